package dev.nuclr.spherify.service;

import dev.nuclr.spherify.engine.AsyncEngineRunner;
import dev.nuclr.spherify.engine.BlockingEngineRunner;
import dev.nuclr.spherify.engine.EngineRunner;

/**
 * Dispatch strategy for a whole batch, chosen once before processing starts.
 */
public enum ExecutionMode {

    /**
     * All tasks are launched before any is awaited. Every input and output
     * raster is held in memory at the same time.
     */
    CONCURRENT {
        @Override
        public EngineRunner newRunner() {
            return new AsyncEngineRunner();
        }
    },

    /** One task at a time in input order; bounds peak memory to one image pair. */
    SEQUENTIAL {
        @Override
        public EngineRunner newRunner() {
            return new BlockingEngineRunner();
        }
    };

    /** The engine runner suited to this strategy. */
    public abstract EngineRunner newRunner();
}
