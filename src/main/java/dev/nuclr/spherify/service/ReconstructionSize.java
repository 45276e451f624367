package dev.nuclr.spherify.service;

import dev.nuclr.spherify.engine.EngineInvocation;

/**
 * Dimensions used to rebuild the output image from the engine's stdout.
 */
public enum ReconstructionSize {

    /** The requested snapshot size, which the engine is told to render. */
    SNAPSHOT,

    /** The source image size. Matches older runs of the tool that ignored the snapshot size here. */
    SOURCE;

    public int width(EngineInvocation inv) {
        return this == SNAPSHOT ? inv.snapshotWidth() : inv.width();
    }

    public int height(EngineInvocation inv) {
        return this == SNAPSHOT ? inv.snapshotHeight() : inv.height();
    }
}
