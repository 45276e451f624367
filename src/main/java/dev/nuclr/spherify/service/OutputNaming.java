package dev.nuclr.spherify.service;

import java.nio.file.Path;

/**
 * File name of the saved result for an input file.
 */
@FunctionalInterface
public interface OutputNaming {

    /** {@code <prefix><original file name>}; collisions are not deduplicated. */
    OutputNaming PREFIXED = (prefix, source) -> prefix + source.getFileName();

    String fileName(String prefix, Path source);
}
