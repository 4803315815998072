package io.surfworks.vectorforge.render;

/**
 * Bit order used when re-partitioning a blasted bit string.
 */
public enum Endianness {
    /** Most significant bit of the first value comes first. */
    BIG_ENDIAN,
    /** The whole bit string of a side is reversed before splitting. */
    LITTLE_ENDIAN
}
