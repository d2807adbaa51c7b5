package io.veraaws.server.spi;

/**
 * Length of the random hex suffix of a resource id.
 */
public enum IdFormat {
    /** Legacy form, e.g. {@code vpc-1a2b3c4d}. */
    SHORT(8),
    /** Current form, e.g. {@code vpc-0123456789abcdef0}. */
    LONG(17);

    private final int suffixLength;

    IdFormat(int suffixLength) {
        this.suffixLength = suffixLength;
    }

    public int suffixLength() {
        return suffixLength;
    }
}
