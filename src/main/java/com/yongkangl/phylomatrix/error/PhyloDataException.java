package com.yongkangl.phylomatrix.error;

/**
 * Base class for every failure raised while reading, transforming or writing
 * phylogenetic data. A conversion that throws produces no output.
 */
public class PhyloDataException extends RuntimeException {
    public PhyloDataException(String message) {
        super(message);
    }

    public PhyloDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
