package com.yongkangl.phylomatrix.error;

/**
 * The source text does not have the shape its format requires, e.g. a
 * missing NEXUS header or a PHYLIP row count that disagrees with the header.
 */
public class MalformedInputException extends PhyloDataException {
    public MalformedInputException(String message) {
        super(message);
    }

    public MalformedInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
