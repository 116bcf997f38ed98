package com.yongkangl.phylomatrix.error;

/**
 * The options do not determine what to do, e.g. the output format cannot be
 * inferred from a stream or from an unknown file extension.
 */
public class AmbiguousConfigurationException extends PhyloDataException {
    public AmbiguousConfigurationException(String message) {
        super(message);
    }
}
