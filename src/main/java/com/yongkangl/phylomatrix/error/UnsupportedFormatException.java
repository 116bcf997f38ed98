package com.yongkangl.phylomatrix.error;

/**
 * An unknown format name, slug level or ascertainment mode was requested.
 */
public class UnsupportedFormatException extends PhyloDataException {
    public UnsupportedFormatException(String message) {
        super(message);
    }
}
