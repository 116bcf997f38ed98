package com.yongkangl.phylomatrix.model;

import com.yongkangl.phylomatrix.error.UnsupportedFormatException;

import java.util.Locale;

public enum Ascertainment {
    DEFAULT,
    TRUE,
    FALSE;

    public static Ascertainment fromName(String name) {
        if (name != null) {
            for (Ascertainment mode : values()) {
                if (mode.name().equalsIgnoreCase(name.trim())) {
                    return mode;
                }
            }
        }
        throw new UnsupportedFormatException("Unknown ascertainment mode `" + name + "`.");
    }

    /**
     * Whether ascertainment columns should be added to {@code phyd}. The
     * default is to correct unless every character is genetic.
     */
    public boolean isActive(PhyloData phyd) {
        switch (this) {
            case TRUE:
                return true;
            case FALSE:
                return false;
            default:
                return !DataProfile.of(phyd).isGenetic();
        }
    }

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
