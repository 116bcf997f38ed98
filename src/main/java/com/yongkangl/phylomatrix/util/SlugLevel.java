package com.yongkangl.phylomatrix.util;

import com.yongkangl.phylomatrix.error.UnsupportedFormatException;

import java.util.Locale;

public enum SlugLevel {
    NONE,
    SIMPLE,
    FULL;

    public static SlugLevel fromName(String name) {
        if (name != null) {
            for (SlugLevel level : values()) {
                if (level.name().equalsIgnoreCase(name.trim())) {
                    return level;
                }
            }
        }
        throw new UnsupportedFormatException("Unknown level of slugging `" + name + "`.");
    }

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
