package com.yongkangl.phylomatrix.io;

import com.yongkangl.phylomatrix.error.AmbiguousConfigurationException;
import com.yongkangl.phylomatrix.error.UnsupportedFormatException;

import java.util.Locale;
import java.util.regex.Pattern;

public enum DataFormat {
    AUTO,
    TABULAR,
    CSV,
    TSV,
    NEXUS,
    PHYLIP;

    private static final Pattern PHYLIP_HEADER = Pattern.compile("\\s*\\d+\\s+\\d+\\s*");

    public static DataFormat fromName(String name) {
        if (name != null) {
            for (DataFormat format : values()) {
                if (format.name().equalsIgnoreCase(name.trim())) {
                    return format;
                }
            }
        }
        throw new UnsupportedFormatException("Unknown format `" + name + "`.");
    }

    /**
     * Output format implied by a file name. Streams ({@code -}) and unknown
     * extensions cannot be resolved.
     */
    public static DataFormat fromExtension(String path) {
        if (path == null || path.equals("-") || !path.contains(".")) {
            throw new AmbiguousConfigurationException("Unable to detect output format; please specify it with `--to`.");
        }
        String extension = path.substring(path.lastIndexOf('.') + 1).toLowerCase(Locale.ROOT);
        switch (extension) {
            case "csv":
                return CSV;
            case "tsv":
            case "tab":
                return TSV;
            case "nex":
            case "nexus":
            case "nxs":
                return NEXUS;
            case "phy":
            case "phylip":
                return PHYLIP;
            default:
                throw new AmbiguousConfigurationException("Unable to detect output format from extension `"
                        + extension + "`; please specify it with `--to`.");
        }
    }

    /**
     * Guesses the format of a source: a #NEXUS header, a PHYLIP
     * {@code <ntax> <nchar>} first line, or otherwise a table.
     */
    public static DataFormat sniff(String source) {
        String stripped = source.strip();
        if (stripped.regionMatches(true, 0, "#NEXUS", 0, "#NEXUS".length())) {
            return NEXUS;
        }
        String firstLine = stripped.split("\\R", 2)[0];
        if (PHYLIP_HEADER.matcher(firstLine).matches()) {
            return PHYLIP;
        }
        return TABULAR;
    }

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
