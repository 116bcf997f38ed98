package com.yongkangl.phylomatrix.io;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Structured content of a NEXUS source, as collected by {@link NexusParser}.
 * Scalar fields are {@code null} when the source does not declare them.
 */
public final class ParsedBlock {
    private final List<String> blocks;
    private final Integer ntax;
    private final Integer nchar;
    private final String datatype;
    private final String missing;
    private final String gap;
    private final String symbols;
    private final Map<Integer, String> charstateLabels;
    private final Map<String, List<String>> charstateStates;
    private final Map<String, String> matrix;
    private final List<CharsetRange> charsets;

    public ParsedBlock(List<String> blocks, Integer ntax, Integer nchar, String datatype, String missing, String gap,
                       String symbols, Map<Integer, String> charstateLabels, Map<String, List<String>> charstateStates,
                       Map<String, String> matrix, List<CharsetRange> charsets) {
        this.blocks = Collections.unmodifiableList(new ArrayList<>(blocks));
        this.ntax = ntax;
        this.nchar = nchar;
        this.datatype = datatype;
        this.missing = missing;
        this.gap = gap;
        this.symbols = symbols;
        this.charstateLabels = Collections.unmodifiableMap(new TreeMap<>(charstateLabels));
        this.charstateStates = Collections.unmodifiableMap(new LinkedHashMap<>(charstateStates));
        this.matrix = Collections.unmodifiableMap(new LinkedHashMap<>(matrix));
        this.charsets = Collections.unmodifiableList(new ArrayList<>(charsets));
    }

    public List<String> getBlocks() {
        return blocks;
    }

    public Integer getNtax() {
        return ntax;
    }

    public Integer getNchar() {
        return nchar;
    }

    public String getDatatype() {
        return datatype;
    }

    public String getMissing() {
        return missing;
    }

    public String getGap() {
        return gap;
    }

    public String getSymbols() {
        return symbols;
    }

    /** 1-based column index to character label. */
    public Map<Integer, String> getCharstateLabels() {
        return charstateLabels;
    }

    /** Character label to the state names declared after its slash. */
    public Map<String, List<String>> getCharstateStates() {
        return charstateStates;
    }

    /** Taxon to raw vector, in source order. */
    public Map<String, String> getMatrix() {
        return matrix;
    }

    public List<CharsetRange> getCharsets() {
        return charsets;
    }

    /**
     * One inclusive, 1-based column range of a named charset. A charset
     * declared with several ranges yields several instances.
     */
    public static final class CharsetRange {
        private final String charset;
        private final int start;
        private final int end;

        public CharsetRange(String charset, int start, int end) {
            this.charset = charset;
            this.start = start;
            this.end = end;
        }

        public String getCharset() {
            return charset;
        }

        public int getStart() {
            return start;
        }

        public int getEnd() {
            return end;
        }

        @Override
        public String toString() {
            return charset + "=" + start + "-" + end;
        }
    }
}
