package com.yongkangl.phylomatrix.io;

import com.yongkangl.phylomatrix.error.MalformedInputException;
import com.yongkangl.phylomatrix.model.Character;
import com.yongkangl.phylomatrix.model.PhyloData;
import com.yongkangl.phylomatrix.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Sequential (non-interleaved) PHYLIP: a {@code <ntax> <nchar>} header
 * followed by one {@code <taxon> <vector>} row per taxon.
 */
public class PhylipParser {
    private static final Logger log = LoggerFactory.getLogger(PhylipParser.class);

    private static final Pattern HEADER = Pattern.compile("(\\d+)\\s+(\\d+)");
    private static final Pattern ROW = Pattern.compile("(\\S+)\\s+(.+)");

    private final Map<String, String> rows;
    private final int ntax;
    private final int nchar;

    public PhylipParser(String source) {
        rows = new LinkedHashMap<>();
        String[] lines = source.strip().split("\\R");

        Matcher header = HEADER.matcher(lines[0]);
        if (!header.find()) {
            throw new MalformedInputException("Missing `<ntax> <nchar>` header in PHYLIP source.");
        }
        ntax = Integer.parseInt(header.group(1));
        nchar = Integer.parseInt(header.group(2));

        for (int i = 1; i < lines.length; i++) {
            String line = lines[i].strip();
            if (line.isEmpty()) {
                continue;
            }
            Matcher row = ROW.matcher(line);
            if (!row.matches()) {
                throw new MalformedInputException("PHYLIP row " + i + " has no sequence.");
            }
            String vector = row.group(2).replaceAll("\\s", "").toUpperCase(Locale.ROOT);
            if (rows.put(row.group(1), vector) != null) {
                throw new MalformedInputException("Taxon `" + row.group(1) + "` appears twice.");
            }
        }

        if (rows.size() != ntax) {
            throw new MalformedInputException("Mismatch in number of taxa: header declares " + ntax
                    + ", found " + rows.size() + ".");
        }
        for (Map.Entry<String, String> row : rows.entrySet()) {
            if (row.getValue().length() != nchar) {
                throw new MalformedInputException("Alignment length of `" + row.getKey() + "` ("
                        + row.getValue().length() + ") differs from the one in the header (" + nchar + ").");
            }
        }
    }

    public static PhyloData read(String source) {
        return new PhylipParser(source).toPhyloData();
    }

    public PhyloData toPhyloData() {
        PhyloData phyd = new PhyloData();
        for (Map.Entry<String, String> row : rows.entrySet()) {
            String vector = row.getValue();
            for (int idx = 0; idx < vector.length(); idx++) {
                String state = String.valueOf(vector.charAt(idx));
                if (!state.equals(Character.GAP)) {
                    phyd.extend(row.getKey(), Utils.positionalName(idx, nchar), state);
                }
            }
        }
        log.debug("Read {} from PHYLIP", phyd);
        return phyd;
    }

    public int getTaxaCount() {
        return ntax;
    }

    public int getAlignmentLength() {
        return nchar;
    }
}
