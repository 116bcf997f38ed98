package com.yongkangl.phylomatrix.io;

import com.yongkangl.phylomatrix.error.MalformedInputException;
import com.yongkangl.phylomatrix.model.Character;
import com.yongkangl.phylomatrix.model.PhyloData;
import com.yongkangl.phylomatrix.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link PhyloData} from NEXUS text. Columns covered by a charset are
 * folded back into one multistate character named after the charset.
 */
public final class NexusReader {
    private static final Logger log = LoggerFactory.getLogger(NexusReader.class);

    private NexusReader() {
    }

    public static PhyloData read(String source) {
        ParsedBlock nexus = NexusParser.parse(source);

        String missing = nexus.getMissing() != null ? nexus.getMissing() : Character.MISSING;
        String gap = nexus.getGap() != null ? nexus.getGap() : Character.GAP;
        String alphabet = nexus.getSymbols() != null ? nexus.getSymbols() : PhyloData.ALPHABET;

        Map<String, List<List<String>>> rows = new LinkedHashMap<>();
        int columns = 0;
        for (Map.Entry<String, String> row : nexus.getMatrix().entrySet()) {
            List<List<String>> cells = tokenize(row.getKey(), row.getValue());
            if (nexus.getNchar() != null && cells.size() != nexus.getNchar()) {
                throw new MalformedInputException("Taxon `" + row.getKey() + "` has " + cells.size()
                        + " characters, but NCHAR is " + nexus.getNchar() + ".");
            }
            columns = Math.max(columns, cells.size());
            rows.put(row.getKey(), cells);
        }
        if (nexus.getNtax() != null && rows.size() != nexus.getNtax()) {
            throw new MalformedInputException("Matrix has " + rows.size() + " taxa, but NTAX is "
                    + nexus.getNtax() + ".");
        }

        // inverse map from 1-based column to charset
        Map<Integer, String> columnCharset = new HashMap<>();
        for (ParsedBlock.CharsetRange range : nexus.getCharsets()) {
            for (int idx = range.getStart(); idx <= range.getEnd(); idx++) {
                columnCharset.put(idx, range.getCharset());
            }
        }

        PhyloData phyd = new PhyloData();
        for (Map.Entry<String, List<List<String>>> row : rows.entrySet()) {
            String taxon = row.getKey();
            List<List<String>> cells = row.getValue();
            for (int idx = 0; idx < cells.size(); idx++) {
                String label = nexus.getCharstateLabels().getOrDefault(idx + 1, Utils.positionalName(idx, columns));
                String charset = columnCharset.get(idx + 1);
                if (label.equals(charset)) {
                    charset = null;
                }
                for (String symbol : cells.get(idx)) {
                    if (charset != null) {
                        readGrouped(phyd, taxon, charset, label, symbol, missing, gap);
                    } else if (symbol.equals(missing)) {
                        phyd.extend(taxon, label, Character.MISSING);
                    } else if (!symbol.equals(gap)) {
                        List<String> states = nexus.getCharstateStates().get(label);
                        phyd.extend(taxon, label, resolve(label, symbol, states, alphabet));
                    }
                }
            }
        }

        log.debug("Read {} from NEXUS ({} charset ranges)", phyd, nexus.getCharsets().size());
        return phyd;
    }

    private static void readGrouped(PhyloData phyd, String taxon, String charset, String label, String symbol,
                                    String missing, String gap) {
        if (label.endsWith(PhyloData.ASCERTAINMENT_SUFFIX) || symbol.equals(gap) || symbol.equals("0")) {
            return;
        }
        if (symbol.equals(missing)) {
            phyd.extend(taxon, charset, Character.MISSING);
        } else {
            String prefix = charset + "_";
            String state = label.startsWith(prefix) && label.length() > prefix.length()
                    ? label.substring(prefix.length())
                    : label;
            phyd.extend(taxon, charset, state);
        }
    }

    private static String resolve(String label, String symbol, List<String> states, String alphabet) {
        if (states == null || states.isEmpty()) {
            return symbol;
        }
        int idx = alphabet.indexOf(symbol);
        if (idx < 0 || idx >= states.size()) {
            throw new MalformedInputException("Symbol `" + symbol + "` has no declared state for character `"
                    + label + "`.");
        }
        return states.get(idx);
    }

    /**
     * Splits a vector into cells; a cell is one symbol or a polymorphic group
     * written as {@code (a,b)}, {@code (ab)} or <code>{ab}</code>.
     */
    static List<List<String>> tokenize(String taxon, String vector) {
        List<List<String>> cells = new ArrayList<>();
        int i = 0;
        while (i < vector.length()) {
            char current = vector.charAt(i);
            if (current == '(' || current == '{') {
                char close = current == '(' ? ')' : '}';
                int end = vector.indexOf(close, i);
                if (end < 0) {
                    throw new MalformedInputException("Unterminated polymorphic cell in the row of taxon `"
                            + taxon + "`.");
                }
                List<String> group = new ArrayList<>();
                for (char member : vector.substring(i + 1, end).toCharArray()) {
                    if (member != ',' && !java.lang.Character.isWhitespace(member)) {
                        group.add(String.valueOf(member));
                    }
                }
                cells.add(group);
                i = end + 1;
            } else {
                List<String> single = new ArrayList<>();
                single.add(String.valueOf(current));
                cells.add(single);
                i++;
            }
        }
        return cells;
    }
}
