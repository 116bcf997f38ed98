package com.yongkangl.phylomatrix.io;

import com.yongkangl.phylomatrix.model.DataProfile;
import com.yongkangl.phylomatrix.model.PhyloData;
import com.yongkangl.phylomatrix.util.Utils;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Renders a {@link PhyloData} as NEXUS: a TAXA block, a CHARACTERS block and,
 * for all-binary data with grouped characters, an ASSUMPTIONS block.
 */
public final class NexusWriter {
    private static final String INDENT = "    ";
    private static final Pattern PLAIN_WORD = Pattern.compile("[^\\s,;/'\"()\\[\\]{}=:]+");

    private NexusWriter() {
    }

    public static String build(PhyloData phyd, DataProfile profile) {
        List<String> components = new ArrayList<>();
        components.add("#NEXUS");
        components.add(buildTaxaBlock(phyd));
        components.add(buildCharactersBlock(phyd, profile));
        if (profile.isBinary() && !groupedCharsets(phyd).isEmpty()) {
            components.add(buildAssumptionsBlock(phyd));
        }
        return String.join("\n\n", components) + "\n";
    }

    static String buildTaxaBlock(PhyloData phyd) {
        StringBuilder sb = new StringBuilder();
        sb.append("BEGIN TAXA;\n");
        sb.append(INDENT).append("DIMENSIONS NTAX=").append(phyd.getTaxa().size()).append(";\n");
        sb.append(INDENT).append("TAXLABELS\n");
        for (String taxon : phyd.getTaxa()) {
            sb.append(INDENT).append(INDENT).append(taxon).append("\n");
        }
        sb.append(INDENT).append(";\n");
        sb.append("END;");
        return sb.toString();
    }

    static String buildCharactersBlock(PhyloData phyd, DataProfile profile) {
        List<String> characters = phyd.getCharacters();

        StringBuilder sb = new StringBuilder();
        sb.append("BEGIN CHARACTERS;\n");
        sb.append(INDENT).append("DIMENSIONS NCHAR=").append(characters.size()).append(";\n");
        if (profile.isGenetic()) {
            sb.append(INDENT).append("FORMAT DATATYPE=DNA MISSING=? GAP=-;\n");
        } else {
            // binary states are written as themselves
            String symbols = profile.isBinary() ? "01" : phyd.getSymbols();
            sb.append(INDENT).append("FORMAT DATATYPE=STANDARD MISSING=? GAP=- SYMBOLS=\"")
                    .append(symbols).append("\";\n");
        }

        sb.append(INDENT).append("CHARSTATELABELS\n");
        List<String> labels = new ArrayList<>();
        for (int i = 0; i < characters.size(); i++) {
            String character = characters.get(i);
            List<String> states = phyd.getCharacter(character).getStates();
            StringBuilder label = new StringBuilder();
            label.append(INDENT).append(INDENT).append(i + 1).append(" ").append(word(character));
            if (!profile.isGenetic() && !profile.isBinary() && !states.isEmpty()) {
                label.append(" /");
                for (String state : states) {
                    label.append(" ").append(word(state));
                }
            }
            labels.add(label.toString());
        }
        if (!labels.isEmpty()) {
            sb.append(String.join(",\n", labels)).append("\n");
        }
        sb.append(INDENT).append(";\n");

        sb.append(buildMatrixCommand(phyd, profile)).append("\n");
        sb.append("END;");
        return sb.toString();
    }

    static String buildMatrixCommand(PhyloData phyd, DataProfile profile) {
        Map<String, String> matrix = phyd.getMatrix(profile.isGenetic() || profile.isBinary());
        int width = 0;
        for (String taxon : matrix.keySet()) {
            width = Math.max(width, taxon.length());
        }

        StringBuilder sb = new StringBuilder();
        sb.append(INDENT).append("MATRIX\n");
        for (Map.Entry<String, String> row : matrix.entrySet()) {
            sb.append(INDENT).append(INDENT)
                    .append(StringUtils.rightPad(row.getKey(), width))
                    .append(INDENT)
                    .append(row.getValue())
                    .append("\n");
        }
        sb.append(INDENT).append(";");
        return sb.toString();
    }

    static String buildAssumptionsBlock(PhyloData phyd) {
        List<String> characters = phyd.getCharacters();

        StringBuilder sb = new StringBuilder();
        sb.append("BEGIN ASSUMPTIONS;\n");
        for (Map.Entry<String, List<String>> charset : groupedCharsets(phyd).entrySet()) {
            List<Integer> indexes = new ArrayList<>();
            for (String character : charset.getValue()) {
                indexes.add(characters.indexOf(character) + 1);
            }
            sb.append(INDENT).append("CHARSET ").append(charset.getKey()).append(" = ")
                    .append(Utils.indexesToRanges(indexes)).append(";\n");
        }
        sb.append("END;");
        return sb.toString();
    }

    /**
     * A label as one NEXUS word, single quoted when it holds whitespace or
     * punctuation.
     */
    static String word(String label) {
        if (PLAIN_WORD.matcher(label).matches()) {
            return label;
        }
        return "'" + label.replace("'", "''") + "'";
    }

    // charsets made of anything but the single character they are named after
    private static Map<String, List<String>> groupedCharsets(PhyloData phyd) {
        Map<String, List<String>> grouped = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> charset : phyd.getCharsets().entrySet()) {
            List<String> members = charset.getValue();
            if (members.size() != 1 || !members.get(0).equals(charset.getKey())) {
                grouped.put(charset.getKey(), members);
            }
        }
        return grouped;
    }
}
