package com.yongkangl.phylomatrix.io;

import com.yongkangl.phylomatrix.model.DataProfile;
import com.yongkangl.phylomatrix.model.PhyloData;
import org.apache.commons.lang3.StringUtils;

import java.util.Map;

public final class PhylipWriter {
    private PhylipWriter() {
    }

    public static String build(PhyloData phyd, DataProfile profile) {
        Map<String, String> matrix = phyd.getMatrix(profile.isGenetic() || profile.isBinary());
        int width = 0;
        for (String taxon : matrix.keySet()) {
            width = Math.max(width, taxon.length());
        }

        StringBuilder sb = new StringBuilder();
        sb.append(matrix.size()).append(" ").append(phyd.getCharacters().size()).append("\n");
        for (Map.Entry<String, String> row : matrix.entrySet()) {
            sb.append(StringUtils.rightPad(row.getKey(), width)).append("    ").append(row.getValue()).append("\n");
        }
        return sb.toString();
    }
}
