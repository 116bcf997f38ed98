package com.yongkangl.phylomatrix.io;

import com.yongkangl.phylomatrix.model.PhyloData;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Long-format output: one row per observed state, characters in canonical
 * order (ascertainment columns first within their group), then taxa, then
 * states, all sorted.
 */
public final class TabularWriter {
    private TabularWriter() {
    }

    public static String build(PhyloData phyd, char delimiter, String taxaColumn, String characterColumn,
                               String stateColumn) {
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setRecordSeparator("\n")
                .setHeader(taxaColumn, characterColumn, stateColumn)
                .build();

        StringBuilder sb = new StringBuilder();
        try (CSVPrinter printer = new CSVPrinter(sb, format)) {
            for (String character : phyd.getCharacters()) {
                for (String taxon : phyd.getTaxa()) {
                    List<String> states = new ArrayList<>(phyd.getObservation(taxon, character));
                    Collections.sort(states);
                    for (String state : states) {
                        printer.printRecord(taxon, character, state);
                    }
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return sb.toString();
    }
}
