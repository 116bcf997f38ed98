package com.yongkangl.phylomatrix.io;

import com.yongkangl.phylomatrix.error.MalformedInputException;
import com.yongkangl.phylomatrix.model.Character;
import com.yongkangl.phylomatrix.model.PhyloData;
import com.yongkangl.phylomatrix.util.SlugLevel;
import com.yongkangl.phylomatrix.util.Slugs;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.lang3.tuple.Triple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;

/**
 * Reads long-format tables with one (taxon, character, state) observation
 * per row. Column names not given explicitly are inferred from the header.
 */
public final class TabularReader {
    private static final Logger log = LoggerFactory.getLogger(TabularReader.class);

    private static final List<String> TAXA_CANDIDATES =
            Arrays.asList("taxon", "species", "language", "doculect", "manuscript", "witness");
    private static final List<String> CHARACTER_CANDIDATES =
            Arrays.asList("character", "feature", "property", "position");
    private static final List<String> STATE_CANDIDATES =
            Arrays.asList("state", "value", "observation", "cognate", "lesson", "reading");

    private TabularReader() {
    }

    /**
     * Comma unless the header line has more tabs than commas.
     */
    public static char detectDelimiter(String source) {
        String header = "";
        for (String line : source.split("\\R")) {
            if (!line.isBlank()) {
                header = line;
                break;
            }
        }
        long commas = header.chars().filter(c -> c == ',').count();
        long tabs = header.chars().filter(c -> c == '\t').count();
        log.debug("Header has {} commas and {} tabs", commas, tabs);
        return commas >= tabs ? ',' : '\t';
    }

    public static PhyloData read(String source, char delimiter, String taxaColumn, String characterColumn,
                                 String stateColumn) {
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setHeader()
                .setSkipHeaderRecord(true)
                .setIgnoreEmptyLines(true)
                .setTrim(true)
                .build();

        try (CSVParser parser = CSVParser.parse(source, format)) {
            Triple<String, String, String> columns =
                    columnNames(parser.getHeaderNames(), taxaColumn, characterColumn, stateColumn);

            PhyloData phyd = new PhyloData();
            for (CSVRecord record : parser) {
                String taxon = field(record, columns.getLeft());
                String character = field(record, columns.getMiddle());
                String state = field(record, columns.getRight());
                if (taxon.isEmpty() || character.isEmpty()) {
                    throw new MalformedInputException("Row " + record.getRecordNumber()
                            + " has no taxon or character.");
                }
                phyd.extend(taxon, character, state.isEmpty() ? Character.MISSING : state);
            }
            log.debug("Read {} from {} rows", phyd, parser.getRecordNumber());
            return phyd;
        } catch (IOException | UncheckedIOException | IllegalStateException | IllegalArgumentException e) {
            throw new MalformedInputException("Unable to read tabular source: " + e.getMessage(), e);
        }
    }

    /**
     * Resolves the taxa, character and state columns, inferring the ones that
     * are {@code null} from candidate names found in the full slug of each
     * header. The three names must be distinct.
     */
    static Triple<String, String, String> columnNames(List<String> header, String taxaColumn,
                                                      String characterColumn, String stateColumn) {
        String colTaxa = taxaColumn;
        String colChar = characterColumn;
        String colState = stateColumn;
        if (colTaxa == null || colChar == null || colState == null) {
            log.debug("Inferring column names from {}", header);
            List<String> columns = new ArrayList<>(header);
            columns.removeAll(Arrays.asList(colTaxa, colChar, colState));

            if (colTaxa == null) {
                colTaxa = infer(columns, TAXA_CANDIDATES);
            }
            if (colChar == null) {
                colChar = infer(columns, CHARACTER_CANDIDATES);
            }
            if (colState == null) {
                colState = infer(columns, STATE_CANDIDATES);
            }
        }

        List<String> names = Arrays.asList(colTaxa, colChar, colState);
        if (names.contains(null) || new HashSet<>(names).size() < 3) {
            throw new MalformedInputException("Non-unique or missing column names in " + names + ".");
        }
        for (String name : names) {
            if (!header.contains(name)) {
                throw new MalformedInputException("Column `" + name + "` not found in header " + header + ".");
            }
        }
        return Triple.of(colTaxa, colChar, colState);
    }

    private static String infer(List<String> columns, List<String> candidates) {
        for (String candidate : candidates) {
            for (String column : columns) {
                if (Slugs.slug(column, SlugLevel.FULL).contains(candidate)) {
                    return column;
                }
            }
        }
        return null;
    }

    private static String field(CSVRecord record, String column) {
        if (!record.isSet(column)) {
            throw new MalformedInputException("Row " + record.getRecordNumber() + " has no `" + column + "` value.");
        }
        return record.get(column);
    }
}
