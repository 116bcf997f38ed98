package com.yongkangl.phylomatrix.convert;

import com.yongkangl.phylomatrix.error.AmbiguousConfigurationException;
import com.yongkangl.phylomatrix.error.MalformedInputException;
import com.yongkangl.phylomatrix.io.DataFormat;
import com.yongkangl.phylomatrix.util.SlugLevel;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

final class ConverterTest {
    private static String resource(String name) throws IOException {
        try (InputStream in = ConverterTest.class.getResourceAsStream(name)) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static ConversionOptions options(DataFormat from, DataFormat to) {
        ConversionOptions options = new ConversionOptions();
        options.setFrom(from);
        options.setTo(to);
        return options;
    }

    @Test
    void phylipToCsvListsEveryNonGapCell() throws IOException {
        String expected = "Taxon,Character,State\n"
                + "alpha,CHAR_0,A\n"
                + "beta,CHAR_0,A\n"
                + "gamma,CHAR_0,A\n"
                + "alpha,CHAR_1,C\n"
                + "beta,CHAR_1,C\n"
                + "gamma,CHAR_1,C\n"
                + "alpha,CHAR_2,G\n"
                + "gamma,CHAR_2,G\n"
                + "alpha,CHAR_3,T\n"
                + "beta,CHAR_3,T\n"
                + "gamma,CHAR_3,A\n";

        String csv = Converter.convert(resource("/example.phy"), options(DataFormat.AUTO, DataFormat.CSV));
        assertEquals(expected, csv);
    }

    @Test
    void repeatedConversionsAreIdentical() throws IOException {
        String source = resource("/cognates.csv");
        ConversionOptions options = options(DataFormat.AUTO, DataFormat.NEXUS);
        options.setBinarize(true);

        String first = Converter.convert(source, options);
        assertEquals(first, Converter.convert(source, options));
        assertEquals(first, Converter.convert(source, options));
    }

    @Test
    void tabularSurvivesNexusRoundTrip() throws IOException {
        String source = resource("/cognates.csv");
        String direct = Converter.convert(source, options(DataFormat.CSV, DataFormat.CSV));

        String nexus = Converter.convert(source, options(DataFormat.CSV, DataFormat.NEXUS));
        assertTrue(nexus.contains("1 foot / B C,"));
        assertEquals(direct, Converter.convert(nexus, options(DataFormat.AUTO, DataFormat.CSV)));
    }

    @Test
    void binarizedNexusRestoresMultistateObservations() throws IOException {
        String source = resource("/cognates.csv");
        String direct = Converter.convert(source, options(DataFormat.CSV, DataFormat.CSV));

        ConversionOptions binarize = options(DataFormat.CSV, DataFormat.NEXUS);
        binarize.setBinarize(true);
        String nexus = Converter.convert(source, binarize);

        assertTrue(nexus.contains("BEGIN ASSUMPTIONS;"));
        assertTrue(nexus.contains("foot_ASCERTAINMENT"));
        assertEquals(direct, Converter.convert(nexus, options(DataFormat.NEXUS, DataFormat.CSV)));
    }

    @Test
    void multiWordStatesSurviveNexusRoundTrip() {
        String source = "Taxon,Character,State\n"
                + "t1,c1,dark blue\n"
                + "t2,c1,red\n"
                + "t3,c1,\"a, b\"\n"
                + "t3,c2,it's; odd/ok\n"
                + "t1,c2,plain\n";
        String direct = Converter.convert(source, options(DataFormat.CSV, DataFormat.CSV));
        assertTrue(direct.contains("t1,c1,dark blue\n"));

        String nexus = Converter.convert(source, options(DataFormat.CSV, DataFormat.NEXUS));
        assertEquals(direct, Converter.convert(nexus, options(DataFormat.NEXUS, DataFormat.CSV)));

        ConversionOptions binarize = options(DataFormat.CSV, DataFormat.NEXUS);
        binarize.setBinarize(true);
        String binary = Converter.convert(source, binarize);
        assertEquals(direct, Converter.convert(binary, options(DataFormat.NEXUS, DataFormat.CSV)));
    }

    @Test
    void collidingTaxaKeepTheirObservations() {
        String source = "Taxon,Character,State\na,c1,x\ná,c1,y\na-a,c1,z\n";

        String expected = "Taxon,Character,State\n"
                + "a-a,c1,z\n"
                + "a-b,c1,x\n"
                + "a-c,c1,y\n";
        assertEquals(expected, Converter.convert(source, options(DataFormat.AUTO, DataFormat.CSV)));
    }

    @Test
    void directCsvKeepsMissingStates() throws IOException {
        String direct = Converter.convert(resource("/cognates.csv"), options(DataFormat.CSV, DataFormat.CSV));

        String expected = "Taxon,Character,State\n"
                + "Dutch,foot,C\n"
                + "Frisian,foot,?\n"
                + "German,foot,B\n"
                + "Dutch,hand,B\n"
                + "English,hand,A\n"
                + "German,hand,A\n";
        assertEquals(expected, direct);
    }

    @Test
    void tsvOutputUsesCustomColumns() throws IOException {
        ConversionOptions options = options(DataFormat.PHYLIP, DataFormat.TSV);
        options.setOutputTaxa("Species");
        options.setOutputCharacter("Site");
        options.setOutputState("Base");
        options.setSlugTaxa(SlugLevel.FULL);

        String tsv = Converter.convert(resource("/example.phy"), options);
        assertTrue(tsv.startsWith("Species\tSite\tBase\nalpha\tCHAR_0\tA\n"));
    }

    @Test
    void slugsLabelsBeforeWriting() {
        String source = "Taxon,Character,State\nÅland Swedish,Body part (hand),x\n";
        String csv = Converter.convert(source, options(DataFormat.AUTO, DataFormat.CSV));

        assertEquals("Taxon,Character,State\nAland_Swedish,Body_part_hand,x\n", csv);
    }

    @Test
    void unresolvedOutputFormatFails() {
        assertThrows(AmbiguousConfigurationException.class,
                () -> Converter.convert("3 1\na A\nb C\nc G\n", options(DataFormat.AUTO, DataFormat.AUTO)));
    }

    @Test
    void malformedInputProducesNoOutput() {
        assertThrows(MalformedInputException.class,
                () -> Converter.convert("3 2\na AC\n", options(DataFormat.PHYLIP, DataFormat.CSV)));
    }
}
