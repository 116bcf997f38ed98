package com.yongkangl.phylomatrix.io;

import com.yongkangl.phylomatrix.error.MalformedInputException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

final class NexusParserTest {
    private static final String SOURCE = "#NEXUS\n"
            + "BEGIN CHARACTERS;\n"
            + "    DIMENSIONS NTAX=2 NCHAR=3;\n"
            + "    FORMAT DATATYPE=Standard MISSING=? GAP=- SYMBOLS=\"0 1 2\";\n"
            + "    CHARSTATELABELS\n"
            + "        1 colour / red green,\n"
            + "        2 size,\n"
            + "        3 shape / round\n"
            + "    ;\n"
            + "    OPTIONS GAPMODE=MISSING;\n"
            + "    MATRIX\n"
            + "        alpha    01?\n"
            + "        beta     1 0 0\n"
            + "    ;\n"
            + "END;\n"
            + "begin assumptions;\n"
            + "    charset colours = 1-2 3;\n"
            + "endblock;\n";

    @Test
    void collectsBlocksAndDimensions() {
        ParsedBlock nexus = NexusParser.parse(SOURCE);

        assertEquals(Arrays.asList("CHARACTERS", "ASSUMPTIONS"), nexus.getBlocks());
        assertEquals(2, nexus.getNtax());
        assertEquals(3, nexus.getNchar());
        assertEquals("STANDARD", nexus.getDatatype());
        assertEquals("?", nexus.getMissing());
        assertEquals("-", nexus.getGap());
        assertEquals("012", nexus.getSymbols());
    }

    @Test
    void collectsLabelsAndStates() {
        ParsedBlock nexus = NexusParser.parse(SOURCE);

        assertEquals("colour", nexus.getCharstateLabels().get(1));
        assertEquals("size", nexus.getCharstateLabels().get(2));
        assertEquals(Arrays.asList("red", "green"), nexus.getCharstateStates().get("colour"));
        assertEquals(Arrays.asList("round"), nexus.getCharstateStates().get("shape"));
        assertNull(nexus.getCharstateStates().get("size"));
    }

    @Test
    void joinsSpacedVectors() {
        ParsedBlock nexus = NexusParser.parse(SOURCE);

        assertEquals("01?", nexus.getMatrix().get("alpha"));
        assertEquals("100", nexus.getMatrix().get("beta"));
    }

    @Test
    void collectsCharsetRanges() {
        ParsedBlock nexus = NexusParser.parse(SOURCE);

        assertEquals(2, nexus.getCharsets().size());
        ParsedBlock.CharsetRange first = nexus.getCharsets().get(0);
        assertEquals("colours", first.getCharset());
        assertEquals(1, first.getStart());
        assertEquals(2, first.getEnd());
        assertEquals(3, nexus.getCharsets().get(1).getStart());
        assertEquals(3, nexus.getCharsets().get(1).getEnd());
    }

    @Test
    void headerOnlyIsAnEmptyFile() {
        ParsedBlock nexus = NexusParser.parse("#nexus\n");
        assertTrue(nexus.getBlocks().isEmpty());
        assertTrue(nexus.getMatrix().isEmpty());
    }

    @Test
    void rejectsMissingHeader() {
        assertThrows(MalformedInputException.class, () -> NexusParser.parse(""));
        assertThrows(MalformedInputException.class, () -> NexusParser.parse("BEGIN DATA;\nEND;\n"));
    }

    @Test
    void rejectsGarbageOutsideBlocks() {
        assertThrows(MalformedInputException.class, () -> NexusParser.parse("#NEXUS\nSOMETHING ELSE;\n"));
    }

    @Test
    void rejectsUnterminatedInput() {
        assertThrows(MalformedInputException.class,
                () -> NexusParser.parse("#NEXUS\nBEGIN DATA;\n    DIMENSIONS NTAX=1\n"));
        assertThrows(MalformedInputException.class,
                () -> NexusParser.parse("#NEXUS\nBEGIN DATA;\n    DIMENSIONS NTAX=1;\n"));
    }

    @Test
    void rejectsDuplicateTaxa() {
        String source = "#NEXUS\nBEGIN DATA;\nMATRIX\na 01\na 10\n;\nEND;\n";
        assertThrows(MalformedInputException.class, () -> NexusParser.parse(source));
    }

    @Test
    void readsQuotedStateLabels() {
        String source = "#NEXUS\nBEGIN DATA;\n"
                + "CHARSTATELABELS 1 colour / 'dark blue' 'it''s; odd' red, 2 'body part'/ 'a, b';\n"
                + "END;\n";
        ParsedBlock nexus = NexusParser.parse(source);

        assertEquals(Arrays.asList("dark blue", "it's; odd", "red"), nexus.getCharstateStates().get("colour"));
        assertEquals("body part", nexus.getCharstateLabels().get(2));
        assertEquals(Arrays.asList("a, b"), nexus.getCharstateStates().get("body part"));
    }

    @Test
    void splitsWordsAroundSlashesAndQuotes() {
        assertEquals(Arrays.asList("1", "c", "/", "x", "it's"), NexusParser.words(" 1 c/x 'it''s' "));
        assertEquals(Arrays.asList("a", "'b,c'", " d"), NexusParser.splitUnquoted("a,'b,c', d", ','));
        assertThrows(MalformedInputException.class, () -> NexusParser.words("1 'open"));
    }

    @Test
    void rejectsUnterminatedQuotes() {
        String source = "#NEXUS\nBEGIN DATA;\nCHARSTATELABELS 1 c / 'open;\nEND;\n";
        assertThrows(MalformedInputException.class, () -> NexusParser.parse(source));
    }

    @Test
    void rejectsNumbersOutOfRange() {
        assertThrows(MalformedInputException.class,
                () -> NexusParser.parse("#NEXUS\nBEGIN DATA;\nDIMENSIONS NTAX=99999999999;\nEND;\n"));
        assertThrows(MalformedInputException.class,
                () -> NexusParser.parse("#NEXUS\nBEGIN SETS;\nCHARSET c = 1-99999999999;\nEND;\n"));
    }

    @Test
    void rejectsMalformedCharstateLabels() {
        String source = "#NEXUS\nBEGIN DATA;\nCHARSTATELABELS 1 two words here;\nEND;\n";
        assertThrows(MalformedInputException.class, () -> NexusParser.parse(source));
    }
}
