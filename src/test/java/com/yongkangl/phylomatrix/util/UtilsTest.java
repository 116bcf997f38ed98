package com.yongkangl.phylomatrix.util;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

final class UtilsTest {
    @Test
    void collapsesConsecutiveIndexes() {
        assertEquals("1-3, 5, 8-9", Utils.indexesToRanges(Arrays.asList(1, 2, 3, 5, 8, 9)));
    }

    @Test
    void sortsAndDeduplicatesBeforeCollapsing() {
        assertEquals("1-3, 7", Utils.indexesToRanges(Arrays.asList(7, 3, 1, 2, 2)));
    }

    @Test
    void emptyIndexesGiveEmptyString() {
        assertEquals("", Utils.indexesToRanges(Collections.emptyList()));
    }

    @Test
    void positionalNamesArePaddedToColumnCount() {
        assertEquals("CHAR_3", Utils.positionalName(3, 4));
        assertEquals("CHAR_3", Utils.positionalName(3, 10));
        assertEquals("CHAR_03", Utils.positionalName(3, 11));
        assertEquals("CHAR_0", Utils.positionalName(0, 0));
    }
}
