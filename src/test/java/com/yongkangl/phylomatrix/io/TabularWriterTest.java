package com.yongkangl.phylomatrix.io;

import com.yongkangl.phylomatrix.model.PhyloData;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class TabularWriterTest {
    private static PhyloData colours() {
        PhyloData phyd = new PhyloData();
        phyd.extend("t1", "c1", "red");
        phyd.extend("t2", "c1", "blue");
        phyd.extend("t3", "c1", "green");
        phyd.extend("t1", "c2", "yes");
        phyd.extend("t2", "c2", "?");
        return phyd;
    }

    @Test
    void writesOneRowPerObservation() {
        String expected = "Taxon,Character,State\n"
                + "t1,c1,red\n"
                + "t2,c1,blue\n"
                + "t3,c1,green\n"
                + "t1,c2,yes\n"
                + "t2,c2,?\n";
        assertEquals(expected, TabularWriter.build(colours(), ',', "Taxon", "Character", "State"));
    }

    @Test
    void polymorphicObservationsGiveSortedRows() {
        PhyloData phyd = colours();
        phyd.extend("t1", "c2", "maybe");

        String tsv = TabularWriter.build(phyd, '\t', "Language", "Feature", "Value");
        assertTrue(tsv.startsWith("Language\tFeature\tValue\n"));
        assertTrue(tsv.contains("t1\tc2\tmaybe\nt1\tc2\tyes\n"));
    }

    @Test
    void quotesDelimitersInValues() {
        PhyloData phyd = new PhyloData();
        phyd.extend("Smith, J.", "x", "1");

        assertEquals("Taxon,Character,State\n\"Smith, J.\",x,1\n",
                TabularWriter.build(phyd, ',', "Taxon", "Character", "State"));
    }
}
