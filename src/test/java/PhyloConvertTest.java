import com.yongkangl.phylomatrix.convert.ConversionOptions;
import com.yongkangl.phylomatrix.error.UnsupportedFormatException;
import com.yongkangl.phylomatrix.io.DataFormat;
import com.yongkangl.phylomatrix.model.Ascertainment;
import com.yongkangl.phylomatrix.util.SlugLevel;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.ParseException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

final class PhyloConvertTest {
    private static CommandLine parse(String... args) throws ParseException {
        return new DefaultParser().parse(PhyloConvert.buildOptions(), args);
    }

    @Test
    void flagsOverrideDefaults() throws ParseException {
        CommandLine cmd = parse("-f", "nexus", "-t", "TSV", "--slug-taxa", "full", "--slug-chars", "none",
                "--o-state", "Value", "--i-taxa", "Language", "-b", "-a", "true");
        ConversionOptions options = new ConversionOptions();
        PhyloConvert.applyFlags(cmd, options);

        assertEquals(DataFormat.NEXUS, options.getFrom());
        assertEquals(DataFormat.TSV, options.getTo());
        assertEquals(SlugLevel.FULL, options.getSlugTaxa());
        assertEquals(SlugLevel.NONE, options.getSlugChars());
        assertEquals("Value", options.getOutputState());
        assertEquals("Language", options.getInputTaxa());
        assertTrue(options.isBinarize());
        assertEquals(Ascertainment.TRUE, options.getAscertainment());
    }

    @Test
    void absentFlagsKeepConfiguredValues() throws ParseException {
        ConversionOptions options = new ConversionOptions();
        options.setTo(DataFormat.PHYLIP);
        options.setBinarize(true);
        PhyloConvert.applyFlags(parse("-i", "data.csv"), options);

        assertEquals(DataFormat.PHYLIP, options.getTo());
        assertTrue(options.isBinarize());
    }

    @Test
    void badValuesAreRejected() throws ParseException {
        ConversionOptions options = new ConversionOptions();
        assertThrows(UnsupportedFormatException.class,
                () -> PhyloConvert.applyFlags(parse("--to", "xml"), options));
        assertThrows(UnsupportedFormatException.class,
                () -> PhyloConvert.applyFlags(parse("-a", "sometimes"), options));
        assertThrows(UnsupportedFormatException.class, () -> PhyloConvert.charsetFor("no-such-charset"));
    }

    @Test
    void resolvesEncodings() {
        assertEquals(StandardCharsets.ISO_8859_1, PhyloConvert.charsetFor("latin1"));
        assertEquals(StandardCharsets.UTF_8, PhyloConvert.charsetFor("utf-8"));
    }

    @Test
    void unknownFlagIsAUsageError() {
        assertThrows(ParseException.class, () -> parse("--colour", "blue"));
    }
}
