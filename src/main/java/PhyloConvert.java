import java.io.File;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;

import com.yongkangl.phylomatrix.convert.ConversionOptions;
import com.yongkangl.phylomatrix.convert.Converter;
import com.yongkangl.phylomatrix.convert.OptionsLoader;
import com.yongkangl.phylomatrix.error.PhyloDataException;
import com.yongkangl.phylomatrix.error.UnsupportedFormatException;
import com.yongkangl.phylomatrix.io.DataFormat;
import com.yongkangl.phylomatrix.io.StreamUtils;
import com.yongkangl.phylomatrix.model.Ascertainment;
import com.yongkangl.phylomatrix.util.SlugLevel;
import org.apache.commons.cli.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class PhyloConvert {
    static final int EXIT_ERROR = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        Options options = buildOptions();

        CommandLineParser parser = new DefaultParser();
        CommandLine cmd = null;

        try {
            cmd = parser.parse(options, args);
        } catch (ParseException e) {
            System.err.println("Error parsing command line: " + e.getMessage());
            printHelp(options);
            System.exit(EXIT_USAGE);
        }

        if (cmd.hasOption("help")) {
            printHelp(options);
            return;
        }

        // must run before the first logger is created
        String verbosity = cmd.getOptionValue("verbosity", "info");
        if (!verbosity.matches("(?i)debug|info|warn|error")) {
            System.err.println("Invalid verbosity `" + verbosity + "`");
            System.exit(EXIT_USAGE);
        }
        System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", verbosity.toLowerCase());
        Logger log = LoggerFactory.getLogger(PhyloConvert.class);

        String input = cmd.getOptionValue("input", StreamUtils.STREAM);
        String output = cmd.getOptionValue("output", StreamUtils.STREAM);

        try {
            ConversionOptions conversion = cmd.hasOption("config")
                    ? OptionsLoader.load(new File(cmd.getOptionValue("config")))
                    : new ConversionOptions();
            applyFlags(cmd, conversion);
            if (conversion.getTo() == DataFormat.AUTO) {
                conversion.setTo(DataFormat.fromExtension(output));
            }
            Charset charset = charsetFor(conversion.getEncoding());
            log.debug("Converting `{}` to `{}` with {}", input, output, conversion);

            String source = StreamUtils.readSource(input, charset);
            String result = Converter.convert(source, conversion);
            StreamUtils.writeOutput(output, result, charset);
        } catch (PhyloDataException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(EXIT_ERROR);
        } catch (IOException e) {
            System.err.println("Error reading or writing data: " + e.getMessage());
            System.exit(EXIT_ERROR);
        }
    }

    static Options buildOptions() {
        Options options = new Options();
        options.addOption("i", "input", true, "Input file, or - for stdin (default)");
        options.addOption("o", "output", true, "Output file, or - for stdout (default)");
        options.addOption("f", "from", true, "Input format: auto, tabular, csv, tsv, nexus, phylip");
        options.addOption("t", "to", true, "Output format: auto, tabular, csv, tsv, nexus, phylip");
        options.addOption("e", "encoding", true, "Character encoding of input and output (default UTF-8)");
        options.addOption(null, "i-taxa", true, "Name of the taxa column in tabular input");
        options.addOption(null, "i-char", true, "Name of the character column in tabular input");
        options.addOption(null, "i-state", true, "Name of the state column in tabular input");
        options.addOption(null, "o-taxa", true, "Name of the taxa column in tabular output");
        options.addOption(null, "o-char", true, "Name of the character column in tabular output");
        options.addOption(null, "o-state", true, "Name of the state column in tabular output");
        options.addOption(null, "slug-taxa", true, "Slug level for taxa: none, simple, full");
        options.addOption(null, "slug-chars", true, "Slug level for characters: none, simple, full");
        options.addOption("b", "binarize", false, "Binarize multistate characters");
        options.addOption("a", "ascertainment", true, "Ascertainment correction: default, true, false");
        options.addOption("c", "config", true, "JSON file with conversion options");
        options.addOption("v", "verbosity", true, "Log level: debug, info, warn, error");
        options.addOption("h", "help", false, "Print this message");
        return options;
    }

    static void applyFlags(CommandLine cmd, ConversionOptions conversion) {
        if (cmd.hasOption("from")) {
            conversion.setFrom(DataFormat.fromName(cmd.getOptionValue("from")));
        }
        if (cmd.hasOption("to")) {
            conversion.setTo(DataFormat.fromName(cmd.getOptionValue("to")));
        }
        if (cmd.hasOption("encoding")) {
            conversion.setEncoding(cmd.getOptionValue("encoding"));
        }
        if (cmd.hasOption("i-taxa")) {
            conversion.setInputTaxa(cmd.getOptionValue("i-taxa"));
        }
        if (cmd.hasOption("i-char")) {
            conversion.setInputCharacter(cmd.getOptionValue("i-char"));
        }
        if (cmd.hasOption("i-state")) {
            conversion.setInputState(cmd.getOptionValue("i-state"));
        }
        if (cmd.hasOption("o-taxa")) {
            conversion.setOutputTaxa(cmd.getOptionValue("o-taxa"));
        }
        if (cmd.hasOption("o-char")) {
            conversion.setOutputCharacter(cmd.getOptionValue("o-char"));
        }
        if (cmd.hasOption("o-state")) {
            conversion.setOutputState(cmd.getOptionValue("o-state"));
        }
        if (cmd.hasOption("slug-taxa")) {
            conversion.setSlugTaxa(SlugLevel.fromName(cmd.getOptionValue("slug-taxa")));
        }
        if (cmd.hasOption("slug-chars")) {
            conversion.setSlugChars(SlugLevel.fromName(cmd.getOptionValue("slug-chars")));
        }
        if (cmd.hasOption("binarize")) {
            conversion.setBinarize(true);
        }
        if (cmd.hasOption("ascertainment")) {
            conversion.setAscertainment(Ascertainment.fromName(cmd.getOptionValue("ascertainment")));
        }
    }

    static Charset charsetFor(String encoding) {
        try {
            return Charset.forName(encoding);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            throw new UnsupportedFormatException("Unknown encoding `" + encoding + "`.");
        }
    }

    private static void printHelp(Options options) {
        new HelpFormatter().printHelp("phyloconvert [options]", options);
    }
}
