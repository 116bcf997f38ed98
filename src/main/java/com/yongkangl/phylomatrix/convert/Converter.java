package com.yongkangl.phylomatrix.convert;

import com.yongkangl.phylomatrix.error.AmbiguousConfigurationException;
import com.yongkangl.phylomatrix.io.DataFormat;
import com.yongkangl.phylomatrix.io.NexusReader;
import com.yongkangl.phylomatrix.io.NexusWriter;
import com.yongkangl.phylomatrix.io.PhylipParser;
import com.yongkangl.phylomatrix.io.PhylipWriter;
import com.yongkangl.phylomatrix.io.TabularReader;
import com.yongkangl.phylomatrix.io.TabularWriter;
import com.yongkangl.phylomatrix.model.Binarizer;
import com.yongkangl.phylomatrix.model.DataProfile;
import com.yongkangl.phylomatrix.model.PhyloData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read, slug, optionally binarize, and write.
 */
public final class Converter {
    private static final Logger log = LoggerFactory.getLogger(Converter.class);

    private Converter() {
    }

    public static String convert(String source, ConversionOptions options) {
        DataFormat from = options.getFrom() == DataFormat.AUTO ? DataFormat.sniff(source) : options.getFrom();
        if (options.getTo() == DataFormat.AUTO) {
            throw new AmbiguousConfigurationException("Output format must be resolved before converting.");
        }

        PhyloData phyd = read(source, from, options);
        log.info("Read {} from {} source", phyd, from);

        phyd.slugTaxa(options.getSlugTaxa());
        phyd.slugCharacters(options.getSlugChars());

        if (options.isBinarize()) {
            phyd = Binarizer.binarize(phyd, options.getAscertainment());
        }

        DataProfile profile = DataProfile.of(phyd);
        log.debug("Writing {} as {} ({})", phyd, options.getTo(), profile);
        return write(phyd, profile, options.getTo(), options);
    }

    static PhyloData read(String source, DataFormat from, ConversionOptions options) {
        switch (from) {
            case TABULAR:
                return readTabular(source, TabularReader.detectDelimiter(source), options);
            case CSV:
                return readTabular(source, ',', options);
            case TSV:
                return readTabular(source, '\t', options);
            case NEXUS:
                return NexusReader.read(source);
            case PHYLIP:
                return PhylipParser.read(source);
            default:
                throw new IllegalStateException("Unresolved input format " + from);
        }
    }

    static String write(PhyloData phyd, DataProfile profile, DataFormat to, ConversionOptions options) {
        switch (to) {
            case TABULAR:
            case CSV:
                return writeTabular(phyd, ',', options);
            case TSV:
                return writeTabular(phyd, '\t', options);
            case NEXUS:
                return NexusWriter.build(phyd, profile);
            case PHYLIP:
                return PhylipWriter.build(phyd, profile);
            default:
                throw new IllegalStateException("Unresolved output format " + to);
        }
    }

    private static PhyloData readTabular(String source, char delimiter, ConversionOptions options) {
        return TabularReader.read(source, delimiter,
                options.getInputTaxa(), options.getInputCharacter(), options.getInputState());
    }

    private static String writeTabular(PhyloData phyd, char delimiter, ConversionOptions options) {
        return TabularWriter.build(phyd, delimiter,
                options.getOutputTaxa(), options.getOutputCharacter(), options.getOutputState());
    }
}
