package com.yongkangl.phylomatrix.convert;

import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

/**
 * Loads {@link ConversionOptions} from JSON. Enum values are matched without
 * regard to case ({@code "simple"}, {@code "nexus"}); unknown keys fail.
 */
public final class OptionsLoader {
    private static final ObjectMapper mapper = JsonMapper.builder()
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .build();

    private OptionsLoader() {
    }

    public static ConversionOptions load(File file) throws IOException {
        return mapper.readValue(file, ConversionOptions.class);
    }

    public static ConversionOptions load(InputStream in) throws IOException {
        return mapper.readValue(in, ConversionOptions.class);
    }
}
