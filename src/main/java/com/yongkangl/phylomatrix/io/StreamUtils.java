package com.yongkangl.phylomatrix.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Paths;

/**
 * Reads and writes whole sources, with {@code -} standing for stdin/stdout.
 */
public final class StreamUtils {
    private static final Logger log = LoggerFactory.getLogger(StreamUtils.class);

    public static final String STREAM = "-";

    private StreamUtils() {
    }

    public static String readSource(String input, Charset charset) throws IOException {
        log.debug("Reading contents from `{}` as {}", input, charset);
        if (STREAM.equals(input)) {
            return new String(System.in.readAllBytes(), charset);
        }
        return Files.readString(Paths.get(input), charset);
    }

    public static void writeOutput(String output, String content, Charset charset) throws IOException {
        log.debug("Writing {} chars to `{}`", content.length(), output);
        if (STREAM.equals(output)) {
            PrintStream out = new PrintStream(System.out, true, charset);
            out.print(content);
            out.flush();
            return;
        }
        Files.writeString(Paths.get(output), content, charset);
    }
}
