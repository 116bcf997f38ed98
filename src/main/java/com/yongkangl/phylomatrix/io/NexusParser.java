package com.yongkangl.phylomatrix.io;

import com.yongkangl.phylomatrix.error.MalformedInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Character-at-a-time automaton over NEXUS text. Statements are buffered up
 * to their terminating semicolon and dispatched on their leading keyword;
 * statements it does not know are skipped.
 */
public class NexusParser {
    private static final Logger log = LoggerFactory.getLogger(NexusParser.class);

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.DOTALL;
    private static final Pattern BEGIN = Pattern.compile("BEGIN\\s+(\\S+?)\\s*;", FLAGS);
    private static final Pattern NTAX = Pattern.compile("\\bNTAX\\s*=\\s*(\\d+)", FLAGS);
    private static final Pattern NCHAR = Pattern.compile("\\bNCHAR\\s*=\\s*(\\d+)", FLAGS);
    private static final Pattern DATATYPE = Pattern.compile("\\bDATATYPE\\s*=\\s*(\\w+)", FLAGS);
    private static final Pattern MISSING = Pattern.compile("\\bMISSING\\s*=\\s*(\\S)", FLAGS);
    private static final Pattern GAP = Pattern.compile("\\bGAP\\s*=\\s*(\\S)", FLAGS);
    private static final Pattern SYMBOLS = Pattern.compile("\\bSYMBOLS\\s*=\\s*\"([^\"]*)\"", FLAGS);
    private static final Pattern CHARSET = Pattern.compile("CHARSET\\s+(\\S+?)\\s*=\\s*(.+)", FLAGS);
    private static final Pattern RANGE = Pattern.compile("(\\d+)(?:\\s*-\\s*(\\d+))?");

    enum ParserState {
        NONE,
        OUT_OF_BLOCK,
        IN_BLOCK
    }

    private final String input;
    private int position;
    private int line;

    private final List<String> blocks = new ArrayList<>();
    private Integer ntax;
    private Integer nchar;
    private String datatype;
    private String missing;
    private String gap;
    private String symbols;
    private final Map<Integer, String> charstateLabels = new HashMap<>();
    private final Map<String, List<String>> charstateStates = new LinkedHashMap<>();
    private final Map<String, String> matrix = new LinkedHashMap<>();
    private final List<ParsedBlock.CharsetRange> charsets = new ArrayList<>();

    public NexusParser(String input) {
        this.input = input;
        this.position = 0;
        this.line = 1;
    }

    public static ParsedBlock parse(String input) {
        return new NexusParser(input).parse();
    }

    public ParsedBlock parse() {
        ParserState state = ParserState.NONE;
        StringBuilder buffer = new StringBuilder();
        boolean quoted = false;
        for (position = 0; position < input.length(); position++) {
            char current = input.charAt(position);
            switch (state) {
                case NONE:
                    if (!java.lang.Character.isWhitespace(current)) {
                        buffer.append(current);
                    } else if (buffer.length() > 0) {
                        checkHeader(buffer.toString());
                        buffer.setLength(0);
                        state = ParserState.OUT_OF_BLOCK;
                    }
                    break;
                case OUT_OF_BLOCK:
                    buffer.append(current);
                    if (current == ';') {
                        blocks.add(parseBegin(buffer.toString()));
                        buffer.setLength(0);
                        state = ParserState.IN_BLOCK;
                    }
                    break;
                case IN_BLOCK:
                    buffer.append(current);
                    if (current == '\'') {
                        quoted = !quoted;
                    } else if (current == ';' && !quoted) {
                        String statement = buffer.toString();
                        buffer.setLength(0);
                        if (isEnd(statement)) {
                            state = ParserState.OUT_OF_BLOCK;
                        } else {
                            parseStatement(statement.substring(0, statement.length() - 1).strip());
                        }
                    }
                    break;
                default:
                    throw new IllegalStateException("Unhandled parser state " + state);
            }
            if (current == '\n') {
                line++;
            }
        }

        if (state == ParserState.NONE) {
            checkHeader(buffer.toString());
        } else if (quoted) {
            throw new MalformedInputException("Unterminated quoted word in NEXUS source.");
        } else if (!buffer.toString().isBlank()) {
            throw new MalformedInputException("Unterminated NEXUS statement at line " + line + ".");
        } else if (state == ParserState.IN_BLOCK) {
            throw new MalformedInputException("NEXUS block `" + blocks.get(blocks.size() - 1) + "` is not closed.");
        }

        log.debug("Parsed NEXUS blocks {} with {} matrix rows", blocks, matrix.size());
        return new ParsedBlock(blocks, ntax, nchar, datatype, missing, gap, symbols,
                charstateLabels, charstateStates, matrix, charsets);
    }

    private void checkHeader(String token) {
        if (!token.equalsIgnoreCase("#NEXUS")) {
            throw new MalformedInputException("Source does not start with a #NEXUS header.");
        }
    }

    private String parseBegin(String statement) {
        Matcher matcher = BEGIN.matcher(statement.strip());
        if (!matcher.matches()) {
            throw new MalformedInputException("Unable to parse NEXUS block at char " + position
                    + " (line " + line + ").");
        }
        return matcher.group(1).toUpperCase(Locale.ROOT);
    }

    private static boolean isEnd(String statement) {
        String compact = statement.replaceAll("\\s", "").toUpperCase(Locale.ROOT);
        return compact.equals("END;") || compact.equals("ENDBLOCK;");
    }

    private void parseStatement(String statement) {
        String[] parts = statement.split("\\s+", 2);
        String command = parts[0].toUpperCase(Locale.ROOT);
        String body = parts.length > 1 ? parts[1] : "";
        switch (command) {
            case "DIMENSIONS":
                parseDimensions(body);
                break;
            case "FORMAT":
                parseFormat(body);
                break;
            case "CHARSTATELABELS":
                parseCharstateLabels(body);
                break;
            case "MATRIX":
                parseMatrix(body);
                break;
            case "CHARSET":
                parseCharset(statement);
                break;
            default:
                log.debug("Ignoring NEXUS command `{}` at line {}", command, line);
        }
    }

    private void parseDimensions(String body) {
        Matcher ntaxMatch = NTAX.matcher(body);
        if (ntaxMatch.find()) {
            ntax = parseNumber(ntaxMatch.group(1), "NTAX");
        }
        Matcher ncharMatch = NCHAR.matcher(body);
        if (ncharMatch.find()) {
            nchar = parseNumber(ncharMatch.group(1), "NCHAR");
        }
    }

    private void parseFormat(String body) {
        Matcher matcher = DATATYPE.matcher(body);
        if (matcher.find()) {
            datatype = matcher.group(1).toUpperCase(Locale.ROOT);
        }
        matcher = MISSING.matcher(body);
        if (matcher.find()) {
            missing = matcher.group(1);
        }
        matcher = GAP.matcher(body);
        if (matcher.find()) {
            gap = matcher.group(1);
        }
        matcher = SYMBOLS.matcher(body);
        if (matcher.find()) {
            // symbols may be listed space separated
            symbols = matcher.group(1).replaceAll("\\s", "");
        }
    }

    private void parseCharstateLabels(String body) {
        for (String entry : splitUnquoted(body, ',')) {
            List<String> words = words(entry);
            if (words.isEmpty()) {
                continue;
            }
            String charstateLabel = String.join(" ", words);
            boolean withStates = words.size() > 2 && words.get(2).equals("/");
            if (words.size() < 2 || (words.size() > 2 && !withStates) || words.get(1).equals("/")) {
                throw new MalformedInputException("Unable to parse charstatelabel `" + charstateLabel + "`.");
            }
            String label = words.get(1);
            charstateLabels.put(parseNumber(words.get(0), "charstatelabel `" + charstateLabel + "`"), label);
            if (withStates) {
                charstateStates.put(label, new ArrayList<>(words.subList(3, words.size())));
            }
        }
    }

    /**
     * Splits on {@code separator} outside single-quoted words.
     */
    static List<String> splitUnquoted(String text, char separator) {
        List<String> parts = new ArrayList<>();
        StringBuilder part = new StringBuilder();
        boolean quoted = false;
        for (char c : text.toCharArray()) {
            if (c == '\'') {
                quoted = !quoted;
            }
            if (c == separator && !quoted) {
                parts.add(part.toString());
                part.setLength(0);
            } else {
                part.append(c);
            }
        }
        parts.add(part.toString());
        return parts;
    }

    /**
     * NEXUS words: whitespace separated, {@code /} standing alone, and
     * {@code 'single quoted'} words with {@code ''} for an embedded quote.
     */
    static List<String> words(String text) {
        List<String> words = new ArrayList<>();
        StringBuilder word = new StringBuilder();
        boolean pending = false;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\'') {
                int close = i + 1;
                while (true) {
                    close = text.indexOf('\'', close);
                    if (close < 0) {
                        throw new MalformedInputException("Unterminated quoted word in `" + text.strip() + "`.");
                    }
                    if (close + 1 < text.length() && text.charAt(close + 1) == '\'') {
                        close += 2;
                    } else {
                        break;
                    }
                }
                word.append(text, i + 1, close);
                pending = true;
                i = close + 1;
                continue;
            }
            if (java.lang.Character.isWhitespace(c) || c == '/') {
                if (pending) {
                    words.add(word.toString().replace("''", "'"));
                    word.setLength(0);
                    pending = false;
                }
                if (c == '/') {
                    words.add("/");
                }
            } else {
                word.append(c);
                pending = true;
            }
            i++;
        }
        if (pending) {
            words.add(word.toString().replace("''", "'"));
        }
        return words;
    }

    private void parseMatrix(String body) {
        for (String row : body.split("\\R")) {
            String entry = row.strip();
            if (entry.isEmpty()) {
                continue;
            }
            String[] tokens = entry.split("\\s+");
            if (tokens.length < 2) {
                throw new MalformedInputException("Matrix row `" + entry + "` has no vector.");
            }
            String vector = String.join("", Arrays.copyOfRange(tokens, 1, tokens.length));
            if (matrix.put(tokens[0], vector) != null) {
                throw new MalformedInputException("Taxon `" + tokens[0] + "` appears twice in the matrix.");
            }
        }
    }

    private void parseCharset(String statement) {
        Matcher matcher = CHARSET.matcher(statement);
        if (!matcher.matches()) {
            log.debug("Ignoring unsupported charset syntax `{}`", statement);
            return;
        }
        String name = matcher.group(1);
        Matcher range = RANGE.matcher(matcher.group(2));
        while (range.find()) {
            int start = parseNumber(range.group(1), "charset `" + name + "`");
            int end = range.group(2) != null ? parseNumber(range.group(2), "charset `" + name + "`") : start;
            charsets.add(new ParsedBlock.CharsetRange(name, start, end));
        }
    }

    private static int parseNumber(String digits, String context) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new MalformedInputException("Invalid number `" + digits + "` in " + context + ".", e);
        }
    }
}
