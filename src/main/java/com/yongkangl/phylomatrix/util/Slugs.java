package com.yongkangl.phylomatrix.util;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Normalization of taxon and character labels into identifier-safe forms.
 */
public final class Slugs {
    private static final Logger log = LoggerFactory.getLogger(Slugs.class);

    private Slugs() {
    }

    /**
     * Returns the slugged version of a single label. As this operates on one
     * string, distinct labels may collapse to the same slug; use
     * {@link #uniqueIds(List, SlugLevel)} when uniqueness matters.
     */
    public static String slug(String label, SlugLevel level) {
        Objects.requireNonNull(level, "level");
        String slugged;
        switch (level) {
            case NONE:
                slugged = label;
                break;
            case SIMPLE:
                slugged = keep(StringUtils.stripAccents(label), true)
                        .strip()
                        .replaceAll("\\s+", "_");
                break;
            case FULL:
                String collapsed = StringUtils.stripAccents(label).strip().replaceAll("\\s+", " ");
                slugged = keep(collapsed.toLowerCase(Locale.ROOT), false);
                break;
            default:
                throw new IllegalStateException("Unhandled slug level " + level);
        }
        log.trace("Slugged `{}` to `{}` ({})", label, slugged, level);
        return slugged;
    }

    /**
     * Slugs every label and makes the results unique. Labels whose slug occurs
     * more than once get the first free suffix of "-a", "-b", ... "-z", "-aa",
     * ... in order of appearance, skipping suffixed forms that another label
     * already slugs to. The output has the same length and order as the input
     * and never repeats an id.
     */
    public static List<String> uniqueIds(List<String> labels, SlugLevel level) {
        List<String> slugged = new ArrayList<>(labels.size());
        Map<String, Integer> totals = new HashMap<>();
        for (String label : labels) {
            String s = slug(label, level);
            slugged.add(s);
            totals.merge(s, 1, Integer::sum);
        }

        // slugs emitted verbatim are reserved up front
        Set<String> taken = new HashSet<>();
        for (Map.Entry<String, Integer> total : totals.entrySet()) {
            if (total.getValue() == 1) {
                taken.add(total.getKey());
            }
        }

        Map<String, Integer> next = new HashMap<>();
        List<String> unique = new ArrayList<>(slugged.size());
        for (String s : slugged) {
            if (totals.get(s) == 1) {
                unique.add(s);
                continue;
            }
            String candidate;
            do {
                int occurrence = next.merge(s, 1, Integer::sum) - 1;
                candidate = s + suffix(occurrence);
            } while (!taken.add(candidate));
            unique.add(candidate);
        }
        return unique;
    }

    // bijective base-26: 0 -> "-a", 25 -> "-z", 26 -> "-aa"
    static String suffix(int occurrence) {
        StringBuilder sb = new StringBuilder();
        int k = occurrence + 1;
        while (k > 0) {
            k--;
            sb.append((char) ('a' + k % 26));
            k /= 26;
        }
        return "-" + sb.reverse();
    }

    private static String keep(String label, boolean simple) {
        StringBuilder sb = new StringBuilder(label.length());
        for (int i = 0; i < label.length(); i++) {
            char c = label.charAt(i);
            boolean letter = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
            if (letter) {
                sb.append(c);
            } else if (simple && ((c >= '0' && c <= '9') || c == '_' || c == '-' || Character.isWhitespace(c))) {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
