package com.yongkangl.phylomatrix.model;

import com.yongkangl.phylomatrix.error.MalformedInputException;
import com.yongkangl.phylomatrix.util.SlugLevel;
import com.yongkangl.phylomatrix.util.Slugs;
import org.apache.commons.math3.util.Pair;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * In-memory representation of a character matrix. Observations are sets of
 * state tokens keyed by (taxon, character), so a taxon can carry several
 * states for the same character. Every view is recomputed on request and
 * iterated in sorted order.
 */
public class PhyloData {
    public static final String ALPHABET = "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZ";
    public static final String ASCERTAINMENT_SUFFIX = "_ASCERTAINMENT";

    private Set<String> taxa;
    private Map<String, Character> characters;
    // character id -> charset name
    private Map<String, String> charsets;
    private Map<Pair<String, String>, Set<String>> observations;

    public PhyloData() {
        taxa = new HashSet<>();
        characters = new HashMap<>();
        charsets = new HashMap<>();
        observations = new HashMap<>();
    }

    public void extend(String taxon, String character, String state) {
        extend(taxon, character, character, state);
    }

    public void extend(String taxon, String character, String charset, String state) {
        String previous = charsets.putIfAbsent(character, charset);
        if (previous != null && !previous.equals(charset)) {
            throw new MalformedInputException("Character `" + character + "` already belongs to charset `"
                    + previous + "`, not `" + charset + "`.");
        }
        taxa.add(taxon);
        characters.computeIfAbsent(character, k -> new Character()).addState(state);
        observations.computeIfAbsent(new Pair<>(taxon, character), k -> new HashSet<>()).add(state);
    }

    public List<String> getTaxa() {
        List<String> sorted = new ArrayList<>(taxa);
        Collections.sort(sorted);
        return sorted;
    }

    /**
     * Character ids grouped by charset, ascertainment columns first within
     * their group. Ungrouped data comes out in plain lexicographic order.
     */
    public List<String> getCharacters() {
        List<String> sorted = new ArrayList<>(characters.keySet());
        sorted.sort(Comparator.comparing((String c) -> charsets.get(c))
                .thenComparing(c -> isAscertainment(c) ? 0 : 1)
                .thenComparing(Comparator.naturalOrder()));
        return sorted;
    }

    public Character getCharacter(String character) {
        return characters.get(character);
    }

    public String getCharset(String character) {
        return charsets.get(character);
    }

    /**
     * Charset name to member character ids, both in canonical order.
     */
    public Map<String, List<String>> getCharsets() {
        Map<String, List<String>> grouped = new LinkedHashMap<>();
        for (String character : getCharacters()) {
            grouped.computeIfAbsent(charsets.get(character), k -> new ArrayList<>()).add(character);
        }
        return grouped;
    }

    public boolean isAscertainment(String character) {
        String charset = charsets.get(character);
        return character.endsWith(ASCERTAINMENT_SUFFIX) && charset != null && !charset.equals(character);
    }

    public Set<String> getObservation(String taxon, String character) {
        Set<String> observed = observations.get(new Pair<>(taxon, character));
        return observed == null ? Collections.emptySet() : Collections.unmodifiableSet(observed);
    }

    public int getObservationCount() {
        int count = 0;
        for (Set<String> observed : observations.values()) {
            count += observed.size();
        }
        return count;
    }

    public boolean isEmpty() {
        return taxa.isEmpty();
    }

    public int getCardinality() {
        int cardinality = 0;
        for (Character character : characters.values()) {
            cardinality = Math.max(cardinality, character.size());
        }
        return cardinality;
    }

    public String getSymbols() {
        int cardinality = getCardinality();
        if (cardinality > 0) {
            symbolFor(cardinality - 1);
        }
        return ALPHABET.substring(0, cardinality);
    }

    public Map<String, String> getMatrix() {
        return getMatrix(false);
    }

    /**
     * One vector per taxon, one cell per character in canonical order. Cells
     * are symbols from {@link #ALPHABET}, or the state tokens themselves when
     * {@code rawStates} is set.
     */
    public Map<String, String> getMatrix(boolean rawStates) {
        List<String> order = getCharacters();
        Map<String, List<String>> states = new HashMap<>();
        for (String character : order) {
            states.put(character, characters.get(character).getStates());
        }

        Map<String, String> matrix = new LinkedHashMap<>();
        for (String taxon : getTaxa()) {
            StringBuilder vector = new StringBuilder();
            for (String character : order) {
                vector.append(cell(getObservation(taxon, character), states.get(character), rawStates));
            }
            matrix.put(taxon, vector.toString());
        }
        return matrix;
    }

    private static String cell(Set<String> observed, List<String> states, boolean rawStates) {
        List<String> symbols = new ArrayList<>();
        for (String token : observed) {
            if (!Character.isSentinel(token)) {
                symbols.add(rawStates ? token : String.valueOf(symbolFor(states.indexOf(token))));
            }
        }
        if (symbols.isEmpty()) {
            return observed.contains(Character.MISSING) ? Character.MISSING : Character.GAP;
        }
        if (symbols.size() == 1) {
            return symbols.get(0);
        }
        Collections.sort(symbols);
        return "(" + String.join(",", symbols) + ")";
    }

    private static char symbolFor(int index) {
        if (index >= ALPHABET.length()) {
            throw new MalformedInputException("Characters with more than " + ALPHABET.length()
                    + " states cannot be represented with symbols.");
        }
        return ALPHABET.charAt(index);
    }

    public void slugTaxa(SlugLevel level) {
        List<String> labels = getTaxa();
        Map<String, String> slugMap = slugMap(labels, level);

        Set<String> newTaxa = new HashSet<>();
        for (String taxon : labels) {
            newTaxa.add(slugMap.get(taxon));
        }
        Map<Pair<String, String>, Set<String>> newObservations = new HashMap<>();
        for (Map.Entry<Pair<String, String>, Set<String>> e : observations.entrySet()) {
            newObservations.put(new Pair<>(slugMap.get(e.getKey().getFirst()), e.getKey().getSecond()), e.getValue());
        }

        taxa = newTaxa;
        observations = newObservations;
    }

    /**
     * Slugs character ids and charset names together, so a charset keeps
     * pointing at the same label as the character it was derived from.
     */
    public void slugCharacters(SlugLevel level) {
        TreeSet<String> labels = new TreeSet<>(characters.keySet());
        labels.addAll(charsets.values());
        Map<String, String> slugMap = slugMap(new ArrayList<>(labels), level);

        Map<String, Character> newCharacters = new HashMap<>();
        Map<String, String> newCharsets = new HashMap<>();
        for (Map.Entry<String, Character> e : characters.entrySet()) {
            newCharacters.put(slugMap.get(e.getKey()), e.getValue());
            newCharsets.put(slugMap.get(e.getKey()), slugMap.get(charsets.get(e.getKey())));
        }
        Map<Pair<String, String>, Set<String>> newObservations = new HashMap<>();
        for (Map.Entry<Pair<String, String>, Set<String>> e : observations.entrySet()) {
            newObservations.put(new Pair<>(e.getKey().getFirst(), slugMap.get(e.getKey().getSecond())), e.getValue());
        }

        characters = newCharacters;
        charsets = newCharsets;
        observations = newObservations;
    }

    private static Map<String, String> slugMap(List<String> labels, SlugLevel level) {
        List<String> ids = Slugs.uniqueIds(labels, level);
        Map<String, String> slugMap = new HashMap<>();
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < labels.size(); i++) {
            if (!seen.add(ids.get(i))) {
                throw new IllegalStateException("Slugging maps more than one label to `" + ids.get(i) + "`.");
            }
            slugMap.put(labels.get(i), ids.get(i));
        }
        return slugMap;
    }

    @Override
    public String toString() {
        return "PhyloData with " + taxa.size() + " taxa and " + characters.size() + " characters.";
    }
}
