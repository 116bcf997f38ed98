package com.yongkangl.phylomatrix.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * A column of the character matrix: the set of state tokens observed for it.
 * Missing and gap tokens are recorded but never reported by {@link #getStates()}.
 */
public class Character {
    public static final String MISSING = "?";
    public static final String GAP = "-";

    private static final String NUCLEOTIDES = "ACGT";
    private static final String IUPAC = "ACGTURYSWKMBDHVN";

    private final Set<String> tokens;

    public Character() {
        this.tokens = new HashSet<>();
    }

    public Character(String state) {
        this();
        addState(state);
    }

    public void addState(String state) {
        tokens.add(state);
    }

    /**
     * Sorted, deduplicated states without the missing and gap sentinels. The
     * position of a state in this list defines the symbol it is written with.
     */
    public List<String> getStates() {
        List<String> states = new ArrayList<>();
        for (String token : tokens) {
            if (!isSentinel(token)) {
                states.add(token);
            }
        }
        Collections.sort(states);
        return states;
    }

    public int size() {
        return getStates().size();
    }

    public boolean isBinary() {
        for (String state : getStates()) {
            if (!state.equals("0") && !state.equals("1")) {
                return false;
            }
        }
        return true;
    }

    public boolean isGenetic() {
        return allIn(NUCLEOTIDES);
    }

    public boolean isNucleotide() {
        return allIn(IUPAC);
    }

    public static boolean isSentinel(String token) {
        return MISSING.equals(token) || GAP.equals(token);
    }

    private boolean allIn(String alphabet) {
        for (String state : getStates()) {
            if (state.length() != 1 || alphabet.indexOf(state.toUpperCase(Locale.ROOT).charAt(0)) < 0) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "Character with " + size() + " states " + getStates() + ".";
    }
}
