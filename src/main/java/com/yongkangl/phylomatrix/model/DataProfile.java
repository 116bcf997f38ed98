package com.yongkangl.phylomatrix.model;

/**
 * Dataset-wide flags that decide how the builders render a matrix. Computed
 * once per conversion with {@link #of(PhyloData)}.
 */
public final class DataProfile {
    private final boolean genetic;
    private final boolean binary;

    public DataProfile(boolean genetic, boolean binary) {
        this.genetic = genetic;
        this.binary = binary;
    }

    public static DataProfile of(PhyloData phyd) {
        boolean genetic = true;
        boolean binary = true;
        for (String id : phyd.getCharacters()) {
            Character character = phyd.getCharacter(id);
            genetic &= character.isGenetic();
            binary &= character.isBinary();
        }
        return new DataProfile(genetic, binary);
    }

    public boolean isGenetic() {
        return genetic;
    }

    public boolean isBinary() {
        return binary;
    }

    @Override
    public String toString() {
        return "DataProfile{genetic=" + genetic + ", binary=" + binary + "}";
    }
}
