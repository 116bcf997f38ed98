package com.yongkangl.phylomatrix.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;

/**
 * Expands multistate characters into presence/absence columns, one per state,
 * grouped under a charset named after the original character.
 */
public final class Binarizer {
    private static final Logger log = LoggerFactory.getLogger(Binarizer.class);

    private Binarizer() {
    }

    public static PhyloData binarize(PhyloData phyd, Ascertainment ascertainment) {
        boolean correct = ascertainment.isActive(phyd);
        log.debug("Binarizing {} (ascertainment correction: {})", phyd, correct);

        PhyloData binary = new PhyloData();
        for (String character : phyd.getCharacters()) {
            List<String> states = phyd.getCharacter(character).getStates();
            for (String taxon : phyd.getTaxa()) {
                if (correct) {
                    binary.extend(taxon, character + PhyloData.ASCERTAINMENT_SUFFIX, character, "0");
                }

                Set<String> observed = phyd.getObservation(taxon, character);
                boolean known = false;
                for (String token : observed) {
                    known |= !Character.isSentinel(token);
                }
                if (!known && !observed.contains(Character.MISSING)) {
                    continue;
                }
                for (String state : states) {
                    String value = !known ? Character.MISSING : observed.contains(state) ? "1" : "0";
                    binary.extend(taxon, character + "_" + state, character, value);
                }
            }
        }

        log.debug("Binarized into {}", binary);
        return binary;
    }
}
