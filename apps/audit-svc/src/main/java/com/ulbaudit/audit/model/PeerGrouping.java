package com.ulbaudit.audit.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Peer-grouping criterion of a rule, resolved once when the rule is loaded.
 * Population bounds are only meaningful for {@link Mode#POPULATION}.
 */
public record PeerGrouping(Mode mode, Double populationMin, Double populationMax) {

    public enum Mode {
        POPULATION("population_size", "population"),
        DISTRICT("district"),
        GRADE("municipality_grade", "grade"),
        STATEWIDE("none", "statewide");

        private final Set<String> keys;

        Mode(String... keys) {
            this.keys = Set.of(keys);
        }

        public static Optional<Mode> fromKey(String key) {
            if (key == null || key.isBlank()) {
                return Optional.of(STATEWIDE);
            }
            String normalized = key.trim().toLowerCase(Locale.ROOT);
            return Arrays.stream(values())
                    .filter(mode -> mode.keys.contains(normalized))
                    .findFirst();
        }
    }

    public static PeerGrouping statewide() {
        return new PeerGrouping(Mode.STATEWIDE, null, null);
    }

    public static PeerGrouping district() {
        return new PeerGrouping(Mode.DISTRICT, null, null);
    }

    public static PeerGrouping grade() {
        return new PeerGrouping(Mode.GRADE, null, null);
    }

    public static PeerGrouping population(Double min, Double max) {
        return new PeerGrouping(Mode.POPULATION, min, max);
    }
}
