package com.vnaddress.matching;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Tunables of {@link HierarchicalResolver}.
 *
 * @param specialEnding      character class that must directly follow a district or ward alias
 *                           when the search is constrained by a resolved parent
 * @param danglingQualifiers generic city qualifiers ("Thanh Pho") stripped when the province
 *                           match leaves them stranded at the end of the address
 * @param sentinel           terminator appended to the address before matching
 */
public record ResolverSettings(String specialEnding, List<String> danglingQualifiers, String sentinel) {

    public static final String DEFAULT_SPECIAL_ENDING = "[g.;,\\s]";
    public static final String DEFAULT_SENTINEL = ",";

    public ResolverSettings {
        if (specialEnding == null || specialEnding.isEmpty()) {
            throw new IllegalArgumentException("Special ending pattern is required");
        }
        // fails fast on a malformed class
        Pattern.compile(specialEnding);
        if (sentinel == null || sentinel.isEmpty()) {
            throw new IllegalArgumentException("Sentinel must not be empty");
        }
        danglingQualifiers = danglingQualifiers == null ? List.of() : List.copyOf(danglingQualifiers);
    }

    public static ResolverSettings defaults() {
        return new ResolverSettings(DEFAULT_SPECIAL_ENDING, List.of("Thanh Pho", "Tp"), DEFAULT_SENTINEL);
    }

    public ResolverSettings withDanglingQualifiers(List<String> qualifiers) {
        return new ResolverSettings(specialEnding, qualifiers, sentinel);
    }
}
