package com.conveyal.stopboard.util;

import com.google.common.collect.ImmutableMap;

import java.util.Locale;
import java.util.Map;

/**
 * The static feed and the live arrival page label the same route differently: Greek or Latin script, mixed case,
 * stray spaces. Both sides are reduced to a canonical key before they are compared.
 */
public abstract class RouteNames {

    // Ρ and Χ map onto the same Latin letters as Π and Ξ, so "Ρ1" and "Π1" share a key.
    private static final Map<Character, String> GREEK_TO_LATIN = ImmutableMap.<Character, String>builder()
        .put('Α', "A").put('Β', "B").put('Γ', "G").put('Δ', "D").put('Ε', "E").put('Ζ', "Z")
        .put('Η', "H").put('Θ', "TH").put('Ι', "I").put('Κ', "K").put('Λ', "L").put('Μ', "M")
        .put('Ν', "N").put('Ξ', "X").put('Ο', "O").put('Π', "P").put('Ρ', "P").put('Σ', "S")
        .put('Τ', "T").put('Υ', "Y").put('Φ', "F").put('Χ', "X").put('Ψ', "PS").put('Ω', "O")
        .build();

    /**
     * Reduce a route label to its matching key: trim, upper-case, drop all whitespace, then transliterate Greek
     * capitals. Characters outside the table pass through unchanged. Never throws; null and empty input give "".
     */
    public static String canonicalize (String name) {
        if (name == null || name.isEmpty()) return "";
        String upper = name.trim().toUpperCase(Locale.ROOT);
        StringBuilder canonical = new StringBuilder(upper.length());
        for (int i = 0; i < upper.length(); i++) {
            char c = upper.charAt(i);
            // Control characters go too, otherwise trim() on a second pass could change the key.
            if (c <= ' ' || Character.isWhitespace(c) || Character.isSpaceChar(c)) continue;
            String latin = GREEK_TO_LATIN.get(c);
            if (latin != null) canonical.append(latin);
            else canonical.append(c);
        }
        return canonical.toString();
    }

}
