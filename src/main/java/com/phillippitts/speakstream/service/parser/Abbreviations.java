package com.phillippitts.speakstream.service.parser;

import java.util.Collection;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Abbreviations whose trailing period never ends a sentence.
 *
 * <p>Entries are lower case and omit the final period; abbreviations with inner periods keep
 * them ({@code e.g}, {@code i.e}). Words that are also common English words ("no", "sat") are
 * left out on purpose.
 */
public final class Abbreviations {

    private static final Set<String> DEFAULTS = Set.of(
            // titles
            "mr", "mrs", "ms", "dr", "prof", "sr", "jr", "rev", "gen", "col", "capt", "lt", "sgt",
            // months and weekdays
            "jan", "feb", "apr", "jun", "jul", "aug", "sep", "sept", "oct", "nov", "dec",
            "mon", "tue", "tues", "thu", "thur", "thurs", "fri",
            // common
            "etc", "vs", "vol", "fig", "pp", "st", "ave", "blvd", "approx", "dept", "est",
            "inc", "ltd", "corp", "mt",
            // academic
            "phd", "mph",
            // latin
            "i.e", "e.g", "al", "ibid", "cf", "viz"
    );

    private Abbreviations() {
        // Utility class - prevent instantiation
    }

    public static Set<String> defaults() {
        return DEFAULTS;
    }

    /**
     * Returns the default abbreviations plus the given extras, normalised to lower case with any
     * trailing period removed.
     *
     * @param extras additional abbreviations (nullable)
     * @return combined immutable set
     */
    public static Set<String> withAdditional(Collection<String> extras) {
        if (extras == null || extras.isEmpty()) {
            return DEFAULTS;
        }
        Set<String> combined = new HashSet<>(DEFAULTS);
        for (String extra : extras) {
            if (extra == null || extra.isBlank()) {
                continue;
            }
            String normalized = extra.strip().toLowerCase(Locale.ROOT);
            while (normalized.endsWith(".")) {
                normalized = normalized.substring(0, normalized.length() - 1);
            }
            if (!normalized.isEmpty()) {
                combined.add(normalized);
            }
        }
        return Set.copyOf(combined);
    }
}
