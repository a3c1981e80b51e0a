package com.stlmonitor.core.geo;

import com.stlmonitor.core.model.GazetteerEntry;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Pre-compiled name and alias terms of one gazetteer entry. Built once per {@link Gazetteer}.
 */
final class PlaceMatcher {
    private final GazetteerEntry entry;
    private final Term name;
    private final List<Term> aliases;

    private PlaceMatcher(GazetteerEntry entry) {
        this.entry = entry;
        this.name = Term.of(entry.name());
        this.aliases = entry.aliases().stream().map(Term::of).toList();
    }

    static PlaceMatcher of(GazetteerEntry entry) {
        return new PlaceMatcher(entry);
    }

    GazetteerEntry entry() {
        return entry;
    }

    /**
     * @param lowerText text already lower-cased with {@link Locale#ROOT}
     */
    boolean mentionedIn(String lowerText) {
        return name.foundIn(lowerText) || aliases.stream().anyMatch(alias -> alias.foundIn(lowerText));
    }

    /**
     * Match bonus for this entry, or -1 when neither the name nor any alias occurs. A name hit wins over
     * aliases; among aliases only the first hit counts.
     */
    int matchScore(String lowerText, String text) {
        if (name.foundIn(lowerText)) {
            return name.onBoundaryIn(text) ? TextGeocoder.NAME_BOUNDARY_BONUS : TextGeocoder.NAME_SUBSTRING_BONUS;
        }
        for (Term alias : aliases) {
            if (alias.foundIn(lowerText)) {
                return alias.onBoundaryIn(text) ? TextGeocoder.ALIAS_BOUNDARY_BONUS : TextGeocoder.ALIAS_SUBSTRING_BONUS;
            }
        }
        return -1;
    }

    private record Term(String lower, Pattern boundary) {
        static Term of(String value) {
            String lower = value.toLowerCase(Locale.ROOT);
            return new Term(lower, Pattern.compile("\\b" + Pattern.quote(lower) + "\\b", Pattern.CASE_INSENSITIVE));
        }

        boolean foundIn(String lowerText) {
            return !lower.isEmpty() && lowerText.contains(lower);
        }

        boolean onBoundaryIn(String text) {
            return boundary.matcher(text).find();
        }
    }
}
