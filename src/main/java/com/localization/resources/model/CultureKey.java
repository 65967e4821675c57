package com.localization.resources.model;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.RequiredArgsConstructor;

import java.util.Locale;

/**
 * Identifies the culture of a resource language.
 * The neutral culture carries no locale and sorts before every other culture.
 */
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class CultureKey implements Comparable<CultureKey> {

    public static final CultureKey NEUTRAL = new CultureKey(null);

    private final Locale culture;

    public static CultureKey of(Locale culture) {
        if (culture == null || Locale.ROOT.equals(culture)) {
            return NEUTRAL;
        }
        return new CultureKey(culture);
    }

    /**
     * Parse a culture name such as {@code de}, {@code de-DE} or {@code de_DE}.
     * A null or blank name yields {@link #NEUTRAL}.
     */
    public static CultureKey parse(String cultureName) {
        if (cultureName == null || cultureName.isBlank()) {
            return NEUTRAL;
        }
        return of(Locale.forLanguageTag(cultureName.trim().replace('_', '-')));
    }

    public boolean isNeutral() {
        return culture == null;
    }

    /**
     * @return the locale, or {@code null} for the neutral culture
     */
    public Locale getCulture() {
        return culture;
    }

    public String toLanguageTag() {
        return culture == null ? "" : culture.toLanguageTag();
    }

    @Override
    public int compareTo(CultureKey other) {
        if (isNeutral() || other.isNeutral()) {
            return Boolean.compare(!isNeutral(), !other.isNeutral());
        }
        return toLanguageTag().compareTo(other.toLanguageTag());
    }

    @Override
    public String toString() {
        return culture == null ? "neutral" : culture.toLanguageTag();
    }
}
