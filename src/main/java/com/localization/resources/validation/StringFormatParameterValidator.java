package com.localization.resources.validation;

import lombok.experimental.UtilityClass;

import java.util.Arrays;
import java.util.BitSet;
import java.util.HashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks that translations of a resource use the same positional format parameters.
 *
 * <p>A format parameter is a placeholder such as {@code {0}}, {@code {1,-8}},
 * {@code {2:N2}} or {@code {3,10:yyyy}}. Only the parameter index matters; alignment
 * and format specs are ignored, as is how often an index occurs.</p>
 */
@UtilityClass
public class StringFormatParameterValidator {

    private static final Pattern FORMAT_PARAMETER_PATTERN = Pattern.compile("\\{(\\d+)(,-?\\d+)?(:[^{}]*)?\\}");

    // Composite format strings reject indexes of a million or more
    private static final int MAX_PARAMETER_INDEX = 999_999;

    /**
     * Get the set of parameter indexes used by a value.
     *
     * @return a bit set with bit N set iff {@code {N}} occurs; empty for null or empty values
     */
    public BitSet getFormatFlags(String value) {
        BitSet flags = new BitSet();
        if (value == null || value.isEmpty()) {
            return flags;
        }

        Matcher matcher = FORMAT_PARAMETER_PATTERN.matcher(value);
        while (matcher.find()) {
            int index = parseIndex(matcher.group(1));
            if (index >= 0) {
                flags.set(index);
            }
        }
        return flags;
    }

    /**
     * Check whether the non-empty values use more than one distinct set of format parameters.
     * Null and empty values are skipped, a missing translation is not a mismatch.
     */
    public boolean hasMismatches(Iterable<String> values) {
        Set<BitSet> patterns = new HashSet<>();
        for (String value : values) {
            if (value == null || value.isEmpty()) {
                continue;
            }
            patterns.add(getFormatFlags(value));
            if (patterns.size() > 1) {
                return true;
            }
        }
        return false;
    }

    public boolean hasMismatches(String... values) {
        return hasMismatches(Arrays.asList(values));
    }

    private int parseIndex(String digits) {
        String trimmed = digits.replaceFirst("^0+(?=\\d)", "");
        if (trimmed.length() > 6) {
            return -1;
        }
        int index = Integer.parseInt(trimmed);
        return index <= MAX_PARAMETER_INDEX ? index : -1;
    }
}
