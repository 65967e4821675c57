package com.localization.resources.validation;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Arrays;
import java.util.BitSet;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for StringFormatParameterValidator.
 */
class StringFormatParameterValidatorTest {

    @Test
    void testFlagsOfSimpleParameters() {
        BitSet flags = StringFormatParameterValidator.getFormatFlags("Copied {0} of {2} files");

        assertThat(flags.get(0)).isTrue();
        assertThat(flags.get(1)).isFalse();
        assertThat(flags.get(2)).isTrue();
        assertThat(flags.cardinality()).isEqualTo(2);
    }

    @Test
    void testFlagsIgnoreAlignmentAndFormatSpec() {
        assertThat(StringFormatParameterValidator.getFormatFlags("{0,10} {1:N2} {2,-5:yyyy-MM-dd}"))
                .isEqualTo(StringFormatParameterValidator.getFormatFlags("{0}{1}{2}"));
    }

    @Test
    void testFormatSpecStopsAtClosingBrace() {
        BitSet flags = StringFormatParameterValidator.getFormatFlags("{0:d}/{1}");

        assertThat(flags.get(0)).isTrue();
        assertThat(flags.get(1)).isTrue();
        assertThat(flags.cardinality()).isEqualTo(2);
    }

    @Test
    void testRepeatedParameterSetsOneBit() {
        assertThat(StringFormatParameterValidator.getFormatFlags("{0} and {0} again"))
                .isEqualTo(StringFormatParameterValidator.getFormatFlags("{0}"));
    }

    @Test
    void testNonParametersAreIgnored() {
        assertThat(StringFormatParameterValidator.getFormatFlags("{name} {} {-1} { 0 }").isEmpty()).isTrue();
        assertThat(StringFormatParameterValidator.getFormatFlags(null).isEmpty()).isTrue();
        assertThat(StringFormatParameterValidator.getFormatFlags("").isEmpty()).isTrue();
    }

    @Test
    void testHighIndexesDoNotThrow() {
        assertThat(StringFormatParameterValidator.getFormatFlags("{64}").get(64)).isTrue();
        assertThat(StringFormatParameterValidator.getFormatFlags("{99999999999999999999}").isEmpty()).isTrue();
        assertThat(StringFormatParameterValidator.getFormatFlags("{1000000}").isEmpty()).isTrue();
        assertThat(StringFormatParameterValidator.getFormatFlags("{000003}").get(3)).isTrue();
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "Hello {0}   | Bonjour {0}   | false",
            "Hello {0}   | Bonjour       | true",
            "{0} of {1}  | {1} von {0}   | false",
            "{0} of {1}  | {0} von {0}   | true",
            "Hi          | Salut         | false",
            "{0:N2} EUR  | {0,8} EUR     | false",
            "{0:d}/{1}   | {1}/{0:d}     | false",
            "{0:d}/{1}   | {0:d}/        | true"
    })
    void testPairMismatch(String neutral, String translated, boolean expected) {
        assertThat(StringFormatParameterValidator.hasMismatches(neutral, translated)).isEqualTo(expected);
    }

    @Test
    void testEmptyValuesAreExcluded() {
        assertThat(StringFormatParameterValidator.hasMismatches("Hi", "")).isFalse();
        assertThat(StringFormatParameterValidator.hasMismatches("Hello {0}", null, "")).isFalse();
        assertThat(StringFormatParameterValidator.hasMismatches(Arrays.asList(null, "", null))).isFalse();
        assertThat(StringFormatParameterValidator.hasMismatches(List.of())).isFalse();
    }

    @Test
    void testMoreThanTwoValues() {
        assertThat(StringFormatParameterValidator.hasMismatches(List.of("{0}", "x {0}", "{0} y"))).isFalse();
        assertThat(StringFormatParameterValidator.hasMismatches(List.of("{0}", "x {0}", "{1} y"))).isTrue();
    }
}
