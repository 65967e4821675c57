package com.localization.resources.model;

import com.localization.resources.exception.CultureNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ResourceTableValues.
 */
class ResourceTableValuesTest {

    private static final CultureKey GERMAN = CultureKey.parse("de");
    private static final CultureKey ITALIAN = CultureKey.parse("it");

    private final Map<CultureKey, ResourceLanguage> languages = new LinkedHashMap<>();
    private ResourceTableValues<String> values;
    private final List<CultureKey> changes = new ArrayList<>();

    @BeforeEach
    void setUp() {
        ResourceLanguage neutral = new ResourceLanguage(CultureKey.NEUTRAL);
        ResourceLanguage german = new ResourceLanguage(GERMAN);
        neutral.setValue("Save", "Save");
        german.setValue("Save", "Speichern");
        languages.put(CultureKey.NEUTRAL, neutral);
        languages.put(GERMAN, german);

        values = new ResourceTableValues<>(languages,
                language -> language.getValue("Save"),
                (language, value) -> language.setValue("Save", value));
        values.addValueChangedListener((source, culture) -> changes.add(culture));
    }

    @Test
    void testGetDelegatesToGetter() {
        assertThat(values.get(CultureKey.NEUTRAL)).isEqualTo("Save");
        assertThat(values.get(GERMAN)).isEqualTo("Speichern");
    }

    @Test
    void testUnknownCultureIsRejected() {
        assertThatThrownBy(() -> values.get(ITALIAN))
                .isInstanceOf(CultureNotFoundException.class)
                .hasMessageContaining("it");
        assertThatThrownBy(() -> values.set(ITALIAN, "Salva"))
                .isInstanceOf(CultureNotFoundException.class);
        assertThat(changes).isEmpty();
    }

    @Test
    void testSetNotifiesOncePerChange() {
        assertThat(values.set(GERMAN, "Sichern")).isTrue();

        assertThat(changes).containsExactly(GERMAN);
        assertThat(values.get(GERMAN)).isEqualTo("Sichern");
    }

    @Test
    void testSetWithoutChangeDoesNotNotify() {
        assertThat(values.set(GERMAN, "Speichern")).isFalse();

        assertThat(changes).isEmpty();
    }

    @Test
    void testRemovedListenerIsNotCalled() {
        ValueChangedListener listener = (source, culture) -> fail("removed listener called");
        values.addValueChangedListener(listener);
        values.removeValueChangedListener(listener);

        values.set(GERMAN, "Sichern");

        assertThat(changes).hasSize(1);
    }

    @Test
    void testIterationFollowsCultureOrder() {
        assertThat(values.getCultures()).containsExactly(CultureKey.NEUTRAL, GERMAN);
        assertThat(values.stream().map(Map.Entry::getValue)).containsExactly("Save", "Speichern");
        assertThat(values.asMap()).containsExactly(
                entry(CultureKey.NEUTRAL, "Save"),
                entry(GERMAN, "Speichern"));
        assertThat(values.size()).isEqualTo(2);
    }

    @Test
    void testCultureSetIsFixedAtConstruction() {
        languages.put(ITALIAN, new ResourceLanguage(ITALIAN));

        assertThat(values.containsCulture(ITALIAN)).isFalse();
        assertThat(values.getCultures()).hasSize(2);
    }
}
