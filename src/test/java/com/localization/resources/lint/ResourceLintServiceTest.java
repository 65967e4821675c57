package com.localization.resources.lint;

import com.localization.resources.model.CultureKey;
import com.localization.resources.model.ResourceEntity;
import com.localization.resources.model.ResourceLanguage;
import com.localization.resources.model.ResourceTableConfig;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ResourceLintService.
 */
class ResourceLintServiceTest {

    private static final CultureKey GERMAN = CultureKey.parse("de");
    private static final CultureKey FRENCH = CultureKey.parse("fr");

    private final ResourceLintService service = new ResourceLintService();

    private ResourceEntity entity(ResourceTableConfig config) {
        ResourceLanguage neutral = new ResourceLanguage(CultureKey.NEUTRAL);
        ResourceLanguage german = new ResourceLanguage(GERMAN);
        ResourceLanguage french = new ResourceLanguage(FRENCH);

        neutral.setValue("count", "{0} files");
        german.setValue("count", "{0} Dateien");
        french.setValue("count", "fichiers");

        neutral.setValue("brand", "Acme {0}");
        neutral.setComment("brand", "@Invariant");
        german.setValue("brand", "Acme");

        neutral.setValue("title", "Title");
        german.setValue("title", "Titel {0}");
        french.setValue("title", "");

        Map<CultureKey, ResourceLanguage> languages = new LinkedHashMap<>();
        languages.put(CultureKey.NEUTRAL, neutral);
        languages.put(GERMAN, german);
        languages.put(FRENCH, french);
        return new ResourceEntity("App", "messages", languages, config);
    }

    @Test
    void testCollectsErrorsPerCulture() {
        LintResult result = service.lint(List.of(entity(null)));

        assertThat(result.getEntitiesChecked()).isEqualTo(1);
        assertThat(result.getEntriesChecked()).isEqualTo(3);
        assertThat(result.getInvariantEntries()).isEqualTo(1);
        assertThat(result.getEntriesWithMismatches()).isEqualTo(2);
        assertThat(result.hasFindings()).isTrue();
        assertThat(result.getFindings())
                .extracting(LintFinding::getKey, LintFinding::getCulture)
                .containsExactly(tuple("count", FRENCH), tuple("title", GERMAN));
        assertThat(result.getFindings())
                .extracting(LintFinding::getMessage)
                .containsOnly(ResourceTableConfig.DEFAULT_FORMAT_PARAMETER_MISMATCH_ERROR);
    }

    @Test
    void testConfiguredMessageIsReported() {
        ResourceTableConfig config = ResourceTableConfig.builder()
                .formatParameterMismatchError("placeholders differ")
                .build();

        LintResult result = service.lint(List.of(entity(config)));

        assertThat(result.getFindings()).extracting(LintFinding::getMessage).containsOnly("placeholders differ");
    }

    @Test
    void testNoEntities() {
        LintResult result = service.lint(List.of());

        assertThat(result.hasFindings()).isFalse();
        assertThat(result.getEntriesChecked()).isZero();
    }
}
