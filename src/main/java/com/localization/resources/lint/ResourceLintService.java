package com.localization.resources.lint;

import com.localization.resources.model.CultureKey;
import com.localization.resources.model.ResourceEntity;
import com.localization.resources.model.ResourceTableEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Collects the per-culture errors of all entries into a {@link LintResult}.
 */
public class ResourceLintService {
    private static final Logger log = LoggerFactory.getLogger(ResourceLintService.class);

    public LintResult lint(List<ResourceEntity> entities) {
        LintResult.LintResultBuilder result = LintResult.builder()
                .entitiesChecked(entities.size());

        int entries = 0;
        int invariant = 0;
        int mismatched = 0;

        for (ResourceEntity entity : entities) {
            for (ResourceTableEntry entry : entity.getEntries()) {
                entries++;
                if (entry.isInvariant()) {
                    invariant++;
                    log.debug("Skipping invariant entry {}", entry);
                    continue;
                }
                if (entry.hasAnyStringFormatParameterMismatches()) {
                    mismatched++;
                }
                for (Map.Entry<CultureKey, String> error : entry.getErrors()) {
                    if (error.getValue() != null) {
                        result.finding(LintFinding.builder()
                                .baseName(entity.getBaseName())
                                .key(entry.getKey())
                                .culture(error.getKey())
                                .message(error.getValue())
                                .build());
                    }
                }
            }
        }

        return result
                .entriesChecked(entries)
                .invariantEntries(invariant)
                .entriesWithMismatches(mismatched)
                .build();
    }
}
