package com.localization.resources.lint;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.List;

/**
 * Result of checking a set of resource entities.
 */
@Data
@Builder
public class LintResult {
    private int entitiesChecked;
    private int entriesChecked;
    private int invariantEntries;
    private int entriesWithMismatches;

    @Singular
    private List<LintFinding> findings;

    public boolean hasFindings() {
        return findings != null && !findings.isEmpty();
    }
}
