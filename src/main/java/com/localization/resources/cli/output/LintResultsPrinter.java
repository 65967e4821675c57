package com.localization.resources.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.localization.resources.cli.model.LintOptions;
import com.localization.resources.cli.model.ValidatedLintOptions;
import com.localization.resources.lint.LintFinding;
import com.localization.resources.lint.LintResult;

/**
 * Responsible only for printing CLI output for the "lint" command.
 * No validation, no execution, no prompting.
 */
public class LintResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(LintResultsPrinter.class);

    public void printBanner(LintOptions o, ValidatedLintOptions v) {
        log.info("=================================================");
        log.info("Resource Format Parameter Lint");
        log.info("=================================================");
        log.info("Resource Directory: {}", v.getNormalizedResourceDir());
        log.info("Base Name: {}", v.getBaseNameFilter() != null ? v.getBaseNameFilter() : "All");
        log.info("Invariant Marker: {}", v.getConfig().getInvariantMarker());
        log.info("Fail On Mismatch: {}", o.isFailOnMismatch());
        log.info("=================================================");
    }

    public void printResult(LintOptions o, LintResult result) {
        if (!o.isQuiet()) {
            for (LintFinding finding : result.getFindings()) {
                log.warn("{}:{} [{}] {}", finding.getBaseName(), finding.getKey(), finding.getCulture(), finding.getMessage());
            }
        }

        log.info("");
        log.info("=================================================");
        log.info(result.hasFindings() ? "LINT FOUND ISSUES" : "LINT PASSED");
        log.info("=================================================");
        log.info("Bundles Checked: {}", result.getEntitiesChecked());
        log.info("Keys Checked: {}", result.getEntriesChecked());
        log.info("Invariant Keys Skipped: {}", result.getInvariantEntries());
        log.info("Keys With Mismatches: {}", result.getEntriesWithMismatches());
        log.info("Findings: {}", result.getFindings().size());
        log.info("=================================================");
    }
}
