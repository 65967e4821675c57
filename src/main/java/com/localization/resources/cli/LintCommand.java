package com.localization.resources.cli;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.localization.resources.cli.exception.OptionsValidationException;
import com.localization.resources.cli.model.LintOptions;
import com.localization.resources.cli.model.ValidatedLintOptions;
import com.localization.resources.cli.output.LintResultsPrinter;
import com.localization.resources.cli.validation.LintOptionsValidator;
import com.localization.resources.lint.LintResult;
import com.localization.resources.lint.ResourceLintService;
import com.localization.resources.loader.PropertiesBundleLoader;
import com.localization.resources.model.ResourceEntity;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command that checks resource bundles for format parameter mismatches between cultures.
 */
@Command(
        name = "lint",
        mixinStandardHelpOptions = true,
        version = "resource-table-model 1.0.0",
        description = "Checks that every translation uses the same {N} format parameters as the neutral resource."
)
public class LintCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(LintCommand.class);

    @Mixin
    private LintOptions options = new LintOptions();

    private final LintOptionsValidator validator = new LintOptionsValidator();
    private final LintResultsPrinter printer = new LintResultsPrinter();
    private final ResourceLintService lintService = new ResourceLintService();

    @Override
    public Integer call() {
        ValidatedLintOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error("{}", error));
            return 1;
        }

        printer.printBanner(options, validated);

        try {
            PropertiesBundleLoader loader = new PropertiesBundleLoader(validated.getConfig());
            List<ResourceEntity> entities = loader.load(validated.getNormalizedResourceDir(), validated.getBaseNameFilter());

            if (validated.getBaseNameFilter() != null && entities.isEmpty()) {
                log.error("No bundle with base name '{}' in {}", validated.getBaseNameFilter(), validated.getNormalizedResourceDir());
                return 1;
            }

            LintResult result = lintService.lint(entities);
            printer.printResult(options, result);

            return options.isFailOnMismatch() && result.hasFindings() ? 1 : 0;

        } catch (IOException e) {
            log.error("Failed to read resource bundles from {}", validated.getNormalizedResourceDir(), e);
            return 1;
        } catch (Exception e) {
            log.error("Lint failed with exception", e);
            return 1;
        }
    }
}
