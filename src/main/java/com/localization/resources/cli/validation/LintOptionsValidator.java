package com.localization.resources.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.localization.resources.cli.exception.OptionsValidationException;
import com.localization.resources.cli.model.LintOptions;
import com.localization.resources.cli.model.ValidatedLintOptions;
import com.localization.resources.model.ResourceTableConfig;

public class LintOptionsValidator {

	public ValidatedLintOptions validate(LintOptions o) {
		List<String> errors = new ArrayList<>();

		if (o.getResourceDir() == null) {
			errors.add("Resource directory is required (--resource-dir / -d).");
		} else if (!existsDirectory(o.getResourceDir())) {
			errors.add("Resource directory does not exist or is not a directory: " + o.getResourceDir());
		}

		if (o.getBaseName() != null && isBlank(o.getBaseName())) {
			errors.add("Base name must not be blank when given (--base-name / -b).");
		}

		if (isBlank(o.getInvariantMarker())) {
			errors.add("Invariant marker must not be blank (--invariant-marker).");
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		Path normalizedResourceDir = o.getResourceDir().toAbsolutePath().normalize();

		ResourceTableConfig config = ResourceTableConfig.builder()
				.invariantMarker(o.getInvariantMarker().trim())
				.build();

		String baseNameFilter = o.getBaseName() == null ? null : o.getBaseName().trim();

		return new ValidatedLintOptions(normalizedResourceDir, baseNameFilter, config);
	}

	private static boolean existsDirectory(Path p) {
		return p != null && Files.exists(p) && Files.isDirectory(p);
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
