package com.localization.resources.cli.model;

import java.nio.file.Path;

import com.localization.resources.model.ResourceTableConfig;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps LintCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedLintOptions {
    Path normalizedResourceDir;
    String baseNameFilter;
    ResourceTableConfig config;
}
