package com.localization.resources;

import com.localization.resources.cli.LintCommand;
import picocli.CommandLine;

/**
 * Main entry point for the resource lint tool.
 * Loads properties bundles into the resource table model and reports translations
 * whose format parameters differ from the neutral resource.
 */
public class ResourceLintApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new LintCommand())
                .execute(args);
        System.exit(exitCode);
    }
}
