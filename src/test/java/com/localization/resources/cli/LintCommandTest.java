package com.localization.resources.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end tests of the lint command on bundles written to a temp directory.
 */
class LintCommandTest {

    @TempDir
    Path tempDir;

    private int run(String... args) {
        return new CommandLine(new LintCommand()).execute(args);
    }

    @Test
    void testCleanBundlesPass() throws IOException {
        Files.writeString(tempDir.resolve("messages.properties"), "greeting=Hello {0}\n");
        Files.writeString(tempDir.resolve("messages_de.properties"), "greeting=Hallo {0}\n");

        assertThat(run("-d", tempDir.toString(), "--fail-on-mismatch")).isZero();
    }

    @Test
    void testMismatchFailsOnlyWhenRequested() throws IOException {
        Files.writeString(tempDir.resolve("messages.properties"), "greeting=Hello {0}\n");
        Files.writeString(tempDir.resolve("messages_de.properties"), "greeting=Hallo\n");

        assertThat(run("-d", tempDir.toString())).isZero();
        assertThat(run("-d", tempDir.toString(), "--fail-on-mismatch")).isEqualTo(1);
        assertThat(run("-d", tempDir.toString(), "--fail-on-mismatch", "-q")).isEqualTo(1);
    }

    @Test
    void testUnknownBaseNameFails() throws IOException {
        Files.writeString(tempDir.resolve("messages.properties"), "greeting=Hello\n");

        assertThat(run("-d", tempDir.toString(), "-b", "errors")).isEqualTo(1);
    }

    @Test
    void testInvalidOptionsFail() {
        assertThat(run("-d", tempDir.resolve("missing").toString())).isEqualTo(1);
        assertThat(run()).isNotZero();
    }
}
