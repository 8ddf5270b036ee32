package com.cljformatter.cli;

import com.cljformatter.util.LoggerUtil;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FormatterCliTest {

    @TempDir
    Path dir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private String configOption;

    @BeforeEach
    void writeConfig() throws IOException {
        Path config = dir.resolve("config.yml");
        Files.writeString(config, "general:\n  threads: 1\n  ignoreFiles: []\n");
        configOption = "--config=" + config;
    }

    private int run(String... args) {
        FormatterCli cli = new FormatterCli(
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
        return cli.run(args);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    void inputFileIsPrintedFormatted() throws IOException {
        Path input = Files.writeString(dir.resolve("in.clj"), "(def x 1)");
        assertEquals(FormatterCli.EXIT_OK, run("-i", input.toString()));
        assertEquals("(def x\n  1)\n", stdout());
    }

    @Test
    void outputFileReceivesFormattedText() throws IOException {
        Path input = Files.writeString(dir.resolve("in.clj"), "(def x 1)");
        Path output = dir.resolve("out.clj");
        assertEquals(FormatterCli.EXIT_OK, run("--input", input.toString(), "-o", output.toString()));
        assertEquals("(def x\n  1)\n", Files.readString(output));
        assertEquals("", stdout());
    }

    @Test
    void missingInputIsUsageError() {
        assertEquals(FormatterCli.EXIT_USAGE, run("-i", dir.resolve("absent.clj").toString()));
        assertTrue(stderr().contains("does not exist"), stderr());
        assertEquals(FormatterCli.EXIT_USAGE, run("-i"));
    }

    @Test
    void unreadableInputFails() throws IOException {
        Path input = Files.writeString(dir.resolve("in.clj"), "(def x\n  ]");
        assertEquals(FormatterCli.EXIT_FAILURE, run("-i", input.toString()));
        assertTrue(stderr().contains("Syntax error"), stderr());
        assertEquals("", stdout());
    }

    @Test
    void checkFailsOnFilesNeedingFormatting() throws IOException {
        Path file = Files.writeString(dir.resolve("a.clj"), "(def x 1)");
        assertEquals(FormatterCli.EXIT_FAILURE, run("check", dir.toString(), configOption, "--no-color"));
        assertTrue(stdout().contains("File needs formatting: " + file), stdout());
        assertEquals("(def x 1)", Files.readString(file));
    }

    @Test
    void checkPassesOnCanonicalFiles() throws IOException {
        Files.writeString(dir.resolve("a.clj"), "(def x\n  1)\n");
        assertEquals(FormatterCli.EXIT_OK, run("check", dir.toString(), configOption));
    }

    @Test
    void formatRewritesFilesThenCheckPasses() throws IOException {
        Path file = Files.writeString(dir.resolve("a.clj"), "(def x 1)");
        assertEquals(FormatterCli.EXIT_OK, run("format", dir.toString(), configOption, "--threads=2"));
        assertEquals("(def x\n  1)\n", Files.readString(file));
        assertEquals(FormatterCli.EXIT_OK, run("check", file.toString(), configOption));
    }

    @Test
    void formatReportsFilesWithErrors() throws IOException {
        Files.writeString(dir.resolve("broken.clj"), "(def x");
        assertEquals(FormatterCli.EXIT_FAILURE, run("format", dir.toString(), configOption, "--no-color"));
        assertTrue(stderr().contains("Failed to format"), stderr());
        assertEquals("(def x", Files.readString(dir.resolve("broken.clj")));
    }

    @Test
    void missingPathIsUsageError() {
        assertEquals(FormatterCli.EXIT_USAGE, run("format"));
        assertEquals(FormatterCli.EXIT_USAGE, run("check", dir.resolve("absent").toString()));
    }

    @Test
    void initWritesConfigurationOnce() throws IOException {
        Path config = dir.resolve("generated.yml");
        assertEquals(FormatterCli.EXIT_OK, run("init", "--config=" + config));
        assertTrue(Files.readString(config).contains("extensions"));
        assertEquals(FormatterCli.EXIT_FAILURE, run("init", "--config=" + config));
        assertEquals(FormatterCli.EXIT_OK, run("init", "--force", "--config=" + config));
    }

    @Test
    void logFileReceivesEngineDetails() throws IOException {
        Path input = Files.writeString(dir.resolve("in.clj"), "(def x 1)");
        Path log = dir.resolve("run.log");
        try {
            assertEquals(FormatterCli.EXIT_OK, run("-i", input.toString(), "--log-file=" + log));
        } finally {
            LoggerUtil.shutdown();
        }
        assertTrue(Files.readString(log).contains("Rendering 1 top-level items"));
    }

    @Test
    void versionAndHelp() {
        assertEquals(FormatterCli.EXIT_OK, run("--version"));
        assertTrue(stdout().contains("clj-sculptor version 1.0.0"));
        assertEquals(FormatterCli.EXIT_OK, run("--help", "--no-color"));
        assertTrue(stdout().contains("Usage:"));
    }

    @Test
    void unknownCommandIsUsageError() {
        assertEquals(FormatterCli.EXIT_USAGE, run("frobnicate"));
        assertTrue(stderr().contains("Unknown command: frobnicate"), stderr());
        assertEquals(FormatterCli.EXIT_USAGE, run());
    }
}
