package edu.purdue.dsnl.procsim;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    private static final String HEADER = "completed\tdropped\tmean\tp50\tp90\tp99\tmonitorDepth";

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();

    private PrintStream originalOut;

    @BeforeEach
    void captureStdout() {
        originalOut = System.out;
        System.setOut(new PrintStream(stdout, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreStdout() {
        System.setOut(originalOut);
    }

    private int run(String... args) {
        return new CommandLine(new Main()).execute(args);
    }

    /** Fields of the line following the summary header. */
    private String[] summaryFields() {
        var lines = Arrays.asList(stdout.toString(StandardCharsets.UTF_8).split("\\R"));
        int header = lines.indexOf(HEADER);
        assertTrue(header >= 0, "no summary header in output");
        assertTrue(header + 1 < lines.size(), "no summary line after header");
        return lines.get(header + 1).split("\t");
    }

    @ParameterizedTest
    @EnumSource(ProcessorType.class)
    @DisplayName("Should run every standalone processor type")
    void shouldRunSingleSetup(ProcessorType type) {
        assertEquals(0, run("single", "-p", type.name(), "--lambda", "0.05", "--mu", "0.1",
                "-d", "2000", "--workers", "2", "--limit", "2", "--quantum", "3", "--color-ratio", "0.3",
                "--monitor-interval", "100"));

        var fields = summaryFields();
        assertEquals(7, fields.length);
        assertTrue(Integer.parseInt(fields[0]) > 0);
        assertEquals("0", fields[1]);
    }

    @Test
    @DisplayName("Should write the request log of the bounded pipeline")
    void shouldRunBoundedSetup(@TempDir Path dir) throws IOException {
        var log = dir.resolve("bounded.csv");

        assertEquals(0, run("bounded", "--buf-size", "2", "--lambda", "0.2", "--mu", "0.5", "-d", "500",
                "--log", log.toString()));

        var lines = Files.readAllLines(log);
        assertTrue(lines.size() > 1);
        assertTrue(lines.get(0).startsWith("requestId"));
        assertEquals(7, summaryFields().length);
    }

    @Test
    @DisplayName("Should fail on an invalid quantum")
    void shouldFailOnBadQuantum() {
        assertNotEquals(0, run("single", "-p", "TS", "--quantum", "0", "-d", "100"));
    }

    @Test
    @DisplayName("Should fail on an unknown processor type")
    void shouldFailOnUnknownType() {
        assertNotEquals(0, run("single", "-p", "FIFO"));
    }
}
