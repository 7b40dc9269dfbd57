package com.taskweave.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.taskweave.core.analysis.TaskAnalyzer;
import com.taskweave.core.config.OrchestratorProperties;
import com.taskweave.core.decomposition.TaskDecomposer;
import com.taskweave.core.graph.DependencyMapper;
import com.taskweave.core.planning.ExecutionPlanner;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the Taskweave CLI command structure.
 * These tests exercise picocli directly without Spring context.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    /**
     * picocli factory wiring commands to real planning components.
     */
    private CommandLine.IFactory createFactory() {
        var analyzer = new TaskAnalyzer();
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == AnalyzeCommand.class) {
                    return (K) new AnalyzeCommand(analyzer);
                }
                if (cls == PlanCommand.class) {
                    return (K) new PlanCommand(analyzer, new TaskDecomposer(), new DependencyMapper(),
                            new ExecutionPlanner(), new OrchestratorProperties(), MAPPER);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new TaskweaveCommand(), createFactory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists all subcommands")
        void helpListsSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("analyze"));
            assertTrue(result.output().contains("plan"));
            assertTrue(result.output().contains("help"));
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Taskweave 0.1.0"));
        }

        @Test
        @DisplayName("plan --help shows the --json option")
        void planHelp() {
            CliResult result = execute("plan", "--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("--json"));
        }

        @Test
        @DisplayName("no subcommand prints the banner and usage")
        void noSubcommand() {
            CliResult result = execute();
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("TASKWEAVE"));
            assertTrue(result.output().contains("Usage"));
        }
    }

    @Nested
    @DisplayName("analyze")
    class AnalyzeTests {

        @Test
        @DisplayName("prints complexity, domains and requirements")
        void analyze() {
            CliResult result = execute("analyze",
                    "Build a complete web application with authentication, database, and deployment");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Complexity: complex"));
            assertTrue(result.output().contains("devops"));
            assertTrue(result.output().contains("REQUIREMENTS:"));
        }

        @Test
        @DisplayName("missing description is a usage error")
        void missingDescription() {
            CliResult result = execute("analyze");
            assertNotEquals(0, result.exitCode());
        }
    }

    @Nested
    @DisplayName("plan")
    class PlanTests {

        @Test
        @DisplayName("prints subtasks, steps and the critical path")
        void plan() {
            CliResult result = execute("plan", "Build a REST API and test it");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("SUBTASKS:"));
            assertTrue(result.output().contains("task_1"));
            assertTrue(result.output().contains("STEP 1"));
            assertTrue(result.output().contains("CRITICAL PATH"));
        }

        @Test
        @DisplayName("--json renders a parseable plan document")
        void planJson() throws Exception {
            CliResult result = execute("plan", "--json", "Create a simple Python function");

            assertEquals(0, result.exitCode());
            var tree = MAPPER.readTree(result.output());
            assertEquals("simple", tree.get("analysis").get("complexity").asText().toLowerCase());
            assertEquals(1, tree.get("plan").get("totalSteps").asInt());
            assertEquals("task_0", tree.get("subtasks").get(0).get("id").asText());
        }
    }
}
