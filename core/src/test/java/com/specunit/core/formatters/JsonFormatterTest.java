package com.specunit.core.formatters;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.specunit.core.Example;
import com.specunit.core.ExampleResult;
import com.specunit.core.Metadata;
import com.specunit.core.MetadataKeys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.StringWriter;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class JsonFormatterTest {
    private final ObjectMapper objectMapper = new ObjectMapper();
    private JsonFormatter formatter;

    @BeforeEach
    void setUp() {
        formatter = new JsonFormatter();
    }

    private static Example<Object> example(String description, int line) {
        Metadata metadata = Metadata.metadata(
                MetadataKeys.DESCRIPTION, description,
                MetadataKeys.FULL_DESCRIPTION, "CalculatorTest#" + description,
                MetadataKeys.LOCATION, "com/example/CalculatorTest.java:" + line);
        return new Example<>(description, null, metadata, instance -> { });
    }

    @Test
    void describesEveryExample() throws Exception {
        formatter.exampleFinished(ExampleResult.passed(example("test_adds", 10), Duration.ofMillis(1500)));

        StringWriter out = new StringWriter();
        formatter.write(out);
        JsonNode example = objectMapper.readTree(out.toString()).get("examples").get(0);

        assertEquals("test_adds", example.get("description").asText());
        assertEquals("CalculatorTest#test_adds", example.get("full_description").asText());
        assertEquals("com/example/CalculatorTest.java:10", example.get("location").asText());
        assertEquals("passed", example.get("status").asText());
        assertEquals(1.5, example.get("run_time").asDouble(), 0.0001);
        assertFalse(example.has("exception"));
    }

    @Test
    void reportsTheExceptionOfFailedExamples() {
        formatter.exampleFinished(ExampleResult.failed(example("test_divides", 20),
                new ArithmeticException("/ by zero"), Duration.ZERO));

        JsonNode example = formatter.toJson().get("examples").get(0);

        assertEquals("errored", example.get("status").asText());
        assertEquals("java.lang.ArithmeticException", example.get("exception").get("class").asText());
        assertEquals("/ by zero", example.get("exception").get("message").asText());
    }

    @Test
    void summarisesCounts() {
        formatter.exampleFinished(ExampleResult.passed(example("a", 1), Duration.ZERO));
        formatter.exampleFinished(ExampleResult.failed(example("b", 2), new AssertionError("no"), Duration.ZERO));
        formatter.exampleFinished(ExampleResult.failed(example("c", 3), new IllegalStateException(), Duration.ZERO));

        JsonNode summary = formatter.toJson().get("summary");

        assertEquals(3, summary.get("example_count").asInt());
        assertEquals(1, summary.get("failure_count").asInt());
        assertEquals(1, summary.get("error_count").asInt());
    }

    @Test
    void writesReportFiles(@TempDir Path dir) throws Exception {
        formatter.exampleFinished(ExampleResult.passed(example("a", 1), Duration.ZERO));
        Path report = dir.resolve("reports").resolve("examples.json");

        formatter.write(report);

        JsonNode written = objectMapper.readTree(report.toFile());
        assertEquals(1, written.get("summary").get("example_count").asInt());
    }
}
