package com.specunit.core.formatters;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.specunit.core.Example;
import com.specunit.core.ExampleResult;
import com.specunit.core.MetadataKeys;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Renders collected results as a JSON report:
 * <pre>
 * {"examples": [{"description": .., "full_description": .., "location": .., "status": "passed", ...}],
 *  "summary": {"example_count": 2, "failure_count": 1, "error_count": 0}}
 * </pre>
 */
public class JsonFormatter extends BaseFormatter {
    private final ObjectMapper objectMapper;

    public JsonFormatter() {
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public ObjectNode toJson() {
        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode examples = root.putArray("examples");
        int failures = 0;
        int errors = 0;

        for (ExampleResult result : results()) {
            examples.add(toJson(result));
            if (result.status() == ExampleResult.Status.FAILED) {
                failures++;
            } else if (result.status() == ExampleResult.Status.ERRORED) {
                errors++;
            }
        }

        ObjectNode summary = root.putObject("summary");
        summary.put("example_count", results().size());
        summary.put("failure_count", failures);
        summary.put("error_count", errors);
        return root;
    }

    private ObjectNode toJson(ExampleResult result) {
        Example<?> example = result.example();
        ObjectNode node = objectMapper.createObjectNode();
        node.put(MetadataKeys.DESCRIPTION, example.description());
        node.put(MetadataKeys.FULL_DESCRIPTION, example.fullDescription());
        node.put(MetadataKeys.LOCATION, example.location());
        node.put("status", result.status().name().toLowerCase());
        node.put("run_time", result.duration().toNanos() / 1_000_000_000.0);

        if (result.failure() != null) {
            ObjectNode exception = node.putObject("exception");
            exception.put("class", result.failure().getClass().getName());
            exception.put("message", result.failure().getMessage());
        }
        return node;
    }

    public void write(Writer writer) throws IOException {
        objectMapper.writeValue(writer, toJson());
    }

    public void write(Path file) throws IOException {
        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
        objectMapper.writeValue(file.toFile(), toJson());
    }
}
