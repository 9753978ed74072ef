package com.specunit.core.formatters;

import com.specunit.core.Example;
import com.specunit.core.ExampleResult;
import com.specunit.core.Reporter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the result of every example it is told about.
 */
public class BaseFormatter implements Reporter {
    private final List<ExampleResult> results = new ArrayList<>();

    @Override
    public void exampleFinished(ExampleResult result) {
        results.add(result);
    }

    public List<ExampleResult> results() {
        return Collections.unmodifiableList(results);
    }

    public List<Example<?>> examples() {
        return results.stream()
                .map(ExampleResult::example)
                .collect(Collectors.toList());
    }

    public List<Example<?>> failedExamples() {
        return results.stream()
                .filter(result -> !result.isPassed())
                .map(ExampleResult::example)
                .collect(Collectors.toList());
    }

    public List<Example<?>> passedExamples() {
        return results.stream()
                .filter(ExampleResult::isPassed)
                .map(ExampleResult::example)
                .collect(Collectors.toList());
    }
}
