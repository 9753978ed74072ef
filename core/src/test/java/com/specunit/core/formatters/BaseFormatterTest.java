package com.specunit.core.formatters;

import com.specunit.core.Example;
import com.specunit.core.ExampleResult;
import com.specunit.core.Metadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BaseFormatterTest {
    private BaseFormatter formatter;
    private Example<Object> passing;
    private Example<Object> failing;
    private Example<Object> erroring;

    @BeforeEach
    void setUp() {
        formatter = new BaseFormatter();
        passing = example("passes");
        failing = example("fails");
        erroring = example("errors");
    }

    private static Example<Object> example(String description) {
        return new Example<>(description, null, new Metadata(), instance -> { });
    }

    @Test
    void collectsResultsInOrder() {
        formatter.exampleFinished(ExampleResult.passed(passing, Duration.ZERO));
        formatter.exampleFinished(ExampleResult.failed(failing, new AssertionError(), Duration.ZERO));

        assertEquals(List.of(passing, failing), formatter.examples());
        assertEquals(2, formatter.results().size());
    }

    @Test
    void errorsCountAsFailedExamples() {
        formatter.exampleFinished(ExampleResult.passed(passing, Duration.ZERO));
        formatter.exampleFinished(ExampleResult.failed(failing, new AssertionError(), Duration.ZERO));
        formatter.exampleFinished(ExampleResult.failed(erroring, new RuntimeException(), Duration.ZERO));

        assertEquals(List.of(failing, erroring), formatter.failedExamples());
        assertEquals(List.of(passing), formatter.passedExamples());
    }

    @Test
    void resultsAreReadOnly() {
        assertThrows(UnsupportedOperationException.class,
                () -> formatter.results().add(ExampleResult.passed(passing, Duration.ZERO)));
    }
}
