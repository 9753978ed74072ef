package com.specunit.core;

import java.time.Duration;

/**
 * The outcome of running one example.
 */
public record ExampleResult(
        Example<?> example,
        Status status,
        Throwable failure,
        Duration duration
) {
    public enum Status {
        PASSED,
        FAILED,
        ERRORED
    }

    public static ExampleResult passed(Example<?> example, Duration duration) {
        return new ExampleResult(example, Status.PASSED, null, duration);
    }

    /**
     * Assertion errors count as failures, anything else as an error.
     */
    public static ExampleResult failed(Example<?> example, Throwable failure, Duration duration) {
        Status status = failure instanceof AssertionError ? Status.FAILED : Status.ERRORED;
        return new ExampleResult(example, status, failure, duration);
    }

    public boolean isPassed() {
        return status == Status.PASSED;
    }
}
