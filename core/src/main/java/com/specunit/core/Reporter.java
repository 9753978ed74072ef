package com.specunit.core;

/**
 * Receives progress notifications while example groups run.
 */
public interface Reporter {
    Reporter NONE = new Reporter() {
    };

    default void exampleGroupStarted(ExampleGroup<?> group) {
    }

    default void exampleStarted(Example<?> example) {
    }

    default void exampleFinished(ExampleResult result) {
    }

    default void exampleGroupFinished(ExampleGroup<?> group) {
    }
}
