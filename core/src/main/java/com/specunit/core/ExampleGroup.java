package com.specunit.core;

import java.util.List;

/**
 * A holder of examples, hooks and metadata as seen by the runner.
 *
 * @param <T> the type of instance each example runs against
 */
public interface ExampleGroup<T> {
    String description();

    Metadata metadata();

    List<Example<T>> examples();

    /**
     * Hooks to run before each example, outermost group first.
     */
    List<Hook<T>> beforeHooks();

    /**
     * Hooks to run after each example, innermost group first.
     */
    List<Hook<T>> afterHooks();

    List<? extends ExampleGroup<T>> ancestors();

    List<ExampleResult> runAll(Reporter reporter);

    default List<ExampleResult> runAll() {
        return runAll(Reporter.NONE);
    }
}
