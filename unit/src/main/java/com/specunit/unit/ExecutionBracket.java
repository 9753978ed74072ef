package com.specunit.unit;

import com.specunit.core.Example;
import com.specunit.core.ExampleResult;
import com.specunit.core.Hook;
import com.specunit.core.Reporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs examples one at a time as setup, before hooks, body, after hooks, teardown.
 * Teardown always runs; a failure is recorded on its example and the run goes on.
 */
final class ExecutionBracket {
    private static final Logger logger = LoggerFactory.getLogger(ExecutionBracket.class);

    private ExecutionBracket() {
    }

    static List<ExampleResult> runAll(TestCaseClass type, Reporter reporter) {
        Reporter target = reporter != null ? reporter : Reporter.NONE;
        List<Example<TestCase>> examples = type.examples();
        logger.debug("Running {} examples of {}", examples.size(), type);

        target.exampleGroupStarted(type);
        List<ExampleResult> results = new ArrayList<>();
        for (Example<TestCase> example : examples) {
            target.exampleStarted(example);
            ExampleResult result = run(type, example);
            results.add(result);
            target.exampleFinished(result);
        }
        target.exampleGroupFinished(type);
        return results;
    }

    static ExampleResult run(TestCaseClass type, Example<TestCase> example) {
        long started = System.nanoTime();
        TestCase instance;
        try {
            instance = type.newInstance();
        } catch (Throwable t) {
            rethrowIfFatal(t);
            logger.warn("Could not instantiate {} for {}", type.javaClass().getName(), example, t);
            return ExampleResult.failed(example, t, elapsedSince(started));
        }

        instance.exampleStarted();
        Throwable failure = null;
        try {
            instance.setup();
            failure = runHooksAndBody(type, example, instance);
        } catch (Throwable t) {
            rethrowIfFatal(t);
            failure = t;
        }
        if (failure != null) {
            instance.markFailed();
        }

        try {
            instance.teardown();
        } catch (Throwable t) {
            rethrowIfFatal(t);
            failure = combine(failure, t, example);
            instance.markFailed();
        }

        Duration duration = elapsedSince(started);
        if (failure == null) {
            logger.debug("{} passed", example);
            return ExampleResult.passed(example, duration);
        }
        logger.debug("{} failed: {}", example, failure.toString());
        return ExampleResult.failed(example, failure, duration);
    }

    private static Throwable runHooksAndBody(TestCaseClass type, Example<TestCase> example, TestCase instance) {
        Throwable failure = null;
        try {
            for (Hook<TestCase> hook : type.beforeHooks()) {
                hook.run(instance);
            }
            example.run(instance);
        } catch (Throwable t) {
            rethrowIfFatal(t);
            failure = t;
        }

        for (Hook<TestCase> hook : type.afterHooks()) {
            try {
                hook.run(instance);
            } catch (Throwable t) {
                rethrowIfFatal(t);
                failure = combine(failure, t, example);
            }
        }
        return failure;
    }

    /**
     * The first failure stays the cause of the result; later ones are attached to it.
     */
    private static Throwable combine(Throwable first, Throwable next, Example<TestCase> example) {
        if (first == null) {
            return next;
        }
        if (first != next) {
            logger.warn("Additional failure in {} after {}", example, first.toString(), next);
            first.addSuppressed(next);
        }
        return first;
    }

    private static void rethrowIfFatal(Throwable t) {
        if (t instanceof VirtualMachineError) {
            throw (VirtualMachineError) t;
        }
    }

    private static Duration elapsedSince(long started) {
        return Duration.ofNanos(System.nanoTime() - started);
    }
}
