package com.specunit.core.formatters;

import com.specunit.core.ExampleGroup;
import com.specunit.core.ExampleResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes one log line per finished example.
 */
public class LoggingFormatter extends BaseFormatter {
    private static final Logger logger = LoggerFactory.getLogger(LoggingFormatter.class);

    @Override
    public void exampleGroupStarted(ExampleGroup<?> group) {
        logger.info("Running {}", group.description());
    }

    @Override
    public void exampleFinished(ExampleResult result) {
        super.exampleFinished(result);
        switch (result.status()) {
            case PASSED:
                logger.info("PASSED {} ({} ms)", result.example(), result.duration().toMillis());
                break;
            case FAILED:
                logger.warn("FAILED {} at {}: {}", result.example(), result.example().location(),
                        result.failure().getMessage());
                break;
            default:
                logger.error("ERRORED {} at {}", result.example(), result.example().location(), result.failure());
        }
    }

    @Override
    public void exampleGroupFinished(ExampleGroup<?> group) {
        logger.info("Finished {}: {} examples, {} failures",
                group.description(), results().size(), failedExamples().size());
    }
}
