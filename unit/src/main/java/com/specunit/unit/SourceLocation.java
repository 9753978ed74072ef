package com.specunit.unit;

import java.util.Optional;

/**
 * Where something was declared. {@code filePath} is relative to the source root,
 * e.g. {@code com/acme/CalculatorTest.java}.
 */
public record SourceLocation(String filePath, int lineNumber) {

    public static Optional<SourceLocation> of(StackTraceElement frame) {
        if (frame.getFileName() == null || frame.getLineNumber() < 0) {
            return Optional.empty();
        }
        String className = frame.getClassName();
        int lastDot = className.lastIndexOf('.');
        String filePath = lastDot < 0
                ? frame.getFileName()
                : className.substring(0, lastDot).replace('.', '/') + "/" + frame.getFileName();
        return Optional.of(new SourceLocation(filePath, frame.getLineNumber()));
    }

    @Override
    public String toString() {
        return filePath + ":" + lineNumber;
    }
}
