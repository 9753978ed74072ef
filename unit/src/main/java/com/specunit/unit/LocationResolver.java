package com.specunit.unit;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Finds the declaration trace of a method or class name, searching the method resolution order.
 */
final class LocationResolver {

    private LocationResolver() {
    }

    /**
     * Method definitions anywhere in the resolution order win over a class declared under the same name.
     */
    static List<StackTraceElement> findCallerLines(MethodContainer container, String name) {
        List<MethodContainer> order = container.methodResolutionOrder();
        for (MethodContainer candidate : order) {
            List<StackTraceElement> lines = candidate.callerLines(name);
            if (!lines.isEmpty()) {
                return lines;
            }
        }
        for (MethodContainer candidate : order) {
            List<StackTraceElement> lines = candidate.declarationLines(name);
            if (!lines.isEmpty()) {
                return lines;
            }
        }
        return Collections.emptyList();
    }

    static Optional<SourceLocation> findDefinition(MethodContainer container, String name) {
        return findCallerLines(container, name).stream()
                .findFirst()
                .flatMap(SourceLocation::of);
    }
}
