package com.specunit.unit;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Captures the stack at a declaration, starting at the first frame outside the adapter.
 */
final class CallerTrace {
    private static final StackWalker walker = StackWalker.getInstance(StackWalker.Option.RETAIN_CLASS_REFERENCE);

    private static final Set<Class<?>> ADAPTER_CLASSES = Set.of(
            CallerTrace.class,
            MethodContainer.class,
            TestCaseClass.class,
            TestModule.class,
            TestCase.class,
            Registration.class,
            ReflectiveImporter.class
    );

    private CallerTrace() {
    }

    static List<StackTraceElement> capture() {
        return walker.walk(frames -> frames
                .dropWhile(CallerTrace::isAdapterFrame)
                .map(StackWalker.StackFrame::toStackTraceElement)
                .collect(Collectors.toList()));
    }

    private static boolean isAdapterFrame(StackWalker.StackFrame frame) {
        return ADAPTER_CLASSES.contains(frame.getDeclaringClass().getNestHost());
    }
}
