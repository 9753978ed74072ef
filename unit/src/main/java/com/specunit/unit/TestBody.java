package com.specunit.unit;

/**
 * A method or example body that takes no arguments.
 */
@FunctionalInterface
public interface TestBody {
    void run(TestCase self) throws Throwable;

    default MethodBody asMethodBody() {
        return (self, arguments) -> {
            run(self);
            return null;
        };
    }
}
