package com.specunit.unit;

/**
 * The implementation of a method declared on a test class or module.
 */
@FunctionalInterface
public interface MethodBody {
    Object invoke(TestCase self, Object[] arguments) throws Throwable;
}
