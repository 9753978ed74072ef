package com.specunit.core;

@FunctionalInterface
public interface ExampleBody<T> {
    void run(T instance) throws Throwable;
}
