package com.specunit.core;

/**
 * A before or after callback run around each example of a group.
 */
@FunctionalInterface
public interface Hook<T> {
    void run(T instance) throws Throwable;
}
