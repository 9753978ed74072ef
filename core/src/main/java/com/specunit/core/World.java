package com.specunit.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Registry of every example group declared in this process, in declaration order.
 * Not thread safe: a runner using several workers gives each worker its own world.
 */
public class World {
    private static final Logger logger = LoggerFactory.getLogger(World.class);
    private static final World GLOBAL = new World();

    private final List<ExampleGroup<?>> exampleGroups = new ArrayList<>();

    public static World global() {
        return GLOBAL;
    }

    public void register(ExampleGroup<?> group) {
        exampleGroups.add(group);
        logger.debug("Registered example group {} ({} total)", group.description(), exampleGroups.size());
    }

    public List<ExampleGroup<?>> exampleGroups() {
        return Collections.unmodifiableList(exampleGroups);
    }

    public void reset() {
        exampleGroups.clear();
    }
}
