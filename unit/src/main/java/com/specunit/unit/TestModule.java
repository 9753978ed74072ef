package com.specunit.unit;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A set of methods mixed into test classes with {@link MethodContainer#include}.
 */
public class TestModule extends MethodContainer {
    private static final Map<Class<?>, TestModule> interfaceModules = new HashMap<>();

    public TestModule() {
        this(null);
    }

    public TestModule(String name) {
        super(name);
    }

    /**
     * The module made from the default methods of a Java interface, created on first use.
     */
    public static TestModule forInterface(Class<?> type) {
        if (!type.isInterface()) {
            throw new IllegalArgumentException(type.getName() + " is not an interface");
        }
        TestModule module = interfaceModules.get(type);
        if (module == null) {
            module = ReflectiveImporter.importInterface(type);
            interfaceModules.put(type, module);
        }
        return module;
    }

    @Override
    public List<MethodContainer> methodResolutionOrder() {
        return ownResolutionOrder();
    }

    @Override
    public String toString() {
        return isAnonymous() ? "<Anonymous TestModule>" : name();
    }
}
