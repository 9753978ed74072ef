package com.specunit.unit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Creates test classes and adds each one to the configured world as it is declared.
 */
final class Registration {
    private static final Logger logger = LoggerFactory.getLogger(Registration.class);
    private static final Map<Class<?>, TestCaseClass> javaClasses = new HashMap<>();

    private Registration() {
    }

    static TestCaseClass defineSubclass(TestCaseClass parent, String name, Class<? extends TestCase> javaClass) {
        TestCaseClass created = new TestCaseClass(name, parent, javaClass, CallerTrace.capture());
        TestCaseClass.config().world().register(created);
        logger.debug("Declared test class {} < {} at {}", created, parent, created.location());
        return created;
    }

    static TestCaseClass forClass(Class<? extends TestCase> type) {
        if (type == TestCase.class) {
            return TestCaseClass.root();
        }
        TestCaseClass existing = javaClasses.get(type);
        if (existing != null) {
            return existing;
        }

        TestCaseClass parent = forClass(type.getSuperclass().asSubclass(TestCase.class));
        String name = type.getSimpleName().isEmpty() ? null : type.getSimpleName();
        TestCaseClass created = defineSubclass(parent, name, type);
        javaClasses.put(type, created);
        ReflectiveImporter.importClass(created, type);
        return created;
    }

    /**
     * The class followed by its superclasses, without the root.
     */
    static List<TestCaseClass> ancestors(TestCaseClass type) {
        List<TestCaseClass> ancestors = new ArrayList<>();
        for (TestCaseClass current = type; current != null && !current.isRoot(); current = current.superclass()) {
            ancestors.add(current);
        }
        return ancestors;
    }
}
