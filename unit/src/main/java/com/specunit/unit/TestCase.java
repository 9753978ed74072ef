package com.specunit.unit;

import org.junit.jupiter.api.Assertions;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Base class of xUnit-style test classes. An instance is created for every example it runs.
 *
 * <p>Test classes are either Java subclasses whose public no-argument {@code test*} methods become
 * examples, or classes declared at run time:
 * <pre>
 * TestCaseClass calculator = TestCase.define("CalculatorTest");
 * calculator.def("setup", self -> self.set("calculator", new Calculator()));
 * calculator.def("test_adds", self -> self.assertEquals(4, self.&lt;Calculator&gt;get("calculator").add(2, 2)));
 * calculator.runAll(new BaseFormatter());
 * </pre>
 */
public class TestCase {
    private static final Set<String> LIFECYCLE_METHODS = Set.of("setup", "teardown");

    private final Map<String, Object> state = new HashMap<>();
    private final Deque<MethodDefinition> frames = new ArrayDeque<>();
    private TestCaseClass testClass;
    private boolean passed = true;

    public static TestCaseClass define() {
        return TestCaseClass.root().subclass();
    }

    public static TestCaseClass define(String name) {
        return TestCaseClass.root().subclass(name);
    }

    void bind(TestCaseClass type) {
        this.testClass = type;
    }

    /**
     * The class this instance runs examples for.
     */
    public TestCaseClass testClass() {
        if (testClass == null) {
            testClass = TestCaseClass.forClass(getClass());
        }
        return testClass;
    }

    // ==================== lifecycle ====================

    /**
     * Runs before each example. Calls the {@code setup} method declared on the test class, if any.
     */
    protected void setup() throws Throwable {
        dispatchLifecycle("setup");
    }

    /**
     * Runs after each example, whatever its outcome. Calls the declared {@code teardown} method, if any.
     */
    protected void teardown() throws Throwable {
        dispatchLifecycle("teardown");
    }

    /**
     * False once the running example has failed; teardown can read it.
     */
    public boolean passed() {
        return passed;
    }

    void exampleStarted() {
        passed = true;
        frames.clear();
    }

    void markFailed() {
        passed = false;
    }

    private void dispatchLifecycle(String methodName) throws Throwable {
        Optional<MethodDefinition> definition = testClass().resolveMethod(methodName);
        if (definition.isPresent()) {
            dispatch(definition.get());
        }
    }

    // ==================== state ====================

    public void set(String name, Object value) {
        state.put(name, value);
    }

    @SuppressWarnings("unchecked")
    public <V> V get(String name) {
        return (V) state.get(name);
    }

    public boolean has(String name) {
        return state.containsKey(name);
    }

    // ==================== method calls ====================

    /**
     * Call a method resolved on this instance's class, whatever its visibility.
     */
    public Object invoke(String methodName, Object... arguments) throws Throwable {
        MethodDefinition definition = testClass().resolveMethod(methodName)
                .orElseThrow(() -> new UndefinedMethodException(methodName, testClass()));
        return dispatch(definition, arguments);
    }

    /**
     * Call the next definition of the running method up the resolution order, like {@code super}.
     * Reaching the top of the hierarchy from {@code setup} or {@code teardown} is a no-op.
     */
    public Object invokeSuper(Object... arguments) throws Throwable {
        MethodDefinition current = frames.peek();
        if (current == null) {
            throw new IllegalStateException("invokeSuper called outside of a declared method");
        }
        Optional<MethodDefinition> next = testClass().resolveMethodAfter(current.owner(), current.name());
        if (next.isPresent()) {
            return dispatch(next.get(), arguments);
        }
        if (LIFECYCLE_METHODS.contains(current.name())) {
            return null;
        }
        throw new UndefinedMethodException(current.name(), "super of " + current);
    }

    Object dispatch(MethodDefinition definition, Object... arguments) throws Throwable {
        if (!definition.parameters().accepts(arguments.length)) {
            throw new IllegalArgumentException("wrong number of arguments (" + arguments.length + ") for "
                    + definition + " " + definition.parameters());
        }
        frames.push(definition);
        try {
            return definition.body().invoke(this, arguments);
        } finally {
            frames.pop();
        }
    }

    // ==================== assertions ====================

    public void flunk() {
        Assertions.fail("Flunked");
    }

    public void flunk(String message) {
        Assertions.fail(message);
    }

    public void assertTrue(boolean condition) {
        Assertions.assertTrue(condition);
    }

    public void assertTrue(boolean condition, String message) {
        Assertions.assertTrue(condition, message);
    }

    public void assertFalse(boolean condition) {
        Assertions.assertFalse(condition);
    }

    public void assertEquals(Object expected, Object actual) {
        Assertions.assertEquals(expected, actual);
    }

    public void assertEquals(Object expected, Object actual, String message) {
        Assertions.assertEquals(expected, actual, message);
    }

    public void assertNull(Object actual) {
        Assertions.assertNull(actual);
    }

    public void assertNotNull(Object actual) {
        Assertions.assertNotNull(actual);
    }

    @Override
    public String toString() {
        return "#<" + testClass() + ">";
    }
}
