package com.specunit.unit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Method table shared by test classes and modules. Methods and examples can be added at any
 * time; every definition records the stack trace of its declaration.
 */
public abstract class MethodContainer {
    private static final Logger logger = LoggerFactory.getLogger(MethodContainer.class);
    private static final AtomicInteger exampleSequence = new AtomicInteger();

    private final String name;
    private final Map<String, MethodDefinition> methods = new LinkedHashMap<>();
    private final Map<String, MethodDefinition> declaredExamples = new LinkedHashMap<>();
    private final List<TestModule> includes = new ArrayList<>();
    private final Set<String> exampleAliases = new LinkedHashSet<>();
    private final Map<String, List<StackTraceElement>> callerLines = new HashMap<>();
    private final Map<String, List<StackTraceElement>> declarationLines = new HashMap<>();
    private final PendingInfo pendingInfo = new PendingInfo();

    protected MethodContainer(String name) {
        this.name = name;
    }

    /**
     * Null for anonymous classes and modules.
     */
    public String name() {
        return name;
    }

    public boolean isAnonymous() {
        return name == null;
    }

    /**
     * Containers searched for a method, nearest first.
     */
    public abstract List<MethodContainer> methodResolutionOrder();

    // ==================== methods ====================

    public void def(String methodName, TestBody body) {
        define(methodName, Visibility.PUBLIC, Parameters.none(), body.asMethodBody(), CallerTrace.capture());
    }

    public void def(String methodName, Parameters parameters, MethodBody body) {
        define(methodName, Visibility.PUBLIC, parameters, body, CallerTrace.capture());
    }

    public void protectedDef(String methodName, TestBody body) {
        define(methodName, Visibility.PROTECTED, Parameters.none(), body.asMethodBody(), CallerTrace.capture());
    }

    public void privateDef(String methodName, TestBody body) {
        define(methodName, Visibility.PRIVATE, Parameters.none(), body.asMethodBody(), CallerTrace.capture());
    }

    public void define(String methodName, Visibility visibility, Parameters parameters, MethodBody body) {
        define(methodName, visibility, parameters, body, CallerTrace.capture());
    }

    void define(String methodName, Visibility visibility, Parameters parameters, MethodBody body,
                List<StackTraceElement> trace) {
        Objects.requireNonNull(methodName, "methodName");
        Objects.requireNonNull(body, "body");
        MethodDefinition definition = new MethodDefinition(methodName, methodName, visibility, parameters, body,
                locationOf(trace), this, false, Collections.emptyMap());

        if (MethodDiscovery.isTestMethod(definition, TestCaseClass.config())) {
            definition = definition.withInfo(pendingInfo.consume());
        }
        methods.put(methodName, definition);
        callerLines.put(methodName, trace);
        logger.debug("Defined {} {} at {}", visibility.name().toLowerCase(), definition, definition.location());
    }

    public boolean hasOwnMethod(String methodName) {
        return methods.containsKey(methodName);
    }

    Optional<MethodDefinition> ownMethod(String methodName) {
        return Optional.ofNullable(methods.get(methodName));
    }

    Collection<MethodDefinition> ownMethods() {
        return Collections.unmodifiableCollection(methods.values());
    }

    // ==================== fluent examples ====================

    public void example(String description, TestBody body) {
        declareExample(description, body);
    }

    public void test(String description, TestBody body) {
        declareExample(description, body);
    }

    public void it(String description, TestBody body) {
        declareExample(description, body);
    }

    public void specify(String description, TestBody body) {
        declareExample(description, body);
    }

    /**
     * Make {@code alias} another entry point for {@link #declare}, here and in subclasses.
     */
    public void aliasExampleTo(String alias) {
        exampleAliases.add(Objects.requireNonNull(alias, "alias"));
    }

    /**
     * Declare an example through a named entry point: one of the configured aliases
     * ({@code example}, {@code test}, {@code it}, {@code specify}) or one registered with {@link #aliasExampleTo}.
     */
    public void declare(String entryPoint, String description, TestBody body) {
        if (!isExampleEntryPoint(entryPoint)) {
            throw new UndefinedMethodException(entryPoint, this);
        }
        declareExample(description, body);
    }

    public boolean isExampleEntryPoint(String entryPoint) {
        if (TestCaseClass.config().exampleAliases().contains(entryPoint)) {
            return true;
        }
        return methodResolutionOrder().stream()
                .anyMatch(container -> container.exampleAliases.contains(entryPoint));
    }

    private void declareExample(String description, TestBody body) {
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(body, "body");
        List<StackTraceElement> trace = CallerTrace.capture();
        String key = "example " + exampleSequence.incrementAndGet();

        MethodDefinition definition = new MethodDefinition(key, description, Visibility.PUBLIC, Parameters.none(),
                body.asMethodBody(), locationOf(trace), this, true, Collections.emptyMap())
                .withInfo(pendingInfo.consume());
        declaredExamples.put(key, definition);
        logger.debug("Declared example {} at {}", definition, definition.location());
    }

    Collection<MethodDefinition> ownDeclaredExamples() {
        return Collections.unmodifiableCollection(declaredExamples.values());
    }

    // ==================== modules ====================

    public void include(TestModule module) {
        Objects.requireNonNull(module, "module");
        if (module == this || module.methodResolutionOrder().contains(this)) {
            throw new IllegalArgumentException("cyclic include detected: " + module + " already includes " + this);
        }
        if (!includes.contains(module)) {
            includes.add(module);
        }
    }

    List<TestModule> includes() {
        return Collections.unmodifiableList(includes);
    }

    /**
     * This container followed by its modules, the most recently included first.
     */
    List<MethodContainer> ownResolutionOrder() {
        Set<MethodContainer> order = new LinkedHashSet<>();
        order.add(this);
        for (int i = includes.size() - 1; i >= 0; i--) {
            order.addAll(includes.get(i).methodResolutionOrder());
        }
        return new ArrayList<>(order);
    }

    // ==================== metadata and locations ====================

    /**
     * Stage metadata for the next test method or example declared here.
     */
    public void testInfo(Map<String, ?> info) {
        pendingInfo.stage(info);
    }

    boolean hasPendingInfo() {
        return pendingInfo.isStaged();
    }

    /**
     * The stack trace recorded when {@code name} was declared, searching ancestors; empty when not found.
     */
    public List<StackTraceElement> findCallerLines(String name) {
        return LocationResolver.findCallerLines(this, name);
    }

    public Optional<SourceLocation> findDefinition(String name) {
        return LocationResolver.findDefinition(this, name);
    }

    List<StackTraceElement> callerLines(String name) {
        return callerLines.getOrDefault(name, Collections.emptyList());
    }

    /**
     * The trace of the container's own declaration under {@code name}. Kept apart from method traces.
     */
    List<StackTraceElement> declarationLines(String name) {
        return declarationLines.getOrDefault(name, Collections.emptyList());
    }

    void recordDeclarationLines(String name, List<StackTraceElement> trace) {
        declarationLines.putIfAbsent(name, trace);
    }

    static SourceLocation locationOf(List<StackTraceElement> trace) {
        return trace.stream()
                .findFirst()
                .flatMap(SourceLocation::of)
                .orElse(null);
    }
}
