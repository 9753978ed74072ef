package com.specunit.unit;

import java.lang.reflect.Array;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Copies the methods of real Java classes and interfaces into method containers.
 * Each imported method is located at its first line in the class file, followed by the trace of the import.
 */
final class ReflectiveImporter {
    private static final Set<String> LIFECYCLE_METHODS = Set.of("setup", "teardown");

    // zero-argument overloads sort last so they win the name
    private static final Comparator<Method> DECLARATION_ORDER = Comparator
            .comparing(Method::getName)
            .thenComparing(Comparator.<Method>comparingInt(Method::getParameterCount).reversed());

    private ReflectiveImporter() {
    }

    static void importClass(TestCaseClass target, Class<? extends TestCase> type) {
        List<StackTraceElement> trace = CallerTrace.capture();
        for (Class<?> implemented : type.getInterfaces()) {
            target.include(TestModule.forInterface(implemented));
        }
        importMethods(target, type, method -> !LIFECYCLE_METHODS.contains(method.getName()), trace);
    }

    static TestModule importInterface(Class<?> type) {
        List<StackTraceElement> trace = CallerTrace.capture();
        TestModule module = new TestModule(type.getSimpleName());
        for (Class<?> parent : type.getInterfaces()) {
            module.include(TestModule.forInterface(parent));
        }
        importMethods(module, type, Method::isDefault, trace);
        return module;
    }

    private static void importMethods(MethodContainer target, Class<?> type, Predicate<Method> filter,
                                      List<StackTraceElement> trace) {
        List<Method> methods = Arrays.stream(type.getDeclaredMethods())
                .filter(method -> !Modifier.isStatic(method.getModifiers()))
                .filter(method -> !method.isSynthetic() && !method.isBridge())
                .filter(filter)
                .sorted(DECLARATION_ORDER)
                .collect(Collectors.toList());

        ClassFileLines lines = ClassFileLines.read(type);
        for (Method method : methods) {
            if (!Modifier.isPublic(method.getModifiers()) || !Modifier.isPublic(type.getModifiers())) {
                method.setAccessible(true);
            }
            List<StackTraceElement> definitionTrace = lines.definitionOf(method)
                    .map(frame -> startingAt(frame, trace))
                    .orElse(trace);
            target.define(method.getName(), visibilityOf(method), parametersOf(method),
                    (self, arguments) -> invoke(method, self, arguments), definitionTrace);
        }
    }

    private static List<StackTraceElement> startingAt(StackTraceElement frame, List<StackTraceElement> trace) {
        List<StackTraceElement> result = new ArrayList<>(trace.size() + 1);
        result.add(frame);
        result.addAll(trace);
        return result;
    }

    static Visibility visibilityOf(Method method) {
        int modifiers = method.getModifiers();
        if (Modifier.isPublic(modifiers)) {
            return Visibility.PUBLIC;
        }
        return Modifier.isProtected(modifiers) ? Visibility.PROTECTED : Visibility.PRIVATE;
    }

    static Parameters parametersOf(Method method) {
        int count = method.getParameterCount();
        return method.isVarArgs() ? Parameters.required(count - 1).withRest() : Parameters.required(count);
    }

    private static Object invoke(Method method, TestCase self, Object[] arguments) throws Throwable {
        try {
            return method.invoke(self, packArguments(method, arguments));
        } catch (InvocationTargetException e) {
            throw e.getCause();
        }
    }

    private static Object[] packArguments(Method method, Object[] arguments) {
        if (!method.isVarArgs()) {
            return arguments;
        }
        int fixed = method.getParameterCount() - 1;
        Class<?> componentType = method.getParameterTypes()[fixed].getComponentType();
        Object rest = Array.newInstance(componentType, arguments.length - fixed);
        for (int i = fixed; i < arguments.length; i++) {
            Array.set(rest, i - fixed, arguments[i]);
        }
        Object[] packed = Arrays.copyOf(arguments, fixed + 1);
        packed[fixed] = rest;
        return packed;
    }
}
