package com.specunit.unit;

import com.specunit.core.Example;
import com.specunit.core.Metadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns the test methods visible on a class into examples. Nothing is cached: methods added to
 * any ancestor or module show up on the next call.
 */
final class MethodDiscovery {
    private static final Logger logger = LoggerFactory.getLogger(MethodDiscovery.class);

    private MethodDiscovery() {
    }

    static List<Example<TestCase>> examples(TestCaseClass type) {
        List<Example<TestCase>> examples = new ArrayList<>();
        for (MethodDefinition definition : visibleDefinitions(type).values()) {
            if (isTestMethod(definition, TestCaseClass.config())) {
                examples.add(toExample(type, definition));
            }
        }
        logger.trace("Discovered {} examples on {}", examples.size(), type);
        return examples;
    }

    /**
     * Walks from the root-most container to the class itself. A name keeps the position where it
     * first appeared and the definition nearest the class.
     */
    static Map<String, MethodDefinition> visibleDefinitions(TestCaseClass type) {
        List<MethodContainer> order = type.methodResolutionOrder();
        Map<String, MethodDefinition> visible = new LinkedHashMap<>();
        for (int i = order.size() - 1; i >= 0; i--) {
            MethodContainer container = order.get(i);
            for (MethodDefinition definition : container.ownMethods()) {
                visible.put(definition.name(), definition);
            }
            for (MethodDefinition definition : container.ownDeclaredExamples()) {
                visible.put(definition.name(), definition);
            }
        }
        return visible;
    }

    static boolean isTestMethod(MethodDefinition definition, UnitConfig config) {
        if (definition.declaredExample()) {
            return true;
        }
        return config.isTestMethodName(definition.name())
                && definition.visibility() == Visibility.PUBLIC
                && definition.parameters().acceptsNoArguments();
    }

    private static Example<TestCase> toExample(TestCaseClass type, MethodDefinition definition) {
        SourceLocation location = definition.declaredExample()
                ? definition.location()
                : LocationResolver.findDefinition(type, definition.name()).orElse(definition.location());
        Metadata metadata = MetadataStore.exampleMetadata(type, definition, location);
        return new Example<>(definition.description(), type, metadata, instance -> instance.dispatch(definition));
    }
}
