package com.specunit.unit;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A method (or fluently declared example) recorded on a test class or module.
 *
 * @param name             the method name; fluently declared examples get a generated name
 * @param description      what the resulting example is called
 * @param owner            the class or module the definition was made on
 * @param declaredExample  true when made through {@code example}/{@code test}/{@code it} or an alias
 * @param info             metadata staged with {@code testInfo} and consumed by this definition
 */
public record MethodDefinition(
        String name,
        String description,
        Visibility visibility,
        Parameters parameters,
        MethodBody body,
        SourceLocation location,
        MethodContainer owner,
        boolean declaredExample,
        Map<String, Object> info
) {
    public MethodDefinition withInfo(Map<String, Object> info) {
        return new MethodDefinition(name, description, visibility, parameters, body, location, owner,
                declaredExample, Collections.unmodifiableMap(new LinkedHashMap<>(info)));
    }

    @Override
    public String toString() {
        return owner + "#" + description;
    }
}
