package com.specunit.unit;

import com.specunit.core.Metadata;
import com.specunit.core.MetadataKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

import static com.specunit.core.Metadata.metadata;
import static com.specunit.core.MetadataKeys.*;

/**
 * Builds the metadata records of test classes and their examples.
 */
final class MetadataStore {
    private static final Logger logger = LoggerFactory.getLogger(MetadataStore.class);

    private MetadataStore() {
    }

    /**
     * The class record, {@code {example_group: {...}}}. A subclass starts with its parent's user keys.
     */
    static Metadata groupMetadata(String description, SourceLocation location, Metadata parent) {
        Metadata group = new Metadata();
        group.put(DESCRIPTION, description);
        group.put(FULL_DESCRIPTION, description);
        putLocation(group, location);
        group.put(BLOCK, null);
        group.put(DESCRIBES, null);
        group.put(TEST_UNIT, true);

        if (parent != null) {
            parent.nested(EXAMPLE_GROUP).forEach((key, value) -> {
                if (!REQUIRED_GROUP_KEYS.contains(key)) {
                    group.put(key, value);
                }
            });
        }
        return metadata(EXAMPLE_GROUP, group);
    }

    static void mergeGroupInfo(Metadata group, Map<String, ?> info, Object owner) {
        info.forEach((key, value) -> {
            if (key == null) {
                throw new IllegalArgumentException("Metadata keys must not be null (" + owner + ")");
            }
            if (REQUIRED_GROUP_KEYS.contains(key)) {
                logger.warn("Ignoring test case info '{}' for {}: the key is computed", key, owner);
            } else {
                group.put(key, value);
            }
        });
    }

    /**
     * Required keys first, then the class's user keys, then the info staged for this definition.
     * The class record is copied, so later class changes do not alter this example.
     */
    static Metadata exampleMetadata(TestCaseClass type, MethodDefinition definition, SourceLocation location) {
        Metadata group = type.metadata().nested(EXAMPLE_GROUP).copy();

        Metadata example = new Metadata();
        example.put(DESCRIPTION, definition.description());
        example.put(FULL_DESCRIPTION, type.description() + "#" + definition.description());
        putLocation(example, location);
        example.put(EXAMPLE_GROUP, group);
        example.put(BEHAVIOUR, group);
        example.put(TEST_UNIT, true);

        group.forEach((key, value) -> {
            if (!REQUIRED_GROUP_KEYS.contains(key)) {
                example.putIfAbsent(key, value);
            }
        });
        definition.info().forEach((key, value) -> {
            if (MetadataKeys.REQUIRED_EXAMPLE_KEYS.contains(key)) {
                logger.debug("Ignoring test info '{}' for {}: the key is computed", key, definition);
            } else {
                example.put(key, value);
            }
        });
        return example;
    }

    private static void putLocation(Metadata metadata, SourceLocation location) {
        metadata.put(FILE_PATH, location != null ? location.filePath() : null);
        metadata.put(LINE_NUMBER, location != null ? location.lineNumber() : null);
        metadata.put(LOCATION, location != null ? location.toString() : null);
    }
}
