package com.specunit.core;

import java.util.List;
import java.util.Set;

public final class MetadataKeys {
    public static final String DESCRIPTION = "description";
    public static final String FULL_DESCRIPTION = "full_description";
    public static final String FILE_PATH = "file_path";
    public static final String LINE_NUMBER = "line_number";
    public static final String LOCATION = "location";
    public static final String EXAMPLE_GROUP = "example_group";
    public static final String BEHAVIOUR = "behaviour";
    public static final String TEST_UNIT = "test_unit";
    public static final String BLOCK = "block";
    public static final String DESCRIBES = "describes";

    /**
     * Keys computed for every example; user supplied metadata never replaces them.
     */
    public static final Set<String> REQUIRED_EXAMPLE_KEYS = Set.of(
            DESCRIPTION, FULL_DESCRIPTION, FILE_PATH, LINE_NUMBER, LOCATION, EXAMPLE_GROUP, BEHAVIOUR, TEST_UNIT);

    /**
     * Keys computed for every example group, in the order they are written.
     */
    public static final List<String> REQUIRED_GROUP_KEYS = List.of(
            DESCRIPTION, FULL_DESCRIPTION, FILE_PATH, LINE_NUMBER, LOCATION, BLOCK, DESCRIBES, TEST_UNIT);

    private MetadataKeys() {
    }
}
