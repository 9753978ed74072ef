package com.specunit.core;

/**
 * One runnable unit of an example group.
 *
 * @param <T> the type of the group instance the body runs against
 */
public class Example<T> {
    private final String description;
    private final ExampleGroup<T> exampleGroup;
    private final Metadata metadata;
    private final ExampleBody<T> body;

    public Example(String description, ExampleGroup<T> exampleGroup, Metadata metadata, ExampleBody<T> body) {
        this.description = description;
        this.exampleGroup = exampleGroup;
        this.metadata = metadata;
        this.body = body;
    }

    public String description() {
        return description;
    }

    public ExampleGroup<T> exampleGroup() {
        return exampleGroup;
    }

    public Metadata metadata() {
        return metadata;
    }

    public String fullDescription() {
        return metadata.getString(MetadataKeys.FULL_DESCRIPTION);
    }

    /**
     * "file:line" of the example's definition, or null when unknown.
     */
    public String location() {
        return metadata.getString(MetadataKeys.LOCATION);
    }

    public void run(T instance) throws Throwable {
        body.run(instance);
    }

    @Override
    public String toString() {
        return fullDescription() != null ? fullDescription() : description;
    }
}
