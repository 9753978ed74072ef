package com.specunit.unit;

import com.specunit.core.World;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings shared by every test class.
 *
 * @param testPrefixes         method names starting with one of these are test methods
 * @param anonymousDescription description given to classes declared without a name
 * @param exampleAliases       entry points accepted by {@link MethodContainer#declare}
 * @param world                registry new test classes are added to
 */
public record UnitConfig(
        List<String> testPrefixes,
        String anonymousDescription,
        List<String> exampleAliases,
        World world
) {
    public static UnitConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * True when the name starts with a test prefix and goes on past it.
     */
    public boolean isTestMethodName(String methodName) {
        return testPrefixes.stream()
                .anyMatch(prefix -> methodName.length() > prefix.length() && methodName.startsWith(prefix));
    }

    public static class Builder {
        private List<String> testPrefixes = new ArrayList<>(List.of("test"));
        private String anonymousDescription = "<Anonymous TestCase>";
        private List<String> exampleAliases = new ArrayList<>(List.of("example", "test", "it", "specify"));
        private World world = World.global();

        public Builder testPrefixes(List<String> testPrefixes) {
            this.testPrefixes = new ArrayList<>(testPrefixes);
            return this;
        }

        public Builder testPrefix(String testPrefix) {
            this.testPrefixes.add(testPrefix);
            return this;
        }

        public Builder anonymousDescription(String anonymousDescription) {
            this.anonymousDescription = anonymousDescription;
            return this;
        }

        public Builder exampleAlias(String alias) {
            this.exampleAliases.add(alias);
            return this;
        }

        public Builder world(World world) {
            this.world = world;
            return this;
        }

        public UnitConfig build() {
            if (testPrefixes.isEmpty()) {
                throw new IllegalStateException("At least one test method prefix is required");
            }
            return new UnitConfig(
                    List.copyOf(testPrefixes),
                    anonymousDescription,
                    List.copyOf(exampleAliases),
                    world
            );
        }
    }
}
