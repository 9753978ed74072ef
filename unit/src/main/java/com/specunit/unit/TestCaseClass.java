package com.specunit.unit;

import com.specunit.core.Example;
import com.specunit.core.ExampleGroup;
import com.specunit.core.ExampleResult;
import com.specunit.core.Hook;
import com.specunit.core.Metadata;
import com.specunit.core.MetadataKeys;
import com.specunit.core.Reporter;

import java.lang.reflect.Constructor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * A test class as seen by the runner: an example group whose examples are its test methods.
 * Classes form a single-inheritance hierarchy below {@link #root()}, which stands for {@link TestCase} itself.
 */
public class TestCaseClass extends MethodContainer implements ExampleGroup<TestCase> {
    private static UnitConfig config = UnitConfig.defaults();
    private static final TestCaseClass ROOT = new TestCaseClass();

    private final TestCaseClass superclass;
    private final Class<? extends TestCase> javaClass;
    private final SourceLocation location;
    private final Metadata metadata;
    private final List<Hook<TestCase>> befores = new ArrayList<>();
    private final List<Hook<TestCase>> afters = new ArrayList<>();
    private Supplier<? extends TestCase> instanceFactory;

    private TestCaseClass() {
        super(TestCase.class.getSimpleName());
        this.superclass = null;
        this.javaClass = TestCase.class;
        this.location = null;
        this.metadata = MetadataStore.groupMetadata(description(), null, null);
    }

    TestCaseClass(String name, TestCaseClass superclass, Class<? extends TestCase> javaClass,
                  List<StackTraceElement> trace) {
        super(name);
        this.superclass = Objects.requireNonNull(superclass, "superclass");
        this.javaClass = javaClass;
        this.location = locationOf(trace);
        if (name != null) {
            recordDeclarationLines(name, trace);
        }
        this.metadata = MetadataStore.groupMetadata(description(), location, superclass.metadata);
    }

    public static TestCaseClass root() {
        return ROOT;
    }

    public static UnitConfig config() {
        return config;
    }

    public static void configure(UnitConfig newConfig) {
        config = Objects.requireNonNull(newConfig, "config");
    }

    /**
     * The test class for a Java subclass of {@link TestCase}, registered the first time it is asked for.
     * Its methods and the default methods of its interfaces are imported by reflection.
     */
    public static TestCaseClass forClass(Class<? extends TestCase> type) {
        return Registration.forClass(type);
    }

    public TestCaseClass subclass() {
        return Registration.defineSubclass(this, null, javaClass);
    }

    public TestCaseClass subclass(String name) {
        return Registration.defineSubclass(this, Objects.requireNonNull(name, "name"), javaClass);
    }

    public boolean isRoot() {
        return this == ROOT;
    }

    /**
     * The parent class; {@link #root()} for classes declared directly below it, null for the root itself.
     */
    public TestCaseClass superclass() {
        return superclass;
    }

    public Class<? extends TestCase> javaClass() {
        return javaClass;
    }

    /**
     * Where the class was first declared; null for the root.
     */
    public SourceLocation location() {
        return location;
    }

    @Override
    public String description() {
        return isAnonymous() ? config.anonymousDescription() : name();
    }

    @Override
    public Metadata metadata() {
        return metadata;
    }

    /**
     * Merge user metadata into this class's {@code example_group} record.
     */
    public void testCaseInfo(Map<String, ?> info) {
        MetadataStore.mergeGroupInfo(metadata.nested(MetadataKeys.EXAMPLE_GROUP), info, this);
    }

    // ==================== hooks ====================

    public void before(Hook<TestCase> hook) {
        befores.add(Objects.requireNonNull(hook, "hook"));
    }

    public void after(Hook<TestCase> hook) {
        afters.add(Objects.requireNonNull(hook, "hook"));
    }

    @Override
    public List<Hook<TestCase>> beforeHooks() {
        List<Hook<TestCase>> hooks = new ArrayList<>();
        List<TestCaseClass> chain = classChain();
        for (int i = chain.size() - 1; i >= 0; i--) {
            hooks.addAll(chain.get(i).befores);
        }
        return hooks;
    }

    @Override
    public List<Hook<TestCase>> afterHooks() {
        List<Hook<TestCase>> hooks = new ArrayList<>();
        for (TestCaseClass type : classChain()) {
            List<Hook<TestCase>> own = new ArrayList<>(type.afters);
            Collections.reverse(own);
            hooks.addAll(own);
        }
        return hooks;
    }

    // ==================== discovery and execution ====================

    @Override
    public List<Example<TestCase>> examples() {
        return MethodDiscovery.examples(this);
    }

    @Override
    public List<TestCaseClass> ancestors() {
        return Registration.ancestors(this);
    }

    @Override
    public List<ExampleResult> runAll(Reporter reporter) {
        return ExecutionBracket.runAll(this, reporter);
    }

    /**
     * Run every example against instances from {@code factory} instead of fresh reflective instances.
     */
    public void instantiateWith(Supplier<? extends TestCase> factory) {
        this.instanceFactory = factory;
    }

    TestCase newInstance() throws ReflectiveOperationException {
        TestCase instance;
        if (instanceFactory != null) {
            instance = instanceFactory.get();
        } else {
            Constructor<? extends TestCase> constructor = javaClass.getDeclaredConstructor();
            constructor.setAccessible(true);
            instance = constructor.newInstance();
        }
        instance.bind(this);
        return instance;
    }

    // ==================== method resolution ====================

    /**
     * This class, its modules, then each superclass with its modules, up to and including the root.
     */
    @Override
    public List<MethodContainer> methodResolutionOrder() {
        List<MethodContainer> order = new ArrayList<>();
        for (TestCaseClass type : classChain()) {
            for (MethodContainer container : type.ownResolutionOrder()) {
                if (!order.contains(container)) {
                    order.add(container);
                }
            }
        }
        return order;
    }

    public Optional<MethodDefinition> resolveMethod(String methodName) {
        for (MethodContainer container : methodResolutionOrder()) {
            Optional<MethodDefinition> definition = container.ownMethod(methodName);
            if (definition.isPresent()) {
                return definition;
            }
        }
        return Optional.empty();
    }

    /**
     * The definition of {@code methodName} found after {@code owner} in the resolution order.
     */
    Optional<MethodDefinition> resolveMethodAfter(MethodContainer owner, String methodName) {
        List<MethodContainer> order = methodResolutionOrder();
        int start = order.indexOf(owner);
        for (int i = start + 1; start >= 0 && i < order.size(); i++) {
            Optional<MethodDefinition> definition = order.get(i).ownMethod(methodName);
            if (definition.isPresent()) {
                return definition;
            }
        }
        return Optional.empty();
    }

    /**
     * This class and its superclasses, nearest first, including the root.
     */
    private List<TestCaseClass> classChain() {
        List<TestCaseClass> chain = new ArrayList<>();
        for (TestCaseClass type = this; type != null; type = type.superclass) {
            chain.add(type);
        }
        return chain;
    }

    @Override
    public String toString() {
        return description();
    }
}
