package com.specunit.unit;

import com.specunit.core.World;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.specunit.core.MetadataKeys.LINE_NUMBER;
import static com.specunit.unit.CurrentLine.THIS_PACKAGE_PATH;
import static com.specunit.unit.CurrentLine.currentLine;
import static org.junit.jupiter.api.Assertions.*;

class LocationResolverTest {
    private TestCaseClass foo;

    @BeforeEach
    void setUp() {
        World.global().reset();
        TestCaseClass.configure(UnitConfig.defaults());
        foo = TestCase.define();
    }

    @Test
    void returnsAnEmptyTraceIfTheMethodNameIsNotFound() {
        assertTrue(foo.findCallerLines("wrong").isEmpty());
        TestCaseClass bar = foo.subclass();
        assertTrue(bar.findCallerLines("wrong").isEmpty());
        assertEquals(Optional.empty(), bar.findDefinition("wrong"));
    }

    @Test
    void returnsAStackTraceIfTheNameIsFoundInCallerLines() {
        foo.def("test_bar", self -> { });

        List<StackTraceElement> lines = foo.findCallerLines("test_bar");

        assertFalse(lines.isEmpty());
        assertEquals(LocationResolverTest.class.getName(), lines.get(0).getClassName());
    }

    @Test
    void returnsAStackTraceIfTheNameIsFoundInTheParentsCallerLines() {
        foo.def("test_bar", self -> { });
        TestCaseClass bar = foo.subclass();

        assertFalse(bar.findCallerLines("test_bar").isEmpty());
    }

    @Test
    void findsDefinitionsInIncludedModules() {
        TestModule mixin = new TestModule("Mixin");
        mixin.def("test_mixed", self -> { }); int line = currentLine();
        foo.include(mixin);

        Optional<SourceLocation> location = foo.subclass().findDefinition("test_mixed");

        assertEquals(Optional.of(new SourceLocation(THIS_PACKAGE_PATH + "LocationResolverTest.java", line)), location);
    }

    @Test
    void findsTheNearestRedefinition() {
        foo.def("test_bar", self -> { });
        TestCaseClass bar = foo.subclass();
        bar.def("test_bar", self -> { }); int line = currentLine();

        assertEquals(line, bar.findDefinition("test_bar").orElseThrow().lineNumber());
    }

    @Test
    void findsTheDeclarationOfANamedClass() {
        TestCaseClass named = TestCase.define("Named"); int line = currentLine();

        assertEquals(line, named.findDefinition("Named").orElseThrow().lineNumber());
        assertEquals(line, named.location().lineNumber());
    }

    @Test
    void aClassNamedLikeAnInheritedMethodDoesNotHideTheMethod() {
        foo.def("test_suite", self -> { }); int methodLine = currentLine();
        TestCaseClass suite = foo.subclass("test_suite"); int classLine = currentLine();

        assertEquals(methodLine, suite.findDefinition("test_suite").orElseThrow().lineNumber());
        assertEquals(methodLine, suite.examples().get(0).metadata().get(LINE_NUMBER));
        assertEquals(classLine, suite.location().lineNumber());
    }

    @Test
    void classLocationIsStableAcrossReopening() {
        SourceLocation before = foo.location();
        foo.def("test_later", self -> { });

        assertEquals(before, foo.location());
    }

    @Test
    void anonymousClassesStillHaveALocation() {
        assertNotNull(foo.location());
        assertEquals(THIS_PACKAGE_PATH + "LocationResolverTest.java", foo.location().filePath());
    }

    @Test
    void sourceLocationFormatsAsFileColonLine() {
        assertEquals("com/acme/FooTest.java:12", new SourceLocation("com/acme/FooTest.java", 12).toString());
    }

    @Test
    void sourceLocationIsEmptyWithoutAFileName() {
        StackTraceElement frame = new StackTraceElement("com.acme.Foo", "bar", null, 3);

        assertEquals(Optional.empty(), SourceLocation.of(frame));
    }
}
