package com.specunit.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(MockitoExtension.class)
class WorldTest {

    @Mock
    private ExampleGroup<Object> first;

    @Mock
    private ExampleGroup<Object> second;

    private World world;

    @BeforeEach
    void setUp() {
        world = new World();
    }

    @Test
    void keepsGroupsInRegistrationOrder() {
        world.register(first);
        world.register(second);

        assertEquals(List.of(first, second), world.exampleGroups());
    }

    @Test
    void exposesAReadOnlyView() {
        world.register(first);

        assertThrows(UnsupportedOperationException.class, () -> world.exampleGroups().add(second));
    }

    @Test
    void resetForgetsEveryGroup() {
        world.register(first);

        world.reset();

        assertTrue(world.exampleGroups().isEmpty());
    }

    @Test
    void theGlobalWorldIsShared() {
        assertSame(World.global(), World.global());
    }
}
