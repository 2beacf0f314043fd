package io.lighting.stencil.filter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.lighting.stencil.Stencil;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultFilterRegistryTest {

    @Test
    void lastRegistrationWins() {
        DefaultFilterRegistry registry = new DefaultFilterRegistry();
        Filter first = (value, args) -> "first";
        Filter second = (value, args) -> "second";
        registry.register("pick", first).register(" pick ", second);
        assertSame(second, registry.find("pick"));
        assertEquals(1, registry.names().size());
    }

    @Test
    void rejectsBlankNames() {
        DefaultFilterRegistry registry = new DefaultFilterRegistry();
        assertThrows(IllegalArgumentException.class, () -> registry.register(" ", (value, args) -> value));
        assertThrows(NullPointerException.class, () -> registry.register("x", null));
    }

    @Test
    void standardRegistriesAreIndependent() {
        FilterRegistry one = FilterRegistry.standard();
        FilterRegistry two = FilterRegistry.standard();
        one.register("only_in_one", (value, args) -> value);
        assertNotNull(one.find("only_in_one"));
        assertNull(two.find("only_in_one"));
        assertTrue(((DefaultFilterRegistry) two).names().contains("strip"));
    }

    @Test
    void globalRegistrationsReachTheStandardEngine() {
        Filters.register("shout_registry_test", (value, args) -> value + "!");
        assertEquals("hey!", Stencil.standard().render("{{ \"hey\" | shout_registry_test }}", Map.of()));
        assertEquals("Foo", Stencil.standard().render("{{ \"foo\" | capitalize }}", Map.of()));
    }
}
