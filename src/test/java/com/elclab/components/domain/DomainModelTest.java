package com.elclab.components.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the domain entities and value objects.
 */
class DomainModelTest {

    // ======================================================================
    // StandardCategory
    // ======================================================================

    @Nested
    @DisplayName("StandardCategory classification")
    class StandardCategoryTests {

        @ParameterizedTest(name = "[{index}] {0} / {1} -> {2}")
        @CsvSource({
                "LED_RED,      ,                   OTHER",
                "74HC595,      shift register,     IC",
                "LM7805,       5V regulator,       IC",
                "R10K,         10k ohm resistor,   RESISTOR",
                "R_4K7,        ,                   RESISTOR",
                "C1,           100nF cap,          CAPACITOR",
                "100UF_25V,    ,                   CAPACITOR",
                "D_1N4148,     ,                   DIODE",
                "1N4007,       rectifier diode,    DIODE",
                "IRF540,       ,                   TRANSISTORS",
                "BC547,        NPN transistor,     TRANSISTORS",
                "BUZZER,       ,                   OTHER"
        })
        @DisplayName("classify follows the keyword rules in order")
        void classify_followsRules(String identifier, String description, StandardCategory expected) {
            assertEquals(expected, StandardCategory.classify(identifier, description));
        }

        @Test
        @DisplayName("classify is case-insensitive")
        void classify_isCaseInsensitive() {
            assertEquals(StandardCategory.RESISTOR,
                    StandardCategory.classify("r_220", null));
            assertEquals(StandardCategory.CAPACITOR,
                    StandardCategory.classify("x1", "Tantalum Cap"));
        }

        @Test
        @DisplayName("classify tolerates null input")
        void classify_nulls_returnsOther() {
            assertEquals(StandardCategory.OTHER, StandardCategory.classify(null, null));
        }

        @Test
        @DisplayName("an LED identifier wins over an IC keyword in the description")
        void classify_ledBeatsIcKeyword() {
            assertEquals(StandardCategory.OTHER,
                    StandardCategory.classify("LED_DRIVER_BOARD", "LED driver"));
        }

        @Test
        @DisplayName("fromDisplayName resolves stored names ignoring case")
        void fromDisplayName_resolves() {
            assertEquals(StandardCategory.OTHER, StandardCategory.fromDisplayName("other components"));
            assertEquals(StandardCategory.IC, StandardCategory.fromDisplayName(" IC "));
            assertNull(StandardCategory.fromDisplayName("Connectors"));
            assertNull(StandardCategory.fromDisplayName(null));
        }
    }

    // ======================================================================
    // CandidateRecord
    // ======================================================================

    @Nested
    @DisplayName("CandidateRecord")
    class CandidateRecordTests {

        @ParameterizedTest
        @ValueSource(strings = {"", "   "})
        @DisplayName("rejects a blank identifier")
        void blankIdentifier_throws(String identifier) {
            assertThrows(IllegalArgumentException.class,
                    () -> new CandidateRecord(identifier, BigDecimal.ONE, null));
        }

        @Test
        @DisplayName("rejects a negative or missing price")
        void badPrice_throws() {
            assertThrows(IllegalArgumentException.class,
                    () -> new CandidateRecord("R1", new BigDecimal("-0.01"), null));
            assertThrows(IllegalArgumentException.class,
                    () -> new CandidateRecord("R1", null, null));
        }

        @Test
        @DisplayName("blank description becomes absent")
        void blankDescription_isAbsent() {
            CandidateRecord candidate = new CandidateRecord("R1", BigDecimal.ONE, "   ");
            assertNull(candidate.getDescription());
            assertFalse(candidate.hasDescription());
        }

        @Test
        @DisplayName("toComponent starts with zero stock and no category")
        void toComponent_defaults() {
            Component c = new CandidateRecord(" R10K ", new BigDecimal("0.05"), "10k").toComponent();
            assertEquals("R10K", c.getIdentifier());
            assertEquals(0, c.getQuantity());
            assertFalse(c.hasCategory());
            assertEquals(0, new BigDecimal("0.050").compareTo(c.getPrice()));
        }

        @Test
        @DisplayName("equality compares prices numerically")
        void equals_numericPrice() {
            assertEquals(new CandidateRecord("R1", new BigDecimal("0.05"), "a"),
                    new CandidateRecord("R1", new BigDecimal("0.050"), "a"));
        }
    }

    // ======================================================================
    // Component and ComponentUpdate
    // ======================================================================

    @Nested
    @DisplayName("Component and ComponentUpdate")
    class ComponentTests {

        @Test
        @DisplayName("components are equal by case-sensitive identifier")
        void equality_byIdentifier() {
            Component a = new Component("R10K", "a", BigDecimal.ONE, 1);
            Component b = new Component("R10K", "b", BigDecimal.TEN, 5);
            Component c = new Component("r10k", "a", BigDecimal.ONE, 1);
            assertEquals(a, b);
            assertEquals(a.hashCode(), b.hashCode());
            assertNotEquals(a, c);
        }

        @Test
        @DisplayName("getPriceFormatted rounds to two places")
        void priceFormatted() {
            assertEquals("0.05", new Component("R1", null, new BigDecimal("0.049"), 0).getPriceFormatted());
        }

        @Test
        @DisplayName("descriptionOnly leaves price and quantity alone")
        void descriptionOnly_apply() {
            Component c = new Component("R1", null, new BigDecimal("0.10"), 7);
            ComponentUpdate.descriptionOnly("resistor").applyTo(c);
            assertEquals("resistor", c.getDescription());
            assertEquals(0, new BigDecimal("0.10").compareTo(c.getPrice()));
            assertEquals(7, c.getQuantity());
        }

        @Test
        @DisplayName("priceAndDescription may clear the description")
        void priceAndDescription_clears() {
            Component c = new Component("R1", "old", new BigDecimal("0.10"), 7);
            ComponentUpdate.priceAndDescription(null, new BigDecimal("0.20")).applyTo(c);
            assertNull(c.getDescription());
            assertEquals(0, new BigDecimal("0.20").compareTo(c.getPrice()));
        }

        @Test
        @DisplayName("ComponentUpdate rejects a negative price")
        void update_negativePrice_throws() {
            assertThrows(IllegalArgumentException.class,
                    () -> ComponentUpdate.of("x", new BigDecimal("-1"), 0));
        }
    }
}
