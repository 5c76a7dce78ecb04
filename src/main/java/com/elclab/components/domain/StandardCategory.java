package com.elclab.components.domain;

import java.util.List;

/**
 * StandardCategory - the built-in component categories of the lab catalog.
 *
 * <p>Each constant maps to a category row of the same display name that
 * {@code CategoryService.seedStandardCategories()} creates on startup.
 * {@link #classify(String, String)} suggests one of them from a component's
 * identifier and description; the import driver uses it when
 * auto-categorisation is switched on.
 */
public enum StandardCategory {

    RESISTOR("RESISTOR", "Fixed and variable resistors"),
    CAPACITOR("CAPACITOR", "Ceramic, film and electrolytic capacitors"),
    DIODE("DIODE", "Rectifier, signal and zener diodes"),
    IC("IC", "Integrated circuits, regulators and logic"),
    TRANSISTORS("TRANSISTORS", "Bipolar transistors and FETs"),
    OTHER("OTHER COMPONENTS", "Everything else, including LEDs");

    private static final List<String> IC_KEYWORDS = List.of(
            "IC", "LM", "MC", "OPAMP", "OP-AMP", "REGULATOR",
            "DRIVER", "BUFFER", "INVERTER");

    private static final List<String> RESISTOR_KEYWORDS = List.of("RESISTOR", "OHM", "RES");

    private static final List<String> CAPACITOR_KEYWORDS = List.of("CAPACITOR", "CAP");

    private static final List<String> CAPACITOR_UNITS = List.of("UF", "NF", "PF");

    private static final List<String> TRANSISTOR_KEYWORDS = List.of("TRANSISTOR", "FET", "IRF");

    private final String displayName;
    private final String description;

    StandardCategory(String displayName, String description) {
        this.displayName = displayName;
        this.description = description;
    }

    /**
     * @return the category name as stored in the categories table
     */
    public String getDisplayName() {
        return displayName;
    }

    /**
     * @return default description used when the category is seeded
     */
    public String getDescription() {
        return description;
    }

    /**
     * Suggests a standard category for a component.
     *
     * <p>Rules are checked in order; the first match wins:
     * <ol>
     *   <li>"LED" anywhere in the identifier: {@link #OTHER}.</li>
     *   <li>Identifier starting with "74" (logic family): {@link #IC}.</li>
     *   <li>IC keywords in identifier or description: {@link #IC}.</li>
     *   <li>Resistor keywords, or identifier prefix "R_": {@link #RESISTOR}.</li>
     *   <li>Capacitor keywords, a UF/NF/PF unit in the identifier, or
     *       prefix "C_": {@link #CAPACITOR}.</li>
     *   <li>"DIODE", or prefix "D_": {@link #DIODE}.</li>
     *   <li>Transistor keywords, or prefix "T_": {@link #TRANSISTORS}.</li>
     * </ol>
     * Matching is case-insensitive. Anything else is {@link #OTHER}.
     *
     * @param identifier  component identifier (may be null)
     * @param description component description (may be null)
     * @return the suggested category, never null
     */
    public static StandardCategory classify(String identifier, String description) {
        String code = identifier == null ? "" : identifier.toUpperCase();
        String desc = description == null ? "" : description.toUpperCase();

        if (code.contains("LED")) {
            return OTHER;
        }
        if (code.startsWith("74")) {
            return IC;
        }
        if (containsAny(code, desc, IC_KEYWORDS)) {
            return IC;
        }
        if (containsAny(code, desc, RESISTOR_KEYWORDS) || code.startsWith("R_")) {
            return RESISTOR;
        }
        if (containsAny(code, desc, CAPACITOR_KEYWORDS)
                || CAPACITOR_UNITS.stream().anyMatch(code::contains)
                || code.startsWith("C_")) {
            return CAPACITOR;
        }
        if (code.contains("DIODE") || desc.contains("DIODE") || code.startsWith("D_")) {
            return DIODE;
        }
        if (containsAny(code, desc, TRANSISTOR_KEYWORDS) || code.startsWith("T_")) {
            return TRANSISTORS;
        }
        return OTHER;
    }

    /**
     * Looks up a standard category by its stored display name,
     * ignoring case.
     *
     * @param name stored category name
     * @return the matching constant, or null if the name is not standard
     */
    public static StandardCategory fromDisplayName(String name) {
        if (name == null || name.isBlank()) {
            return null;
        }
        for (StandardCategory c : values()) {
            if (c.displayName.equalsIgnoreCase(name.trim())) {
                return c;
            }
        }
        return null;
    }

    private static boolean containsAny(String code, String desc, List<String> keywords) {
        for (String keyword : keywords) {
            if (code.contains(keyword) || desc.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
