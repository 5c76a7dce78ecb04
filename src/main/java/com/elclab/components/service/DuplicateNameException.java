package com.elclab.components.service;

/**
 * Thrown when creating or renaming a category would collide with an
 * existing category name (compared without case).
 */
public class DuplicateNameException extends ValidationException {

    private final String name;

    public DuplicateNameException(String name) {
        super("name", "A category named '" + name + "' already exists.");
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
