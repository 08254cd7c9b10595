package com.repo.cccp.core;

import java.util.Locale;

/**
 * How a source file is divided into scored units.
 */
public enum UnitMode {

    /** The whole file is one unit. */
    MODULE,

    /** Each top-level function body is a unit; leftover module statements form one more. */
    FUNCTION;

    public static UnitMode fromName(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown unit mode: " + name + " (expected module or function)", e);
        }
    }
}
