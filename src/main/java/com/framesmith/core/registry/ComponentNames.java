package com.framesmith.core.registry;

import java.util.Locale;

/**
 * Registry key normalization: case-insensitive, surrounding whitespace ignored.
 */
public final class ComponentNames {

    private ComponentNames() {}

    public static String normalize(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Component name must not be null");
        }
        String key = name.trim().toLowerCase(Locale.ROOT);
        if (key.isEmpty()) {
            throw new IllegalArgumentException("Component name must not be blank");
        }
        return key;
    }
}
