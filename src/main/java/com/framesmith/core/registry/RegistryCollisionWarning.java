package com.framesmith.core.registry;

import java.io.Serializable;

/**
 * Non-fatal record of a registration whose content differed from the stored descriptor of the same name.
 * The stored descriptor is kept; the later screen only gets a reference.
 */
public record RegistryCollisionWarning(
    String componentName,
    String screenId,
    String keptFilePath,
    String rejectedFilePath
) implements Serializable {

    public String message() {
        return "Component '" + componentName + "' from screen " + screenId
                + " differs from the registered version (" + keptFilePath + " kept, "
                + rejectedFilePath + " dropped)";
    }
}
