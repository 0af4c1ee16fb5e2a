package com.framesmith.core.oracle;

import com.framesmith.core.model.ComponentDescriptor;
import com.framesmith.core.model.GeneratedFile;

import java.util.List;

/**
 * Oracle output after parsing.
 *
 * @param shape       which of the accepted response shapes was found
 * @param uiFiles     UI files
 * @param apiFiles    API handler files
 * @param components  component descriptors; screen usage is filled in by the adapter
 * @param registryRef referenced component name for {@link Shape#REGISTRY_REF} responses
 */
public record ParsedOracleResponse(
    Shape shape,
    List<GeneratedFile> uiFiles,
    List<GeneratedFile> apiFiles,
    List<ComponentDescriptor> components,
    String registryRef
) {

    public enum Shape {
        STRUCTURED,
        REGISTRY_REF,
        TEXT
    }

    public ParsedOracleResponse {
        uiFiles = uiFiles == null ? List.of() : List.copyOf(uiFiles);
        apiFiles = apiFiles == null ? List.of() : List.copyOf(apiFiles);
        components = components == null ? List.of() : List.copyOf(components);
    }

    public static ParsedOracleResponse registryRef(String name) {
        return new ParsedOracleResponse(Shape.REGISTRY_REF, List.of(), List.of(), List.of(), name);
    }

    public boolean isRegistryRef() {
        return shape == Shape.REGISTRY_REF;
    }
}
