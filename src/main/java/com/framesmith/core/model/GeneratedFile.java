package com.framesmith.core.model;

import java.io.Serializable;

/**
 * A single generated source file.
 *
 * @param path    relative path within the generated project
 * @param content file body
 */
public record GeneratedFile(
    String path,
    String content
) implements Serializable {

    public GeneratedFile withPath(String newPath) {
        return new GeneratedFile(newPath, content);
    }
}
