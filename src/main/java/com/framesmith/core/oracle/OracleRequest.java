package com.framesmith.core.oracle;

import com.framesmith.core.model.GenerationOptions;

import java.util.List;

/**
 * One call to the code oracle.
 *
 * @param screenId        screen the request is for
 * @param systemPrompt    role and output-format instructions
 * @param userPrompt      contextual prompt carrying the serialized subtree
 * @param knownComponents registry component names at the time of the call
 * @param options         generation options
 */
public record OracleRequest(
    String screenId,
    String systemPrompt,
    String userPrompt,
    List<String> knownComponents,
    GenerationOptions options
) {

    public OracleRequest {
        knownComponents = knownComponents == null ? List.of() : List.copyOf(knownComponents);
    }
}
