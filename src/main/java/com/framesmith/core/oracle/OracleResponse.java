package com.framesmith.core.oracle;

/**
 * Raw oracle output.
 *
 * @param content    response text
 * @param tokensUsed total tokens reported by the model, or -1 when the model reports none
 */
public record OracleResponse(String content, long tokensUsed) {

    public static OracleResponse of(String content) {
        return new OracleResponse(content, -1L);
    }

    public boolean hasUsage() {
        return tokensUsed >= 0;
    }
}
