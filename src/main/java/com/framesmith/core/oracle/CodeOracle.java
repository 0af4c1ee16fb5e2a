package com.framesmith.core.oracle;

/**
 * Opaque remote code generator.
 */
public interface CodeOracle {

    /**
     * Generates code for one screen.
     *
     * @throws TransientOracleException when the call may succeed if repeated
     * @throws OracleRequestException   when the request itself was rejected
     */
    OracleResponse generate(OracleRequest request);
}
