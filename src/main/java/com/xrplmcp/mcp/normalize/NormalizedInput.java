package com.xrplmcp.mcp.normalize;

import java.util.Collections;
import java.util.Map;

/**
 * Caller input after normalization.
 *
 * @param values     ledger key to normalized value, in the order the caller supplied them
 * @param callerKeys ledger key to the key as the caller spelled it
 */
public record NormalizedInput(Map<String, Object> values, Map<String, String> callerKeys) {

    public NormalizedInput {
        values = Collections.unmodifiableMap(values);
        callerKeys = Collections.unmodifiableMap(callerKeys);
    }
}
