package com.xrplmcp.mcp.validate;

import java.util.Map;

/**
 * A nested model whose fields passed validation but which is not constructed yet.
 */
record BoundModel(Class<?> modelClass, Map<String, Object> values) {
}
