package com.xrplmcp.models.requests;

import java.util.Map;

import com.xrplmcp.models.BaseModel;

/**
 * A query sent to a ledger server. The method name is derived from the model name.
 */
public interface Request extends BaseModel {
    Object id();

    /** Server method name, e.g. {@code account_info} for {@code AccountInfo}. */
    default String method() {
        final String name = getClass().getSimpleName();
        final StringBuilder sb = new StringBuilder(name.length() + 4);
        for (int i = 0; i < name.length(); i++) {
            final char c = name.charAt(i);
            if (Character.isUpperCase(c)) {
                if (i > 0) sb.append('_');
                sb.append(Character.toLowerCase(c));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    @Override
    default Map<String, Object> typeFields() {
        return Map.of("Method", method());
    }
}
