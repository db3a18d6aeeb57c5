package com.xrplmcp.mcp.validate;

import java.util.List;

/**
 * A value outside an enum field's legal set.
 */
public record EnumProblem(String path, Object value, List<String> legalValues) {

    public String message() {
        return "'" + value + "' is not a valid value for " + path + ", expected one of " + legalValues;
    }
}
