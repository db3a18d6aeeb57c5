package com.xrplmcp.mcp.validate;

import java.util.List;
import java.util.Map;

/**
 * Result of checking normalized input against a model's fields.
 *
 * @param values       ledger-keyed values restricted to the model's fields, defaults applied
 * @param missing      paths of required fields that were not supplied
 * @param mismatched   paths of union fields whose value matched no alternative
 * @param enumProblems enum fields holding illegal values
 */
public record Binding(
    Map<String, Object> values,
    List<String> missing,
    List<String> mismatched,
    List<EnumProblem> enumProblems
) {

    public Binding {
        missing = List.copyOf(missing);
        mismatched = List.copyOf(mismatched);
        enumProblems = List.copyOf(enumProblems);
    }

    public boolean isStructurallyValid() {
        return missing.isEmpty() && mismatched.isEmpty();
    }
}
