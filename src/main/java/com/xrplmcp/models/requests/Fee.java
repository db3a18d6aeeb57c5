package com.xrplmcp.models.requests;

import com.xrplmcp.models.ModelDoc;
import com.xrplmcp.models.ModelField;

@ModelDoc("Retrieves the current transaction cost requirements.")
public record Fee(
    @ModelField(value = "Identifier echoed in the response", defaultValue = "") Object id
) implements Request {
}
