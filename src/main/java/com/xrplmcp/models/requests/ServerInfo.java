package com.xrplmcp.models.requests;

import com.xrplmcp.models.ModelDoc;
import com.xrplmcp.models.ModelField;

@ModelDoc("Retrieves the status of the server.")
public record ServerInfo(
    @ModelField(value = "Identifier echoed in the response", defaultValue = "") Object id
) implements Request {
}
