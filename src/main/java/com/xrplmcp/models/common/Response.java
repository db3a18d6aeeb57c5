package com.xrplmcp.models.common;

import java.util.Map;

import com.xrplmcp.models.BaseModel;
import com.xrplmcp.models.ModelDoc;
import com.xrplmcp.models.ModelField;

@ModelDoc("A response returned by a ledger server.")
public record Response(
    @ModelField("Whether the request succeeded") ResponseStatus status,
    @ModelField("Response payload, shaped by the request that produced it") Map<String, Object> result,
    @ModelField(value = "Identifier echoed from the request", defaultValue = "") Object id,
    @ModelField(value = "Kind of message", defaultValue = "response") ResponseType type
) implements BaseModel {
}
