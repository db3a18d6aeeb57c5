package com.xrplmcp.models.common;

import com.xrplmcp.models.BaseModel;
import com.xrplmcp.models.ModelDoc;
import com.xrplmcp.models.ModelField;

@ModelDoc("An account authorized to bid for an AMM auction slot.")
public record AuthAccount(
    @ModelField("Address of the authorized account") String account
) implements BaseModel {
}
