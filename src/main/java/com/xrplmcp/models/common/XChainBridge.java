package com.xrplmcp.models.common;

import com.xrplmcp.models.AnyOf;
import com.xrplmcp.models.BaseModel;
import com.xrplmcp.models.ModelDoc;
import com.xrplmcp.models.ModelField;
import com.xrplmcp.models.ModelValidationException;
import com.xrplmcp.models.currencies.IssuedCurrency;
import com.xrplmcp.models.currencies.XRP;

@ModelDoc("A cross-chain bridge between a locking chain and an issuing chain.")
public record XChainBridge(
    @ModelField("Door account on the locking chain") String lockingChainDoor,
    @ModelField("Asset locked on the locking chain")
    @AnyOf({IssuedCurrency.class, XRP.class}) Object lockingChainIssue,
    @ModelField("Door account on the issuing chain") String issuingChainDoor,
    @ModelField("Asset minted on the issuing chain")
    @AnyOf({IssuedCurrency.class, XRP.class}) Object issuingChainIssue
) implements BaseModel {

    public XChainBridge {
        ModelValidationException.check(lockingChainDoor == null || !lockingChainDoor.equals(issuingChainDoor),
            "LockingChainDoor and IssuingChainDoor must be different accounts");
    }
}
