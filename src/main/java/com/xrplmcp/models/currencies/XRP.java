package com.xrplmcp.models.currencies;

import com.xrplmcp.models.ModelDoc;
import com.xrplmcp.models.ModelField;
import com.xrplmcp.models.ModelValidationException;

@ModelDoc("The native currency of the ledger.")
public record XRP(
    @ModelField(value = "Always XRP", defaultValue = "XRP") String currency
) implements Currency {

    public XRP {
        if (currency == null) {
            currency = "XRP";
        }
        ModelValidationException.check("XRP".equals(currency), "Currency must be XRP, got '" + currency + "'");
    }
}
