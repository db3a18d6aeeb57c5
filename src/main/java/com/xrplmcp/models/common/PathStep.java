package com.xrplmcp.models.common;

import com.xrplmcp.models.BaseModel;
import com.xrplmcp.models.ModelDoc;
import com.xrplmcp.models.ModelField;
import com.xrplmcp.models.ModelValidationException;

@ModelDoc("One step of a payment path: an account to ripple through or an order book to cross.")
public record PathStep(
    @ModelField(value = "Account to ripple through", defaultValue = "") String account,
    @ModelField(value = "Currency of the order book to cross", defaultValue = "") String currency,
    @ModelField(value = "Issuer of the order book's currency", defaultValue = "") String issuer
) implements BaseModel {

    public PathStep {
        ModelValidationException.check(account != null || currency != null || issuer != null,
            "A path step needs at least one of Account, Currency or Issuer");
        ModelValidationException.check(account == null || currency == null,
            "A path step cannot name both an Account and a Currency");
        ModelValidationException.check(!"XRP".equals(currency) || issuer == null,
            "A path step through XRP cannot have an Issuer");
    }
}
