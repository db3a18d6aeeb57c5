package com.xrplmcp.models.currencies;

import com.xrplmcp.models.ModelDoc;
import com.xrplmcp.models.ModelField;
import com.xrplmcp.models.ModelValidationException;

@ModelDoc("A token issued by an account, identified by its currency code and issuer.")
public record IssuedCurrency(
    @ModelField("Three-letter code or 40-character hex code of the currency") String currency,
    @ModelField("Address of the account that issues the currency") String issuer
) implements Currency {

    public IssuedCurrency {
        ModelValidationException.check(currency == null || !"XRP".equalsIgnoreCase(currency),
            "Currency must not be XRP for an issued currency");
        ModelValidationException.check(currency == null || Currencies.isValidCode(currency),
            "Currency must be a 3-character code or a 40-character hex code, got '" + currency + "'");
    }
}
