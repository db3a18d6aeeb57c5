package com.xrplmcp.models.amounts;

import com.xrplmcp.models.BaseModel;
import com.xrplmcp.models.ModelDoc;
import com.xrplmcp.models.ModelField;
import com.xrplmcp.models.ModelValidationException;

@ModelDoc("An amount of a token issued by an account, as opposed to XRP expressed in drops.")
public record IssuedCurrencyAmount(
    @ModelField("Three-letter code or 40-character hex code of the currency") String currency,
    @ModelField("Address of the account that issues the currency") String issuer,
    @ModelField("Quoted decimal amount of the currency") String value
) implements BaseModel {

    public IssuedCurrencyAmount {
        ModelValidationException.check(currency == null || !"XRP".equalsIgnoreCase(currency),
            "Currency must not be XRP for an issued currency amount");
        ModelValidationException.check(value == null || Amounts.isDecimal(value),
            "Value must be a decimal number, got '" + value + "'");
    }
}
