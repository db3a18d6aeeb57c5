package com.xrplmcp.models.requests;

import com.xrplmcp.models.AnyOf;
import com.xrplmcp.models.ModelDoc;
import com.xrplmcp.models.ModelField;
import com.xrplmcp.models.ModelValidationException;
import com.xrplmcp.models.currencies.IssuedCurrency;
import com.xrplmcp.models.currencies.XRP;

@ModelDoc("Retrieves the offers of an order book between two currencies.")
public record BookOffers(
    @ModelField("Currency the taker receives")
    @AnyOf({IssuedCurrency.class, XRP.class}) Object takerGets,
    @ModelField("Currency the taker pays")
    @AnyOf({IssuedCurrency.class, XRP.class}) Object takerPays,
    @ModelField(value = "Ledger index or shortcut to use", defaultValue = "")
    @AnyOf({LedgerShortcut.class, Long.class}) Object ledgerIndex,
    @ModelField(value = "Account viewing the book, for funding calculations", defaultValue = "") String taker,
    @ModelField(value = "Maximum number of offers to return", defaultValue = "") Integer limit,
    @ModelField(value = "Identifier echoed in the response", defaultValue = "") Object id
) implements Request {

    public BookOffers {
        ModelValidationException.check(takerGets == null || !takerGets.equals(takerPays),
            "TakerGets and TakerPays must be different currencies");
    }
}
