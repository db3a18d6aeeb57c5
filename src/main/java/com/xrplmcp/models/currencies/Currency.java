package com.xrplmcp.models.currencies;

import com.xrplmcp.models.BaseModel;

/**
 * A currency without an amount: either {@link XRP} or an {@link IssuedCurrency}.
 */
public interface Currency extends BaseModel {
    String currency();
}
