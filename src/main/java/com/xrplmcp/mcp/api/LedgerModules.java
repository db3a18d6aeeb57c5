package com.xrplmcp.mcp.api;

import java.util.List;

import com.xrplmcp.models.amounts.Amounts;
import com.xrplmcp.models.common.CommonModels;
import com.xrplmcp.models.currencies.Currencies;
import com.xrplmcp.models.requests.Requests;
import com.xrplmcp.models.transactions.Transactions;

/**
 * The fixed list of model-bearing modules scanned at startup, in registration order.
 */
public final class LedgerModules {
    public static final String TRANSACTION = "transaction";
    public static final String REQUEST = "request";
    public static final String AMOUNT = "amount";
    public static final String CURRENCY = "currency";
    public static final String OTHER = "other";

    private LedgerModules() {}

    public static List<ModelModule> all() {
        return List.of(
            ModelModule.of(TRANSACTION, Transactions.DEFINITIONS),
            ModelModule.of(REQUEST, Requests.DEFINITIONS),
            ModelModule.of(AMOUNT, Amounts.DEFINITIONS),
            ModelModule.of(CURRENCY, Currencies.DEFINITIONS),
            ModelModule.of(OTHER, CommonModels.DEFINITIONS));
    }
}
