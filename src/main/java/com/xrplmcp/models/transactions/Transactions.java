package com.xrplmcp.models.transactions;

import java.util.List;

/**
 * Every class-like definition of the transactions module, models and supporting types alike.
 */
public final class Transactions {

    public static final List<Class<?>> DEFINITIONS = List.of(
        Transaction.class,
        AccountDelete.class,
        AccountSet.class,
        AccountSetAsfFlag.class,
        CheckCreate.class,
        EscrowCreate.class,
        Memo.class,
        NFTokenMint.class,
        OfferCancel.class,
        OfferCreate.class,
        Payment.class,
        PaymentFlag.class,
        Signer.class,
        TrustSet.class,
        TrustSetFlag.class);

    private Transactions() {}
}
