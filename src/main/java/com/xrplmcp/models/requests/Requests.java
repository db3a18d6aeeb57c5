package com.xrplmcp.models.requests;

import java.util.List;

public final class Requests {

    public static final List<Class<?>> DEFINITIONS = List.of(
        Request.class,
        AccountInfo.class,
        AccountLines.class,
        AccountObjects.class,
        AccountObjectType.class,
        AccountTx.class,
        BookOffers.class,
        Fee.class,
        Ledger.class,
        LedgerShortcut.class,
        ServerInfo.class,
        Tx.class);

    private Requests() {}
}
