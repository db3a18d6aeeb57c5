package com.xrplmcp.models.common;

import java.util.List;

/**
 * Models shared across transactions and requests that belong to no other module.
 */
public final class CommonModels {

    public static final List<Class<?>> DEFINITIONS = List.of(
        AuthAccount.class,
        PathStep.class,
        Response.class,
        ResponseStatus.class,
        ResponseType.class,
        XChainBridge.class);

    private CommonModels() {}
}
