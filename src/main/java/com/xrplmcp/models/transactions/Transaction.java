package com.xrplmcp.models.transactions;

import java.util.List;
import java.util.Map;

import com.xrplmcp.models.BaseModel;

/**
 * Fields shared by every transaction kind. Not a model of its own.
 */
public interface Transaction extends BaseModel {
    String account();

    String fee();

    Long sequence();

    Long flags();

    List<Memo> memos();

    @Override
    default Map<String, Object> typeFields() {
        return Map.of("TransactionType", getClass().getSimpleName());
    }

    /** True when every bit of {@code flag} is set on this transaction. */
    default boolean hasFlag(long flag) {
        return flags() != null && (flags() & flag) == flag;
    }
}
