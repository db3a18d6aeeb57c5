package com.xrplmcp.models.transactions;

import com.xrplmcp.models.BaseModel;
import com.xrplmcp.models.ModelDoc;
import com.xrplmcp.models.ModelField;
import com.xrplmcp.models.ModelValidationException;

@ModelDoc("Arbitrary data attached to a transaction.")
public record Memo(
    @ModelField(value = "Hex-encoded content of the memo", defaultValue = "") String memoData,
    @ModelField(value = "Hex-encoded MIME type of the memo content", defaultValue = "") String memoFormat,
    @ModelField(value = "Hex-encoded relation of the memo to the transaction", defaultValue = "") String memoType
) implements BaseModel {

    public Memo {
        ModelValidationException.check(memoData != null || memoFormat != null || memoType != null,
            "A memo needs at least one of MemoData, MemoFormat or MemoType");
    }
}
