package com.xrplmcp.models.requests;

import com.xrplmcp.models.ModelDoc;
import com.xrplmcp.models.ModelField;
import com.xrplmcp.models.ModelValidationException;

@ModelDoc("Retrieves a single transaction by its hash.")
public record Tx(
    @ModelField("Hash of the transaction") String transaction,
    @ModelField(value = "Return the transaction as a hex blob", defaultValue = "false") Boolean binary,
    @ModelField(value = "Lowest ledger to search", defaultValue = "") Long minLedger,
    @ModelField(value = "Highest ledger to search", defaultValue = "") Long maxLedger,
    @ModelField(value = "Identifier echoed in the response", defaultValue = "") Object id
) implements Request {

    public Tx {
        ModelValidationException.check((minLedger == null) == (maxLedger == null),
            "MinLedger and MaxLedger must be provided together");
        ModelValidationException.check(minLedger == null || minLedger <= maxLedger,
            "MinLedger must not be greater than MaxLedger");
    }
}
