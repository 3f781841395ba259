package com.custodia.auditchain;

import java.util.List;

/**
 * Malformed input: missing required fields, a timestamp beyond the clock-skew tolerance, or
 * metadata that is not flat string/number data. Recoverable by correcting the input; never
 * retried automatically.
 */
public class AuditValidationException extends AuditTrailException {

    private final List<String> errors;

    public AuditValidationException(List<String> errors) {
        super("Invalid audit input: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public AuditValidationException(String error) {
        this(List.of(error));
    }

    public List<String> errors() {
        return errors;
    }
}
