package io.github.eutro.hlo2shlo.core.conversion;

import io.github.eutro.hlo2shlo.core.ir.Operation;

/**
 * A message about an operation, reported while converting it.
 */
public final class Diagnostic {
    public enum Severity {
        /**
         * An operation did not match a conversion. This is expected, and only an error
         * if the driver needed the operation to be converted.
         */
        REMARK,
        /**
         * An operation violates a constraint of the conversion.
         */
        ERROR,
    }

    public final Severity severity;
    public final String opName;
    public final String message;

    public Diagnostic(Severity severity, String opName, String message) {
        this.severity = severity;
        this.opName = opName;
        this.message = message;
    }

    public static Diagnostic remark(Operation op, String message) {
        return new Diagnostic(Severity.REMARK, op.getName(), message);
    }

    public static Diagnostic error(Operation op, String message) {
        return new Diagnostic(Severity.ERROR, op.getName(), message);
    }

    @Override
    public String toString() {
        return severity.name().toLowerCase() + ": '" + opName + "' " + message;
    }
}
