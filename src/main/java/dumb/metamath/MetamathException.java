package dumb.metamath;

import static java.util.Objects.requireNonNull;

public class MetamathException extends RuntimeException {
    private final Kind kind;
    private final int step;

    public MetamathException(Kind kind, String message) {
        this(kind, message, -1, null);
    }

    public MetamathException(Kind kind, String message, int step) {
        this(kind, message, step, null);
    }

    public MetamathException(Kind kind, String message, int step, Throwable cause) {
        super(message, cause);
        this.kind = requireNonNull(kind);
        this.step = step;
    }

    public Kind kind() {
        return kind;
    }

    /** 1-based proof step, 0 for the final conclusion check, -1 when not raised by a proof run. */
    public int step() {
        return step;
    }

    /** The message without kind and step decoration. */
    public String detail() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        return kind + ": " + super.getMessage() + (step > 0 ? " at step " + step : "");
    }

    public enum Kind {
        DUPLICATE_LABEL, NOT_FOUND,
        MISSING_BINDING, UNKNOWN_BINDING, KIND_MISMATCH, TYPE_CONFLICT,
        STACK_UNDERFLOW, TYPECODE_MISMATCH, HYPOTHESIS_MISMATCH, DISJOINT_VIOLATION, UNKNOWN_REFERENCE, CONCLUSION_MISMATCH,
        STEP_LIMIT_EXCEEDED, MALFORMED, PROOF_REJECTED
    }
}
