package dumb.metamath;

import java.util.List;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/** Outcome of replaying one theorem's proof. {@code trace} is empty unless detailed mode was requested. */
sealed public interface VerificationResult permits VerificationResult.Success, VerificationResult.Failure {

    String theorem();

    List<ProofStep> trace();

    boolean ok();

    default String describe() {
        var lines = trace().stream().map(ProofStep::describe).collect(Collectors.toList());
        if (this instanceof Success s)
            lines.add("Proof successfully concludes with assertion '" + s.conclusion() + "'");
        else if (this instanceof Failure f)
            lines.add("Proof of '" + theorem() + "' failed" + (f.step() > 0 ? " at step " + f.step() : "") + ": " + f.reason() + ": " + f.message());
        return String.join("\n", lines);
    }

    record Success(String theorem, Formula conclusion, List<ProofStep> trace) implements VerificationResult {
        public Success {
            requireNonNull(theorem);
            requireNonNull(conclusion);
            trace = List.copyOf(trace);
        }

        @Override
        public boolean ok() {
            return true;
        }
    }

    /** {@code step} is the 1-based failing token, or 0 when the final conclusion check failed. */
    record Failure(String theorem, MetamathException.Kind reason, int step, String message,
                   List<ProofStep> trace) implements VerificationResult {
        public Failure {
            requireNonNull(theorem);
            requireNonNull(reason);
            requireNonNull(message);
            trace = List.copyOf(trace);
        }

        @Override
        public boolean ok() {
            return false;
        }

        public MetamathException toException() {
            return new MetamathException(reason, theorem + ": " + message, step);
        }
    }
}
