package dumb.metamath;

import java.util.List;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/** One entry of a proof run's step log. {@code popped}, {@code matches} and {@code hypotheses} are empty for pushes. */
public record ProofStep(int index, Action action, String reference, List<List<Symbol>> popped, List<Match> matches,
                        List<HypothesisMatch> hypotheses, List<Symbol> pushed) {
    public ProofStep {
        requireNonNull(action);
        requireNonNull(reference);
        popped = popped.stream().map(List::copyOf).collect(Collectors.toUnmodifiableList());
        matches = List.copyOf(matches);
        hypotheses = List.copyOf(hypotheses);
        pushed = List.copyOf(pushed);
    }

    static ProofStep push(int index, Action action, String reference, List<Symbol> pushed) {
        return new ProofStep(index, action, reference, List.of(), List.of(), List.of(), pushed);
    }

    public String describe() {
        return switch (action) {
            case PUSH_TYPE -> "Step " + index + ": push type assumption '" + reference + "' -> '" + Formula.str(pushed) + "'";
            case PUSH_HYPOTHESIS -> "Step " + index + ": push hypothesis '" + reference + "' -> '" + Formula.str(pushed) + "'";
            case APPLY_AXIOM, APPLY_THEOREM -> {
                var sb = new StringBuilder()
                        .append("Step ").append(index).append(": apply ")
                        .append(action == Action.APPLY_AXIOM ? "axiom" : "theorem")
                        .append(" '").append(reference).append("', pop ")
                        .append(popped.stream().map(p -> "'" + Formula.str(p) + "'").collect(Collectors.joining(", ", "[", "]")));
                for (var m : matches)
                    sb.append("\n  match ").append(m.hypothesis()).append(": type '").append(m.typecode().label())
                            .append("', var '").append(m.variable().label()).append("' -> '").append(Formula.str(m.value())).append('\'');
                for (var hm : hypotheses)
                    sb.append("\n  hypothesis ").append(hm.hypothesis()).append(" matches '").append(Formula.str(hm.value())).append('\'');
                sb.append("\n  conclude -> '").append(Formula.str(pushed)).append("' and push to stack");
                yield sb.toString();
            }
        };
    }

    @Override
    public String toString() {
        return describe();
    }

    public enum Action {PUSH_TYPE, PUSH_HYPOTHESIS, APPLY_AXIOM, APPLY_THEOREM}

    public record Match(String hypothesis, Constant typecode, Variable variable, List<Symbol> value) {
        public Match {
            value = List.copyOf(value);
        }
    }

    public record HypothesisMatch(String hypothesis, List<Symbol> value) {
        public HypothesisMatch {
            value = List.copyOf(value);
        }
    }
}
