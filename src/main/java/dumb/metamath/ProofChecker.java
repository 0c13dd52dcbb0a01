package dumb.metamath;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

import static dumb.metamath.MetamathException.Kind.CONCLUSION_MISMATCH;
import static dumb.metamath.MetamathException.Kind.DISJOINT_VIOLATION;
import static dumb.metamath.MetamathException.Kind.HYPOTHESIS_MISMATCH;
import static dumb.metamath.MetamathException.Kind.MALFORMED;
import static dumb.metamath.MetamathException.Kind.STACK_UNDERFLOW;
import static dumb.metamath.MetamathException.Kind.STEP_LIMIT_EXCEEDED;
import static dumb.metamath.MetamathException.Kind.TYPECODE_MISMATCH;
import static dumb.metamath.MetamathException.Kind.UNKNOWN_REFERENCE;
import static java.util.Objects.requireNonNull;

/**
 * Reverse-polish replay of a theorem's proof script. Hypothesis references push their pattern;
 * an axiom or theorem reference pops its arity, matches typed hypotheses into a substitution,
 * checks logical hypotheses and disjointness, and pushes its substituted conclusion.
 */
public class ProofChecker {
    private static final Logger logger = LoggerFactory.getLogger(ProofChecker.class);

    private final Function<String, Optional<Assertion>> rules;
    private final Config config;

    /**
     * {@code rules} resolves the axioms and theorems a proof may cite; it may throw a
     * {@link MetamathException} to refuse a reference, which fails the proof at the citing step.
     */
    public ProofChecker(Function<String, Optional<Assertion>> rules, Config config) {
        this.rules = requireNonNull(rules);
        this.config = requireNonNull(config);
    }

    public VerificationResult check(Assertion theorem, boolean detailed) {
        if (!theorem.isTheorem())
            throw new MetamathException(MALFORMED, theorem.label() + " has no proof");
        var script = theorem.p();
        var run = new Run(theorem);
        try {
            for (var i = 0; i < script.size(); i++) {
                var index = i + 1;
                if (config.maxSteps() > 0 && index > config.maxSteps())
                    throw new MetamathException(STEP_LIMIT_EXCEEDED, "proof exceeds " + config.maxSteps() + " steps", index);
                var step = run.step(index, script.get(i));
                if (config.logSteps()) logger.debug("{}: {}", theorem.label(), step.describe());
            }
            return run.conclude(detailed);
        } catch (MetamathException e) {
            return new VerificationResult.Failure(theorem.label(), e.kind(), Math.max(e.step(), 0), e.detail(),
                    detailed ? run.log : List.of());
        }
    }

    private static List<Symbol> substitute(List<Symbol> pattern, Map<Variable, List<Symbol>> subst) {
        var out = new ArrayList<Symbol>();
        for (var s : pattern) {
            var v = s instanceof Variable variable ? subst.get(variable) : null;
            if (v != null) out.addAll(v);
            else out.add(s);
        }
        return out;
    }

    private static Set<Symbol> variablesOf(List<Symbol> symbols) {
        var out = new HashSet<Symbol>();
        for (var s : symbols) if (s.isVariable()) out.add(s);
        return out;
    }

    private final class Run {
        final Assertion theorem;
        final List<List<Symbol>> stack = new ArrayList<>();
        final List<ProofStep> log = new ArrayList<>();

        Run(Assertion theorem) {
            this.theorem = theorem;
        }

        ProofStep step(int index, String token) {
            ProofStep step;
            var typed = theorem.t().get(token);
            var hyp = theorem.h().get(token);
            if (typed != null) {
                stack.add(typed.symbols());
                step = ProofStep.push(index, ProofStep.Action.PUSH_TYPE, token, typed.symbols());
            } else if (hyp != null) {
                stack.add(hyp);
                step = ProofStep.push(index, ProofStep.Action.PUSH_HYPOTHESIS, token, hyp);
            } else {
                step = apply(index, resolve(index, token));
            }
            log.add(step);
            return step;
        }

        Assertion resolve(int index, String token) {
            Optional<Assertion> rule;
            try {
                rule = rules.apply(token);
            } catch (MetamathException e) {
                if (e.step() >= 0) throw e;
                throw new MetamathException(e.kind(), e.detail(), index, e);
            }
            return rule.orElseThrow(() -> new MetamathException(UNKNOWN_REFERENCE, "unknown proof step '" + token + "'", index));
        }

        ProofStep apply(int index, Assertion rule) {
            var n = rule.arity();
            if (stack.size() < n)
                throw new MetamathException(STACK_UNDERFLOW, "applying '" + rule.label() + "' needs " + n + " items, stack holds " + stack.size(), index);
            var top = stack.subList(stack.size() - n, stack.size());
            var args = new ArrayList<>(top);
            top.clear();

            var subst = new LinkedHashMap<Variable, List<Symbol>>();
            var matches = new ArrayList<ProofStep.Match>();
            var i = 0;
            for (var e : rule.t().entrySet()) {
                var expected = e.getValue();
                var candidate = args.get(i++);
                if (candidate.isEmpty() || !Symbol.same(candidate.get(0), expected.typecode()))
                    throw new MetamathException(TYPECODE_MISMATCH, "type mismatch for " + e.getKey() + " of '" + rule.label()
                            + "': expected '" + expected.typecode().label() + "', got '" + Formula.str(candidate) + "'", index);
                var value = candidate.subList(1, candidate.size());
                subst.put(expected.variable(), value);
                matches.add(new ProofStep.Match(e.getKey(), expected.typecode(), expected.variable(), value));
            }

            var hypotheses = new ArrayList<ProofStep.HypothesisMatch>();
            for (var e : rule.h().entrySet()) {
                var expected = substitute(e.getValue(), subst);
                var actual = args.get(i++);
                if (!Formula.sameSequence(expected, actual))
                    throw new MetamathException(HYPOTHESIS_MISMATCH, "hypothesis mismatch for " + e.getKey() + " of '" + rule.label()
                            + "': expected '" + Formula.str(expected) + "', got '" + Formula.str(actual) + "'", index);
                hypotheses.add(new ProofStep.HypothesisMatch(e.getKey(), actual));
            }

            for (var dj : rule.d()) {
                var common = variablesOf(subst.get(dj.x()));
                common.retainAll(variablesOf(subst.get(dj.y())));
                if (!common.isEmpty())
                    throw new MetamathException(DISJOINT_VIOLATION, "distinct violation " + dj.label() + " of '" + rule.label() + "': '"
                            + dj.x().label() + "' and '" + dj.y().label() + "' share " + Formula.str(new ArrayList<>(common)), index);
            }

            var conclusion = substitute(rule.a(), subst);
            stack.add(conclusion);
            var action = rule.isTheorem() ? ProofStep.Action.APPLY_THEOREM : ProofStep.Action.APPLY_AXIOM;
            return new ProofStep(index, action, rule.label(), args, matches, hypotheses, conclusion);
        }

        VerificationResult conclude(boolean detailed) {
            if (stack.size() != 1)
                throw new MetamathException(CONCLUSION_MISMATCH, "proof ends with " + stack.size() + " items on the stack, expected 1", 0);
            var last = stack.get(0);
            if (!Formula.sameSequence(last, theorem.a()))
                throw new MetamathException(CONCLUSION_MISMATCH, "proof concludes '" + Formula.str(last) + "', expected '" + Formula.str(theorem.a()) + "'", 0);
            return new VerificationResult.Success(theorem.label(), new Formula(null, last), detailed ? log : List.of());
        }
    }
}
