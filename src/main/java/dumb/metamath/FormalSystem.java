package dumb.metamath;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import static dumb.metamath.MetamathException.Kind.DUPLICATE_LABEL;
import static dumb.metamath.MetamathException.Kind.MALFORMED;
import static dumb.metamath.MetamathException.Kind.NOT_FOUND;
import static dumb.metamath.MetamathException.Kind.PROOF_REJECTED;
import static dumb.metamath.MetamathException.Kind.UNKNOWN_REFERENCE;
import static java.util.Objects.requireNonNull;

/**
 * Constants, axioms and theorems sharing one {@link Registry} namespace. A theorem's proof may cite only
 * axioms and theorems declared before it, and a cited theorem must itself verify. Built assertions are immutable, so {@link #verify} runs may
 * proceed in parallel; additions are serialized.
 */
public class FormalSystem {
    private static final Logger logger = LoggerFactory.getLogger(FormalSystem.class);

    private final Registry registry;
    private final Config config;
    private final List<String> constants = new CopyOnWriteArrayList<>();
    private final List<String> declared = new CopyOnWriteArrayList<>();
    private final Map<String, Integer> order = new ConcurrentHashMap<>();
    private final Map<String, Assertion> assertions = new ConcurrentHashMap<>();
    private final Map<String, AssertionSpec> specs = new ConcurrentHashMap<>();
    /** Proof verdicts of declared theorems; absent until first checked. */
    private final Map<String, Boolean> sound = new ConcurrentHashMap<>();

    public FormalSystem(Collection<String> constants, Map<String, AssertionSpec> axioms, Map<String, AssertionSpec> theorems) {
        this(new Registry(), Config.load(), constants, axioms, theorems);
    }

    public FormalSystem(Registry registry, Config config) {
        this(registry, config, List.of(), Map.of(), Map.of());
    }

    public FormalSystem(Registry registry, Config config, Collection<String> constants,
                        Map<String, AssertionSpec> axioms, Map<String, AssertionSpec> theorems) {
        this.registry = requireNonNull(registry);
        this.config = requireNonNull(config);
        constants.forEach(this::addConstant);
        axioms.forEach(this::addAxiom);
        theorems.forEach((label, spec) -> add(label, spec, config.verifyOnLoad()));
        if (!constants.isEmpty() || !axioms.isEmpty() || !theorems.isEmpty())
            logger.info("Formal system built: {} constants, {} axioms, {} theorems", constants.size(), axioms.size(), theorems.size());
    }

    public synchronized Constant addConstant(String label) {
        var c = registry.constant(label);
        constants.add(label);
        return c;
    }

    public synchronized Assertion addAxiom(String label, AssertionSpec spec) {
        if (spec.isTheorem())
            throw new MetamathException(MALFORMED, label + ": an axiom cannot carry a proof");
        checkFree(label);
        return declare(label, spec, Assertion.compile(label, spec, registry));
    }

    /** Adds a theorem after replaying its proof; rejects it with {@code PROOF_REJECTED} when the proof fails. */
    public Assertion addTheorem(String label, AssertionSpec spec) {
        return add(label, spec, true);
    }

    private synchronized Assertion add(String label, AssertionSpec spec, boolean verify) {
        if (!spec.isTheorem())
            throw new MetamathException(MALFORMED, label + ": a theorem needs a proof");
        checkFree(label);
        var theorem = Assertion.compile(label, spec, registry);
        if (verify) {
            var result = check(theorem, declared.size(), false);
            if (result instanceof VerificationResult.Failure f) {
                logger.warn("Rejected theorem {}: {}", label, f.message());
                throw new MetamathException(PROOF_REJECTED, "proof of '" + label + "' is incorrect: " + f.message(), f.step(), f.toException());
            }
            sound.put(label, true);
        }
        return declare(label, spec, theorem);
    }

    private void checkFree(String label) {
        if (registry.contains(label))
            throw new MetamathException(DUPLICATE_LABEL, "Label already registered: " + label);
    }

    private Assertion declare(String label, AssertionSpec spec, Assertion assertion) {
        registry.register(assertion);
        order.put(label, declared.size());
        declared.add(label);
        assertions.put(label, assertion);
        specs.put(label, spec);
        logger.debug("Declared {} {}", assertion.isTheorem() ? "theorem" : "axiom", label);
        return assertion;
    }

    private VerificationResult check(Assertion theorem, int before, boolean detailed) {
        return new ProofChecker(l -> citable(l, before), config).check(theorem, detailed);
    }

    private Optional<Assertion> citable(String label, int before) {
        var idx = order.get(label);
        var rule = idx != null && idx < before ? Optional.ofNullable(assertions.get(label)) : Optional.<Assertion>empty();
        if (rule.isPresent() && rule.get().isTheorem() && !sound(rule.get()))
            throw new MetamathException(UNKNOWN_REFERENCE, "cited theorem '" + label + "' does not verify");
        return rule;
    }

    /** Cached verdict; earlier theorems are checked first, so the recursion follows declaration order. */
    private boolean sound(Assertion theorem) {
        var verdict = sound.get(theorem.label());
        if (verdict == null) {
            verdict = check(theorem, order.get(theorem.label()), false).ok();
            sound.put(theorem.label(), verdict);
        }
        return verdict;
    }

    public VerificationResult verify(String theorem) {
        return verify(theorem, false);
    }

    /** Replays the proof of {@code theorem}; {@code detailed} adds the step trace to the result. */
    public VerificationResult verify(String theorem, boolean detailed) {
        var t = theorem(theorem).orElseThrow(() -> new MetamathException(NOT_FOUND, "No theorem labeled: " + theorem));
        var result = check(t, order.get(theorem), detailed);
        sound.put(theorem, result.ok());
        if (result instanceof VerificationResult.Failure f)
            logger.info("{}: {} at step {}: {}", theorem, f.reason(), f.step(), f.message());
        else
            logger.info("{}: verified in {} steps", theorem, t.p().size());
        return result;
    }

    public Map<String, VerificationResult> verifyAll() {
        var out = new LinkedHashMap<String, VerificationResult>();
        theorems().keySet().forEach(l -> out.put(l, verify(l)));
        return out;
    }

    /** Composes templates under the configured collision policy. */
    public FormulaTemplate compose(FormulaTemplate template, Map<String, ?> bindings) {
        return template.generateTemplate(bindings, config.collisions());
    }

    public Optional<Assertion> axiom(String label) {
        return Optional.ofNullable(assertions.get(label)).filter(a -> !a.isTheorem());
    }

    public Optional<Assertion> theorem(String label) {
        return Optional.ofNullable(assertions.get(label)).filter(Assertion::isTheorem);
    }

    public List<String> constants() {
        return Collections.unmodifiableList(constants);
    }

    public Map<String, Assertion> axioms() {
        return select(false);
    }

    public Map<String, Assertion> theorems() {
        return select(true);
    }

    /** The caller-facing records this system was built from, in declaration order. */
    public Map<String, AssertionSpec> specs(boolean theorems) {
        var out = new LinkedHashMap<String, AssertionSpec>();
        select(theorems).keySet().forEach(l -> out.put(l, specs.get(l)));
        return Collections.unmodifiableMap(out);
    }

    private Map<String, Assertion> select(boolean theorems) {
        var out = new LinkedHashMap<String, Assertion>();
        for (var l : declared) {
            var a = assertions.get(l);
            if (a != null && a.isTheorem() == theorems) out.put(l, a);
        }
        return Collections.unmodifiableMap(out);
    }

    public Registry registry() {
        return registry;
    }

    public Config config() {
        return config;
    }
}
