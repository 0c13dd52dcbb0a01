package dumb.metamath;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static dumb.metamath.MetamathException.Kind.MALFORMED;
import static java.util.Objects.requireNonNull;

/** A compiled axiom ({@code p == null}) or theorem over the symbols of one {@link Registry}. */
public record Assertion(String label, Set<Disjoint> d, Map<String, TypedHypothesis> t, Map<String, List<Symbol>> h,
                        List<Symbol> a, @Nullable List<String> p) implements Labeled {
    public Assertion {
        requireNonNull(label);
        d = Set.copyOf(d);
        t = Collections.unmodifiableMap(new LinkedHashMap<>(t));
        var hs = new LinkedHashMap<String, List<Symbol>>();
        h.forEach((k, v) -> hs.put(k, List.copyOf(v)));
        h = Collections.unmodifiableMap(hs);
        a = List.copyOf(a);
        if (a.isEmpty()) throw new MetamathException(MALFORMED, label + ": empty conclusion");
        if (p != null) p = List.copyOf(p);
    }

    public boolean isTheorem() {
        return p != null;
    }

    public int arity() {
        return t.size() + h.size();
    }

    static Assertion compile(String label, AssertionSpec spec, Registry registry) {
        var locals = new HashSet<String>();
        var vars = new LinkedHashMap<String, Variable>();

        var t = new LinkedHashMap<String, TypedHypothesis>();
        spec.t().forEach((k, v) -> {
            local(label, k, locals, registry);
            var parts = tokens(v);
            if (parts.length != 2)
                throw malformed(label, "type hypothesis '" + k + "' must be 'typecode variable': '" + v + "'");
            var typecode = constant(label, parts[0], registry)
                    .orElseThrow(() -> malformed(label, "type hypothesis '" + k + "' prefix is not a constant: '" + parts[0] + "'"));
            var name = parts[1];
            if (vars.containsKey(name) || locals.contains(name))
                throw malformed(label, "variable '" + name + "' bound twice or clashes with a local label");
            if (registry.find(name).filter(e -> !(e instanceof Variable)).isPresent())
                throw malformed(label, "variable '" + name + "' clashes with a global label");
            var variable = registry.intern(name);
            vars.put(name, variable);
            locals.add(name);
            t.put(k, new TypedHypothesis(typecode, variable));
        });

        var h = new LinkedHashMap<String, List<Symbol>>();
        spec.h().forEach((k, v) -> {
            local(label, k, locals, registry);
            h.put(k, pattern(label, "hypothesis '" + k + "'", v, vars, registry));
        });

        var a = pattern(label, "conclusion", spec.a(), vars, registry);

        var d = new LinkedHashSet<Disjoint>();
        spec.d().forEach((k, v) -> {
            local(label, k, locals, registry);
            var parts = tokens(v);
            if (parts.length != 2 || parts[0].equals(parts[1]) || !vars.containsKey(parts[0]) || !vars.containsKey(parts[1]))
                throw malformed(label, "disjoint '" + k + "' must name two different bound variables: '" + v + "'");
            d.add(Disjoint.of(k, vars.get(parts[0]), vars.get(parts[1])));
        });

        var unused = new LinkedHashSet<>(vars.values());
        h.values().forEach(unused::removeAll);
        a.forEach(unused::remove);
        if (!unused.isEmpty())
            throw malformed(label, "variables never used in hypotheses or conclusion: " + unused);

        return new Assertion(label, d, t, h, a, spec.isTheorem() ? spec.proofTokens() : null);
    }

    private static void local(String label, String key, Set<String> locals, Registry registry) {
        if (!locals.add(key))
            throw malformed(label, "duplicate local label '" + key + "'");
        if (registry.find(key).filter(e -> !(e instanceof Variable)).isPresent())
            throw malformed(label, "local label '" + key + "' clashes with a global label");
    }

    private static List<Symbol> pattern(String label, String what, String text, Map<String, Variable> vars, Registry registry) {
        var out = new ArrayList<Symbol>();
        for (var tok : tokens(text)) {
            var v = vars.get(tok);
            if (v != null) out.add(v);
            else out.add(constant(label, tok, registry)
                    .orElseThrow(() -> malformed(label, what + " token is neither a constant nor a bound variable: '" + tok + "'")));
        }
        if (out.isEmpty()) throw malformed(label, what + " is empty");
        return out;
    }

    private static Optional<Constant> constant(String label, String tok, Registry registry) {
        return registry.find(tok).filter(Constant.class::isInstance).map(Constant.class::cast);
    }

    private static String[] tokens(String text) {
        var s = text.trim();
        return s.isEmpty() ? new String[0] : s.split("\\s+");
    }

    private static MetamathException malformed(String label, String message) {
        return new MetamathException(MALFORMED, label + ": " + message);
    }

    public record TypedHypothesis(Constant typecode, Variable variable) {
        public TypedHypothesis {
            requireNonNull(typecode);
            requireNonNull(variable);
        }

        public List<Symbol> symbols() {
            return List.of(typecode, variable);
        }

        @Override
        public String toString() {
            return typecode.label() + " " + variable.label();
        }
    }

    /** Unordered pair of variables that must never share a variable after substitution. */
    public record Disjoint(String label, Variable x, Variable y) {
        public Disjoint {
            requireNonNull(label);
            requireNonNull(x);
            requireNonNull(y);
        }

        static Disjoint of(String label, Variable u, Variable v) {
            return u.label().compareTo(v.label()) <= 0 ? new Disjoint(label, u, v) : new Disjoint(label, v, u);
        }

        @Override
        public String toString() {
            return x.label() + " " + y.label();
        }
    }
}
