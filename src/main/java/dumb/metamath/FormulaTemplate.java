package dumb.metamath;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.stream.Collectors;

import static dumb.metamath.MetamathException.Kind.KIND_MISMATCH;
import static dumb.metamath.MetamathException.Kind.MALFORMED;
import static dumb.metamath.MetamathException.Kind.MISSING_BINDING;
import static dumb.metamath.MetamathException.Kind.TYPE_CONFLICT;
import static dumb.metamath.MetamathException.Kind.UNKNOWN_BINDING;
import static java.util.Objects.requireNonNull;

/**
 * Formula skeleton with named parameters. Every declared parameter occurs in the body and every
 * body reference is declared. {@link #generate} and {@link #generateTemplate} never mutate the receiver.
 */
public final class FormulaTemplate {
    private final Map<String, ParamKind> params;
    private final List<Token> body;

    public FormulaTemplate(Map<String, ParamKind> params, List<? extends Token> body) {
        if (body.isEmpty())
            throw new MetamathException(MALFORMED, "Template body must not be empty");
        this.params = Collections.unmodifiableMap(new LinkedHashMap<>(requireNonNull(params)));
        this.body = List.copyOf(body);
        var refs = refs(this.body);
        if (!refs.equals(this.params.keySet())) {
            var undeclared = new TreeSet<>(refs);
            undeclared.removeAll(this.params.keySet());
            var unused = new TreeSet<>(this.params.keySet());
            unused.removeAll(refs);
            throw new MetamathException(MALFORMED, "Template parameters and body disagree: undeclared " + undeclared + ", unused " + unused);
        }
    }

    /**
     * Parts are {@link Symbol}s and {@link Formula}s (literal, flattened), {@link Token}s, or
     * strings naming a parameter.
     */
    public static FormulaTemplate of(Map<String, ParamKind> params, Object... parts) {
        var tokens = new ArrayList<Token>();
        for (var p : parts) {
            if (p instanceof Token t) tokens.add(t);
            else if (p instanceof String name) tokens.add(new Ref(name));
            else if (p instanceof Formula f) f.symbols().forEach(s -> tokens.add(new Literal(s)));
            else if (p instanceof Symbol s) tokens.add(new Literal(s));
            else throw new MetamathException(MALFORMED, "Template part must be a symbol, formula, token or parameter name: " + p);
        }
        return new FormulaTemplate(params, tokens);
    }

    private static LinkedHashSet<String> refs(List<Token> body) {
        return body.stream().filter(Ref.class::isInstance).map(t -> ((Ref) t).name())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public Map<String, ParamKind> params() {
        return params;
    }

    public List<Token> body() {
        return body;
    }

    /** Instantiates every parameter with a formula; the result is transient and unregistered. */
    public Formula generate(Map<String, ? extends Formula> bindings) {
        var splices = new LinkedHashMap<String, Binding>();
        bindings.forEach((k, v) -> {
            if (v == null) throw nullBinding(k);
            splices.put(k, new Splice(v));
        });
        var result = substitute(splices, CollisionPolicy.UNIFY);
        var symbols = new ArrayList<Symbol>(result.body.size());
        for (var t : result.body) symbols.add(((Literal) t).symbol());
        return new Formula(null, symbols);
    }

    /**
     * Binding values are a parameter name (rename), a {@link Formula} (splice) or a
     * {@link FormulaTemplate} (nest), or any {@link Binding}.
     */
    public FormulaTemplate generateTemplate(Map<String, ?> bindings) {
        return generateTemplate(bindings, CollisionPolicy.UNIFY);
    }

    public FormulaTemplate generateTemplate(Map<String, ?> bindings, CollisionPolicy policy) {
        var resolved = new LinkedHashMap<String, Binding>();
        bindings.forEach((k, v) -> resolved.put(k, Binding.of(k, v)));
        return substitute(resolved, requireNonNull(policy));
    }

    private FormulaTemplate substitute(Map<String, Binding> bindings, CollisionPolicy policy) {
        var missing = new TreeSet<>(params.keySet());
        missing.removeAll(bindings.keySet());
        if (!missing.isEmpty())
            throw new MetamathException(MISSING_BINDING, "No binding for parameters " + missing);
        var unknown = new TreeSet<>(bindings.keySet());
        unknown.removeAll(params.keySet());
        if (!unknown.isEmpty())
            throw new MetamathException(UNKNOWN_BINDING, "Not parameters of this template: " + unknown);

        var merged = new LinkedHashMap<String, ParamKind>();
        var origin = new LinkedHashMap<String, String>();
        params.forEach((name, kind) -> {
            var b = bindings.get(name);
            if (b instanceof Rename r) {
                contribute(merged, origin, r.name(), kind, name, policy);
            } else if (b instanceof Splice) {
                if (kind != ParamKind.FORMULA)
                    throw new MetamathException(KIND_MISMATCH, "Parameter '" + name + "' expects a " + kind + ", bound to a formula");
            } else if (b instanceof Nest n) {
                if (kind != ParamKind.TEMPLATE)
                    throw new MetamathException(KIND_MISMATCH, "Parameter '" + name + "' expects a " + kind + ", bound to a template");
                n.template().params.forEach((sub, subKind) -> contribute(merged, origin, sub, subKind, name, policy));
            }
        });

        var out = new ArrayList<Token>(body.size());
        for (var t : body) {
            if (t instanceof Ref r) {
                var b = bindings.get(r.name());
                if (b instanceof Rename rn) out.add(new Ref(rn.name()));
                else if (b instanceof Splice s) s.formula().symbols().forEach(x -> out.add(new Literal(x)));
                else out.addAll(((Nest) b).template().body);
            } else {
                out.add(t);
            }
        }
        return new FormulaTemplate(merged, out);
    }

    private static void contribute(Map<String, ParamKind> merged, Map<String, String> origin, String name, ParamKind kind,
                                   String from, CollisionPolicy policy) {
        var existing = merged.get(name);
        if (existing == null) {
            merged.put(name, kind);
            origin.put(name, from);
            return;
        }
        if (existing != kind)
            throw new MetamathException(TYPE_CONFLICT, "Parameter '" + name + "' contributed as " + existing + " by '" + origin.get(name) + "' and as " + kind + " by '" + from + "'");
        if (policy == CollisionPolicy.REJECT && !origin.get(name).equals(from))
            throw new MetamathException(TYPE_CONFLICT, "Parameter '" + name + "' contributed by both '" + origin.get(name) + "' and '" + from + "'");
    }

    private static void checkName(String name) {
        requireNonNull(name);
        if (name.isBlank() || name.chars().anyMatch(Character::isWhitespace))
            throw new MetamathException(MALFORMED, "Parameter name must be a non-blank token: '" + name + "'");
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof FormulaTemplate that && params.equals(that.params) && body.equals(that.body));
    }

    @Override
    public int hashCode() {
        return Objects.hash(params, body);
    }

    @Override
    public String toString() {
        return params + " " + body.stream().map(Token::toString).collect(Collectors.joining(" "));
    }

    public enum ParamKind {FORMULA, TEMPLATE}

    /** How same-kind parameter names contributed by different bindings are resolved. */
    public enum CollisionPolicy {UNIFY, REJECT}

    sealed public interface Token permits Literal, Ref {
    }

    public record Literal(Symbol symbol) implements Token {
        public Literal {
            requireNonNull(symbol);
        }

        @Override
        public String toString() {
            return symbol.label();
        }
    }

    public record Ref(String name) implements Token {
        public Ref {
            checkName(name);
        }

        @Override
        public String toString() {
            return "{" + name + "}";
        }
    }

    sealed public interface Binding permits Rename, Splice, Nest {
        static Binding of(String param, @Nullable Object value) {
            if (value == null) throw nullBinding(param);
            if (value instanceof Binding b) return b;
            if (value instanceof String s) return new Rename(s);
            if (value instanceof Formula f) return new Splice(f);
            if (value instanceof FormulaTemplate t) return new Nest(t);
            throw new MetamathException(KIND_MISMATCH, "Parameter '" + param + "' bound to unsupported value: " + value);
        }
    }

    private static MetamathException nullBinding(String param) {
        return new MetamathException(MISSING_BINDING, "Parameter '" + param + "' bound to null");
    }

    public record Rename(String name) implements Binding {
        public Rename {
            checkName(name);
        }
    }

    public record Splice(Formula formula) implements Binding {
        public Splice {
            requireNonNull(formula);
        }
    }

    public record Nest(FormulaTemplate template) implements Binding {
        public Nest {
            requireNonNull(template);
        }
    }
}
