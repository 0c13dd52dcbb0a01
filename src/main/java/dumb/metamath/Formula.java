package dumb.metamath;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * An immutable, non-empty symbol sequence. Nested formulas are flattened at construction;
 * equality and hashing look only at the sequence, never at the label.
 */
public class Formula implements Labeled {
    @Nullable
    private final String label;
    @Nullable
    private final List<Symbol> symbols;
    private volatile int hashCodeCache;
    private volatile boolean hashCodeCalculated = false;

    public Formula(@Nullable String label, List<? extends Symbol> symbols) {
        if (symbols.isEmpty())
            throw new MetamathException(MetamathException.Kind.MALFORMED, "Formula must contain at least one symbol" + (label != null ? ": " + label : ""));
        this.label = label;
        this.symbols = List.copyOf(symbols);
    }

    /** Atomic formula whose sequence is supplied by the subclass. */
    Formula(String label) {
        this.label = label;
        this.symbols = null;
    }

    /** Transient formula from {@link Symbol}s and {@link Formula}s, in order. */
    public static Formula of(Object... parts) {
        return new Formula(null, flatten(List.of(parts)));
    }

    static List<Symbol> flatten(Collection<?> parts) {
        var out = new ArrayList<Symbol>();
        for (var p : parts) {
            if (p instanceof Formula f) out.addAll(f.symbols());
            else if (p instanceof Symbol s) out.add(s);
            else
                throw new MetamathException(MetamathException.Kind.MALFORMED, "Formula part must be a symbol or formula: " + p);
        }
        return out;
    }

    @Override
    @Nullable
    public String label() {
        return label;
    }

    public List<Symbol> symbols() {
        return symbols;
    }

    public int size() {
        return symbols().size();
    }

    public Symbol get(int index) {
        return symbols().get(index);
    }

    public Set<Symbol> variables() {
        return symbols().stream().filter(Symbol::isVariable).collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public boolean matches(List<? extends Symbol> other) {
        return sameSequence(symbols(), other);
    }

    static boolean sameSequence(List<? extends Symbol> x, List<? extends Symbol> y) {
        var s = x.size();
        if (s != y.size()) return false;
        for (var i = 0; i < s; i++)
            if (!Symbol.same(x.get(i), y.get(i))) return false;
        return true;
    }

    static String str(List<? extends Symbol> symbols) {
        return symbols.stream().map(Symbol::label).collect(Collectors.joining(" "));
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Formula that && this.hashCode() == that.hashCode() && sameSequence(symbols(), that.symbols()));
    }

    @Override
    public int hashCode() {
        if (!hashCodeCalculated) {
            var h = 1;
            for (var s : symbols())
                h = 31 * h + (s.label().hashCode() ^ s.getClass().getSimpleName().hashCode());
            hashCodeCache = h;
            hashCodeCalculated = true;
        }
        return hashCodeCache;
    }

    @Override
    public String toString() {
        return str(symbols());
    }
}
