package dumb.metamath;

import java.util.List;

import static java.util.Objects.requireNonNull;

/** A one-symbol formula standing for itself, usable as a placeholder inside larger formulas and templates. */
public final class FormulaVariable extends Formula implements Symbol {
    private final List<Symbol> self;

    public FormulaVariable(String label) {
        super(requireNonNull(label));
        if (label.isBlank() || label.chars().anyMatch(Character::isWhitespace))
            throw new MetamathException(MetamathException.Kind.MALFORMED, "Formula variable label must be a non-blank token: '" + label + "'");
        this.self = List.of(this);
    }

    @Override
    public String label() {
        return requireNonNull(super.label());
    }

    @Override
    public List<Symbol> symbols() {
        return self;
    }
}
