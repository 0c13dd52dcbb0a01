package dumb.metamath;

import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

public record Variable(String label, @Nullable String shortCode, @Nullable String externalCode) implements Symbol {
    public Variable {
        requireNonNull(label);
        if (label.isBlank() || label.chars().anyMatch(Character::isWhitespace))
            throw new MetamathException(MetamathException.Kind.MALFORMED, "Variable label must be a non-blank token: '" + label + "'");
    }

    public Variable(String label) {
        this(label, null, null);
    }

    @Override
    public String toString() {
        return label;
    }
}
