package dumb.metamath;

import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

public record Constant(String label, @Nullable String shortCode, @Nullable String externalCode) implements Symbol {
    public Constant {
        requireNonNull(label);
        if (label.isBlank() || label.chars().anyMatch(Character::isWhitespace))
            throw new MetamathException(MetamathException.Kind.MALFORMED, "Constant label must be a non-blank token: '" + label + "'");
    }

    public Constant(String label) {
        this(label, null, null);
    }

    @Override
    public String toString() {
        return label;
    }
}
