package dumb.metamath;

import org.jetbrains.annotations.Nullable;

/** Anything a {@link Registry} can index: a unique label plus optional short and external codes. */
public interface Labeled {

    String label();

    @Nullable
    default String shortCode() {
        return null;
    }

    @Nullable
    default String externalCode() {
        return null;
    }
}
