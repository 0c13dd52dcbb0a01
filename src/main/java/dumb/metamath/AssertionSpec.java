package dumb.metamath;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static dumb.metamath.MetamathException.Kind.MALFORMED;
import static java.util.Objects.requireNonNull;

/**
 * Caller-facing shape of an axiom or theorem. Patterns are whitespace-separated symbol labels:
 * {@code d} label to "x y", {@code t} label to "typecode var", {@code h} label to pattern,
 * {@code a} the conclusion and {@code p} the proof tokens (theorems only). Map order is significant.
 * A JSON record must carry exactly the keys d, t, h, a and, for a theorem, p.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AssertionSpec(Map<String, String> d, Map<String, String> t, Map<String, String> h, String a,
                            @Nullable @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY) List<String> p) {
    public AssertionSpec {
        d = ordered(d);
        t = ordered(t);
        h = ordered(h);
        requireNonNull(a, "a");
        if (p != null) p = List.copyOf(p);
    }

    @JsonCreator
    public static AssertionSpec json(@JsonProperty("d") @Nullable Map<String, String> d,
                                     @JsonProperty("t") @Nullable Map<String, String> t,
                                     @JsonProperty("h") @Nullable Map<String, String> h,
                                     @JsonProperty("a") @Nullable String a,
                                     @JsonProperty("p") @Nullable @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY) List<String> p) {
        if (d == null || t == null || h == null || a == null)
            throw new MetamathException(MALFORMED, "assertion record needs keys d, t, h and a");
        return new AssertionSpec(d, t, h, a, p);
    }

    public static AssertionSpec axiom(Map<String, String> t, Map<String, String> h, String a) {
        return new AssertionSpec(Map.of(), t, h, a, null);
    }

    public static AssertionSpec theorem(Map<String, String> t, Map<String, String> h, String a, String proof) {
        return new AssertionSpec(Map.of(), t, h, a, Arrays.asList(proof.trim().split("\\s+")));
    }

    public AssertionSpec withDisjoint(Map<String, String> pairs) {
        return new AssertionSpec(pairs, t, h, a, p);
    }

    @JsonIgnore
    public boolean isTheorem() {
        return p != null;
    }

    /** Proof tokens with any whitespace-joined entries split apart. */
    @JsonIgnore
    public List<String> proofTokens() {
        if (p == null) return List.of();
        return p.stream().flatMap(s -> Arrays.stream(s.trim().split("\\s+"))).filter(s -> !s.isEmpty()).toList();
    }

    private static Map<String, String> ordered(@Nullable Map<String, String> m) {
        return m == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(m));
    }
}
