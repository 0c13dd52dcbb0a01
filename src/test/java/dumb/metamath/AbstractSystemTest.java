package dumb.metamath;

import org.junit.jupiter.api.BeforeEach;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.fail;

/** Propositional calculus demo: constants, the six axioms, and theorem mp2. */
abstract class AbstractSystemTest {

    static final List<String> CONSTANTS = List.of("wff", "->", "|-", "(", ")", "-.");
    static final String MP2_PROOF = "wps wch mp2.2 wph wps wch wi mp2.1 mp2.3 ax-mp ax-mp";

    protected FormalSystem system;

    @BeforeEach
    void setUp() {
        system = new FormalSystem(new Registry(), config(), CONSTANTS, axioms(), Map.of("mp2", mp2(MP2_PROOF)));
    }

    Config config() {
        return new Config();
    }

    /** Insertion-ordered map from alternating keys and values. */
    static Map<String, String> ordered(String... kv) {
        if (kv.length % 2 != 0) throw new IllegalArgumentException("odd key/value count");
        var m = new LinkedHashMap<String, String>();
        for (var i = 0; i < kv.length; i += 2) m.put(kv[i], kv[i + 1]);
        return m;
    }

    static Map<String, AssertionSpec> axioms() {
        var m = new LinkedHashMap<String, AssertionSpec>();
        m.put("wn", AssertionSpec.axiom(ordered("wph", "wff ph"), Map.of(), "wff -. ph"));
        m.put("wi", AssertionSpec.axiom(ordered("wph", "wff ph", "wps", "wff ps"), Map.of(), "wff ( ph -> ps )"));
        m.put("ax-1", AssertionSpec.axiom(ordered("wph", "wff ph", "wps", "wff ps"), Map.of(), "|- ( ph -> ( ps -> ph ) )"));
        m.put("ax-2", AssertionSpec.axiom(ordered("wph", "wff ph", "wps", "wff ps", "wch", "wff ch"), Map.of(),
                "|- ( ( ph -> ( ps -> ch ) ) -> ( ( ph -> ps ) -> ( ph -> ch ) ) )"));
        m.put("ax-3", AssertionSpec.axiom(ordered("wph", "wff ph", "wps", "wff ps"), Map.of(), "|- ( ( -. ph -> -. ps ) -> ( ps -> ph ) )"));
        m.put("ax-mp", AssertionSpec.axiom(ordered("wph", "wff ph", "wps", "wff ps"),
                ordered("min", "|- ph", "maj", "|- ( ph -> ps )"), "|- ps"));
        return m;
    }

    static AssertionSpec mp2(String proof) {
        return AssertionSpec.theorem(ordered("wph", "wff ph", "wps", "wff ps", "wch", "wff ch"),
                ordered("mp2.1", "|- ph", "mp2.2", "|- ps", "mp2.3", "|- ( ph -> ( ps -> ch ) )"), "|- ch", proof);
    }

    /** {@code bogus} has a broken proof, {@code uses} cites it, {@code via-mp2} cites {@code mp2}. */
    static Map<String, AssertionSpec> lemmaChain() {
        var m = new LinkedHashMap<String, AssertionSpec>();
        m.put("bogus", AssertionSpec.theorem(ordered("wph", "wff ph", "wps", "wff ps"), ordered("bogus.1", "|- ph"), "|- ps", "wps"));
        m.put("uses", AssertionSpec.theorem(ordered("wph", "wff ph", "wps", "wff ps"), ordered("uses.1", "|- ph"), "|- ps",
                "wph wps uses.1 bogus"));
        m.put("via-mp2", AssertionSpec.theorem(ordered("wph", "wff ph", "wps", "wff ps", "wch", "wff ch"),
                ordered("v.1", "|- ph", "v.2", "|- ps", "v.3", "|- ( ph -> ( ps -> ch ) )"), "|- ch",
                "wph wps wch v.1 v.2 v.3 mp2"));
        return m;
    }

    static List<String> tokens(String proof) {
        return Arrays.asList(proof.split(" "));
    }

    static VerificationResult.Failure assertFailure(VerificationResult r, MetamathException.Kind kind, int step) {
        var f = assertInstanceOf(VerificationResult.Failure.class, r, () -> "expected failure, got " + r.describe());
        assertEquals(kind, f.reason(), f::message);
        assertEquals(step, f.step(), f::message);
        return f;
    }

    static VerificationResult.Success assertSuccess(VerificationResult r) {
        if (r instanceof VerificationResult.Success s) return s;
        fail("expected success, got:\n" + r.describe());
        return null;
    }
}
