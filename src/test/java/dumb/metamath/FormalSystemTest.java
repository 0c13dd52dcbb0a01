package dumb.metamath;

import dumb.metamath.FormulaTemplate.CollisionPolicy;
import dumb.metamath.FormulaTemplate.ParamKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static dumb.metamath.MetamathException.Kind.CONCLUSION_MISMATCH;
import static dumb.metamath.MetamathException.Kind.DUPLICATE_LABEL;
import static dumb.metamath.MetamathException.Kind.MALFORMED;
import static dumb.metamath.MetamathException.Kind.NOT_FOUND;
import static dumb.metamath.MetamathException.Kind.PROOF_REJECTED;
import static dumb.metamath.MetamathException.Kind.TYPE_CONFLICT;
import static dumb.metamath.MetamathException.Kind.UNKNOWN_REFERENCE;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FormalSystemTest extends AbstractSystemTest {

    @Test
    void declarationOrderIsKept() {
        assertEquals(CONSTANTS, system.constants());
        assertEquals(List.of("wn", "wi", "ax-1", "ax-2", "ax-3", "ax-mp"), List.copyOf(system.axioms().keySet()));
        assertEquals(List.of("mp2"), List.copyOf(system.theorems().keySet()));
        assertTrue(system.axiom("ax-mp").isPresent());
        assertTrue(system.theorem("ax-mp").isEmpty());
    }

    @Test
    void constantsAxiomsAndTheoremsShareOneNamespace() {
        assertEquals(DUPLICATE_LABEL, assertThrows(MetamathException.class, () -> system.addConstant("wff")).kind());
        assertEquals(DUPLICATE_LABEL, assertThrows(MetamathException.class,
                () -> system.addAxiom("|-", AssertionSpec.axiom(ordered("wph", "wff ph"), Map.of(), "wff ph"))).kind());
        assertEquals(DUPLICATE_LABEL, assertThrows(MetamathException.class,
                () -> system.addTheorem("wi", mp2(MP2_PROOF))).kind());
    }

    @Test
    void variablesAreSharedAcrossAssertions() {
        var wn = system.axiom("wn").orElseThrow();
        var wi = system.axiom("wi").orElseThrow();
        assertSame(wn.t().get("wph").variable(), wi.t().get("wph").variable());
        assertSame(wn.t().get("wph").variable(), system.registry().findVariable("ph").orElseThrow());
    }

    @Test
    void boundVariableNamesStayFreeAsLabels() {
        assertFalse(system.registry().contains("ph"));
        var ps = system.addAxiom("ps", AssertionSpec.axiom(ordered("wph", "wff ph"), Map.of(), "|- ( ph -> ph )"));
        assertSame(ps, system.axiom("ps").orElseThrow());
        system.addConstant("ph");
        assertInstanceOf(Constant.class, system.registry().lookup("ph"));
        assertEquals(MALFORMED, assertThrows(MetamathException.class,
                () -> system.addAxiom("ax-ph", AssertionSpec.axiom(ordered("wph", "wff ph"), Map.of(), "wff ph"))).kind());
        assertSuccess(system.verify("mp2"));
    }

    @Test
    void addTheoremRejectsBrokenProof() {
        var e = assertThrows(MetamathException.class, () -> system.addTheorem("mp2x", mp2("wps wch mp2.2")));
        assertEquals(PROOF_REJECTED, e.kind());
        assertEquals(CONCLUSION_MISMATCH, ((MetamathException) e.getCause()).kind());
        assertTrue(system.theorem("mp2x").isEmpty());
        assertFalse(system.registry().contains("mp2x"));
    }

    @Test
    void addTheoremAcceptsSoundProof() {
        var t = system.addTheorem("mp2b", mp2(MP2_PROOF));
        assertTrue(t.isTheorem());
        assertTrue(system.verify("mp2b").ok());
    }

    @Test
    void verifyOnLoadRejectsBrokenTheorems() {
        var config = new Config().withVerifyOnLoad(true);
        var e = assertThrows(MetamathException.class,
                () -> new FormalSystem(new Registry(), config, CONSTANTS, axioms(), Map.of("mp2", mp2("wps"))));
        assertEquals(PROOF_REJECTED, e.kind());
        new FormalSystem(new Registry(), config, CONSTANTS, axioms(), Map.of("mp2", mp2(MP2_PROOF)));
    }

    @Test
    void citingAnUnsoundTheoremFails() {
        var theorems = new LinkedHashMap<String, AssertionSpec>();
        theorems.put("mp2", mp2(MP2_PROOF));
        theorems.putAll(lemmaChain());
        var s = new FormalSystem(new Registry(), new Config(), CONSTANTS, axioms(), theorems);

        var f = assertFailure(s.verify("uses"), UNKNOWN_REFERENCE, 4);
        assertTrue(f.message().contains("bogus"), f.message());
        assertFailure(s.verify("bogus"), CONCLUSION_MISMATCH, 0);
        assertSuccess(s.verify("via-mp2"));

        var e = assertThrows(MetamathException.class, () -> s.addTheorem("uses2",
                AssertionSpec.theorem(ordered("wph", "wff ph", "wps", "wff ps"), ordered("u2.1", "|- ph"), "|- ps", "wph wps u2.1 bogus")));
        assertEquals(PROOF_REJECTED, e.kind());
        assertEquals(UNKNOWN_REFERENCE, ((MetamathException) e.getCause()).kind());
    }

    @Test
    void verifyNeedsAKnownTheorem() {
        assertEquals(NOT_FOUND, assertThrows(MetamathException.class, () -> system.verify("nope")).kind());
        assertEquals(NOT_FOUND, assertThrows(MetamathException.class, () -> system.verify("ax-mp")).kind());
    }

    @Test
    void axiomsCannotCarryProofsAndTheoremsNeedThem() {
        assertEquals(MALFORMED, assertThrows(MetamathException.class,
                () -> system.addAxiom("ax-x", mp2(MP2_PROOF))).kind());
        assertEquals(MALFORMED, assertThrows(MetamathException.class,
                () -> system.addTheorem("th-x", AssertionSpec.axiom(ordered("wph", "wff ph"), Map.of(), "wff ph"))).kind());
    }

    static Stream<Arguments> malformedAxioms() {
        return Stream.of(
                Arguments.of("typed hypothesis with three tokens", ordered("wph", "wff ph ps"), Map.of(), "wff ph", Map.of()),
                Arguments.of("typecode is not a constant", ordered("wph", "set ph"), Map.of(), "wff ph", Map.of()),
                Arguments.of("variable bound twice", ordered("wph", "wff ph", "wph2", "wff ph"), Map.of(), "wff ph", Map.of()),
                Arguments.of("variable named like a constant", ordered("wph", "wff wff"), Map.of(), "wff wff", Map.of()),
                Arguments.of("local label clashes with an axiom", ordered("wi", "wff ph"), Map.of(), "wff ph", Map.of()),
                Arguments.of("hypothesis label repeats a type label", ordered("wph", "wff ph"), ordered("wph", "|- ph"), "|- ph", Map.of()),
                Arguments.of("unbound token in hypothesis", ordered("wph", "wff ph"), ordered("h1", "|- ps"), "|- ph", Map.of()),
                Arguments.of("unbound token in conclusion", ordered("wph", "wff ph"), Map.of(), "|- ph -> q", Map.of()),
                Arguments.of("unused variable", ordered("wph", "wff ph", "wps", "wff ps"), Map.of(), "|- ph", Map.of()),
                Arguments.of("disjoint pair repeats a variable", ordered("wph", "wff ph"), Map.of(), "|- ph", ordered("d1", "ph ph")),
                Arguments.of("disjoint pair names an unbound variable", ordered("wph", "wff ph"), Map.of(), "|- ph", ordered("d1", "ph ch")),
                Arguments.of("empty conclusion", ordered("wph", "wff ph"), ordered("h1", "|- ph"), " ", Map.of()));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("malformedAxioms")
    void malformedAssertionsAreRejected(String why, Map<String, String> t, Map<String, String> h, String a, Map<String, String> d) {
        var e = assertThrows(MetamathException.class, () -> system.addAxiom("ax-bad", AssertionSpec.axiom(t, h, a).withDisjoint(d)), why);
        assertEquals(MALFORMED, e.kind(), e::getMessage);
        assertFalse(system.registry().contains("ax-bad"));
    }

    @Test
    void templateGeneratedPatternsDeclareAxioms() {
        var reg = system.registry();
        var implication = FormulaTemplate.of(Map.of("A", ParamKind.FORMULA, "B", ParamKind.FORMULA),
                reg.lookup("|-", Constant.class), reg.lookup("(", Constant.class), "A",
                reg.lookup("->", Constant.class), "B", reg.lookup(")", Constant.class));
        var ph = reg.findVariable("ph").orElseThrow();
        var conclusion = implication.generate(Map.of("A", Formula.of(ph), "B", Formula.of(ph)));
        var id = system.addAxiom("ax-id", AssertionSpec.axiom(ordered("wph", "wff ph"), Map.of(), conclusion.toString()));
        assertTrue(conclusion.matches(id.a()));
    }

    @Test
    void composeFollowsConfiguredCollisionPolicy() {
        var reg = system.registry();
        var neg = reg.lookup("-.", Constant.class);
        var inner = FormulaTemplate.of(Map.of("P", ParamKind.FORMULA), neg, "P");
        var outer = FormulaTemplate.of(Map.of("X", ParamKind.TEMPLATE, "Y", ParamKind.TEMPLATE), "X", reg.lookup("->", Constant.class), "Y");
        var bindings = Map.of("X", inner, "Y", inner);

        assertEquals(Map.of("P", ParamKind.FORMULA), system.compose(outer, bindings).params());
        var strict = new FormalSystem(reg, new Config().withCollisions(CollisionPolicy.REJECT));
        assertEquals(TYPE_CONFLICT, assertThrows(MetamathException.class, () -> strict.compose(outer, bindings)).kind());
    }

    @Test
    void concurrentVerificationsAgree() throws InterruptedException, ExecutionException {
        var pool = Executors.newFixedThreadPool(4);
        try {
            var tasks = IntStream.range(0, 16).<Callable<VerificationResult>>mapToObj(i -> () -> system.verify("mp2", i % 2 == 0)).toList();
            for (var f : pool.invokeAll(tasks)) assertTrue(f.get().ok());
        } finally {
            pool.shutdown();
        }
    }
}
