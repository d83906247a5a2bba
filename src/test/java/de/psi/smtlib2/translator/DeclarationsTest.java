package de.psi.smtlib2.translator;

import de.psi.smtlib2.ast.Axiom;
import de.psi.smtlib2.ast.CV;
import de.psi.smtlib2.ast.Kind;
import de.psi.smtlib2.ast.Op;
import de.psi.smtlib2.ast.SV;
import de.psi.smtlib2.smt.SmtConfig;
import de.psi.smtlib2.smt.SolverCapabilities;
import edu.mit.csail.sdg.alloy4.ConstList;
import edu.mit.csail.sdg.alloy4.Err;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class DeclarationsTest {

    private static final TranslationContext CTX = new TranslationContext(new SmtConfig());

    @Test
    public void uninterpretedSort() {
        assertEquals(Collections.singletonList("(declare-sort A 0)  ; N.B. Uninterpreted sort."),
                Declarations.declSort((Kind.UserSort) Kind.userSort("A")));
    }

    @Test
    public void roundingModeIsBuiltIn() {
        assertTrue(Declarations.declSort((Kind.UserSort) Kind.userSort("RoundingMode")).isEmpty());
    }

    @Test
    public void enumeration() {
        assertEquals(Arrays.asList(
                "(declare-datatypes ((Color 0)) (((R) (G) (B))))",
                "(define-fun Color_constrIndex ((x Color)) Int",
                "   (ite (= x R) 0 (ite (= x G) 1 2))",
                ")"), Declarations.declSort((Kind.UserSort) Kind.enumeration("Color", "R", "G", "B")));
    }

    @Test
    public void tuples() throws Err {
        assertEquals(Arrays.asList(
                "(declare-datatypes ((SBVTuple2 2)) ((par (T1 T2)",
                "                                    ((mkSBVTuple2 (proj_1_SBVTuple2 T1)",
                "                                                  (proj_2_SBVTuple2 T2))))))"),
                Declarations.declTuple(2));
        assertEquals(Collections.singletonList("(declare-datatypes ((SBVTuple0 0)) (((mkSBVTuple0))))"),
                Declarations.declTuple(0));
    }

    @Test
    public void constants() {
        final SV s = new SV(Kind.word(8), 3);
        assertEquals(Collections.singletonList("(define-fun s3 () (_ BitVec 8) #x07)"),
                Declarations.declConst(CTX, s, CV.word(8, 7)));
        assertTrue(Declarations.declConst(CTX, SV.TRUE, CV.bool(true)).isEmpty());
        assertTrue(Declarations.declConst(CTX, SV.FALSE, CV.bool(false)).isEmpty());
    }

    @Test
    public void definitionsWithoutDefineFun() {
        final SmtConfig cfg = new SmtConfig();
        cfg.capabilities = SolverCapabilities.abc();
        final SV s = new SV(Kind.word(8), 3);
        assertEquals(Arrays.asList("(declare-fun s3 () (_ BitVec 8))", "(assert (= s3 #x07))"),
                Declarations.declConst(new TranslationContext(cfg), s, CV.word(8, 7)));
    }

    @Test
    public void plainInputs() throws Err {
        final SV s = new SV(Kind.BOOL, 0);
        assertEquals(Collections.singletonList("(declare-fun s0 () Bool) ; tracks x"),
                Declarations.declareFun(s, Collections.singletonList(Kind.BOOL), "tracks x"));
    }

    @Test
    public void charactersAreOneLong() throws Err {
        final SV s = new SV(Kind.CHAR, 0);
        assertEquals(Arrays.asList("(declare-fun s0 () String)", "(assert (= 1 (str.len s0)))"),
                Declarations.declareFun(s, Collections.singletonList(Kind.CHAR), null));
    }

    @Test
    public void rationalsHavePositiveDenominators() throws Err {
        final SV s = new SV(Kind.RATIONAL, 0);
        assertEquals(Arrays.asList("(declare-fun s0 () SBVRational)", "(assert (< 0 (sbv.rat.denominator s0)))"),
                Declarations.declareFun(s, Collections.singletonList(Kind.RATIONAL), null));
    }

    @Test
    public void restrictionsReachIntoContainers() throws Err {
        final SV s = new SV(Kind.list(Kind.CHAR), 0);
        assertEquals(Arrays.asList(
                "(declare-fun s0 () (Seq String))",
                "(assert (forall ((seq0 Int)) (=> (and (>= seq0 0) (< seq0 (seq.len s0))) (= 1 (str.len (seq.nth s0 seq0))))))"),
                Declarations.declareFun(s, Collections.singletonList(Kind.list(Kind.CHAR)), null));
    }

    @Test
    public void tupleRestrictionsAreConjoined() throws Err {
        final Kind k = Kind.tuple(Kind.CHAR, Kind.RATIONAL);
        final SV s = new SV(k, 0);
        assertEquals(Arrays.asList(
                "(declare-fun s0 () (SBVTuple2 String SBVRational))",
                "(assert (and (= 1 (str.len (proj_1_SBVTuple2 s0)))",
                "             (< 0 (sbv.rat.denominator (proj_2_SBVTuple2 s0)))",
                "        ))"),
                Declarations.declareFun(s, Collections.singletonList(k), null));
    }

    @Test
    public void functionResultsAreQuantified() throws Err {
        assertEquals(Arrays.asList(
                "(declare-fun f (Int) String)",
                "(assert (forall ((a1 Int))",
                "                (let ((result (f a1)))",
                "                     (= 1 (str.len result))",
                "                )))"),
                Declarations.declareName("f", Arrays.asList(Kind.UNBOUNDED, Kind.CHAR), null));
    }

    @Test
    public void axioms() {
        final Axiom ax = new Axiom(false, "positive", ConstList.make(Collections.singletonList("(assert (> x 0))")));
        assertEquals(Arrays.asList(";; -- user given axiom: positive", "(assert (> x 0))"), Declarations.declAxiom(ax));
    }

    @Test
    public void reversal() throws Err {
        final List<String> lines = Declarations.declFunction(new Op.SeqReverse(Kind.STRING), "sbv.reverse_0");
        assertEquals("(define-fun-rec sbv.reverse_0 ((str String)) String", lines.get(0));
        assertEquals(5, lines.size());
    }
}
