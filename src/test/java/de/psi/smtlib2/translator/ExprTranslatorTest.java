package de.psi.smtlib2.translator;

import de.psi.smtlib2.ast.Kind;
import de.psi.smtlib2.ast.Op;
import de.psi.smtlib2.ast.Operation;
import de.psi.smtlib2.ast.RegExp;
import de.psi.smtlib2.ast.SV;
import de.psi.smtlib2.smt.SmtConfig;
import de.psi.smtlib2.smt.SolverCapabilities;
import edu.mit.csail.sdg.alloy4.ConstList;
import edu.mit.csail.sdg.alloy4.Err;
import edu.mit.csail.sdg.alloy4.ErrorFatal;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class ExprTranslatorTest {

    private static final SV W0 = new SV(Kind.word(8), 0);
    private static final SV W1 = new SV(Kind.word(8), 1);
    private static final SV I2 = new SV(Kind.signed(8), 2);
    private static final SV I3 = new SV(Kind.signed(8), 3);
    private static final SV N4 = new SV(Kind.UNBOUNDED, 4);
    private static final SV N5 = new SV(Kind.UNBOUNDED, 5);
    private static final SV F6 = new SV(Kind.FLOAT, 6);
    private static final SV F7 = new SV(Kind.FLOAT, 7);
    private static final SV B8 = new SV(Kind.BOOL, 8);
    private static final SV B9 = new SV(Kind.BOOL, 9);
    private static final SV Q10 = new SV(Kind.RATIONAL, 10);
    private static final SV Q11 = new SV(Kind.RATIONAL, 11);
    private static final SV S12 = new SV(Kind.STRING, 12);
    private static final SV S13 = new SV(Kind.STRING, 13);

    private static TranslationContext context(SolverCapabilities caps) {
        final SmtConfig cfg = new SmtConfig();
        cfg.capabilities = caps;
        return new TranslationContext(cfg);
    }

    private static String translate(TranslationContext ctx, Op op, SV... args) throws Err {
        return ExprTranslator.translate(ctx, new Operation(op, ConstList.make(Arrays.asList(args))));
    }

    private static String z3(Op op, SV... args) throws Err {
        return translate(context(SolverCapabilities.z3()), op, args);
    }

    private static String z3(Op.Operator op, SV... args) throws Err {
        return z3(new Op.Basic(op), args);
    }

    @Test
    public void bitVectorArithmetic() throws Err {
        assertEquals("(bvadd s0 s1)", z3(Op.Operator.PLUS, W0, W1));
        assertEquals("(bvneg s0)", z3(Op.Operator.UNEG, W0));
        assertEquals("(bvudiv s0 s1)", z3(Op.Operator.QUOT, W0, W1));
        assertEquals("(bvsdiv s2 s3)", z3(Op.Operator.QUOT, I2, I3));
        assertEquals("(bvurem s0 s1)", z3(Op.Operator.REM, W0, W1));
        assertEquals("(bvslt s2 s3)", z3(Op.Operator.LESS_THAN, I2, I3));
        assertEquals("(bvuge s0 s1)", z3(Op.Operator.GREATER_EQ, W0, W1));
    }

    @Test
    public void bitVectorLogic() throws Err {
        assertEquals("(bvand s0 s1)", z3(Op.Operator.AND, W0, W1));
        assertEquals("(bvnot s0)", z3(Op.Operator.NOT, W0));
        assertEquals("(concat s0 s1)", z3(Op.Operator.JOIN, W0, W1));
        assertEquals("(bvlshr s0 s1)", z3(Op.Operator.SHR, W0, W1));
        assertEquals("(bvashr s2 s3)", z3(Op.Operator.SHR, I2, I3));
        assertEquals("((_ extract 3 0) s0)", z3(new Op.Extract(3, 0), W0));
        assertEquals("((_ rotate_left 2) s0)", z3(new Op.Rotate(true, 2), W0));
        assertEquals("(not (bvumul_noovfl s0 s1))", z3(new Op.Overflow(Op.OverflowCheck.UMUL_OVFL), W0, W1));
    }

    @Test
    public void absoluteValues() throws Err {
        assertEquals("(ite (bvslt s2 #x00) (bvneg s2) s2)", z3(Op.Operator.ABS, I2));
        assertEquals("s0", z3(Op.Operator.ABS, W0));
        assertEquals("(abs s4)", z3(Op.Operator.ABS, N4));
        assertEquals("(fp.abs s6)", z3(Op.Operator.ABS, F6));
    }

    @Test
    public void integers() throws Err {
        assertEquals("(+ s4 s5)", z3(Op.Operator.PLUS, N4, N5));
        assertEquals("(div s4 s5)", z3(Op.Operator.QUOT, N4, N5));
        assertEquals("(mod s4 s5)", z3(Op.Operator.REM, N4, N5));
        assertEquals("(distinct s4 s5)", z3(Op.Operator.NOT_EQUAL, N4, N5));
    }

    @Test
    public void disequalityWithoutDistinct() throws Err {
        final SolverCapabilities caps = SolverCapabilities.z3();
        caps.supportsDistinct = false;
        final SV n6 = new SV(Kind.UNBOUNDED, 6);
        assertEquals("(not (= s4 s5))", translate(context(caps), new Op.Basic(Op.Operator.NOT_EQUAL), N4, N5));
        assertEquals("(and (not (= s4 s5)) (not (= s4 s6)) (not (= s5 s6)))",
                translate(context(caps), new Op.Basic(Op.Operator.NOT_EQUAL), N4, N5, n6));
    }

    @Test
    public void floats() throws Err {
        assertEquals("(fp.add roundNearestTiesToEven s6 s7)", z3(Op.Operator.PLUS, F6, F7));
        assertEquals("(fp.eq s6 s7)", z3(Op.Operator.EQUAL, F6, F7));
        assertEquals("(not (fp.eq s6 s7))", z3(Op.Operator.NOT_EQUAL, F6, F7));
        assertEquals("(fp.leq s6 s7)", z3(Op.Operator.LESS_EQ, F6, F7));
        assertEquals("(fp.isNaN s6)", z3(new Op.FloatOp(Op.FPOperation.IS_NAN), F6));
    }

    @Test
    public void booleans() throws Err {
        assertEquals("(and s8 s9)", z3(Op.Operator.AND, B8, B9));
        assertEquals("(not s8)", z3(Op.Operator.NOT, B8));
        assertEquals("(= s8 s9)", z3(Op.Operator.EQUAL, B8, B9));
        assertEquals("(and (not s8) s9)", z3(Op.Operator.LESS_THAN, B8, B9));
        assertEquals("(or (not s9) s8)", z3(Op.Operator.GREATER_EQ, B8, B9));
        assertEquals("(ite s8 s0 s1)", z3(Op.Operator.ITE, B8, W0, W1));
    }

    @Test
    public void rationals() throws Err {
        assertEquals("(sbv.rat.plus s10 s11)", z3(Op.Operator.PLUS, Q10, Q11));
        assertEquals("(sbv.rat.lt s11 s10)", z3(Op.Operator.GREATER_THAN, Q10, Q11));
        assertEquals("(sbv.rat.notEq s10 s11)", z3(Op.Operator.NOT_EQUAL, Q10, Q11));
        assertEquals("(SBV.Rational s4 s5)", z3(new Op.RationalConstructor(), N4, N5));
    }

    @Test
    public void strings() throws Err {
        assertEquals("(str.< s12 s13)", z3(Op.Operator.LESS_THAN, S12, S13));
        assertEquals("(str.<= s13 s12)", z3(Op.Operator.GREATER_EQ, S12, S13));
        assertEquals("(str.len s12)", z3(new Op.StringOp(Op.StringOperation.LEN), S12));
        assertEquals("s12", z3(new Op.StringOp(Op.StringOperation.UNIT), S12));
        assertEquals("(str.in_re s12 (re.* (str.to_re \"ab\")))", z3(new Op.StrInRe(RegExp.star(RegExp.literal("ab"))), S12));
    }

    @Test
    public void enumerations() throws Err {
        final Kind color = Kind.enumeration("Color", "R", "G");
        final SV c0 = new SV(color, 14), c1 = new SV(color, 15);
        assertEquals("(< (Color_constrIndex s14) (Color_constrIndex s15))", z3(Op.Operator.LESS_THAN, c0, c1));
        assertEquals("(= s14 s15)", z3(Op.Operator.EQUAL, c0, c1));
    }

    @Test
    public void uninterpretedSortsOnlyHaveEquality() throws Err {
        final Kind u = Kind.userSort("U");
        final SV u0 = new SV(u, 14), u1 = new SV(u, 15);
        assertEquals("(distinct s14 s15)", z3(Op.Operator.NOT_EQUAL, u0, u1));
        try {
            z3(Op.Operator.PLUS, u0, u1);
            fail("no addition on uninterpreted sorts");
        } catch (ErrorFatal ex) {
            assertTrue(ex.getMessage().contains("Uninterpreted kinds only support equality."));
        }
    }

    @Test
    public void dataTypes() throws Err {
        final SV t = new SV(Kind.tuple(Kind.BOOL, Kind.UNBOUNDED), 16);
        final SV m = new SV(Kind.maybe(Kind.UNBOUNDED), 17);
        assertEquals("((as mkSBVTuple2 (SBVTuple2 Bool Int)) s8 s4)", z3(new Op.TupleConstructor(2), B8, N4));
        assertEquals("(proj_1_SBVTuple2 s16)", z3(new Op.TupleAccess(1, 2), t));
        assertEquals("(as nothing_SBVMaybe (SBVMaybe Int))", z3(new Op.MaybeConstructor(Kind.UNBOUNDED, false)));
        assertEquals("((as just_SBVMaybe (SBVMaybe Int)) s4)", z3(new Op.MaybeConstructor(Kind.UNBOUNDED, true), N4));
        assertEquals("((_ is (just_SBVMaybe (Int) (SBVMaybe Int))) s17)", z3(new Op.MaybeIs(Kind.UNBOUNDED, true), m));
        assertEquals("((_ is just_SBVMaybe) s17)",
                translate(context(SolverCapabilities.cvc4()), new Op.MaybeIs(Kind.UNBOUNDED, true), m));
        assertEquals("(get_left_SBVEither s18)", z3(new Op.EitherAccess(false), new SV(Kind.either(Kind.BOOL, Kind.BOOL), 18)));
    }

    @Test
    public void sets() throws Err {
        final SV s = new SV(Kind.set(Kind.word(8)), 18);
        assertEquals("(select s18 s0)", z3(new Op.SetOp(Op.SetOperation.MEMBER), W0, s));
        assertEquals("(store s18 s0 true)", z3(new Op.SetOp(Op.SetOperation.INSERT), W0, s));
        assertEquals("(union s18 s18)", z3(new Op.SetOp(Op.SetOperation.UNION), s, s));
    }

    @Test
    public void lookUps() throws Err {
        assertEquals("(ite (bvule #x03 s0) s1 (table0 s0))",
                z3(new Op.LookUp(0, Kind.word(8), Kind.word(8), 3, W0, W1)));
        assertEquals("(ite (or (bvslt s2 #x00) (bvsle #x03 s2)) s3 (table0 s2))",
                z3(new Op.LookUp(0, Kind.signed(8), Kind.signed(8), 3, I2, I3)));
        assertEquals("(ite (or (< s4 0) (<= 2 s4)) s5 (table1 s4))",
                z3(new Op.LookUp(1, Kind.UNBOUNDED, Kind.UNBOUNDED, 2, N4, N5)));
        assertEquals("(table0 s8)", z3(new Op.LookUp(0, Kind.BOOL, Kind.BOOL, 2, B8, B9)));
    }

    @Test
    public void pseudoBooleansFollowTheSolver() throws Err {
        final Op.PseudoBoolean atMost = new Op.PseudoBoolean(Op.PBKind.AT_MOST, 1);
        assertEquals("((_ at-most 1) s8 s9)", z3(atMost, B8, B9));
        assertEquals("(<= (+ (ite s8 1 0) (ite s9 1 0)) 1)",
                translate(context(SolverCapabilities.cvc4()), atMost, B8, B9));
    }

    @Test
    public void skolemizedInputsAreApplied() throws Err {
        final SV a = new SV(Kind.word(8), 20);
        final Map<SV, List<SV>> skolems = new HashMap<SV, List<SV>>();
        skolems.put(W0, Collections.singletonList(a));
        final TranslationContext ctx = new TranslationContext(new SmtConfig(), skolems,
                new HashMap<Integer, String>(), new HashMap<Op.SeqReverse, String>());
        assertEquals("(bvadd (s0 s20) s1)", translate(ctx, new Op.Basic(Op.Operator.PLUS), W0, W1));
    }

    @Test
    public void reversalUsesTheGeneratedFunction() throws Err {
        final Op.SeqReverse rev = new Op.SeqReverse(Kind.STRING);
        final Map<Op.SeqReverse, String> functions = new HashMap<Op.SeqReverse, String>();
        functions.put(rev, "sbv.reverse_0");
        final TranslationContext ctx = new TranslationContext(new SmtConfig(), new HashMap<SV, List<SV>>(),
                new HashMap<Integer, String>(), functions);
        assertEquals("(sbv.reverse_0 s12)", translate(ctx, new Op.SeqReverse(Kind.STRING), S12));
        try {
            z3(rev, S12);
            fail("no helper function was registered");
        } catch (ErrorFatal ex) {
            assertTrue(ex.getMessage().startsWith("Internal error"));
        }
    }

    @Test
    public void uninterpretedFunctions() throws Err {
        assertEquals("(f s4 s5)", z3(new Op.Uninterpreted("f"), N4, N5));
        assertEquals("c", z3(new Op.Uninterpreted("c")));
    }
}
