package de.psi.smtlib2.ast;

import de.psi.smtlib2.smt.RoundingMode;
import edu.mit.csail.sdg.alloy4.Err;
import edu.mit.csail.sdg.alloy4.ErrorFatal;
import org.junit.Test;

import java.math.BigInteger;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class CVTest {

    private static String smt(CV c) {
        return c.toSmtLib(RoundingMode.ROUND_NEAREST_TIES_TO_EVEN);
    }

    @Test
    public void bitVectors() {
        assertEquals("#x0a", smt(CV.word(8, 10)));
        assertEquals("#b101", smt(CV.word(3, 5)));
        assertEquals("(bvneg #x03)", smt(CV.signed(8, -3)));
        assertEquals("#b10000000", smt(CV.signed(8, -128)));
        assertEquals("#xff", smt(CV.word(8, -1)));
    }

    @Test
    public void integersAndBooleans() {
        assertEquals("(- 5)", smt(CV.integer(-5)));
        assertEquals("42", smt(CV.integer(42)));
        assertEquals("true", smt(CV.bool(true)));
        assertEquals("false", smt(CV.bool(false)));
    }

    @Test
    public void reals() {
        assertEquals("(/ 1.0 2.0)", smt(CV.real(3, 6)));
        assertEquals("(- 2.0)", smt(CV.real(-4, 2)));
        assertEquals("0.0", smt(CV.real(0, 5)));
    }

    @Test
    public void rationalsAreNotReduced() {
        assertEquals("(SBV.Rational 2 4)", smt(CV.rational(2, 4)));
        assertEquals("(SBV.Rational (- 1) 3)", smt(CV.rational(-1, 3)));
    }

    @Test
    public void floats() {
        assertEquals("((_ to_fp 11 53) roundNearestTiesToEven (/ 1 2))", smt(CV.ofDouble(0.5)));
        assertEquals("((_ to_fp 8 24) roundTowardZero (/ 3 1))", CV.ofFloat(3.0f).toSmtLib(RoundingMode.ROUND_TOWARD_ZERO));
        assertEquals("(_ -zero 8 24)", smt(CV.ofFloat(-0.0f)));
        assertEquals("(_ +zero 11 53)", smt(CV.ofDouble(0.0)));
        assertEquals("(_ NaN 11 53)", smt(CV.ofDouble(Double.NaN)));
        assertEquals("(_ -oo 8 24)", smt(CV.ofFloat(Float.NEGATIVE_INFINITY)));
        assertEquals("(fp #b0 #b01111 #b0000000000)", smt(CV.fpBits(5, 11, BigInteger.valueOf(0x3C00))));
    }

    @Test
    public void strings() {
        assertEquals("\"abc\"", smt(CV.string("abc")));
        assertEquals("\"a\"\"b\"", smt(CV.string("a\"b")));
        assertEquals("\"\\u{e9}\"", smt(CV.character('\u00e9')));
        assertEquals("\"\\u{5c}\"", smt(CV.string("\\")));
    }

    @Test
    public void containers() {
        assertEquals("(as seq.empty (Seq Int))", smt(CV.list(Kind.UNBOUNDED)));
        assertEquals("(seq.unit 1)", smt(CV.list(Kind.UNBOUNDED, CV.integer(1))));
        assertEquals("(seq.++ (seq.unit 1) (seq.unit 2))", smt(CV.list(Kind.UNBOUNDED, CV.integer(1), CV.integer(2))));
        assertEquals("(store ((as const (Array (_ BitVec 4) Bool)) false) #x1 true)",
                smt(CV.set(Kind.word(4), CV.word(4, 1))));
        assertEquals("(store ((as const (Array Int Bool)) true) 3 false)",
                smt(CV.complementSet(Kind.UNBOUNDED, CV.integer(3))));
        assertEquals("((as mkSBVTuple2 (SBVTuple2 Bool Int)) true 2)", smt(CV.tuple(CV.bool(true), CV.integer(2))));
    }

    @Test
    public void sums() {
        assertEquals("(as nothing_SBVMaybe (SBVMaybe Bool))", smt(CV.nothing(Kind.BOOL)));
        assertEquals("((as just_SBVMaybe (SBVMaybe Int)) 3)", smt(CV.just(CV.integer(3))));
        assertEquals("((as left_SBVEither (SBVEither Int Bool)) 1)", smt(CV.left(CV.integer(1), Kind.BOOL)));
        assertEquals("((as right_SBVEither (SBVEither Int Bool)) false)", smt(CV.right(Kind.UNBOUNDED, CV.bool(false))));
    }

    @Test
    public void constructors() {
        assertEquals("R", smt(CV.constructor(Kind.enumeration("Color", "R", "G"), "R")));
        assertEquals("roundTowardNegative", smt(CV.roundingMode(RoundingMode.ROUND_TOWARD_NEGATIVE)));
    }

    @Test
    public void integerConstants() throws Err {
        assertEquals("#x1", smt(CV.ofInteger(Kind.word(4), 17)));
        assertEquals("3.0", smt(CV.ofInteger(Kind.REAL, 3)));
        assertEquals("(SBV.Rational 3 1)", smt(CV.ofInteger(Kind.RATIONAL, 3)));
        try {
            CV.ofInteger(Kind.STRING, 1);
            fail("strings have no integer constants");
        } catch (ErrorFatal ex) {
            // expected
        }
    }
}
