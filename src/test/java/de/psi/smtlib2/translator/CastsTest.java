package de.psi.smtlib2.translator;

import de.psi.smtlib2.ast.Kind;
import edu.mit.csail.sdg.alloy4.Err;
import edu.mit.csail.sdg.alloy4.ErrorFatal;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class CastsTest {

    private static final String RTZ = "roundTowardZero";

    @Test
    public void betweenBitVectors() throws Err {
        assertEquals("((_ zero_extend 8) x)", Casts.handleKindCast(true, Kind.word(8), Kind.word(16), "x"));
        assertEquals("((_ sign_extend 8) x)", Casts.handleKindCast(true, Kind.signed(8), Kind.signed(16), "x"));
        assertEquals("((_ extract 7 0) x)", Casts.handleKindCast(true, Kind.word(16), Kind.signed(8), "x"));
        assertEquals("x", Casts.handleKindCast(true, Kind.word(8), Kind.word(8), "x"));
    }

    @Test
    public void signChangeKeepsTheBits() throws Err {
        assertEquals("x", Casts.handleKindCast(true, Kind.word(8), Kind.signed(8), "x"));
        assertEquals("x", Casts.handleKindCast(false, Kind.signed(32), Kind.word(32), "x"));
    }

    @Test
    public void bitVectorsToIntegers() throws Err {
        assertEquals("(bv2nat x)", Casts.handleKindCast(true, Kind.word(8), Kind.UNBOUNDED, "x"));
        assertEquals("(ite (= ((_ extract 7 7) x) #b0) (bv2nat ((_ extract 6 0) x)) (- (bv2nat ((_ extract 6 0) x)) 128))",
                Casts.handleKindCast(true, Kind.signed(8), Kind.UNBOUNDED, "x"));
        assertEquals("(ite (= x #b0) 0 (- 1))", Casts.handleKindCast(true, Kind.signed(1), Kind.UNBOUNDED, "x"));
    }

    @Test
    public void integersToBitVectors() throws Err {
        assertEquals("((_ int2bv 4) x)", Casts.handleKindCast(true, Kind.UNBOUNDED, Kind.word(4), "x"));
        assertEquals("(let ((__a (mod x 4))) (let ((__a0 (ite (= (mod __a 2) 0) #b0 #b1))"
                        + " (__a1 (ite (= (mod (div __a 2) 2) 0) #b0 #b1))) (concat __a1 __a0)))",
                Casts.handleKindCast(false, Kind.UNBOUNDED, Kind.word(2), "x"));
    }

    @Test
    public void integersAndReals() throws Err {
        assertEquals("(to_real x)", Casts.handleKindCast(true, Kind.UNBOUNDED, Kind.REAL, "x"));
        assertEquals("(to_int x)", Casts.handleKindCast(true, Kind.REAL, Kind.UNBOUNDED, "x"));
    }

    @Test
    public void floatsUseTheDefaultRoundingMode() throws Err {
        assertEquals("((_ to_fp 11 53) roundNearestTiesToEven x)", Casts.handleKindCast(true, Kind.FLOAT, Kind.DOUBLE, "x"));
    }

    @Test
    public void toFloats() throws Err {
        assertEquals("((_ to_fp 8 24) roundTowardZero (to_real x))", Casts.handleFPCast(Kind.UNBOUNDED, Kind.FLOAT, RTZ, "x"));
        assertEquals("((_ to_fp_unsigned 11 53) roundTowardZero x)", Casts.handleFPCast(Kind.word(8), Kind.DOUBLE, RTZ, "x"));
        assertEquals("((_ to_fp 11 53) roundTowardZero x)", Casts.handleFPCast(Kind.signed(8), Kind.DOUBLE, RTZ, "x"));
        assertEquals("((_ to_fp 5 11) roundTowardZero x)", Casts.handleFPCast(Kind.REAL, Kind.fp(5, 11), RTZ, "x"));
    }

    @Test
    public void fromFloats() throws Err {
        assertEquals("((_ fp.to_sbv 8) roundTowardZero x)", Casts.handleFPCast(Kind.DOUBLE, Kind.signed(8), RTZ, "x"));
        assertEquals("((_ fp.to_ubv 16) roundTowardZero x)", Casts.handleFPCast(Kind.FLOAT, Kind.word(16), RTZ, "x"));
        assertEquals("(to_int (fp.to_real x))", Casts.handleFPCast(Kind.FLOAT, Kind.UNBOUNDED, RTZ, "x"));
        assertEquals("(fp.to_real x)", Casts.handleFPCast(Kind.FLOAT, Kind.REAL, RTZ, "x"));
    }

    @Test
    public void singlePrecisionIsAnArbitraryFloat() throws Err {
        assertEquals("x", Casts.handleFPCast(Kind.FLOAT, Kind.fp(8, 24), RTZ, "x"));
    }

    @Test
    public void unsupportedCast() throws Err {
        try {
            Casts.handleKindCast(true, Kind.STRING, Kind.BOOL, "x");
            fail("strings cannot be cast to booleans");
        } catch (ErrorFatal ex) {
            // expected
        }
    }
}
