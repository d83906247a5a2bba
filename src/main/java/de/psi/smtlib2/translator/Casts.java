package de.psi.smtlib2.translator;

import de.psi.smtlib2.ast.Kind;
import de.psi.smtlib2.smt.RoundingMode;
import edu.mit.csail.sdg.alloy4.Err;
import edu.mit.csail.sdg.alloy4.ErrorFatal;

import java.math.BigInteger;
import java.util.List;
import java.util.Vector;

/**
 * Conversions between numeric kinds.
 */
public final class Casts {

	private Casts() {}

	private static ErrorFatal unexpected(Kind from, Kind to) {
		return new ErrorFatal("Internal error: unexpected cast from " + from + " to " + to + ". Please report this as a bug.");
	}

	/**
	 * Converts {@code a} from kind {@code from} to kind {@code to}. Without
	 * int2bv, integers are turned into bit vectors one bit at a time.
	 */
	public static String handleKindCast(boolean hasInt2bv, Kind from, Kind to, String a) throws Err {
		if (from.equals(to))
			return a;

		if (from.isBounded() && to.isBounded()) {
			final Kind.Bounded f = (Kind.Bounded) from, t = (Kind.Bounded) to;
			final int m = f.width, n = t.width;
			if (m < n)
				return "((_ " + (f.signed ? "sign_extend " : "zero_extend ") + (n - m) + ") " + a + ")";
			if (m == n)
				return a;
			return "((_ extract " + (n - 1) + " 0) " + a + ")";
		}

		if (from.isBounded() && to.isUnbounded()) {
			final Kind.Bounded f = (Kind.Bounded) from;
			final int m = f.width;
			if (!f.signed)
				return "(bv2nat " + a + ")";
			if (m == 1)
				return "(ite (= " + a + " #b0) 0 (- 1))";
			final String rest = "(bv2nat ((_ extract " + (m - 2) + " 0) " + a + "))";
			return "(ite (= ((_ extract " + (m - 1) + " " + (m - 1) + ") " + a + ") #b0) " + rest
					+ " (- " + rest + " " + BigInteger.ONE.shiftLeft(m - 1) + "))";
		}

		if (from.isUnbounded() && to.isReal())
			return "(to_real " + a + ")";
		if (from.isReal() && to.isUnbounded())
			return "(to_int " + a + ")";

		if (from.isUnbounded() && to.isBounded()) {
			final int n = ((Kind.Bounded) to).width;
			if (hasInt2bv)
				return "((_ int2bv " + n + ") " + a + ")";
			return int2bv(n, a);
		}

		if (from.isSomeFloat() || to.isSomeFloat())
			return handleFPCast(from, to, RoundingMode.ROUND_NEAREST_TIES_TO_EVEN.smtName(), a);

		throw unexpected(from, to);
	}

	/** Bit {@code i} is the parity of {@code a div 2^i}; the bits are concatenated high to low. */
	private static String int2bv(int n, String a) {
		final BigInteger modulus = BigInteger.ONE.shiftLeft(n);
		List<String> bits = new Vector<String>();
		bits.add("(__a0 (ite (= (mod __a 2) 0) #b0 #b1))");
		for (int i = 1; i < n; ++i)
			bits.add("(__a" + i + " (ite (= (mod (div __a " + BigInteger.ONE.shiftLeft(i) + ") 2) 0) #b0 #b1))");
		String body = "__a0";
		for (int i = 1; i < n; ++i)
			body = "(concat __a" + i + " " + body + ")";
		return "(let ((__a (mod " + a + " " + modulus + "))) (let (" + Helpers.unwords(bits) + ") " + body + "))";
	}

	private static Kind simplify(Kind k) {
		if (k.isFloat()) return Kind.fp(8, 24);
		if (k.isDouble()) return Kind.fp(11, 53);
		return k;
	}

	/**
	 * Converts to and from floats under rounding mode {@code rm}. Single and
	 * double precision are treated as the arbitrary-precision floats they are.
	 */
	public static String handleFPCast(Kind kFromIn, Kind kToIn, String rm, String input) throws Err {
		final Kind kFrom = simplify(kFromIn), kTo = simplify(kToIn);
		if (kFrom.equals(kTo))
			return input;

		if (kTo.isFP()) {
			final Kind.FloatingPoint t = (Kind.FloatingPoint) kTo;
			final String toFP = "(_ to_fp " + t.eb + " " + t.sb + ")";
			if (kFrom.isUnbounded())
				return "(" + toFP + " " + rm + " (to_real " + input + "))";
			if (kFrom.isBounded() && !kFrom.hasSign())
				return "((_ to_fp_unsigned " + t.eb + " " + t.sb + ") " + rm + " " + input + ")";
			if (kFrom.isBounded() || kFrom.isReal() || kFrom.isFP())
				return "(" + toFP + " " + rm + " " + input + ")";
			throw unexpected(kFromIn, kToIn);
		}

		if (kFrom.isFP()) {
			if (kTo.isUnbounded())
				return "(to_int (fp.to_real " + input + "))";
			if (kTo.isBounded()) {
				final Kind.Bounded t = (Kind.Bounded) kTo;
				return "((_ " + (t.signed ? "fp.to_sbv " : "fp.to_ubv ") + t.width + ") " + rm + " " + input + ")";
			}
			if (kTo.isReal())
				return "(fp.to_real " + input + ")";
		}

		throw unexpected(kFromIn, kToIn);
	}
}
