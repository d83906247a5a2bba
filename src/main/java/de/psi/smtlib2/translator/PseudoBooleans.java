package de.psi.smtlib2.translator;

import de.psi.smtlib2.ast.Op;
import de.psi.smtlib2.smt.SExpr;
import edu.mit.csail.sdg.alloy4.Err;
import edu.mit.csail.sdg.alloy4.ErrorFatal;

import java.util.List;
import java.util.Vector;

/**
 * Pseudo-boolean constraints, either in the solver's native syntax or
 * reduced to linear integer arithmetic.
 */
public final class PseudoBooleans {

	private PseudoBooleans() {}

	/** The weights to use; the unweighted forms count every operand once. */
	private static List<Integer> weights(Op.PseudoBoolean pb, int n) {
		if (!pb.coefficients.isEmpty())
			return pb.coefficients;
		List<Integer> ones = new Vector<Integer>();
		for (int i = 0; i < n; ++i)
			ones.add(1);
		return ones;
	}

	private static String numbers(int k, List<Integer> cs) {
		StringBuilder sb = new StringBuilder();
		sb.append(k);
		for (Integer c : cs)
			sb.append(" ").append(c);
		return sb.toString();
	}

	public static String handlePB(Op.PseudoBoolean pb, List<String> args) throws Err {
		final String xs = Helpers.unwords(args);
		switch (pb.kind) {
			case AT_MOST: return "((_ at-most " + pb.bound + ") " + xs + ")";
			case AT_LEAST: return "((_ at-least " + pb.bound + ") " + xs + ")";
			case EXACTLY: return "((_ pbeq " + numbers(pb.bound, weights(pb, args.size())) + ") " + xs + ")";
			case EQ: return "((_ pbeq " + numbers(pb.bound, pb.coefficients) + ") " + xs + ")";
			case LE: return "((_ pble " + numbers(pb.bound, pb.coefficients) + ") " + xs + ")";
			case GE: return "((_ pbge " + numbers(pb.bound, pb.coefficients) + ") " + xs + ")";
			default: throw new ErrorFatal("Internal error: unknown pseudo-boolean " + pb + ". Please report this as a bug.");
		}
	}

	public static String reducePB(Op.PseudoBoolean pb, List<String> args) throws Err {
		final String sum = addIf(args, weights(pb, args.size()));
		switch (pb.kind) {
			case AT_MOST:
			case LE:
				return "(<= " + sum + " " + pb.bound + ")";
			case AT_LEAST:
			case GE:
				return "(>= " + sum + " " + pb.bound + ")";
			case EXACTLY:
			case EQ:
				return "(=  " + sum + " " + pb.bound + ")";
			default:
				throw new ErrorFatal("Internal error: unknown pseudo-boolean " + pb + ". Please report this as a bug.");
		}
	}

	/** Sum of the weights of the operands that hold; extra weights are ignored. */
	private static String addIf(List<String> args, List<Integer> cs) {
		List<SExpr> terms = new Vector<SExpr>();
		for (int i = 0; i < args.size() && i < cs.size(); ++i)
			terms.add(SExpr.ite(SExpr.sym(args.get(i)), SExpr.sym(String.valueOf(cs.get(i))), SExpr.sym("0")));
		return SExpr.add(terms).toString();
	}
}
