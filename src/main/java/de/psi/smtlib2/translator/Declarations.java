package de.psi.smtlib2.translator;

import de.psi.smtlib2.ast.Assignment;
import de.psi.smtlib2.ast.Axiom;
import de.psi.smtlib2.ast.CV;
import de.psi.smtlib2.ast.Kind;
import de.psi.smtlib2.ast.Op;
import de.psi.smtlib2.ast.SV;
import de.psi.smtlib2.ast.UninterpretedSymbol;
import de.psi.smtlib2.smt.RoundingMode;
import edu.mit.csail.sdg.alloy4.ConstList;
import edu.mit.csail.sdg.alloy4.Err;
import edu.mit.csail.sdg.alloy4.ErrorFatal;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Vector;

/**
 * Emitters for everything that is declared rather than asserted: sorts,
 * datatypes, constants, functions, axioms and definitions.
 */
public final class Declarations {

	private Declarations() {}

	public static final ConstList<String> SUM = ConstList.make(Arrays.asList(
			"(declare-datatypes ((SBVEither 2)) ((par (T1 T2)",
			"                                    ((left_SBVEither  (get_left_SBVEither  T1))",
			"                                     (right_SBVEither (get_right_SBVEither T2))))))"));

	public static final ConstList<String> MAYBE = ConstList.make(Arrays.asList(
			"(declare-datatypes ((SBVMaybe 1)) ((par (T)",
			"                                    ((nothing_SBVMaybe)",
			"                                     (just_SBVMaybe (get_just_SBVMaybe T))))))"));

	/**
	 * Rationals are kept unreduced, so every comparison cross-multiplies
	 * instead of comparing numerators and denominators.
	 */
	public static final ConstList<String> RATIONALS = ConstList.make(Arrays.asList(
			"(declare-datatype SBVRational ((SBV.Rational (sbv.rat.numerator Int) (sbv.rat.denominator Int))))",
			"",
			"(define-fun sbv.rat.eq ((x SBVRational) (y SBVRational)) Bool",
			"   (= (* (sbv.rat.numerator   x) (sbv.rat.denominator y))",
			"      (* (sbv.rat.denominator x) (sbv.rat.numerator   y)))",
			")",
			"",
			"(define-fun sbv.rat.notEq ((x SBVRational) (y SBVRational)) Bool",
			"   (not (sbv.rat.eq x y))",
			")",
			"",
			"(define-fun sbv.rat.lt ((x SBVRational) (y SBVRational)) Bool",
			"   (<  (* (sbv.rat.numerator   x) (sbv.rat.denominator y))",
			"       (* (sbv.rat.denominator x) (sbv.rat.numerator   y)))",
			")",
			"",
			"(define-fun sbv.rat.leq ((x SBVRational) (y SBVRational)) Bool",
			"   (<= (* (sbv.rat.numerator   x) (sbv.rat.denominator y))",
			"       (* (sbv.rat.denominator x) (sbv.rat.numerator   y)))",
			")",
			"",
			"(define-fun sbv.rat.plus ((x SBVRational) (y SBVRational)) SBVRational",
			"   (SBV.Rational (+ (* (sbv.rat.numerator   x) (sbv.rat.denominator y))",
			"                    (* (sbv.rat.denominator x) (sbv.rat.numerator   y)))",
			"                 (* (sbv.rat.denominator x) (sbv.rat.denominator y)))",
			")",
			"",
			"(define-fun sbv.rat.minus ((x SBVRational) (y SBVRational)) SBVRational",
			"   (SBV.Rational (- (* (sbv.rat.numerator   x) (sbv.rat.denominator y))",
			"                    (* (sbv.rat.denominator x) (sbv.rat.numerator   y)))",
			"                 (* (sbv.rat.denominator x) (sbv.rat.denominator y)))",
			")",
			"",
			"(define-fun sbv.rat.times ((x SBVRational) (y SBVRational)) SBVRational",
			"   (SBV.Rational (* (sbv.rat.numerator   x) (sbv.rat.numerator y))",
			"                 (* (sbv.rat.denominator x) (sbv.rat.denominator y)))",
			")",
			"",
			"(define-fun sbv.rat.uneg ((x SBVRational)) SBVRational",
			"   (SBV.Rational (* (- 1) (sbv.rat.numerator x)) (sbv.rat.denominator x))",
			")",
			"",
			"(define-fun sbv.rat.abs ((x SBVRational)) SBVRational",
			"   (SBV.Rational (abs (sbv.rat.numerator x)) (sbv.rat.denominator x))",
			")"));

	/** Uninterpreted sorts and enumerations; the rounding mode sort is built in. */
	public static List<String> declSort(Kind.UserSort s) {
		if (s.name.equals(RoundingMode.SORT_NAME))
			return Collections.emptyList();
		if (!s.isEnumeration())
			return Collections.singletonList("(declare-sort " + s.name + " 0)  ; N.B. Uninterpreted sort.");
		List<String> cs = new Vector<String>();
		for (String c : s.constructors)
			cs.add("(" + c + ")");
		List<String> result = new Vector<String>();
		result.add("(declare-datatypes ((" + s.name + " 0)) ((" + Helpers.unwords(cs) + ")))");
		result.add("(define-fun " + s.name + "_constrIndex ((x " + s.name + ")) Int");
		result.add("   " + constructorIndex(s.constructors, 0));
		result.add(")");
		return result;
	}

	private static String constructorIndex(List<String> cs, int i) {
		if (cs.isEmpty()) return "";
		if (cs.size() == 1) return String.valueOf(i);
		return "(ite (= x " + cs.get(0) + ") " + i + " " + constructorIndex(cs.subList(1, cs.size()), i + 1) + ")";
	}

	/**
	 * The polymorphic tuple datatype of the given arity, e.g.
	 * <pre>
	 * (declare-datatypes ((SBVTuple2 2)) ((par (T1 T2)
	 *                                     ((mkSBVTuple2 (proj_1_SBVTuple2 T1)
	 *                                                   (proj_2_SBVTuple2 T2))))))
	 * </pre>
	 */
	public static List<String> declTuple(int arity) throws Err {
		if (arity == 0)
			return Collections.singletonList("(declare-datatypes ((SBVTuple0 0)) (((mkSBVTuple0))))");
		if (arity == 1)
			throw new ErrorFatal("Internal error: unexpected one-tuple. Please report this as a bug.");
		final String l1 = "(declare-datatypes ((SBVTuple" + arity + " " + arity + ")) (";
		final String l2 = Helpers.spaces(l1.length()) + "((mkSBVTuple" + arity + " ";
		final String tab = Helpers.spaces(l2.length());
		List<String> params = new Vector<String>();
		for (int i = 1; i <= arity; ++i)
			params.add("T" + i);
		List<String> result = new Vector<String>();
		result.add(l1 + "(par (" + Helpers.unwords(params) + ")");
		for (int i = 1; i <= arity; ++i) {
			final String proj = "(proj_" + i + "_SBVTuple" + arity + " T" + i + ")";
			result.add((i == 1 ? l2 : tab) + proj + (i == arity ? ")))))" : ""));
		}
		return result;
	}

	/** Recursive definition of a reversal function for strings or lists. */
	public static List<String> declFunction(Op.SeqReverse op, String nm) throws Err {
		if (op.kind.isString()) {
			return Arrays.asList(
					"(define-fun-rec " + nm + " ((str String)) String",
					"                (ite (= str \"\")",
					"                     \"\"",
					"                     (str.++ (" + nm + " (str.substr str 1 (- (str.len str) 1)))",
					"                             (str.substr str 0 1))))");
		}
		if (op.kind.isList()) {
			final String t = op.kind.smtType();
			return Arrays.asList(
					"(define-fun-rec " + nm + " ((lst " + t + ")) " + t,
					"                (ite (= lst (as seq.empty " + t + "))",
					"                     (as seq.empty " + t + ")",
					"                     (seq.++ (" + nm + " (seq.extract lst 1 (- (seq.len lst) 1))) (seq.unit (seq.nth lst 0)))))");
		}
		throw new ErrorFatal("Internal error: unexpected helper function " + nm + " for " + op + ". Please report this as a bug.");
	}

	/**
	 * {@code s} defined as {@code def}. Solvers without define-fun get a
	 * declaration and an equality instead.
	 */
	public static List<String> defineFun(TranslationContext ctx, SV s, String def, String comment) {
		final String varT = s + " () " + s.kind.smtType();
		final String cmnt = comment == null ? "" : " ; " + comment;
		if (ctx.caps.supportsDefineFun)
			return Collections.singletonList("(define-fun " + varT + " " + def + ")" + cmnt);
		return Arrays.asList("(declare-fun " + varT + ")" + cmnt, "(assert (= " + s + " " + def + "))");
	}

	/** Literal constants; true and false are inlined and never declared. */
	public static List<String> declConst(TranslationContext ctx, SV s, CV c) {
		if (s.isTrueOrFalse())
			return Collections.emptyList();
		return defineFun(ctx, s, ctx.cv(c), null);
	}

	public static List<String> declDef(TranslationContext ctx, Assignment a) throws Err {
		if (a.expr.op instanceof Op.Label)
			return defineFun(ctx, a.sv, ctx.sv(a.expr.args.get(0)), ((Op.Label) a.expr.op).comment);
		return defineFun(ctx, a.sv, ExprTranslator.translate(ctx, a.expr), null);
	}

	public static List<String> declUI(UninterpretedSymbol ui) throws Err {
		return declareName(ui.name, ui.signature, null);
	}

	/** The axiom text, preceded by a comment naming it. */
	public static List<String> declAxiom(Axiom ax) {
		List<String> result = new Vector<String>();
		result.add(";; -- user given " + (ax.isDefinition ? "definition" : "axiom") + ": " + ax.name);
		result.addAll(ax.lines);
		return result;
	}

	public static List<String> declareFun(SV s, List<Kind> signature, String comment) throws Err {
		return declareName(s.toString(), signature, comment);
	}

	/**
	 * {@code (_ BitVec 8) Bool} style function type; the last kind is the result.
	 */
	static String functionType(List<Kind> signature) throws Err {
		if (signature.isEmpty())
			throw new ErrorFatal("Internal error: received an empty type. Please report this as a bug.");
		List<String> args = new Vector<String>();
		for (Kind k : signature.subList(0, signature.size() - 1))
			args.add(k.smtType());
		return "(" + Helpers.unwords(args) + ") " + signature.get(signature.size() - 1).smtType();
	}

	/**
	 * Declares {@code s} with the given signature. Characters must be
	 * strings of length one and rationals must have a positive denominator;
	 * when the result kind contains either, the declaration is followed by
	 * an assertion saying so.
	 */
	public static List<String> declareName(String s, List<Kind> signature, String comment) throws Err {
		List<String> result = new Vector<String>();
		result.add("(declare-fun " + s + " " + functionType(signature) + ")" + (comment == null ? "" : " ; " + comment));

		final List<Kind> args = signature.subList(0, signature.size() - 1);
		final Kind kind = signature.get(signature.size() - 1);
		if (kind.isCharAndRationalFree())
			return result;

		final boolean needsQuant = !args.isEmpty();
		final String resultVar = needsQuant ? "result" : s;
		final List<String> constraints = new WellFormedness(0, resultVar, SCALAR).visitThis(kind);

		if (needsQuant) {
			List<String> argNames = new Vector<String>();
			List<String> argTypes = new Vector<String>();
			for (int i = 0; i < args.size(); ++i) {
				argNames.add("a" + (i + 1));
				argTypes.add("(a" + (i + 1) + " " + args.get(i).smtType() + ")");
			}
			result.add("(assert (forall (" + Helpers.unwords(argTypes) + ")");
			result.add("                (let ((" + resultVar + " (" + s + " " + Helpers.unwords(argNames) + ")))");
			if (constraints.isEmpty()) {
				result.add("                     true");
			} else if (constraints.size() == 1) {
				result.add("                     " + constraints.get(0));
			} else {
				result.add("                     (and " + constraints.get(0));
				for (String c : constraints.subList(1, constraints.size()))
					result.add("                          " + c);
				result.add("                     )");
			}
			result.add("                )))");
		} else if (constraints.size() == 1) {
			result.add("(assert " + constraints.get(0) + ")");
		} else if (constraints.size() > 1) {
			result.add("(assert (and " + constraints.get(0));
			for (String c : constraints.subList(1, constraints.size()))
				result.add("             " + c);
			result.add("        ))");
		}
		return result;
	}

	/** Produces the constraints a scalar value of kind {@code k}, written {@code nm}, must satisfy. */
	interface Restriction {
		List<String> apply(Kind k, String nm);
	}

	private static final Restriction SCALAR = new Restriction() {
		@Override
		public List<String> apply(Kind k, String nm) {
			if (k.isChar())
				return Collections.singletonList("(= 1 (str.len " + nm + "))");
			if (k.isRational())
				return Collections.singletonList("(< 0 (sbv.rat.denominator " + nm + "))");
			return Collections.emptyList();
		}
	};

	private static String mkAnd(List<String> cs) {
		if (cs.isEmpty()) return "true";
		if (cs.size() == 1) return cs.get(0);
		return "(and " + Helpers.unwords(cs) + ")";
	}

	/**
	 * Walks a kind and pushes the scalar restriction through containers:
	 * lists and sets quantify over their elements, tuples project, and
	 * optional and sum values are guarded by their testers.
	 */
	private static final class WellFormedness extends Kind.Visitor<List<String>> {
		private final int depth;
		private final String nm;
		private final Restriction f;

		WellFormedness(int depth, String nm, Restriction f) {
			this.depth = depth;
			this.nm = nm;
			this.f = f;
		}

		private List<String> scalar(Kind k) {
			return f.apply(k, nm);
		}

		@Override public List<String> visit(Kind.Bool k) { return scalar(k); }
		@Override public List<String> visit(Kind.Bounded k) { return scalar(k); }
		@Override public List<String> visit(Kind.Unbounded k) { return scalar(k); }
		@Override public List<String> visit(Kind.Real k) { return scalar(k); }
		@Override public List<String> visit(Kind.Float32 k) { return scalar(k); }
		@Override public List<String> visit(Kind.Float64 k) { return scalar(k); }
		@Override public List<String> visit(Kind.FloatingPoint k) { return scalar(k); }
		@Override public List<String> visit(Kind.Rational k) { return scalar(k); }
		@Override public List<String> visit(Kind.Char k) { return scalar(k); }
		@Override public List<String> visit(Kind.Str k) { return scalar(k); }
		@Override public List<String> visit(Kind.UserSort k) { return scalar(k); }

		@Override
		public List<String> visit(Kind.Seq k) {
			if (k.elem.isCharAndRationalFree())
				return Collections.emptyList();
			final String fnm = "seq" + depth;
			final List<String> cstrs = new WellFormedness(depth + 1, "(seq.nth " + nm + " " + fnm + ")", f).visitThis(k.elem);
			return Collections.singletonList("(forall ((" + fnm + " " + Kind.UNBOUNDED.smtType() + ")) (=> (and (>= " + fnm
					+ " 0) (< " + fnm + " (seq.len " + nm + "))) " + mkAnd(cstrs) + "))");
		}

		@Override
		public List<String> visit(final Kind.SetOf k) {
			if (k.elem.isCharAndRationalFree())
				return Collections.emptyList();
			final String fnm = "set" + depth;
			final Restriction member = new Restriction() {
				@Override
				public List<String> apply(Kind sk, String snm) {
					List<String> result = new Vector<String>();
					for (String c : f.apply(sk, fnm))
						result.add("(=> (select " + snm + " " + fnm + ") " + c + ")");
					return result;
				}
			};
			final List<String> cstrs = new WellFormedness(depth + 1, nm, member).visitThis(k.elem);
			return Collections.singletonList("(forall ((" + fnm + " " + k.elem.smtType() + ")) " + mkAnd(cstrs) + ")");
		}

		@Override
		public List<String> visit(Kind.Tuple k) {
			final String tt = "SBVTuple" + k.arity();
			List<String> result = new Vector<String>();
			for (int i = 0; i < k.arity(); ++i) {
				final String projection = "(proj_" + (i + 1) + "_" + tt + " " + nm + ")";
				result.addAll(new WellFormedness(depth + 1, projection, f).visitThis(k.elems.get(i)));
			}
			return result;
		}

		@Override
		public List<String> visit(Kind.Maybe k) {
			final String n = "(get_just_SBVMaybe " + nm + ")";
			final String guard = "((_ is (just_SBVMaybe (" + k.elem.smtType() + ") " + k.smtType() + ")) " + nm + ")";
			return guarded(guard, new WellFormedness(depth + 1, n, f).visitThis(k.elem));
		}

		@Override
		public List<String> visit(Kind.Either k) {
			final String n1 = "(get_left_SBVEither " + nm + ")";
			final String n2 = "(get_right_SBVEither " + nm + ")";
			final String g1 = "((_ is (left_SBVEither (" + k.left.smtType() + ") " + k.smtType() + ")) " + nm + ")";
			final String g2 = "((_ is (right_SBVEither (" + k.right.smtType() + ") " + k.smtType() + ")) " + nm + ")";
			List<String> result = new Vector<String>();
			result.addAll(guarded(g1, new WellFormedness(depth + 1, n1, f).visitThis(k.left)));
			result.addAll(guarded(g2, new WellFormedness(depth + 1, n2, f).visitThis(k.right)));
			return result;
		}

		private static List<String> guarded(String guard, List<String> cs) {
			List<String> result = new Vector<String>();
			for (String c : cs)
				result.add("(=> " + guard + " " + c + ")");
			return result;
		}
	}
}
