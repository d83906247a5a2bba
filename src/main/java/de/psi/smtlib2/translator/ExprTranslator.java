package de.psi.smtlib2.translator;

import de.psi.smtlib2.ast.CV;
import de.psi.smtlib2.ast.Kind;
import de.psi.smtlib2.ast.Op;
import de.psi.smtlib2.ast.Operation;
import de.psi.smtlib2.ast.SV;
import de.psi.smtlib2.smt.SExpr;
import edu.mit.csail.sdg.alloy4.Err;
import edu.mit.csail.sdg.alloy4.ErrorFatal;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.Vector;

/**
 * Renders one operation as an SMT-LIB term. The encoding depends on the
 * operator and on the class of its operands: bit vectors, booleans,
 * unbounded integers, reals, rationals, floats, strings, lists and user
 * sorts, checked in that order.
 */
public final class ExprTranslator extends Op.Visitor<String> {

	private final TranslationContext ctx;
	private final Operation expr;
	private final List<SV> args;

	private final boolean bvOp;
	private final boolean intOp;
	private final boolean ratOp;
	private final boolean realOp;
	private final boolean fpOp;
	private final boolean boolOp;
	private final boolean charOp;
	private final boolean stringOp;
	private final boolean listOp;

	private ExprTranslator(TranslationContext ctx, Operation expr) {
		this.ctx = ctx;
		this.expr = expr;
		this.args = expr.args;
		boolean bv = true, bool = true, integer = false, rat = false, real = false, fp = false, chr = false,
				str = false, list = false;
		for (SV a : args) {
			final Kind k = a.kind;
			bv &= k.isBounded();
			bool &= k.isBoolean();
			integer |= k.isUnbounded();
			rat |= k.isRational();
			real |= k.isReal();
			fp |= k.isSomeFloat();
			chr |= k.isChar();
			str |= k.isString();
			list |= k.isList();
		}
		bvOp = bv;
		boolOp = bool;
		intOp = integer;
		ratOp = rat;
		realOp = real;
		fpOp = fp;
		charOp = chr;
		stringOp = str;
		listOp = list;
	}

	public static String translate(TranslationContext ctx, Operation expr) throws Err {
		return new ExprTranslator(ctx, expr).visitThis(expr.op);
	}

	private String ssv(SV s) {
		return ctx.sv(s);
	}

	private List<String> ssvs() {
		List<String> result = new Vector<String>();
		for (SV a : args)
			result.add(ssv(a));
		return result;
	}

	private boolean anySigned() {
		for (SV a : args)
			if (a.hasSign()) return true;
		return false;
	}

	private ErrorFatal bad() {
		if (intOp)
			return new ErrorFatal("Internal error: unsupported operation on unbounded integers: " + expr + ". Please report this as a bug.");
		return new ErrorFatal("Internal error: unsupported operation on real values: " + expr + ". Please report this as a bug.");
	}

	private ErrorFatal unexpected(String what) {
		return new ErrorFatal("Internal error: " + what + " in " + expr + ". Please report this as a bug.");
	}

	private void ensureBV() throws Err {
		if (!bvOp) throw bad();
	}

	private void ensureBVOrBool() throws Err {
		if (!bvOp && !boolOp) throw bad();
	}

	private String lift1(String o, List<String> xs) throws Err {
		if (xs.size() != 1) throw unexpected("expected one argument for " + o);
		return liftN(o, xs);
	}

	private String lift2(String o, List<String> xs) throws Err {
		if (xs.size() != 2) throw unexpected("expected two arguments for " + o);
		return liftN(o, xs);
	}

	private static String liftN(String o, List<String> xs) {
		return SExpr.call(o, SExpr.syms(xs)).toString();
	}

	private static List<String> swap(List<String> xs) {
		return xs.size() == 2 ? Arrays.asList(xs.get(1), xs.get(0)) : xs;
	}

	private String addRM(String o) {
		return o + " " + ctx.rm.smtName();
	}

	/** Binary arithmetic; floats get the rounding mode as an extra first argument. */
	private String lift2WM(String o, String fo, List<String> xs) throws Err {
		return fpOp ? lift2(addRM(fo), xs) : lift2(o, xs);
	}

	private String lift2Cmp(String o, String fo, List<String> xs) throws Err {
		return lift2(fpOp ? fo : o, xs);
	}

	private String liftAbs(boolean signed, List<String> xs) throws Err {
		if (fpOp) return lift1("fp.abs", xs);
		if (intOp) return lift1("abs", xs);
		if (bvOp && signed) return mkAbs(xs.get(0), "bvslt", "bvneg");
		if (bvOp) return xs.get(0);
		return mkAbs(xs.get(0), "<", "-");
	}

	private String mkAbs(String x, String cmp, String neg) throws Err {
		final SExpr v = SExpr.sym(x);
		final SExpr z = SExpr.sym(ctx.cv(CV.ofInteger(args.get(0).kind, 0)));
		return SExpr.ite(SExpr.call(cmp, v, z), SExpr.call(neg, v), v).toString();
	}

	private String equal(List<String> xs) throws Err {
		return lift2(fpOp ? "fp.eq" : "=", xs);
	}

	/**
	 * Distinctness. Floats never use {@code distinct}, since signed zeros and
	 * NaNs would give it the wrong meaning; solvers without it get pairwise
	 * disequalities as well.
	 */
	private String notEqual(List<String> xs) throws Err {
		if (fpOp || !ctx.caps.supportsDistinct)
			return pairwise(xs);
		return liftN("distinct", xs);
	}

	private String pairwise(List<String> xs) throws Err {
		if (xs.size() == 2)
			return SExpr.not(SExpr.sym(equal(xs))).toString();
		List<SExpr> parts = new Vector<SExpr>();
		for (int i = 0; i < xs.size(); ++i)
			for (int j = i + 1; j < xs.size(); ++j)
				parts.add(SExpr.sym(pairwise(Arrays.asList(xs.get(i), xs.get(j)))));
		return SExpr.and(parts).toString();
	}

	private String ordered(boolean swapped, String o, List<String> xs) throws Err {
		return lift2(o, swapped ? swap(xs) : xs);
	}

	private String dtConstructor(String fld, List<SV> xs, Kind res) {
		final SExpr head = SExpr.ascribed(fld, res.smtType());
		if (xs.isEmpty())
			return head.toString();
		List<String> ss = new Vector<String>();
		for (SV x : xs)
			ss.add(ssv(x));
		return SExpr.call(head, SExpr.syms(ss)).toString();
	}

	/** Tester for a constructor; some solvers need the full signature to resolve it. */
	private String dtTester(String fld, List<Kind> params, Kind res, SV arg) {
		final String tester;
		if (ctx.caps.supportsDirectAccessors) {
			tester = "(_ is " + fld + ")";
		} else {
			List<String> ps = new Vector<String>();
			for (Kind p : params)
				ps.add(p.smtType());
			tester = "(_ is (" + fld + " (" + Helpers.unwords(ps) + ") " + res.smtType() + "))";
		}
		return "(" + tester + " " + ssv(arg) + ")";
	}

	@Override
	public String visit(Op.Basic op) throws Err {
		final List<String> xs = ssvs();
		switch (op.op) {
			case ITE:
				if (xs.size() != 3) throw unexpected("expected three arguments for ite");
				return liftN("ite", xs);
			case AND:
				ensureBVOrBool();
				return lift2(boolOp ? "and" : "bvand", xs);
			case OR:
				ensureBVOrBool();
				return lift2(boolOp ? "or" : "bvor", xs);
			case XOR:
				ensureBVOrBool();
				return lift2(boolOp ? "xor" : "bvxor", xs);
			case NOT:
				ensureBVOrBool();
				return lift1(boolOp ? "not" : "bvnot", xs);
			case JOIN:
				ensureBVOrBool();
				return lift2("concat", xs);
			case SHL:
				if (!bvOp) throw bad();
				return lift2("bvshl", xs);
			case SHR:
				if (!bvOp) throw bad();
				return lift2(args.get(0).hasSign() ? "bvashr" : "bvlshr", xs);
			default:
				break;
		}

		String result = null;
		if (intOp) result = intOp(op.op, xs);
		if (result == null && boolOp) result = boolComparison(op.op, xs);
		if (result == null && bvOp) result = bvOp(op.op, xs);
		if (result == null && realOp) result = realOp(op.op, xs);
		if (result == null && ratOp) result = ratOp(op.op, xs);
		if (result == null && fpOp) result = fpOp(op.op, xs);
		if (result == null && (charOp || stringOp)) result = stringOp(op.op, xs);
		if (result == null && listOp) result = listOp(op.op, xs);
		if (result == null) result = uninterpretedOp(op.op, xs);
		if (result != null)
			return result;

		Set<Kind> kinds = new LinkedHashSet<Kind>();
		for (SV a : args)
			kinds.add(a.kind);
		if (!args.isEmpty() && args.get(0).kind.isUserSort())
			throw new ErrorFatal("Cannot translate operator " + op + " when applied to arguments of kind " + kinds
					+ " (found as part of " + expr + "). Uninterpreted kinds only support equality."
					+ " If you believe this is in error, please report!");
		throw unexpected("cannot translate operator " + op + " on kinds " + kinds);
	}

	/** Operators shared by unbounded integers, reals and floats. */
	private String arithmetic(Op.Operator o, List<String> xs) throws Err {
		switch (o) {
			case PLUS: return lift2WM("+", "fp.add", xs);
			case MINUS: return lift2WM("-", "fp.sub", xs);
			case TIMES: return lift2WM("*", "fp.mul", xs);
			case UNEG: return lift1(fpOp ? "fp.neg" : "-", xs);
			case ABS: return liftAbs(anySigned(), xs);
			case EQUAL: return equal(xs);
			case NOT_EQUAL: return notEqual(xs);
			case LESS_THAN: return lift2Cmp("<", "fp.lt", xs);
			case GREATER_THAN: return lift2Cmp(">", "fp.gt", xs);
			case LESS_EQ: return lift2Cmp("<=", "fp.leq", xs);
			case GREATER_EQ: return lift2Cmp(">=", "fp.geq", xs);
			default: return null;
		}
	}

	private String intOp(Op.Operator o, List<String> xs) throws Err {
		switch (o) {
			case QUOT: return lift2("div", xs);
			case REM: return lift2("mod", xs);
			default: return arithmetic(o, xs);
		}
	}

	private String realOp(Op.Operator o, List<String> xs) throws Err {
		if (o == Op.Operator.QUOT) return lift2WM("/", "fp.div", xs);
		return arithmetic(o, xs);
	}

	private String fpOp(Op.Operator o, List<String> xs) throws Err {
		return realOp(o, xs);
	}

	/** The solver's booleans are unordered; false &lt; true is spelled out. */
	private String boolComparison(Op.Operator o, List<String> xs) throws Err {
		switch (o) {
			case LESS_THAN: return blt(xs);
			case GREATER_THAN: return blt(swap(xs));
			case LESS_EQ: return blq(xs);
			case GREATER_EQ: return blq(swap(xs));
			default: return null;
		}
	}

	private String blt(List<String> xs) throws Err {
		if (xs.size() != 2) throw unexpected("incorrect arity for a boolean comparison");
		return "(and (not " + xs.get(0) + ") " + xs.get(1) + ")";
	}

	private String blq(List<String> xs) throws Err {
		if (xs.size() != 2) throw unexpected("incorrect arity for a boolean comparison");
		return "(or (not " + xs.get(0) + ") " + xs.get(1) + ")";
	}

	private String bvOp(Op.Operator o, List<String> xs) throws Err {
		final boolean s = anySigned();
		switch (o) {
			case PLUS: return lift2("bvadd", xs);
			case MINUS: return lift2("bvsub", xs);
			case TIMES: return lift2("bvmul", xs);
			case UNEG: return lift1("bvneg", xs);
			case ABS: return liftAbs(s, xs);
			case QUOT: return lift2(s ? "bvsdiv" : "bvudiv", xs);
			case REM: return lift2(s ? "bvsrem" : "bvurem", xs);
			case EQUAL: return lift2("=", xs);
			case NOT_EQUAL: return notEqual(xs);
			case LESS_THAN: return lift2(s ? "bvslt" : "bvult", xs);
			case GREATER_THAN: return lift2(s ? "bvsgt" : "bvugt", xs);
			case LESS_EQ: return lift2(s ? "bvsle" : "bvule", xs);
			case GREATER_EQ: return lift2(s ? "bvsge" : "bvuge", xs);
			default: return null;
		}
	}

	private String ratOp(Op.Operator o, List<String> xs) throws Err {
		switch (o) {
			case PLUS: return lift2("sbv.rat.plus", xs);
			case MINUS: return lift2("sbv.rat.minus", xs);
			case TIMES: return lift2("sbv.rat.times", xs);
			case UNEG: return lift1("sbv.rat.uneg", xs);
			case ABS: return lift1("sbv.rat.abs", xs);
			case EQUAL: return lift2("sbv.rat.eq", xs);
			case NOT_EQUAL: return lift2("sbv.rat.notEq", xs);
			case LESS_THAN: return lift2("sbv.rat.lt", xs);
			case GREATER_THAN: return lift2("sbv.rat.lt", swap(xs));
			case LESS_EQ: return lift2("sbv.rat.leq", xs);
			case GREATER_EQ: return lift2("sbv.rat.leq", swap(xs));
			default: return null;
		}
	}

	private String stringOp(Op.Operator o, List<String> xs) throws Err {
		switch (o) {
			case EQUAL: return lift2("=", xs);
			case NOT_EQUAL: return notEqual(xs);
			case LESS_THAN: return stringCmp(false, "str.<", xs);
			case GREATER_THAN: return stringCmp(true, "str.<", xs);
			case LESS_EQ: return stringCmp(false, "str.<=", xs);
			case GREATER_EQ: return stringCmp(true, "str.<=", xs);
			default: return null;
		}
	}

	private String stringCmp(boolean swapped, String o, List<String> xs) throws Err {
		final Kind k = args.get(0).kind;
		if (!k.isString() && !k.isChar())
			throw unexpected("string comparison " + o + " on " + k);
		return ordered(swapped, o, xs);
	}

	private String listOp(Op.Operator o, List<String> xs) throws Err {
		switch (o) {
			case EQUAL: return lift2("=", xs);
			case NOT_EQUAL: return notEqual(xs);
			case LESS_THAN: return seqCmp(false, "seq.<", xs);
			case GREATER_THAN: return seqCmp(true, "seq.<", xs);
			case LESS_EQ: return seqCmp(false, "seq.<=", xs);
			case GREATER_EQ: return seqCmp(true, "seq.<=", xs);
			default: return null;
		}
	}

	private String seqCmp(boolean swapped, String o, List<String> xs) throws Err {
		final Kind k = args.get(0).kind;
		if (!k.isList())
			throw unexpected("sequence comparison " + o + " on " + k);
		return ordered(swapped, o, xs);
	}

	/** Equality works on every kind; ordering only on enumerations. */
	private String uninterpretedOp(Op.Operator o, List<String> xs) throws Err {
		switch (o) {
			case EQUAL: return lift2("=", xs);
			case NOT_EQUAL: return notEqual(xs);
			case LESS_THAN: return enumCmp("<", xs);
			case GREATER_THAN: return enumCmp(">", xs);
			case LESS_EQ: return enumCmp("<=", xs);
			case GREATER_EQ: return enumCmp(">=", xs);
			default: return null;
		}
	}

	private String enumCmp(String o, List<String> xs) throws Err {
		final Kind k = args.isEmpty() ? null : args.get(0).kind;
		if (xs.size() != 2 || k == null || !k.isUserSort() || !((Kind.UserSort) k).isEnumeration())
			throw unexpected("comparison " + o + " needs two values of an enumerated sort");
		final String s = ((Kind.UserSort) k).name;
		return "(" + o + " (" + s + "_constrIndex " + xs.get(0) + ") (" + s + "_constrIndex " + xs.get(1) + "))";
	}

	@Override
	public String visit(Op.Extract op) throws Err {
		ensureBV();
		return SExpr.call(SExpr.indexed("extract", op.hi, op.lo), SExpr.sym(ssv(args.get(0)))).toString();
	}

	@Override
	public String visit(Op.Rotate op) throws Err {
		if (!bvOp) throw bad();
		final SExpr f = SExpr.indexed(op.left ? "rotate_left" : "rotate_right", op.amount);
		return SExpr.call(f, SExpr.sym(ssv(args.get(0)))).toString();
	}

	@Override
	public String visit(Op.KindCast op) throws Err {
		return Casts.handleKindCast(ctx.caps.supportsInt2bv, op.from, op.to, ssv(args.get(0)));
	}

	@Override
	public String visit(Op.Uninterpreted op) {
		if (args.isEmpty())
			return op.name;
		return liftN(op.name, ssvs());
	}

	@Override
	public String visit(Op.Label op) {
		return ssv(args.get(0));
	}

	/**
	 * Direct application when every possible index is inside the table;
	 * otherwise out-of-range indices select the default.
	 */
	@Override
	public String visit(Op.LookUp op) throws Err {
		final Kind aKnd = op.indexKind;
		final BigInteger length = BigInteger.valueOf(op.length);
		final boolean needsCheck;
		if (aKnd.isBoolean())
			needsCheck = BigInteger.valueOf(2).compareTo(length) > 0;
		else if (aKnd.isBounded())
			needsCheck = BigInteger.ONE.shiftLeft(((Kind.Bounded) aKnd).width).compareTo(length) > 0;
		else if (aKnd.isUnbounded())
			needsCheck = true;
		else
			throw unexpected("unexpected " + aKnd + " valued index");

		final String lkUp = "(" + ctx.table(op.table) + " " + ssv(op.index) + ")";
		if (!needsCheck)
			return lkUp;

		final String less, leq;
		if (aKnd.isBounded()) {
			less = op.index.hasSign() ? "bvslt" : "bvult";
			leq = op.index.hasSign() ? "bvsle" : "bvule";
		} else if (aKnd.isUnbounded()) {
			less = "<";
			leq = "<=";
		} else {
			throw unexpected("unexpected boolean valued index");
		}
		final String le0 = "(" + less + " " + ssv(op.index) + " " + ctx.cv(CV.ofInteger(op.index.kind, 0)) + ")";
		final String gtl = "(" + leq + " " + ctx.cv(CV.ofInteger(op.index.kind, op.length)) + " " + ssv(op.index) + ")";
		final String cond = op.index.hasSign() ? "(or " + le0 + " " + gtl + ") " : gtl + " ";
		return "(ite " + cond + ssv(op.dflt) + " " + lkUp + ")";
	}

	@Override
	public String visit(Op.ArrayEq op) {
		return SExpr.eq(SExpr.sym("array_" + op.left), SExpr.sym("array_" + op.right)).toString();
	}

	@Override
	public String visit(Op.ArrayRead op) {
		return "(select array_" + op.array + " " + ssv(args.get(0)) + ")";
	}

	@Override
	public String visit(Op.FloatOp op) {
		return liftN(op.op.smtName, ssvs());
	}

	@Override
	public String visit(Op.FPCast op) throws Err {
		return Casts.handleFPCast(op.from, op.to, ssv(op.roundingMode), Helpers.unwords(ssvs()));
	}

	@Override
	public String visit(Op.NonLinear op) {
		return liftN(op.function.smtName, ssvs());
	}

	@Override
	public String visit(Op.PseudoBoolean op) throws Err {
		if (ctx.caps.supportsPseudoBooleans)
			return PseudoBooleans.handlePB(op, ssvs());
		return PseudoBooleans.reducePB(op, ssvs());
	}

	/** The native check reports "no overflow", hence the negation. */
	@Override
	public String visit(Op.Overflow op) {
		return SExpr.not(SExpr.call(op.check.smtName, SExpr.syms(ssvs()))).toString();
	}

	@Override
	public String visit(Op.StringOp op) {
		// a character already is a string of length one
		if (op.op == Op.StringOperation.UNIT)
			return ssv(args.get(0));
		return liftN(op.op.smtName, ssvs());
	}

	@Override
	public String visit(Op.StrInRe op) {
		return "(str.in_re " + Helpers.unwords(ssvs()) + " " + op.regExp.toSmtLib() + ")";
	}

	@Override
	public String visit(Op.RegExCompare op) {
		return "(" + (op.equal ? "=" : "distinct") + " " + op.left.toSmtLib() + " " + op.right.toSmtLib() + ")";
	}

	@Override
	public String visit(Op.SeqOp op) {
		return liftN(op.op.smtName, ssvs());
	}

	@Override
	public String visit(Op.SeqReverse op) throws Err {
		return liftN(ctx.function(op), ssvs());
	}

	@Override
	public String visit(Op.SetOp op) throws Err {
		final List<String> xs = ssvs();
		switch (op.op) {
			case EQUAL: return liftN("=", xs);
			case MEMBER: return "(select " + set(xs) + " " + xs.get(0) + ")";
			case INSERT: return "(store " + set(xs) + " " + xs.get(0) + " true)";
			case DELETE: return "(store " + set(xs) + " " + xs.get(0) + " false)";
			case INTERSECT: return liftN("intersection", xs);
			case UNION: return liftN("union", xs);
			case SUBSET: return liftN("subset", xs);
			case DIFFERENCE: return liftN("setminus", xs);
			case COMPLEMENT: return liftN("complement", xs);
			case HAS_SIZE: return liftN("set-has-size", xs);
			default: throw unexpected("unknown set operation " + op);
		}
	}

	/** Element operations take the element first and the set second. */
	private String set(List<String> xs) throws Err {
		if (xs.size() != 2) throw unexpected("expected an element and a set");
		return xs.get(1);
	}

	@Override
	public String visit(Op.TupleConstructor op) {
		if (op.arity == 0)
			return "mkSBVTuple0";
		List<Kind> ks = new Vector<Kind>();
		for (SV a : args)
			ks.add(a.kind);
		return SExpr.call(SExpr.ascribed("mkSBVTuple" + op.arity, Kind.tuple(ks).smtType()), SExpr.syms(ssvs())).toString();
	}

	@Override
	public String visit(Op.TupleAccess op) {
		return "(proj_" + op.index + "_SBVTuple" + op.arity + " " + ssv(args.get(0)) + ")";
	}

	@Override
	public String visit(Op.EitherConstructor op) {
		return dtConstructor(op.isRight ? "right_SBVEither" : "left_SBVEither", args, Kind.either(op.left, op.right));
	}

	@Override
	public String visit(Op.EitherIs op) {
		final Kind res = Kind.either(op.left, op.right);
		if (op.isRight)
			return dtTester("right_SBVEither", Arrays.asList(op.right), res, args.get(0));
		return dtTester("left_SBVEither", Arrays.asList(op.left), res, args.get(0));
	}

	@Override
	public String visit(Op.EitherAccess op) {
		return "(" + (op.isRight ? "get_right_SBVEither " : "get_left_SBVEither ") + ssv(args.get(0)) + ")";
	}

	@Override
	public String visit(Op.MaybeConstructor op) {
		return dtConstructor(op.isJust ? "just_SBVMaybe" : "nothing_SBVMaybe", args, Kind.maybe(op.elem));
	}

	@Override
	public String visit(Op.MaybeIs op) {
		final Kind res = Kind.maybe(op.elem);
		if (op.isJust)
			return dtTester("just_SBVMaybe", Arrays.asList(op.elem), res, args.get(0));
		return dtTester("nothing_SBVMaybe", new Vector<Kind>(), res, args.get(0));
	}

	@Override
	public String visit(Op.MaybeAccess op) {
		return "(get_just_SBVMaybe " + ssv(args.get(0)) + ")";
	}

	@Override
	public String visit(Op.RationalConstructor op) {
		return "(SBV.Rational " + ssv(args.get(0)) + " " + ssv(args.get(1)) + ")";
	}
}
