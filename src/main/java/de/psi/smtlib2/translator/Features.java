package de.psi.smtlib2.translator;

import de.psi.smtlib2.ast.ArrayInfo;
import de.psi.smtlib2.ast.Assignment;
import de.psi.smtlib2.ast.Kind;
import de.psi.smtlib2.ast.Op;
import de.psi.smtlib2.ast.Problem;
import de.psi.smtlib2.smt.RoundingMode;

import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.Vector;

/**
 * What a problem uses, as far as logic selection and declarations are
 * concerned. Computed once per translation.
 */
public final class Features {
	public final boolean hasInteger;
	public final boolean hasReal;
	public final boolean hasFP;
	public final boolean hasString;
	public final boolean hasRegExp;
	public final boolean hasChar;
	public final boolean hasRounding;
	public final boolean hasBVs;
	public final boolean hasNonBVArrays;
	public final boolean hasArrayInits;
	public final boolean hasOverflows;
	public final boolean hasList;
	public final boolean hasSets;
	public final boolean hasTuples;
	public final boolean hasEither;
	public final boolean hasMaybe;
	public final boolean hasRational;
	/** User sorts other than the built-in rounding mode sort. */
	public final List<Kind.UserSort> userSorts;
	public final List<Integer> tupleArities;

	public final boolean hasForalls;
	public final boolean hasAxioms;
	public final boolean hasArrays;
	public final boolean hasUninterpretedsOrTables;
	public final boolean needsFlattening;

	public Features(Problem p) {
		final List<Kind> kinds = p.kinds;
		boolean integer = false, real = false, fp = false, string = false, chr = false, rounding = false,
				bvs = false, list = false, sets = false;
		userSorts = new Vector<Kind.UserSort>();
		for (Kind k : kinds) {
			integer |= k.isUnbounded();
			real |= k.isReal();
			fp |= k.isSomeFloat();
			string |= k.isString();
			chr |= k.isChar();
			bvs |= k.isBounded();
			list |= k.isList();
			sets |= k.isSet();
			if (k.isUserSort()) {
				if (((Kind.UserSort) k).name.equals(RoundingMode.SORT_NAME))
					rounding = true;
				else
					userSorts.add((Kind.UserSort) k);
			}
		}
		hasInteger = integer;
		hasReal = real;
		hasFP = fp;
		hasString = string;
		hasChar = chr;
		hasRounding = rounding;
		hasBVs = bvs;
		hasList = list;
		hasSets = sets;
		tupleArities = tupleArities(kinds);
		hasTuples = !tupleArities.isEmpty();
		hasEither = containsSum(kinds);
		hasMaybe = containsMaybe(kinds);
		hasRational = containsRationals(kinds);

		boolean nonBV = false, inits = false;
		for (ArrayInfo a : p.arrays) {
			nonBV |= !(a.domain.isBounded() && a.range.isBounded());
			inits |= a.context instanceof ArrayInfo.Free && ((ArrayInfo.Free) a.context).init != null;
		}
		hasNonBVArrays = nonBV;
		hasArrayInits = inits;

		boolean regexp = false, overflows = false;
		for (Assignment a : p.program) {
			regexp |= a.expr.op instanceof Op.RegExCompare || a.expr.op instanceof Op.StrInRe;
			overflows |= a.expr.op instanceof Op.Overflow;
		}
		hasRegExp = regexp;
		hasOverflows = overflows;

		hasForalls = !p.foralls().isEmpty();
		hasAxioms = !p.axioms.isEmpty();
		hasArrays = !p.arrays.isEmpty();
		hasUninterpretedsOrTables = !p.uninterpreteds.isEmpty() || !p.tables.isEmpty();
		needsFlattening = needsFlattening(kinds);
	}

	/** Distinct tuple sizes, ascending. */
	public static List<Integer> tupleArities(Iterable<Kind> kinds) {
		SortedSet<Integer> arities = new TreeSet<Integer>();
		for (Kind k : kinds)
			if (k.isTuple())
				arities.add(((Kind.Tuple) k).arity());
		return new Vector<Integer>(arities);
	}

	public static boolean containsSum(Iterable<Kind> kinds) {
		for (Kind k : kinds)
			if (k.isEither()) return true;
		return false;
	}

	public static boolean containsMaybe(Iterable<Kind> kinds) {
		for (Kind k : kinds)
			if (k.isMaybe()) return true;
		return false;
	}

	public static boolean containsRationals(Iterable<Kind> kinds) {
		for (Kind k : kinds)
			if (k.isRational()) return true;
		return false;
	}

	public static boolean needsFlattening(Iterable<Kind> kinds) {
		for (Kind k : kinds)
			if (k.needsFlattening()) return true;
		return false;
	}
}
