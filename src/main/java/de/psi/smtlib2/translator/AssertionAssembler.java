package de.psi.smtlib2.translator;

import de.psi.smtlib2.ast.Constraint;
import de.psi.smtlib2.ast.SV;
import edu.mit.csail.sdg.alloy4.ConstList;
import edu.mit.csail.sdg.alloy4.Err;
import edu.mit.csail.sdg.alloy4.ErrorAPI;
import edu.mit.csail.sdg.alloy4.Pair;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Vector;

/**
 * Turns the user's constraints and the goal into the assertions that close
 * the script. Without universals every constraint gets its own assertion;
 * under universals all of them are conjoined into the body of the
 * quantifier.
 */
public final class AssertionAssembler {

	/** A constraint reduced to a literal, possibly negated. */
	public static final class Lit {
		public final boolean soft;
		public final List<Pair<String, String>> attributes;
		public final SV sv;
		public final boolean negated;

		public Lit(boolean soft, List<Pair<String, String>> attributes, SV sv, boolean negated) {
			this.soft = soft;
			this.attributes = attributes;
			this.sv = sv;
			this.negated = negated;
		}

		/** Literally true: a positive true or a negated false. */
		boolean redundant() {
			return negated ? sv.equals(SV.FALSE) : sv.equals(SV.TRUE);
		}

		/** Literally false. */
		boolean bad() {
			return negated ? sv.equals(SV.TRUE) : sv.equals(SV.FALSE);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof Lit)) return false;
			final Lit that = (Lit) o;
			return sv.equals(that.sv) && negated == that.negated;
		}

		@Override
		public int hashCode() {
			return sv.hashCode() * 2 + (negated ? 1 : 0);
		}
	}

	/** Positive literals first, each group ordered by node id. */
	private static final Comparator<Lit> ORDER = new Comparator<Lit>() {
		public int compare(Lit x, Lit y) {
			if (x.negated != y.negated)
				return x.negated ? 1 : -1;
			return x.sv.compareTo(y.sv);
		}
	};

	private final TranslationContext ctx;
	private final List<SV> foralls;

	/** True if nothing at all was asserted. */
	public final boolean noConstraints;
	public final List<Lit> assertions;

	public AssertionAssembler(TranslationContext ctx, List<SV> foralls, List<Constraint> constraints, SV goal, boolean isSat) {
		this.ctx = ctx;
		this.foralls = foralls;
		List<Lit> finals = new Vector<Lit>();
		for (Constraint c : constraints) {
			final Lit l = pos(c.soft, c.attributes, c.literal);
			if (l != null) finals.add(l);
		}
		final List<Pair<String, String>> none = ConstList.make();
		final Lit g = isSat ? pos(false, none, goal) : neg(none, goal);
		if (g != null) finals.add(g);
		if (finals.isEmpty()) {
			noConstraints = true;
			assertions = Collections.singletonList(new Lit(false, none, SV.TRUE, false));
		} else {
			noConstraints = false;
			assertions = finals;
		}
	}

	private static Lit pos(boolean soft, List<Pair<String, String>> attrs, SV s) {
		if (s.equals(SV.TRUE)) return null;
		return new Lit(soft, attrs, s, false);
	}

	/** A goal to be proven is asserted negated. */
	private static Lit neg(List<Pair<String, String>> attrs, SV s) {
		if (s.equals(SV.FALSE)) return null;
		if (s.equals(SV.TRUE)) return new Lit(false, attrs, SV.FALSE, false);
		return new Lit(false, attrs, s, true);
	}

	/**
	 * {@code x} with its attributes attached. Values are printed between
	 * bars, so bars and backslashes in them are spelled out.
	 */
	public static String addAnnotations(List<Pair<String, String>> attrs, String x) {
		if (attrs.isEmpty())
			return x;
		StringBuilder sb = new StringBuilder("(! ").append(x);
		for (Pair<String, String> attr : attrs) {
			sb.append(" ").append(attr.a).append(" |");
			final String v = attr.b;
			for (int i = 0; i < v.length(); ++i) {
				final char c = v.charAt(i);
				if (c == '|') sb.append("_bar_");
				else if (c == '\\') sb.append("_backslash_");
				else sb.append(c);
			}
			sb.append("|");
		}
		sb.append(")");
		return sb.toString();
	}

	private String literal(Lit l) {
		return l.negated ? "(not " + ctx.sv(l.sv) + ")" : ctx.sv(l.sv);
	}

	private String quantifiedVariables() {
		List<String> vs = new Vector<String>();
		for (SV s : foralls)
			vs.add(s.toString());
		return Helpers.unwords(vs);
	}

	/**
	 * The closing lines of the script.
	 *
	 * @param hasDelayed whether delayed table equalities opened an extra conjunction
	 * @param closeParens number of parentheses still open under the quantifier
	 */
	public List<String> finalAssert(boolean hasDelayed, int closeParens) throws Err {
		List<String> result = new Vector<String>();
		if (foralls.isEmpty()) {
			if (noConstraints)
				return result;
			for (Lit l : assertions)
				if (!l.soft)
					result.add("(assert " + addAnnotations(l.attributes, literal(l)) + ")");
			for (Lit l : assertions)
				if (l.soft)
					result.add("(assert-soft " + addAnnotations(l.attributes, literal(l)) + ")");
			return result;
		}

		List<String> named = new Vector<String>();
		List<String> soft = new Vector<String>();
		for (Lit l : assertions) {
			if (!l.attributes.isEmpty()) {
				String name = "<anonymous>";
				for (Pair<String, String> attr : l.attributes) {
					if (attr.a.equals(":named")) {
						name = attr.b;
						break;
					}
				}
				named.add(Helpers.quoted(name));
			}
			if (l.soft)
				soft.add(literal(l));
		}
		if (!named.isEmpty())
			throw new ErrorAPI("Constraints with attributes and quantifiers cannot be mixed!"
					+ "\n   Quantified variables: " + quantifiedVariables()
					+ "\n   Named constraints   : " + join(named));
		if (!soft.isEmpty())
			throw new ErrorAPI("Soft constraints and quantifiers cannot be mixed!"
					+ "\n   Quantified variables: " + quantifiedVariables()
					+ "\n   Soft constraints    : " + join(soft));

		StringBuilder sb = new StringBuilder();
		sb.append(Helpers.spaces(hasDelayed ? 17 : 12));
		sb.append(combined());
		for (int i = 0; i < closeParens; ++i)
			sb.append(')');
		result.add(sb.toString());
		return result;
	}

	private static String join(List<String> xs) {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < xs.size(); ++i) {
			if (i > 0) sb.append(", ");
			sb.append(xs.get(i));
		}
		return sb.toString();
	}

	/** The hard literals as one formula, with duplicates and trivially true ones removed. */
	private String combined() {
		List<Lit> sorted = new ArrayList<Lit>();
		for (Lit l : assertions)
			if (!l.soft)
				sorted.add(l);
		Collections.sort(sorted, ORDER);
		List<Lit> lits = new Vector<Lit>();
		for (Lit l : sorted)
			if (!l.redundant() && !lits.contains(l))
				lits.add(l);
		if (lits.isEmpty())
			return "true";
		if (lits.size() == 1)
			return literal(lits.get(0));
		List<String> parts = new Vector<String>();
		for (Lit l : lits) {
			if (l.bad())
				return "false";
			parts.add(literal(l));
		}
		return "(and " + Helpers.unwords(parts) + ")";
	}
}
