package de.psi.smtlib2.translator;

import de.psi.smtlib2.ast.CV;
import de.psi.smtlib2.ast.SV;
import de.psi.smtlib2.ast.TableInfo;
import edu.mit.csail.sdg.alloy4.Err;

import java.util.Collection;
import java.util.List;
import java.util.Vector;

/**
 * Lookup tables become uninterpreted functions plus one equality per
 * element. A table whose elements are all constants is filled in at the
 * top of the script; any other table is skolemized over the universals and
 * filled in under the quantifier.
 */
public final class TableDeclarations {

	private TableDeclarations() {}

	/** A table with its element equalities. */
	public static final class TableData {
		public final TableInfo table;
		/** True if every element is a constant. */
		public final boolean constant;
		public final List<String> equalities;

		TableData(TableInfo table, boolean constant, List<String> equalities) {
			this.table = table;
			this.constant = constant;
			this.equalities = equalities;
		}
	}

	/**
	 * Element equalities of {@code t}. {@code args} is the text inserted
	 * after the table name when the table is applied under the quantifier,
	 * e.g. {@code " s0 s1"}.
	 */
	public static TableData generate(TranslationContext ctx, String args, Collection<SV> consts, TableInfo t) throws Err {
		final String name = "table" + t.id;
		List<String> pre = new Vector<String>();
		List<String> post = new Vector<String>();
		List<String> preNested = new Vector<String>();
		for (int k = 0; k < t.elems.size(); ++k) {
			final SV x = t.elems.get(k);
			final String idx = ctx.cv(CV.ofInteger(t.argKind, k));
			final String v = ctx.sv(x);
			if (consts.contains(x)) {
				pre.add("(= (" + name + " " + idx + ") " + v + ")");
				preNested.add("(= (" + name + args + " " + idx + ") " + v + ")");
			} else {
				post.add("(= (" + name + args + " " + idx + ") " + v + ")");
			}
		}
		if (post.isEmpty())
			return new TableData(t, true, pre);
		List<String> all = new Vector<String>(preNested);
		all.addAll(post);
		return new TableData(t, false, all);
	}

	/** Declaration, one initializer per element and the combined initializer. */
	public static List<String> constTable(TableData d) {
		final String t = "table" + d.table.id;
		final String initializer = t + "_initializer";
		List<String> result = new Vector<String>();
		result.add("(declare-fun " + t + " (" + d.table.argKind.smtType() + ") " + d.table.resultKind.smtType() + ")");
		for (int k = 0; k < d.equalities.size(); ++k)
			result.add("(define-fun " + initializer + "_" + k + " () Bool " + d.equalities.get(k) + ")");
		result.addAll(setup(initializer, d.equalities.size(), true));
		return result;
	}

	/** Declaration of a table taking the universals as extra leading arguments. */
	public static String skolemTable(String forallTypes, TableData d) {
		final String qs = forallTypes.isEmpty() ? "" : forallTypes + " ";
		return "(declare-fun table" + d.table.id + " (" + qs + d.table.argKind.smtType() + ") "
				+ d.table.resultKind.smtType() + ")";
	}

	/**
	 * Conjunction of {@code n} numbered initializers, asserted. With none,
	 * the trivial initializer is still defined if {@code emitEmpty} is set.
	 */
	static List<String> setup(String initializer, int n, boolean emitEmpty) {
		List<String> result = new Vector<String>();
		if (n == 0) {
			if (emitEmpty)
				result.add("(define-fun " + initializer + " () Bool true) ; no initialization needed");
			return result;
		}
		if (n == 1) {
			result.add("(define-fun " + initializer + " () Bool " + initializer + "_0)");
		} else {
			List<String> inits = new Vector<String>();
			for (int k = 0; k < n; ++k)
				inits.add(initializer + "_" + k);
			result.add("(define-fun " + initializer + " () Bool (and " + Helpers.unwords(inits) + "))");
		}
		result.add("(assert " + initializer + ")");
		return result;
	}
}
