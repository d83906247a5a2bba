package de.psi.smtlib2.translator;

import de.psi.smtlib2.ast.ArrayInfo;
import de.psi.smtlib2.ast.CV;
import de.psi.smtlib2.ast.SV;
import edu.mit.csail.sdg.alloy4.Err;
import edu.mit.csail.sdg.alloy4.ErrorAPI;

import java.util.List;
import java.util.Map;
import java.util.Vector;

/**
 * Arrays are declared up front and tied to their predecessor by an
 * equality. Equalities over constants only are emitted with the
 * declaration; the others wait until the program has defined their
 * operands.
 */
public final class ArrayDeclarations {

	/** Declaration plus ready initializers. */
	public final List<String> constants = new Vector<String>();
	/** Initializers that refer to program values. */
	public final List<String> delayeds = new Vector<String>();
	public final List<String> setups = new Vector<String>();

	private final TranslationContext ctx;
	private final Map<SV, CV> consts;
	private final boolean topLevel;

	private ArrayDeclarations(TranslationContext ctx, Map<SV, CV> consts, boolean topLevel) {
		this.ctx = ctx;
		this.consts = consts;
		this.topLevel = topLevel;
	}

	/**
	 * Emits array {@code a}. Under universals only arrays built from
	 * constants can be translated.
	 *
	 * @param consts every constant known to the script, with its value
	 */
	public static ArrayDeclarations declare(TranslationContext ctx, boolean quantified, Map<SV, CV> consts, ArrayInfo a) throws Err {
		final ArrayInfo.Context c = a.context;
		boolean topLevel = !quantified;
		if (c instanceof ArrayInfo.Free) {
			final SV init = ((ArrayInfo.Free) c).init;
			topLevel |= init == null || consts.containsKey(init);
		} else if (c instanceof ArrayInfo.Mutate) {
			final ArrayInfo.Mutate m = (ArrayInfo.Mutate) c;
			topLevel |= consts.containsKey(m.index) && consts.containsKey(m.value);
		} else if (c instanceof ArrayInfo.Merge) {
			topLevel |= consts.containsKey(((ArrayInfo.Merge) c).cond);
		}
		ArrayDeclarations result = new ArrayDeclarations(ctx, consts, topLevel);
		result.emit(quantified, a);
		return result;
	}

	private String ssv(SV s) throws Err {
		if (topLevel || consts.containsKey(s))
			return ctx.sv(s);
		throw new ErrorAPI("Not yet supported: Non-constant array initializer in a quantified context");
	}

	private void emit(boolean quantified, ArrayInfo a) throws Err {
		final String nm = "array_" + a.id;
		final String atyp = "(Array " + a.domain.smtType() + " " + a.range.smtType() + ")";
		final ArrayInfo.Context c = a.context;

		if (c instanceof ArrayInfo.Free && ((ArrayInfo.Free) c).init != null) {
			final SV init = ((ArrayInfo.Free) c).init;
			final CV value = consts.get(init);
			final String v = value != null ? ctx.cv(value) : ssv(init);
			constants.add("(define-fun " + nm + " () " + atyp + " ((as const " + atyp + ") " + v + "))");
		} else if (c instanceof ArrayInfo.Free && a.range.isChar()) {
			// elements would have to be constrained to strings of length one
			throw new ErrorAPI("Not yet supported: Free array declarations containing SChars");
		} else {
			constants.add("(declare-fun " + nm + " () " + atyp + ")");
		}

		final String initializer = nm + "_initializer";
		int n = 0;
		if (c instanceof ArrayInfo.Mutate) {
			final ArrayInfo.Mutate m = (ArrayInfo.Mutate) c;
			final boolean ready = consts.containsKey(m.index) && consts.containsKey(m.value);
			final String eq = "(= " + nm + " (store array_" + m.base + " " + ssv(m.index) + " " + ssv(m.value) + "))";
			(ready ? constants : delayeds).add("(define-fun " + initializer + "_0 () Bool " + eq + ")");
			n = 1;
		} else if (c instanceof ArrayInfo.Merge) {
			final ArrayInfo.Merge m = (ArrayInfo.Merge) c;
			final boolean ready = consts.containsKey(m.cond);
			final String eq = "(= " + nm + " (ite " + ssv(m.cond) + " array_" + m.then + " array_" + m.otherwise + "))";
			(ready ? constants : delayeds).add("(define-fun " + initializer + "_0 () Bool " + eq + ")");
			n = 1;
		}
		setups.addAll(TableDeclarations.setup(initializer, n, !quantified));
	}
}
