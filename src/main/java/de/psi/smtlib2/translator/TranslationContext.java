package de.psi.smtlib2.translator;

import de.psi.smtlib2.ast.CV;
import de.psi.smtlib2.ast.Op;
import de.psi.smtlib2.ast.SV;
import de.psi.smtlib2.smt.RoundingMode;
import de.psi.smtlib2.smt.SmtConfig;
import de.psi.smtlib2.smt.SolverCapabilities;
import edu.mit.csail.sdg.alloy4.Err;
import edu.mit.csail.sdg.alloy4.ErrorFatal;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Naming state shared by the emitters of one translation: how symbolic
 * values, tables and generated helper functions are referred to.
 */
public final class TranslationContext {
	public final SolverCapabilities caps;
	public final RoundingMode rm;

	/** Skolemized inputs and the universals they are applied to. */
	private final Map<SV, List<SV>> skolemMap;
	private final Map<Integer, String> tableMap;
	private final Map<Op.SeqReverse, String> functionMap;

	public TranslationContext(SmtConfig config, Map<SV, List<SV>> skolemMap, Map<Integer, String> tableMap,
							  Map<Op.SeqReverse, String> functionMap) {
		this.caps = config.capabilities;
		this.rm = config.roundingMode;
		this.skolemMap = skolemMap;
		this.tableMap = tableMap;
		this.functionMap = functionMap;
	}

	/** A context without skolem functions, tables or helper functions. */
	public TranslationContext(SmtConfig config) {
		this(config, Collections.<SV, List<SV>>emptyMap(), Collections.<Integer, String>emptyMap(),
				Collections.<Op.SeqReverse, String>emptyMap());
	}

	/** How {@code s} is written in the script; true and false are inlined. */
	public String sv(SV s) {
		final List<SV> args = skolemMap.get(s);
		if (args != null) {
			StringBuilder sb = new StringBuilder("(");
			sb.append(s);
			for (SV a : args) {
				sb.append(" ");
				sb.append(a);
			}
			sb.append(")");
			return sb.toString();
		}
		if (s.equals(SV.TRUE)) return "true";
		if (s.equals(SV.FALSE)) return "false";
		return s.toString();
	}

	public String cv(CV c) {
		return c.toSmtLib(rm);
	}

	/** Name of table {@code id}, applied to the universals if it is skolemized. */
	public String table(int id) {
		final String name = tableMap.get(id);
		return name != null ? name : "table" + id;
	}

	public String function(Op.SeqReverse op) throws Err {
		final String name = functionMap.get(op);
		if (name == null)
			throw new ErrorFatal("Internal error: no helper function was generated for " + op + ". Please report this as a bug.");
		return name;
	}
}
