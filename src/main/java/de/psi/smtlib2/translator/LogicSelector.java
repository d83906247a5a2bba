package de.psi.smtlib2.translator;

import de.psi.smtlib2.smt.Logic;
import de.psi.smtlib2.smt.QueryContext;
import de.psi.smtlib2.smt.SmtConfig;
import de.psi.smtlib2.smt.SolverCapabilities;
import de.psi.smtlib2.smt.SolverOption;
import edu.mit.csail.sdg.alloy4.A4Reporter;
import edu.mit.csail.sdg.alloy4.Err;
import edu.mit.csail.sdg.alloy4.ErrorAPI;

import java.util.Collections;
import java.util.List;
import java.util.Vector;

/**
 * Produces the settings that open a script: user options, model production
 * and the logic. The logic is picked by a fixed sequence of rules; the first
 * one that applies wins.
 */
public final class LogicSelector {

	private LogicSelector() {}

	public static List<String> settings(A4Reporter rep, Features f, SmtConfig cfg) throws Err {
		// the logic is decided first so that configuration errors surface before anything else
		final List<String> logic = logic(rep, f, cfg);
		List<String> result = new Vector<String>();
		result.addAll(userSettings(cfg.solverOptions));
		result.addAll(modelSettings(f.needsFlattening, cfg.capabilities));
		result.addAll(logic);
		return result;
	}

	/**
	 * The user's options minus any logic override. Of several diagnostic
	 * output channels only the last one is kept.
	 */
	public static List<String> userSettings(List<SolverOption> options) {
		List<String> result = new Vector<String>();
		for (int i = 0; i < options.size(); ++i) {
			final SolverOption o = options.get(i);
			if (o instanceof SolverOption.SetLogic)
				continue;
			if (o instanceof SolverOption.DiagnosticOutputChannel && hasDiagnosticOutputAfter(options, i))
				continue;
			result.add(o.toSmtLib());
		}
		return result;
	}

	private static boolean hasDiagnosticOutputAfter(List<SolverOption> options, int i) {
		for (int j = i + 1; j < options.size(); ++j)
			if (options.get(j) instanceof SolverOption.DiagnosticOutputChannel)
				return true;
		return false;
	}

	public static List<String> modelSettings(boolean needsFlattening, SolverCapabilities caps) {
		List<String> result = new Vector<String>();
		result.add("(set-option :produce-models true)");
		if (needsFlattening && caps.flattenedModels != null)
			result.addAll(caps.flattenedModels);
		return result;
	}

	static SolverOption.SetLogic logicOverride(List<SolverOption> options) throws Err {
		List<SolverOption.SetLogic> overrides = new Vector<SolverOption.SetLogic>();
		for (SolverOption o : options)
			if (o instanceof SolverOption.SetLogic)
				overrides.add((SolverOption.SetLogic) o);
		if (overrides.size() > 1) {
			StringBuilder sb = new StringBuilder();
			for (SolverOption.SetLogic l : overrides) {
				sb.append(" ");
				sb.append(l.logic);
			}
			throw new ErrorAPI("Only one setOption call to 'setLogic' is allowed, found: " + overrides.size()
					+ "\n  " + sb);
		}
		return overrides.isEmpty() ? null : overrides.get(0);
	}

	/** Every feature the problem needs and the solver lacks. */
	static List<String> unsupported(Features f, SolverCapabilities caps) {
		List<String> result = new Vector<String>();
		if ((f.hasTuples || f.hasEither || f.hasMaybe) && !caps.supportsDataTypes)
			result.add("data types");
		if (f.hasSets && !caps.supportsSets)
			result.add("set operations");
		if (f.hasBVs && !caps.supportsBitVectors)
			result.add("bit vectors");
		return result;
	}

	/** Reason for falling back to the catch-all logic, or null. */
	static String catchAllReason(Features f) {
		if (f.hasInteger) return "has unbounded values";
		if (f.hasRational) return "has rational values";
		if (f.hasReal) return "has algebraic reals";
		if (!f.userSorts.isEmpty()) return "has user-defined sorts";
		if (f.hasNonBVArrays) return "has non-bitvector arrays";
		if (f.hasTuples) return "has tuples";
		if (f.hasEither) return "has either type";
		if (f.hasMaybe) return "has maybe type";
		if (f.hasSets) return "has sets";
		if (f.hasList) return "has lists";
		if (f.hasChar) return "has chars";
		if (f.hasString) return "has strings";
		if (f.hasRegExp) return "has regular expressions";
		if (f.hasArrayInits) return "has array initializers";
		if (f.hasOverflows) return "has overflow checks";
		return null;
	}

	public static List<String> logic(A4Reporter rep, Features f, SmtConfig cfg) throws Err {
		final SolverCapabilities caps = cfg.capabilities;

		final SolverOption.SetLogic override = logicOverride(cfg.solverOptions);
		if (override != null) {
			rep.debug("Logic given by the user: " + override.logic + "\n");
			if (override.logic == Logic.NONE)
				return Collections.singletonList("; NB. Not setting the logic per user request of Logic_NONE");
			return Collections.singletonList("(set-logic " + override.logic + ") ; NB. User specified.");
		}

		final List<String> missing = unsupported(f, caps);
		if (!missing.isEmpty()) {
			StringBuilder sb = new StringBuilder("Unable to choose a proper solver configuration:");
			for (String w : missing) {
				sb.append("\n  Given problem requires support for ").append(w);
				sb.append("\n  But the chosen solver (").append(Helpers.quoted(caps.name)).append(") doesn't support this feature.");
			}
			sb.append("\nPlease report this as a feature request, either for the translator or the backend solver.");
			throw new ErrorAPI(sb.toString());
		}

		// never QF_S; ALL does at least as well on string problems
		final String reason = catchAllReason(f);
		if (reason != null) {
			rep.debug("Using the catch-all logic: " + reason + "\n");
			return Collections.singletonList("(set-logic ALL) ; " + reason + ", using catch-all.");
		}

		if (f.hasFP || f.hasRounding) {
			if (f.hasForalls) return Collections.singletonList("(set-logic ALL)");
			return Collections.singletonList(f.hasBVs ? "(set-logic QF_FPBV)" : "(set-logic QF_FP)");
		}

		if (cfg.queryContext == QueryContext.EXTERNAL)
			return Collections.singletonList("(set-logic ALL) ; external query, using all logics.");

		if (!caps.supportsBitVectors)
			return Collections.singletonList("(set-logic ALL)");

		// axioms are likely to contain quantifiers; tables are declared as uninterpreted functions
		final String qs = !f.hasForalls && !f.hasAxioms ? "QF_" : "";
		final String as = f.hasArrays ? "A" : "";
		final String ufs = f.hasUninterpretedsOrTables ? "UF" : "";
		rep.debug("Assembled bit-vector logic " + qs + as + ufs + "BV\n");
		return Collections.singletonList("(set-logic " + qs + as + ufs + "BV)");
	}
}
