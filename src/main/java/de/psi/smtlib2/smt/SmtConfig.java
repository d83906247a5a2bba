package de.psi.smtlib2.smt;

import java.util.List;
import java.util.Vector;

/**
 * Translator settings. Fields are public and carry defaults; callers adjust
 * what they need before handing the object to the translator.
 */
public final class SmtConfig implements Cloneable {

    /** Rounding mode used when printing floating-point literals and arithmetic. */
    public RoundingMode roundingMode = RoundingMode.ROUND_NEAREST_TIES_TO_EVEN;

    /** Options to pass on to the solver, in the order given. At most one may set the logic. */
    public List<SolverOption> solverOptions = new Vector<SolverOption>();

    /** Capabilities of the target solver. */
    public SolverCapabilities capabilities = SolverCapabilities.z3();

    /** Whether the script is generated for an interactive query session. */
    public QueryContext queryContext = QueryContext.INTERNAL;

    @Override
    public SmtConfig clone() {
        final SmtConfig x = new SmtConfig();
        x.roundingMode = roundingMode;
        x.solverOptions = new Vector<SolverOption>(solverOptions);
        x.capabilities = capabilities.clone();
        x.queryContext = queryContext;
        return x;
    }
}
