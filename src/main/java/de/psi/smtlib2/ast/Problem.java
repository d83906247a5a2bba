package de.psi.smtlib2.ast;

import de.psi.smtlib2.smt.SmtConfig;
import edu.mit.csail.sdg.alloy4.ConstList;
import edu.mit.csail.sdg.alloy4.Pair;

/**
 * Everything the translator needs to produce one complete script. Instances
 * are built once by {@link ProblemBuilder} and only read afterwards.
 */
public final class Problem {
    public final ConstList<String> comments;
    /** Every kind in use, nested kinds included. */
    public final ConstList<Kind> kinds;
    /** True for a satisfiability query, false when the goal is to be proven. */
    public final boolean isSat;
    public final ConstList<NamedVar> inputs;
    public final ConstList<SkolemInput> skolemInputs;
    public final ConstList<NamedVar> trackers;
    public final ConstList<Pair<SV, CV>> constants;
    public final ConstList<TableInfo> tables;
    public final ConstList<ArrayInfo> arrays;
    public final ConstList<UninterpretedSymbol> uninterpreteds;
    public final ConstList<Axiom> axioms;
    public final ConstList<Assignment> program;
    public final ConstList<Constraint> constraints;
    public final SV goal;
    public final SmtConfig config;

    public Problem(ConstList<String> comments, ConstList<Kind> kinds, boolean isSat,
                   ConstList<NamedVar> inputs, ConstList<SkolemInput> skolemInputs, ConstList<NamedVar> trackers,
                   ConstList<Pair<SV, CV>> constants, ConstList<TableInfo> tables, ConstList<ArrayInfo> arrays,
                   ConstList<UninterpretedSymbol> uninterpreteds, ConstList<Axiom> axioms,
                   ConstList<Assignment> program, ConstList<Constraint> constraints, SV goal, SmtConfig config) {
        this.comments = comments;
        this.kinds = kinds;
        this.isSat = isSat;
        this.inputs = inputs;
        this.skolemInputs = skolemInputs;
        this.trackers = trackers;
        this.constants = constants;
        this.tables = tables;
        this.arrays = arrays;
        this.uninterpreteds = uninterpreteds;
        this.axioms = axioms;
        this.program = program;
        this.constraints = constraints;
        this.goal = goal;
        this.config = config;
    }

    /** The universally quantified variables, in declaration order. */
    public ConstList<SV> foralls() {
        ConstList.TempList<SV> result = new ConstList.TempList<SV>();
        for (SkolemInput in : skolemInputs)
            if (in.universal)
                result.add(in.sv);
        return result.makeConst();
    }
}
