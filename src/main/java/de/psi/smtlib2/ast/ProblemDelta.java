package de.psi.smtlib2.ast;

import de.psi.smtlib2.smt.SmtConfig;
import edu.mit.csail.sdg.alloy4.ConstList;
import edu.mit.csail.sdg.alloy4.Pair;

/**
 * The entities created since the previous translation of an open session.
 */
public final class ProblemDelta {
    public final ConstList<NamedVar> inputs;
    /** Kinds not seen by the session before. */
    public final ConstList<Kind> newKinds;
    /** Every constant of the session, old and new. */
    public final ConstList<Pair<SV, CV>> allConstants;
    public final ConstList<Pair<SV, CV>> newConstants;
    public final ConstList<ArrayInfo> arrays;
    public final ConstList<TableInfo> tables;
    public final ConstList<UninterpretedSymbol> uninterpreteds;
    public final ConstList<Assignment> program;
    public final ConstList<Constraint> constraints;
    public final SmtConfig config;

    public ProblemDelta(ConstList<NamedVar> inputs, ConstList<Kind> newKinds,
                        ConstList<Pair<SV, CV>> allConstants, ConstList<Pair<SV, CV>> newConstants,
                        ConstList<ArrayInfo> arrays, ConstList<TableInfo> tables,
                        ConstList<UninterpretedSymbol> uninterpreteds, ConstList<Assignment> program,
                        ConstList<Constraint> constraints, SmtConfig config) {
        this.inputs = inputs;
        this.newKinds = newKinds;
        this.allConstants = allConstants;
        this.newConstants = newConstants;
        this.arrays = arrays;
        this.tables = tables;
        this.uninterpreteds = uninterpreteds;
        this.program = program;
        this.constraints = constraints;
        this.config = config;
    }
}
