package de.psi.smtlib2.ast;

import edu.mit.csail.sdg.alloy4.ConstList;

/**
 * An operator applied to symbolic operands.
 */
public final class Operation {
    public final Op op;
    public final ConstList<SV> args;

    public Operation(Op op, ConstList<SV> args) {
        this.op = op;
        this.args = args;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(op.toString());
        for (SV a : args) {
            sb.append(" ");
            sb.append(a);
        }
        return sb.toString();
    }
}
