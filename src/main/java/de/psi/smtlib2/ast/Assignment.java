package de.psi.smtlib2.ast;

/**
 * One entry of the program: {@code sv} is defined as the result of {@code expr}.
 */
public final class Assignment {
    public final SV sv;
    public final Operation expr;

    public Assignment(SV sv, Operation expr) {
        this.sv = sv;
        this.expr = expr;
    }

    @Override
    public String toString() {
        return sv + " = " + expr;
    }
}
