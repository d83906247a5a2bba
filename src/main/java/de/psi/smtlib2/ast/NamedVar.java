package de.psi.smtlib2.ast;

/**
 * A variable with the name the user gave it.
 */
public final class NamedVar {
    public final SV sv;
    public final String name;

    public NamedVar(SV sv, String name) {
        this.sv = sv;
        this.name = name;
    }

    @Override
    public String toString() {
        return name + " (" + sv + ")";
    }
}
