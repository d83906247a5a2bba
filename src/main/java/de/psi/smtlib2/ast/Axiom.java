package de.psi.smtlib2.ast;

import edu.mit.csail.sdg.alloy4.ConstList;

/**
 * Script text supplied by the user, passed through unchanged.
 */
public final class Axiom {
    /** True for a definition, false for an axiom the user vouches for. */
    public final boolean isDefinition;
    public final String name;
    public final ConstList<String> lines;

    public Axiom(boolean isDefinition, String name, ConstList<String> lines) {
        this.isDefinition = isDefinition;
        this.name = name;
        this.lines = lines;
    }
}
