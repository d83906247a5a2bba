package de.psi.smtlib2.ast;

import edu.mit.csail.sdg.alloy4.ConstList;
import edu.mit.csail.sdg.alloy4.Pair;

public final class Constraint {
    public final boolean soft;
    /** Keyword/value pairs such as {@code (":named", "c1")}. */
    public final ConstList<Pair<String, String>> attributes;
    public final SV literal;

    public Constraint(boolean soft, ConstList<Pair<String, String>> attributes, SV literal) {
        this.soft = soft;
        this.attributes = attributes;
        this.literal = literal;
    }

    @Override
    public String toString() {
        return (soft ? "soft " : "") + literal + (attributes.isEmpty() ? "" : " " + attributes);
    }
}
