package de.psi.smtlib2.ast;

import edu.mit.csail.sdg.alloy4.ConstList;

/**
 * An input as seen after skolemization: either a universally quantified
 * variable, or an existential one that becomes a function of the universals
 * declared before it.
 */
public final class SkolemInput {
    public final SV sv;
    public final boolean universal;
    /** Universals this existential depends on; empty for universals. */
    public final ConstList<SV> dependsOn;

    private SkolemInput(SV sv, boolean universal, ConstList<SV> dependsOn) {
        this.sv = sv;
        this.universal = universal;
        this.dependsOn = dependsOn;
    }

    public static SkolemInput forall(SV sv) {
        return new SkolemInput(sv, true, ConstList.<SV>make());
    }

    public static SkolemInput exists(SV sv, ConstList<SV> dependsOn) {
        return new SkolemInput(sv, false, dependsOn);
    }

    @Override
    public String toString() {
        return universal ? "forall " + sv : "exists " + sv + " " + dependsOn;
    }
}
