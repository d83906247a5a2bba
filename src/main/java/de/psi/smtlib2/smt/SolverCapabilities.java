package de.psi.smtlib2.smt;

import java.util.Arrays;
import java.util.List;

/**
 * What a particular backend solver accepts. The translator only reads these
 * fields; it never changes them.
 */
public final class SolverCapabilities implements Cloneable {

    /** Name of the solver, used in diagnostics. */
    public String name = "unknown";

    public boolean supportsQuantifiers = true;
    public boolean supportsDefineFun = true;
    public boolean supportsDistinct = true;
    public boolean supportsBitVectors = true;
    public boolean supportsUninterpretedSorts = true;
    public boolean supportsUnboundedInts = true;
    public boolean supportsReals = true;
    public boolean supportsIEEE754 = true;
    public boolean supportsSets = false;
    public boolean supportsOptimization = false;
    public boolean supportsPseudoBooleans = false;
    public boolean supportsDataTypes = true;

    /** Whether datatype testers may be written as {@code (_ is c)} without a signature. */
    public boolean supportsDirectAccessors = false;

    /** Whether {@code (_ int2bv n)} is available. */
    public boolean supportsInt2bv = false;

    /**
     * Option lines that ask the solver to print models in flattened form, or
     * null if the solver has no such setting.
     */
    public List<String> flattenedModels = null;

    @Override
    public SolverCapabilities clone() {
        try {
            return (SolverCapabilities) super.clone();
        } catch (CloneNotSupportedException ex) {
            throw new AssertionError(ex);
        }
    }

    public static SolverCapabilities z3() {
        SolverCapabilities c = new SolverCapabilities();
        c.name = "Z3";
        c.supportsSets = true;
        c.supportsOptimization = true;
        c.supportsPseudoBooleans = true;
        c.supportsInt2bv = true;
        c.flattenedModels = Arrays.asList(
                "(set-option :pp.max_depth 4294967295)",
                "(set-option :pp.min_alias_size 4294967295)",
                "(set-option :model.inline_def true )");
        return c;
    }

    public static SolverCapabilities cvc4() {
        SolverCapabilities c = new SolverCapabilities();
        c.name = "CVC4";
        c.supportsSets = true;
        c.supportsDirectAccessors = true;
        c.supportsInt2bv = true;
        return c;
    }

    public static SolverCapabilities yices() {
        SolverCapabilities c = new SolverCapabilities();
        c.name = "Yices";
        c.supportsQuantifiers = false;
        c.supportsUninterpretedSorts = true;
        c.supportsIEEE754 = false;
        c.supportsDataTypes = false;
        return c;
    }

    public static SolverCapabilities boolector() {
        SolverCapabilities c = new SolverCapabilities();
        c.name = "Boolector";
        c.supportsQuantifiers = false;
        c.supportsUninterpretedSorts = false;
        c.supportsUnboundedInts = false;
        c.supportsReals = false;
        c.supportsIEEE754 = false;
        c.supportsDataTypes = false;
        return c;
    }

    public static SolverCapabilities mathSAT() {
        SolverCapabilities c = new SolverCapabilities();
        c.name = "MathSAT";
        c.supportsQuantifiers = false;
        c.supportsDataTypes = false;
        return c;
    }

    public static SolverCapabilities abc() {
        SolverCapabilities c = new SolverCapabilities();
        c.name = "ABC";
        c.supportsQuantifiers = false;
        c.supportsDefineFun = false;
        c.supportsUninterpretedSorts = false;
        c.supportsUnboundedInts = false;
        c.supportsReals = false;
        c.supportsIEEE754 = false;
        c.supportsDataTypes = false;
        return c;
    }
}
