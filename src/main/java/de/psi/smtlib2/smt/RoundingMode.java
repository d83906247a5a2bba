package de.psi.smtlib2.smt;

/**
 * IEEE-754 rounding modes with their SMT-LIB names.
 */
public enum RoundingMode {
    ROUND_NEAREST_TIES_TO_EVEN("roundNearestTiesToEven"),
    ROUND_NEAREST_TIES_TO_AWAY("roundNearestTiesToAway"),
    ROUND_TOWARD_POSITIVE("roundTowardPositive"),
    ROUND_TOWARD_NEGATIVE("roundTowardNegative"),
    ROUND_TOWARD_ZERO("roundTowardZero");

    /** Name of the built-in sort; never declared. */
    public static final String SORT_NAME = "RoundingMode";

    private final String smtName;

    RoundingMode(String smtName) {
        this.smtName = smtName;
    }

    public String smtName() {
        return smtName;
    }

    @Override
    public String toString() {
        return smtName;
    }
}
