package de.psi.smtlib2.smt;

/**
 * SMT-LIB logics a user may request explicitly. {@link #NONE} asks the
 * translator not to emit any {@code set-logic} line.
 */
public enum Logic {
    AUFLIA, AUFLIRA, AUFNIRA, LRA,
    QF_ABV, QF_AUFBV, QF_AUFLIA, QF_AX, QF_BV, QF_IDL, QF_LIA, QF_LRA, QF_NIA, QF_NRA, QF_RDL,
    QF_UF, QF_UFBV, QF_UFIDL, QF_UFLIA, QF_UFLRA, QF_UFNRA, QF_UFNIRA,
    UFLRA, UFNIA,
    QF_FPBV, QF_FP, QF_FD, QF_S,
    ALL,
    NONE
}
