package de.psi.smtlib2.smt;

/**
 * Whether the script is produced for a plain sat/prove call or for an
 * interactive query session driven by the user.
 */
public enum QueryContext {
    INTERNAL,
    EXTERNAL
}
