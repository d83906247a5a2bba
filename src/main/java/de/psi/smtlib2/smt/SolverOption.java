package de.psi.smtlib2.smt;

import java.util.Arrays;
import java.util.List;

/**
 * A user-requested solver setting. Every option renders to exactly one line.
 */
public abstract class SolverOption {

    public abstract String toSmtLib();

    public static SolverOption setLogic(Logic logic) {
        return new SetLogic(logic);
    }

    public static SolverOption diagnosticOutputChannel(String file) {
        return new DiagnosticOutputChannel(file);
    }

    public static SolverOption produceAssertions(boolean b) {
        return new Flag(":produce-assertions", b);
    }

    public static SolverOption produceAssignments(boolean b) {
        return new Flag(":produce-assignments", b);
    }

    public static SolverOption produceProofs(boolean b) {
        return new Flag(":produce-proofs", b);
    }

    public static SolverOption produceInterpolants(boolean b) {
        return new Flag(":produce-interpolants", b);
    }

    public static SolverOption produceUnsatAssumptions(boolean b) {
        return new Flag(":produce-unsat-assumptions", b);
    }

    public static SolverOption produceUnsatCores(boolean b) {
        return new Flag(":produce-unsat-cores", b);
    }

    public static SolverOption randomSeed(int seed) {
        return new Keyword(":random-seed", String.valueOf(seed));
    }

    public static SolverOption reproducibleResourceLimit(int limit) {
        return new Keyword(":reproducible-resource-limit", String.valueOf(limit));
    }

    public static SolverOption verbosity(int level) {
        return new Keyword(":verbosity", String.valueOf(level));
    }

    public static SolverOption keyword(String keyword, String... values) {
        return new Keyword(keyword, values);
    }

    public static SolverOption setInfo(String keyword, String... values) {
        return new SetInfo(keyword, values);
    }

    private static String unwords(String head, List<String> rest) {
        StringBuilder sb = new StringBuilder(head);
        for (String s : rest) {
            sb.append(" ");
            sb.append(s);
        }
        return sb.toString();
    }

    public static final class SetLogic extends SolverOption {
        public final Logic logic;

        public SetLogic(Logic logic) {
            this.logic = logic;
        }

        @Override
        public String toSmtLib() {
            return "(set-logic " + logic + ")";
        }

        @Override
        public String toString() {
            return "SetLogic " + logic;
        }
    }

    public static final class DiagnosticOutputChannel extends SolverOption {
        public final String file;

        public DiagnosticOutputChannel(String file) {
            this.file = file;
        }

        @Override
        public String toSmtLib() {
            return "(set-option :diagnostic-output-channel \"" + file + "\")";
        }
    }

    public static final class Flag extends SolverOption {
        public final String keyword;
        public final boolean value;

        public Flag(String keyword, boolean value) {
            this.keyword = keyword;
            this.value = value;
        }

        @Override
        public String toSmtLib() {
            return "(set-option " + keyword + " " + value + ")";
        }
    }

    public static final class Keyword extends SolverOption {
        public final String keyword;
        public final List<String> values;

        public Keyword(String keyword, String... values) {
            this.keyword = keyword;
            this.values = Arrays.asList(values);
        }

        @Override
        public String toSmtLib() {
            return "(set-option " + unwords(keyword, values) + ")";
        }
    }

    public static final class SetInfo extends SolverOption {
        public final String keyword;
        public final List<String> values;

        public SetInfo(String keyword, String... values) {
            this.keyword = keyword;
            this.values = Arrays.asList(values);
        }

        @Override
        public String toSmtLib() {
            return "(set-info " + unwords(keyword, values) + ")";
        }
    }
}
