package de.psi.smtlib2.ast;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Vector;

/**
 * Regular expressions over strings, printed in the SMT-LIB string theory syntax.
 */
public abstract class RegExp {

    public abstract String toSmtLib();

    @Override
    public String toString() {
        return toSmtLib();
    }

    public static RegExp literal(String s) { return new Literal(s); }
    public static RegExp all() { return new Atom("re.all"); }
    public static RegExp allChar() { return new Atom("re.allchar"); }
    public static RegExp none() { return new Atom("re.none"); }
    public static RegExp range(char from, char to) { return new Range(from, to); }
    public static RegExp concat(RegExp... rs) { return new Nary("re.++", Arrays.asList(rs), new Literal("")); }
    public static RegExp union(RegExp... rs) { return new Nary("re.union", Arrays.asList(rs), new Atom("re.none")); }
    public static RegExp star(RegExp r) { return new Unary("re.*", r); }
    public static RegExp plus(RegExp r) { return new Unary("re.+", r); }
    public static RegExp opt(RegExp r) { return new Unary("re.opt", r); }
    public static RegExp complement(RegExp r) { return new Unary("re.comp", r); }
    public static RegExp inter(RegExp a, RegExp b) { return new Nary("re.inter", Arrays.asList(a, b), null); }
    public static RegExp diff(RegExp a, RegExp b) { return new Nary("re.diff", Arrays.asList(a, b), null); }
    public static RegExp loop(int lo, int hi, RegExp r) { return new Loop(lo, hi, r); }

    public static final class Literal extends RegExp {
        public final String text;

        Literal(String text) {
            this.text = text;
        }

        @Override
        public String toSmtLib() {
            return "(str.to_re " + CV.quote(text) + ")";
        }
    }

    public static final class Atom extends RegExp {
        public final String name;

        Atom(String name) {
            this.name = name;
        }

        @Override
        public String toSmtLib() {
            return name;
        }
    }

    public static final class Range extends RegExp {
        public final char from;
        public final char to;

        Range(char from, char to) {
            this.from = from;
            this.to = to;
        }

        @Override
        public String toSmtLib() {
            return "(re.range " + CV.quote(String.valueOf(from)) + " " + CV.quote(String.valueOf(to)) + ")";
        }
    }

    public static final class Unary extends RegExp {
        public final String op;
        public final RegExp arg;

        Unary(String op, RegExp arg) {
            this.op = op;
            this.arg = arg;
        }

        @Override
        public String toSmtLib() {
            return "(" + op + " " + arg.toSmtLib() + ")";
        }
    }

    public static final class Loop extends RegExp {
        public final int lo;
        public final int hi;
        public final RegExp arg;

        Loop(int lo, int hi, RegExp arg) {
            this.lo = lo;
            this.hi = hi;
            this.arg = arg;
        }

        @Override
        public String toSmtLib() {
            return "((_ re.loop " + lo + " " + hi + ") " + arg.toSmtLib() + ")";
        }
    }

    /** An n-ary combinator; with no operands it stands for its unit. */
    public static final class Nary extends RegExp {
        public final String op;
        public final List<RegExp> args;
        private final RegExp unit;

        Nary(String op, List<RegExp> args, RegExp unit) {
            this.op = op;
            this.args = Collections.unmodifiableList(new Vector<RegExp>(args));
            this.unit = unit;
        }

        @Override
        public String toSmtLib() {
            if (args.isEmpty() && unit != null) return unit.toSmtLib();
            if (args.size() == 1 && unit != null) return args.get(0).toSmtLib();
            StringBuilder sb = new StringBuilder("(" + op);
            for (RegExp r : args) {
                sb.append(" ");
                sb.append(r.toSmtLib());
            }
            sb.append(")");
            return sb.toString();
        }
    }
}
