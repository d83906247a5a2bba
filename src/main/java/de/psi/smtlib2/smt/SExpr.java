package de.psi.smtlib2.smt;

import java.util.Arrays;
import java.util.List;
import java.util.Vector;

/**
 * A minimal S-expression tree used to print SMT-LIB terms.
 */
public abstract class SExpr {

    public static final SExpr TRUE = new Symbol("true");
    public static final SExpr FALSE = new Symbol("false");

    public static SExpr sym(String name) {
        return new Symbol(name);
    }

    public static List<SExpr> syms(List<String> names) {
        List<SExpr> l = new Vector<SExpr>();
        for (String name : names)
            l.add(new Symbol(name));
        return l;
    }

    public static SExpr call(String funcName, SExpr... args) {
        return call(new Symbol(funcName), Arrays.asList(args));
    }

    public static SExpr call(String funcName, List<SExpr> args) {
        return call(new Symbol(funcName), args);
    }

    public static SExpr call(SExpr head, SExpr... args) {
        return call(head, Arrays.asList(args));
    }

    public static SExpr call(SExpr head, List<SExpr> args) {
        List<SExpr> l = new Vector<SExpr>();
        l.add(head);
        l.addAll(args);
        return new SList(l);
    }

    /** An indexed identifier such as {@code (_ extract 7 0)}. */
    public static SExpr indexed(String name, Object... indices) {
        List<SExpr> l = new Vector<SExpr>();
        l.add(new Symbol("_"));
        l.add(new Symbol(name));
        for (Object index : indices)
            l.add(new Symbol(String.valueOf(index)));
        return new SList(l);
    }

    /** A symbol qualified by its result sort, {@code (as name sort)}. */
    public static SExpr ascribed(String name, String sort) {
        return call("as", sym(name), sym(sort));
    }

    public static SExpr and(SExpr... args) {
        return and(Arrays.asList(args));
    }

    public static SExpr and(List<SExpr> args) {
        if (args.size() > 1) {
            return call("and", args);
        } else if (args.size() == 1) {
            return args.get(0);
        } else {
            return TRUE;
        }
    }

    public static SExpr add(List<SExpr> args) {
        return call("+", args);
    }

    public static SExpr eq(SExpr... args) {
        return call("=", args);
    }

    public static SExpr not(SExpr arg) {
        return call("not", arg);
    }

    public static SExpr ite(SExpr cond, SExpr then, SExpr otherwise) {
        return call("ite", cond, then, otherwise);
    }

    public static class Symbol extends SExpr {
        private final String name;

        public Symbol(String name) {
            this.name = name;
        }

        public String getName() {
            return name;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    public static class SList extends SExpr {
        private final List<SExpr> items;

        public SList(List<SExpr> items) {
            this.items = items;
        }

        public List<SExpr> getItems() {
            return items;
        }

        @Override
        public String toString() {
            boolean first = true;
            StringBuilder sb = new StringBuilder();
            sb.append("(");
            for (SExpr expr : items) {
                if (first) first = false; else sb.append(" ");
                sb.append(expr.toString());
            }
            sb.append(")");
            return sb.toString();
        }
    }
}
