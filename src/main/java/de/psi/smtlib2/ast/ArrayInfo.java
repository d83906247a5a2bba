package de.psi.smtlib2.ast;

/**
 * A symbolic array together with the step that produced it.
 */
public final class ArrayInfo {
    public final int id;
    public final String name;
    public final Kind domain;
    public final Kind range;
    public final Context context;

    public ArrayInfo(int id, String name, Kind domain, Kind range, Context context) {
        this.id = id;
        this.name = name;
        this.domain = domain;
        this.range = range;
        this.context = context;
    }

    @Override
    public String toString() {
        return "array_" + id + " (" + name + ") :: " + domain + " -> " + range + " = " + context;
    }

    /** How an array came into existence. */
    public static abstract class Context {
    }

    /** A fresh array, optionally with every element set to {@code init}. */
    public static final class Free extends Context {
        public final SV init;

        public Free(SV init) {
            this.init = init;
        }

        @Override
        public String toString() {
            return init == null ? "free" : "const " + init;
        }
    }

    /** Array {@code base} with {@code index} updated to {@code value}. */
    public static final class Mutate extends Context {
        public final int base;
        public final SV index;
        public final SV value;

        public Mutate(int base, SV index, SV value) {
            this.base = base;
            this.index = index;
            this.value = value;
        }

        @Override
        public String toString() {
            return "array_" + base + "[" + index + " := " + value + "]";
        }
    }

    public static final class Merge extends Context {
        public final SV cond;
        public final int then;
        public final int otherwise;

        public Merge(SV cond, int then, int otherwise) {
            this.cond = cond;
            this.then = then;
            this.otherwise = otherwise;
        }

        @Override
        public String toString() {
            return "ite " + cond + " array_" + then + " array_" + otherwise;
        }
    }
}
