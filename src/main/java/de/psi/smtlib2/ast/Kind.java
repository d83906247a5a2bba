package de.psi.smtlib2.ast;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Vector;

/**
 * The sort of a symbolic value. Kinds nest; every structural question about
 * a kind is answered by recursing over {@link #children()} or by a
 * {@link Visitor}.
 */
public abstract class Kind {

    public static final Kind BOOL = new Bool();
    public static final Kind UNBOUNDED = new Unbounded();
    public static final Kind REAL = new Real();
    public static final Kind FLOAT = new Float32();
    public static final Kind DOUBLE = new Float64();
    public static final Kind RATIONAL = new Rational();
    public static final Kind CHAR = new Char();
    public static final Kind STRING = new Str();

    public static Kind bounded(boolean signed, int width) {
        return new Bounded(signed, width);
    }

    public static Kind word(int width) {
        return new Bounded(false, width);
    }

    public static Kind signed(int width) {
        return new Bounded(true, width);
    }

    public static Kind fp(int eb, int sb) {
        return new FloatingPoint(eb, sb);
    }

    public static Kind list(Kind elem) {
        return new Seq(elem);
    }

    public static Kind set(Kind elem) {
        return new SetOf(elem);
    }

    public static Kind tuple(Kind... elems) {
        return new Tuple(Arrays.asList(elems));
    }

    public static Kind tuple(List<Kind> elems) {
        return new Tuple(elems);
    }

    public static Kind maybe(Kind elem) {
        return new Maybe(elem);
    }

    public static Kind either(Kind left, Kind right) {
        return new Either(left, right);
    }

    public static Kind userSort(String name) {
        return new UserSort(name, null);
    }

    public static Kind enumeration(String name, String... constructors) {
        return new UserSort(name, Arrays.asList(constructors));
    }

    /** The SMT-LIB sort this kind maps to. */
    public abstract String smtType();

    public abstract <T> T accept(Visitor<T> visitor);

    /** Immediate sub-kinds. */
    public List<Kind> children() {
        return Collections.emptyList();
    }

    public boolean hasSign() {
        return false;
    }

    /** Whether model values of this kind are only readable when the solver prints them flattened. */
    public boolean needsFlattening() {
        return false;
    }

    /** This kind followed by all kinds nested inside it, pre-order. */
    public final List<Kind> universe() {
        List<Kind> result = new Vector<Kind>();
        collect(this, result);
        return result;
    }

    private static void collect(Kind k, List<Kind> into) {
        into.add(k);
        for (Kind c : k.children())
            collect(c, into);
    }

    /** True if neither a character nor a rational occurs anywhere in this kind. */
    public final boolean isCharAndRationalFree() {
        for (Kind k : universe())
            if (k.isChar() || k.isRational())
                return false;
        return true;
    }

    public final boolean isBoolean() { return this instanceof Bool; }
    public final boolean isBounded() { return this instanceof Bounded; }
    public final boolean isUnbounded() { return this instanceof Unbounded; }
    public final boolean isReal() { return this instanceof Real; }
    public final boolean isFloat() { return this instanceof Float32; }
    public final boolean isDouble() { return this instanceof Float64; }
    public final boolean isFP() { return this instanceof FloatingPoint; }
    public final boolean isRational() { return this instanceof Rational; }
    public final boolean isChar() { return this instanceof Char; }
    public final boolean isString() { return this instanceof Str; }
    public final boolean isList() { return this instanceof Seq; }
    public final boolean isSet() { return this instanceof SetOf; }
    public final boolean isTuple() { return this instanceof Tuple; }
    public final boolean isMaybe() { return this instanceof Maybe; }
    public final boolean isEither() { return this instanceof Either; }
    public final boolean isUserSort() { return this instanceof UserSort; }

    /** Float, Double or an arbitrary-precision float. */
    public final boolean isSomeFloat() {
        return isFloat() || isDouble() || isFP();
    }

    @Override
    public boolean equals(Object o) {
        return o != null && o.getClass() == getClass() && o.toString().equals(toString());
    }

    @Override
    public int hashCode() {
        return toString().hashCode();
    }

    public static final class Bool extends Kind {
        private Bool() {}

        @Override public String smtType() { return "Bool"; }
        @Override public String toString() { return "Bool"; }
        @Override public <T> T accept(Visitor<T> v) { return v.visit(this); }
    }

    public static final class Bounded extends Kind {
        public final boolean signed;
        public final int width;

        private Bounded(boolean signed, int width) {
            this.signed = signed;
            this.width = width;
        }

        @Override public String smtType() { return "(_ BitVec " + width + ")"; }
        @Override public boolean hasSign() { return signed; }
        @Override public String toString() { return (signed ? "Int" : "Word") + width; }
        @Override public <T> T accept(Visitor<T> v) { return v.visit(this); }
    }

    public static final class Unbounded extends Kind {
        private Unbounded() {}

        @Override public String smtType() { return "Int"; }
        @Override public boolean hasSign() { return true; }
        @Override public String toString() { return "Integer"; }
        @Override public <T> T accept(Visitor<T> v) { return v.visit(this); }
    }

    public static final class Real extends Kind {
        private Real() {}

        @Override public String smtType() { return "Real"; }
        @Override public boolean hasSign() { return true; }
        @Override public String toString() { return "Real"; }
        @Override public <T> T accept(Visitor<T> v) { return v.visit(this); }
    }

    public static final class Float32 extends Kind {
        private Float32() {}

        @Override public String smtType() { return "(_ FloatingPoint 8 24)"; }
        @Override public boolean hasSign() { return true; }
        @Override public String toString() { return "Float"; }
        @Override public <T> T accept(Visitor<T> v) { return v.visit(this); }
    }

    public static final class Float64 extends Kind {
        private Float64() {}

        @Override public String smtType() { return "(_ FloatingPoint 11 53)"; }
        @Override public boolean hasSign() { return true; }
        @Override public String toString() { return "Double"; }
        @Override public <T> T accept(Visitor<T> v) { return v.visit(this); }
    }

    public static final class FloatingPoint extends Kind {
        public final int eb;
        public final int sb;

        private FloatingPoint(int eb, int sb) {
            this.eb = eb;
            this.sb = sb;
        }

        @Override public String smtType() { return "(_ FloatingPoint " + eb + " " + sb + ")"; }
        @Override public boolean hasSign() { return true; }
        @Override public String toString() { return "FloatingPoint " + eb + " " + sb; }
        @Override public <T> T accept(Visitor<T> v) { return v.visit(this); }
    }

    public static final class Rational extends Kind {
        private Rational() {}

        @Override public String smtType() { return "SBVRational"; }
        @Override public boolean hasSign() { return true; }
        @Override public String toString() { return "Rational"; }
        @Override public <T> T accept(Visitor<T> v) { return v.visit(this); }
    }

    public static final class Char extends Kind {
        private Char() {}

        @Override public String smtType() { return "String"; }
        @Override public String toString() { return "Char"; }
        @Override public <T> T accept(Visitor<T> v) { return v.visit(this); }
    }

    public static final class Str extends Kind {
        private Str() {}

        @Override public String smtType() { return "String"; }
        @Override public String toString() { return "String"; }
        @Override public <T> T accept(Visitor<T> v) { return v.visit(this); }
    }

    public static final class Seq extends Kind {
        public final Kind elem;

        private Seq(Kind elem) {
            this.elem = elem;
        }

        @Override public String smtType() { return "(Seq " + elem.smtType() + ")"; }
        @Override public List<Kind> children() { return Collections.singletonList(elem); }
        @Override public boolean needsFlattening() { return true; }
        @Override public String toString() { return "[" + elem + "]"; }
        @Override public <T> T accept(Visitor<T> v) { return v.visit(this); }
    }

    public static final class SetOf extends Kind {
        public final Kind elem;

        private SetOf(Kind elem) {
            this.elem = elem;
        }

        @Override public String smtType() { return "(Array " + elem.smtType() + " Bool)"; }
        @Override public List<Kind> children() { return Collections.singletonList(elem); }
        @Override public boolean needsFlattening() { return true; }
        @Override public String toString() { return "{" + elem + "}"; }
        @Override public <T> T accept(Visitor<T> v) { return v.visit(this); }
    }

    public static final class Tuple extends Kind {
        public final List<Kind> elems;

        private Tuple(List<Kind> elems) {
            this.elems = Collections.unmodifiableList(new Vector<Kind>(elems));
        }

        public int arity() {
            return elems.size();
        }

        @Override
        public String smtType() {
            if (elems.isEmpty()) return "SBVTuple0";
            StringBuilder sb = new StringBuilder("(SBVTuple" + elems.size());
            for (Kind k : elems) {
                sb.append(" ");
                sb.append(k.smtType());
            }
            sb.append(")");
            return sb.toString();
        }

        @Override public List<Kind> children() { return elems; }
        @Override public boolean needsFlattening() { return true; }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("(");
            for (int i = 0; i < elems.size(); ++i) {
                if (i > 0) sb.append(", ");
                sb.append(elems.get(i));
            }
            sb.append(")");
            return sb.toString();
        }

        @Override public <T> T accept(Visitor<T> v) { return v.visit(this); }
    }

    public static final class Maybe extends Kind {
        public final Kind elem;

        private Maybe(Kind elem) {
            this.elem = elem;
        }

        @Override public String smtType() { return "(SBVMaybe " + elem.smtType() + ")"; }
        @Override public List<Kind> children() { return Collections.singletonList(elem); }
        @Override public boolean needsFlattening() { return true; }
        @Override public String toString() { return "Maybe " + elem; }
        @Override public <T> T accept(Visitor<T> v) { return v.visit(this); }
    }

    public static final class Either extends Kind {
        public final Kind left;
        public final Kind right;

        private Either(Kind left, Kind right) {
            this.left = left;
            this.right = right;
        }

        @Override public String smtType() { return "(SBVEither " + left.smtType() + " " + right.smtType() + ")"; }
        @Override public List<Kind> children() { return Arrays.asList(left, right); }
        @Override public boolean needsFlattening() { return true; }
        @Override public String toString() { return "Either " + left + " " + right; }
        @Override public <T> T accept(Visitor<T> v) { return v.visit(this); }
    }

    /**
     * An uninterpreted sort, or an enumeration when constructor names are given.
     */
    public static final class UserSort extends Kind {
        public final String name;
        public final List<String> constructors;

        private UserSort(String name, List<String> constructors) {
            this.name = name;
            this.constructors = constructors == null ? null : Collections.unmodifiableList(new Vector<String>(constructors));
        }

        public boolean isEnumeration() {
            return constructors != null;
        }

        @Override public String smtType() { return name; }
        @Override public String toString() { return name; }
        @Override public <T> T accept(Visitor<T> v) { return v.visit(this); }
    }

    public static abstract class Visitor<T> {
        public final T visitThis(Kind k) { return k.accept(this); }

        public abstract T visit(Bool k);
        public abstract T visit(Bounded k);
        public abstract T visit(Unbounded k);
        public abstract T visit(Real k);
        public abstract T visit(Float32 k);
        public abstract T visit(Float64 k);
        public abstract T visit(FloatingPoint k);
        public abstract T visit(Rational k);
        public abstract T visit(Char k);
        public abstract T visit(Str k);
        public abstract T visit(Seq k);
        public abstract T visit(SetOf k);
        public abstract T visit(Tuple k);
        public abstract T visit(Maybe k);
        public abstract T visit(Either k);
        public abstract T visit(UserSort k);
    }
}
