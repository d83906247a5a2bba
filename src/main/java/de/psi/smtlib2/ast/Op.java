package de.psi.smtlib2.ast;

import edu.mit.csail.sdg.alloy4.Err;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Vector;

/**
 * Operator tag of an operation node. Operands live in {@link Operation};
 * parameters that are not symbolic values (widths, indices, table ids, ...)
 * live in the operator itself.
 */
public abstract class Op {

    public abstract <T> T accept(Visitor<T> visitor) throws Err;

    /** Operators whose encoding depends on the kind of their operands. */
    public enum Operator {
        PLUS, TIMES, MINUS, UNEG, ABS, QUOT, REM,
        EQUAL, NOT_EQUAL, LESS_THAN, GREATER_THAN, LESS_EQ, GREATER_EQ,
        ITE, AND, OR, XOR, NOT, SHL, SHR, JOIN
    }

    public enum FPOperation {
        ABS("fp.abs"), NEG("fp.neg"), ADD("fp.add"), SUB("fp.sub"), MUL("fp.mul"), DIV("fp.div"),
        FMA("fp.fma"), SQRT("fp.sqrt"), REM("fp.rem"), ROUND_TO_INTEGRAL("fp.roundToIntegral"),
        MIN("fp.min"), MAX("fp.max"), OBJECT_EQUAL("="),
        IS_NORMAL("fp.isNormal"), IS_SUBNORMAL("fp.isSubnormal"), IS_ZERO("fp.isZero"),
        IS_INFINITE("fp.isInfinite"), IS_NAN("fp.isNaN"), IS_NEGATIVE("fp.isNegative"), IS_POSITIVE("fp.isPositive");

        public final String smtName;

        FPOperation(String smtName) {
            this.smtName = smtName;
        }
    }

    public enum NonLinearFunction {
        SIN("sin"), COS("cos"), TAN("tan"), ASIN("asin"), ACOS("acos"), ATAN("atan"), SQRT("sqrt"),
        SINH("sinh"), COSH("cosh"), TANH("tanh"), EXP("exp"), LOG("log"), POW("pow");

        public final String smtName;

        NonLinearFunction(String smtName) {
            this.smtName = smtName;
        }
    }

    public enum PBKind {
        AT_MOST, AT_LEAST, EXACTLY, LE, GE, EQ
    }

    /** Native checks report "no overflow"; the node itself means "overflows". */
    public enum OverflowCheck {
        UMUL_OVFL("bvumul_noovfl"), SMUL_OVFL("bvsmul_noovfl"), SMUL_UDFL("bvsmul_noudfl");

        public final String smtName;

        OverflowCheck(String smtName) {
            this.smtName = smtName;
        }
    }

    public enum StringOperation {
        CONCAT("str.++"), LEN("str.len"), UNIT(null), NTH("str.at"), SUBSTR("str.substr"),
        INDEX_OF("str.indexof"), CONTAINS("str.contains"), PREFIX_OF("str.prefixof"),
        SUFFIX_OF("str.suffixof"), REPLACE("str.replace"), TO_INT("str.to_int"),
        FROM_INT("str.from_int"), TO_CODE("str.to_code"), FROM_CODE("str.from_code");

        public final String smtName;

        StringOperation(String smtName) {
            this.smtName = smtName;
        }
    }

    public enum SequenceOperation {
        CONCAT("seq.++"), LEN("seq.len"), UNIT("seq.unit"), NTH("seq.nth"), EXTRACT("seq.extract"),
        INDEX_OF("seq.indexof"), CONTAINS("seq.contains"), PREFIX_OF("seq.prefixof"),
        SUFFIX_OF("seq.suffixof"), REPLACE("seq.replace");

        public final String smtName;

        SequenceOperation(String smtName) {
            this.smtName = smtName;
        }
    }

    public enum SetOperation {
        EQUAL, MEMBER, INSERT, DELETE, INTERSECT, UNION, SUBSET, DIFFERENCE, COMPLEMENT, HAS_SIZE
    }

    public static final class Basic extends Op {
        public final Operator op;

        public Basic(Operator op) {
            this.op = op;
        }

        @Override public <T> T accept(Visitor<T> v) throws Err { return v.visit(this); }
        @Override public String toString() { return op.toString(); }
    }

    public static final class Extract extends Op {
        public final int hi;
        public final int lo;

        public Extract(int hi, int lo) {
            this.hi = hi;
            this.lo = lo;
        }

        @Override public <T> T accept(Visitor<T> v) throws Err { return v.visit(this); }
        @Override public String toString() { return "Extract " + hi + " " + lo; }
    }

    public static final class Rotate extends Op {
        public final boolean left;
        public final int amount;

        public Rotate(boolean left, int amount) {
            this.left = left;
            this.amount = amount;
        }

        @Override public <T> T accept(Visitor<T> v) throws Err { return v.visit(this); }
        @Override public String toString() { return (left ? "Rol " : "Ror ") + amount; }
    }

    public static final class KindCast extends Op {
        public final Kind from;
        public final Kind to;

        public KindCast(Kind from, Kind to) {
            this.from = from;
            this.to = to;
        }

        @Override public <T> T accept(Visitor<T> v) throws Err { return v.visit(this); }
        @Override public String toString() { return "KindCast " + from + " " + to; }
    }

    public static final class Uninterpreted extends Op {
        public final String name;

        public Uninterpreted(String name) {
            this.name = name;
        }

        @Override public <T> T accept(Visitor<T> v) throws Err { return v.visit(this); }
        @Override public String toString() { return "Uninterpreted " + name; }
    }

    /** Identity with a comment attached; the comment ends up next to the definition. */
    public static final class Label extends Op {
        public final String comment;

        public Label(String comment) {
            this.comment = comment;
        }

        @Override public <T> T accept(Visitor<T> v) throws Err { return v.visit(this); }
        @Override public String toString() { return "Label " + comment; }
    }

    /** Lookup into table {@code table}; out-of-range indices yield {@code dflt}. */
    public static final class LookUp extends Op {
        public final int table;
        public final Kind indexKind;
        public final Kind resultKind;
        public final int length;
        public final SV index;
        public final SV dflt;

        public LookUp(int table, Kind indexKind, Kind resultKind, int length, SV index, SV dflt) {
            this.table = table;
            this.indexKind = indexKind;
            this.resultKind = resultKind;
            this.length = length;
            this.index = index;
            this.dflt = dflt;
        }

        @Override public <T> T accept(Visitor<T> v) throws Err { return v.visit(this); }
        @Override public String toString() { return "LkUp table" + table + " " + index + " " + dflt; }
    }

    public static final class ArrayEq extends Op {
        public final int left;
        public final int right;

        public ArrayEq(int left, int right) {
            this.left = left;
            this.right = right;
        }

        @Override public <T> T accept(Visitor<T> v) throws Err { return v.visit(this); }
        @Override public String toString() { return "ArrEq " + left + " " + right; }
    }

    public static final class ArrayRead extends Op {
        public final int array;

        public ArrayRead(int array) {
            this.array = array;
        }

        @Override public <T> T accept(Visitor<T> v) throws Err { return v.visit(this); }
        @Override public String toString() { return "ArrRead " + array; }
    }

    public static final class FloatOp extends Op {
        public final FPOperation op;

        public FloatOp(FPOperation op) {
            this.op = op;
        }

        @Override public <T> T accept(Visitor<T> v) throws Err { return v.visit(this); }
        @Override public String toString() { return op.smtName; }
    }

    /** Floating-point conversion with a symbolic rounding mode. */
    public static final class FPCast extends Op {
        public final Kind from;
        public final Kind to;
        public final SV roundingMode;

        public FPCast(Kind from, Kind to, SV roundingMode) {
            this.from = from;
            this.to = to;
            this.roundingMode = roundingMode;
        }

        @Override public <T> T accept(Visitor<T> v) throws Err { return v.visit(this); }
        @Override public String toString() { return "FPCast " + from + " " + to + " " + roundingMode; }
    }

    public static final class NonLinear extends Op {
        public final NonLinearFunction function;

        public NonLinear(NonLinearFunction function) {
            this.function = function;
        }

        @Override public <T> T accept(Visitor<T> v) throws Err { return v.visit(this); }
        @Override public String toString() { return function.smtName; }
    }

    public static final class PseudoBoolean extends Op {
        public final PBKind kind;
        /** Per-operand weights; empty for the unweighted forms. */
        public final List<Integer> coefficients;
        public final int bound;

        public PseudoBoolean(PBKind kind, int bound, Integer... coefficients) {
            this.kind = kind;
            this.bound = bound;
            this.coefficients = Collections.unmodifiableList(new Vector<Integer>(Arrays.asList(coefficients)));
        }

        @Override public <T> T accept(Visitor<T> v) throws Err { return v.visit(this); }
        @Override public String toString() { return "PB " + kind + " " + coefficients + " " + bound; }
    }

    public static final class Overflow extends Op {
        public final OverflowCheck check;

        public Overflow(OverflowCheck check) {
            this.check = check;
        }

        @Override public <T> T accept(Visitor<T> v) throws Err { return v.visit(this); }
        @Override public String toString() { return check.smtName; }
    }

    public static final class StringOp extends Op {
        public final StringOperation op;

        public StringOp(StringOperation op) {
            this.op = op;
        }

        @Override public <T> T accept(Visitor<T> v) throws Err { return v.visit(this); }
        @Override public String toString() { return "StrOp " + op; }
    }

    public static final class StrInRe extends Op {
        public final RegExp regExp;

        public StrInRe(RegExp regExp) {
            this.regExp = regExp;
        }

        @Override public <T> T accept(Visitor<T> v) throws Err { return v.visit(this); }
        @Override public String toString() { return "StrInRe " + regExp; }
    }

    public static final class RegExCompare extends Op {
        public final boolean equal;
        public final RegExp left;
        public final RegExp right;

        public RegExCompare(boolean equal, RegExp left, RegExp right) {
            this.equal = equal;
            this.left = left;
            this.right = right;
        }

        @Override public <T> T accept(Visitor<T> v) throws Err { return v.visit(this); }
        @Override public String toString() { return (equal ? "RegExEq " : "RegExNEq ") + left + " " + right; }
    }

    public static final class SeqOp extends Op {
        public final SequenceOperation op;

        public SeqOp(SequenceOperation op) {
            this.op = op;
        }

        @Override public <T> T accept(Visitor<T> v) throws Err { return v.visit(this); }
        @Override public String toString() { return "SeqOp " + op; }
    }

    /** Reversal of a string or a list; translated through a generated recursive function. */
    public static final class SeqReverse extends Op {
        public final Kind kind;

        public SeqReverse(Kind kind) {
            this.kind = kind;
        }

        @Override public <T> T accept(Visitor<T> v) throws Err { return v.visit(this); }
        @Override public String toString() { return "Reverse " + kind; }

        @Override
        public boolean equals(Object o) {
            return o instanceof SeqReverse && ((SeqReverse) o).kind.equals(kind);
        }

        @Override
        public int hashCode() {
            return kind.hashCode();
        }
    }

    public static final class SetOp extends Op {
        public final SetOperation op;

        public SetOp(SetOperation op) {
            this.op = op;
        }

        @Override public <T> T accept(Visitor<T> v) throws Err { return v.visit(this); }
        @Override public String toString() { return "SetOp " + op; }
    }

    public static final class TupleConstructor extends Op {
        public final int arity;

        public TupleConstructor(int arity) {
            this.arity = arity;
        }

        @Override public <T> T accept(Visitor<T> v) throws Err { return v.visit(this); }
        @Override public String toString() { return "TupleConstructor " + arity; }
    }

    /** Projection of the 1-based {@code index}-th component. */
    public static final class TupleAccess extends Op {
        public final int index;
        public final int arity;

        public TupleAccess(int index, int arity) {
            this.index = index;
            this.arity = arity;
        }

        @Override public <T> T accept(Visitor<T> v) throws Err { return v.visit(this); }
        @Override public String toString() { return "TupleAccess " + index + " " + arity; }
    }

    public static final class EitherConstructor extends Op {
        public final Kind left;
        public final Kind right;
        public final boolean isRight;

        public EitherConstructor(Kind left, Kind right, boolean isRight) {
            this.left = left;
            this.right = right;
            this.isRight = isRight;
        }

        @Override public <T> T accept(Visitor<T> v) throws Err { return v.visit(this); }
        @Override public String toString() { return "EitherConstructor " + left + " " + right + " " + isRight; }
    }

    public static final class EitherIs extends Op {
        public final Kind left;
        public final Kind right;
        public final boolean isRight;

        public EitherIs(Kind left, Kind right, boolean isRight) {
            this.left = left;
            this.right = right;
            this.isRight = isRight;
        }

        @Override public <T> T accept(Visitor<T> v) throws Err { return v.visit(this); }
        @Override public String toString() { return "EitherIs " + left + " " + right + " " + isRight; }
    }

    public static final class EitherAccess extends Op {
        public final boolean isRight;

        public EitherAccess(boolean isRight) {
            this.isRight = isRight;
        }

        @Override public <T> T accept(Visitor<T> v) throws Err { return v.visit(this); }
        @Override public String toString() { return "EitherAccess " + isRight; }
    }

    public static final class MaybeConstructor extends Op {
        public final Kind elem;
        public final boolean isJust;

        public MaybeConstructor(Kind elem, boolean isJust) {
            this.elem = elem;
            this.isJust = isJust;
        }

        @Override public <T> T accept(Visitor<T> v) throws Err { return v.visit(this); }
        @Override public String toString() { return "MaybeConstructor " + elem + " " + isJust; }
    }

    public static final class MaybeIs extends Op {
        public final Kind elem;
        public final boolean isJust;

        public MaybeIs(Kind elem, boolean isJust) {
            this.elem = elem;
            this.isJust = isJust;
        }

        @Override public <T> T accept(Visitor<T> v) throws Err { return v.visit(this); }
        @Override public String toString() { return "MaybeIs " + elem + " " + isJust; }
    }

    public static final class MaybeAccess extends Op {
        @Override public <T> T accept(Visitor<T> v) throws Err { return v.visit(this); }
        @Override public String toString() { return "MaybeAccess"; }
    }

    public static final class RationalConstructor extends Op {
        @Override public <T> T accept(Visitor<T> v) throws Err { return v.visit(this); }
        @Override public String toString() { return "RationalConstructor"; }
    }

    public static abstract class Visitor<T> {
        public final T visitThis(Op op) throws Err { return op.accept(this); }

        public abstract T visit(Basic op) throws Err;
        public abstract T visit(Extract op) throws Err;
        public abstract T visit(Rotate op) throws Err;
        public abstract T visit(KindCast op) throws Err;
        public abstract T visit(Uninterpreted op) throws Err;
        public abstract T visit(Label op) throws Err;
        public abstract T visit(LookUp op) throws Err;
        public abstract T visit(ArrayEq op) throws Err;
        public abstract T visit(ArrayRead op) throws Err;
        public abstract T visit(FloatOp op) throws Err;
        public abstract T visit(FPCast op) throws Err;
        public abstract T visit(NonLinear op) throws Err;
        public abstract T visit(PseudoBoolean op) throws Err;
        public abstract T visit(Overflow op) throws Err;
        public abstract T visit(StringOp op) throws Err;
        public abstract T visit(StrInRe op) throws Err;
        public abstract T visit(RegExCompare op) throws Err;
        public abstract T visit(SeqOp op) throws Err;
        public abstract T visit(SeqReverse op) throws Err;
        public abstract T visit(SetOp op) throws Err;
        public abstract T visit(TupleConstructor op) throws Err;
        public abstract T visit(TupleAccess op) throws Err;
        public abstract T visit(EitherConstructor op) throws Err;
        public abstract T visit(EitherIs op) throws Err;
        public abstract T visit(EitherAccess op) throws Err;
        public abstract T visit(MaybeConstructor op) throws Err;
        public abstract T visit(MaybeIs op) throws Err;
        public abstract T visit(MaybeAccess op) throws Err;
        public abstract T visit(RationalConstructor op) throws Err;
    }
}
