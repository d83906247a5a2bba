package de.psi.smtlib2.ast;

import de.psi.smtlib2.smt.RoundingMode;
import edu.mit.csail.sdg.alloy4.Err;
import edu.mit.csail.sdg.alloy4.ErrorFatal;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Vector;

/**
 * A concrete value together with its kind. Each subclass knows how to print
 * itself as an SMT-LIB literal.
 */
public abstract class CV {

    public final Kind kind;

    protected CV(Kind kind) {
        this.kind = kind;
    }

    public abstract String toSmtLib(RoundingMode rm);

    @Override
    public String toString() {
        return toSmtLib(RoundingMode.ROUND_NEAREST_TIES_TO_EVEN) + " :: " + kind;
    }

    public static CV bool(boolean b) {
        return new Int(Kind.BOOL, b ? BigInteger.ONE : BigInteger.ZERO);
    }

    public static CV integer(long i) {
        return new Int(Kind.UNBOUNDED, BigInteger.valueOf(i));
    }

    public static CV word(int width, long value) {
        return bounded(Kind.word(width), BigInteger.valueOf(value));
    }

    public static CV signed(int width, long value) {
        return bounded(Kind.signed(width), BigInteger.valueOf(value));
    }

    /** A bit-vector value, wrapped into the range of the given kind. */
    public static CV bounded(Kind kind, BigInteger value) {
        final Kind.Bounded b = (Kind.Bounded) kind;
        final BigInteger modulus = BigInteger.ONE.shiftLeft(b.width);
        BigInteger v = value.mod(modulus);
        if (b.signed && v.testBit(b.width - 1))
            v = v.subtract(modulus);
        return new Int(kind, v);
    }

    public static CV real(long numerator, long denominator) {
        return new Ratio(Kind.REAL, BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
    }

    public static CV rational(long numerator, long denominator) {
        return new Ratio(Kind.RATIONAL, BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
    }

    public static CV ofFloat(float f) {
        return new Floating(Kind.FLOAT, f);
    }

    public static CV ofDouble(double d) {
        return new Floating(Kind.DOUBLE, d);
    }

    /** An arbitrary-precision float given by its IEEE-754 bit pattern (sign, exponent, significand). */
    public static CV fpBits(int eb, int sb, BigInteger bits) {
        return new Bits(Kind.fp(eb, sb), bits);
    }

    public static CV character(char c) {
        return new Text(Kind.CHAR, String.valueOf(c));
    }

    public static CV string(String s) {
        return new Text(Kind.STRING, s);
    }

    public static CV list(Kind elemKind, CV... elems) {
        return new Elements(Kind.list(elemKind), Arrays.asList(elems), false);
    }

    public static CV set(Kind elemKind, CV... elems) {
        return new Elements(Kind.set(elemKind), Arrays.asList(elems), false);
    }

    /** The set of everything except the given elements. */
    public static CV complementSet(Kind elemKind, CV... elems) {
        return new Elements(Kind.set(elemKind), Arrays.asList(elems), true);
    }

    public static CV tuple(CV... elems) {
        List<Kind> ks = new Vector<Kind>();
        for (CV e : elems)
            ks.add(e.kind);
        return new Elements(Kind.tuple(ks), Arrays.asList(elems), false);
    }

    public static CV nothing(Kind elemKind) {
        return new Optional(Kind.maybe(elemKind), null);
    }

    public static CV just(CV value) {
        return new Optional(Kind.maybe(value.kind), value);
    }

    public static CV left(CV value, Kind rightKind) {
        return new Sum(Kind.either(value.kind, rightKind), false, value);
    }

    public static CV right(Kind leftKind, CV value) {
        return new Sum(Kind.either(leftKind, value.kind), true, value);
    }

    public static CV constructor(Kind userSort, String name) {
        return new Constructor(userSort, name);
    }

    public static CV roundingMode(RoundingMode rm) {
        return new Constructor(Kind.userSort(RoundingMode.SORT_NAME), rm.smtName());
    }

    /**
     * The given integer as a value of the given kind. Only numeric kinds
     * (and booleans, for 0 and 1) have such a value.
     */
    public static CV ofInteger(Kind kind, BigInteger i) throws Err {
        if (kind.isBoolean()) return new Int(kind, i.signum() == 0 ? BigInteger.ZERO : BigInteger.ONE);
        if (kind.isBounded()) return bounded(kind, i);
        if (kind.isUnbounded()) return new Int(kind, i);
        if (kind.isReal() || kind.isRational()) return new Ratio(kind, i, BigInteger.ONE);
        if (kind.isFloat() || kind.isDouble()) return new Floating(kind, i.doubleValue());
        throw new ErrorFatal("Cannot make an integer constant of kind " + kind);
    }

    public static CV ofInteger(Kind kind, long i) throws Err {
        return ofInteger(kind, BigInteger.valueOf(i));
    }

    static String showInteger(BigInteger i) {
        return i.signum() < 0 ? "(- " + i.negate() + ")" : i.toString();
    }

    private static String pad(String digits, int length) {
        StringBuilder sb = new StringBuilder();
        for (int i = digits.length(); i < length; ++i)
            sb.append('0');
        sb.append(digits);
        return sb.toString();
    }

    static String binary(BigInteger v, int width) {
        return "#b" + pad(v.toString(2), width);
    }

    static String hexOrBinary(BigInteger v, int width) {
        if (width % 4 == 0)
            return "#x" + pad(v.toString(16), width / 4);
        return binary(v, width);
    }

    /** SMT-LIB string literal; quotes are doubled, everything outside printable ASCII is escaped. */
    public static String quote(String s) {
        StringBuilder sb = new StringBuilder("\"");
        for (int i = 0; i < s.length(); ) {
            final int c = s.codePointAt(i);
            if (c == '"') {
                sb.append("\"\"");
            } else if (c >= 32 && c < 127 && c != '\\') {
                sb.appendCodePoint(c);
            } else {
                sb.append("\\u{");
                sb.append(Integer.toHexString(c));
                sb.append("}");
            }
            i += Character.charCount(c);
        }
        sb.append("\"");
        return sb.toString();
    }

    /** Booleans, bit vectors and unbounded integers. */
    public static final class Int extends CV {
        public final BigInteger value;

        Int(Kind kind, BigInteger value) {
            super(kind);
            this.value = value;
        }

        @Override
        public String toSmtLib(RoundingMode rm) {
            if (kind.isBoolean())
                return value.signum() == 0 ? "false" : "true";
            if (kind.isUnbounded())
                return showInteger(value);
            final Kind.Bounded b = (Kind.Bounded) kind;
            if (!b.signed || value.signum() >= 0)
                return hexOrBinary(value, b.width);
            if (value.equals(BigInteger.ONE.shiftLeft(b.width - 1).negate()))
                return binary(BigInteger.ONE.shiftLeft(b.width - 1), b.width);
            return "(bvneg " + hexOrBinary(value.negate(), b.width) + ")";
        }
    }

    /** Reals and (unreduced) rationals. */
    public static final class Ratio extends CV {
        public final BigInteger numerator;
        public final BigInteger denominator;

        Ratio(Kind kind, BigInteger numerator, BigInteger denominator) {
            super(kind);
            this.numerator = numerator;
            this.denominator = denominator;
        }

        @Override
        public String toSmtLib(RoundingMode rm) {
            if (kind.isRational())
                return "(SBV.Rational " + showInteger(numerator) + " " + showInteger(denominator) + ")";
            BigInteger n = numerator;
            BigInteger d = denominator;
            if (d.signum() < 0) {
                n = n.negate();
                d = d.negate();
            }
            final BigInteger g = n.gcd(d);
            if (g.signum() != 0 && !g.equals(BigInteger.ONE)) {
                n = n.divide(g);
                d = d.divide(g);
            }
            final String magnitude = d.equals(BigInteger.ONE)
                    ? n.abs() + ".0"
                    : "(/ " + n.abs() + ".0 " + d + ".0)";
            return n.signum() < 0 ? "(- " + magnitude + ")" : magnitude;
        }
    }

    /** Single and double precision floats. */
    public static final class Floating extends CV {
        public final double value;

        Floating(Kind kind, double value) {
            super(kind);
            this.value = value;
        }

        @Override
        public String toSmtLib(RoundingMode rm) {
            final String size = kind.isFloat() ? "8 24" : "11 53";
            if (Double.isNaN(value)) return "(_ NaN " + size + ")";
            if (Double.isInfinite(value)) return "(_ " + (value < 0 ? "-oo " : "+oo ") + size + ")";
            if (value == 0) {
                final boolean negative = Double.doubleToRawLongBits(value) < 0;
                return "(_ " + (negative ? "-zero " : "+zero ") + size + ")";
            }
            final BigDecimal exact = new BigDecimal(value);
            BigInteger n = exact.unscaledValue();
            BigInteger d = BigInteger.ONE;
            if (exact.scale() > 0)
                d = BigInteger.TEN.pow(exact.scale());
            else
                n = n.multiply(BigInteger.TEN.pow(-exact.scale()));
            final BigInteger g = n.gcd(d);
            n = n.divide(g);
            d = d.divide(g);
            return "((_ to_fp " + size + ") " + rm.smtName() + " (/ " + showInteger(n) + " " + d + "))";
        }
    }

    /** Arbitrary-precision floats, kept as raw bits. */
    public static final class Bits extends CV {
        public final BigInteger bits;

        Bits(Kind kind, BigInteger bits) {
            super(kind);
            this.bits = bits;
        }

        @Override
        public String toSmtLib(RoundingMode rm) {
            final Kind.FloatingPoint fp = (Kind.FloatingPoint) kind;
            final int mantissa = fp.sb - 1;
            final BigInteger m = bits.and(BigInteger.ONE.shiftLeft(mantissa).subtract(BigInteger.ONE));
            final BigInteger e = bits.shiftRight(mantissa).and(BigInteger.ONE.shiftLeft(fp.eb).subtract(BigInteger.ONE));
            final BigInteger s = bits.testBit(mantissa + fp.eb) ? BigInteger.ONE : BigInteger.ZERO;
            return "(fp " + binary(s, 1) + " " + binary(e, fp.eb) + " " + binary(m, mantissa) + ")";
        }
    }

    /** Characters and strings. */
    public static final class Text extends CV {
        public final String value;

        Text(Kind kind, String value) {
            super(kind);
            this.value = value;
        }

        @Override
        public String toSmtLib(RoundingMode rm) {
            return quote(value);
        }
    }

    /** Lists, sets and tuples. */
    public static final class Elements extends CV {
        public final List<CV> elems;
        public final boolean complement;

        Elements(Kind kind, List<CV> elems, boolean complement) {
            super(kind);
            this.elems = Collections.unmodifiableList(new Vector<CV>(elems));
            this.complement = complement;
        }

        @Override
        public String toSmtLib(RoundingMode rm) {
            if (kind.isList()) {
                if (elems.isEmpty())
                    return "(as seq.empty " + kind.smtType() + ")";
                if (elems.size() == 1)
                    return "(seq.unit " + elems.get(0).toSmtLib(rm) + ")";
                StringBuilder sb = new StringBuilder("(seq.++");
                for (CV e : elems) {
                    sb.append(" (seq.unit ");
                    sb.append(e.toSmtLib(rm));
                    sb.append(")");
                }
                sb.append(")");
                return sb.toString();
            }
            if (kind.isSet()) {
                String acc = "((as const " + kind.smtType() + ") " + complement + ")";
                for (CV e : elems)
                    acc = "(store " + acc + " " + e.toSmtLib(rm) + " " + !complement + ")";
                return acc;
            }
            if (elems.isEmpty())
                return "mkSBVTuple0";
            StringBuilder sb = new StringBuilder("((as mkSBVTuple" + elems.size() + " " + kind.smtType() + ")");
            for (CV e : elems) {
                sb.append(" ");
                sb.append(e.toSmtLib(rm));
            }
            sb.append(")");
            return sb.toString();
        }
    }

    public static final class Optional extends CV {
        public final CV value;

        Optional(Kind kind, CV value) {
            super(kind);
            this.value = value;
        }

        @Override
        public String toSmtLib(RoundingMode rm) {
            if (value == null)
                return "(as nothing_SBVMaybe " + kind.smtType() + ")";
            return "((as just_SBVMaybe " + kind.smtType() + ") " + value.toSmtLib(rm) + ")";
        }
    }

    public static final class Sum extends CV {
        public final boolean isRight;
        public final CV value;

        Sum(Kind kind, boolean isRight, CV value) {
            super(kind);
            this.isRight = isRight;
            this.value = value;
        }

        @Override
        public String toSmtLib(RoundingMode rm) {
            final String c = isRight ? "right_SBVEither" : "left_SBVEither";
            return "((as " + c + " " + kind.smtType() + ") " + value.toSmtLib(rm) + ")";
        }
    }

    /** A constructor of an enumerated user sort. */
    public static final class Constructor extends CV {
        public final String name;

        Constructor(Kind kind, String name) {
            super(kind);
            this.name = name;
        }

        @Override
        public String toSmtLib(RoundingMode rm) {
            return name;
        }
    }
}
