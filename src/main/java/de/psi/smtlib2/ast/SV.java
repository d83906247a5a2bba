package de.psi.smtlib2.ast;

/**
 * Reference to a node of the operation graph. Node ids are handed out in
 * creation order, so comparing ids compares positions in the topological
 * order.
 */
public final class SV implements Comparable<SV> {

    public static final SV FALSE = new SV(Kind.BOOL, -2);
    public static final SV TRUE = new SV(Kind.BOOL, -1);

    public final Kind kind;
    public final int id;

    public SV(Kind kind, int id) {
        this.kind = kind;
        this.id = id;
    }

    public boolean hasSign() {
        return kind.hasSign();
    }

    public boolean isTrueOrFalse() {
        return id == TRUE.id || id == FALSE.id;
    }

    @Override
    public int compareTo(SV other) {
        return id < other.id ? -1 : (id == other.id ? 0 : 1);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SV && ((SV) o).id == id;
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public String toString() {
        return "s" + id;
    }
}
