package de.psi.smtlib2.ast;

import edu.mit.csail.sdg.alloy4.ConstList;

/**
 * A memoized lookup table. Element {@code k} is the value at index {@code k}.
 */
public final class TableInfo {
    public final int id;
    public final Kind argKind;
    public final Kind resultKind;
    public final ConstList<SV> elems;

    public TableInfo(int id, Kind argKind, Kind resultKind, ConstList<SV> elems) {
        this.id = id;
        this.argKind = argKind;
        this.resultKind = resultKind;
        this.elems = elems;
    }

    @Override
    public String toString() {
        return "table" + id + " :: " + argKind + " -> " + resultKind + " " + elems;
    }
}
