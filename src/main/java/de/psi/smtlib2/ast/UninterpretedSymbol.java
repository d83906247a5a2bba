package de.psi.smtlib2.ast;

import edu.mit.csail.sdg.alloy4.ConstList;

/**
 * An uninterpreted constant or function. The last kind of the signature is
 * the result; the others are the arguments.
 */
public final class UninterpretedSymbol {
    public final String name;
    public final ConstList<Kind> signature;

    public UninterpretedSymbol(String name, ConstList<Kind> signature) {
        this.name = name;
        this.signature = signature;
    }

    public Kind result() {
        return signature.get(signature.size() - 1);
    }

    public int arity() {
        return signature.size() - 1;
    }

    @Override
    public String toString() {
        return name + " :: " + signature;
    }
}
