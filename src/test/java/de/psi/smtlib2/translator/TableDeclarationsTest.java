package de.psi.smtlib2.translator;

import de.psi.smtlib2.ast.Kind;
import de.psi.smtlib2.ast.SV;
import de.psi.smtlib2.ast.TableInfo;
import de.psi.smtlib2.smt.SmtConfig;
import edu.mit.csail.sdg.alloy4.ConstList;
import edu.mit.csail.sdg.alloy4.Err;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class TableDeclarationsTest {

    private static final TranslationContext CTX = new TranslationContext(new SmtConfig());
    private static final Kind W8 = Kind.word(8);

    private static TableInfo table(SV... elems) {
        return new TableInfo(0, W8, W8, ConstList.make(Arrays.asList(elems)));
    }

    @Test
    public void constantTable() throws Err {
        final SV c0 = new SV(W8, 1), c1 = new SV(W8, 2);
        final Set<SV> consts = new HashSet<SV>(Arrays.asList(c0, c1));
        final TableDeclarations.TableData d = TableDeclarations.generate(CTX, "", consts, table(c0, c1));
        assertTrue(d.constant);
        assertEquals(Arrays.asList(
                "(declare-fun table0 ((_ BitVec 8)) (_ BitVec 8))",
                "(define-fun table0_initializer_0 () Bool (= (table0 #x00) s1))",
                "(define-fun table0_initializer_1 () Bool (= (table0 #x01) s2))",
                "(define-fun table0_initializer () Bool (and table0_initializer_0 table0_initializer_1))",
                "(assert table0_initializer)"), TableDeclarations.constTable(d));
    }

    @Test
    public void symbolicElementsComeLast() throws Err {
        final SV x = new SV(W8, 0), c = new SV(W8, 1);
        final Set<SV> consts = Collections.singleton(c);
        final TableDeclarations.TableData d = TableDeclarations.generate(CTX, " s0", consts, table(x, c));
        assertFalse(d.constant);
        assertEquals(Arrays.asList("(= (table0 s0 #x01) s1)", "(= (table0 s0 #x00) s0)"), d.equalities);
        assertEquals("(declare-fun table0 ((_ BitVec 8) (_ BitVec 8)) (_ BitVec 8))",
                TableDeclarations.skolemTable("(_ BitVec 8)", d));
    }

    @Test
    public void setups() {
        assertEquals(Collections.singletonList("(define-fun t_initializer () Bool true) ; no initialization needed"),
                TableDeclarations.setup("t_initializer", 0, true));
        assertTrue(TableDeclarations.setup("t_initializer", 0, false).isEmpty());
        assertEquals(Arrays.asList("(define-fun t_initializer () Bool t_initializer_0)", "(assert t_initializer)"),
                TableDeclarations.setup("t_initializer", 1, false));
    }
}
