package de.psi.smtlib2.translator;

import de.psi.smtlib2.ast.CV;
import de.psi.smtlib2.ast.Kind;
import de.psi.smtlib2.ast.ProblemBuilder;
import de.psi.smtlib2.ast.SV;
import de.psi.smtlib2.smt.Logic;
import de.psi.smtlib2.smt.QueryContext;
import de.psi.smtlib2.smt.SolverCapabilities;
import de.psi.smtlib2.smt.SolverOption;
import edu.mit.csail.sdg.alloy4.A4Reporter;
import edu.mit.csail.sdg.alloy4.Err;
import edu.mit.csail.sdg.alloy4.ErrorAPI;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class LogicSelectorTest {

    private ProblemBuilder b;

    @Before
    public void setUp() {
        b = new ProblemBuilder();
    }

    private String logic() throws Err {
        final List<String> lines = LogicSelector.logic(A4Reporter.NOP, new Features(b.build(SV.TRUE, true)), b.config);
        assertEquals(1, lines.size());
        return lines.get(0);
    }

    @Test
    public void quantifierFreeBitVectors() throws Err {
        b.input(Kind.word(8), "x");
        assertEquals("(set-logic QF_BV)", logic());
    }

    @Test
    public void quantifiedBitVectors() throws Err {
        b.forall(Kind.word(8), "x");
        assertEquals("(set-logic BV)", logic());
    }

    @Test
    public void axiomsDropTheQuantifierFreePrefix() throws Err {
        b.input(Kind.word(8), "x");
        b.axiom("ax", "(assert true)");
        assertEquals("(set-logic BV)", logic());
    }

    @Test
    public void arraysAndTables() throws Err {
        final SV c = b.constant(CV.word(8, 1));
        b.newArray("a", Kind.word(8), Kind.word(8), null);
        assertEquals("(set-logic QF_ABV)", logic());
        b.table(Kind.word(8), Kind.word(8), c);
        assertEquals("(set-logic QF_AUFBV)", logic());
    }

    @Test
    public void uninterpretedFunctions() throws Err {
        final SV x = b.input(Kind.word(8), "x");
        b.uninterpreted("f", Kind.word(8), x);
        assertEquals("(set-logic QF_UFBV)", logic());
    }

    @Test
    public void catchAll() throws Err {
        b.input(Kind.UNBOUNDED, "n");
        assertEquals("(set-logic ALL) ; has unbounded values, using catch-all.", logic());
    }

    @Test
    public void catchAllForStrings() throws Err {
        b.input(Kind.STRING, "s");
        assertEquals("(set-logic ALL) ; has strings, using catch-all.", logic());
    }

    @Test
    public void floats() throws Err {
        b.input(Kind.FLOAT, "f");
        assertEquals("(set-logic QF_FP)", logic());
        b.input(Kind.word(8), "x");
        assertEquals("(set-logic QF_FPBV)", logic());
        b.forall(Kind.DOUBLE, "d");
        assertEquals("(set-logic ALL)", logic());
    }

    @Test
    public void externalQueries() throws Err {
        b.input(Kind.word(8), "x");
        b.config.queryContext = QueryContext.EXTERNAL;
        assertEquals("(set-logic ALL) ; external query, using all logics.", logic());
    }

    @Test
    public void userOverride() throws Err {
        b.input(Kind.UNBOUNDED, "n");
        b.config.solverOptions.add(SolverOption.setLogic(Logic.QF_NIA));
        assertEquals("(set-logic QF_NIA) ; NB. User specified.", logic());
    }

    @Test
    public void userOverrideNone() throws Err {
        b.config.solverOptions.add(SolverOption.setLogic(Logic.NONE));
        assertEquals("; NB. Not setting the logic per user request of Logic_NONE", logic());
    }

    @Test
    public void overrideWinsOverMissingCapabilities() throws Err {
        b.input(Kind.tuple(Kind.BOOL, Kind.BOOL), "t");
        b.config.capabilities = SolverCapabilities.boolector();
        b.config.solverOptions.add(SolverOption.setLogic(Logic.ALL));
        assertEquals("(set-logic ALL) ; NB. User specified.", logic());
    }

    @Test
    public void onlyOneOverride() throws Err {
        b.config.solverOptions.add(SolverOption.setLogic(Logic.QF_BV));
        b.config.solverOptions.add(SolverOption.setLogic(Logic.QF_LIA));
        try {
            logic();
            fail("two logics were requested");
        } catch (ErrorAPI ex) {
            assertTrue(ex.getMessage().contains("found: 2"));
            assertTrue(ex.getMessage().contains("QF_BV QF_LIA"));
        }
    }

    @Test
    public void missingCapabilitiesAreAllReported() throws Err {
        b.input(Kind.tuple(Kind.BOOL, Kind.BOOL), "t");
        b.input(Kind.set(Kind.word(8)), "s");
        b.config.capabilities = SolverCapabilities.boolector();
        try {
            logic();
            fail("boolector has neither data types nor sets");
        } catch (ErrorAPI ex) {
            final String msg = ex.getMessage();
            assertTrue(msg.contains("Given problem requires support for data types"));
            assertTrue(msg.contains("Given problem requires support for set operations"));
            assertTrue(msg.contains("(\"Boolector\")"));
        }
    }

    @Test
    public void addingFeaturesOnlyWidensTheLogic() throws Err {
        b.input(Kind.word(8), "x");
        assertEquals("(set-logic QF_BV)", logic());
        b.constant(CV.rational(1, 2));
        assertEquals("(set-logic ALL) ; has rational values, using catch-all.", logic());
    }

    @Test
    public void settingsOrder() throws Err {
        b.input(Kind.word(8), "x");
        b.config.solverOptions.add(SolverOption.diagnosticOutputChannel("a.log"));
        b.config.solverOptions.add(SolverOption.randomSeed(1));
        b.config.solverOptions.add(SolverOption.setLogic(Logic.QF_BV));
        b.config.solverOptions.add(SolverOption.diagnosticOutputChannel("b.log"));
        final List<String> settings = LogicSelector.settings(A4Reporter.NOP, new Features(b.build(SV.TRUE, true)), b.config);
        assertEquals(Arrays.asList(
                "(set-option :random-seed 1)",
                "(set-option :diagnostic-output-channel \"b.log\")",
                "(set-option :produce-models true)",
                "(set-logic QF_BV) ; NB. User specified."), settings);
    }

    @Test
    public void flattenedModels() {
        assertEquals(4, LogicSelector.modelSettings(true, SolverCapabilities.z3()).size());
        assertEquals(1, LogicSelector.modelSettings(false, SolverCapabilities.z3()).size());
        assertEquals(Arrays.asList("(set-option :produce-models true)"),
                LogicSelector.modelSettings(true, SolverCapabilities.cvc4()));
    }
}
