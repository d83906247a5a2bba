package de.psi.smtlib2.smt;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class SmtConfigTest {

    @Test
    public void defaults() {
        SmtConfig c = new SmtConfig();
        assertSame(RoundingMode.ROUND_NEAREST_TIES_TO_EVEN, c.roundingMode);
        assertTrue(c.solverOptions.isEmpty());
        assertEquals("Z3", c.capabilities.name);
        assertSame(QueryContext.INTERNAL, c.queryContext);
    }

    @Test
    public void cloneIsDeep() {
        SmtConfig c = new SmtConfig();
        SmtConfig d = c.clone();
        d.capabilities.supportsDistinct = false;
        d.solverOptions.add(SolverOption.randomSeed(7));
        assertTrue(c.capabilities.supportsDistinct);
        assertTrue(c.solverOptions.isEmpty());
        assertEquals(1, d.solverOptions.size());
    }

    @Test
    public void presets() {
        assertNotNull(SolverCapabilities.z3().flattenedModels);
        assertNull(SolverCapabilities.cvc4().flattenedModels);
        assertTrue(SolverCapabilities.cvc4().supportsDirectAccessors);
        assertFalse(SolverCapabilities.boolector().supportsDataTypes);
        assertFalse(SolverCapabilities.abc().supportsDefineFun);
    }

    @Test
    public void optionRendering() {
        assertEquals("(set-logic QF_BV)", SolverOption.setLogic(Logic.QF_BV).toSmtLib());
        assertEquals("(set-option :random-seed 42)", SolverOption.randomSeed(42).toSmtLib());
        assertEquals("(set-option :produce-unsat-cores true)", SolverOption.produceUnsatCores(true).toSmtLib());
        assertEquals("(set-option :diagnostic-output-channel \"log.txt\")",
                SolverOption.diagnosticOutputChannel("log.txt").toSmtLib());
        assertEquals("(set-info :status sat)", SolverOption.setInfo(":status", "sat").toSmtLib());
        assertEquals("(set-option :smt.mbqi false)", SolverOption.keyword(":smt.mbqi", "false").toSmtLib());
    }

    @Test
    public void produceFlags() {
        assertEquals("(set-option :produce-assertions true)", SolverOption.produceAssertions(true).toSmtLib());
        assertEquals("(set-option :produce-assignments false)", SolverOption.produceAssignments(false).toSmtLib());
        assertEquals("(set-option :produce-proofs true)", SolverOption.produceProofs(true).toSmtLib());
        assertEquals("(set-option :produce-interpolants true)", SolverOption.produceInterpolants(true).toSmtLib());
        assertEquals("(set-option :produce-unsat-assumptions false)",
                SolverOption.produceUnsatAssumptions(false).toSmtLib());
        assertEquals("(set-option :reproducible-resource-limit 1000)",
                SolverOption.reproducibleResourceLimit(1000).toSmtLib());
        assertEquals("(set-option :verbosity 2)", SolverOption.verbosity(2).toSmtLib());
    }

    @Test
    public void roundingModeNames() {
        assertEquals("roundNearestTiesToEven", RoundingMode.ROUND_NEAREST_TIES_TO_EVEN.toString());
        assertEquals("roundTowardZero", RoundingMode.ROUND_TOWARD_ZERO.smtName());
    }
}
