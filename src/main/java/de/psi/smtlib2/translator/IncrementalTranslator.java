package de.psi.smtlib2.translator;

import de.psi.smtlib2.ast.ArrayInfo;
import de.psi.smtlib2.ast.Assignment;
import de.psi.smtlib2.ast.CV;
import de.psi.smtlib2.ast.Constraint;
import de.psi.smtlib2.ast.Kind;
import de.psi.smtlib2.ast.NamedVar;
import de.psi.smtlib2.ast.ProblemDelta;
import de.psi.smtlib2.ast.SV;
import de.psi.smtlib2.ast.TableInfo;
import de.psi.smtlib2.ast.UninterpretedSymbol;
import de.psi.smtlib2.smt.SExpr;
import de.psi.smtlib2.smt.SmtScript;
import edu.mit.csail.sdg.alloy4.A4Reporter;
import edu.mit.csail.sdg.alloy4.Err;
import edu.mit.csail.sdg.alloy4.Pair;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.Vector;

/**
 * Lines that extend an open session. Only what is new is declared; nothing
 * is quantified, so every table is a constant table and every input a plain
 * constant.
 */
final class IncrementalTranslator {

	private final A4Reporter rep;
	private final ProblemDelta d;
	/** Naming without skolem functions or helper functions. */
	private final TranslationContext ctx;

	IncrementalTranslator(A4Reporter rep, ProblemDelta d) {
		this.rep = rep;
		this.d = d;
		this.ctx = new TranslationContext(d.config);
	}

	SmtScript script() throws Err {
		final SmtScript s = new SmtScript();

		final Map<SV, CV> allConsts = new LinkedHashMap<SV, CV>();
		for (Pair<SV, CV> c : d.allConstants)
			allConsts.put(c.a, c.b);
		final Set<SV> newConsts = new LinkedHashSet<SV>();
		for (Pair<SV, CV> c : d.newConstants)
			newConsts.add(c.a);

		List<ArrayDeclarations> arrays = new Vector<ArrayDeclarations>();
		for (ArrayInfo a : d.arrays)
			arrays.add(ArrayDeclarations.declare(ctx, false, allConsts, a));

		List<TableDeclarations.TableData> tables = new Vector<TableDeclarations.TableData>();
		for (TableInfo t : d.tables)
			tables.add(TableDeclarations.generate(ctx, "", newConsts, t));

		if (Features.needsFlattening(d.newKinds) && d.config.capabilities.flattenedModels != null)
			s.addAll(d.config.capabilities.flattenedModels);

		for (Kind k : d.newKinds)
			if (k.isUserSort())
				s.addAll(Declarations.declSort((Kind.UserSort) k));
		for (int arity : Features.tupleArities(d.newKinds))
			s.addAll(Declarations.declTuple(arity));
		if (Features.containsSum(d.newKinds)) s.addAll(Declarations.SUM);
		if (Features.containsMaybe(d.newKinds)) s.addAll(Declarations.MAYBE);
		if (Features.containsRationals(d.newKinds)) s.addAll(Declarations.RATIONALS);

		for (Pair<SV, CV> c : d.newConstants)
			s.addAll(Declarations.declConst(ctx, c.a, c.b));

		for (NamedVar in : d.inputs)
			s.addAll(Declarations.declareFun(in.sv, Collections.singletonList(in.sv.kind), null));

		for (ArrayDeclarations a : arrays)
			s.addAll(a.constants);

		for (UninterpretedSymbol ui : d.uninterpreteds)
			s.addAll(Declarations.declUI(ui));

		List<List<String>> tableSetups = new Vector<List<String>>();
		for (TableDeclarations.TableData t : tables) {
			final List<String> lines = TableDeclarations.constTable(t);
			// the declaration goes first, the initializers after the definitions they refer to
			s.add(lines.get(0));
			tableSetups.add(lines.subList(1, lines.size()));
		}

		for (Assignment a : d.program)
			s.addAll(Declarations.declDef(ctx, a));

		for (ArrayDeclarations a : arrays)
			s.addAll(a.delayeds);
		for (List<String> setup : tableSetups)
			s.addAll(setup);
		for (ArrayDeclarations a : arrays)
			s.addAll(a.setups);

		for (Constraint c : d.constraints) {
			final String lit = AssertionAssembler.addAnnotations(c.attributes, ctx.sv(c.literal));
			if (c.soft)
				s.add("(assert-soft " + lit + ")");
			else
				s.addConstraint(SExpr.sym(lit));
		}

		rep.debug("Incremental step: " + d.program.size() + " definitions, " + d.constraints.size() + " constraints\n");
		return s;
	}
}
