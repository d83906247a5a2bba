package de.psi.smtlib2.translator;

import de.psi.smtlib2.ast.ArrayInfo;
import de.psi.smtlib2.ast.Assignment;
import de.psi.smtlib2.ast.Axiom;
import de.psi.smtlib2.ast.CV;
import de.psi.smtlib2.ast.Kind;
import de.psi.smtlib2.ast.NamedVar;
import de.psi.smtlib2.ast.Op;
import de.psi.smtlib2.ast.Problem;
import de.psi.smtlib2.ast.ProblemDelta;
import de.psi.smtlib2.ast.SV;
import de.psi.smtlib2.ast.SkolemInput;
import de.psi.smtlib2.ast.TableInfo;
import de.psi.smtlib2.ast.UninterpretedSymbol;
import de.psi.smtlib2.smt.SExpr;
import de.psi.smtlib2.smt.SmtScript;
import edu.mit.csail.sdg.alloy4.A4Reporter;
import edu.mit.csail.sdg.alloy4.ConstList;
import edu.mit.csail.sdg.alloy4.Err;
import edu.mit.csail.sdg.alloy4.ErrorFatal;
import edu.mit.csail.sdg.alloy4.Pair;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Vector;

/**
 * Translates a problem into an SMT-LIB 2 script.
 * <p>
 * Without universals the script is a flat list of declarations and
 * definitions followed by one assertion per constraint. With universals,
 * everything defined after the first universal moves under a single
 * {@code (assert (forall ...))}: definitions become nested lets, tables that
 * depend on them are skolemized, and the constraints are conjoined into the
 * body.
 */
public final class SmtLib2Translator {

	/** Indentation of lets and the body under the quantifier. */
	private static final int LET_SHIFT = 12;

	private final A4Reporter rep;
	private final Problem p;
	private final Features features;
	private final List<SV> foralls;
	private final String forallArgs;

	private final Map<SV, CV> allConsts = new LinkedHashMap<SV, CV>();
	private final Map<SV, List<SV>> skolemMap = new HashMap<SV, List<SV>>();
	private final Map<Integer, String> tableMap = new HashMap<Integer, String>();
	private final Map<Op.SeqReverse, String> functionMap = new LinkedHashMap<Op.SeqReverse, String>();

	private final List<Assignment> preQuantifier = new Vector<Assignment>();
	private final List<Assignment> postQuantifier = new Vector<Assignment>();

	private final List<TableDeclarations.TableData> constTables = new Vector<TableDeclarations.TableData>();
	private final List<TableDeclarations.TableData> skolemTables = new Vector<TableDeclarations.TableData>();
	private final List<String> delayedEqualities = new Vector<String>();

	private final TranslationContext ctx;

	private SmtLib2Translator(A4Reporter rep, Problem p) throws Err {
		this.rep = rep;
		this.p = p;
		this.features = new Features(p);
		this.foralls = p.foralls();

		StringBuilder sb = new StringBuilder();
		for (SV s : foralls)
			sb.append(" ").append(s);
		this.forallArgs = sb.toString();

		for (Pair<SV, CV> c : p.constants)
			allConsts.put(c.a, c.b);

		for (SkolemInput in : p.skolemInputs)
			if (!in.universal && !in.dependsOn.isEmpty())
				skolemMap.put(in.sv, in.dependsOn);

		// assignments created before the first universal do not depend on it
		final int first = foralls.isEmpty() ? Integer.MAX_VALUE : foralls.get(0).id;
		boolean pre = true;
		for (Assignment a : p.program) {
			pre = pre && a.sv.id < first;
			(pre ? preQuantifier : postQuantifier).add(a);
		}

		for (Assignment a : p.program) {
			if (a.expr.op instanceof Op.SeqReverse && !functionMap.containsKey(a.expr.op))
				functionMap.put((Op.SeqReverse) a.expr.op, "sbv.reverse_" + functionMap.size());
		}

		// tables are classified with the naming of plain symbolic values
		final TranslationContext plain = new TranslationContext(p.config, skolemMap,
				new HashMap<Integer, String>(), functionMap);
		for (TableInfo t : p.tables) {
			final TableDeclarations.TableData d = TableDeclarations.generate(plain, forallArgs, allConsts.keySet(), t);
			if (d.constant) {
				constTables.add(d);
				tableMap.put(t.id, "table" + t.id);
			} else {
				skolemTables.add(d);
				tableMap.put(t.id, "table" + t.id + forallArgs);
				delayedEqualities.addAll(d.equalities);
				rep.debug("Table " + t.id + " depends on symbolic values, skolemized over" + forallArgs + "\n");
			}
		}
		this.ctx = new TranslationContext(p.config, skolemMap, tableMap, functionMap);
	}

	/**
	 * Produces the complete script for {@code p}.
	 *
	 * @param rep receives diagnostics; may be null
	 * @throws Err if the problem cannot be expressed for the configured solver
	 */
	public static ConstList<String> translate(A4Reporter rep, Problem p) throws Err {
		rep = rep == null ? A4Reporter.NOP : rep;
		try {
			return new SmtLib2Translator(rep, p).script().lines();
		} catch (Throwable ex) {
			if (ex instanceof Err) throw (Err) ex; else throw new ErrorFatal("Unknown exception occurred: " + ex, ex);
		}
	}

	/**
	 * Produces the lines that extend an open session by {@code delta}.
	 *
	 * @param rep receives diagnostics; may be null
	 */
	public static ConstList<String> translateIncremental(A4Reporter rep, ProblemDelta delta) throws Err {
		rep = rep == null ? A4Reporter.NOP : rep;
		try {
			return new IncrementalTranslator(rep, delta).script().lines();
		} catch (Throwable ex) {
			if (ex instanceof Err) throw (Err) ex; else throw new ErrorFatal("Unknown exception occurred: " + ex, ex);
		}
	}

	/** Closing parentheses for the lets, the binder, its assert and the delayed conjunction. */
	int closeParens() {
		if (foralls.isEmpty())
			return 0;
		return postQuantifier.size() + 2 + (delayedEqualities.isEmpty() ? 0 : 1);
	}

	private SmtScript script() throws Err {
		final boolean quantified = !foralls.isEmpty();

		final List<String> settings = LogicSelector.settings(rep, features, p.config);
		final AssertionAssembler assembler = new AssertionAssembler(ctx, foralls, p.constraints, p.goal, p.isSat);
		final List<String> finalAssert = assembler.finalAssert(!delayedEqualities.isEmpty(), closeParens());

		List<ArrayDeclarations> arrays = new Vector<ArrayDeclarations>();
		for (ArrayInfo a : p.arrays)
			arrays.add(ArrayDeclarations.declare(ctx, quantified, allConsts, a));

		final SmtScript s = new SmtScript();
		for (String c : p.comments)
			s.comment(c);
		s.addAll(settings);

		s.section("uninterpreted sorts");
		for (Kind.UserSort u : features.userSorts)
			s.addAll(Declarations.declSort(u));

		s.section("tuples");
		for (int arity : features.tupleArities)
			s.addAll(Declarations.declTuple(arity));

		s.section("sums");
		if (features.hasEither) s.addAll(Declarations.SUM);
		if (features.hasMaybe) s.addAll(Declarations.MAYBE);
		if (features.hasRational) s.addAll(Declarations.RATIONALS);

		s.section("literal constants");
		for (Pair<SV, CV> c : p.constants)
			s.addAll(Declarations.declConst(ctx, c.a, c.b));

		s.section("skolem constants");
		for (SkolemInput in : p.skolemInputs) {
			if (in.universal)
				continue;
			List<Kind> signature = new Vector<Kind>();
			for (SV d : in.dependsOn)
				signature.add(d.kind);
			signature.add(in.sv.kind);
			s.addAll(Declarations.declareFun(in.sv, signature, userName(in.sv)));
		}

		if (!p.trackers.isEmpty()) {
			s.section("optimization tracker variables");
			for (NamedVar t : p.trackers)
				s.addAll(Declarations.declareFun(t.sv, Collections.singletonList(t.sv.kind), "tracks " + t.name));
		}

		s.section("constant tables");
		for (TableDeclarations.TableData d : constTables)
			s.addAll(TableDeclarations.constTable(d));

		s.section("skolemized tables");
		List<String> forallTypes = new Vector<String>();
		for (SV f : foralls)
			forallTypes.add(f.kind.smtType());
		for (TableDeclarations.TableData d : skolemTables)
			s.add(TableDeclarations.skolemTable(Helpers.unwords(forallTypes), d));

		s.section("arrays");
		for (ArrayDeclarations a : arrays)
			s.addAll(a.constants);

		s.section("uninterpreted constants");
		for (UninterpretedSymbol ui : p.uninterpreteds)
			s.addAll(Declarations.declUI(ui));

		if (!functionMap.isEmpty()) {
			s.section("helper function definitions");
			for (Map.Entry<Op.SeqReverse, String> f : functionMap.entrySet())
				s.addAll(Declarations.declFunction(f.getKey(), f.getValue()));
		}

		s.section("user given axioms");
		for (Axiom ax : p.axioms)
			s.addAll(Declarations.declAxiom(ax));

		s.section("preQuantifier assignments");
		for (Assignment a : preQuantifier)
			s.addAll(Declarations.declDef(ctx, a));

		s.section("arrayDelayeds");
		for (ArrayDeclarations a : arrays)
			s.addAll(a.delayeds);

		s.section("arraySetups");
		for (ArrayDeclarations a : arrays)
			s.addAll(a.setups);

		s.section("formula");
		s.addAll(binder());

		s.section("postQuantifier assignments");
		for (Assignment a : postQuantifier) {
			if (quantified)
				s.add(Helpers.align(LET_SHIFT, let(a)));
			else
				s.addAll(Declarations.declDef(ctx, a));
		}

		s.section("delayedEqualities");
		for (int i = 0; i < delayedEqualities.size(); ++i) {
			final String eq = delayedEqualities.get(i);
			if (!quantified)
				s.addConstraint(SExpr.sym(eq));
			else if (i == 0)
				s.add(Helpers.align(LET_SHIFT, "(and " + eq));
			else
				s.add(Helpers.align(LET_SHIFT + 5, eq));
		}

		s.section("finalAssert");
		s.addAll(finalAssert);
		return s;
	}

	/** The comment for a skolem input whose user name differs from its node name. */
	private String userName(SV s) {
		for (NamedVar v : p.inputs)
			if (v.sv.equals(s) && !v.name.equals(s.toString()))
				return "tracks user variable " + Helpers.quoted(v.name);
		return null;
	}

	/**
	 * Opening of the quantifier, one universal per line:
	 * <pre>
	 * (assert (forall ((s0 (_ BitVec 8))
	 *                  (s1 (_ BitVec 8)))
	 * </pre>
	 */
	private List<String> binder() {
		List<String> result = new Vector<String>();
		for (int i = 0; i < foralls.size(); ++i) {
			final SV f = foralls.get(i);
			final String decl = "(" + f + " " + f.kind.smtType() + ")" + (i == foralls.size() - 1 ? ")" : "");
			result.add(i == 0 ? "(assert (forall (" + decl : Helpers.align(17, decl));
		}
		return result;
	}

	private String let(Assignment a) throws Err {
		if (a.expr.op instanceof Op.Label)
			return "(let ((" + a.sv + " " + ctx.sv(a.expr.args.get(0)) + ")) ; " + ((Op.Label) a.expr.op).comment;
		return "(let ((" + a.sv + " " + ExprTranslator.translate(ctx, a.expr) + "))";
	}
}
