package de.psi.smtlib2.ast;

import de.psi.smtlib2.smt.RoundingMode;
import de.psi.smtlib2.smt.SmtConfig;
import edu.mit.csail.sdg.alloy4.ConstList;
import edu.mit.csail.sdg.alloy4.Err;
import edu.mit.csail.sdg.alloy4.ErrorAPI;
import edu.mit.csail.sdg.alloy4.Pair;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Vector;

/**
 * Arena in which the operation graph is built. Node ids are handed out
 * densely in creation order, so the program is topologically sorted by
 * construction.
 * <p>
 * {@link #build} takes a snapshot of everything created so far;
 * {@link #delta} takes a snapshot of what was created since the previous
 * snapshot, for sessions that are already open.
 */
public final class ProblemBuilder {

    public SmtConfig config = new SmtConfig();

    private int nextNode = 0;
    private int nextTable = 0;
    private int nextArray = 0;

    private final List<String> comments = new Vector<String>();
    private final List<Kind> kinds = new Vector<Kind>();
    private final List<NamedVar> inputs = new Vector<NamedVar>();
    private final List<SkolemInput> skolemInputs = new Vector<SkolemInput>();
    private final List<SV> foralls = new Vector<SV>();
    private final List<NamedVar> trackers = new Vector<NamedVar>();
    private final List<Pair<SV, CV>> constants = new Vector<Pair<SV, CV>>();
    private final Map<String, SV> constantIndex = new HashMap<String, SV>();
    private final List<TableInfo> tables = new Vector<TableInfo>();
    private final List<ArrayInfo> arrays = new Vector<ArrayInfo>();
    private final List<UninterpretedSymbol> uninterpreteds = new Vector<UninterpretedSymbol>();
    private final Map<String, UninterpretedSymbol> uninterpretedIndex = new HashMap<String, UninterpretedSymbol>();
    private final List<Axiom> axioms = new Vector<Axiom>();
    private final List<Assignment> program = new Vector<Assignment>();
    private final List<Constraint> constraints = new Vector<Constraint>();

    // positions reached by the last snapshot
    private int kindMark, inputMark, constantMark, tableMark, arrayMark, uninterpretedMark, programMark, constraintMark;

    public ProblemBuilder() {
        registerKind(Kind.BOOL);
        constants.add(new Pair<SV, CV>(SV.FALSE, CV.bool(false)));
        constants.add(new Pair<SV, CV>(SV.TRUE, CV.bool(true)));
        constantIndex.put(key(CV.bool(false)), SV.FALSE);
        constantIndex.put(key(CV.bool(true)), SV.TRUE);
    }

    public ProblemBuilder comment(String text) {
        comments.add(text);
        return this;
    }

    private void registerKind(Kind k) {
        for (Kind sub : k.universe())
            if (!kinds.contains(sub))
                kinds.add(sub);
    }

    private SV fresh(Kind k) {
        registerKind(k);
        return new SV(k, nextNode++);
    }

    private static String key(CV cv) {
        return cv.kind + ":" + cv.toSmtLib(RoundingMode.ROUND_NEAREST_TIES_TO_EVEN);
    }

    /**
     * A free variable. Inside the scope of universals it depends on all of
     * them and ends up as a skolem function.
     */
    public SV input(Kind k, String name) {
        final SV sv = fresh(k);
        inputs.add(new NamedVar(sv, name));
        ConstList.TempList<SV> deps = new ConstList.TempList<SV>();
        deps.addAll(foralls);
        skolemInputs.add(SkolemInput.exists(sv, deps.makeConst()));
        return sv;
    }

    public SV forall(Kind k, String name) {
        final SV sv = fresh(k);
        inputs.add(new NamedVar(sv, name));
        skolemInputs.add(SkolemInput.forall(sv));
        foralls.add(sv);
        return sv;
    }

    /** A variable tracking the value of an optimization goal. */
    public SV tracker(Kind k, String name) {
        final SV sv = fresh(k);
        trackers.add(new NamedVar(sv, name));
        return sv;
    }

    /** The node holding the given value; equal values share a node. */
    public SV constant(CV value) {
        final String key = key(value);
        SV sv = constantIndex.get(key);
        if (sv == null) {
            sv = fresh(value.kind);
            constantIndex.put(key, sv);
            constants.add(new Pair<SV, CV>(sv, value));
        }
        return sv;
    }

    public SV apply(Kind result, Op op, SV... args) {
        final SV sv = fresh(result);
        program.add(new Assignment(sv, new Operation(op, ConstList.make(Arrays.asList(args)))));
        return sv;
    }

    public SV apply(Kind result, Op.Operator op, SV... args) {
        return apply(result, new Op.Basic(op), args);
    }

    /** Registers a table whose element {@code k} sits at index {@code k}; returns its id. */
    public int table(Kind argKind, Kind resultKind, SV... elems) {
        registerKind(argKind);
        registerKind(resultKind);
        final int id = nextTable++;
        tables.add(new TableInfo(id, argKind, resultKind, ConstList.make(Arrays.asList(elems))));
        return id;
    }

    public SV lookup(int table, SV index, SV dflt) throws Err {
        final TableInfo t = findTable(table);
        return apply(t.resultKind, new Op.LookUp(t.id, t.argKind, t.resultKind, t.elems.size(), index, dflt));
    }

    private TableInfo findTable(int id) throws Err {
        for (TableInfo t : tables)
            if (t.id == id)
                return t;
        throw new ErrorAPI("No table with id " + id);
    }

    private ArrayInfo findArray(int id) throws Err {
        for (ArrayInfo a : arrays)
            if (a.id == id)
                return a;
        throw new ErrorAPI("No array with id " + id);
    }

    /** A fresh array; {@code init} may be null for an unconstrained one. */
    public int newArray(String name, Kind domain, Kind range, SV init) {
        registerKind(domain);
        registerKind(range);
        final int id = nextArray++;
        arrays.add(new ArrayInfo(id, name, domain, range, new ArrayInfo.Free(init)));
        return id;
    }

    public int writeArray(int base, SV index, SV value) throws Err {
        final ArrayInfo b = findArray(base);
        final int id = nextArray++;
        arrays.add(new ArrayInfo(id, b.name, b.domain, b.range, new ArrayInfo.Mutate(base, index, value)));
        return id;
    }

    public int mergeArrays(SV cond, int then, int otherwise) throws Err {
        final ArrayInfo t = findArray(then);
        findArray(otherwise);
        final int id = nextArray++;
        arrays.add(new ArrayInfo(id, t.name, t.domain, t.range, new ArrayInfo.Merge(cond, then, otherwise)));
        return id;
    }

    public SV readArray(int array, SV index) throws Err {
        return apply(findArray(array).range, new Op.ArrayRead(array), index);
    }

    public SV arraysEqual(int left, int right) {
        return apply(Kind.BOOL, new Op.ArrayEq(left, right));
    }

    /** Declares an uninterpreted symbol; the last kind is the result. */
    public UninterpretedSymbol declareUninterpreted(String name, Kind... signature) {
        UninterpretedSymbol ui = uninterpretedIndex.get(name);
        if (ui == null) {
            for (Kind k : signature)
                registerKind(k);
            ui = new UninterpretedSymbol(name, ConstList.make(Arrays.asList(signature)));
            uninterpretedIndex.put(name, ui);
            uninterpreteds.add(ui);
        }
        return ui;
    }

    /** An application of an uninterpreted function, declaring it on first use. */
    public SV uninterpreted(String name, Kind result, SV... args) {
        Kind[] signature = new Kind[args.length + 1];
        for (int i = 0; i < args.length; ++i)
            signature[i] = args[i].kind;
        signature[args.length] = result;
        declareUninterpreted(name, signature);
        return apply(result, new Op.Uninterpreted(name), args);
    }

    public ProblemBuilder axiom(String name, String... lines) {
        axioms.add(new Axiom(false, name, ConstList.make(Arrays.asList(lines))));
        return this;
    }

    public ProblemBuilder definition(String name, String... lines) {
        axioms.add(new Axiom(true, name, ConstList.make(Arrays.asList(lines))));
        return this;
    }

    public ProblemBuilder constrain(SV literal) {
        return constrain(false, Collections.<Pair<String, String>>emptyList(), literal);
    }

    public ProblemBuilder softConstrain(SV literal) {
        return constrain(true, Collections.<Pair<String, String>>emptyList(), literal);
    }

    public ProblemBuilder namedConstrain(String name, SV literal) {
        return constrain(false, Collections.singletonList(new Pair<String, String>(":named", name)), literal);
    }

    public ProblemBuilder constrain(boolean soft, List<Pair<String, String>> attributes, SV literal) {
        constraints.add(new Constraint(soft, ConstList.make(attributes), literal));
        return this;
    }

    private static <T> ConstList<T> since(List<T> list, int mark) {
        return ConstList.make(list.subList(mark, list.size()));
    }

    private void mark() {
        kindMark = kinds.size();
        inputMark = inputs.size();
        constantMark = constants.size();
        tableMark = tables.size();
        arrayMark = arrays.size();
        uninterpretedMark = uninterpreteds.size();
        programMark = program.size();
        constraintMark = constraints.size();
    }

    /** Snapshot of the whole problem. */
    public Problem build(SV goal, boolean isSat) {
        final Problem p = new Problem(ConstList.make(comments), ConstList.make(kinds), isSat,
                ConstList.make(inputs), ConstList.make(skolemInputs), ConstList.make(trackers),
                ConstList.make(constants), ConstList.make(tables), ConstList.make(arrays),
                ConstList.make(uninterpreteds), ConstList.make(axioms), ConstList.make(program),
                ConstList.make(constraints), goal, config);
        mark();
        return p;
    }

    /** Snapshot of what was created since the previous snapshot. */
    public ProblemDelta delta() {
        final ProblemDelta d = new ProblemDelta(since(inputs, inputMark), since(kinds, kindMark),
                ConstList.make(constants), since(constants, constantMark), since(arrays, arrayMark),
                since(tables, tableMark), since(uninterpreteds, uninterpretedMark),
                since(program, programMark), since(constraints, constraintMark), config);
        mark();
        return d;
    }
}
