package de.psi.smtlib2.smt;

import edu.mit.csail.sdg.alloy4.ConstList;

import java.util.List;
import java.util.Vector;

/**
 * Ordered collection of script lines. Lines are kept verbatim; the script is
 * valid once all of them are sent in order.
 */
public class SmtScript {
    private final List<String> lines = new Vector<String>();

    public SmtScript add(String line) {
        lines.add(line);
        return this;
    }

    public SmtScript addAll(Iterable<String> more) {
        for (String line : more)
            lines.add(line);
        return this;
    }

    public SmtScript comment(String text) {
        lines.add("; " + text);
        return this;
    }

    public SmtScript section(String title) {
        lines.add("; --- " + title + " ---");
        return this;
    }

    public SmtScript addConstraint(SExpr expr) {
        lines.add(SExpr.call("assert", expr).toString());
        return this;
    }

    public int size() {
        return lines.size();
    }

    public ConstList<String> lines() {
        ConstList.TempList<String> result = new ConstList.TempList<String>();
        result.addAll(lines);
        return result.makeConst();
    }

    public static String render(Iterable<String> lines) {
        StringBuilder sb = new StringBuilder();
        for (String line : lines) {
            sb.append(line);
            sb.append("\n");
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return render(lines);
    }
}
