package de.psi.smtlib2.translator;

public class Helpers {

	public static String spaces(int n) {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < n; ++i)
			sb.append(' ');
		return sb.toString();
	}

	public static String align(int n, String s) {
		return spaces(n) + s;
	}

	public static String unwords(Iterable<String> words) {
		StringBuilder sb = new StringBuilder();
		boolean first = true;
		for (String w : words) {
			if (first) first = false; else sb.append(" ");
			sb.append(w);
		}
		return sb.toString();
	}

	/** Double-quoted, with quotes and backslashes escaped. */
	public static String quoted(String s) {
		StringBuilder sb = new StringBuilder("\"");
		for (int i = 0; i < s.length(); ++i) {
			final char c = s.charAt(i);
			if (c == '"' || c == '\\')
				sb.append('\\');
			sb.append(c);
		}
		sb.append('"');
		return sb.toString();
	}
}
