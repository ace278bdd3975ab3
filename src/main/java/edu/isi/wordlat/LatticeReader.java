package edu.isi.wordlat;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a text archive of keyed lattices, one after another:
 * <pre>
 * key
 * src dst ilabel olabel [weight]
 * state [final-weight]
 * (blank line)
 * </pre>
 * The source state of the first line is the start state. Missing weights
 * are the semiring's ONE. Lines starting with % are comments.
 */
public class LatticeReader implements Closeable {

	// empty spaces or comments regions
	private static Pattern commentPat = Pattern.compile("\\s*%.*");
	private static Pattern blankPat = Pattern.compile("\\s*");
	private static Pattern keyPat = Pattern.compile("\\s*(\\S+)\\s*");
	private static Pattern splitPat = Pattern.compile("\\s+");

	private BufferedReader br;
	private Semiring semiring;
	private int lineNumber = 0;

	private String key = null;
	private Automaton lattice = null;

	public LatticeReader(BufferedReader br, Semiring semiring) {
		this.br = br;
		this.semiring = semiring;
	}

	/**
	 * Read the next lattice.
	 * @return false when the archive is exhausted
	 */
	public boolean next() throws IOException, DataFormatException {
		boolean debug = false;
		key = null;
		lattice = null;

		// 1) skip blank lines and comments until the key
		String line = readLine();
		while (line != null && (blankPat.matcher(line).matches() || commentPat.matcher(line).matches()))
			line = readLine();
		if (line == null)
			return false;
		Matcher keyMatch = keyPat.matcher(line);
		if (!keyMatch.matches())
			throw new DataFormatException(lineNumber, "Expected a single lattice key but found "+line);
		String k = keyMatch.group(1);
		if (debug) Debug.debug(debug, "Reading lattice "+k);

		// 2) arcs and final states up to the next blank line
		Automaton fst = new VectorAutomaton(semiring);
		line = readLine();
		while (line != null && !blankPat.matcher(line).matches()) {
			if (!commentPat.matcher(line).matches())
				readEntry(fst, line.trim());
			line = readLine();
		}
		key = k;
		lattice = fst;
		return true;
	}

	public String getKey() { return key; }
	public Automaton getLattice() { return lattice; }

	private void readEntry(Automaton fst, String text) throws DataFormatException {
		String[] toks = splitPat.split(text);
		switch (toks.length) {
		case 1:
		case 2: {
			int s = parseInt(toks[0], "state");
			addStatesUpTo(fst, s);
			setStartIfUnset(fst, s);
			double w = toks.length == 2 ? parseWeight(toks[1]) : semiring.ONE();
			fst.setFinal(s, w);
			break;
		}
		case 4:
		case 5: {
			int src = parseInt(toks[0], "source state");
			int dst = parseInt(toks[1], "destination state");
			int il = parseInt(toks[2], "input label");
			int ol = parseInt(toks[3], "output label");
			double w = toks.length == 5 ? parseWeight(toks[4]) : semiring.ONE();
			addStatesUpTo(fst, Math.max(src, dst));
			setStartIfUnset(fst, src);
			fst.addArc(src, new Arc(il, ol, w, dst));
			break;
		}
		default:
			throw new DataFormatException(lineNumber, "Expected an arc (src dst ilabel olabel [weight]) "+
					"or a final state (state [weight]) but found "+text);
		}
	}

	// states are created on demand
	private void addStatesUpTo(Automaton fst, int s) {
		while (fst.getNumStates() <= s)
			fst.addState();
	}

	// the first state mentioned is the start
	private void setStartIfUnset(Automaton fst, int s) {
		if (fst.getStart() == Automaton.NO_STATE)
			fst.setStart(s);
	}

	private int parseInt(String tok, String what) throws DataFormatException {
		int v;
		try {
			v = Integer.parseInt(tok);
		}
		catch (NumberFormatException e) {
			throw new DataFormatException(lineNumber, "Bad "+what+" "+tok, e);
		}
		if (v < 0)
			throw new DataFormatException(lineNumber, "Negative "+what+" "+tok);
		return v;
	}

	private double parseWeight(String tok) throws DataFormatException {
		try {
			return semiring.printToInternal(Double.parseDouble(tok));
		}
		catch (NumberFormatException e) {
			throw new DataFormatException(lineNumber, "Bad weight "+tok, e);
		}
	}

	private String readLine() throws IOException {
		String line = br.readLine();
		if (line != null)
			lineNumber++;
		return line;
	}

	public void close() throws IOException {
		br.close();
	}
}
