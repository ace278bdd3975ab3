package edu.isi.wordlat;

import java.io.Closeable;
import java.io.IOException;
import java.io.Writer;

// writes lattices in the archive format LatticeReader reads. The start
// state goes first so it is read back as the start. Labels are written as
// names when the lattice carries a symbol table.
public class LatticeWriter implements Closeable {
	private Writer w;

	public LatticeWriter(Writer w) {
		this.w = w;
	}

	public void write(String key, Automaton fst) throws IOException {
		StringBuffer sb = new StringBuffer();
		sb.append(key).append("\n");
		int start = fst.getStart();
		if (start != Automaton.NO_STATE) {
			appendState(sb, fst, start);
			for (int s = 0; s < fst.getNumStates(); s++)
				if (s != start)
					appendState(sb, fst, s);
		}
		sb.append("\n");
		w.write(sb.toString());
		w.flush();
	}

	private void appendState(StringBuffer sb, Automaton fst, int s) {
		Semiring semiring = fst.getSemiring();
		SymbolTable syms = fst.getSymbols();
		for (Arc a : fst.getArcs(s)) {
			sb.append(s).append(' ').append(a.getNextState()).append(' ');
			sb.append(label(syms, a.getILabel())).append(' ');
			sb.append(label(syms, a.getOLabel())).append(' ');
			sb.append(formatWeight(semiring.internalToPrint(a.getWeight()))).append("\n");
		}
		if (fst.isFinal(s))
			sb.append(s).append(' ').append(formatWeight(semiring.internalToPrint(fst.getFinal(s)))).append("\n");
	}

	private static String label(SymbolTable syms, int l) {
		if (syms != null) {
			String name = syms.find(l);
			if (name != null)
				return name;
		}
		return Integer.toString(l);
	}

	// integral weights without the trailing ".0"
	static String formatWeight(double d) {
		if (!Double.isInfinite(d) && d == Math.rint(d) && Math.abs(d) < 1e15)
			return Long.toString((long)d);
		return Double.toString(d);
	}

	public void flush() throws IOException {
		w.flush();
	}

	public void close() throws IOException {
		w.close();
	}
}
