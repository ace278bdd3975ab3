package edu.isi.wordlat;

import gnu.trove.iterator.TIntIterator;
import gnu.trove.set.hash.TIntHashSet;

import java.io.IOException;
import java.io.Writer;
import java.util.Date;

/**
 * Runs the whole per-lattice pipeline over an archive: optional scaling and
 * beam pruning, expansion into words, symbol table handling, writing.
 */
public class CharToWordConverter {
	private final TIntHashSet delimiters;
	private final int maxLength;
	private final double beam;
	private final double scale;
	private final MatchSide side;
	private final SymbolScope scope;
	private final LabelSequenceInterner interner = new LabelSequenceInterner();

	private int numDone = 0;

	public CharToWordConverter(TIntHashSet delimiters, int maxLength, double beam, double scale,
			MatchSide side, SymbolScope scope) throws ConfigureException {
		if (delimiters.contains(Arc.EPSILON))
			throw new ConfigureException("Epsilon (0) cannot be a delimiter symbol!");
		if (maxLength < 0)
			throw new ConfigureException("Maximum word length must be non-negative; got "+maxLength);
		if (!(scale > 0))
			throw new ConfigureException("Scale must be strictly greater than 0.0; got "+scale);
		if (!(beam >= 0))
			throw new ConfigureException("Beam must be non-negative; got "+beam);
		this.delimiters = delimiters;
		this.maxLength = maxLength;
		this.beam = beam;
		this.scale = scale;
		this.side = side;
		this.scope = scope;
	}

	/**
	 * Parse a whitespace separated list of delimiter labels, e.g. "3 4".
	 */
	public static TIntHashSet parseDelimiters(String text) throws ConfigureException {
		TIntHashSet ret = new TIntHashSet();
		String trimmed = text.trim();
		if (trimmed.length() == 0)
			return ret;
		for (String tok : trimmed.split("\\s+")) {
			int l;
			try {
				l = Integer.parseInt(tok);
			}
			catch (NumberFormatException e) {
				throw new ConfigureException("Delimiter symbols must be integers; got "+tok, e);
			}
			if (l == Arc.EPSILON)
				throw new ConfigureException("Epsilon (0) cannot be a delimiter symbol!");
			if (l < 0)
				throw new ConfigureException("Delimiter symbols must be positive; got "+l);
			ret.add(l);
		}
		return ret;
	}

	/** run the pipeline on one lattice. Pruning changes lat in place */
	public Automaton convert(String key, Automaton lat) throws UnexpectedCaseException {
		boolean debug = false;
		Date preTime = new Date();
		if (beam != Double.POSITIVE_INFINITY) {
			// prune in the scaled space, then put the weights back
			LatticePruner.scale(lat, scale);
			LatticePruner.prune(lat, beam);
			LatticePruner.scale(lat, 1.0/scale);
		}
		if (scope == SymbolScope.PER_LATTICE)
			interner.reset();
		Automaton olat = LatticeExpander.expand(lat, delimiters, maxLength, side, interner, interner);
		if (scope == SymbolScope.PER_LATTICE)
			olat.setSymbols(SymbolTableBuilder.build(interner));
		if (debug) Debug.debug(debug, key+": "+lat.getNumStates()+" states in, "+olat.getNumStates()+" states out");
		Debug.dbtime(2, preTime, "expand "+key);
		return olat;
	}

	/** convert every lattice of reader into writer; returns how many */
	public int convertAll(LatticeReader reader, LatticeWriter writer)
		throws IOException, DataFormatException, UnexpectedCaseException {
		int count = 0;
		while (reader.next()) {
			Automaton olat = convert(reader.getKey(), reader.getLattice());
			writer.write(reader.getKey(), olat);
			count++;
			numDone++;
		}
		return count;
	}

	/** the shared table, as accumulated so far */
	public void writeSymbols(Writer w) throws IOException, UnexpectedCaseException {
		SymbolTableBuilder.build(interner).writeText(w);
	}

	public LabelSequenceInterner getInterner() { return interner; }
	public SymbolScope getScope() { return scope; }
	public int getNumDone() { return numDone; }

	public String toString() {
		StringBuffer sb = new StringBuffer("delimiters {");
		TIntIterator it = delimiters.iterator();
		while (it.hasNext()) {
			sb.append(it.next());
			if (it.hasNext())
				sb.append(' ');
		}
		sb.append("}, max length "+(maxLength == Integer.MAX_VALUE ? "unbounded" : Integer.toString(maxLength)));
		sb.append(", beam "+beam+", scale "+scale+", match "+side+", symbols "+scope);
		return sb.toString();
	}
}
