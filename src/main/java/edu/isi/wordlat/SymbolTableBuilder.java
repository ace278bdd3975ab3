package edu.isi.wordlat;

import gnu.trove.iterator.TObjectIntIterator;

// names every interned sequence: "0" for epsilon, otherwise the labels
// joined by an underscore, e.g. [1, 2] -> "1_2"
public class SymbolTableBuilder {
	public static final char SEPARATOR = '_';

	public static SymbolTable build(LabelSequenceInterner interner) throws UnexpectedCaseException {
		boolean debug = false;
		int size = interner.size();
		// slot per id, so a clash or a hole shows up right away
		LabelSequence[] byId = new LabelSequence[size];
		TObjectIntIterator<LabelSequence> it = interner.iterator();
		while (it.hasNext()) {
			it.advance();
			int id = it.value();
			if (id < 0 || id >= size)
				throw new UnexpectedCaseException("Sequence "+it.key()+" has id "+id+" outside 0.."+(size-1));
			if (byId[id] != null)
				throw new UnexpectedCaseException("Sequences "+byId[id]+" and "+it.key()+" share id "+id);
			byId[id] = it.key();
		}
		SymbolTable table = new SymbolTable();
		for (int id = 0; id < size; id++) {
			if (byId[id] == null)
				throw new UnexpectedCaseException("No sequence was assigned id "+id);
			String name = byId[id].toString(SEPARATOR);
			int got = table.addSymbol(name, id);
			if (got != id)
				throw new UnexpectedCaseException("Symbol "+name+" wanted id "+id+" but already has "+got);
			if (debug) Debug.debug(debug, id+" "+name);
		}
		return table;
	}
}
