package edu.isi.wordlat;

/** Lifetime of the word symbols across an archive. */
public enum SymbolScope {
	/** one interner for the whole archive; its table is written once, separately */
	SHARED,
	/** the interner is reset before each lattice, which carries its own table */
	PER_LATTICE
}
