package edu.isi.wordlat;

import java.util.List;

/**
 * A weighted automaton with states numbered <code>0..getNumStates()-1</code>.
 * Each state has a final weight (the semiring's ZERO when the state is not
 * final) and a list of outgoing arcs. This is everything the expansion, the
 * trimming and the pruning need, so any graph representation can be plugged
 * in behind it.
 */
public interface Automaton {
	public static final int NO_STATE = -1;

	public Semiring getSemiring();

	public int getNumStates();
	/** @return the id of the new state, which is not final and has no arcs */
	public int addState();
	/** removes all states and arcs and unsets the start state */
	public void deleteStates();

	public int getStart();
	public void setStart(int state);

	public double getFinal(int state);
	public void setFinal(int state, double weight);
	public boolean isFinal(int state);

	/** arcs leaving state, in insertion order. Not to be modified by the caller. */
	public List<Arc> getArcs(int state);
	public int getNumArcs(int state);
	public void addArc(int state, Arc arc);
	public void deleteArcs(int state);

	/** symbols for the labels, if any are attached */
	public SymbolTable getSymbols();
	public void setSymbols(SymbolTable symbols);
}
