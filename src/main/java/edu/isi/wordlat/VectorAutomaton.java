package edu.isi.wordlat;

import java.util.Collections;
import java.util.List;
import java.util.Vector;

// states are kept in a vector, each with its own arc vector
public class VectorAutomaton implements Automaton {

	private static class StateEntry {
		double fin;
		Vector<Arc> arcs = new Vector<Arc>();
		StateEntry(double f) { fin = f; }
	}

	private Semiring semiring;
	private Vector<StateEntry> states;
	private int start = NO_STATE;
	private SymbolTable symbols = null;

	public VectorAutomaton(Semiring s) {
		semiring = s;
		states = new Vector<StateEntry>();
	}

	public Semiring getSemiring() { return semiring; }

	public int getNumStates() { return states.size(); }

	public int addState() {
		states.add(new StateEntry(semiring.ZERO()));
		return states.size()-1;
	}

	public void deleteStates() {
		states.clear();
		start = NO_STATE;
	}

	public int getStart() { return start; }
	public void setStart(int state) {
		if (state != NO_STATE)
			checkState(state);
		start = state;
	}

	public double getFinal(int state) {
		checkState(state);
		return states.get(state).fin;
	}
	public void setFinal(int state, double weight) {
		checkState(state);
		states.get(state).fin = weight;
	}
	public boolean isFinal(int state) {
		return !semiring.isZero(getFinal(state));
	}

	public List<Arc> getArcs(int state) {
		checkState(state);
		return Collections.unmodifiableList(states.get(state).arcs);
	}
	public int getNumArcs(int state) {
		checkState(state);
		return states.get(state).arcs.size();
	}
	public void addArc(int state, Arc arc) {
		checkState(state);
		checkState(arc.getNextState());
		states.get(state).arcs.add(arc);
	}
	public void deleteArcs(int state) {
		checkState(state);
		states.get(state).arcs.clear();
	}

	public SymbolTable getSymbols() { return symbols; }
	public void setSymbols(SymbolTable s) { symbols = s; }

	private void checkState(int state) {
		if (state < 0 || state >= states.size())
			throw new IllegalArgumentException("No such state "+state+" (automaton has "+states.size()+" states)");
	}

	public String toString() {
		StringBuffer sb = new StringBuffer();
		sb.append("start "+start+"\n");
		for (int s = 0; s < states.size(); s++) {
			for (Arc a : states.get(s).arcs)
				sb.append(s+" "+a.toString()+"\n");
			if (isFinal(s))
				sb.append(s+" final "+states.get(s).fin+"\n");
		}
		return sb.toString();
	}
}
