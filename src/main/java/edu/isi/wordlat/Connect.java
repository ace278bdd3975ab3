package edu.isi.wordlat;

import gnu.trove.list.array.TIntArrayList;
import gnu.trove.stack.array.TIntArrayStack;

import java.util.List;
import java.util.Vector;

// Remove states that are not on any path from the start state to a final
// state. First go forward from the start and mark every accessible state,
// then go backward from the final states and mark every coaccessible state.
// Only states with both marks survive; they keep their order and are
// renumbered from 0.
public class Connect {

	public static void connect(Automaton fst) {
		boolean debug = false;
		int n = fst.getNumStates();
		int start = fst.getStart();
		if (start == Automaton.NO_STATE) {
			if (debug) Debug.debug(debug, "No start state; emptying");
			fst.deleteStates();
			return;
		}

		// phase 1: forward from start
		boolean[] accessible = new boolean[n];
		TIntArrayStack ready = new TIntArrayStack();
		accessible[start] = true;
		ready.push(start);
		// reverse adjacency, filled on the way for phase 2
		TIntArrayList[] preds = new TIntArrayList[n];
		while (ready.size() > 0) {
			int s = ready.pop();
			for (Arc a : fst.getArcs(s)) {
				int t = a.getNextState();
				if (preds[t] == null)
					preds[t] = new TIntArrayList();
				preds[t].add(s);
				if (!accessible[t]) {
					accessible[t] = true;
					ready.push(t);
				}
			}
		}

		// phase 2: backward from accessible final states
		boolean[] coaccessible = new boolean[n];
		for (int s = 0; s < n; s++) {
			if (accessible[s] && fst.isFinal(s)) {
				coaccessible[s] = true;
				ready.push(s);
			}
		}
		while (ready.size() > 0) {
			int t = ready.pop();
			if (preds[t] == null)
				continue;
			for (int i = 0; i < preds[t].size(); i++) {
				int s = preds[t].get(i);
				if (!coaccessible[s]) {
					coaccessible[s] = true;
					ready.push(s);
				}
			}
		}

		// phase 3: renumber and rebuild
		int[] newId = new int[n];
		int kept = 0;
		for (int s = 0; s < n; s++)
			newId[s] = (accessible[s] && coaccessible[s]) ? kept++ : Automaton.NO_STATE;
		if (debug) Debug.debug(debug, "Going from "+n+" to "+kept+" states");
		if (kept == n)
			return;
		if (newId[start] == Automaton.NO_STATE) {
			fst.deleteStates();
			return;
		}

		double[] finals = new double[kept];
		Vector<List<Arc>> arcs = new Vector<List<Arc>>();
		for (int s = 0; s < n; s++) {
			if (newId[s] == Automaton.NO_STATE)
				continue;
			finals[newId[s]] = fst.getFinal(s);
			Vector<Arc> keptArcs = new Vector<Arc>();
			for (Arc a : fst.getArcs(s)) {
				int t = newId[a.getNextState()];
				if (t == Automaton.NO_STATE)
					continue;
				keptArcs.add(new Arc(a.getILabel(), a.getOLabel(), a.getWeight(), t));
			}
			arcs.add(keptArcs);
		}
		fst.deleteStates();
		for (int s = 0; s < kept; s++) {
			fst.addState();
			fst.setFinal(s, finals[s]);
		}
		for (int s = 0; s < kept; s++)
			for (Arc a : arcs.get(s))
				fst.addArc(s, a);
		fst.setStart(newId[start]);
	}
}
