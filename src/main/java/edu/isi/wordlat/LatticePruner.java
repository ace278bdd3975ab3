package edu.isi.wordlat;

import gnu.trove.list.array.TIntArrayList;
import gnu.trove.set.hash.TIntHashSet;
import gnu.trove.stack.array.TIntArrayStack;

import java.util.Vector;

// weight scaling and beam pruning of a lattice before it is expanded.
// Weights are costs (times is addition), so scaling multiplies them and the
// beam is measured in the same units.
public class LatticePruner {

	/** multiply every arc weight and every non-zero final weight by factor */
	public static void scale(Automaton fst, double factor) {
		if (factor == 1.0)
			return;
		for (int s = 0; s < fst.getNumStates(); s++) {
			Vector<Arc> scaled = new Vector<Arc>();
			for (Arc a : fst.getArcs(s))
				scaled.add(new Arc(a.getILabel(), a.getOLabel(), a.getWeight()*factor, a.getNextState()));
			fst.deleteArcs(s);
			for (Arc a : scaled)
				fst.addArc(s, a);
			if (fst.isFinal(s))
				fst.setFinal(s, fst.getFinal(s)*factor);
		}
	}

	/**
	 * Remove arcs and final weights that are only on paths costing more than
	 * beam above the best path, then connect. An infinite beam does nothing.
	 */
	public static void prune(Automaton fst, double beam) {
		boolean debug = false;
		if (Double.isInfinite(beam) && beam > 0)
			return;
		int n = fst.getNumStates();
		int start = fst.getStart();
		if (start == Automaton.NO_STATE || n == 0)
			return;
		Semiring semiring = fst.getSemiring();

		// alpha: best cost from start. beta: best cost to a final state
		double[] alpha = forward(fst);
		double[] beta = backward(fst);
		double best = beta[start];
		if (semiring.isZero(best)) {
			if (debug) Debug.debug(debug, "No successful path; emptying");
			fst.deleteStates();
			return;
		}
		double threshold = semiring.times(best, beam);
		if (debug) Debug.debug(debug, "Best path costs "+best+"; threshold is "+threshold);

		int removed = 0;
		for (int s = 0; s < n; s++) {
			if (semiring.isZero(alpha[s]))
				continue;
			Vector<Arc> kept = new Vector<Arc>();
			for (Arc a : fst.getArcs(s)) {
				double through = semiring.times(semiring.times(alpha[s], a.getWeight()), beta[a.getNextState()]);
				if (!semiring.isZero(through) && semiring.betteroreq(through, threshold))
					kept.add(a);
				else
					removed++;
			}
			if (kept.size() < fst.getNumArcs(s)) {
				fst.deleteArcs(s);
				for (Arc a : kept)
					fst.addArc(s, a);
			}
			if (fst.isFinal(s) && !semiring.betteroreq(semiring.times(alpha[s], fst.getFinal(s)), threshold))
				fst.setFinal(s, semiring.ZERO());
		}
		if (debug) Debug.debug(debug, "Pruned "+removed+" arcs");
		Connect.connect(fst);
	}

	// best cost of reaching each state from the start. A label-correcting
	// worklist, so negative costs are fine as long as there are no negative cycles.
	static double[] forward(Automaton fst) {
		Semiring semiring = fst.getSemiring();
		int n = fst.getNumStates();
		double[] dist = new double[n];
		for (int s = 0; s < n; s++)
			dist[s] = semiring.ZERO();
		int start = fst.getStart();
		if (start == Automaton.NO_STATE)
			return dist;
		dist[start] = semiring.ONE();
		TIntArrayStack ready = new TIntArrayStack();
		TIntHashSet readyList = new TIntHashSet();
		ready.push(start);
		readyList.add(start);
		while (ready.size() > 0) {
			int s = ready.pop();
			readyList.remove(s);
			for (Arc a : fst.getArcs(s)) {
				int t = a.getNextState();
				double cand = semiring.times(dist[s], a.getWeight());
				if (semiring.better(cand, dist[t])) {
					dist[t] = cand;
					if (!readyList.contains(t)) {
						ready.push(t);
						readyList.add(t);
					}
				}
			}
		}
		return dist;
	}

	// best cost of reaching a final state from each state
	static double[] backward(Automaton fst) {
		Semiring semiring = fst.getSemiring();
		int n = fst.getNumStates();
		TIntArrayList[] preds = new TIntArrayList[n];
		Vector<Vector<Arc>> predArcs = new Vector<Vector<Arc>>();
		for (int s = 0; s < n; s++)
			predArcs.add(new Vector<Arc>());
		for (int s = 0; s < n; s++) {
			for (Arc a : fst.getArcs(s)) {
				int t = a.getNextState();
				if (preds[t] == null)
					preds[t] = new TIntArrayList();
				preds[t].add(s);
				predArcs.get(t).add(a);
			}
		}
		double[] dist = new double[n];
		TIntArrayStack ready = new TIntArrayStack();
		TIntHashSet readyList = new TIntHashSet();
		for (int s = 0; s < n; s++) {
			dist[s] = fst.getFinal(s);
			if (!semiring.isZero(dist[s])) {
				ready.push(s);
				readyList.add(s);
			}
		}
		while (ready.size() > 0) {
			int t = ready.pop();
			readyList.remove(t);
			if (preds[t] == null)
				continue;
			for (int i = 0; i < preds[t].size(); i++) {
				int s = preds[t].get(i);
				double cand = semiring.times(predArcs.get(t).get(i).getWeight(), dist[t]);
				if (semiring.better(cand, dist[s])) {
					dist[s] = cand;
					if (!readyList.contains(s)) {
						ready.push(s);
						readyList.add(s);
					}
				}
			}
		}
		return dist;
	}
}
