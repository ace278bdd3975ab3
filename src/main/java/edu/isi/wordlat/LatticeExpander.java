package edu.isi.wordlat;

import gnu.trove.set.hash.TIntHashSet;

import java.util.Stack;

/**
 * Turns a lattice over fine symbols (characters) into a lattice over coarse
 * symbols (words). Every run of arcs between two delimiter arcs becomes a
 * single arc, labelled with the interned sequence of the labels it covers
 * and weighted with the product of their weights. Delimiter arcs are kept,
 * each with its one-label sequence.
 * <p>
 * A word ends at any state that is final or that has an outgoing delimiter
 * arc; a word starts at the start state or at the target of a delimiter arc.
 * Words are found by a depth-first search from every word start, with no
 * sharing between searches from different starts. The cost therefore grows
 * with the number of distinct paths of at most maxLength labels, which can
 * be exponential in the worst case. With no delimiters every successful path
 * of the input becomes one arc. The search does not detect cycles: a cycle
 * free of delimiters must be cut off by a finite maxLength.
 */
public class LatticeExpander {

	// one partial word on the search stack
	private static class PartialWord {
		final int origin;
		final int current;
		final double weight;
		final LabelSequence ilabels;
		final LabelSequence olabels;
		PartialWord(int o, int c, double w, LabelSequence i, LabelSequence ol) {
			origin = o;
			current = c;
			weight = w;
			ilabels = i;
			olabels = ol;
		}
	}

	/**
	 * Expand ifst into a new automaton of the same semiring.
	 * @see #expand(Automaton, TIntHashSet, int, MatchSide, Automaton, LabelSequenceInterner, LabelSequenceInterner)
	 */
	public static Automaton expand(Automaton ifst, TIntHashSet delim, int maxLength, MatchSide side,
			LabelSequenceInterner imap, LabelSequenceInterner omap) {
		if (ifst == null)
			throw new IllegalArgumentException("Expansion needs a source automaton");
		Automaton ofst = new VectorAutomaton(ifst.getSemiring());
		expand(ifst, delim, maxLength, side, ofst, imap, omap);
		return ofst;
	}

	/**
	 * Expand ifst into ofst, whose previous contents are discarded. Input
	 * label sequences are interned with imap and output label sequences with
	 * omap; the two may be the same interner.
	 *
	 * @param delim delimiter labels, which must not include epsilon
	 * @param maxLength longest word, counted in non-epsilon labels on side.
	 *   Longer words are dropped, not truncated
	 * @param side which side of each arc is compared against delim
	 */
	public static void expand(Automaton ifst, TIntHashSet delim, int maxLength, MatchSide side,
			Automaton ofst, LabelSequenceInterner imap, LabelSequenceInterner omap) {
		boolean debug = false;
		if (ifst == null || ofst == null)
			throw new IllegalArgumentException("Expansion needs both a source and a destination automaton");
		if (imap == null || omap == null)
			throw new IllegalArgumentException("Expansion needs label interners");
		Semiring semiring = ifst.getSemiring();

		// the output has, at most, as many states as the input
		ofst.deleteStates();
		int n = ifst.getNumStates();
		for (int s = 0; s < n; s++)
			ofst.addState();
		int start = ifst.getStart();
		ofst.setStart(start);

		// words may begin at the start state and after any delimiter arc
		boolean[] wordStart = new boolean[n];
		if (start != Automaton.NO_STATE)
			wordStart[start] = true;

		// keep the delimiter arcs as words of their own
		for (int s = 0; s < n; s++) {
			ofst.setFinal(s, ifst.getFinal(s));
			for (Arc arc : ifst.getArcs(s)) {
				if (!delim.contains(arc.getLabel(side)))
					continue;
				int ilab = imap.intern(LabelSequence.EMPTY.append(arc.getILabel()));
				int olab = omap.intern(LabelSequence.EMPTY.append(arc.getOLabel()));
				ofst.addArc(s, new Arc(ilab, olab, arc.getWeight(), arc.getNextState()));
				wordStart[arc.getNextState()] = true;
			}
		}

		Stack<PartialWord> stack = new Stack<PartialWord>();
		for (int s = 0; s < n; s++)
			if (wordStart[s])
				stack.push(new PartialWord(s, s, semiring.ONE(), LabelSequence.EMPTY, LabelSequence.EMPTY));

		int emitted = 0;
		int popped = 0;
		while (!stack.isEmpty()) {
			PartialWord pw = stack.pop();
			popped++;
			LabelSequence matched = side == MatchSide.INPUT ? pw.ilabels : pw.olabels;
			boolean hasDelimArc = false;
			for (Arc arc : ifst.getArcs(pw.current)) {
				int matchLabel = arc.getLabel(side);
				if (delim.contains(matchLabel)) {
					hasDelimArc = true;
					continue;
				}
				int newLength = matched.size() + (matchLabel == Arc.EPSILON ? 0 : 1);
				if (newLength > maxLength)
					continue;
				stack.push(new PartialWord(pw.origin, arc.getNextState(),
						semiring.times(pw.weight, arc.getWeight()),
						pw.ilabels.append(arc.getILabel()),
						pw.olabels.append(arc.getOLabel())));
			}

			// the word ends here if a delimiter follows or the lattice may end
			if (pw.origin != pw.current && (hasDelimArc || ifst.isFinal(pw.current))) {
				int ilab = imap.intern(pw.ilabels);
				int olab = omap.intern(pw.olabels);
				ofst.addArc(pw.origin, new Arc(ilab, olab, pw.weight, pw.current));
				emitted++;
			}
		}
		if (debug) Debug.debug(debug, "Explored "+popped+" partial words, emitted "+emitted+" word arcs");

		Connect.connect(ofst);
	}
}
