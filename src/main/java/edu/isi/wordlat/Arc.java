package edu.isi.wordlat;

// a transition: labels on both sides, a weight, and the state it leads to.
// The source state is implicit (the state the arc is stored under).
public class Arc {
	// label 0 on either side means no symbol
	public static final int EPSILON = 0;

	private final int ilabel;
	private final int olabel;
	private final double weight;
	private final int nextstate;

	public Arc(int ilabel, int olabel, double weight, int nextstate) {
		this.ilabel = ilabel;
		this.olabel = olabel;
		this.weight = weight;
		this.nextstate = nextstate;
	}
	public int getILabel() { return ilabel; }
	public int getOLabel() { return olabel; }
	public double getWeight() { return weight; }
	public int getNextState() { return nextstate; }

	// the label that the given side looks at
	public int getLabel(MatchSide side) {
		return side == MatchSide.INPUT ? ilabel : olabel;
	}

	public boolean equals(Object o) {
		if (!(o instanceof Arc))
			return false;
		Arc a = (Arc)o;
		return ilabel == a.ilabel && olabel == a.olabel &&
			nextstate == a.nextstate &&
			Double.compare(weight, a.weight) == 0;
	}
	public int hashCode() {
		int hsh = ilabel;
		hsh = 31*hsh + olabel;
		hsh = 31*hsh + nextstate;
		hsh = 31*hsh + Double.hashCode(weight);
		return hsh;
	}
	public String toString() {
		return "-"+ilabel+":"+olabel+"/"+weight+"-> "+nextstate;
	}
}
