package edu.isi.wordlat;

import java.util.Arrays;

// an immutable run of non-epsilon labels. Equality is element-wise and
// order sensitive, so sequences can key a hash map.
public final class LabelSequence {
	public static final LabelSequence EMPTY = new LabelSequence(new int[0]);

	private final int[] labels;
	private int hshcode = 0;
	private boolean hashed = false;

	private LabelSequence(int[] l) {
		labels = l;
	}

	// epsilons are dropped
	public static LabelSequence of(int... l) {
		LabelSequence ret = EMPTY;
		for (int x : l)
			ret = ret.append(x);
		return ret;
	}

	/** this sequence followed by label; epsilon leaves the sequence as is */
	public LabelSequence append(int label) {
		if (label == Arc.EPSILON)
			return this;
		int[] next = Arrays.copyOf(labels, labels.length+1);
		next[labels.length] = label;
		return new LabelSequence(next);
	}

	public int size() { return labels.length; }

	public boolean equals(Object o) {
		if (o == this)
			return true;
		if (!(o instanceof LabelSequence))
			return false;
		return Arrays.equals(labels, ((LabelSequence)o).labels);
	}
	public int hashCode() {
		if (!hashed) {
			hshcode = Arrays.hashCode(labels);
			hashed = true;
		}
		return hshcode;
	}

	/** decimal labels joined by sep; "0" for the empty sequence */
	public String toString(char sep) {
		if (labels.length == 0)
			return "0";
		StringBuffer sb = new StringBuffer();
		for (int i = 0; i < labels.length; i++) {
			if (i > 0)
				sb.append(sep);
			sb.append(labels[i]);
		}
		return sb.toString();
	}
	public String toString() {
		return Arrays.toString(labels);
	}
}
