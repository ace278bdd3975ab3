package edu.isi.wordlat;

import gnu.trove.iterator.TObjectIntIterator;
import gnu.trove.map.hash.TObjectIntHashMap;

/**
 * Gives each distinct label sequence a label of its own. Ids are handed out
 * in first-seen order; the empty sequence is always 0.
 * <p>
 * The same interner can serve many expansions (one symbol space for a whole
 * archive) or be reset between them. It does no locking: callers sharing one
 * across threads have to serialize the calls to {@link #intern}.
 */
public class LabelSequenceInterner {
	private TObjectIntHashMap<LabelSequence> ids;

	public LabelSequenceInterner() {
		ids = new TObjectIntHashMap<LabelSequence>();
		ids.put(LabelSequence.EMPTY, Arc.EPSILON);
	}

	public int intern(LabelSequence seq) {
		boolean debug = false;
		if (ids.containsKey(seq))
			return ids.get(seq);
		int id = ids.size();
		ids.put(seq, id);
		if (debug) Debug.debug(debug, seq+" -> "+id);
		return id;
	}

	/** forget everything but the empty sequence */
	public void reset() {
		ids.clear();
		ids.put(LabelSequence.EMPTY, Arc.EPSILON);
	}

	public int size() { return ids.size(); }

	public boolean contains(LabelSequence seq) {
		return ids.containsKey(seq);
	}

	// -1 if never interned
	public int lookup(LabelSequence seq) {
		return ids.containsKey(seq) ? ids.get(seq) : -1;
	}

	/** all (sequence, id) entries, in no particular order */
	public TObjectIntIterator<LabelSequence> iterator() {
		return ids.iterator();
	}
}
