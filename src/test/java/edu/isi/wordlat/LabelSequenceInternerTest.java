package edu.isi.wordlat;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class LabelSequenceInternerTest {

	@Test
	public void testEmptySequenceIsEpsilon() {
		LabelSequenceInterner interner = new LabelSequenceInterner();
		assertEquals(0, interner.intern(LabelSequence.EMPTY));
		assertEquals(0, interner.intern(LabelSequence.of()));
		assertEquals(1, interner.size());
	}

	@Test
	public void testFirstSeenOrder() {
		LabelSequenceInterner interner = new LabelSequenceInterner();
		assertEquals(1, interner.intern(LabelSequence.of(3)));
		assertEquals(2, interner.intern(LabelSequence.of(1, 2)));
		assertEquals(3, interner.intern(LabelSequence.of(2, 1)));
		assertEquals(4, interner.size());
	}

	@Test
	public void testInternIsIdempotent() {
		LabelSequenceInterner interner = new LabelSequenceInterner();
		int a = interner.intern(LabelSequence.of(5, 6, 7));
		int b = interner.intern(LabelSequence.of(5, 6, 7));
		assertEquals(a, b);
		assertEquals(2, interner.size());
		assertEquals(a, interner.lookup(LabelSequence.of(5, 6, 7)));
		assertEquals(-1, interner.lookup(LabelSequence.of(5, 6)));
	}

	@Test
	public void testEpsilonsAreNotStored() {
		LabelSequenceInterner interner = new LabelSequenceInterner();
		int a = interner.intern(LabelSequence.of(0, 4, 0, 9));
		assertEquals(a, interner.intern(LabelSequence.of(4, 9)));
		assertEquals(0, interner.intern(LabelSequence.EMPTY.append(0)));
	}

	@Test
	public void testResetReproducesIds() {
		LabelSequenceInterner interner = new LabelSequenceInterner();
		LabelSequence[] seqs = {
			LabelSequence.of(1, 2), LabelSequence.of(3), LabelSequence.of(1, 2), LabelSequence.of(4, 4, 4)
		};
		int[] first = new int[seqs.length];
		for (int i = 0; i < seqs.length; i++)
			first[i] = interner.intern(seqs[i]);
		interner.reset();
		assertEquals(1, interner.size());
		assertFalse(interner.contains(LabelSequence.of(3)));
		assertTrue(interner.contains(LabelSequence.EMPTY));
		for (int i = 0; i < seqs.length; i++)
			assertEquals(first[i], interner.intern(seqs[i]));
	}

	@Test
	public void testSequenceEquality() {
		assertEquals(LabelSequence.of(1, 2), LabelSequence.EMPTY.append(1).append(2));
		assertEquals(LabelSequence.of(1, 2).hashCode(), LabelSequence.EMPTY.append(1).append(2).hashCode());
		assertNotEquals(LabelSequence.of(1, 2), LabelSequence.of(2, 1));
		assertNotEquals(LabelSequence.of(12), LabelSequence.of(1, 2));
	}
}
