package edu.isi.wordlat;

import gnu.trove.iterator.TObjectIntIterator;
import gnu.trove.map.hash.TObjectIntHashMap;

import java.io.StringWriter;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SymbolTableBuilderTest {

	// hands the builder whatever entries it is given
	private static class RiggedInterner extends LabelSequenceInterner {
		private TObjectIntHashMap<LabelSequence> entries = new TObjectIntHashMap<LabelSequence>();
		RiggedInterner put(LabelSequence s, int id) {
			entries.put(s, id);
			return this;
		}
		public int size() { return entries.size(); }
		public TObjectIntIterator<LabelSequence> iterator() { return entries.iterator(); }
	}

	@Test
	public void testNames() throws Exception {
		LabelSequenceInterner interner = new LabelSequenceInterner();
		interner.intern(LabelSequence.of(3));
		interner.intern(LabelSequence.of(1, 2));
		interner.intern(LabelSequence.of(10, 200, 3));
		SymbolTable table = SymbolTableBuilder.build(interner);
		assertEquals(4, table.size());
		assertEquals("0", table.find(0));
		assertEquals("3", table.find(1));
		assertEquals("1_2", table.find(2));
		assertEquals("10_200_3", table.find(3));
		assertEquals(2, table.find("1_2"));
	}

	@Test
	public void testAscendingText() throws Exception {
		LabelSequenceInterner interner = new LabelSequenceInterner();
		interner.intern(LabelSequence.of(7, 8));
		interner.intern(LabelSequence.of(9));
		StringWriter w = new StringWriter();
		SymbolTableBuilder.build(interner).writeText(w);
		assertEquals("0\t0\n7_8\t1\n9\t2\n", w.toString());
	}

	@Test
	public void testSharedIdFails() {
		RiggedInterner interner = new RiggedInterner()
			.put(LabelSequence.EMPTY, 0)
			.put(LabelSequence.of(1), 1)
			.put(LabelSequence.of(2), 1);
		assertThrows(UnexpectedCaseException.class, () -> SymbolTableBuilder.build(interner));
	}

	@Test
	public void testMissingIdFails() {
		RiggedInterner interner = new RiggedInterner()
			.put(LabelSequence.EMPTY, 0)
			.put(LabelSequence.of(1), 2);
		assertThrows(UnexpectedCaseException.class, () -> SymbolTableBuilder.build(interner));
	}

	@Test
	public void testAddSymbolKeepsExistingKey() {
		SymbolTable table = new SymbolTable();
		assertEquals(4, table.addSymbol("a", 4));
		assertEquals(4, table.addSymbol("a", 5));
		assertNull(table.find(5));
		assertThrows(IllegalArgumentException.class, () -> table.addSymbol("b", 4));
	}
}
