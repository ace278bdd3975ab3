package edu.isi.wordlat;

import gnu.trove.set.hash.TIntHashSet;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.Writer;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CharToWordConverterTest {

	// "ab cd" and "ef" with 3 as the space
	static final String ARCHIVE =
		"first\n"+
		"0 1 1 1 0.5\n"+
		"1 2 2 2 0.5\n"+
		"2 3 3 3 0\n"+
		"3 4 4 4 1\n"+
		"4 5 5 5 1\n"+
		"5 0\n"+
		"\n"+
		"second\n"+
		"0 1 6 6 1\n"+
		"1 2 7 7 1\n"+
		"2 0\n"+
		"\n";

	static String run(CharToWordConverter conv) throws Exception {
		LatticeReader r = new LatticeReader(new BufferedReader(new StringReader(ARCHIVE)), new TropicalSemiring());
		StringWriter w = new StringWriter();
		assertEquals(2, conv.convertAll(r, new LatticeWriter(w)));
		return w.toString();
	}

	@Test
	public void testPerLatticeSymbols() throws Exception {
		CharToWordConverter conv = new CharToWordConverter(CharToWordConverter.parseDelimiters("3"),
				Integer.MAX_VALUE, Double.POSITIVE_INFINITY, 1.0, MatchSide.OUTPUT, SymbolScope.PER_LATTICE);
		String out = run(conv);
		assertEquals(
				"first\n"+
				"0 1 1_2 1_2 1\n"+
				"1 2 3 3 0\n"+
				"2 3 4_5 4_5 2\n"+
				"3 0\n"+
				"\n"+
				"second\n"+
				"0 1 6_7 6_7 2\n"+
				"1 0\n"+
				"\n", out);
		// reset before the second lattice, so only its own word is left
		assertEquals(2, conv.getInterner().size());
		assertEquals(1, conv.getInterner().lookup(LabelSequence.of(6, 7)));
	}

	@Test
	public void testSharedSymbols() throws Exception {
		CharToWordConverter conv = new CharToWordConverter(CharToWordConverter.parseDelimiters("3"),
				Integer.MAX_VALUE, Double.POSITIVE_INFINITY, 1.0, MatchSide.OUTPUT, SymbolScope.SHARED);
		String out = run(conv);
		assertTrue(out.contains("second\n0 1 4 4 2\n"));
		StringWriter syms = new StringWriter();
		conv.writeSymbols(syms);
		String table = syms.toString();
		assertTrue(table.startsWith("0\t0\n"));
		assertTrue(table.contains("6_7\t4\n"));
		assertEquals(5, table.split("\n").length);
		assertEquals(2, conv.getNumDone());
	}

	// a destination that refuses every write
	static class BrokenWriter extends Writer {
		public void write(char[] cbuf, int off, int len) throws IOException {
			throw new IOException("disk full");
		}
		public void flush() throws IOException { }
		public void close() throws IOException { }
	}

	@Test
	public void testWriteSymbolsFailure() throws Exception {
		CharToWordConverter conv = new CharToWordConverter(CharToWordConverter.parseDelimiters("3"),
				Integer.MAX_VALUE, Double.POSITIVE_INFINITY, 1.0, MatchSide.OUTPUT, SymbolScope.SHARED);
		run(conv);
		IOException e = assertThrows(IOException.class, () -> conv.writeSymbols(new BrokenWriter()));
		assertEquals("disk full", e.getMessage());
		// the table is still there for a second attempt
		StringWriter syms = new StringWriter();
		conv.writeSymbols(syms);
		assertEquals(5, syms.toString().split("\n").length);
	}

	@Test
	public void testMaxLengthDropsLattice() throws Exception {
		CharToWordConverter conv = new CharToWordConverter(CharToWordConverter.parseDelimiters("3"),
				1, Double.POSITIVE_INFINITY, 1.0, MatchSide.OUTPUT, SymbolScope.PER_LATTICE);
		String out = run(conv);
		assertTrue(out.startsWith("first\n\nsecond\n\n"));
	}

	@Test
	public void testBeamBeforeExpansion() throws Exception {
		Automaton lat = LatticeExpanderTest.states(3);
		LatticeExpanderTest.arc(lat, 0, 1, 1, 1, 1.0);
		LatticeExpanderTest.arc(lat, 0, 1, 2, 2, 6.0);
		LatticeExpanderTest.arc(lat, 1, 2, 3, 3, 0.0);
		lat.setFinal(2, 0.0);
		CharToWordConverter conv = new CharToWordConverter(CharToWordConverter.parseDelimiters("3"),
				Integer.MAX_VALUE, 2.0, 2.0, MatchSide.OUTPUT, SymbolScope.SHARED);
		Automaton out = conv.convert("k", lat);
		// scaled by 2 the second letter is 10 worse than the first, beyond the beam
		assertEquals(1, out.getNumArcs(0));
		assertEquals(1.0, out.getArcs(0).get(0).getWeight(), 1e-12);
		assertFalse(conv.getInterner().contains(LabelSequence.of(2)));
	}

	@Test
	public void testParseDelimiters() throws Exception {
		TIntHashSet d = CharToWordConverter.parseDelimiters(" 3  4\t17 ");
		assertEquals(3, d.size());
		assertTrue(d.contains(17));
		assertEquals(0, CharToWordConverter.parseDelimiters("").size());
		assertThrows(ConfigureException.class, () -> CharToWordConverter.parseDelimiters("3 0"));
		assertThrows(ConfigureException.class, () -> CharToWordConverter.parseDelimiters("3 x"));
		assertThrows(ConfigureException.class, () -> CharToWordConverter.parseDelimiters("-2"));
	}

	@Test
	public void testBadConfiguration() {
		TIntHashSet withEps = new TIntHashSet();
		withEps.add(0);
		assertThrows(ConfigureException.class, () -> new CharToWordConverter(withEps,
				10, Double.POSITIVE_INFINITY, 1.0, MatchSide.OUTPUT, SymbolScope.SHARED));
		TIntHashSet ok = new TIntHashSet();
		ok.add(3);
		assertThrows(ConfigureException.class, () -> new CharToWordConverter(ok,
				10, Double.POSITIVE_INFINITY, 0.0, MatchSide.OUTPUT, SymbolScope.SHARED));
		assertThrows(ConfigureException.class, () -> new CharToWordConverter(ok,
				-1, Double.POSITIVE_INFINITY, 1.0, MatchSide.OUTPUT, SymbolScope.SHARED));
		assertThrows(ConfigureException.class, () -> new CharToWordConverter(ok,
				10, -1.0, 1.0, MatchSide.OUTPUT, SymbolScope.SHARED));
	}
}
