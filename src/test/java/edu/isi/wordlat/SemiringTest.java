package edu.isi.wordlat;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SemiringTest {

	@Test
	public void testTropical() {
		Semiring s = new TropicalSemiring();
		assertEquals(1.5, s.times(1.0, 0.5));
		assertTrue(s.isZero(s.times(2.0, s.ZERO())));
		assertEquals(3.0, s.times(s.ONE(), 3.0));
		assertTrue(s.better(1.0, 2.0));
		assertTrue(s.betteroreq(2.0, 2.0));
	}

	@Test
	public void testReal() {
		Semiring s = new RealSemiring();
		double half = s.printToInternal(0.5);
		assertEquals(0.25, s.internalToPrint(s.times(half, half)), 1e-12);
		assertTrue(s.isZero(s.printToInternal(0.0)));
		assertTrue(s.isZero(s.times(half, s.ZERO())));
		assertEquals(1.0, s.internalToPrint(s.ONE()));
		// likelier is better
		assertTrue(s.better(s.printToInternal(0.9), half));
	}
}
