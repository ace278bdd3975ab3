package edu.isi.wordlat;

import org.junit.jupiter.api.Test;

import static edu.isi.wordlat.LatticeExpanderTest.arc;
import static edu.isi.wordlat.LatticeExpanderTest.states;
import static org.junit.jupiter.api.Assertions.*;

public class ConnectTest {

	@Test
	public void testRemovesUnreachableAndDeadEnds() {
		// 0 -> 1 -> 3 (final); 0 -> 2 is a dead end; 4 -> 3 is unreachable
		Automaton fst = states(5);
		arc(fst, 0, 1, 1, 1, 0.0);
		arc(fst, 1, 3, 2, 2, 0.0);
		arc(fst, 0, 2, 3, 3, 0.0);
		arc(fst, 4, 3, 4, 4, 0.0);
		fst.setFinal(3, 0.5);
		Connect.connect(fst);

		assertEquals(3, fst.getNumStates());
		assertEquals(0, fst.getStart());
		// survivors keep their order: 0, 1, 3 -> 0, 1, 2
		assertEquals(1, fst.getNumArcs(0));
		assertEquals(1, fst.getArcs(0).get(0).getNextState());
		assertEquals(2, fst.getArcs(1).get(0).getNextState());
		assertEquals(0.5, fst.getFinal(2));
	}

	@Test
	public void testRenumbersStart() {
		Automaton fst = states(3);
		fst.setStart(2);
		arc(fst, 2, 1, 1, 1, 0.0);
		fst.setFinal(1, 0.0);
		Connect.connect(fst);
		assertEquals(2, fst.getNumStates());
		assertEquals(1, fst.getStart());
		assertEquals(0, fst.getArcs(1).get(0).getNextState());
	}

	@Test
	public void testUselessStartEmpties() {
		Automaton fst = states(2);
		arc(fst, 0, 1, 1, 1, 0.0);
		Connect.connect(fst);
		assertEquals(0, fst.getNumStates());
		assertEquals(Automaton.NO_STATE, fst.getStart());
	}

	@Test
	public void testNoStartEmpties() {
		Automaton fst = states(2);
		fst.setFinal(1, 0.0);
		fst.setStart(Automaton.NO_STATE);
		Connect.connect(fst);
		assertEquals(0, fst.getNumStates());
	}

	@Test
	public void testCycleIsKept() {
		Automaton fst = states(2);
		arc(fst, 0, 1, 1, 1, 0.0);
		arc(fst, 1, 0, 2, 2, 0.0);
		fst.setFinal(1, 0.0);
		Connect.connect(fst);
		assertEquals(2, fst.getNumStates());
		assertEquals(1, fst.getNumArcs(1));
	}
}
