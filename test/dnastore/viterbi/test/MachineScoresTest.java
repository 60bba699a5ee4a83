package dnastore.viterbi.test;

import java.util.List;

import junit.framework.TestCase;
import dnastore.machine.Machine;
import dnastore.machine.MachineSymbols;
import dnastore.viterbi.InputModel;
import dnastore.viterbi.MachineScores;
import dnastore.viterbi.StateScores;
import dnastore.viterbi.TransitionScore;

public class MachineScoresTest extends TestCase {
	private static final double TOLERANCE = 0.0000001;

	private Machine buildMachine() {
		Machine machine = new Machine();
		int s0 = machine.addState("S0");
		int s1 = machine.addState("S1");
		int s2 = machine.addState("S2");
		int e = machine.addState("E");
		machine.addTransition(s0, MachineSymbols.NULL, 'A', s1);
		machine.addTransition(s1, MachineSymbols.NULL, 'C', s2);
		machine.addTransition(s2, '0', 'G', e, 0.25);
		machine.addTransition(s2, '1', 'T', e, 0.75);
		machine.addTransition(s2, 'x', 'A', e);
		return machine;
	}

	public void testLeftContexts() {
		MachineScores scores = new MachineScores(buildMachine(), new InputModel(), 4);
		assertEquals("", scores.getStateScores(0).getLeftContext());
		assertEquals("A", scores.getStateScores(1).getLeftContext());
		assertEquals("AC", scores.getStateScores(2).getLeftContext());
		assertEquals('C', scores.getStateScores(2).getTanDupBase(0));
		assertEquals('A', scores.getStateScores(2).getTanDupBase(1));
		//Paths reaching E end with different bases
		assertEquals("", scores.getStateScores(3).getLeftContext());
	}

	public void testLeftContextsAreCapped() {
		MachineScores scores = new MachineScores(buildMachine(), new InputModel(), 1);
		assertEquals("C", scores.getStateScores(2).getLeftContext());
	}

	public void testLeftContextOfCycle() {
		Machine machine = new Machine();
		int s0 = machine.addState("S0");
		int s1 = machine.addState("S1");
		machine.addTransition(s0, '0', 'A', s1);
		machine.addTransition(s1, MachineSymbols.NULL, 'A', s0);
		machine.addTransition(s1, MachineSymbols.NULL, MachineSymbols.NULL, s0);
		MachineScores scores = new MachineScores(machine, new InputModel(), 3);
		assertEquals("", scores.getStateScores(0).getLeftContext());
		assertEquals("A", scores.getStateScores(1).getLeftContext());
	}

	public void testTransitionScores() {
		InputModel model = new InputModel("01", 0.01);
		MachineScores scores = new MachineScores(buildMachine(), model, 4);
		List<TransitionScore> transitions = scores.getTransitions();
		//Transition with undecodable input is excluded
		assertEquals(4, transitions.size());
		assertEquals(4, scores.getNumStates());
		TransitionScore t = transitions.get(2);
		assertEquals(2, t.getId());
		assertEquals(2, t.getSource());
		assertEquals(3, t.getDestination());
		assertEquals('0', t.getInput());
		assertEquals('G', t.getBase());
		assertEquals(Math.log(0.25)+Math.log(0.5), t.getScore(), TOLERANCE);
		//Transitions without input do not pay the prior
		assertEquals(0.0, transitions.get(0).getScore(), TOLERANCE);

		StateScores e = scores.getStateScores(3);
		assertEquals(2, e.getEmit().size());
		assertEquals(0, e.getNullTransitions().size());
		StateScores s2 = scores.getStateScores(2);
		assertEquals(2, s2.getEmitOut().size());
		assertEquals(0, s2.getNullOut().size());
	}
}
