package dnastore.viterbi.test;

import java.util.List;

import junit.framework.TestCase;
import dnastore.decoder.MachineDecodingException;
import dnastore.machine.Machine;
import dnastore.machine.MachineSymbols;
import dnastore.math.LogMath;
import dnastore.mutator.MutatorParams;
import dnastore.viterbi.InputModel;
import dnastore.viterbi.ViterbiMatrix;
import dnastore.viterbi.ViterbiMatrix.MutationType;
import dnastore.viterbi.ViterbiMatrix.Step;

public class ViterbiMatrixTest extends TestCase {
	private static final double TOLERANCE = 0.0000001;

	private static Machine buildOneBitMachine() {
		Machine machine = new Machine();
		int s0 = machine.addState("S0");
		int end = machine.addState("END");
		machine.addTransition(s0, '0', 'A', s0, 0.45);
		machine.addTransition(s0, '1', 'C', s0, 0.45);
		machine.addTransition(s0, MachineSymbols.EOF, 'T', end, 0.1);
		return machine;
	}

	private static MutatorParams buildNoiselessParams() {
		MutatorParams params = new MutatorParams();
		params.setPDelOpen(0);
		params.setPTanDup(0);
		params.setSubstitutionProbability(0);
		return params;
	}

	public void testNoiseless() {
		ViterbiMatrix matrix = new ViterbiMatrix(buildOneBitMachine(), new InputModel(), buildNoiselessParams(), "ACCAT");
		double expected = 4*Math.log(0.45)+Math.log(0.1);
		assertEquals(expected, matrix.getLoglike(), TOLERANCE);
		assertEquals("0110$", matrix.traceback());
		List<Step> path = matrix.getTracebackPath();
		assertEquals(6, path.size());
		for(int i=0;i<path.size();i++) {
			assertEquals(i, path.get(i).getPosition());
			assertEquals(MutationType.PLAIN, path.get(i).getType());
		}
		assertEquals(1, path.get(5).getState());
	}

	public void testNoPath() {
		ViterbiMatrix matrix = new ViterbiMatrix(buildOneBitMachine(), new InputModel(), buildNoiselessParams(), "AG");
		assertTrue(LogMath.isZero(matrix.getLoglike()));
		try {
			matrix.traceback();
			fail("Sequence can not be produced without mutations");
		} catch (MachineDecodingException e) {
			assertEquals(MachineDecodingException.Type.NO_USABLE_TRANSITION, e.getType());
		}
	}

	public void testDeletion() {
		Machine machine = new Machine();
		int s0 = machine.addState("S0");
		int z0 = machine.addState("Z0");
		int z1 = machine.addState("Z1");
		int end = machine.addState("END");
		machine.addTransition(s0, '0', 'A', z0, 0.45);
		machine.addTransition(s0, '1', 'C', z1, 0.45);
		machine.addTransition(s0, MachineSymbols.EOF, 'T', end, 0.1);
		machine.addTransition(z0, MachineSymbols.NULL, 'A', s0);
		machine.addTransition(z1, MachineSymbols.NULL, 'C', s0);
		MutatorParams params = new MutatorParams();
		params.setPDelOpen(0.001);
		params.setSubstitutionProbability(0.001);
		params.setPTanDup(0.05);
		params.setMaxDupLen(2);
		//Produced sequence is AACCT
		ViterbiMatrix matrix = new ViterbiMatrix(machine, new InputModel(), params, "ACCT");
		assertEquals("01$", matrix.traceback());
		boolean deletion = false;
		for(Step step:matrix.getTracebackPath()) {
			if(step.getType()==MutationType.DELETION) deletion = true;
		}
		assertTrue(deletion);
		assertFalse(LogMath.isZero(matrix.getLoglike()));
	}

	public void testTandemDuplication() {
		Machine machine = new Machine();
		int s0 = machine.addState("S0");
		int s1 = machine.addState("S1");
		int s2 = machine.addState("S2");
		int e = machine.addState("E");
		machine.addTransition(s0, MachineSymbols.NULL, 'A', s1);
		machine.addTransition(s1, MachineSymbols.NULL, 'C', s2);
		machine.addTransition(s2, '0', 'G', e);
		machine.addTransition(s2, '1', 'T', e);
		MutatorParams params = new MutatorParams();
		params.setMaxDupLen(2);
		params.setPTanDup(0.05);
		params.setPDelOpen(0.001);
		params.setSubstitutionProbability(0.001);
		//Produced sequence is ACG
		ViterbiMatrix matrix = new ViterbiMatrix(machine, new InputModel(), params, "ACACG");
		assertEquals("0", matrix.traceback());
		List<Step> path = matrix.getTracebackPath();
		int duplicated = 0;
		for(Step step:path) {
			if(step.getType()!=MutationType.TANDEM_REPEAT) continue;
			assertEquals(s2, step.getState());
			String context = matrix.getMachineScores().getStateScores(step.getState()).getLeftContext();
			assertTrue(step.getDuplicationOffset()<context.length());
			duplicated++;
		}
		assertEquals(2, duplicated);
		Step first = null;
		Step second = null;
		for(Step step:path) {
			if(step.getType()!=MutationType.TANDEM_REPEAT) continue;
			if(first==null) first = step;
			else second = step;
		}
		assertEquals(1, first.getDuplicationOffset());
		assertEquals(3, first.getPosition());
		assertEquals(0, second.getDuplicationOffset());
		assertEquals(4, second.getPosition());
		double noGap = Math.log(1-0.001-0.05);
		double match = Math.log(0.999);
		double expected = 3*(noGap+match)+Math.log(0.05)+Math.log(0.5)+2*match;
		assertEquals(expected, matrix.getLoglike(), TOLERANCE);
	}

	public void testTieBreakPrefersFirstEndState() {
		Machine machine = new Machine();
		int s0 = machine.addState("S0");
		int e1 = machine.addState("E1");
		int e2 = machine.addState("E2");
		machine.addTransition(s0, '0', 'A', e1);
		machine.addTransition(s0, '1', 'A', e2);
		ViterbiMatrix matrix = new ViterbiMatrix(machine, new InputModel(), new MutatorParams(), "A");
		assertEquals("0", matrix.traceback());
		List<Step> path = matrix.getTracebackPath();
		assertEquals(e1, path.get(path.size()-1).getState());
	}

	public void testTieBreakPrefersPlainOverDeletion() {
		Machine machine = new Machine();
		int s0 = machine.addState("S0");
		int m = machine.addState("M");
		int e = machine.addState("E");
		machine.addTransition(s0, '0', 'A', e, 0.25);
		machine.addTransition(s0, '1', 'A', m, 0.5);
		machine.addTransition(m, MachineSymbols.NULL, 'C', e);
		MutatorParams params = new MutatorParams();
		params.setPDelOpen(0.5);
		params.setPTanDup(0);
		params.setSubstitutionProbability(0);
		//Reading A from S0 to E scores the same as reading A to M and then deleting C
		ViterbiMatrix matrix = new ViterbiMatrix(machine, new InputModel(), params, "A");
		double expected = 3*Math.log(0.5);
		assertEquals(expected, matrix.getSCell(e, 1), TOLERANCE);
		assertEquals(matrix.getSCell(e, 1), matrix.getDCell(e, 1), 0);
		assertEquals(matrix.getSCell(e, 1), matrix.getLoglike(), 0);
		assertEquals("0", matrix.traceback());
		List<Step> path = matrix.getTracebackPath();
		assertEquals(2, path.size());
		Step last = path.get(1);
		assertEquals(e, last.getState());
		assertEquals(MutationType.PLAIN, last.getType());
	}

	public void testTieBreakKeepsFirstOfferedTransition() {
		Machine machine = new Machine();
		int s0 = machine.addState("S0");
		int e = machine.addState("E");
		machine.addTransition(s0, '1', 'A', e, 0.5);
		machine.addTransition(s0, '0', 'A', e, 0.5);
		ViterbiMatrix matrix = new ViterbiMatrix(machine, new InputModel(), buildNoiselessParams(), "A");
		//Equal scores do not replace the transition offered first
		assertEquals("1", matrix.traceback());
		assertEquals(Math.log(0.5), matrix.getLoglike(), TOLERANCE);
	}

	public void testCyclicSilentTransitions() {
		Machine machine = new Machine();
		int s0 = machine.addState("S0");
		int s1 = machine.addState("S1");
		int end = machine.addState("END");
		machine.addTransition(s0, MachineSymbols.NULL, MachineSymbols.NULL, s1, 0.5);
		machine.addTransition(s0, '0', 'A', end, 0.5);
		machine.addTransition(s1, MachineSymbols.NULL, MachineSymbols.NULL, s0, 0.5);
		machine.addTransition(s1, '1', 'C', end, 0.5);
		ViterbiMatrix matrix = new ViterbiMatrix(machine, new InputModel(), buildNoiselessParams(), "C");
		assertEquals("1", matrix.traceback());
		assertEquals(Math.log(0.25), matrix.getLoglike(), TOLERANCE);
		assertEquals(Math.log(0.5), matrix.getSCell(s1, 0), TOLERANCE);
		assertEquals(0.0, matrix.getSCell(s0, 0), TOLERANCE);
		assertTrue(LogMath.isZero(matrix.getDCell(s1, 0)));
	}

	public void testInputModelChangesDecision() {
		Machine machine = new Machine();
		int s0 = machine.addState("S0");
		int e = machine.addState("E");
		machine.addTransition(s0, '0', 'A', e);
		machine.addTransition(s0, 'B', 'C', e);
		MutatorParams params = new MutatorParams();
		params.setSubstitutionProbability(0.3);
		//Observed G is equally distant from A and C. The prior favors the bit
		ViterbiMatrix matrix = new ViterbiMatrix(machine, new InputModel(machine, 0.01), params, "G");
		assertEquals("0", matrix.traceback());
		matrix = new ViterbiMatrix(machine, new InputModel(machine, 0.99), params, "G");
		assertEquals("B", matrix.traceback());
	}

	public void testEmptySequence() {
		Machine machine = new Machine();
		int s0 = machine.addState("S0");
		int e = machine.addState("E");
		machine.addTransition(s0, MachineSymbols.EOF, MachineSymbols.NULL, e);
		ViterbiMatrix matrix = new ViterbiMatrix(machine, new InputModel(), new MutatorParams(), "");
		assertEquals("$", matrix.traceback());
		assertEquals(0.0, matrix.getLoglike(), TOLERANCE);
	}
}
