package dnastore.machine.test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import junit.framework.TestCase;
import dnastore.machine.Machine;
import dnastore.machine.MachineState;
import dnastore.machine.MachineSymbols;
import dnastore.machine.MachineTransition;
import dnastore.machine.io.MachineFileLoader;

public class MachineFileLoaderTest extends TestCase {

	private Machine load(String text) throws IOException {
		return new MachineFileLoader().loadMachine(new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)));
	}

	public void testLoadMachine() throws IOException {
		String text = "# Two bits per base\n"
				+ "state S0\n"
				+ "state A0\n"
				+ "trans S0 A0 0 -\n"
				+ "trans A0 S0 1 c 0.5\n"
				+ "\n"
				+ "trans S0 END $ -\n"
				+ "state END\n";
		Machine machine = load(text);
		assertEquals(3, machine.getNumStates());
		assertEquals(0, machine.getStartState());
		assertEquals("S0", machine.getState(0).getName());
		assertEquals(2, machine.getStateIndex("END"));
		assertEquals(-1, machine.getStateIndex("A1"));

		MachineState s0 = machine.getState(0);
		assertEquals(2, s0.getTransitions().size());
		MachineTransition t = s0.getTransitions().get(0);
		assertEquals('0', t.getInput());
		assertEquals(MachineSymbols.NULL, t.getOutput());
		assertEquals(1, t.getDestination());
		assertEquals(1.0, t.getProbability(), 0.000001);
		assertTrue(s0.exitsWithInput());
		assertFalse(s0.emitsOutput());

		MachineTransition t2 = machine.getState(1).getTransitions().get(0);
		assertEquals('C', t2.getOutput());
		assertEquals(0.5, t2.getProbability(), 0.000001);
		assertTrue(machine.getState(2).isEnd());

		assertEquals("$01", machine.getInputAlphabet());
		assertEquals("C", machine.getOutputAlphabet());
		assertTrue(machine.hasEOFTransition());
	}

	public void testUTF8StateNames() throws IOException {
		Machine machine = load("state Se\u00f1al\nstate Fin\u00e9\ntrans Se\u00f1al Fin\u00e9 0 A\n");
		assertEquals("Se\u00f1al", machine.getState(0).getName());
		assertEquals(1, machine.getStateIndex("Fin\u00e9"));
	}

	public void testUnknownState() {
		try {
			load("state S0\ntrans S0 X 0 A\n");
			fail("Transition to undeclared state should fail");
		} catch (IOException e) {
			assertTrue(e.getMessage().contains("line 2"));
		}
	}

	public void testUnknownKeyword() {
		try {
			load("state S0\nedge S0 S0 0 A\n");
			fail("Unknown keyword should fail");
		} catch (IOException e) {
			assertTrue(e.getMessage().contains("edge"));
		}
	}

	public void testInvalidProbability() {
		try {
			load("state S0\nstate E\ntrans S0 E 0 A 1.5\n");
			fail("Probability above one should fail");
		} catch (IOException e) {
			assertTrue(e.getMessage().contains("line 3"));
		}
	}

	public void testDuplicatedState() {
		try {
			load("state S0\nstate S0\n");
			fail("Duplicated state should fail");
		} catch (IOException e) {
			assertTrue(e.getMessage().contains("S0"));
		}
	}

	public void testUndecodableInputs() {
		Machine machine = new Machine();
		int s0 = machine.addState("S0");
		int e = machine.addState("E");
		machine.addTransition(s0, 'x', 'A', e);
		machine.addTransition(s0, 'B', 'C', e);
		assertFalse(machine.getState(s0).getTransitions().get(0).isDecodable());
		assertTrue(machine.getState(s0).getTransitions().get(1).isDecodable());
		assertEquals("B", machine.getInputAlphabet());
		assertFalse(machine.hasEOFTransition());
		assertTrue(MachineSymbols.isControl('B'));
		assertEquals(1, MachineSymbols.controlIndex('B'));
		assertEquals('Z', MachineSymbols.controlSymbol(25));
	}
}
