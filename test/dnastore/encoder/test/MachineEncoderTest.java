package dnastore.encoder.test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import junit.framework.TestCase;
import dnastore.decoder.BitPacker;
import dnastore.decoder.SequencesDecoder;
import dnastore.decoder.StateClosureDecoder;
import dnastore.encoder.MachineEncoder;
import dnastore.machine.Machine;
import dnastore.machine.MachineSymbols;
import dnastore.mutator.MutatorParams;
import dnastore.sequences.QualifiedSequence;
import dnastore.viterbi.InputModel;
import dnastore.viterbi.ViterbiMatrix;
import dnastore.viterbi.ViterbiSequencesDecoder;

public class MachineEncoderTest extends TestCase {

	private static Machine buildTwoBitsMachine() {
		Machine machine = new Machine();
		int s0 = machine.addState("S0");
		int a0 = machine.addState("A0");
		int a1 = machine.addState("A1");
		int end = machine.addState("END");
		machine.addTransition(s0, '0', MachineSymbols.NULL, a0);
		machine.addTransition(s0, '1', MachineSymbols.NULL, a1);
		machine.addTransition(s0, MachineSymbols.EOF, MachineSymbols.NULL, end);
		machine.addTransition(a0, '0', 'A', s0);
		machine.addTransition(a0, '1', 'C', s0);
		machine.addTransition(a1, '0', 'G', s0);
		machine.addTransition(a1, '1', 'T', s0);
		return machine;
	}

	public void testEncode() {
		MachineEncoder encoder = new MachineEncoder(buildTwoBitsMachine());
		assertEquals("CG", encoder.encode("0110$"));
		//Stops at a state waiting for input
		assertEquals("TA", encoder.encode("1100"));
	}

	public void testMissingTransition() {
		MachineEncoder encoder = new MachineEncoder(buildTwoBitsMachine());
		try {
			encoder.encode("0$");
			fail("State A0 can not consume the end of file symbol");
		} catch (IllegalArgumentException e) {
			assertTrue(e.getMessage().contains("A0"));
		}
	}

	public void testSilentCycle() {
		Machine machine = new Machine();
		int s0 = machine.addState("S0");
		int s1 = machine.addState("S1");
		machine.addTransition(s0, MachineSymbols.NULL, 'A', s1);
		machine.addTransition(s1, MachineSymbols.NULL, 'C', s0);
		try {
			new MachineEncoder(machine).encode("0");
			fail("Machine never consumes input");
		} catch (IllegalArgumentException e) {
			assertTrue(e.getMessage().contains("loops"));
		}
	}

	public void testBitString() {
		byte [] data = {1, (byte)0xF0};
		assertEquals("1000000000001111", MachineEncoder.toBitString(data, false));
		assertEquals("0000000111110000", MachineEncoder.toBitString(data, true));
	}

	public void testRoundTrip() throws IOException {
		Machine machine = buildTwoBitsMachine();
		Random random = new Random(42);
		for(boolean msb0:new boolean[] {false, true}) {
			byte [] data = new byte[50];
			random.nextBytes(data);
			String input = MachineEncoder.toBitString(data, msb0)+MachineSymbols.EOF;
			String sequence = new MachineEncoder(machine).encode(input);
			assertEquals(4*data.length, sequence.length());
			ByteArrayOutputStream out = new ByteArrayOutputStream();
			try (BitPacker packer = new BitPacker(out, msb0);
				 StateClosureDecoder decoder = new StateClosureDecoder(machine, packer)) {
				decoder.decodeString(sequence);
			}
			assertTrue(Arrays.equals(data, out.toByteArray()));
		}
	}

	public void testViterbiRoundTrip() {
		Machine machine = buildTwoBitsMachine();
		byte [] data = {(byte)0x3C, (byte)0xA5};
		String input = MachineEncoder.toBitString(data, false)+MachineSymbols.EOF;
		String sequence = new MachineEncoder(machine).encode(input);
		ViterbiMatrix matrix = new ViterbiMatrix(machine, new InputModel(), new MutatorParams(), sequence);
		assertEquals(input, matrix.traceback());
	}

	public void testDecodingPrograms() throws IOException {
		Machine machine = buildTwoBitsMachine();
		byte [] data = "DNA".getBytes();
		String sequence = new MachineEncoder(machine).encode(MachineEncoder.toBitString(data, false)+MachineSymbols.EOF);
		List<QualifiedSequence> sequences = new ArrayList<QualifiedSequence>();
		sequences.add(new QualifiedSequence("seq1", sequence));

		ByteArrayOutputStream out = new ByteArrayOutputStream();
		new SequencesDecoder().run(machine, sequences, out);
		assertEquals("DNA", out.toString());

		out = new ByteArrayOutputStream();
		ViterbiSequencesDecoder viterbi = new ViterbiSequencesDecoder();
		viterbi.setMaxDupLen(2);
		viterbi.run(machine, sequences, out);
		assertEquals("DNA", out.toString());

		out = new ByteArrayOutputStream();
		SequencesDecoder raw = new SequencesDecoder();
		raw.setRaw(true);
		raw.run(machine, sequences, out);
		assertEquals(MachineEncoder.toBitString(data, false)+"$\n", out.toString());
	}
}
