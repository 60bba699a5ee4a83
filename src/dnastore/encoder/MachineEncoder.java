/*******************************************************************************
 * DNAStore - Transducer based codec for DNA data storage
 * Copyright 2026 The DNAStore developers
 *
 * This file is part of DNAStore.
 *
 *     DNAStore is free software: you can redistribute it and/or modify
 *     it under the terms of the GNU General Public License as published by
 *     the Free Software Foundation, either version 3 of the License, or
 *     (at your option) any later version.
 *
 *     DNAStore is distributed in the hope that it will be useful,
 *     but WITHOUT ANY WARRANTY; without even the implied warranty of
 *     MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *     GNU General Public License for more details.
 *
 *     You should have received a copy of the GNU General Public License
 *     along with DNAStore.  If not, see <http://www.gnu.org/licenses/>.
 *******************************************************************************/
package dnastore.encoder;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import dnastore.machine.Machine;
import dnastore.machine.MachineState;
import dnastore.machine.MachineSymbols;
import dnastore.machine.MachineTransition;
import dnastore.machine.io.MachineFileLoader;
import dnastore.main.CommandsDescriptor;
import dnastore.sequences.QualifiedSequence;
import dnastore.sequences.io.FastaSequencesHandler;

/**
 * Program to encode binary data as a DNA sequence following the transitions of a machine
 * @author DNAStore developers
 *
 */
public class MachineEncoder {

	public static final String DEF_SEQUENCE_NAME = "encoded";

	private Logger log = Logger.getLogger(MachineEncoder.class.getName());

	private Machine machine;
	private String outputFile = null;
	private String sequenceName = DEF_SEQUENCE_NAME;
	private boolean msb0 = false;

	public MachineEncoder() {

	}

	public MachineEncoder(Machine machine) {
		this.machine = machine;
	}

	public static void main(String[] args) throws Exception {
		MachineEncoder instance = new MachineEncoder();
		int i = CommandsDescriptor.getInstance().loadOptions(instance, args);
		String machineFile = args[i++];
		String inputFile = args[i++];
		instance.run(machineFile, inputFile);
	}

	public Logger getLog() {
		return log;
	}

	public void setLog(Logger log) {
		this.log = log;
	}

	public Machine getMachine() {
		return machine;
	}

	public void setMachine(Machine machine) {
		this.machine = machine;
	}

	public String getOutputFile() {
		return outputFile;
	}

	public void setOutputFile(String outputFile) {
		this.outputFile = outputFile;
	}

	public String getSequenceName() {
		return sequenceName;
	}

	public void setSequenceName(String sequenceName) {
		this.sequenceName = sequenceName;
	}

	public boolean isMsb0() {
		return msb0;
	}

	public void setMsb0(boolean msb0) {
		this.msb0 = msb0;
	}

	public void setMsb0(Boolean msb0) {
		this.setMsb0(msb0.booleanValue());
	}

	public void run(String machineFile, String inputFile) throws IOException {
		MachineFileLoader loader = new MachineFileLoader();
		loader.setLog(log);
		machine = loader.loadMachine(machineFile);
		byte [] data = Files.readAllBytes(Paths.get(inputFile));
		log.info("Loaded "+data.length+" bytes from "+inputFile);
		String input = toBitString(data, msb0);
		if(machine.hasEOFTransition()) input+=MachineSymbols.EOF;
		String sequence = encode(input);
		log.info("Encoded "+input.length()+" input symbols as a sequence of length "+sequence.length());
		List<QualifiedSequence> sequences = new ArrayList<QualifiedSequence>();
		sequences.add(new QualifiedSequence(sequenceName, sequence));
		FastaSequencesHandler handler = new FastaSequencesHandler();
		if(outputFile!=null) {
			try (PrintStream out = new PrintStream(new FileOutputStream(outputFile), false, StandardCharsets.UTF_8)) {
				handler.saveSequences(sequences, out, FastaSequencesHandler.DEF_LINE_LENGTH);
			}
		} else {
			handler.saveSequences(sequences, System.out, FastaSequencesHandler.DEF_LINE_LENGTH);
			System.out.flush();
		}
	}

	/**
	 * Follows the machine from the start state consuming the given input symbols.
	 * States with input transitions consume the next symbol. Other states follow their first decodable transition
	 * @param input Symbols to encode
	 * @return String Output symbols produced along the path
	 * @throws IllegalArgumentException If a symbol can not be consumed or the machine loops without consuming input
	 */
	public String encode(CharSequence input) {
		StringBuilder output = new StringBuilder();
		int state = machine.getStartState();
		int i = 0;
		int silentSteps = 0;
		while(true) {
			MachineState ms = machine.getState(state);
			if(ms.isEnd()) break;
			MachineTransition next = null;
			if(ms.exitsWithInput()) {
				if(i==input.length()) break;
				char symbol = input.charAt(i);
				for(MachineTransition t:ms.getTransitions()) {
					if(t.isDecodable() && t.getInput()==symbol) {
						next = t;
						break;
					}
				}
				if(next==null) throw new IllegalArgumentException("State "+ms.getName()+" can not consume input symbol '"+MachineSymbols.toString(symbol)+"' at position "+i);
				i++;
				silentSteps = 0;
			} else {
				for(MachineTransition t:ms.getTransitions()) {
					if(t.isDecodable()) {
						next = t;
						break;
					}
				}
				if(next==null) throw new IllegalArgumentException("State "+ms.getName()+" does not have decodable transitions");
				silentSteps++;
				if(silentSteps>machine.getNumStates()) throw new IllegalArgumentException("Machine loops without consuming input at state "+ms.getName());
			}
			if(!next.isOutputEmpty()) output.append(next.getOutput());
			state = next.getDestination();
		}
		if(i<input.length()) log.warning("Encoding stopped at state "+machine.getState(state).getName()+". "+(input.length()-i)+" input symbols were not consumed");
		return output.toString();
	}

	/**
	 * Converts the given bytes into a string of bit symbols
	 * @param data to convert
	 * @param msb0 true if the most significant bit of each byte goes first
	 * @return String with one bit symbol per bit of the data
	 */
	public static String toBitString(byte [] data, boolean msb0) {
		StringBuilder answer = new StringBuilder(8*data.length);
		for(byte b:data) {
			for(int i=0;i<8;i++) {
				int shift = msb0?7-i:i;
				answer.append(((b>>shift)&1)==1?MachineSymbols.BIT1:MachineSymbols.BIT0);
			}
		}
		return answer.toString();
	}
}
