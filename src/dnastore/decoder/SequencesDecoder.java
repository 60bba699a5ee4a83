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
package dnastore.decoder;

import java.io.ByteArrayOutputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.List;
import java.util.logging.Logger;

import dnastore.machine.Machine;
import dnastore.machine.io.MachineFileLoader;
import dnastore.main.CommandsDescriptor;
import dnastore.sequences.QualifiedSequence;
import dnastore.sequences.io.FastaSequencesHandler;

/**
 * Program to decode sequences that were produced by a machine and were not mutated
 * @author DNAStore developers
 *
 */
public class SequencesDecoder {

	private Logger log = Logger.getLogger(SequencesDecoder.class.getName());

	private String outputFile = null;
	private boolean raw = false;
	private boolean msb0 = false;

	public static void main(String[] args) throws Exception {
		SequencesDecoder instance = new SequencesDecoder();
		int i = CommandsDescriptor.getInstance().loadOptions(instance, args);
		String machineFile = args[i++];
		String sequencesFile = args[i++];
		instance.run(machineFile, sequencesFile);
	}

	public Logger getLog() {
		return log;
	}

	public void setLog(Logger log) {
		this.log = log;
	}

	public String getOutputFile() {
		return outputFile;
	}

	public void setOutputFile(String outputFile) {
		this.outputFile = outputFile;
	}

	/**
	 * @return boolean true if decoded symbols are written without packing bits into bytes
	 */
	public boolean isRaw() {
		return raw;
	}

	public void setRaw(boolean raw) {
		this.raw = raw;
	}

	public void setRaw(Boolean raw) {
		this.setRaw(raw.booleanValue());
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

	public void run(String machineFile, String sequencesFile) throws IOException {
		MachineFileLoader loader = new MachineFileLoader();
		loader.setLog(log);
		Machine machine = loader.loadMachine(machineFile);
		List<QualifiedSequence> sequences = new FastaSequencesHandler().loadSequences(sequencesFile);
		log.info("Loaded "+sequences.size()+" sequences from "+sequencesFile);
		if(outputFile!=null) {
			try (OutputStream out = new FileOutputStream(outputFile)) {
				run(machine, sequences, out);
			}
		} else {
			run(machine, sequences, System.out);
		}
	}

	public void run(Machine machine, List<QualifiedSequence> sequences, OutputStream out) throws IOException {
		for(QualifiedSequence seq:sequences) {
			byte [] decoded;
			try {
				decoded = decode(machine, seq.getCharacters());
			} catch (MachineDecodingException e) {
				log.severe("Can not decode sequence "+seq.getName()+". "+e.getMessage());
				throw e;
			}
			out.write(decoded);
			if(raw) out.write('\n');
			log.info("Decoded sequence "+seq.getName()+" of length "+seq.getLength()+" into "+decoded.length+(raw?" symbols":" bytes"));
		}
		out.flush();
	}

	/**
	 * Decodes one sequence
	 * @param machine that produced the sequence
	 * @param sequence Observed symbols
	 * @return byte [] decoded bytes, or decoded symbols if the raw mode is active
	 * @throws IOException If the decoded data can not be written
	 */
	public byte [] decode(Machine machine, CharSequence sequence) throws IOException {
		ByteArrayOutputStream decoded = new ByteArrayOutputStream();
		try (OutputStream sink = raw?decoded:new BitPacker(decoded, msb0);
			 StateClosureDecoder decoder = new StateClosureDecoder(machine, sink)) {
			decoder.decodeString(sequence);
		}
		return decoded.toByteArray();
	}
}
