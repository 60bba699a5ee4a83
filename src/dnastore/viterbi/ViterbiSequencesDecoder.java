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
package dnastore.viterbi;

import java.io.ByteArrayOutputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.List;
import java.util.logging.Logger;

import dnastore.decoder.BitPacker;
import dnastore.decoder.MachineDecodingException;
import dnastore.machine.Machine;
import dnastore.machine.io.MachineFileLoader;
import dnastore.main.CommandsDescriptor;
import dnastore.mutator.MutatorParams;
import dnastore.sequences.QualifiedSequence;
import dnastore.sequences.io.FastaSequencesHandler;

/**
 * Program to find the most likely input of a machine for sequences that may carry substitutions,
 * deletions and tandem duplications
 * @author DNAStore developers
 *
 */
public class ViterbiSequencesDecoder {

	private Logger log = Logger.getLogger(ViterbiSequencesDecoder.class.getName());

	private MutatorParams mutatorParams = new MutatorParams();
	private double controlProb = InputModel.DEF_CONTROL_PROB;
	private String outputFile = null;
	private boolean raw = false;
	private boolean msb0 = false;

	public static void main(String[] args) throws Exception {
		ViterbiSequencesDecoder instance = new ViterbiSequencesDecoder();
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

	public MutatorParams getMutatorParams() {
		return mutatorParams;
	}

	public void setMutatorParams(MutatorParams mutatorParams) {
		this.mutatorParams = mutatorParams;
	}

	public void setMaxDupLen(int maxDupLen) {
		mutatorParams.setMaxDupLen(maxDupLen);
	}

	public void setMaxDupLen(Integer maxDupLen) {
		this.setMaxDupLen(maxDupLen.intValue());
	}

	public void setPTanDup(double pTanDup) {
		mutatorParams.setPTanDup(pTanDup);
	}

	public void setPTanDup(Double pTanDup) {
		this.setPTanDup(pTanDup.doubleValue());
	}

	public void setPDelOpen(double pDelOpen) {
		mutatorParams.setPDelOpen(pDelOpen);
	}

	public void setPDelOpen(Double pDelOpen) {
		this.setPDelOpen(pDelOpen.doubleValue());
	}

	public void setPDelExtend(double pDelExtend) {
		mutatorParams.setPDelExtend(pDelExtend);
	}

	public void setPDelExtend(Double pDelExtend) {
		this.setPDelExtend(pDelExtend.doubleValue());
	}

	public void setSubstitutionProbability(double pSub) {
		mutatorParams.setSubstitutionProbability(pSub);
	}

	public void setSubstitutionProbability(Double pSub) {
		this.setSubstitutionProbability(pSub.doubleValue());
	}

	/**
	 * @return double Total prior probability of the control symbols
	 */
	public double getControlProb() {
		return controlProb;
	}

	public void setControlProb(double controlProb) {
		this.controlProb = controlProb;
	}

	public void setControlProb(Double controlProb) {
		this.setControlProb(controlProb.doubleValue());
	}

	public String getOutputFile() {
		return outputFile;
	}

	public void setOutputFile(String outputFile) {
		this.outputFile = outputFile;
	}

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
		mutatorParams.validate();
		InputModel inputModel = new InputModel(machine, controlProb);
		for(QualifiedSequence seq:sequences) {
			ViterbiMatrix matrix = new ViterbiMatrix(machine, inputModel, mutatorParams, seq.getCharacters());
			log.info("Sequence "+seq.getName()+" of length "+seq.getLength()+". Log likelihood of the best path: "+matrix.getLoglike());
			String input;
			try {
				input = matrix.traceback();
			} catch (MachineDecodingException e) {
				log.severe("Can not decode sequence "+seq.getName()+". "+e.getMessage());
				throw e;
			}
			byte [] decoded = pack(input);
			out.write(decoded);
			if(raw) out.write('\n');
		}
		out.flush();
	}

	private byte [] pack(String input) throws IOException {
		ByteArrayOutputStream decoded = new ByteArrayOutputStream();
		try (OutputStream sink = raw?decoded:new BitPacker(decoded, msb0)) {
			for(int i=0;i<input.length();i++) sink.write(input.charAt(i));
		}
		return decoded.toByteArray();
	}
}
