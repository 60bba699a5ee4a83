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

import java.util.Map;
import java.util.TreeMap;

import dnastore.machine.Machine;
import dnastore.machine.MachineSymbols;
import dnastore.math.LogMath;

/**
 * Prior probabilities of the input symbols consumed by a machine
 * @author DNAStore developers
 *
 */
public class InputModel {
	public static final double DEF_CONTROL_PROB = 0.01;

	private Map<Character,Double> symProb = new TreeMap<Character, Double>();

	/**
	 * Creates an uninformative model in which every input symbol has probability one
	 */
	public InputModel() {

	}

	/**
	 * Creates a model in which control symbols share the given probability and the remaining symbols
	 * share the remaining mass
	 * @param inputAlphabet Symbols with non zero probability
	 * @param controlProb Total probability of the control symbols
	 */
	public InputModel(String inputAlphabet, double controlProb) {
		if(controlProb<0 || controlProb>1) throw new IllegalArgumentException("Invalid control probability: "+controlProb);
		int nControls = 0;
		int nOthers = 0;
		for(int i=0;i<inputAlphabet.length();i++) {
			char c = inputAlphabet.charAt(i);
			if(c==MachineSymbols.NULL || symProb.containsKey(c)) continue;
			if(MachineSymbols.isControl(c)) nControls++;
			else nOthers++;
			symProb.put(c, 0.0);
		}
		double othersMass = (nControls>0)?1-controlProb:1;
		double controlsMass = (nOthers>0)?controlProb:1;
		for(Map.Entry<Character, Double> entry:symProb.entrySet()) {
			if(MachineSymbols.isControl(entry.getKey())) entry.setValue(controlsMass/nControls);
			else entry.setValue(othersMass/nOthers);
		}
	}

	/**
	 * Creates a model from the input alphabet of the given machine
	 * @param machine whose decodable input symbols are used
	 * @param controlProb Total probability of the control symbols
	 */
	public InputModel(Machine machine, double controlProb) {
		this(machine.getInputAlphabet(), controlProb);
	}

	public boolean isUninformative() {
		return symProb.isEmpty();
	}

	/**
	 * @param symbol Input symbol
	 * @return double prior probability of the given symbol
	 */
	public double getProbability(char symbol) {
		if(isUninformative()) return 1;
		Double p = symProb.get(symbol);
		if(p==null) return 0;
		return p;
	}

	public double getLogProbability(char symbol) {
		return LogMath.log(getProbability(symbol));
	}
}
