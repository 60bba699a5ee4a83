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
package dnastore.machine;

/**
 * Edge of a machine. Consumes an optional input symbol and produces an optional output symbol
 * @author DNAStore developers
 *
 */
public class MachineTransition {
	private char input;
	private char output;
	private int destination;
	private double probability = 1;

	public MachineTransition(char input, char output, int destination) {
		super();
		this.input = input;
		this.output = output;
		this.destination = destination;
	}

	public MachineTransition(char input, char output, int destination, double probability) {
		this(input, output, destination);
		setProbability(probability);
	}

	public char getInput() {
		return input;
	}

	public char getOutput() {
		return output;
	}

	public int getDestination() {
		return destination;
	}

	public double getProbability() {
		return probability;
	}

	public void setProbability(double probability) {
		if(probability<0 || probability>1) throw new IllegalArgumentException("Invalid transition probability: "+probability);
		this.probability = probability;
	}

	public boolean isInputEmpty() {
		return input == MachineSymbols.NULL;
	}

	public boolean isOutputEmpty() {
		return output == MachineSymbols.NULL;
	}

	/**
	 * @return boolean true if the input of this transition can be recovered by decoding
	 */
	public boolean isDecodable() {
		return MachineSymbols.isDecodable(input);
	}

	public String toString() {
		return MachineSymbols.toString(input)+"/"+MachineSymbols.toString(output)+" -> "+destination;
	}
}
