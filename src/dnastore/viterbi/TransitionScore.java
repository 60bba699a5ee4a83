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

/**
 * Transition of a machine annotated with its log probability
 * @author DNAStore developers
 *
 */
public class TransitionScore {
	private int id;
	private int source;
	private int destination;
	private double score;
	private char input;
	private char base;

	public TransitionScore(int id, int source, int destination, double score, char input, char base) {
		super();
		this.id = id;
		this.source = source;
		this.destination = destination;
		this.score = score;
		this.input = input;
		this.base = base;
	}

	/**
	 * @return int Unique id of the transition within the machine scores
	 */
	public int getId() {
		return id;
	}

	public int getSource() {
		return source;
	}

	public int getDestination() {
		return destination;
	}

	/**
	 * @return double log probability of the transition including the prior of its input symbol
	 */
	public double getScore() {
		return score;
	}

	public char getInput() {
		return input;
	}

	/**
	 * @return char Base emitted by the transition. MachineSymbols.NULL if the transition is silent
	 */
	public char getBase() {
		return base;
	}
}
