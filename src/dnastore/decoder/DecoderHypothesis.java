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

/**
 * Candidate state of the decoder together with the input symbols read but not yet written
 * @author DNAStore developers
 *
 */
public class DecoderHypothesis {
	private int state;
	private String stateName;
	private String inputQueue;

	public DecoderHypothesis(int state, String stateName, String inputQueue) {
		super();
		this.state = state;
		this.stateName = stateName;
		this.inputQueue = inputQueue;
	}

	public int getState() {
		return state;
	}

	public String getStateName() {
		return stateName;
	}

	public String getInputQueue() {
		return inputQueue;
	}

	public String toString() {
		return "State "+stateName+": input queue "+(inputQueue.isEmpty()?"empty":inputQueue);
	}
}
