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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import dnastore.machine.MachineSymbols;

/**
 * Scores of the transitions entering and leaving one state, plus the bases known to be emitted
 * before reaching the state
 * @author DNAStore developers
 *
 */
public class StateScores {
	private String leftContext = "";
	private List<TransitionScore> emit = new ArrayList<TransitionScore>();
	private List<TransitionScore> nullTransitions = new ArrayList<TransitionScore>();
	private List<TransitionScore> emitOut = new ArrayList<TransitionScore>();
	private List<TransitionScore> nullOut = new ArrayList<TransitionScore>();

	/**
	 * @return String Bases emitted immediately before reaching this state on every path from the start state.
	 * The last character is the most recent base
	 */
	public String getLeftContext() {
		return leftContext;
	}

	void setLeftContext(String leftContext) {
		this.leftContext = leftContext;
	}

	/**
	 * @param dupIdx Number of bases to go back from the last base
	 * @return char Base of the left context at the given offset
	 */
	public char getTanDupBase(int dupIdx) {
		return leftContext.charAt(leftContext.length()-1-dupIdx);
	}

	/**
	 * @return List<TransitionScore> Incoming transitions that emit a base
	 */
	public List<TransitionScore> getEmit() {
		return Collections.unmodifiableList(emit);
	}

	/**
	 * @return List<TransitionScore> Incoming transitions that do not emit a base
	 */
	public List<TransitionScore> getNullTransitions() {
		return Collections.unmodifiableList(nullTransitions);
	}

	public List<TransitionScore> getEmitOut() {
		return Collections.unmodifiableList(emitOut);
	}

	public List<TransitionScore> getNullOut() {
		return Collections.unmodifiableList(nullOut);
	}

	void addIncoming(TransitionScore t) {
		if(t.getBase()==MachineSymbols.NULL) nullTransitions.add(t);
		else emit.add(t);
	}

	void addOutgoing(TransitionScore t) {
		if(t.getBase()==MachineSymbols.NULL) nullOut.add(t);
		else emitOut.add(t);
	}
}
