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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Node of a machine
 * @author DNAStore developers
 *
 */
public class MachineState {
	private String name;
	private List<MachineTransition> transitions = new ArrayList<MachineTransition>();

	public MachineState(String name) {
		super();
		this.name = name;
	}

	public String getName() {
		return name;
	}

	public List<MachineTransition> getTransitions() {
		return Collections.unmodifiableList(transitions);
	}

	void addTransition(MachineTransition transition) {
		transitions.add(transition);
	}

	/**
	 * @return boolean true if no transition leaves this state
	 */
	public boolean isEnd() {
		return transitions.isEmpty();
	}

	/**
	 * @return boolean true if at least one transition leaving this state produces an output symbol
	 */
	public boolean emitsOutput() {
		for(MachineTransition t:transitions) {
			if(!t.isOutputEmpty()) return true;
		}
		return false;
	}

	/**
	 * @return boolean true if at least one transition leaving this state consumes an input symbol
	 */
	public boolean exitsWithInput() {
		for(MachineTransition t:transitions) {
			if(!t.isInputEmpty()) return true;
		}
		return false;
	}

	public String toString() {
		return name;
	}
}
