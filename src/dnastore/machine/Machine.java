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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Finite state transducer mapping input symbols to DNA bases.
 * States are identified by their index. The first state added is the start state
 * @author DNAStore developers
 *
 */
public class Machine {
	private List<MachineState> states = new ArrayList<MachineState>();
	private Map<String,Integer> statesByName = new HashMap<String, Integer>();

	/**
	 * Adds a new state
	 * @param name Unique name of the state
	 * @return int Index of the new state
	 */
	public int addState(String name) {
		if(statesByName.containsKey(name)) throw new IllegalArgumentException("Duplicated state name: "+name);
		int index = states.size();
		states.add(new MachineState(name));
		statesByName.put(name, index);
		return index;
	}

	public MachineTransition addTransition(int source, char input, char output, int destination) {
		return addTransition(source, input, output, destination, 1);
	}

	public MachineTransition addTransition(int source, char input, char output, int destination, double probability) {
		checkStateIndex(source);
		checkStateIndex(destination);
		MachineTransition t = new MachineTransition(input, output, destination, probability);
		states.get(source).addTransition(t);
		return t;
	}

	private void checkStateIndex(int index) {
		if(index<0 || index>=states.size()) throw new IllegalArgumentException("Invalid state index: "+index+". Number of states: "+states.size());
	}

	public int getNumStates() {
		return states.size();
	}

	public MachineState getState(int index) {
		return states.get(index);
	}

	/**
	 * @param name of the state
	 * @return int index of the state with the given name or -1 if the state does not exist
	 */
	public int getStateIndex(String name) {
		Integer idx = statesByName.get(name);
		if(idx == null) return -1;
		return idx;
	}

	public int getStartState() {
		if(states.isEmpty()) throw new IllegalStateException("The machine does not have states");
		return 0;
	}

	/**
	 * @return String sorted input symbols of decodable transitions, excluding the empty symbol
	 */
	public String getInputAlphabet() {
		TreeSet<Character> alphabet = new TreeSet<Character>();
		for(MachineState state:states) {
			for(MachineTransition t:state.getTransitions()) {
				if(t.isDecodable() && !t.isInputEmpty()) alphabet.add(t.getInput());
			}
		}
		return toString(alphabet);
	}

	/**
	 * @return String sorted output symbols, excluding the empty symbol
	 */
	public String getOutputAlphabet() {
		TreeSet<Character> alphabet = new TreeSet<Character>();
		for(MachineState state:states) {
			for(MachineTransition t:state.getTransitions()) {
				if(!t.isOutputEmpty()) alphabet.add(t.getOutput());
			}
		}
		return toString(alphabet);
	}

	private String toString(TreeSet<Character> alphabet) {
		StringBuilder answer = new StringBuilder();
		for(char c:alphabet) answer.append(c);
		return answer.toString();
	}

	/**
	 * @return boolean true if any decodable transition consumes the end of file symbol
	 */
	public boolean hasEOFTransition() {
		return getInputAlphabet().indexOf(MachineSymbols.EOF)>=0;
	}
}
