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
package dnastore.machine.io;

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import dnastore.machine.Machine;
import dnastore.machine.MachineSymbols;

/**
 * Loads machines from text files. Each line declares either a state:
 * state &lt;name&gt;
 * or a transition:
 * trans &lt;source&gt; &lt;destination&gt; &lt;input&gt; &lt;output&gt; [probability]
 * The character '-' represents an empty input or output. Lines starting with # are comments
 * @author DNAStore developers
 *
 */
public class MachineFileLoader {
	public static final String KEYWORD_STATE = "state";
	public static final String KEYWORD_TRANSITION = "trans";

	private Logger log = Logger.getLogger(MachineFileLoader.class.getName());

	public Logger getLog() {
		return log;
	}

	public void setLog(Logger log) {
		this.log = log;
	}

	public Machine loadMachine(String filename) throws IOException {
		try (FileInputStream fis = new FileInputStream(filename)) {
			return loadMachine(fis);
		}
	}

	public Machine loadMachine(InputStream is) throws IOException {
		BufferedReader reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8));
		Machine machine = new Machine();
		//Transitions are stored until all states are declared
		List<String []> transitionLines = new ArrayList<String[]>();
		List<Integer> transitionLineNumbers = new ArrayList<Integer>();
		String line = reader.readLine();
		int lineNumber = 1;
		while(line!=null) {
			line = line.trim();
			if(line.length()>0 && !line.startsWith("#")) {
				String [] items = line.split("\\s+");
				if(KEYWORD_STATE.equals(items[0])) {
					if(items.length<2) throw new IOException("Missing state name at line "+lineNumber+": "+line);
					try {
						machine.addState(items[1]);
					} catch (IllegalArgumentException e) {
						throw new IOException("Error at line "+lineNumber+". "+e.getMessage(),e);
					}
				} else if (KEYWORD_TRANSITION.equals(items[0])) {
					if(items.length<5) throw new IOException("Transition at line "+lineNumber+" must have source, destination, input and output. Line: "+line);
					transitionLines.add(items);
					transitionLineNumbers.add(lineNumber);
				} else {
					throw new IOException("Unrecognized keyword "+items[0]+" at line "+lineNumber);
				}
			}
			line = reader.readLine();
			lineNumber++;
		}
		for(int i=0;i<transitionLines.size();i++) {
			addTransition(machine, transitionLines.get(i), transitionLineNumbers.get(i));
		}
		log.info("Loaded machine with "+machine.getNumStates()+" states. Input alphabet: "+machine.getInputAlphabet()+" output alphabet: "+machine.getOutputAlphabet());
		return machine;
	}

	private void addTransition(Machine machine, String [] items, int lineNumber) throws IOException {
		int source = machine.getStateIndex(items[1]);
		if(source<0) throw new IOException("Unknown source state "+items[1]+" at line "+lineNumber);
		int destination = machine.getStateIndex(items[2]);
		if(destination<0) throw new IOException("Unknown destination state "+items[2]+" at line "+lineNumber);
		try {
			char input = MachineSymbols.parse(items[3]);
			char output = Character.toUpperCase(MachineSymbols.parse(items[4]));
			double probability = 1;
			if(items.length>5) probability = Double.parseDouble(items[5]);
			machine.addTransition(source, input, output, destination, probability);
		} catch (IllegalArgumentException e) {
			throw new IOException("Invalid transition at line "+lineNumber+". "+e.getMessage(),e);
		}
	}
}
