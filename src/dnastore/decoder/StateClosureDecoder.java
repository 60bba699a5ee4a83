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

import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Logger;

import dnastore.machine.Machine;
import dnastore.machine.MachineState;
import dnastore.machine.MachineSymbols;
import dnastore.machine.MachineTransition;

/**
 * Inverts a machine on a stream of observed output symbols, assuming that the symbols were not mutated.
 * The decoder keeps every state consistent with the symbols observed so far, together with the input
 * symbols read along the path to that state. Input symbols are written to the output stream as soon
 * as all candidate states agree on them
 * @author DNAStore developers
 *
 */
public class StateClosureDecoder implements Closeable {

	private Logger log = Logger.getLogger(StateClosureDecoder.class.getName());

	private Machine machine;
	private OutputStream out;
	//Input queue of each live state. Replaced as a whole at each decoding step
	private TreeMap<Integer,String> current = new TreeMap<Integer, String>();
	//Set after a decoding error. No further input symbols are written
	private boolean failed = false;

	public StateClosureDecoder(Machine machine, OutputStream out) {
		this.machine = machine;
		this.out = out;
		current.put(machine.getStartState(), "");
		expand();
	}

	public Logger getLog() {
		return log;
	}

	public void setLog(Logger log) {
		this.log = log;
	}

	/**
	 * @return List<DecoderHypothesis> Snapshot of the current candidate states sorted by state index
	 */
	public List<DecoderHypothesis> getHypotheses() {
		List<DecoderHypothesis> answer = new ArrayList<DecoderHypothesis>();
		for(Map.Entry<Integer, String> entry:current.entrySet()) {
			answer.add(buildHypothesis(entry.getKey(), entry.getValue()));
		}
		return answer;
	}

	private DecoderHypothesis buildHypothesis(int state, String queue) {
		return new DecoderHypothesis(state, machine.getState(state).getName(), queue);
	}

	/**
	 * Follows transitions with empty output from every live state until no new state is found.
	 * Only states that emit output or that are end states are kept after the expansion
	 * @throws MachineDecodingException If a state is reachable with two different input queues
	 */
	public void expand() {
		try {
			expandClosure();
		} catch (MachineDecodingException e) {
			failed = true;
			throw e;
		}
	}

	private void expandClosure() {
		Map<Integer,String> seen = new TreeMap<Integer, String>();
		boolean foundNew;
		do {
			foundNew = false;
			TreeMap<Integer,String> next = new TreeMap<Integer, String>();
			for(Map.Entry<Integer, String> entry:current.entrySet()) {
				int state = entry.getKey();
				seen.putIfAbsent(state, entry.getValue());
				MachineState ms = machine.getState(state);
				if(ms.isEnd() || ms.emitsOutput()) next.put(state, entry.getValue());
			}
			Map<Integer,String> discovered = new TreeMap<Integer, String>();
			for(Map.Entry<Integer, String> entry:current.entrySet()) {
				int state = entry.getKey();
				String queue = entry.getValue();
				for(MachineTransition t:machine.getState(state).getTransitions()) {
					if(!t.isDecodable() || !t.isOutputEmpty()) continue;
					int dest = t.getDestination();
					String nextQueue = t.isInputEmpty()?queue:queue+t.getInput();
					String previous = seen.get(dest);
					if(previous == null) previous = discovered.get(dest);
					if(previous!=null) {
						if(!previous.equals(nextQueue)) throw new MachineDecodingException(MachineDecodingException.Type.NON_DETERMINISTIC_MACHINE, machine.getState(dest).getName(), t.getInput(), "Decoder error: state "+machine.getState(dest).getName()+" has two possible input queues ("+previous+", "+nextQueue+")");
						continue;
					}
					discovered.put(dest, nextQueue);
					next.put(dest, nextQueue);
					log.finer("Transition "+machine.getState(state).getName()+" -> "+machine.getState(dest).getName()+(nextQueue.isEmpty()?"":": input queue "+nextQueue));
					foundNew = true;
				}
			}
			current = next;
		} while (foundNew);
	}

	/**
	 * Decodes the given observed symbol
	 * @param outputSymbol Symbol produced by the machine
	 * @throws IOException If decoded input symbols can not be written
	 * @throws MachineDecodingException If the symbol can not be produced from any live state or if the machine is not deterministic
	 */
	public void decodeSymbol(char outputSymbol) throws IOException {
		if(failed) throw new IllegalStateException("Decoder stopped after a decoding error");
		try {
			processSymbol(outputSymbol);
		} catch (MachineDecodingException e) {
			failed = true;
			throw e;
		}
	}

	/**
	 * @return boolean true if decoding stopped because of a decoding error
	 */
	public boolean isFailed() {
		return failed;
	}

	private void processSymbol(char outputSymbol) throws IOException {
		log.finer("Decoding "+outputSymbol);
		TreeMap<Integer,String> next = new TreeMap<Integer, String>();
		for(Map.Entry<Integer, String> entry:current.entrySet()) {
			int state = entry.getKey();
			String queue = entry.getValue();
			for(MachineTransition t:machine.getState(state).getTransitions()) {
				if(!t.isDecodable() || t.getOutput()!=outputSymbol) continue;
				int nextState = t.getDestination();
				String nextQueue = t.isInputEmpty()?queue:queue+t.getInput();
				String previous = next.get(nextState);
				if(previous!=null && !previous.equals(nextQueue)) {
					throw new MachineDecodingException(MachineDecodingException.Type.NON_DETERMINISTIC_MACHINE, machine.getState(nextState).getName(), outputSymbol, "Decoder error: state "+machine.getState(nextState).getName()+" has two possible input queues ("+previous+", "+nextQueue+")");
				}
				next.put(nextState, nextQueue);
				log.finer("Transition "+machine.getState(state).getName()+" -> "+machine.getState(nextState).getName()+": "+(nextQueue.isEmpty()?"":"input queue "+nextQueue+", ")+"output "+outputSymbol);
			}
		}
		if(next.isEmpty()) {
			throw new MachineDecodingException(MachineDecodingException.Type.NO_USABLE_TRANSITION, null, outputSymbol, "Can not decode symbol '"+outputSymbol+"' from states "+getStateNames());
		}
		current = next;
		expand();
		if(current.size()==1 && machine.getState(current.firstKey()).exitsWithInput()) {
			flush(current.firstKey());
		} else {
			shiftResolvedSymbols();
		}
	}

	private String getStateNames() {
		StringBuilder names = new StringBuilder();
		for(int state:current.keySet()) {
			if(names.length()>0) names.append(",");
			names.append(machine.getState(state).getName());
		}
		return names.toString();
	}

	/**
	 * Decodes every symbol of the given sequence. Symbols are converted to upper case
	 * @param sequence Observed symbols
	 * @throws IOException If decoded input symbols can not be written
	 */
	public void decodeString(CharSequence sequence) throws IOException {
		for(int i=0;i<sequence.length();i++) {
			decodeSymbol(Character.toUpperCase(sequence.charAt(i)));
		}
	}

	private void flush(int state) throws IOException {
		String queue = current.get(state);
		if(queue.length()>0) {
			log.fine("Flushing input queue: "+queue);
			write(queue);
			current.put(state, "");
		}
	}

	private void write(CharSequence symbols) throws IOException {
		for(int i=0;i<symbols.length();i++) {
			out.write(symbols.charAt(i));
		}
	}

	/**
	 * Writes input symbols while every live state has the same first symbol in its input queue
	 * @throws IOException If symbols can not be written
	 */
	private void shiftResolvedSymbols() throws IOException {
		while(!current.isEmpty()) {
			char firstSymbol = MachineSymbols.NULL;
			boolean agree = true;
			for(String queue:current.values()) {
				if(queue.isEmpty()) {
					agree = false;
					break;
				}
				if(firstSymbol == MachineSymbols.NULL) firstSymbol = queue.charAt(0);
				else if (firstSymbol != queue.charAt(0)) {
					agree = false;
					break;
				}
			}
			if(!agree) break;
			log.finer("All input queues have '"+firstSymbol+"' as first symbol; shifting");
			out.write(firstSymbol);
			for(Map.Entry<Integer, String> entry:current.entrySet()) {
				entry.setValue(entry.getValue().substring(1));
			}
		}
	}

	/**
	 * Writes the input queue of the state reached at the end of the stream. If the decoded state
	 * is not unique, the candidates are reported as warnings and the decoder is cleared anyway.
	 * After a decoding error the pending input queues are discarded without being written.
	 * Further calls have no effect
	 * @return List<DecoderHypothesis> Candidates that could not be resolved. Empty if decoding finished in a unique state
	 * @throws IOException If the input queue can not be written
	 */
	public List<DecoderHypothesis> finish() throws IOException {
		List<DecoderHypothesis> unresolved = new ArrayList<DecoderHypothesis>();
		if(current.isEmpty()) return unresolved;
		if(failed) {
			log.warning("Decoding failed. Discarding input queues of "+current.size()+" states");
			current.clear();
			out.flush();
			return unresolved;
		}
		expand();
		List<Integer> endStates = new ArrayList<Integer>();
		for(int state:current.keySet()) {
			if(machine.getState(state).isEnd()) endStates.add(state);
		}
		if(endStates.size()==1) {
			flush(endStates.get(0));
		} else if (endStates.size()>1) {
			log.warning("Decoder unresolved: "+endStates.size()+" possible end states");
			for(int state:endStates) unresolved.add(buildHypothesis(state, current.get(state)));
		} else if (current.size()>1) {
			log.warning("Decoder unresolved: "+current.size()+" possible states");
			unresolved.addAll(getHypotheses());
		}
		for(DecoderHypothesis h:unresolved) log.warning(h.toString());
		current.clear();
		out.flush();
		return unresolved;
	}

	@Override
	public void close() throws IOException {
		finish();
	}
}
