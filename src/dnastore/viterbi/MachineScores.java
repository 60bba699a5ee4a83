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
import java.util.LinkedList;
import java.util.List;

import dnastore.machine.Machine;
import dnastore.machine.MachineSymbols;
import dnastore.machine.MachineTransition;
import dnastore.math.LogMath;

/**
 * Precalculated scores of the decodable transitions of a machine, indexed by state
 * @author DNAStore developers
 *
 */
public class MachineScores {
	private List<StateScores> stateScores;
	private List<TransitionScore> transitions = new ArrayList<TransitionScore>();

	/**
	 * Builds the scores of the given machine
	 * @param machine to score
	 * @param inputModel Prior probabilities of the input symbols
	 * @param maxContextLength Maximum number of bases kept in the left context of each state
	 */
	public MachineScores(Machine machine, InputModel inputModel, int maxContextLength) {
		int n = machine.getNumStates();
		stateScores = new ArrayList<StateScores>(n);
		for(int i=0;i<n;i++) stateScores.add(new StateScores());
		for(int src=0;src<n;src++) {
			for(MachineTransition t:machine.getState(src).getTransitions()) {
				if(!t.isDecodable()) continue;
				double score = LogMath.log(t.getProbability());
				if(!t.isInputEmpty()) score = LogMath.logProduct(score, inputModel.getLogProbability(t.getInput()));
				TransitionScore ts = new TransitionScore(transitions.size(), src, t.getDestination(), score, t.getInput(), t.getOutput());
				transitions.add(ts);
				stateScores.get(src).addOutgoing(ts);
				stateScores.get(t.getDestination()).addIncoming(ts);
			}
		}
		calculateLeftContexts(machine.getStartState(), maxContextLength);
	}

	/**
	 * Calculates for each state the longest suffix shared by the bases emitted on every path reaching the state
	 * @param start state
	 * @param maxLength Maximum length of the contexts
	 */
	private void calculateLeftContexts(int start, int maxLength) {
		String [] contexts = new String[stateScores.size()];
		contexts[start] = "";
		LinkedList<Integer> agenda = new LinkedList<Integer>();
		agenda.add(start);
		while(agenda.size()>0) {
			int state = agenda.removeFirst();
			String context = contexts[state];
			StateScores ss = stateScores.get(state);
			List<TransitionScore> outgoing = new ArrayList<TransitionScore>(ss.getNullOut());
			outgoing.addAll(ss.getEmitOut());
			for(TransitionScore t:outgoing) {
				int dest = t.getDestination();
				String candidate = context;
				if(t.getBase()!=MachineSymbols.NULL) candidate+=t.getBase();
				if(candidate.length()>maxLength) candidate = candidate.substring(candidate.length()-maxLength);
				String updated = (contexts[dest]==null)?candidate:commonSuffix(contexts[dest], candidate);
				if(!updated.equals(contexts[dest])) {
					contexts[dest] = updated;
					agenda.add(dest);
				}
			}
		}
		for(int i=0;i<contexts.length;i++) {
			if(contexts[i]!=null) stateScores.get(i).setLeftContext(contexts[i]);
		}
	}

	private static String commonSuffix(String s1, String s2) {
		int l = 0;
		while(l<s1.length() && l<s2.length() && s1.charAt(s1.length()-1-l)==s2.charAt(s2.length()-1-l)) l++;
		return s1.substring(s1.length()-l);
	}

	public int getNumStates() {
		return stateScores.size();
	}

	public StateScores getStateScores(int state) {
		return stateScores.get(state);
	}

	/**
	 * @return List<TransitionScore> Scores of every decodable transition sorted by id
	 */
	public List<TransitionScore> getTransitions() {
		return Collections.unmodifiableList(transitions);
	}
}
