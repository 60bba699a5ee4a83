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

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedList;
import java.util.List;
import java.util.PriorityQueue;
import java.util.logging.Logger;

import dnastore.decoder.MachineDecodingException;
import dnastore.machine.Machine;
import dnastore.machine.MachineSymbols;
import dnastore.math.LogMath;
import dnastore.mutator.MutatorParams;
import dnastore.mutator.MutatorScores;

/**
 * Dynamic programming matrix to find the most likely input of a machine given a sequence
 * that was mutated after being generated by the machine. Cells are indexed by machine state, position
 * in the sequence and state of the mutation channel. The channel can be in the plain state (S), within a deletion (D)
 * or copying a base of a tandem duplication (T) at an offset from the last base emitted by the machine
 * @author DNAStore developers
 *
 */
public class ViterbiMatrix {
	public static final double SCORE_TOLERANCE = 1e-9;
	private static final int NO_CELL = -1;
	private static final int NO_TRANSITION = -1;

	public enum MutationType {
		PLAIN, DELETION, TANDEM_REPEAT
	}

	private Logger log = Logger.getLogger(ViterbiMatrix.class.getName());

	private Machine machine;
	private String seq;
	private MachineScores machineScores;
	private MutatorScores mutatorScores;
	private int maxDupLen;
	private int nStates;
	private int seqLen;

	private double [] cell;
	//Predecessor cell and transition id of the best path reaching each cell
	private int [] backCell;
	private int [] backTransition;

	private double loglike = LogMath.LOG_ZERO;
	private int finalCell = NO_CELL;

	/**
	 * Fills the matrix for the given sequence
	 * @param machine generating the sequence before mutation
	 * @param inputModel Prior probabilities of the input symbols
	 * @param mutatorParams Parameters of the mutation channel
	 * @param sequence Observed sequence
	 */
	public ViterbiMatrix(Machine machine, InputModel inputModel, MutatorParams mutatorParams, CharSequence sequence) {
		this.machine = machine;
		this.seq = sequence.toString().toUpperCase();
		this.mutatorScores = new MutatorScores(mutatorParams);
		this.maxDupLen = mutatorParams.getMaxDupLen();
		this.machineScores = new MachineScores(machine, inputModel, maxDupLen);
		this.nStates = machine.getNumStates();
		this.seqLen = seq.length();
		long nCells = (long)(maxDupLen+2)*nStates*(seqLen+1);
		if(nCells>Integer.MAX_VALUE-8) throw new IllegalArgumentException("Viterbi matrix too large. States: "+nStates+" sequence length: "+seqLen+" maximum duplication length: "+maxDupLen);
		log.fine("Creating Viterbi matrix with "+nCells+" cells");
		cell = new double[(int)nCells];
		backCell = new int[(int)nCells];
		backTransition = new int[(int)nCells];
		Arrays.fill(cell, LogMath.LOG_ZERO);
		Arrays.fill(backCell, NO_CELL);
		Arrays.fill(backTransition, NO_TRANSITION);
		fill();
		findFinalCell();
	}

	public Logger getLog() {
		return log;
	}

	public void setLog(Logger log) {
		this.log = log;
	}

	public MachineScores getMachineScores() {
		return machineScores;
	}

	/**
	 * @return double natural logarithm of the probability of the best path explaining the sequence.
	 * Negative infinity if the sequence can not be explained
	 */
	public double getLoglike() {
		return loglike;
	}

	private int sMutStateIndex() {
		return 0;
	}

	private int dMutStateIndex() {
		return 1;
	}

	private int tMutStateIndex(int dupIdx) {
		return 2+dupIdx;
	}

	private int cellIndex(int state, int pos, int mutState) {
		return (maxDupLen+2)*(pos*nStates+state)+mutState;
	}

	private int sCellIndex(int state, int pos) {
		return cellIndex(state, pos, sMutStateIndex());
	}

	private int dCellIndex(int state, int pos) {
		return cellIndex(state, pos, dMutStateIndex());
	}

	private int tCellIndex(int state, int pos, int dupIdx) {
		return cellIndex(state, pos, tMutStateIndex(dupIdx));
	}

	private int getMutState(int index) {
		return index%(maxDupLen+2);
	}

	private int getState(int index) {
		return (index/(maxDupLen+2))%nStates;
	}

	private int getPosition(int index) {
		return (index/(maxDupLen+2))/nStates;
	}

	public double getSCell(int state, int pos) {
		return cell[sCellIndex(state, pos)];
	}

	public double getDCell(int state, int pos) {
		return cell[dCellIndex(state, pos)];
	}

	public double getTCell(int state, int pos, int dupIdx) {
		return cell[tCellIndex(state, pos, dupIdx)];
	}

	/**
	 * @param ss Scores of a state
	 * @return int Number of duplication offsets allowed at the state
	 */
	public int getMaxDupLenAt(StateScores ss) {
		return Math.min(maxDupLen, ss.getLeftContext().length());
	}

	private void fill() {
		cell[sCellIndex(machine.getStartState(), 0)] = 0;
		for(int pos=0;pos<=seqLen;pos++) {
			if(pos>0) fillFromPreviousPosition(pos);
			fillWithinPosition(pos);
		}
	}

	/**
	 * Fills the cells of the given position that depend only on cells of the previous position,
	 * plus the plain cells reached at the end of a duplication
	 * @param pos Position to fill
	 */
	private void fillFromPreviousPosition(int pos) {
		for(int s=0;s<nStates;s++) {
			StateScores ss = machineScores.getStateScores(s);
			int maxDupAt = getMaxDupLenAt(ss);
			for(int k=0;k<maxDupAt;k++) {
				int target = tCellIndex(s, pos, k);
				offer(target, sCellIndex(s, pos-1), NO_TRANSITION);
				if(k+1<maxDupAt) offer(target, tCellIndex(s, pos-1, k+1), NO_TRANSITION);
			}
			int sTarget = sCellIndex(s, pos);
			for(TransitionScore t:ss.getEmit()) {
				offer(sTarget, sCellIndex(t.getSource(), pos-1), t.getId());
				offer(sTarget, dCellIndex(t.getSource(), pos-1), t.getId());
			}
			if(maxDupAt>0) offer(sTarget, tCellIndex(s, pos, 0), NO_TRANSITION);
		}
	}

	/**
	 * Propagates scores through transitions that do not consume observed symbols. Plain and deletion cells are
	 * finalized from the best to the worst score so that every cell is final before it is used at the same position
	 * @param pos Position to fill
	 */
	private void fillWithinPosition(int pos) {
		boolean [] finalized = new boolean[2*nStates];
		PriorityQueue<Candidate> queue = new PriorityQueue<Candidate>();
		for(int node=0;node<finalized.length;node++) {
			double score = cell[nodeCellIndex(node, pos)];
			if(!LogMath.isZero(score)) queue.add(new Candidate(node, score));
		}
		while(!queue.isEmpty()) {
			Candidate c = queue.poll();
			int from = nodeCellIndex(c.node, pos);
			if(finalized[c.node] || c.score!=cell[from]) continue;
			finalized[c.node] = true;
			int state = c.node/2;
			boolean deletion = c.node%2==1;
			StateScores ss = machineScores.getStateScores(state);
			for(TransitionScore t:ss.getNullOut()) {
				relax(finalized, queue, 2*t.getDestination()+(deletion?1:0), pos, from, t.getId());
			}
			for(TransitionScore t:ss.getEmitOut()) {
				relax(finalized, queue, 2*t.getDestination()+1, pos, from, t.getId());
			}
		}
	}

	private int nodeCellIndex(int node, int pos) {
		int state = node/2;
		if(node%2==1) return dCellIndex(state, pos);
		return sCellIndex(state, pos);
	}

	private void relax(boolean [] finalized, PriorityQueue<Candidate> queue, int node, int pos, int from, int transitionId) {
		if(finalized[node]) return;
		int target = nodeCellIndex(node, pos);
		if(offer(target, from, transitionId)) queue.add(new Candidate(node, cell[target]));
	}

	/**
	 * Updates the target cell if the path through the given predecessor is strictly better than the current score
	 * @param target Cell to update
	 * @param pred Predecessor cell
	 * @param transitionId Transition of the machine followed. NO_TRANSITION if the machine does not move
	 * @return boolean true if the target cell was updated
	 */
	private boolean offer(int target, int pred, int transitionId) {
		double predScore = cell[pred];
		if(LogMath.isZero(predScore)) return false;
		double score = LogMath.logProduct(predScore, calculateIncrement(target, pred, transitionId));
		if(score>cell[target]) {
			cell[target] = score;
			backCell[target] = pred;
			backTransition[target] = transitionId;
			return true;
		}
		return false;
	}

	/**
	 * Calculates the log probability of moving from the predecessor cell to the target cell.
	 * Shared by the fill and the traceback
	 * @param target Cell reached
	 * @param pred Predecessor cell
	 * @param transitionId Transition of the machine followed. NO_TRANSITION if the machine does not move
	 * @return double log probability of the move
	 */
	private double calculateIncrement(int target, int pred, int transitionId) {
		int targetMut = getMutState(target);
		int predMut = getMutState(pred);
		int pos = getPosition(target);
		boolean consumes = getPosition(pred)<pos;
		if(targetMut>=tMutStateIndex(0)) {
			int dupIdx = targetMut-tMutStateIndex(0);
			StateScores ss = machineScores.getStateScores(getState(target));
			double sub = mutatorScores.getSub(ss.getTanDupBase(dupIdx), seq.charAt(pos-1));
			if(predMut==sMutStateIndex()) return LogMath.logProduct(mutatorScores.getTanDup(), mutatorScores.getLenTanDup(dupIdx), sub);
			return sub;
		}
		if(transitionId==NO_TRANSITION) {
			//End of a duplication
			return 0;
		}
		TransitionScore t = machineScores.getTransitions().get(transitionId);
		if(targetMut==sMutStateIndex()) {
			if(!consumes) return t.getScore();
			double sub = mutatorScores.getSub(t.getBase(), seq.charAt(pos-1));
			double gap = (predMut==sMutStateIndex())?mutatorScores.getNoGap():mutatorScores.getDelEnd();
			return LogMath.logProduct(gap, t.getScore(), sub);
		}
		if(t.getBase()==MachineSymbols.NULL) return t.getScore();
		double gap = (predMut==sMutStateIndex())?mutatorScores.getDelOpen():mutatorScores.getDelExtend();
		return LogMath.logProduct(gap, t.getScore());
	}

	/**
	 * Finds the best cell at the end of the sequence. Ties are broken in favor of the end state with the smallest index,
	 * then plain over deletion over duplication cells, then the smallest duplication offset
	 */
	private void findFinalCell() {
		for(int s=0;s<nStates;s++) {
			if(!machine.getState(s).isEnd()) continue;
			int nMutStates = tMutStateIndex(getMaxDupLenAt(machineScores.getStateScores(s)));
			for(int m=0;m<nMutStates;m++) {
				int idx = cellIndex(s, seqLen, m);
				if(cell[idx]>loglike) {
					loglike = cell[idx];
					finalCell = idx;
				}
			}
		}
		log.fine("Log likelihood of the best path: "+loglike);
	}

	/**
	 * Recovers the cells visited by the best path explaining the sequence
	 * @return List<Step> Cells of the best path in forward order, starting with the start state at position zero
	 * @throws MachineDecodingException If no path explains the sequence or if a cell of the path does not have a valid predecessor
	 */
	public List<Step> getTracebackPath() {
		if(finalCell == NO_CELL) {
			throw new MachineDecodingException(MachineDecodingException.Type.NO_USABLE_TRANSITION, null, MachineSymbols.NULL, "No path of the machine can generate the sequence "+seq);
		}
		LinkedList<Step> path = new LinkedList<Step>();
		int startCell = sCellIndex(machine.getStartState(), 0);
		int idx = finalCell;
		while(idx!=startCell) {
			int pred = backCell[idx];
			String stateName = machine.getState(getState(idx)).getName();
			if(pred == NO_CELL) {
				throw new MachineDecodingException(MachineDecodingException.Type.MISSING_PREDECESSOR_SCORE, stateName, MachineSymbols.NULL, "Cell for state "+stateName+" at position "+getPosition(idx)+" does not have a predecessor");
			}
			int transitionId = backTransition[idx];
			double expected = LogMath.logProduct(cell[pred], calculateIncrement(idx, pred, transitionId));
			if(!LogMath.equals(expected, cell[idx], SCORE_TOLERANCE)) {
				throw new MachineDecodingException(MachineDecodingException.Type.MISSING_PREDECESSOR_SCORE, stateName, MachineSymbols.NULL, "Unexpected score error for state "+stateName+" at position "+getPosition(idx)+". Stored: "+cell[idx]+" recalculated: "+expected);
			}
			char input = MachineSymbols.NULL;
			if(transitionId!=NO_TRANSITION) input = machineScores.getTransitions().get(transitionId).getInput();
			path.addFirst(buildStep(idx, input));
			idx = pred;
		}
		path.addFirst(buildStep(startCell, MachineSymbols.NULL));
		return Collections.unmodifiableList(path);
	}

	private Step buildStep(int idx, char input) {
		int mut = getMutState(idx);
		MutationType type = MutationType.TANDEM_REPEAT;
		int offset = 0;
		if(mut==sMutStateIndex()) type = MutationType.PLAIN;
		else if (mut==dMutStateIndex()) type = MutationType.DELETION;
		else offset = mut-tMutStateIndex(0);
		return new Step(getState(idx), getPosition(idx), type, offset, input);
	}

	/**
	 * @return String input symbols consumed along the best path
	 */
	public String traceback() {
		StringBuilder answer = new StringBuilder();
		for(Step step:getTracebackPath()) {
			if(step.getInput()!=MachineSymbols.NULL) answer.append(step.getInput());
		}
		return answer.toString();
	}

	/**
	 * Cell visited by a traceback
	 */
	public static class Step {
		private int state;
		private int position;
		private MutationType type;
		private int duplicationOffset;
		private char input;

		public Step(int state, int position, MutationType type, int duplicationOffset, char input) {
			this.state = state;
			this.position = position;
			this.type = type;
			this.duplicationOffset = duplicationOffset;
			this.input = input;
		}

		public int getState() {
			return state;
		}

		/**
		 * @return int Number of observed symbols explained up to this cell
		 */
		public int getPosition() {
			return position;
		}

		public MutationType getType() {
			return type;
		}

		public int getDuplicationOffset() {
			return duplicationOffset;
		}

		/**
		 * @return char input symbol consumed by the move reaching this cell
		 */
		public char getInput() {
			return input;
		}
	}

	private static class Candidate implements Comparable<Candidate> {
		private int node;
		private double score;

		public Candidate(int node, double score) {
			this.node = node;
			this.score = score;
		}

		@Override
		public int compareTo(Candidate o) {
			if(score!=o.score) return score>o.score?-1:1;
			return node-o.node;
		}
	}
}
