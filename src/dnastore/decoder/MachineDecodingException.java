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
 * Fatal error found while decoding. Signals either a defect in the machine or
 * an observed sequence that the machine can not produce
 * @author DNAStore developers
 *
 */
public class MachineDecodingException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public enum Type {
		/**
		 * The same state is reachable with two different input queues
		 */
		NON_DETERMINISTIC_MACHINE,
		/**
		 * No live state has a usable transition explaining the observed symbol
		 */
		NO_USABLE_TRANSITION,
		/**
		 * A dynamic programming cell was used without a valid predecessor score
		 */
		MISSING_PREDECESSOR_SCORE
	}

	private Type type;
	private String stateName;
	private char symbol;

	public MachineDecodingException(Type type, String stateName, char symbol, String message) {
		super(message);
		this.type = type;
		this.stateName = stateName;
		this.symbol = symbol;
	}

	public Type getType() {
		return type;
	}

	/**
	 * @return String name of the offending state. Null if the error is not related to a single state
	 */
	public String getStateName() {
		return stateName;
	}

	/**
	 * @return char offending symbol or MachineSymbols.NULL if the error is not related to a symbol
	 */
	public char getSymbol() {
		return symbol;
	}
}
