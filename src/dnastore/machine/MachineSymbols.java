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

/**
 * Classification of the input symbols that a machine can consume.
 * Input symbols are represented as chars. Data bits, start and end of file markers
 * and control symbols can be decoded. Any other char is considered internal to the machine
 * @author DNAStore developers
 *
 */
public class MachineSymbols {
	/**
	 * Empty symbol used for silent input or output
	 */
	public static final char NULL = '\0';
	public static final char BIT0 = '0';
	public static final char BIT1 = '1';
	public static final char SOF = '^';
	public static final char EOF = '$';
	public static final char CONTROL_FIRST = 'A';
	public static final char CONTROL_LAST = 'Z';
	/**
	 * Character used in files and messages to represent the empty symbol
	 */
	public static final char EMPTY_SYMBOL_CHARACTER = '-';

	public static boolean isBit(char symbol) {
		return symbol == BIT0 || symbol == BIT1;
	}

	public static boolean isControl(char symbol) {
		return symbol >= CONTROL_FIRST && symbol <= CONTROL_LAST;
	}

	/**
	 * Returns the index of the given control symbol
	 * @param symbol Control symbol
	 * @return int index of the symbol, starting from zero
	 */
	public static int controlIndex(char symbol) {
		if(!isControl(symbol)) throw new IllegalArgumentException("Symbol "+symbol+" is not a control symbol");
		return symbol - CONTROL_FIRST;
	}

	public static char controlSymbol(int index) {
		if(index<0 || index > CONTROL_LAST-CONTROL_FIRST) throw new IllegalArgumentException("Invalid control index: "+index);
		return (char)(CONTROL_FIRST+index);
	}

	/**
	 * Decides if the given input symbol belongs to the alphabet that can be recovered by decoding
	 * @param symbol Input symbol of a transition
	 * @return boolean true if the symbol is empty, a bit, a file delimiter or a control symbol
	 */
	public static boolean isDecodable(char symbol) {
		return symbol == NULL || isBit(symbol) || symbol == SOF || symbol == EOF || isControl(symbol);
	}

	public static String toString(char symbol) {
		if(symbol == NULL) return String.valueOf(EMPTY_SYMBOL_CHARACTER);
		return String.valueOf(symbol);
	}

	/**
	 * Decodes a symbol written in a machine file
	 * @param token Text with a single character, or the empty symbol character
	 * @return char decoded symbol
	 */
	public static char parse(String token) {
		if(token.length()!=1) throw new IllegalArgumentException("Symbol must be a single character. Found: "+token);
		char c = token.charAt(0);
		if(c == EMPTY_SYMBOL_CHARACTER) return NULL;
		return c;
	}
}
