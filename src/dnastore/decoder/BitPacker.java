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

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import dnastore.machine.MachineSymbols;

/**
 * Stream receiving decoded input symbols. Bits are packed into bytes which are written to the underlying stream.
 * Other symbols are discarded
 * @author DNAStore developers
 *
 */
public class BitPacker extends FilterOutputStream {
	public static final int WORD_SIZE = 8;

	private Logger log = Logger.getLogger(BitPacker.class.getName());
	private boolean msb0 = false;
	private List<Boolean> bits = new ArrayList<Boolean>(WORD_SIZE);

	public BitPacker(OutputStream out) {
		super(out);
	}

	public BitPacker(OutputStream out, boolean msb0) {
		super(out);
		this.msb0 = msb0;
	}

	public Logger getLog() {
		return log;
	}

	public void setLog(Logger log) {
		this.log = log;
	}

	/**
	 * @return boolean true if the first decoded bit of each byte is the most significant bit
	 */
	public boolean isMsb0() {
		return msb0;
	}

	public void setMsb0(boolean msb0) {
		this.msb0 = msb0;
	}

	/**
	 * @return int Number of bits waiting to complete a byte
	 */
	public int getPendingBits() {
		return bits.size();
	}

	@Override
	public void write(int b) throws IOException {
		char c = (char)(b & 0xFF);
		if(MachineSymbols.isBit(c)) {
			bits.add(c == MachineSymbols.BIT1);
			if(bits.size()==WORD_SIZE) writeByte();
		} else if (MachineSymbols.isControl(c)) {
			log.warning("Ignoring control character #"+MachineSymbols.controlIndex(c)+" ('"+c+"') in decoder");
		} else if (c == MachineSymbols.SOF) {
			log.fine("Ignoring start-of-file character '"+c+"' in decoder");
		} else if (c == MachineSymbols.EOF) {
			log.fine("Ignoring end-of-file character '"+c+"' in decoder");
		} else {
			log.warning("Ignoring unknown character '"+c+"' (\\x"+String.format("%02x", (int)c)+") in decoder");
		}
	}

	private void writeByte() throws IOException {
		int value = 0;
		for(int i=0;i<bits.size();i++) {
			if(bits.get(i)) value |= 1 << (msb0?(WORD_SIZE-1-i):i);
		}
		log.finer("Decoded byte \\x"+String.format("%02x", value));
		out.write(value);
		bits.clear();
	}

	/**
	 * Discards the bits that do not complete a byte, reporting them as a warning, and closes the underlying stream
	 */
	@Override
	public void close() throws IOException {
		if(!bits.isEmpty()) {
			StringBuilder pending = new StringBuilder();
			for(boolean bit:bits) pending.append(bit?MachineSymbols.BIT1:MachineSymbols.BIT0);
			if(!msb0) pending.reverse();
			log.warning(bits.size()+" bit"+(bits.size()>1?"s":"")+" ("+pending+") remaining on output");
			bits.clear();
		}
		super.close();
	}
}
