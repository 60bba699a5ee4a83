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
package dnastore.mutator;

import dnastore.math.LogMath;

/**
 * Log probabilities of the events of the mutation channel, precalculated from the channel parameters
 * @author DNAStore developers
 *
 */
public class MutatorScores {
	private MutatorParams params;
	private double tanDup;
	private double [] lenTanDup;
	private double noGap;
	private double delOpen;
	private double delExtend;
	private double delEnd;
	private double [][] sub;

	public MutatorScores(MutatorParams params) {
		params.validate();
		this.params = params;
		tanDup = LogMath.log(params.getPTanDup());
		int maxDupLen = params.getMaxDupLen();
		lenTanDup = new double[maxDupLen];
		for(int i=0;i<maxDupLen;i++) lenTanDup[i] = LogMath.log(params.getPLenTanDup(i+1));
		noGap = LogMath.log(params.getPNoGap());
		delOpen = LogMath.log(params.getPDelOpen());
		delExtend = LogMath.log(params.getPDelExtend());
		delEnd = LogMath.log(1-params.getPDelExtend());
		int n = params.getAlphabet().length();
		sub = new double[n][n];
		for(int i=0;i<n;i++) {
			for(int j=0;j<n;j++) {
				sub[i][j] = LogMath.log(params.getPSub(i, j));
			}
		}
	}

	public MutatorParams getParams() {
		return params;
	}

	/**
	 * @return double log probability of starting a tandem duplication
	 */
	public double getTanDup() {
		return tanDup;
	}

	/**
	 * @param dupIdx Offset of the first duplicated base, which is the duplication length minus one
	 * @return double log probability of the duplication length
	 */
	public double getLenTanDup(int dupIdx) {
		return lenTanDup[dupIdx];
	}

	public double getNoGap() {
		return noGap;
	}

	public double getDelOpen() {
		return delOpen;
	}

	public double getDelExtend() {
		return delExtend;
	}

	public double getDelEnd() {
		return delEnd;
	}

	/**
	 * Log probability of reading a base given the base written. Symbols outside the alphabet
	 * can only be read as themselves
	 * @param from Base written
	 * @param to Base read
	 * @return double log probability of the substitution, or of the match if both bases are equal
	 */
	public double getSub(char from, char to) {
		int i = params.getBaseIndex(from);
		int j = params.getBaseIndex(to);
		if(i<0 || j<0) return (Character.toUpperCase(from) == Character.toUpperCase(to))?0:LogMath.LOG_ZERO;
		return sub[i][j];
	}
}
