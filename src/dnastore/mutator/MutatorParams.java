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

import java.util.Arrays;

/**
 * Parameters of the channel that mutates DNA sequences between writing and reading.
 * The channel can substitute bases, delete runs of bases and insert tandem duplications
 * of the bases written immediately before
 * @author DNAStore developers
 *
 */
public class MutatorParams {
	public static final String DEF_ALPHABET = "ACGT";
	public static final int DEF_MAX_DUP_LEN = 4;
	public static final double DEF_P_TAN_DUP = 0.01;
	public static final double DEF_P_DEL_OPEN = 0.01;
	public static final double DEF_P_DEL_EXTEND = 0.1;
	public static final double DEF_P_SUB = 0.01;

	private String alphabet = DEF_ALPHABET;
	private int maxDupLen = DEF_MAX_DUP_LEN;
	private double pTanDup = DEF_P_TAN_DUP;
	private double [] pLenTanDup;
	private double pDelOpen = DEF_P_DEL_OPEN;
	private double pDelExtend = DEF_P_DEL_EXTEND;
	private double [][] pSub;

	public MutatorParams() {
		setSubstitutionProbability(DEF_P_SUB);
		pLenTanDup = uniformLengths(maxDupLen);
	}

	private static double [] uniformLengths(int maxDupLen) {
		double [] lengths = new double[maxDupLen];
		Arrays.fill(lengths, 1.0/maxDupLen);
		return lengths;
	}

	public String getAlphabet() {
		return alphabet;
	}

	/**
	 * Changes the alphabet. The substitution matrix is reset to the default substitution probability
	 * @param alphabet New alphabet
	 */
	public void setAlphabet(String alphabet) {
		if(alphabet==null || alphabet.length()<2) throw new IllegalArgumentException("The alphabet must have at least two symbols");
		this.alphabet = alphabet.toUpperCase();
		setSubstitutionProbability(DEF_P_SUB);
	}

	/**
	 * @param base symbol
	 * @return int index of the base in the alphabet. -1 if the symbol is not part of the alphabet
	 */
	public int getBaseIndex(char base) {
		return alphabet.indexOf(Character.toUpperCase(base));
	}

	public int getMaxDupLen() {
		return maxDupLen;
	}

	/**
	 * Changes the maximum length of tandem duplications. Duplication lengths become uniformly distributed
	 * @param maxDupLen New maximum length
	 */
	public void setMaxDupLen(int maxDupLen) {
		if(maxDupLen<0) throw new IllegalArgumentException("Maximum duplication length can not be negative: "+maxDupLen);
		this.maxDupLen = maxDupLen;
		pLenTanDup = uniformLengths(maxDupLen);
	}

	public double getPTanDup() {
		return pTanDup;
	}

	public void setPTanDup(double pTanDup) {
		checkProbability(pTanDup,"tandem duplication");
		this.pTanDup = pTanDup;
	}

	/**
	 * @param length of a duplication
	 * @return double probability of a duplication having the given length
	 */
	public double getPLenTanDup(int length) {
		return pLenTanDup[length-1];
	}

	/**
	 * Sets the distribution of duplication lengths
	 * @param pLenTanDup Probabilities of lengths from 1 to maxDupLen. Must sum to one
	 */
	public void setPLenTanDup(double [] pLenTanDup) {
		if(pLenTanDup.length!=maxDupLen) throw new IllegalArgumentException("Expected "+maxDupLen+" duplication length probabilities but got "+pLenTanDup.length);
		checkDistribution(pLenTanDup, "duplication lengths");
		this.pLenTanDup = Arrays.copyOf(pLenTanDup, pLenTanDup.length);
	}

	public double getPDelOpen() {
		return pDelOpen;
	}

	public void setPDelOpen(double pDelOpen) {
		checkProbability(pDelOpen, "deletion opening");
		this.pDelOpen = pDelOpen;
	}

	public double getPDelExtend() {
		return pDelExtend;
	}

	public void setPDelExtend(double pDelExtend) {
		checkProbability(pDelExtend, "deletion extension");
		this.pDelExtend = pDelExtend;
	}

	/**
	 * @return double probability of writing a base without opening a deletion or a duplication
	 */
	public double getPNoGap() {
		return 1-pDelOpen-pTanDup;
	}

	/**
	 * @param from Base written
	 * @param to Base read
	 * @return double probability of reading the base to when the base from was written
	 */
	public double getPSub(int from, int to) {
		return pSub[from][to];
	}

	/**
	 * Sets a substitution matrix in which every base mutates to any other base with the same probability
	 * @param pSubstitution Total probability of mutation of a base
	 */
	public void setSubstitutionProbability(double pSubstitution) {
		checkProbability(pSubstitution, "substitution");
		int n = alphabet.length();
		pSub = new double[n][n];
		for(int i=0;i<n;i++) {
			for(int j=0;j<n;j++) {
				pSub[i][j] = (i==j)?1-pSubstitution:pSubstitution/(n-1);
			}
		}
	}

	/**
	 * Sets the substitution matrix
	 * @param pSub Square matrix with the dimension of the alphabet. Rows must sum to one
	 */
	public void setSubstitutionMatrix(double [][] pSub) {
		int n = alphabet.length();
		if(pSub.length!=n) throw new IllegalArgumentException("Substitution matrix must have "+n+" rows");
		double [][] copy = new double[n][];
		for(int i=0;i<n;i++) {
			if(pSub[i].length!=n) throw new IllegalArgumentException("Row "+i+" of the substitution matrix must have "+n+" columns");
			checkDistribution(pSub[i], "substitutions from "+alphabet.charAt(i));
			copy[i] = Arrays.copyOf(pSub[i], n);
		}
		this.pSub = copy;
	}

	/**
	 * Checks that the probabilities of opening deletions and duplications are compatible
	 */
	public void validate() {
		if(getPNoGap()<0) throw new IllegalArgumentException("The sum of deletion and duplication probabilities can not be larger than one. Deletion: "+pDelOpen+" duplication: "+pTanDup);
	}

	private static void checkProbability(double p, String name) {
		if(p<0 || p>1 || Double.isNaN(p)) throw new IllegalArgumentException("Invalid "+name+" probability: "+p);
	}

	private static void checkDistribution(double [] values, String name) {
		double sum = 0;
		for(double p:values) {
			checkProbability(p, name);
			sum+=p;
		}
		if(Math.abs(sum-1)>1e-6) throw new IllegalArgumentException("Probabilities of "+name+" must sum to one. Sum: "+sum);
	}
}
