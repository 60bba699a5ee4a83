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
package dnastore.math;

/**
 * Arithmetic of probabilities represented as natural logarithms.
 * The probability zero is represented as negative infinity
 * @author DNAStore developers
 *
 */
public class LogMath {
	public static final double LOG_ZERO = Double.NEGATIVE_INFINITY;

	/**
	 * Calculates the logarithm of a probability
	 * @param p Probability between zero and one
	 * @return double natural logarithm of p. LOG_ZERO if p is zero
	 */
	public static double log(double p) {
		if(p<0 || p>1 || Double.isNaN(p)) throw new IllegalArgumentException("Invalid probability: "+p);
		if(p==0) return LOG_ZERO;
		return Math.log(p);
	}

	/**
	 * Multiplies two probabilities in logarithmic scale
	 * @param logP1 First log probability
	 * @param logP2 Second log probability
	 * @return double logarithm of the product. LOG_ZERO if any of the two is LOG_ZERO
	 */
	public static double logProduct(double logP1, double logP2) {
		if(isZero(logP1) || isZero(logP2)) return LOG_ZERO;
		return logP1+logP2;
	}

	public static double logProduct(double logP1, double logP2, double logP3) {
		return logProduct(logProduct(logP1, logP2), logP3);
	}

	public static boolean isZero(double logP) {
		return logP == LOG_ZERO;
	}

	/**
	 * Compares two log probabilities allowing for rounding errors
	 * @param logP1 First log probability
	 * @param logP2 Second log probability
	 * @param tolerance Maximum allowed difference
	 * @return boolean true if both are zero or if the difference is below the tolerance
	 */
	public static boolean equals(double logP1, double logP2, double tolerance) {
		if(isZero(logP1) || isZero(logP2)) return isZero(logP1) && isZero(logP2);
		return Math.abs(logP1-logP2)<=tolerance;
	}
}
