package dnastore.mutator.test;

import junit.framework.TestCase;
import dnastore.math.LogMath;
import dnastore.mutator.MutatorParams;
import dnastore.mutator.MutatorScores;

public class MutatorScoresTest extends TestCase {
	private static final double TOLERANCE = 0.0000001;

	public void testDefaultScores() {
		MutatorScores scores = new MutatorScores(new MutatorParams());
		assertEquals(Math.log(0.98), scores.getNoGap(), TOLERANCE);
		assertEquals(Math.log(0.01), scores.getDelOpen(), TOLERANCE);
		assertEquals(Math.log(0.1), scores.getDelExtend(), TOLERANCE);
		assertEquals(Math.log(0.9), scores.getDelEnd(), TOLERANCE);
		assertEquals(Math.log(0.01), scores.getTanDup(), TOLERANCE);
		for(int i=0;i<MutatorParams.DEF_MAX_DUP_LEN;i++) {
			assertEquals(Math.log(0.25), scores.getLenTanDup(i), TOLERANCE);
		}
		assertEquals(Math.log(0.99), scores.getSub('A', 'A'), TOLERANCE);
		assertEquals(Math.log(0.01/3), scores.getSub('A', 'C'), TOLERANCE);
		assertEquals(Math.log(0.01/3), scores.getSub('t', 'g'), TOLERANCE);
	}

	public void testSymbolsOutsideAlphabet() {
		MutatorScores scores = new MutatorScores(new MutatorParams());
		assertEquals(0.0, scores.getSub('N', 'N'), TOLERANCE);
		assertTrue(LogMath.isZero(scores.getSub('N', 'A')));
		assertTrue(LogMath.isZero(scores.getSub('A', 'N')));
	}

	public void testCustomParameters() {
		MutatorParams params = new MutatorParams();
		params.setMaxDupLen(2);
		params.setPLenTanDup(new double[] {0.8, 0.2});
		params.setSubstitutionMatrix(new double[][] {
			{0.7, 0.1, 0.1, 0.1},
			{0, 1, 0, 0},
			{0, 0, 1, 0},
			{0.5, 0, 0, 0.5}});
		MutatorScores scores = new MutatorScores(params);
		assertEquals(Math.log(0.8), scores.getLenTanDup(0), TOLERANCE);
		assertEquals(Math.log(0.2), scores.getLenTanDup(1), TOLERANCE);
		assertEquals(Math.log(0.7), scores.getSub('A', 'A'), TOLERANCE);
		assertEquals(0.0, scores.getSub('C', 'C'), TOLERANCE);
		assertTrue(LogMath.isZero(scores.getSub('C', 'A')));
		assertEquals(Math.log(0.5), scores.getSub('T', 'A'), TOLERANCE);
	}

	public void testInvalidParameters() {
		MutatorParams params = new MutatorParams();
		try {
			params.setPDelOpen(1.5);
			fail("Probability above one should fail");
		} catch (IllegalArgumentException e) {
			assertTrue(e.getMessage().contains("deletion"));
		}
		try {
			params.setPLenTanDup(new double[] {0.5, 0.5});
			fail("Number of lengths must match the maximum duplication length");
		} catch (IllegalArgumentException e) {
			assertTrue(e.getMessage().contains("4"));
		}
		try {
			params.setSubstitutionMatrix(new double[][] {{1,0,0,0},{0,1,0,0},{0,0,1,0},{0.5,0.1,0,0}});
			fail("Rows must sum to one");
		} catch (IllegalArgumentException e) {
			assertTrue(e.getMessage().contains("sum"));
		}
		params.setPDelOpen(0.6);
		params.setPTanDup(0.5);
		try {
			new MutatorScores(params);
			fail("Deletion and duplication probabilities exceed one");
		} catch (IllegalArgumentException e) {
			assertTrue(e.getMessage().contains("larger than one"));
		}
	}
}
