package seqdist.alignments.test;

import java.util.Random;

import junit.framework.TestCase;
import seqdist.alignments.PairwiseAlignerNeedlemanWunsch;
import seqdist.alignments.PairwiseAlignment;
import seqdist.sequences.DNASequence;

public class PairwiseAlignerNeedlemanWunschTest extends TestCase {
	
	private PairwiseAlignerNeedlemanWunsch aligner = new PairwiseAlignerNeedlemanWunsch();
	
	public void testIdenticalSequences() {
		PairwiseAlignment aln = aligner.calculateAlignment("ACGT", "ACGT");
		assertEquals("ACGT", aln.getAlignedSequence1());
		assertEquals("ACGT", aln.getAlignedSequence2());
		assertEquals(20, aln.getScore());
	}
	
	public void testDeletion() {
		PairwiseAlignment aln = aligner.calculateAlignment("ACGT", "AGT");
		assertEquals("ACGT", aln.getAlignedSequence1());
		assertEquals("A-GT", aln.getAlignedSequence2());
		assertEquals(9, aln.getScore());
	}
	
	public void testSingleMismatch() {
		PairwiseAlignment aln = aligner.calculateAlignment("A", "T");
		assertEquals("A", aln.getAlignedSequence1());
		assertEquals("T", aln.getAlignedSequence2());
		assertEquals(-2, aln.getScore());
	}
	
	public void testDiagonalPreferredOverLeft() {
		// Both (A-,AA) and (-A,AA) score -1. The diagonal move at the last cell wins the tie
		PairwiseAlignment aln = aligner.calculateAlignment("A", "AA");
		assertEquals("-A", aln.getAlignedSequence1());
		assertEquals("AA", aln.getAlignedSequence2());
		assertEquals(-1, aln.getScore());
	}
	
	public void testDiagonalPreferredOverUp() {
		PairwiseAlignment aln = aligner.calculateAlignment("AA", "A");
		assertEquals("AA", aln.getAlignedSequence1());
		assertEquals("-A", aln.getAlignedSequence2());
		assertEquals(-1, aln.getScore());
	}
	
	public void testUpPreferredOverLeft() {
		// (-ACA,CAC-) and (ACA-,-CAC) both score -2. At the last cell the gap in the second sequence wins
		PairwiseAlignment aln = aligner.calculateAlignment("ACA", "CAC");
		assertEquals("-ACA", aln.getAlignedSequence1());
		assertEquals("CAC-", aln.getAlignedSequence2());
		assertEquals(-2, aln.getScore());
	}

	public void testLowerCaseInput() {
		PairwiseAlignment aln = aligner.calculateAlignment("acgt", "ACGT");
		assertEquals("ACGT", aln.getAlignedSequence1());
		assertEquals("ACGT", aln.getAlignedSequence2());
		assertEquals(20, aln.getScore());
	}
	
	public void testEmptySequenceRejected() {
		try {
			aligner.calculateAlignment("", "ACGT");
			fail("Empty sequences should not be aligned");
		} catch (IllegalArgumentException e) {
			// expected
		}
	}
	
	public void testRandomSequences() {
		Random rand = new Random(42);
		for(int c=0;c<200;c++) {
			String seq1 = randomSequence(rand, 1+rand.nextInt(40));
			String seq2 = randomSequence(rand, 1+rand.nextInt(40));
			PairwiseAlignment aln = aligner.calculateAlignment(seq1, seq2);
			String aln1 = aln.getAlignedSequence1();
			String aln2 = aln.getAlignedSequence2();
			assertEquals(aln1.length(), aln2.length());
			assertTrue(aln1.length()>=Math.max(seq1.length(), seq2.length()));
			assertTrue(aln1.length()<=seq1.length()+seq2.length());
			assertEquals(seq1, DNASequence.removeGaps(aln1));
			assertEquals(seq2, DNASequence.removeGaps(aln2));
			for(int i=0;i<aln1.length();i++) {
				assertFalse(aln1.charAt(i)==DNASequence.GAP_CHARACTER && aln2.charAt(i)==DNASequence.GAP_CHARACTER);
			}
			assertEquals(aln.getScore(), PairwiseAlignerNeedlemanWunsch.score(aln1, aln2));
			assertEquals(optimalScore(seq1, seq2), aln.getScore());
		}
	}
	
	private String randomSequence(Random rand, int length) {
		StringBuilder answer = new StringBuilder();
		for(int i=0;i<length;i++) answer.append(DNASequence.BASES_STRING.charAt(rand.nextInt(4)));
		return answer.toString();
	}
	
	/**
	 * Optimal global alignment score calculated keeping only two rows
	 */
	private int optimalScore(String seq1, String seq2) {
		int [] previous = new int[seq2.length()+1];
		int [] current = new int[seq2.length()+1];
		for(int j=0;j<previous.length;j++) previous[j] = j*PairwiseAlignerNeedlemanWunsch.GAP_SCORE;
		for(int i=1;i<=seq1.length();i++) {
			current[0] = i*PairwiseAlignerNeedlemanWunsch.GAP_SCORE;
			for(int j=1;j<=seq2.length();j++) {
				int matchScore = seq1.charAt(i-1)==seq2.charAt(j-1)?PairwiseAlignerNeedlemanWunsch.MATCH_SCORE:PairwiseAlignerNeedlemanWunsch.MISMATCH_SCORE;
				current[j] = Math.max(previous[j-1]+matchScore, Math.max(previous[j], current[j-1])+PairwiseAlignerNeedlemanWunsch.GAP_SCORE);
			}
			int [] tmp = previous;
			previous = current;
			current = tmp;
		}
		return previous[seq2.length()];
	}
}
