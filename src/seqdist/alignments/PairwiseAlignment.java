package seqdist.alignments;

import seqdist.sequences.DNASequence;

/**
 * Immutable pair of aligned sequences of equal length.
 * Alignments calculated by a PairwiseAligner also keep the score of the alignment
 */
public final class PairwiseAlignment {
	private final String alignedSequence1;
	private final String alignedSequence2;
	private final boolean scored;
	private final int score;
	
	/**
	 * Creates an alignment without score information, for example supplied by an external tool
	 * @param alignedSequence1 first aligned sequence
	 * @param alignedSequence2 second aligned sequence
	 */
	public PairwiseAlignment(String alignedSequence1, String alignedSequence2) {
		this(alignedSequence1, alignedSequence2, false, 0);
	}
	
	public PairwiseAlignment(String alignedSequence1, String alignedSequence2, int score) {
		this(alignedSequence1, alignedSequence2, true, score);
	}
	
	private PairwiseAlignment(String alignedSequence1, String alignedSequence2, boolean scored, int score) {
		if(alignedSequence1==null || alignedSequence2==null) throw new IllegalArgumentException("Aligned sequences can not be null");
		if(alignedSequence1.length()!=alignedSequence2.length()) throw new IllegalArgumentException("Aligned sequences must have the same length. Lengths: "+alignedSequence1.length()+" "+alignedSequence2.length());
		this.alignedSequence1 = alignedSequence1;
		this.alignedSequence2 = alignedSequence2;
		this.scored = scored;
		this.score = score;
	}
	
	public String getAlignedSequence1() {
		return alignedSequence1;
	}
	public String getAlignedSequence2() {
		return alignedSequence2;
	}
	public int getLength() {
		return alignedSequence1.length();
	}
	/**
	 * @return boolean true if this alignment was produced by an aligner and has a score
	 */
	public boolean hasScore() {
		return scored;
	}
	/**
	 * @return int score of the alignment
	 * @throws IllegalStateException if the alignment does not have a score
	 */
	public int getScore() {
		if(!scored) throw new IllegalStateException("Alignment does not have score information");
		return score;
	}
	/**
	 * @return String first sequence without gaps
	 */
	public String getSequence1() {
		return DNASequence.removeGaps(alignedSequence1);
	}
	/**
	 * @return String second sequence without gaps
	 */
	public String getSequence2() {
		return DNASequence.removeGaps(alignedSequence2);
	}
	
	@Override
	public String toString() {
		return alignedSequence1+"\n"+alignedSequence2;
	}
}
