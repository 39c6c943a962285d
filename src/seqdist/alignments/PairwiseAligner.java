package seqdist.alignments;

public interface PairwiseAligner {
	/**
	 * Calculates a global pairwise alignment between two sequences
	 * @param sequence1 to align
	 * @param sequence2 to align
	 * @return PairwiseAlignment object with the aligned sequences and the alignment score
	 */
	public PairwiseAlignment calculateAlignment (CharSequence sequence1, CharSequence sequence2);
}
