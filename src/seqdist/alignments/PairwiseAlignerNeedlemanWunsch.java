/*******************************************************************************
 * SeqDist - Pairwise alignments and evolutionary distances
 * Copyright 2026 SeqDist developers
 *
 * This file is part of SeqDist.
 *
 *     SeqDist is free software: you can redistribute it and/or modify
 *     it under the terms of the GNU General Public License as published by
 *     the Free Software Foundation, either version 3 of the License, or
 *     (at your option) any later version.
 *
 *     SeqDist is distributed in the hope that it will be useful,
 *     but WITHOUT ANY WARRANTY; without even the implied warranty of
 *     MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *     GNU General Public License for more details.
 *
 *     You should have received a copy of the GNU General Public License
 *     along with SeqDist.  If not, see <http://www.gnu.org/licenses/>.
 *******************************************************************************/
package seqdist.alignments;

import java.util.Locale;

import seqdist.sequences.DNASequence;

/**
 * Global pairwise alignment of nucleotide sequences following the Needleman-Wunsch algorithm
 * with linear gap scoring. Scores are fixed: match +5, mismatch -2 and -6 for every gap column.
 * When two or more moves reach the maximum score, the diagonal move is preferred, then the move
 * consuming a character of the first sequence (up) and finally the move consuming a
 * character of the second sequence (left).
 * Instances keep no state between calls and can be shared by different threads.
 */
public class PairwiseAlignerNeedlemanWunsch implements PairwiseAligner {
	
	public static final int MATCH_SCORE = 5;
	public static final int MISMATCH_SCORE = -2;
	public static final int GAP_SCORE = -6;
	
	static final byte DIRECTION_DIAGONAL = 0;
	static final byte DIRECTION_UP = 1;
	static final byte DIRECTION_LEFT = 2;
	
	@Override
	public PairwiseAlignment calculateAlignment(CharSequence s1, CharSequence s2) {
		if(s1==null || s2==null) throw new IllegalArgumentException("Sequences to align can not be null");
		if(s1.length()==0 || s2.length()==0) throw new IllegalArgumentException("Sequences to align can not be empty");
		int m = s1.length();
		int n = s2.length();
		int [][] scores = new int[m+1][n+1];
		byte [][] directions = new byte[m+1][n+1];
		initMatrices(scores, directions);
		calculateMatrices(s1, s2, scores, directions);
		return getAlignedStrings(s1, s2, directions, scores[m][n]);
	}
	
	private void initMatrices(int [][] scores, byte [][] directions) {
		scores[0][0] = 0;
		for (int i = 1; i < scores.length; i++) {
			scores[i][0] = GAP_SCORE * i;
			directions[i][0] = DIRECTION_UP;
		}
		for (int j = 1; j < scores[0].length; j++) {
			scores[0][j] = GAP_SCORE * j;
			directions[0][j] = DIRECTION_LEFT;
		}
	}
	
	private void calculateMatrices(CharSequence s1, CharSequence s2, int [][] scores, byte [][] directions) {
		for (int i = 1; i <= s1.length(); i++) {
			char c1 = s1.charAt(i - 1);
			for (int j = 1; j <= s2.length(); j++) {
				int diagonal = scores[i-1][j-1] + getMatchScore(c1, s2.charAt(j - 1));
				int up = scores[i-1][j] + GAP_SCORE;
				int left = scores[i][j-1] + GAP_SCORE;
				if(diagonal >= up && diagonal >= left) {
					scores[i][j] = diagonal;
					directions[i][j] = DIRECTION_DIAGONAL;
				} else if (up >= left) {
					scores[i][j] = up;
					directions[i][j] = DIRECTION_UP;
				} else {
					scores[i][j] = left;
					directions[i][j] = DIRECTION_LEFT;
				}
			}
		}
	}
	
	private static int getMatchScore(char a, char b) {
		if (Character.toUpperCase(a) == Character.toUpperCase(b)) return MATCH_SCORE;
		return MISMATCH_SCORE;
	}
	
	private PairwiseAlignment getAlignedStrings(CharSequence s1, CharSequence s2, byte [][] directions, int score) {
		StringBuilder sb1 = new StringBuilder();
		StringBuilder sb2 = new StringBuilder();
		int i = s1.length();
		int j = s2.length();
		// Traceback cycle
		while (i>0 || j>0) {
			byte direction;
			if(i==0) direction = DIRECTION_LEFT;
			else if (j==0) direction = DIRECTION_UP;
			else direction = directions[i][j];
			
			if(direction == DIRECTION_DIAGONAL) {
				sb1.append(s1.charAt(i - 1));
				sb2.append(s2.charAt(j - 1));
				i--;
				j--;
			} else if (direction == DIRECTION_UP) {
				sb1.append(s1.charAt(i - 1));
				sb2.append(DNASequence.GAP_CHARACTER);
				i--;
			} else {
				sb1.append(DNASequence.GAP_CHARACTER);
				sb2.append(s2.charAt(j - 1));
				j--;
			}
		}
		String aligned1 = sb1.reverse().toString().toUpperCase(Locale.ROOT);
		String aligned2 = sb2.reverse().toString().toUpperCase(Locale.ROOT);
		return new PairwiseAlignment(aligned1, aligned2, score);
	}
	
	/**
	 * Calculates the score of a given alignment using the fixed scores of this aligner.
	 * Columns with gaps in both sequences are not expected and are scored as gaps
	 * @param aligned1 First aligned sequence
	 * @param aligned2 Second aligned sequence
	 * @return int score of the alignment
	 */
	public static int score(CharSequence aligned1, CharSequence aligned2) {
		if(aligned1.length()!=aligned2.length()) throw new IllegalArgumentException("Aligned sequences must have the same length");
		int answer = 0;
		for(int i=0;i<aligned1.length();i++) {
			char c1 = aligned1.charAt(i);
			char c2 = aligned2.charAt(i);
			if(c1 == DNASequence.GAP_CHARACTER || c2 == DNASequence.GAP_CHARACTER) answer+=GAP_SCORE;
			else answer+=getMatchScore(c1, c2);
		}
		return answer;
	}
}
