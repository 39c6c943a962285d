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
package seqdist.sequences;

/**
 * Alphabet utilities for nucleotide sequences without degenerate bases
 */
public class DNASequence {
	public static final String [] BASES_ARRAY = {"A","C","G","T"};
	public static final String BASES_STRING = "ACGT";
	public static final char GAP_CHARACTER = '-';
	private static final int [] ARRAY_BASES_INDEXING = {0,-1,1,-1,-1,-1,2,-1,-1,-1,-1,-1,-1,-1,-1,-1,-1,-1,-1,3,-1,-1,-1,-1,-1,-1};
	
	private DNASequence() {
		
	}
	
	/**
	 * Index of the given base within BASES_STRING. Lower case bases are accepted
	 * @param base to look for
	 * @return int index of the base or -1 if the character is not a base
	 */
	public static int getDNAIndex (char base) {
		int i = Character.toUpperCase(base) - 'A';
		if(i<0 || i>=ARRAY_BASES_INDEXING.length) return -1;
		return ARRAY_BASES_INDEXING[i];
	}
	
	/**
	 * Checks that every character of the sequence is one of the four bases, in upper or lower case
	 * @param sequence to check
	 * @return boolean true if the sequence only contains bases
	 */
	public static boolean isDNA (CharSequence sequence) {
		for(int i=0;i<sequence.length();i++) {
			if(getDNAIndex(sequence.charAt(i))<0) return false;
		}
		return true;
	}
	
	/**
	 * Checks that every character of an aligned sequence is either a base or a gap
	 * @param alignedSequence to check
	 * @return boolean true if the sequence only contains bases and gaps
	 */
	public static boolean isAlignedDNA (CharSequence alignedSequence) {
		for(int i=0;i<alignedSequence.length();i++) {
			char c = alignedSequence.charAt(i);
			if(c!=GAP_CHARACTER && getDNAIndex(c)<0) return false;
		}
		return true;
	}
	
	/**
	 * Removes the gap characters of an aligned sequence
	 * @param alignedSequence with gaps
	 * @return String sequence without gaps
	 */
	public static String removeGaps(CharSequence alignedSequence) {
		StringBuilder answer = new StringBuilder(alignedSequence.length());
		for(int i=0;i<alignedSequence.length();i++) {
			char c = alignedSequence.charAt(i);
			if(c!=GAP_CHARACTER) answer.append(c);
		}
		return answer.toString();
	}
}
