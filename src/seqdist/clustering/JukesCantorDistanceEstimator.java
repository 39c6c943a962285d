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
package seqdist.clustering;

import seqdist.alignments.PairwiseAlignment;
import seqdist.alignments.ValidationResult;
import seqdist.sequences.DNASequence;

/**
 * Estimates evolutionary distances between two aligned nucleotide sequences
 * using the Jukes-Cantor correction of the proportion of mismatching sites
 */
public class JukesCantorDistanceEstimator {
	/**
	 * Proportion of mismatches at which the correction is no longer defined
	 */
	public static final double SATURATION_P_DISTANCE = 0.75;
	/**
	 * Distance reported for pairs with p-distance at or above the saturation threshold
	 */
	public static final double SATURATION_DISTANCE = 30.0;
	
	/**
	 * Calculates the proportion of mismatches between comparable columns. A column is comparable
	 * if it does not have a gap in any of the two sequences. Characters are compared as given,
	 * so a lower case base does not match its upper case counterpart
	 * @param aligned1 first aligned sequence
	 * @param aligned2 second aligned sequence
	 * @return ValidationResult<Double> p-distance. Zero if there are no comparable columns
	 */
	public ValidationResult<Double> pDistance(CharSequence aligned1, CharSequence aligned2) {
		if(aligned1==null || aligned2==null) return ValidationResult.malformedInput("Aligned sequences can not be null");
		if(aligned1.length()!=aligned2.length()) return ValidationResult.malformedInput("Aligned sequences have different lengths: "+aligned1.length()+" "+aligned2.length());
		int comparable = 0;
		int mismatches = 0;
		for(int i=0;i<aligned1.length();i++) {
			char c1 = aligned1.charAt(i);
			char c2 = aligned2.charAt(i);
			if(c1==DNASequence.GAP_CHARACTER || c2==DNASequence.GAP_CHARACTER) continue;
			comparable++;
			if(c1!=c2) mismatches++;
		}
		if(comparable==0) return ValidationResult.success(0.0);
		return ValidationResult.success((double)mismatches/comparable);
	}
	
	/**
	 * Calculates the Jukes-Cantor distance between two aligned sequences
	 * @param aligned1 first aligned sequence
	 * @param aligned2 second aligned sequence
	 * @return ValidationResult<Double> Distance. Zero if there are no comparable columns and
	 * SATURATION_DISTANCE if the p-distance is at least SATURATION_P_DISTANCE
	 */
	public ValidationResult<Double> distance(CharSequence aligned1, CharSequence aligned2) {
		ValidationResult<Double> pResult = pDistance(aligned1, aligned2);
		if(!pResult.isValid()) return pResult;
		double p = pResult.getValue();
		if(p>=SATURATION_P_DISTANCE) return ValidationResult.success(SATURATION_DISTANCE);
		double correction = 1.0 - (4.0/3.0)*p;
		// Always positive for p below saturation
		if(correction<=0) return ValidationResult.malformedInput("Non positive Jukes-Cantor correction "+correction+" for p-distance "+p);
		// Avoid reporting -0.0 for identical sequences
		if(p==0) return ValidationResult.success(0.0);
		return ValidationResult.success(-0.75*Math.log(correction));
	}
	
	/**
	 * Calculates the Jukes-Cantor distance between the sequences of the given alignment
	 * @param alignment with the two aligned sequences
	 * @return ValidationResult<Double> Distance between the aligned sequences
	 */
	public ValidationResult<Double> distance(PairwiseAlignment alignment) {
		return distance(alignment.getAlignedSequence1(), alignment.getAlignedSequence2());
	}
}
