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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import seqdist.alignments.AlignmentSet;
import seqdist.alignments.AlignmentSetValidator;
import seqdist.alignments.IndexPair;
import seqdist.alignments.PairwiseAlignment;
import seqdist.alignments.ValidatedAlignmentSet;
import seqdist.alignments.ValidationResult;

/**
 * Builds symmetric matrices of Jukes-Cantor distances from complete sets of pairwise alignments
 */
public class AlignmentsDistanceMatrixBuilder {
	
	private Logger log = Logger.getLogger(AlignmentsDistanceMatrixBuilder.class.getName());
	
	private AlignmentSetValidator validator = new AlignmentSetValidator();
	private JukesCantorDistanceEstimator estimator = new JukesCantorDistanceEstimator();
	
	public Logger getLog() {
		return log;
	}
	public void setLog(Logger log) {
		this.log = log;
	}
	
	/**
	 * Builds the distance matrix for a typed alignment set. Rows are named after the identifiers
	 * @param alignments Complete set of pairwise alignments
	 * @return ValidationResult<DistanceMatrix> Matrix with rows and columns sorted by identifier
	 */
	public ValidationResult<DistanceMatrix> build(AlignmentSet alignments) {
		return build(validator.validate(alignments), null);
	}
	
	/**
	 * Builds the distance matrix naming rows after the labels of the sequences
	 * @param alignments Complete set of pairwise alignments
	 * @param labels Names of the sequences, indexed by identifier. Every identifier in the set must have a label
	 * @return ValidationResult<DistanceMatrix> Matrix with rows and columns sorted by identifier
	 */
	public ValidationResult<DistanceMatrix> build(AlignmentSet alignments, List<String> labels) {
		return build(validator.validate(alignments), labels);
	}
	
	/**
	 * Builds the distance matrix from alignments supplied by external sources
	 * @param rawAlignments Map with the format accepted by AlignmentSetValidator
	 * @return ValidationResult<DistanceMatrix> Matrix with rows and columns sorted by identifier
	 */
	public ValidationResult<DistanceMatrix> build(Map<?, ?> rawAlignments) {
		return build(validator.validate(rawAlignments), null);
	}
	
	private ValidationResult<DistanceMatrix> build(ValidationResult<ValidatedAlignmentSet> validation, List<String> labels) {
		if(!validation.isValid()) return ValidationResult.malformedInput(validation);
		ValidatedAlignmentSet validated = validation.getValue();
		List<Integer> ids = validated.getSortedIds();
		int n = ids.size();
		double [][] matrix = new double[n][n];
		for(Map.Entry<IndexPair, PairwiseAlignment> entry:validated.getAlignments().asMap().entrySet()) {
			IndexPair pair = entry.getKey();
			ValidationResult<Double> distance = estimator.distance(entry.getValue());
			if(!distance.isValid()) return ValidationResult.malformedInput(distance);
			int pos1 = validated.getPosition(pair.getFirst());
			int pos2 = validated.getPosition(pair.getSecond());
			matrix[pos1][pos2] = distance.getValue();
			matrix[pos2][pos1] = distance.getValue();
		}
		List<String> rowNames = new ArrayList<>(n);
		for(int id:ids) {
			if(labels==null) rowNames.add(String.valueOf(id));
			else if (id<labels.size()) rowNames.add(labels.get(id));
			else return ValidationResult.malformedInput("No label available for sequence identifier "+id);
		}
		log.info("Built distance matrix for "+n+" sequences");
		return ValidationResult.success(new DistanceMatrix(rowNames, matrix));
	}
}
