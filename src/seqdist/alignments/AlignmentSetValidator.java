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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Logger;

import seqdist.sequences.DNASequence;

/**
 * Validates sets of pairwise alignments before distances are calculated from them.
 * Keys are normalized to canonical pairs and the pairs must form the complete graph
 * over the identifiers mentioned in the set: every pair of distinct identifiers must appear
 * exactly once. Values must be two aligned sequences of the same positive length made of
 * bases (upper or lower case) and gaps. Aligned sequences are copied as given.
 * The validator does not check that removing the gaps reproduces any particular sequence.
 */
public class AlignmentSetValidator {
	
	private Logger log = Logger.getLogger(AlignmentSetValidator.class.getName());
	
	public Logger getLog() {
		return log;
	}
	public void setLog(Logger log) {
		this.log = log;
	}
	
	/**
	 * Validates a typed alignment set
	 * @param alignments to validate
	 * @return ValidationResult<ValidatedAlignmentSet> sorted identifiers and a normalized copy of the alignments
	 */
	public ValidationResult<ValidatedAlignmentSet> validate(AlignmentSet alignments) {
		if(alignments==null) return ValidationResult.malformedInput("Alignment set can not be null");
		return validate(alignments.asMap());
	}
	
	/**
	 * Validates alignments supplied by external sources. Keys can be IndexPair objects, int arrays of length two
	 * or lists of two Integer objects. Values can be PairwiseAlignment objects, arrays of two CharSequence objects
	 * or lists of two CharSequence objects
	 * @param rawAlignments map from pairs of identifiers to aligned sequences
	 * @return ValidationResult<ValidatedAlignmentSet> sorted identifiers and a normalized copy of the alignments.
	 * The result has an error describing the first problem found if the map is not valid 
	 */
	public ValidationResult<ValidatedAlignmentSet> validate(Map<?, ?> rawAlignments) {
		if(rawAlignments==null || rawAlignments.isEmpty()) return ValidationResult.malformedInput("Alignments map is null or empty");
		Map<IndexPair, PairwiseAlignment> normalized = new TreeMap<>();
		TreeSet<Integer> ids = new TreeSet<>();
		for(Map.Entry<?, ?> entry:rawAlignments.entrySet()) {
			ValidationResult<IndexPair> pairResult = decodePair(entry.getKey());
			if(!pairResult.isValid()) return ValidationResult.malformedInput(pairResult);
			IndexPair pair = pairResult.getValue();
			ValidationResult<PairwiseAlignment> alnResult = decodeAlignment(pair, entry.getValue());
			if(!alnResult.isValid()) return ValidationResult.malformedInput(alnResult);
			if(normalized.containsKey(pair)) return ValidationResult.malformedInput("Pair "+pair+" appears more than once");
			normalized.put(pair, alnResult.getValue());
			ids.add(pair.getFirst());
			ids.add(pair.getSecond());
		}
		List<Integer> sortedIds = new ArrayList<>(ids);
		if(sortedIds.size()<2) return ValidationResult.malformedInput("At least two sequence identifiers are required");
		
		List<IndexPair> expectedPositions = new PairEnumerator().generateAllPairs(sortedIds);
		for(IndexPair positions:expectedPositions) {
			IndexPair expected = new IndexPair(sortedIds.get(positions.getFirst()), sortedIds.get(positions.getSecond()));
			if(!normalized.containsKey(expected)) return ValidationResult.malformedInput("Missing alignment for pair "+expected);
		}
		if(normalized.size()!=expectedPositions.size()) return ValidationResult.malformedInput("Expected "+expectedPositions.size()+" pairs for "+sortedIds.size()+" sequences but found "+normalized.size());
		
		AlignmentSet answer = new AlignmentSet();
		for(Map.Entry<IndexPair, PairwiseAlignment> entry:normalized.entrySet()) {
			answer.addAlignment(entry.getKey(), entry.getValue());
		}
		log.fine("Validated "+answer.size()+" alignments between "+sortedIds.size()+" sequences");
		return ValidationResult.success(new ValidatedAlignmentSet(sortedIds, answer));
	}
	
	private ValidationResult<IndexPair> decodePair(Object key) {
		if(key instanceof IndexPair) return ValidationResult.success((IndexPair)key);
		int i;
		int j;
		if(key instanceof int[]) {
			int [] values = (int[]) key;
			if(values.length!=2) return ValidationResult.malformedInput("Key with "+values.length+" identifiers");
			i = values[0];
			j = values[1];
		} else if (key instanceof List) {
			List<?> values = (List<?>) key;
			if(values.size()!=2) return ValidationResult.malformedInput("Key with "+values.size()+" identifiers");
			if(!(values.get(0) instanceof Integer) || !(values.get(1) instanceof Integer)) return ValidationResult.malformedInput("Key "+values+" is not made of integers");
			i = (Integer)values.get(0);
			j = (Integer)values.get(1);
		} else {
			return ValidationResult.malformedInput("Key "+key+" is not a pair of integers");
		}
		if(i==j) return ValidationResult.malformedInput("Self pair ("+i+", "+j+") is not allowed");
		if(i<0 || j<0) return ValidationResult.malformedInput("Negative identifier in pair ("+i+", "+j+")");
		return ValidationResult.success(new IndexPair(i, j));
	}
	
	private ValidationResult<PairwiseAlignment> decodeAlignment(IndexPair pair, Object value) {
		Object first;
		Object second;
		boolean scored = false;
		int score = 0;
		if(value instanceof PairwiseAlignment) {
			PairwiseAlignment aln = (PairwiseAlignment) value;
			first = aln.getAlignedSequence1();
			second = aln.getAlignedSequence2();
			scored = aln.hasScore();
			if(scored) score = aln.getScore();
		} else if (value instanceof Object[]) {
			Object [] values = (Object[]) value;
			if(values.length!=2) return ValidationResult.malformedInput("Value for pair "+pair+" has "+values.length+" sequences");
			first = values[0];
			second = values[1];
		} else if (value instanceof List) {
			List<?> values = (List<?>) value;
			if(values.size()!=2) return ValidationResult.malformedInput("Value for pair "+pair+" has "+values.size()+" sequences");
			first = values.get(0);
			second = values.get(1);
		} else {
			return ValidationResult.malformedInput("Value for pair "+pair+" is not a pair of aligned sequences");
		}
		if(!(first instanceof CharSequence) || !(second instanceof CharSequence)) return ValidationResult.malformedInput("Value for pair "+pair+" is not made of two strings");
		String aligned1 = first.toString();
		String aligned2 = second.toString();
		if(aligned1.length()!=aligned2.length()) return ValidationResult.malformedInput("Aligned sequences for pair "+pair+" have different lengths: "+aligned1.length()+" "+aligned2.length());
		if(aligned1.length()==0) return ValidationResult.malformedInput("Aligned sequences for pair "+pair+" are empty");
		if(!DNASequence.isAlignedDNA(aligned1) || !DNASequence.isAlignedDNA(aligned2)) return ValidationResult.malformedInput("Aligned sequences for pair "+pair+" have characters other than "+DNASequence.BASES_STRING+" or "+DNASequence.GAP_CHARACTER);
		if(scored) return ValidationResult.success(new PairwiseAlignment(aligned1, aligned2, score));
		return ValidationResult.success(new PairwiseAlignment(aligned1, aligned2));
	}
}
