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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Ordered collection of pairwise alignments indexed by canonical pairs of sequence identifiers
 */
public class AlignmentSet {
	private Map<IndexPair, PairwiseAlignment> alignments = new LinkedHashMap<>();
	
	/**
	 * Adds the alignment for the given pair
	 * @param pair of sequence identifiers
	 * @param alignment between the two sequences
	 * @throws IllegalArgumentException If the set already has an alignment for the pair
	 */
	public void addAlignment(IndexPair pair, PairwiseAlignment alignment) {
		if(pair==null || alignment==null) throw new IllegalArgumentException("Pair and alignment can not be null");
		if(alignments.containsKey(pair)) throw new IllegalArgumentException("Duplicated alignment for pair "+pair);
		alignments.put(pair, alignment);
	}
	
	public PairwiseAlignment getAlignment(IndexPair pair) {
		return alignments.get(pair);
	}
	
	public PairwiseAlignment getAlignment(int i, int j) {
		return alignments.get(new IndexPair(i, j));
	}
	
	public boolean containsPair(IndexPair pair) {
		return alignments.containsKey(pair);
	}
	
	public int size() {
		return alignments.size();
	}
	
	public boolean isEmpty() {
		return alignments.isEmpty();
	}
	
	/**
	 * @return Set<IndexPair> pairs in insertion order
	 */
	public Set<IndexPair> getPairs() {
		return Collections.unmodifiableSet(alignments.keySet());
	}
	
	/**
	 * @return SortedSet<Integer> identifiers of the sequences present in at least one pair
	 */
	public SortedSet<Integer> getIds() {
		SortedSet<Integer> ids = new TreeSet<>();
		for(IndexPair pair:alignments.keySet()) {
			ids.add(pair.getFirst());
			ids.add(pair.getSecond());
		}
		return ids;
	}
	
	/**
	 * @return Map<IndexPair, PairwiseAlignment> unmodifiable view of the alignments in insertion order
	 */
	public Map<IndexPair, PairwiseAlignment> asMap() {
		return Collections.unmodifiableMap(alignments);
	}
}
