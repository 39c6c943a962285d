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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Alignment set that passed validation, with the sorted list of the identifiers present in its pairs
 */
public class ValidatedAlignmentSet {
	private final List<Integer> sortedIds;
	private final AlignmentSet alignments;
	private final Map<Integer, Integer> positions = new HashMap<>();
	
	ValidatedAlignmentSet(List<Integer> sortedIds, AlignmentSet alignments) {
		this.sortedIds = Collections.unmodifiableList(sortedIds);
		this.alignments = alignments;
		for(int i=0;i<sortedIds.size();i++) positions.put(sortedIds.get(i), i);
	}
	
	/**
	 * @return List<Integer> identifiers in increasing order
	 */
	public List<Integer> getSortedIds() {
		return sortedIds;
	}
	
	/**
	 * @return AlignmentSet normalized alignments with pairs in increasing order
	 */
	public AlignmentSet getAlignments() {
		return alignments;
	}
	
	/**
	 * Rank of the given identifier within the sorted identifiers
	 * @param id Sequence identifier
	 * @return int position of the identifier or -1 if the identifier is not present
	 */
	public int getPosition(int id) {
		Integer pos = positions.get(id);
		if(pos==null) return -1;
		return pos;
	}
}
