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

/**
 * Generates the canonical pairs of indexes over a list of sequences
 */
public class PairEnumerator {
	
	/**
	 * Generates every pair (i,j) with i<j over the given entries
	 * @param entries ordered list of entries. Only its size is used
	 * @return List<IndexPair> pairs sorted lexicographically
	 */
	public List<IndexPair> generateAllPairs(List<?> entries) {
		return generateAllPairs(entries.size());
	}
	
	/**
	 * Generates every pair (i,j) with 0<=i<j<n
	 * @param n number of entries
	 * @return List<IndexPair> n(n-1)/2 pairs sorted lexicographically. Empty if n is smaller than 2
	 */
	public List<IndexPair> generateAllPairs(int n) {
		if(n<0) throw new IllegalArgumentException("Number of entries can not be negative: "+n);
		List<IndexPair> pairs = new ArrayList<>(n*(n-1)/2);
		for(int i=0;i<n;i++) {
			for(int j=i+1;j<n;j++) {
				pairs.add(new IndexPair(i, j));
			}
		}
		return pairs;
	}
}
