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

/**
 * Unordered pair of distinct non negative sequence identifiers.
 * The pair is stored in canonical form with the smaller identifier first,
 * so (j,i) and (i,j) represent the same pair
 */
public final class IndexPair implements Comparable<IndexPair> {
	private final int first;
	private final int second;
	
	/**
	 * Creates a canonical pair from two identifiers given in any order
	 * @param i first identifier
	 * @param j second identifier
	 * @throws IllegalArgumentException If the identifiers are equal or negative
	 */
	public IndexPair(int i, int j) {
		if(i==j) throw new IllegalArgumentException("Self pair not allowed for identifier "+i);
		if(i<0 || j<0) throw new IllegalArgumentException("Identifiers must be non negative. Given: "+i+" "+j);
		this.first = Math.min(i, j);
		this.second = Math.max(i, j);
	}
	/**
	 * @return int smaller identifier of the pair
	 */
	public int getFirst() {
		return first;
	}
	/**
	 * @return int larger identifier of the pair
	 */
	public int getSecond() {
		return second;
	}
	
	@Override
	public int compareTo(IndexPair o) {
		if(first!=o.first) return Integer.compare(first, o.first);
		return Integer.compare(second, o.second);
	}
	
	@Override
	public boolean equals(Object obj) {
		if(this==obj) return true;
		if(!(obj instanceof IndexPair)) return false;
		IndexPair other = (IndexPair) obj;
		return first==other.first && second==other.second;
	}
	
	@Override
	public int hashCode() {
		return 31*first+second;
	}
	
	@Override
	public String toString() {
		return "("+first+", "+second+")";
	}
}
