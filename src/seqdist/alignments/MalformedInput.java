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
 * Error reported when alignments or aligned sequences do not comply with the expected structure.
 * This is the only kind of error reported by validation and distance calculations
 */
public final class MalformedInput {
	public static final String DEFAULT_REASON = "malformed input";
	
	private final String reason;
	
	public MalformedInput(String reason) {
		this.reason = reason;
	}
	
	/**
	 * @return String description of the problem. Null if no description was given
	 */
	public String getReason() {
		return reason;
	}
	
	public String getMessage() {
		if(reason==null) return DEFAULT_REASON;
		return DEFAULT_REASON+": "+reason;
	}
	
	@Override
	public String toString() {
		return getMessage();
	}
}
