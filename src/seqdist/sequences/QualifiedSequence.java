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

import java.io.Serializable;

/**
 * Class to store nucleotide sequences identifiable by a name.
 * The position of the sequence within the loaded list is used as its identifier
 */
public class QualifiedSequence implements Serializable {
	/**
	 * 
	 */
	private static final long serialVersionUID = 1L;
	private String name;
	private CharSequence characters;
	
	public QualifiedSequence(String name, CharSequence characters) {
		super();
		this.setName(name);
		this.setCharacters(characters);
	}

	public String getName() {
		return name;
	}
	public void setName(String name) {
		this.name = name;
	}
	public int getLength() {
		return characters.length();
	}
	public CharSequence getCharacters() {
		return characters;
	}
	public void setCharacters(CharSequence characters) {
		if(characters==null) throw new IllegalArgumentException("Sequence characters can not be null");
		this.characters = characters;
	}
	
	@Override
	public String toString() {
		return name+" "+characters;
	}
}
