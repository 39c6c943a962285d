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
package seqdist.main;

/**
 * Decodes values given as command line options into the types expected by programs
 */
public class OptionValuesDecoder {
	
	/**
	 * Decodes the given value as an object of the given type
	 * @param value String representation of the value
	 * @param type Class of the expected object. Supported types are String, Integer, Long, Double and Boolean
	 * @return Object decoded value
	 * @throws NumberFormatException If a numeric value can not be parsed
	 */
	public static Object decode(String value, Class<?> type) {
		if(value==null) return null;
		if(type==String.class) return value;
		if(type==Integer.class || type==int.class) return Integer.parseInt(value.trim());
		if(type==Long.class || type==long.class) return Long.parseLong(value.trim());
		if(type==Double.class || type==double.class) return Double.parseDouble(value.trim());
		if(type==Boolean.class || type==boolean.class) return Boolean.parseBoolean(value.trim());
		throw new IllegalArgumentException("Unsupported type for option values: "+type.getName());
	}
}
