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

import java.lang.reflect.Method;

/**
 * Description of an option of a command
 */
public class CommandOption {
	public static final String TYPE_BOOLEAN="boolean";
	public static final String TYPE_INT="int";
	public static final String TYPE_LONG="long";
	public static final String TYPE_DOUBLE="double";
	public static final String TYPE_STRING="string";
	public static final String TYPE_FILE="file";
	
	private String id;
	private String type = TYPE_STRING;
	private String defaultValue;
	private String attribute;
	private String description;
	
	public CommandOption(String id) {
		this.id = id;
		this.attribute = id;
	}
	public String getId() {
		return id;
	}
	public String getType() {
		return type;
	}
	public void setType(String type) {
		if(getValueType(type)==null) throw new RuntimeException("Unsupported type "+type+" for option "+id);
		this.type = type;
	}
	public String getDefaultValue() {
		return defaultValue;
	}
	public void setDefaultValue(String defaultValue) {
		this.defaultValue = defaultValue;
	}
	public String getAttribute() {
		return attribute;
	}
	public void setAttribute(String attribute) {
		this.attribute = attribute;
	}
	public String getDescription() {
		return description;
	}
	public void setDescription(String description) {
		this.description = description;
	}
	
	/**
	 * @return boolean true if the type should be printed in the help of the command
	 */
	public boolean printType() {
		return !TYPE_BOOLEAN.equals(type);
	}
	
	public int getPrintLength() {
		int length = id.length()+1;
		if(printType()) length+= type.length()+1;
		return length;
	}
	
	/**
	 * Decodes the given value according to the type of this option
	 * @param value String representation of the value
	 * @return Object decoded value
	 */
	public Object decodeValue(String value) {
		return OptionValuesDecoder.decode(value, getValueType(type));
	}
	
	/**
	 * Finds the setter for the attribute of this option in the given program.
	 * A setter receiving the type of this option is preferred over a setter receiving a String
	 * @param programInstance Object implementing a command
	 * @return Method setter for the attribute related to this option
	 * @throws RuntimeException If the program does not have a suitable setter
	 */
	public Method findSetMethod(Object programInstance) {
		String methodName = "set"+Character.toUpperCase(attribute.charAt(0))+attribute.substring(1);
		Class<?> valueType = getValueType(type);
		Method stringSetter = null;
		for(Method m:programInstance.getClass().getMethods()) {
			if(!m.getName().equals(methodName) || m.getParameterTypes().length!=1) continue;
			Class<?> paramType = m.getParameterTypes()[0];
			if(paramType.equals(valueType) || paramType.equals(getPrimitiveType(valueType))) return m;
			if(paramType.equals(String.class)) stringSetter = m;
		}
		if(stringSetter!=null) return stringSetter;
		throw new RuntimeException("Class "+programInstance.getClass().getName()+" does not have a method "+methodName+" for option "+id);
	}
	
	private static Class<?> getValueType(String type) {
		if(TYPE_BOOLEAN.equals(type)) return Boolean.class;
		if(TYPE_INT.equals(type)) return Integer.class;
		if(TYPE_LONG.equals(type)) return Long.class;
		if(TYPE_DOUBLE.equals(type)) return Double.class;
		if(TYPE_STRING.equals(type) || TYPE_FILE.equals(type)) return String.class;
		return null;
	}
	
	private static Class<?> getPrimitiveType(Class<?> type) {
		if(type==Boolean.class) return boolean.class;
		if(type==Integer.class) return int.class;
		if(type==Long.class) return long.class;
		if(type==Double.class) return double.class;
		return type;
	}
}
