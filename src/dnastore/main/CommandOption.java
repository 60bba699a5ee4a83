/*******************************************************************************
 * DNAStore - Transducer based codec for DNA data storage
 * Copyright 2026 The DNAStore developers
 *
 * This file is part of DNAStore.
 *
 *     DNAStore is free software: you can redistribute it and/or modify
 *     it under the terms of the GNU General Public License as published by
 *     the Free Software Foundation, either version 3 of the License, or
 *     (at your option) any later version.
 *
 *     DNAStore is distributed in the hope that it will be useful,
 *     but WITHOUT ANY WARRANTY; without even the implied warranty of
 *     MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *     GNU General Public License for more details.
 *
 *     You should have received a copy of the GNU General Public License
 *     along with DNAStore.  If not, see <http://www.gnu.org/licenses/>.
 *******************************************************************************/
package dnastore.main;

import java.lang.reflect.Method;

/**
 * Optional argument of a command. The value is set on the program calling the setter of the option attribute
 * @author DNAStore developers
 *
 */
public class CommandOption {
	public static final String TYPE_INT = "INT";
	public static final String TYPE_LONG = "LONG";
	public static final String TYPE_DOUBLE = "DOUBLE";
	public static final String TYPE_STRING = "STRING";
	public static final String TYPE_FILE = "FILE";
	public static final String TYPE_BOOLEAN = "BOOLEAN";

	private String id;
	private String type = TYPE_STRING;
	private String defaultValue=null;
	private String description;
	private String attribute;

	public CommandOption(String id) {
		super();
		this.id = id;
	}
	public String getId() {
		return id;
	}
	public String getType() {
		return type;
	}
	public void setType(String type) {
		getTypeClass(type);
		this.type = type;
	}
	public String getDefaultValue() {
		return defaultValue;
	}
	public void setDefaultValue(String defaultValue) {
		this.defaultValue = defaultValue;
	}
	public String getDescription() {
		return description;
	}
	public void setDescription(String description) {
		this.description = description;
	}
	/**
	 * @return String Name of the attribute of the program modified by this option
	 */
	public String getAttribute() {
		return attribute;
	}
	public void setAttribute(String attribute) {
		this.attribute = attribute;
	}
	public boolean printType () {
		return !TYPE_BOOLEAN.equals(type);
	}
	public int getPrintLength() {
		int length = id.length()+9;
		if(printType()) length+=type.length()+1;
		return length;
	}
	/**
	 * Finds the setter of the attribute in the given program. Setters receiving the boxed type of the option are
	 * preferred over setters receiving a String
	 * @param instance Program
	 * @return Method Setter to call
	 */
	public Method findSetMethod (Object instance) {
		if(attribute==null) throw new RuntimeException("Attribute not set for option: "+id);
		String methodName = "set"+Character.toUpperCase(attribute.charAt(0))+attribute.substring(1);
		try {
			return instance.getClass().getMethod(methodName,getTypeClass(type));
		} catch (NoSuchMethodException | SecurityException e) {
			try {
				return instance.getClass().getMethod(methodName,String.class);
			} catch (NoSuchMethodException | SecurityException e1) {
				throw new RuntimeException("Program "+instance.getClass().getName()+" does not have a setter for option "+id,e);
			}
		}
	}
	private static Class<?> getTypeClass(String type) {
		if(TYPE_BOOLEAN.equals(type)) return Boolean.class;
		if(TYPE_INT.equals(type)) return Integer.class;
		if(TYPE_LONG.equals(type)) return Long.class;
		if(TYPE_DOUBLE.equals(type)) return Double.class;
		if(TYPE_STRING.equals(type) || TYPE_FILE.equals(type)) return String.class;
		throw new RuntimeException("Unrecognized option type: "+type);
	}
	public Object decodeValue (String value) {
		return OptionValuesDecoder.decode(value, getTypeClass(type));
	}
}
