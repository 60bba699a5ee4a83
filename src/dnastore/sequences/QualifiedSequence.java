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
package dnastore.sequences;

/**
 * Named sequence of characters with optional comments
 * @author DNAStore developers
 *
 */
public class QualifiedSequence {
	private String name;
	private String comments;
	private CharSequence characters;

	public QualifiedSequence(String name, CharSequence characters) {
		super();
		this.name = name;
		this.characters = characters;
	}
	public String getName() {
		return name;
	}
	public void setName(String name) {
		this.name = name;
	}
	public String getComments() {
		return comments;
	}
	public void setComments(String comments) {
		this.comments = comments;
	}
	public CharSequence getCharacters() {
		return characters;
	}
	public void setCharacters(CharSequence characters) {
		this.characters = characters;
	}
	public int getLength() {
		return characters.length();
	}
}
