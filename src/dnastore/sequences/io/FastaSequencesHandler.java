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
package dnastore.sequences.io;

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.GZIPInputStream;

import dnastore.sequences.QualifiedSequence;

/**
 * Loads and writes sets of sequences in fasta format
 * @author DNAStore developers
 *
 */
public class FastaSequencesHandler {
	public static final int DEF_LINE_LENGTH = 60;

	/**
	 * Loads the sequences present in the given file. Files ending with .gz are decompressed
	 * @param filename Name of the fasta file where sequences must be loaded
	 * @return List<QualifiedSequence> loaded sequences in file order
	 * @throws IOException If the file can not be read
	 */
	public List<QualifiedSequence> loadSequences(String filename) throws IOException {
		try (InputStream fis = new FileInputStream(filename)) {
			if(filename.endsWith(".gz")) {
				try (InputStream gis = new GZIPInputStream(fis)) {
					return loadSequences(gis);
				}
			}
			return loadSequences(fis);
		}
	}

	/**
	 * Loads the sequences available in the given stream. The stream is not closed
	 * @param is Stream with sequences in fasta format
	 * @return List<QualifiedSequence> loaded sequences in stream order
	 * @throws IOException If the stream can not be read
	 */
	public List<QualifiedSequence> loadSequences(InputStream is) throws IOException {
		List<QualifiedSequence> answer = new ArrayList<QualifiedSequence>();
		BufferedReader in = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8));
		String id = null;
		String comment = null;
		StringBuilder buffer = new StringBuilder();
		String line=in.readLine();
		while(line!=null) {
			if(line.startsWith(">")) {
				addSequence(answer, id, comment, buffer);
				String idLine = line.substring(1);
				String [] items = idLine.split(" |\t");
				id = items[0];
				if(id.length()+1<idLine.length()) {
					comment = idLine.substring(id.length()+1);
				} else {
					comment = null;
				}
			} else if (!line.startsWith("#")) {
				buffer.append(removeSpaces(line));
			}
			line=in.readLine();
		}
		addSequence(answer, id, comment, buffer);
		return answer;
	}

	private String removeSpaces(String line) {
		StringBuilder answer = new StringBuilder();
		for(int i=0;i<line.length();i++) {
			char c = line.charAt(i);
			if(!Character.isWhitespace(c) && !Character.isISOControl(c)) {
				answer.append(Character.toUpperCase(c));
			}
		}
		return answer.toString();
	}

	private void addSequence(List<QualifiedSequence> sequences, String name, String comments, StringBuilder buffer) {
		if(name!=null) {
			QualifiedSequence seq = new QualifiedSequence(name,buffer.toString());
			if(comments !=null) seq.setComments(comments);
			sequences.add(seq);
		}
		buffer.delete(0, buffer.length());
	}

	/**
	 * Dump all sequences in the given print stream
	 * @param sequences to write
	 * @param out Stream to print the sequences
	 * @param lineLength Number of bases per line
	 */
	public void saveSequences(List<QualifiedSequence> sequences, PrintStream out,int lineLength) {
		for(QualifiedSequence seq: sequences) {
			out.print(">");
			out.print(seq.getName());
			if(seq.getComments()!=null) {
				out.print(" ");
				out.print(seq.getComments());
			}
			out.println();
			CharSequence characters = seq.getCharacters();
			int l = characters.length();
			for(int j=0;j<l;j+=lineLength) {
				out.println(characters.subSequence(j, Math.min(l, j+lineLength)));
			}
		}
	}
}
