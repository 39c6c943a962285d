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
package seqdist.sequences.io;

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;

import seqdist.sequences.DNASequence;
import seqdist.sequences.QualifiedSequence;

/**
 * Loads labeled nucleotide sequences from files in which every record takes a single line:
 * <pre>
 * &gt;label ACGT ACGT...
 * </pre>
 * Blank lines are ignored. Labels are normalized to a capitalized lower case form and
 * sequences are stripped from whitespace and converted to upper case.
 */
public class LabeledSequencesFileReader {
	public static final char RECORD_START = '>';
	
	private Logger log = Logger.getLogger(LabeledSequencesFileReader.class.getName());
	
	public Logger getLog() {
		return log;
	}
	public void setLog(Logger log) {
		this.log = log;
	}
	
	/**
	 * Loads the sequences present in the given filename
	 * @param filename Name of the file where sequences must be loaded
	 * @return List<QualifiedSequence> Unmodifiable list of sequences in the order of the file
	 * @throws IOException If the file can not be read or if its contents are malformed
	 */
	public List<QualifiedSequence> loadSequences(String filename) throws IOException {
		List<QualifiedSequence> answer;
		try (FileInputStream fis = new FileInputStream(filename)) {
			answer = loadSequences(fis);
		}
		log.info("Loaded "+answer.size()+" sequences from "+filename);
		return answer;
	}
	
	/**
	 * Loads the sequences available in the given stream
	 * @param is Stream with the sequences. It is not closed by this method
	 * @return List<QualifiedSequence> Unmodifiable list of sequences in the order of the stream
	 * @throws IOException If the stream can not be read or if its contents are malformed
	 */
	public List<QualifiedSequence> loadSequences(InputStream is) throws IOException {
		List<QualifiedSequence> answer = new ArrayList<>();
		BufferedReader in = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8));
		String line = in.readLine();
		int lineNumber = 1;
		while(line!=null) {
			line = line.trim();
			if(line.length()>0) {
				answer.add(parseRecord(line, lineNumber));
			}
			line = in.readLine();
			lineNumber++;
		}
		return Collections.unmodifiableList(answer);
	}
	
	private QualifiedSequence parseRecord(String line, int lineNumber) throws IOException {
		if(line.charAt(0)!=RECORD_START) throw new IOException("Line "+lineNumber+" does not start with "+RECORD_START);
		String [] items = line.substring(1).trim().split("\\s+");
		if(items.length<2 || items[0].length()==0) throw new IOException("Line "+lineNumber+" must contain a label followed by a sequence");
		String name = normalizeLabel(items[0]);
		StringBuilder sequence = new StringBuilder();
		for(int i=1;i<items.length;i++) sequence.append(items[i]);
		if(!DNASequence.isDNA(sequence)) throw new IOException("Sequence "+name+" at line "+lineNumber+" contains characters other than "+DNASequence.BASES_STRING);
		return new QualifiedSequence(name, sequence.toString().toUpperCase(Locale.ROOT));
	}
	
	/**
	 * Normalizes a label to lower case with the first character in upper case
	 * @param label to normalize
	 * @return String normalized label
	 */
	public static String normalizeLabel(String label) {
		if(label.length()==0) return label;
		String lower = label.toLowerCase(Locale.ROOT);
		return Character.toUpperCase(lower.charAt(0))+lower.substring(1);
	}
}
