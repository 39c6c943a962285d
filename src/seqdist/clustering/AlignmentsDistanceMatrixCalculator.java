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
package seqdist.clustering;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import seqdist.alignments.AlignmentOrchestrator;
import seqdist.alignments.AlignmentSet;
import seqdist.alignments.IndexPair;
import seqdist.alignments.MalformedInputException;
import seqdist.alignments.PairwiseAlignment;
import seqdist.main.CommandsDescriptor;
import seqdist.main.ProgressNotifier;
import seqdist.sequences.QualifiedSequence;
import seqdist.sequences.io.LabeledSequencesFileReader;

/**
 * Program that aligns every pair of sequences of a file and writes the Jukes-Cantor distance matrix
 */
public class AlignmentsDistanceMatrixCalculator {
	
	// Constants for default values
	public static final int DEF_MATRIX_TYPE = DistanceMatrix.MATRIX_TYPE_FULL;
	public static final int DEF_NUM_THREADS = AlignmentOrchestrator.DEF_NUM_THREADS;
	public static final long DEF_SECONDS_PER_PAIR = AlignmentOrchestrator.DEF_SECONDS_PER_PAIR;
	
	// Logging and progress
	private Logger log = Logger.getLogger(AlignmentsDistanceMatrixCalculator.class.getName());
	private ProgressNotifier progressNotifier=null;
	
	// Parameters
	private String inputFile = null;
	private String outputFile = null;
	private String alignmentsFile = null;
	private int matrixType = DEF_MATRIX_TYPE;
	private int numThreads = DEF_NUM_THREADS;
	private long secondsPerPair = DEF_SECONDS_PER_PAIR;
	
	// Model attributes
	private LabeledSequencesFileReader reader = new LabeledSequencesFileReader();
	private AlignmentsDistanceMatrixBuilder builder = new AlignmentsDistanceMatrixBuilder();
	
	public Logger getLog() {
		return log;
	}
	public void setLog(Logger log) {
		this.log = log;
	}
	public ProgressNotifier getProgressNotifier() {
		return progressNotifier;
	}
	public void setProgressNotifier(ProgressNotifier progressNotifier) {
		this.progressNotifier = progressNotifier;
	}
	
	public String getInputFile() {
		return inputFile;
	}
	public void setInputFile(String inputFile) {
		this.inputFile = inputFile;
	}
	public String getOutputFile() {
		return outputFile;
	}
	public void setOutputFile(String outputFile) {
		this.outputFile = outputFile;
	}
	public String getAlignmentsFile() {
		return alignmentsFile;
	}
	public void setAlignmentsFile(String alignmentsFile) {
		this.alignmentsFile = alignmentsFile;
	}
	public int getMatrixType() {
		return matrixType;
	}
	public void setMatrixType(int matrixType) {
		if(matrixType<DistanceMatrix.MATRIX_TYPE_FULL || matrixType>DistanceMatrix.MATRIX_TYPE_UPPER_RIGHT) throw new IllegalArgumentException("Unknown matrix type: "+matrixType);
		this.matrixType = matrixType;
	}
	public int getNumThreads() {
		return numThreads;
	}
	public void setNumThreads(int numThreads) {
		if(numThreads<1) throw new IllegalArgumentException("Number of threads must be positive. Given: "+numThreads);
		this.numThreads = numThreads;
	}
	public long getSecondsPerPair() {
		return secondsPerPair;
	}
	public void setSecondsPerPair(long secondsPerPair) {
		if(secondsPerPair<1) throw new IllegalArgumentException("Seconds per pair must be positive. Given: "+secondsPerPair);
		this.secondsPerPair = secondsPerPair;
	}
	
	public static void main(String[] args) throws Exception {
		AlignmentsDistanceMatrixCalculator instance = new AlignmentsDistanceMatrixCalculator();
		int i = CommandsDescriptor.getInstance().loadOptions(instance, args);
		if(i>=args.length) {
			System.err.println("A file with sequences is required");
			CommandsDescriptor.getInstance().printHelp(AlignmentsDistanceMatrixCalculator.class);
			System.exit(1);
		}
		instance.setInputFile(args[i++]);
		instance.run();
	}
	
	public void run() throws IOException, MalformedInputException {
		logParameters();
		if(inputFile==null) throw new IOException("A file with sequences is required");
		List<QualifiedSequence> sequences = reader.loadSequences(inputFile);
		DistanceMatrix matrix = calculateMatrix(sequences);
		if(outputFile==null) {
			matrix.printMatrix(System.out);
		} else {
			try (PrintStream out = new PrintStream(outputFile)) {
				matrix.printMatrix(out);
			}
		}
		log.info("Process finished");
	}
	
	/**
	 * Aligns the given sequences and calculates the distances between them
	 * @param sequences to compare. Rows of the matrix follow the order of this list
	 * @return DistanceMatrix with rows named after the sequences
	 * @throws IOException If less than two sequences are given or if the alignments can not be written
	 * @throws MalformedInputException If the calculated alignments are not valid
	 */
	public DistanceMatrix calculateMatrix(List<QualifiedSequence> sequences) throws IOException, MalformedInputException {
		if(sequences.size()<2) throw new IOException("At least two sequences are required to calculate distances. Loaded: "+sequences.size());
		AlignmentOrchestrator orchestrator = new AlignmentOrchestrator();
		orchestrator.setLog(log);
		orchestrator.setNumThreads(numThreads);
		orchestrator.setSecondsPerPair(secondsPerPair);
		orchestrator.setProgressNotifier(progressNotifier);
		AlignmentSet alignments = orchestrator.alignAll(sequences);
		if(alignmentsFile!=null) printAlignments(sequences, alignments, alignmentsFile);
		List<String> labels = new ArrayList<>(sequences.size());
		for(QualifiedSequence seq:sequences) labels.add(seq.getName());
		DistanceMatrix matrix = builder.build(alignments, labels).getValueOrThrow();
		matrix.setMatrixOutputType(matrixType);
		return matrix;
	}
	
	private void printAlignments(List<QualifiedSequence> sequences, AlignmentSet alignments, String filename) throws IOException {
		try (PrintStream out = new PrintStream(filename)) {
			for(Map.Entry<IndexPair, PairwiseAlignment> entry:alignments.asMap().entrySet()) {
				IndexPair pair = entry.getKey();
				PairwiseAlignment aln = entry.getValue();
				String score = aln.hasScore()?String.valueOf(aln.getScore()):"NA";
				out.println(">"+pair.getFirst()+"\t"+pair.getSecond()+"\t"+sequences.get(pair.getFirst()).getName()+"\t"+sequences.get(pair.getSecond()).getName()+"\t"+score);
				out.println(aln.getAlignedSequence1());
				out.println(aln.getAlignedSequence2());
			}
		}
		log.info("Written "+alignments.size()+" alignments to "+filename);
	}
	
	public void logParameters() {
		ByteArrayOutputStream os = new ByteArrayOutputStream();
		PrintStream out = new PrintStream(os);
		out.println("Input file: "+ inputFile);
		if(outputFile!=null) out.println("Output file: "+ outputFile);
		else out.println("Matrix written to standard output");
		if(alignmentsFile!=null) out.println("Alignments file: "+ alignmentsFile);
		out.println("Matrix type: "+ matrixType);
		out.println("Number of threads: "+ numThreads);
		out.println("Maximum seconds per pair: "+ secondsPerPair);
		log.info(os.toString());
	}
}
