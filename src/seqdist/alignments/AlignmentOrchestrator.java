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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Logger;

import seqdist.main.ProgressNotifier;
import seqdist.main.ThreadPoolManager;
import seqdist.sequences.QualifiedSequence;

/**
 * Calculates the pairwise alignments between every pair of sequences in a list.
 * Pairs are independent from each other, so they can be aligned by a pool of threads.
 * The resulting set always follows the lexicographic order of the pairs.
 */
public class AlignmentOrchestrator {
	
	public static final int DEF_NUM_THREADS = 1;
	public static final long DEF_SECONDS_PER_PAIR = 60;
	
	// Logging and progress
	private Logger log = Logger.getLogger(AlignmentOrchestrator.class.getName());
	private ProgressNotifier progressNotifier=null;
	
	// Parameters
	private int numThreads = DEF_NUM_THREADS;
	private long secondsPerPair = DEF_SECONDS_PER_PAIR;
	
	// Model attributes
	private PairEnumerator pairEnumerator = new PairEnumerator();
	private PairwiseAligner aligner = new PairwiseAlignerNeedlemanWunsch();
	
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
	public PairwiseAligner getAligner() {
		return aligner;
	}
	/**
	 * @param aligner Algorithm to align each pair. It must be safe to call from different threads if more than one thread is used
	 */
	public void setAligner(PairwiseAligner aligner) {
		this.aligner = aligner;
	}
	
	/**
	 * Aligns every pair of the given sequences. Identifiers are the positions of the sequences in the list
	 * @param sequences to align
	 * @return AlignmentSet with one alignment for each pair (i,j) with i&lt;j
	 */
	public AlignmentSet alignAll(List<QualifiedSequence> sequences) {
		List<CharSequence> characters = new ArrayList<>(sequences.size());
		for(QualifiedSequence seq:sequences) characters.add(seq.getCharacters());
		return alignAllCharacters(characters);
	}
	
	/**
	 * Aligns every pair of the given sequences. Identifiers are the positions of the sequences in the list
	 * @param sequences to align
	 * @return AlignmentSet with one alignment for each pair (i,j) with i&lt;j
	 */
	public AlignmentSet alignAllCharacters(List<? extends CharSequence> sequences) {
		List<IndexPair> pairs = pairEnumerator.generateAllPairs(sequences);
		log.info("Aligning "+pairs.size()+" pairs of "+sequences.size()+" sequences using "+numThreads+" threads");
		Map<IndexPair, PairwiseAlignment> results;
		if(numThreads==1) results = alignSequential(sequences, pairs);
		else results = alignParallel(sequences, pairs);
		
		AlignmentSet answer = new AlignmentSet();
		for(IndexPair pair:pairs) {
			PairwiseAlignment aln = results.get(pair);
			if(aln==null) throw new RuntimeException("Alignment not calculated for pair "+pair);
			answer.addAlignment(pair, aln);
		}
		log.info("Calculated "+answer.size()+" pairwise alignments");
		return answer;
	}
	
	private Map<IndexPair, PairwiseAlignment> alignSequential(List<? extends CharSequence> sequences, List<IndexPair> pairs) {
		Map<IndexPair, PairwiseAlignment> results = new ConcurrentHashMap<>();
		int processed = 0;
		for(IndexPair pair:pairs) {
			if(progressNotifier!=null && !progressNotifier.keepRunning(processed)) {
				throw new CancellationException("Alignment process cancelled after "+processed+" pairs");
			}
			results.put(pair, align(sequences, pair));
			processed++;
		}
		return results;
	}
	
	private Map<IndexPair, PairwiseAlignment> alignParallel(List<? extends CharSequence> sequences, List<IndexPair> pairs) {
		Map<IndexPair, PairwiseAlignment> results = new ConcurrentHashMap<>();
		AtomicInteger processed = new AtomicInteger(0);
		AtomicReference<RuntimeException> failure = new AtomicReference<>();
		ThreadPoolManager pool = new ThreadPoolManager(numThreads, pairs.size());
		pool.setSecondsPerTask(secondsPerPair);
		boolean cancelled = false;
		for(IndexPair pair:pairs) {
			if(progressNotifier!=null && !progressNotifier.keepRunning(processed.get())) {
				cancelled = true;
				break;
			}
			try {
				pool.queueTask(()->{
					try {
						results.put(pair, align(sequences, pair));
						processed.incrementAndGet();
					} catch (RuntimeException e) {
						failure.compareAndSet(null, e);
					}
				});
			} catch (InterruptedException e) {
				throw new RuntimeException("Concurrence error aligning pair "+pair,e);
			}
		}
		try {
			pool.terminatePool();
		} catch (InterruptedException e) {
			throw new RuntimeException("Concurrence error aligning pairs",e);
		}
		if(failure.get()!=null) throw new RuntimeException("Error aligning pairs", failure.get());
		if(cancelled) throw new CancellationException("Alignment process cancelled after "+processed.get()+" pairs");
		return results;
	}
	
	private PairwiseAlignment align(List<? extends CharSequence> sequences, IndexPair pair) {
		CharSequence seq1 = sequences.get(pair.getFirst());
		CharSequence seq2 = sequences.get(pair.getSecond());
		return aligner.calculateAlignment(seq1, seq2);
	}
}
