package seqdist.alignments.test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CancellationException;

import junit.framework.TestCase;
import seqdist.alignments.AlignmentOrchestrator;
import seqdist.alignments.AlignmentSet;
import seqdist.alignments.AlignmentSetValidator;
import seqdist.alignments.IndexPair;
import seqdist.alignments.PairwiseAlignerNeedlemanWunsch;
import seqdist.alignments.PairwiseAlignment;
import seqdist.sequences.DNASequence;
import seqdist.sequences.QualifiedSequence;

public class AlignmentOrchestratorTest extends TestCase {
	
	public void testAlignAll() {
		List<QualifiedSequence> sequences = new ArrayList<>();
		sequences.add(new QualifiedSequence("Human", "ACGT"));
		sequences.add(new QualifiedSequence("Mouse", "AGT"));
		sequences.add(new QualifiedSequence("Rat", "ACGT"));
		AlignmentOrchestrator orchestrator = new AlignmentOrchestrator();
		AlignmentSet alignments = orchestrator.alignAll(sequences);
		assertEquals(3, alignments.size());
		assertEquals(Arrays.asList(new IndexPair(0, 1),new IndexPair(0, 2),new IndexPair(1, 2)), new ArrayList<>(alignments.getPairs()));
		PairwiseAlignment aln01 = alignments.getAlignment(0, 1);
		assertEquals("ACGT", aln01.getAlignedSequence1());
		assertEquals("A-GT", aln01.getAlignedSequence2());
		PairwiseAlignment aln12 = alignments.getAlignment(1, 2);
		assertEquals("A-GT", aln12.getAlignedSequence1());
		assertEquals("ACGT", aln12.getAlignedSequence2());
		assertEquals(20, alignments.getAlignment(0, 2).getScore());
		assertTrue(new AlignmentSetValidator().validate(alignments).isValid());
	}
	
	public void testFewSequences() {
		AlignmentOrchestrator orchestrator = new AlignmentOrchestrator();
		assertTrue(orchestrator.alignAllCharacters(new ArrayList<String>()).isEmpty());
		assertTrue(orchestrator.alignAllCharacters(Arrays.asList("ACGT")).isEmpty());
	}
	
	public void testParallelMatchesSequential() {
		Random rand = new Random(7);
		List<String> sequences = new ArrayList<>();
		for(int i=0;i<12;i++) {
			StringBuilder seq = new StringBuilder();
			int length = 20+rand.nextInt(30);
			for(int j=0;j<length;j++) seq.append(DNASequence.BASES_STRING.charAt(rand.nextInt(4)));
			sequences.add(seq.toString());
		}
		AlignmentOrchestrator sequential = new AlignmentOrchestrator();
		AlignmentSet expected = sequential.alignAllCharacters(sequences);
		AlignmentOrchestrator parallel = new AlignmentOrchestrator();
		parallel.setNumThreads(4);
		AlignmentSet actual = parallel.alignAllCharacters(sequences);
		assertEquals(66, actual.size());
		assertEquals(new ArrayList<>(expected.getPairs()), new ArrayList<>(actual.getPairs()));
		for(IndexPair pair:expected.getPairs()) {
			PairwiseAlignment e = expected.getAlignment(pair);
			PairwiseAlignment a = actual.getAlignment(pair);
			assertEquals(e.getAlignedSequence1(), a.getAlignedSequence1());
			assertEquals(e.getAlignedSequence2(), a.getAlignedSequence2());
			assertEquals(e.getScore(), a.getScore());
		}
	}
	
	public void testCancellation() {
		AlignmentOrchestrator orchestrator = new AlignmentOrchestrator();
		orchestrator.setProgressNotifier((progress)->progress<2);
		try {
			orchestrator.alignAllCharacters(Arrays.asList("ACGT","AGT","ACT","AAT"));
			fail("Process should be cancelled");
		} catch (CancellationException e) {
			// expected
		}
	}
	
	public void testNotifierAskedOnlyBeforePendingPairs() {
		List<String> sequences = Arrays.asList("ACGT","AGT","ACT");
		for(int numThreads=1;numThreads<=2;numThreads++) {
			AlignmentOrchestrator orchestrator = new AlignmentOrchestrator();
			orchestrator.setNumThreads(numThreads);
			// Stops only once every pair has been aligned
			orchestrator.setProgressNotifier((progress)->progress<3);
			AlignmentSet alignments = orchestrator.alignAllCharacters(sequences);
			assertEquals(3, alignments.size());
		}
	}
	
	public void testFailureInWorkerThread() {
		AlignmentOrchestrator orchestrator = new AlignmentOrchestrator();
		orchestrator.setNumThreads(2);
		orchestrator.setAligner((s1,s2)->{
			if(s1.length()==3) throw new IllegalStateException("Unexpected sequence");
			return new PairwiseAlignerNeedlemanWunsch().calculateAlignment(s1, s2);
		});
		try {
			orchestrator.alignAllCharacters(Arrays.asList("ACGT","AGT","ACT"));
			fail("Failures of worker threads should be reported");
		} catch (RuntimeException e) {
			assertTrue(e.getCause() instanceof IllegalStateException);
		}
	}
}
