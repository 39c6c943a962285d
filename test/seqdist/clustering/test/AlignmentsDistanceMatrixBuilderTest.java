package seqdist.clustering.test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import junit.framework.TestCase;
import seqdist.alignments.AlignmentOrchestrator;
import seqdist.alignments.AlignmentSet;
import seqdist.alignments.MalformedInputException;
import seqdist.alignments.ValidationResult;
import seqdist.clustering.AlignmentsDistanceMatrixBuilder;
import seqdist.clustering.DistanceMatrix;

public class AlignmentsDistanceMatrixBuilderTest extends TestCase {
	
	private AlignmentsDistanceMatrixBuilder builder = new AlignmentsDistanceMatrixBuilder();
	
	public void testThreeSequences() throws MalformedInputException {
		Map<Object, Object> raw = new LinkedHashMap<>();
		raw.put(Arrays.asList(1,2), new String[] {"AA","AA"});
		raw.put(Arrays.asList(1,3), new String[] {"AA","AT"});
		raw.put(Arrays.asList(2,3), new String[] {"AA","AT"});
		DistanceMatrix matrix = builder.build(raw).getValueOrThrow();
		assertEquals(3, matrix.getNumSamples());
		assertEquals(Arrays.asList("1","2","3"), matrix.getIds());
		assertEquals(matrix.getDistance(0, 2), matrix.getDistance(1, 2), 0);
		assertEquals(-0.75*Math.log(1.0/3.0), matrix.getDistance(0, 2), 1E-12);
		assertEquals(0.0, matrix.getDistance(0, 1), 0);
		assertSymmetricWithZeroDiagonal(matrix);
	}
	
	public void testHandCraftedAlignments() throws MalformedInputException {
		Map<Object, Object> raw = new LinkedHashMap<>();
		raw.put(Arrays.asList(1,2), new String[] {"ACGTCGTAACAA","ACGTCGTTACGT"});
		raw.put(Arrays.asList(1,3), new String[] {"ACGTACGT--ACGT","ACGTTCGTATGCGT"});
		raw.put(Arrays.asList(1,4), new String[] {"ACGTACGTACACGTACGT--ACGTACGTACGTAAACGTTCGTATGCGT","ACGTACGTAAACGTTCGTATGCGTACGTACGTACACGTACGT--ACGT"});
		raw.put(Arrays.asList(2,3), new String[] {"ACGTACGT--ACGT","ACGTTCGTATGCGT"});
		raw.put(Arrays.asList(2,4), new String[] {"ACGTACGT--ACGT","ACGTTCGTATGCGT"});
		raw.put(Arrays.asList(3,4), new String[] {"ACGTACGTACACGTACGT--ACGTACGTACACGTACGTGTAAACGTTCGTATGCGT","ACGTACGTAAACGTTCGTATGCACGTACGTGTACGTACGTACACGTACGT--ACGT"});
		DistanceMatrix matrix = builder.build(raw).getValueOrThrow();
		assertEquals(4, matrix.getNumSamples());
		assertSymmetricWithZeroDiagonal(matrix);
		double expected = -0.75*Math.log(7.0/9.0);
		assertEquals(expected, matrix.getDistance(0, 2), 1E-12);
		assertEquals(expected, matrix.getDistance(1, 2), 1E-12);
		assertEquals(expected, matrix.getDistance(1, 3), 1E-12);
		// Pair (1,2): 12 comparable columns, 3 mismatches
		assertEquals(-0.75*Math.log(1.0-(4.0/3.0)*0.25), matrix.getDistance(0, 1), 1E-12);
	}
	
	public void testFromCalculatedAlignments() throws MalformedInputException {
		List<String> sequences = Arrays.asList("ACGTACGTAC","ACGTACGAAC","TTGTACGTAC","ACGTAC");
		AlignmentSet alignments = new AlignmentOrchestrator().alignAllCharacters(sequences);
		DistanceMatrix matrix = builder.build(alignments, Arrays.asList("Human","Chimp","Mouse","Rat")).getValueOrThrow();
		assertEquals(Arrays.asList("Human","Chimp","Mouse","Rat"), matrix.getIds());
		assertSymmetricWithZeroDiagonal(matrix);
		assertEquals(-0.75*Math.log(1.0-(4.0/3.0)*0.1), matrix.getDistance(0, 1), 1E-12);
		// Rat aligns to the first six bases of Human without mismatches
		assertEquals(0.0, matrix.getDistance(0, 3), 0);
	}
	
	public void testIncompleteSetRejected() {
		Map<Object, Object> raw = new LinkedHashMap<>();
		raw.put(Arrays.asList(1,2), new String[] {"AA","AA"});
		raw.put(Arrays.asList(1,3), new String[] {"AA","AT"});
		ValidationResult<DistanceMatrix> result = builder.build(raw);
		assertFalse(result.isValid());
		assertTrue(result.getError().getReason().contains("(2, 3)"));
	}
	
	public void testLowerCaseBasesMismatchUpperCase() throws MalformedInputException {
		Map<Object, Object> raw = new LinkedHashMap<>();
		raw.put(Arrays.asList(1,2), new String[] {"acgt","ACGT"});
		DistanceMatrix matrix = builder.build(raw).getValueOrThrow();
		assertEquals(30.0, matrix.getDistance(0, 1), 0);
		assertSymmetricWithZeroDiagonal(matrix);
	}

	public void testMissingLabel() {
		AlignmentSet alignments = new AlignmentOrchestrator().alignAllCharacters(Arrays.asList("ACGT","ACGA","AGGA"));
		assertFalse(builder.build(alignments, Arrays.asList("Human","Chimp")).isValid());
	}
	
	public void testPrintMatrix() throws MalformedInputException {
		Map<Object, Object> raw = new LinkedHashMap<>();
		raw.put(Arrays.asList(0,1), new String[] {"AAAA","ATAA"});
		DistanceMatrix matrix = builder.build(raw).getValueOrThrow();
		String d = String.valueOf(matrix.getDistance(0, 1));
		assertEquals("2\n0 0.0 "+d+"\n1 "+d+" 0.0\n", print(matrix));
		matrix.setMatrixOutputType(DistanceMatrix.MATRIX_TYPE_LOWER_LEFT);
		assertEquals("2\n0\n1 "+d+"\n", print(matrix));
		matrix.setMatrixOutputType(DistanceMatrix.MATRIX_TYPE_UPPER_RIGHT);
		assertEquals("2\n0 "+d+"\n1\n", print(matrix));
	}
	
	private String print(DistanceMatrix matrix) {
		ByteArrayOutputStream os = new ByteArrayOutputStream();
		PrintStream out = new PrintStream(os);
		matrix.printMatrix(out);
		out.flush();
		return os.toString().replace("\r\n", "\n");
	}
	
	private void assertSymmetricWithZeroDiagonal(DistanceMatrix matrix) {
		int n = matrix.getNumSamples();
		for(int i=0;i<n;i++) {
			assertEquals(0.0, matrix.getDistance(i, i), 0);
			for(int j=0;j<n;j++) {
				assertEquals(matrix.getDistance(i, j), matrix.getDistance(j, i), 0);
				assertTrue(matrix.getDistance(i, j)>=0);
			}
		}
	}
}
