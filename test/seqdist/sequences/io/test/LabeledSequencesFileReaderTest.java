package seqdist.sequences.io.test;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

import junit.framework.TestCase;
import seqdist.sequences.QualifiedSequence;
import seqdist.sequences.io.LabeledSequencesFileReader;

public class LabeledSequencesFileReaderTest extends TestCase {
	
	private LabeledSequencesFileReader reader = new LabeledSequencesFileReader();
	
	public void testLoadSequences() throws IOException {
		String contents = ">hUMAN acgt ACGT\n\n  >Mouse   AGT\n>rat\tA C G T T\n";
		List<QualifiedSequence> sequences = reader.loadSequences(stream(contents));
		assertEquals(3, sequences.size());
		assertEquals("Human", sequences.get(0).getName());
		assertEquals("ACGTACGT", sequences.get(0).getCharacters().toString());
		assertEquals("Mouse", sequences.get(1).getName());
		assertEquals("AGT", sequences.get(1).getCharacters().toString());
		assertEquals("Rat", sequences.get(2).getName());
		assertEquals("ACGTT", sequences.get(2).getCharacters().toString());
		assertEquals(5, sequences.get(2).getLength());
	}
	
	public void testEmptyInput() throws IOException {
		assertTrue(reader.loadSequences(stream("\n  \n")).isEmpty());
	}
	
	public void testMalformedRecords() {
		assertMalformed("ACGT\n");
		assertMalformed(">\n");
		assertMalformed(">Human\n");
		assertMalformed(">Human ACGN\n");
		assertMalformed(">Human ACGT\nMouse AGT\n");
	}
	
	public void testLoadFile() throws IOException {
		File file = File.createTempFile("sequences", ".txt");
		file.deleteOnExit();
		try (PrintStream out = new PrintStream(file, "UTF-8")) {
			out.println(">Human ACGTACGT");
			out.println(">Chimp ACGTACGA");
		}
		List<QualifiedSequence> sequences = reader.loadSequences(file.getAbsolutePath());
		assertEquals(2, sequences.size());
		assertEquals("Chimp", sequences.get(1).getName());
	}
	
	public void testMissingFile() {
		try {
			reader.loadSequences(new File("missingSequencesFile.txt").getAbsolutePath());
			fail("Missing files should be reported");
		} catch (IOException e) {
			// expected
		}
	}
	
	public void testNormalizeLabel() {
		assertEquals("Human", LabeledSequencesFileReader.normalizeLabel("HUMAN"));
		assertEquals("E.coli", LabeledSequencesFileReader.normalizeLabel("e.COLI"));
		assertEquals("", LabeledSequencesFileReader.normalizeLabel(""));
	}
	
	public void testNormalizeLabelIgnoresDefaultLocale() throws IOException {
		Locale defaultLocale = Locale.getDefault();
		try {
			Locale.setDefault(new Locale("tr", "TR"));
			assertEquals("Human", LabeledSequencesFileReader.normalizeLabel("HUMAN"));
			assertEquals("Iguana", LabeledSequencesFileReader.normalizeLabel("IGUANA"));
			List<QualifiedSequence> sequences = reader.loadSequences(stream(">MICE acgt\n"));
			assertEquals("Mice", sequences.get(0).getName());
			assertEquals("ACGT", sequences.get(0).getCharacters().toString());
		} finally {
			Locale.setDefault(defaultLocale);
		}
	}
	
	private InputStream stream(String contents) {
		return new ByteArrayInputStream(contents.getBytes(StandardCharsets.UTF_8));
	}
	
	private void assertMalformed(String contents) {
		try {
			reader.loadSequences(stream(contents));
			fail("Contents should be rejected: "+contents);
		} catch (IOException e) {
			// expected
		}
	}
}
