package seqdist.alignments.test;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import junit.framework.TestCase;
import seqdist.alignments.IndexPair;
import seqdist.alignments.PairEnumerator;

public class PairEnumeratorTest extends TestCase {
	
	private PairEnumerator enumerator = new PairEnumerator();
	
	public void testLexicographicOrder() {
		List<IndexPair> pairs = enumerator.generateAllPairs(4);
		assertEquals(6, pairs.size());
		int [][] expected = {{0,1},{0,2},{0,3},{1,2},{1,3},{2,3}};
		for(int k=0;k<expected.length;k++) {
			assertEquals(expected[k][0], pairs.get(k).getFirst());
			assertEquals(expected[k][1], pairs.get(k).getSecond());
		}
	}
	
	public void testCount() {
		for(int n=0;n<20;n++) {
			List<IndexPair> pairs = enumerator.generateAllPairs(n);
			assertEquals(n*(n-1)/2, pairs.size());
			assertEquals(pairs.size(), new HashSet<>(pairs).size());
		}
	}
	
	public void testSmallLists() {
		assertTrue(enumerator.generateAllPairs(Arrays.asList()).isEmpty());
		assertTrue(enumerator.generateAllPairs(Arrays.asList("ACGT")).isEmpty());
		assertEquals(1, enumerator.generateAllPairs(Arrays.asList("ACGT","AC")).size());
	}
	
	public void testCanonicalPairs() {
		IndexPair p1 = new IndexPair(3, 1);
		IndexPair p2 = new IndexPair(1, 3);
		assertEquals(1, p1.getFirst());
		assertEquals(3, p1.getSecond());
		assertEquals(p1, p2);
		assertEquals(p1.hashCode(), p2.hashCode());
		assertEquals(0, p1.compareTo(p2));
		assertTrue(new IndexPair(0, 5).compareTo(new IndexPair(1, 2))<0);
		Set<IndexPair> set = new HashSet<>(Arrays.asList(p1,p2));
		assertEquals(1, set.size());
	}
	
	public void testIllegalPairs() {
		try {
			new IndexPair(2, 2);
			fail("Self pairs should not be created");
		} catch (IllegalArgumentException e) {
			// expected
		}
		try {
			new IndexPair(-1, 2);
			fail("Negative identifiers should not be accepted");
		} catch (IllegalArgumentException e) {
			// expected
		}
	}
}
