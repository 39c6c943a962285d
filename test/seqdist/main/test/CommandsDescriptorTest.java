package seqdist.main.test;

import java.util.List;

import junit.framework.TestCase;
import seqdist.clustering.AlignmentsDistanceMatrixCalculator;
import seqdist.main.Command;
import seqdist.main.CommandOption;
import seqdist.main.CommandsDescriptor;
import seqdist.main.OptionValuesDecoder;

public class CommandsDescriptorTest extends TestCase {
	
	public void testCommandCatalog() {
		CommandsDescriptor descriptor = CommandsDescriptor.getInstance();
		assertEquals("1.0.0", descriptor.getSwVersion());
		Command command = descriptor.getCommand("AlignmentsDistanceMatrix");
		assertNotNull(command);
		assertEquals(AlignmentsDistanceMatrixCalculator.class, command.getProgram());
		assertSame(command, descriptor.getCommandByClass(AlignmentsDistanceMatrixCalculator.class.getName()));
		assertEquals(1, command.getArguments().size());
		List<CommandOption> options = command.getOptionsList();
		assertEquals(5, options.size());
		CommandOption threads = command.getOption("t");
		assertEquals(CommandOption.TYPE_INT, threads.getType());
		assertEquals("numThreads", threads.getAttribute());
		assertEquals(String.valueOf(AlignmentsDistanceMatrixCalculator.DEF_NUM_THREADS), threads.getDefaultValue());
		assertNull(descriptor.getCommand("Unknown"));
	}
	
	public void testDecodeValues() {
		assertEquals(3, OptionValuesDecoder.decode(" 3", Integer.class));
		assertEquals(10L, OptionValuesDecoder.decode("10", long.class));
		assertEquals(0.5, OptionValuesDecoder.decode("0.5", Double.class));
		assertEquals(Boolean.TRUE, OptionValuesDecoder.decode("true", Boolean.class));
		assertEquals("file.txt", OptionValuesDecoder.decode("file.txt", String.class));
		try {
			OptionValuesDecoder.decode("x", Integer.class);
			fail("Invalid numbers should be rejected");
		} catch (NumberFormatException e) {
			// expected
		}
	}
}
