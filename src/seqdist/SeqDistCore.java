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
package seqdist;

import java.lang.reflect.Method;
import java.util.Arrays;

import seqdist.main.Command;
import seqdist.main.CommandsDescriptor;

public class SeqDistCore {

	/**
	 * Runs the command given as first argument with the remaining arguments
	 * @param args command followed by its options and arguments
	 */
	public static void main(String[] args) throws Exception {
		CommandsDescriptor descriptor = CommandsDescriptor.getInstance();
		if(args.length == 0 || args[0].equals("help") || args[0].equals("-h") || args[0].equals("--help")){
			descriptor.printUsage();
			return;
		} else if(args[0].equals("version") || args[0].equals("-v") || args[0].equals("--version")){
			descriptor.printVersion();
			return;
		}
		
		Command command = descriptor.getCommand(args[0]);
		if(command == null) {
			System.err.println("ERROR: Unrecognized command "+args[0]);
			descriptor.printUsage();
			System.exit(1);
		}
		Class<?> program = command.getProgram();
		Method main = program.getDeclaredMethod("main", String[].class);
		String[] mainArgs = Arrays.copyOfRange(args, 1, args.length);
		main.invoke(null, (Object)mainArgs);
	}

}
