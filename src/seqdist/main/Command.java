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
package seqdist.main;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Information of a command available from the command line
 */
public class Command {
	private String id;
	private Class<?> program;
	private String groupId;
	private String title;
	private String intro;
	private String description;
	private boolean printHelp = true;
	private List<String> arguments = new ArrayList<>();
	private Set<String> multipleArguments = new HashSet<>();
	private Map<String,CommandOption> options = new LinkedHashMap<>();
	
	public Command(String id, Class<?> program) {
		this.id = id;
		this.program = program;
	}
	public String getId() {
		return id;
	}
	public Class<?> getProgram() {
		return program;
	}
	public String getGroupId() {
		return groupId;
	}
	public void setGroupId(String groupId) {
		this.groupId = groupId;
	}
	public String getTitle() {
		return title;
	}
	public void setTitle(String title) {
		this.title = title;
	}
	public String getIntro() {
		return intro;
	}
	public void setIntro(String intro) {
		this.intro = intro;
	}
	public String getDescription() {
		return description;
	}
	public void setDescription(String description) {
		this.description = description;
	}
	public boolean isPrintHelp() {
		return printHelp;
	}
	public void setPrintHelp(boolean printHelp) {
		this.printHelp = printHelp;
	}
	public void addArgument(String argument, boolean multiple) {
		arguments.add(argument);
		if(multiple) multipleArguments.add(argument);
	}
	public List<String> getArguments() {
		return Collections.unmodifiableList(arguments);
	}
	public boolean isMultiple(String argument) {
		return multipleArguments.contains(argument);
	}
	public void addOption(CommandOption option) {
		if(options.containsKey(option.getId())) throw new RuntimeException("Duplicated option "+option.getId()+" for command "+id);
		options.put(option.getId(), option);
	}
	public CommandOption getOption(String optionId) {
		return options.get(optionId);
	}
	public List<CommandOption> getOptionsList() {
		return new ArrayList<>(options.values());
	}
}
