/*******************************************************************************
 * DNAStore - Transducer based codec for DNA data storage
 * Copyright 2026 The DNAStore developers
 *
 * This file is part of DNAStore.
 *
 *     DNAStore is free software: you can redistribute it and/or modify
 *     it under the terms of the GNU General Public License as published by
 *     the Free Software Foundation, either version 3 of the License, or
 *     (at your option) any later version.
 *
 *     DNAStore is distributed in the hope that it will be useful,
 *     but WITHOUT ANY WARRANTY; without even the implied warranty of
 *     MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *     GNU General Public License for more details.
 *
 *     You should have received a copy of the GNU General Public License
 *     along with DNAStore.  If not, see <http://www.gnu.org/licenses/>.
 *******************************************************************************/
package dnastore.main;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Description of a program that can be called from the command line
 * @author DNAStore developers
 *
 */
public class Command {
	private String id;
	private Class<?> program;
	private String title;
	private String intro;
	private String description;
	private String groupId;

	private List<String> arguments = new ArrayList<String>();
	private Map<String, CommandOption> options = new LinkedHashMap<String,CommandOption>();

	public Command(String id, Class<?> program) {
		super();
		this.id = id;
		this.program = program;
	}
	public String getId() {
		return id;
	}
	/**
	 * @return Class<?> Class implementing the program. It must have a static main method
	 */
	public Class<?> getProgram() {
		return program;
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
	public String getGroupId() {
		return groupId;
	}
	public void setGroupId(String groupId) {
		this.groupId = groupId;
	}
	public List<String> getArguments() {
		return new ArrayList<String>(arguments);
	}
	public void addArgument(String argument) {
		arguments.add(argument);
	}
	public List<CommandOption> getOptionsList() {
		return new ArrayList<CommandOption>(options.values());
	}
	public void addOption(CommandOption option) {
		if(options.containsKey(option.getId())) throw new IllegalArgumentException("Duplicated option id: "+option.getId()+" for command "+id);
		options.put(option.getId(), option);
	}
	public CommandOption getOption(String optionId) {
		return options.get(optionId);
	}
}
