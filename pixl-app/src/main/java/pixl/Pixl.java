/*-
 * #%L
 * This file is part of Pixl.
 * %%
 * Copyright (C) 2026 Pixl developers
 * %%
 * Pixl is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * Pixl is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with Pixl.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package pixl;

import java.util.ArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.HelpCommand;
import picocli.CommandLine.IVersionProvider;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Main Pixl launcher.
 */
@Command(name = "pixl", subcommands = {HelpCommand.class, EqualizeCommand.class, ClaheCommand.class, SlicCommand.class, HdrCommand.class},
	description = "Contrast enhancement, superpixel segmentation and HDR exposure fusion for 8-bit images.",
	footer = {"", "Copyright(c) Pixl developers (2026)"}, 
	mixinStandardHelpOptions = true, versionProvider = Pixl.VersionProvider.class)
public class Pixl implements Runnable {
	
	private static final Logger logger = LoggerFactory.getLogger(Pixl.class);
	
	@Spec
	CommandSpec spec;
	
	/**
	 * Main class to launch Pixl.
	 * 
	 * @param args
	 */
	public static void main(String[] args) {
		int exitCode = createCommandLine().execute(args);
		if (exitCode != 0)
			logger.debug("Exiting with code {}", exitCode);
		System.exit(exitCode);
	}
	
	/**
	 * Create the command line used by {@link #main(String[])}.
	 * @return
	 */
	static CommandLine createCommandLine() {
		var cmd = new CommandLine(new Pixl());
		cmd.setCaseInsensitiveEnumValuesAllowed(true);
		cmd.setExpandAtFiles(false);
		return cmd;
	}

	/**
	 * Without a subcommand, show usage.
	 */
	@Override
	public void run() {
		spec.commandLine().usage(System.out);
	}
	
	
	static class VersionProvider implements IVersionProvider {

		@Override
		public String[] getVersion() throws Exception {
			var strings = new ArrayList<String>();
			var version = Pixl.class.getPackage().getImplementationVersion();
			if (version != null)
				strings.add("Pixl v" + version);
			strings.add("Java " + System.getProperty("java.version"));
			return strings.toArray(String[]::new);
		}
		
	}

}
