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

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonParseException;

import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;
import pixl.LogTools.LogLevel;
import pixl.lib.images.ImageCodec;
import pixl.lib.images.io.ImageIOCodec;
import pixl.lib.io.GsonTools;
import pixl.lib.plugins.CancellationContext;
import pixl.lib.plugins.parameters.ParameterList;

/**
 * Shared options and parameter handling for the processing subcommands.
 * <p>
 * Parameters start from the algorithm defaults, are then updated from any JSON file given with 
 * {@code --params}, and finally from explicit command line options.
 */
abstract class AbstractPixlCommand implements Callable<Integer> {
	
	private static final Logger logger = LoggerFactory.getLogger(AbstractPixlCommand.class);
	
	/**
	 * Exit code if the arguments are valid but the images cannot be processed.
	 */
	static final int EXIT_FAILED = 1;
	
	/**
	 * Exit code if processing was cancelled, e.g. because of a timeout.
	 */
	static final int EXIT_CANCELLED = 3;
	
	@Spec
	CommandSpec spec;
	
	@Option(names = {"--params"}, paramLabel = "file.json", description = "JSON file containing parameter values.")
	private Path paramsFile;
	
	@Option(names = {"-l", "--log"}, description = {"Log level (default = INFO).", "Options: ${COMPLETION-CANDIDATES}"})
	private LogLevel logLevel;
	
	@Option(names = {"--timeout"}, paramLabel = "seconds", description = "Cancel processing if it takes longer than this.")
	private Double timeoutSeconds;
	
	@Option(names = {"-h", "--help"}, usageHelp = true, description = "Show this help message and exit.")
	private boolean usageHelpRequested;
	
	private final ImageCodec codec = new ImageIOCodec();
	
	@Override
	public Integer call() throws Exception {
		if (logLevel != null)
			LogTools.setRootLogLevel(logLevel);
		
		var params = buildParameterList();
		logger.debug("Running {} with parameters {}", spec.name(), ParameterList.getParameterListJSON(params));
		
		CancellationContext cancellation;
		if (timeoutSeconds == null)
			cancellation = new CancellationContext();
		else if (timeoutSeconds > 0)
			cancellation = CancellationContext.withDeadline(Duration.ofMillis(Math.round(timeoutSeconds * 1000)));
		else
			throw new ParameterException(spec.commandLine(), "Timeout must be > 0, but got " + timeoutSeconds);
		
		try {
			if (!process(params, cancellation)) {
				logger.warn("{} was cancelled before completion, no output was written", spec.name());
				return EXIT_CANCELLED;
			}
		} catch (IllegalArgumentException | IOException e) {
			logger.error("{} failed: {}", spec.name(), e.getLocalizedMessage());
			logger.debug(e.getLocalizedMessage(), e);
			return EXIT_FAILED;
		}
		return 0;
	}
	
	/**
	 * Build the parameter list that will be passed to {@link #process(ParameterList, CancellationContext)}.
	 * @return
	 * @throws IOException if a parameter file cannot be read
	 */
	ParameterList buildParameterList() throws IOException {
		var params = createParameterList();
		if (paramsFile != null) {
			Map<String, String> map;
			try {
				map = GsonTools.readParameterMap(paramsFile);
			} catch (JsonParseException e) {
				throw new ParameterException(spec.commandLine(), "Invalid parameter file " + paramsFile + ": " + e.getLocalizedMessage(), e);
			}
			int n = ParameterList.updateParameterList(params, map, Locale.ROOT);
			logger.debug("Set {} of {} parameter(s) from {}", n, map.size(), paramsFile);
		}
		for (var entry : getParameterOverrides().entrySet()) {
			if (entry.getValue() == null)
				continue;
			var map = Map.of(entry.getKey(), entry.getValue().toString());
			if (ParameterList.updateParameterList(params, map, Locale.ROOT) != 1)
				throw new ParameterException(spec.commandLine(), "Invalid value for " + params.getParameters().get(entry.getKey()).getPrompt() + ": " + entry.getValue());
		}
		return params;
	}
	
	/**
	 * Get the codec used to read and write images.
	 * @return
	 */
	ImageCodec getCodec() {
		return codec;
	}
	
	/**
	 * Create the default parameter list for the algorithm.
	 * @return
	 */
	abstract ParameterList createParameterList();
	
	/**
	 * Get parameter values given explicitly on the command line, keyed as in {@link #createParameterList()}.
	 * Null values are ignored.
	 * @return
	 */
	abstract Map<String, Object> getParameterOverrides();
	
	/**
	 * Read the input, run the algorithm and write the output.
	 * @param params
	 * @param cancellation
	 * @return true if completed, false if cancelled
	 * @throws IOException
	 */
	abstract boolean process(ParameterList params, CancellationContext cancellation) throws IOException;
	
	static Map<String, Object> overrides(Object... keyValues) {
		Map<String, Object> map = new LinkedHashMap<>();
		for (int i = 0; i < keyValues.length; i += 2)
			map.put((String)keyValues[i], keyValues[i+1]);
		return map;
	}

}
