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
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import pixl.lib.algorithms.hdr.ExposureFusion;
import pixl.lib.algorithms.hdr.SVDLeastSquaresSolver;
import pixl.lib.images.ImageMetadata;
import pixl.lib.images.PixelImage;
import pixl.lib.plugins.CancellationContext;
import pixl.lib.plugins.parameters.ParameterList;

@Command(name = "hdr", description = {
		"Fuse differently-exposed images of a static scene into one image.",
		"Exposure times are given in seconds, in the same order as the input images."})
class HdrCommand extends AbstractPixlCommand {
	
	private static final Logger logger = LoggerFactory.getLogger(HdrCommand.class);
	
	@Parameters(index = "0", paramLabel = "output", description = "Output image (format from the extension, default PNG).")
	private Path output;
	
	@Parameters(index = "1..*", arity = "2..*", paramLabel = "input", description = "Input images (at least 2).")
	private List<Path> inputs;
	
	@Option(names = {"-e", "--exposure"}, split = ",", paramLabel = "seconds", required = true,
			description = "Exposure time of each input, e.g. 1/100,1/50,1/25.")
	private List<String> exposures;
	
	@Option(names = {"--samples"}, paramLabel = "count", description = "Number of sampled pixel locations (default = 256).")
	private Integer sampleCount;
	
	@Option(names = {"--smoothness"}, paramLabel = "lambda", description = "Smoothness weight (default = 10).")
	private Double smoothness;
	
	@Option(names = {"--seed"}, paramLabel = "seed", description = "Random seed for choosing sample locations.")
	private Long seed;

	@Override
	ParameterList createParameterList() {
		return ExposureFusion.getDefaultParameterList();
	}

	@Override
	Map<String, Object> getParameterOverrides() {
		return overrides(
				ExposureFusion.KEY_SAMPLE_COUNT, sampleCount,
				ExposureFusion.KEY_SMOOTHNESS, smoothness);
	}

	@Override
	boolean process(ParameterList params, CancellationContext cancellation) throws IOException {
		if (exposures.size() != inputs.size())
			throw new ParameterException(spec.commandLine(), inputs.size() + " input images but " + exposures.size() + " exposure times");
		
		List<PixelImage> images = new ArrayList<>();
		for (int i = 0; i < inputs.size(); i++) {
			var image = getCodec().read(inputs.get(i));
			image.getMetadata().putDouble(ImageMetadata.EXPOSURE_TIME, parseExposure(exposures.get(i)));
			images.add(image);
		}
		
		var random = seed == null ? new Random() : new Random(seed);
		var result = ExposureFusion.reconstructHDR(images, 
				params.getIntParameterValue(ExposureFusion.KEY_SAMPLE_COUNT), 
				params.getDoubleParameterValue(ExposureFusion.KEY_SMOOTHNESS), 
				cancellation, 
				p -> logger.info("HDR progress: {}%", Math.round(p * 100)),
				random,
				new SVDLeastSquaresSolver());
		if (result == null)
			return false;
		getCodec().write(result, output);
		return true;
	}
	
	/**
	 * Parse an exposure time, either as a decimal number or a fraction such as "1/100".
	 * @param value
	 * @return
	 */
	static double parseExposure(String value) {
		String s = value.strip();
		try {
			int ind = s.indexOf('/');
			if (ind < 0)
				return Double.parseDouble(s);
			return Double.parseDouble(s.substring(0, ind)) / Double.parseDouble(s.substring(ind + 1));
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid exposure time '" + value + "'", e);
		}
	}

}
