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
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import pixl.lib.algorithms.superpixels.SLICSuperpixels;
import pixl.lib.analysis.images.ContourTracing;
import pixl.lib.common.ColorTools;
import pixl.lib.images.PixelImageTools;
import pixl.lib.plugins.CancellationContext;
import pixl.lib.plugins.parameters.ParameterList;

@Command(name = "slic", description = {
		"Segment an image into superpixels using SLIC.",
		"The output shows each superpixel filled with its mean color."})
class SlicCommand extends AbstractPixlCommand {
	
	private static final Logger logger = LoggerFactory.getLogger(SlicCommand.class);
	
	/**
	 * Side length of the squares drawn at cluster centers.
	 */
	static final int CENTER_SIZE = 5;
	
	@Parameters(index = "0", paramLabel = "input", description = "Input image.")
	private Path input;
	
	@Parameters(index = "1", paramLabel = "output", description = "Output image (format from the extension, default PNG).")
	private Path output;
	
	@Option(names = {"-k"}, paramLabel = "count", description = "Desired number of superpixels (default = 100).")
	private Integer k;
	
	@Option(names = {"-m", "--compactness"}, paramLabel = "m", description = "Compactness, usually 1-40 (default = 10).")
	private Double compactness;
	
	@Option(names = {"--contours"}, description = "Draw the boundaries between superpixels.")
	private boolean drawContours;
	
	@Option(names = {"--contour-color"}, paramLabel = "RRGGBB", description = "Hex color for boundaries (default = ${DEFAULT-VALUE}).", defaultValue = "ffff00")
	private String contourColor;
	
	@Option(names = {"--centers"}, description = "Mark the center of each superpixel.")
	private boolean drawCenters;

	@Override
	ParameterList createParameterList() {
		return SLICSuperpixels.getDefaultParameterList();
	}

	@Override
	Map<String, Object> getParameterOverrides() {
		return overrides(
				SLICSuperpixels.KEY_K, k,
				SLICSuperpixels.KEY_COMPACTNESS, compactness);
	}

	@Override
	boolean process(ParameterList params, CancellationContext cancellation) throws IOException {
		int rgbContour = ColorTools.parseHexRGB(contourColor);
		var image = PixelImageTools.toRGB(getCodec().read(input));
		var result = SLICSuperpixels.segment(image, params, cancellation);
		if (result == null)
			return false;
		result.applyTo(image);
		if (drawContours)
			ContourTracing.drawContours(image, result.getLabels(), rgbContour);
		if (drawCenters)
			PixelImageTools.drawSquares(image, result.getCenters(), CENTER_SIZE, ColorTools.RED, ColorTools.BLACK);
		logger.debug("Writing {} superpixels to {}", result.nClusters(), output);
		getCodec().write(image, output);
		return true;
	}

}
