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

package pixl.lib.algorithms.contrast;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import pixl.lib.analysis.stats.HistogramTools;
import pixl.lib.images.ImagePlane;
import pixl.lib.images.PixelImage;
import pixl.lib.images.PixelImageTools;
import pixl.lib.plugins.CancellationContext;
import pixl.lib.plugins.parameters.ParameterList;

/**
 * Global histogram equalization, with optional contrast limiting.
 * <p>
 * Grayscale images are equalized using plane 0, which is then copied to the other color planes.
 * Color images are converted to HSV and only the value channel is equalized.
 * <p>
 * Images are modified in place. If the operation is cancelled, they may be left partially modified.
 */
public class HistogramEqualization {
	
	private static final Logger logger = LoggerFactory.getLogger(HistogramEqualization.class);
	
	/**
	 * Parameter key for the clip limit.
	 */
	public static final String KEY_CLIP_LIMIT = "clipLimit";
	
	// Suppressed default constructor for non-instantiability
	private HistogramEqualization() {
		throw new AssertionError();
	}
	
	/**
	 * Get the parameters supported by {@link #equalizeHistogram(PixelImage, ParameterList, CancellationContext)}.
	 * @return
	 */
	public static ParameterList getDefaultParameterList() {
		return new ParameterList()
				.addDoubleParameter(KEY_CLIP_LIMIT, "Clip limit", 0, null, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY, 
						"Limit each histogram bin to this multiple of the mean bin count before equalizing; values <= 0 disable clipping");
	}
	
	/**
	 * Equalize an image using values from a parameter list.
	 * @param image
	 * @param params
	 * @param cancellation
	 * @return true if the image was fully equalized, false if cancelled
	 * @see #getDefaultParameterList()
	 */
	public static boolean equalizeHistogram(PixelImage image, ParameterList params, CancellationContext cancellation) {
		return equalizeHistogram(image, params.getDoubleParameterValue(KEY_CLIP_LIMIT), cancellation);
	}

	/**
	 * Equalize an image in place.
	 * @param image the image to modify
	 * @param clipLimit clip limit; values {@code <= 0} mean no clipping
	 * @param cancellation
	 * @return true if the image was fully equalized, false if cancelled
	 */
	public static boolean equalizeHistogram(PixelImage image, double clipLimit, CancellationContext cancellation) {
		Objects.requireNonNull(image, "Image must not be null");
		Objects.requireNonNull(cancellation, "Cancellation context must not be null");
		
		long startTime = System.currentTimeMillis();
		boolean completed;
		if (image.isGrayscale()) {
			completed = equalizePlane(image.getPlane(0), clipLimit, cancellation);
			PixelImageTools.applyPlaneToColorPlanes(image, 0);
		} else {
			double[][] hsv = PixelImageTools.toHSV(image);
			var value = ImagePlane.fromDoubles(hsv[2], image.getWidth(), image.getHeight());
			completed = equalizePlane(value, clipLimit, cancellation);
			hsv[2] = value.toDoubles();
			PixelImageTools.setPixelsFromHSV(image, hsv);
		}
		long endTime = System.currentTimeMillis();
		if (completed)
			logger.info("Histogram equalization of {} completed in {} ms", image, endTime - startTime);
		else
			logger.info("Histogram equalization of {} cancelled", image);
		return completed;
	}
	
	/**
	 * Equalize a single plane in place.
	 * <p>
	 * Cancellation is checked before the lookup table is built and once per row while it is applied.
	 * 
	 * @param plane the plane to modify
	 * @param clipLimit clip limit; values {@code <= 0} mean no clipping
	 * @param cancellation
	 * @return true if the plane was fully equalized, false if cancelled
	 */
	public static boolean equalizePlane(ImagePlane plane, double clipLimit, CancellationContext cancellation) {
		Objects.requireNonNull(plane, "Plane must not be null");
		if (cancellation.isCancelled())
			return false;
		
		int[] hist = HistogramTools.getHistogram(plane);
		HistogramTools.clipHistogram(hist, clipLimit, (long)plane.getWidth() * plane.getHeight());
		int[] table = HistogramTools.equalizationTable(hist);
		
		for (int y = 0; y < plane.getHeight(); y++) {
			if (cancellation.isCancelled())
				return false;
			for (int x = 0; x < plane.getWidth(); x++)
				plane.setValue(x, y, table[plane.getValue(x, y)]);
		}
		return true;
	}

}
