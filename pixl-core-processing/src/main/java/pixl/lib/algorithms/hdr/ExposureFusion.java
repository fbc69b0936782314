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

package pixl.lib.algorithms.hdr;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import pixl.lib.common.ColorTools;
import pixl.lib.common.ThreadTools;
import pixl.lib.images.ImageMetadata;
import pixl.lib.images.MissingMetadataException;
import pixl.lib.images.PixelImage;
import pixl.lib.plugins.CancellationContext;
import pixl.lib.plugins.ProgressListener;
import pixl.lib.plugins.parameters.ParameterList;

/**
 * Reconstruct a high dynamic range radiance image from photographs of the same scene with different exposure times.
 * <p>
 * The camera response curve is recovered separately for each color plane by weighted least squares, 
 * following Debevec &amp; Malik, <i>Recovering High Dynamic Range Radiance Maps from Photographs</i>, SIGGRAPH 1997.
 * The exposures are then fused into a log-radiance map, which is normalized and quantized to 8 bits.
 */
public class ExposureFusion {
	
	private static final Logger logger = LoggerFactory.getLogger(ExposureFusion.class);
	
	/**
	 * Parameter key for the number of sampled pixel locations.
	 */
	public static final String KEY_SAMPLE_COUNT = "sampleCount";
	
	/**
	 * Parameter key for the smoothness weight.
	 */
	public static final String KEY_SMOOTHNESS = "smoothness";
	
	/**
	 * Default number of sampled pixel locations.
	 */
	public static final int DEFAULT_SAMPLE_COUNT = 256;
	
	/**
	 * Default smoothness weight.
	 */
	public static final double DEFAULT_SMOOTHNESS = 10;
	
	static final int Z_MIN = 0;
	static final int Z_MAX = 255;
	static final int Z_MID = 127;
	static final int N_VALUES = Z_MAX + 1;
	
	private static final int N_PLANES = 3;
	
	// Suppressed default constructor for non-instantiability
	private ExposureFusion() {
		throw new AssertionError();
	}
	
	/**
	 * Get the parameters supported by {@link #reconstructHDR(List, ParameterList, CancellationContext, ProgressListener)}.
	 * @return
	 */
	public static ParameterList getDefaultParameterList() {
		return new ParameterList()
				.addIntParameter(KEY_SAMPLE_COUNT, "Sample count", DEFAULT_SAMPLE_COUNT, null, 1, Integer.MAX_VALUE, 
						"Number of random pixel locations used to recover the camera response")
				.addDoubleParameter(KEY_SMOOTHNESS, "Smoothness", DEFAULT_SMOOTHNESS, null, 0, Double.MAX_VALUE, 
						"Weight of the smoothness term relative to the data term; increase for noisier images");
	}
	
	/**
	 * Weighting function, emphasizing values in the middle of the range.
	 * @param z pixel value
	 * @return
	 */
	static int weight(int z) {
		return z <= Z_MID ? z - Z_MIN : Z_MAX - z;
	}
	
	/**
	 * Reconstruct an HDR image using values from a parameter list.
	 * @param images
	 * @param params
	 * @param cancellation
	 * @param progress
	 * @return the fused image, or null if cancelled
	 * @see #getDefaultParameterList()
	 */
	public static PixelImage reconstructHDR(List<PixelImage> images, ParameterList params, CancellationContext cancellation, ProgressListener progress) {
		return reconstructHDR(images, params.getIntParameterValue(KEY_SAMPLE_COUNT), params.getDoubleParameterValue(KEY_SMOOTHNESS), cancellation, progress);
	}
	
	/**
	 * Reconstruct an HDR image, sampling pixel locations with a new {@link Random}.
	 * @param images
	 * @param sampleCount
	 * @param smoothness
	 * @param cancellation
	 * @param progress
	 * @return the fused image, or null if cancelled
	 * @see #reconstructHDR(List, int, double, CancellationContext, ProgressListener, Random, LeastSquaresSolver)
	 */
	public static PixelImage reconstructHDR(List<PixelImage> images, int sampleCount, double smoothness, CancellationContext cancellation, ProgressListener progress) {
		return reconstructHDR(images, sampleCount, smoothness, cancellation, progress, new Random());
	}
	
	/**
	 * Reconstruct an HDR image using a specified random number generator for sampling.
	 * @param images
	 * @param sampleCount
	 * @param smoothness
	 * @param cancellation
	 * @param progress
	 * @param random
	 * @return the fused image, or null if cancelled
	 * @see #reconstructHDR(List, int, double, CancellationContext, ProgressListener, Random, LeastSquaresSolver)
	 */
	public static PixelImage reconstructHDR(List<PixelImage> images, int sampleCount, double smoothness, CancellationContext cancellation, ProgressListener progress, Random random) {
		return reconstructHDR(images, sampleCount, smoothness, cancellation, progress, random, new SVDLeastSquaresSolver());
	}
	
	/**
	 * Reconstruct an HDR image from differently-exposed images of a static scene.
	 * <p>
	 * Progress is reported after the linear systems are constructed (0.1) and after they are solved (0.8). 
	 * Cancellation is checked at the same points. 
	 * The three per-plane systems are solved concurrently.
	 * 
	 * @param images at least 2 images of identical size with at least 3 planes, 
	 *               each with an {@link ImageMetadata#EXPOSURE_TIME} value in seconds
	 * @param sampleCount number of random pixel locations used to recover the response curve
	 * @param smoothness weight of the smoothness term, must be &gt;= 0
	 * @param cancellation
	 * @param progress
	 * @param random source of sample locations
	 * @param solver least-squares solver
	 * @return a new 3-plane image, or null if cancelled
	 * @throws IllegalArgumentException if the images or parameters are invalid
	 * @throws MissingMetadataException if an image has no exposure time
	 */
	public static PixelImage reconstructHDR(List<PixelImage> images, int sampleCount, double smoothness, 
			CancellationContext cancellation, ProgressListener progress, Random random, LeastSquaresSolver solver) {
		
		double[] logExposureTimes = validateAndReadExposures(images);
		if (sampleCount < 1)
			throw new IllegalArgumentException("Sample count must be >= 1, but got " + sampleCount);
		if (!(smoothness >= 0) || Double.isInfinite(smoothness))
			throw new IllegalArgumentException("Smoothness must be finite and >= 0, but got " + smoothness);
		Objects.requireNonNull(cancellation, "Cancellation context must not be null");
		Objects.requireNonNull(progress, "Progress listener must not be null");
		Objects.requireNonNull(random, "Random must not be null");
		Objects.requireNonNull(solver, "Solver must not be null");
		
		long startTime = System.currentTimeMillis();
		int width = images.get(0).getWidth();
		int height = images.get(0).getHeight();
		
		int[] sampleX = new int[sampleCount];
		int[] sampleY = new int[sampleCount];
		for (int i = 0; i < sampleCount; i++) {
			sampleX[i] = random.nextInt(width);
			sampleY[i] = random.nextInt(height);
		}
		
		List<ResponseSystem> systems = new ArrayList<>();
		for (int p = 0; p < N_PLANES; p++)
			systems.add(buildSystem(images, p, sampleX, sampleY, logExposureTimes, smoothness));
		logger.debug("Built {} response systems with {} rows and {} columns", N_PLANES, systems.get(0).b.length, systems.get(0).a[0].length);
		
		if (cancellation.isCancelled())
			return null;
		progress.updateProgress(0.1);
		
		double[][] g = solveResponseCurves(systems, solver);
		if (g == null)
			return null;
		
		if (cancellation.isCancelled())
			return null;
		progress.updateProgress(0.8);
		
		var result = fuse(images, g, logExposureTimes);
		
		long endTime = System.currentTimeMillis();
		logger.info("HDR reconstruction from {} images ({} samples, smoothness {}) completed in {} ms", images.size(), sampleCount, smoothness, endTime - startTime);
		return result;
	}
	
	private static double[] validateAndReadExposures(List<PixelImage> images) {
		if (images == null || images.isEmpty())
			throw new IllegalArgumentException("No images provided for HDR reconstruction");
		if (images.size() < 2)
			throw new IllegalArgumentException("At least 2 images are required for HDR reconstruction, but got " + images.size());
		var first = Objects.requireNonNull(images.get(0), "Images must not be null");
		double[] logExposureTimes = new double[images.size()];
		for (int i = 0; i < images.size(); i++) {
			var image = Objects.requireNonNull(images.get(i), "Images must not be null");
			if (image.getWidth() != first.getWidth() || image.getHeight() != first.getHeight())
				throw new IllegalArgumentException("All images must be the same size, but image " + i + " is " + image.getWidth() + "x" + image.getHeight() 
						+ " and image 0 is " + first.getWidth() + "x" + first.getHeight());
			if (image.nPlanes() < N_PLANES)
				throw new IllegalArgumentException("HDR reconstruction requires RGB images, but image " + i + " has " + image.nPlanes() + " plane(s)");
			var exposure = image.getMetadata().getDouble(ImageMetadata.EXPOSURE_TIME);
			if (exposure.isEmpty())
				throw new MissingMetadataException(ImageMetadata.EXPOSURE_TIME, "Image " + i + " has no exposure time");
			double t = exposure.getAsDouble();
			if (!(t > 0) || Double.isInfinite(t))
				throw new IllegalArgumentException("Exposure time must be > 0, but image " + i + " has " + t);
			logExposureTimes[i] = Math.log(t);
		}
		return logExposureTimes;
	}
	
	/**
	 * Weighted least-squares system for the response curve of one plane.
	 * Columns 0-255 hold g(z), the remaining columns the log irradiance of each sample.
	 */
	static class ResponseSystem {
		
		final double[][] a;
		final double[] b;
		
		ResponseSystem(int rows, int cols) {
			this.a = new double[rows][cols];
			this.b = new double[rows];
		}
		
	}
	
	static ResponseSystem buildSystem(List<PixelImage> images, int planeIndex, int[] sampleX, int[] sampleY, double[] logExposureTimes, double smoothness) {
		int nSamples = sampleX.length;
		int nImages = images.size();
		int rows = nSamples * nImages + 1 + (Z_MAX - Z_MIN - 1);
		int cols = N_VALUES + nSamples;
		var system = new ResponseSystem(rows, cols);
		
		// Data fitting: w(z) * (g(z) - lnE_i) = w(z) * lnT_j
		int k = 0;
		for (int i = 0; i < nSamples; i++) {
			for (int j = 0; j < nImages; j++) {
				int z = images.get(j).getPlane(planeIndex).getValue(sampleX[i], sampleY[i]);
				int w = weight(z);
				system.a[k][z] = w;
				system.a[k][N_VALUES + i] = -w;
				system.b[k] = w * logExposureTimes[j];
				k++;
			}
		}
		
		// Fix the scale with g(Zmid) = 0
		system.a[k][Z_MID] = 1;
		k++;
		
		// Smoothness: lambda * w(z) * (g(z-1) - 2 g(z) + g(z+1)) = 0
		for (int z = Z_MIN + 1; z < Z_MAX; z++) {
			double sw = smoothness * weight(z);
			system.a[k][z - 1] = sw;
			system.a[k][z] = -2 * sw;
			system.a[k][z + 1] = sw;
			k++;
		}
		return system;
	}
	
	/**
	 * Solve all systems concurrently, returning g(z) for each plane.
	 * @return response curves indexed as {@code g[plane][z]}, or null if interrupted
	 */
	private static double[][] solveResponseCurves(List<ResponseSystem> systems, LeastSquaresSolver solver) {
		ExecutorService pool = Executors.newFixedThreadPool(systems.size(), ThreadTools.createThreadFactory("hdr-solver-", true));
		try {
			List<Future<double[]>> futures = new ArrayList<>();
			for (var system : systems)
				futures.add(pool.submit(() -> solver.solve(system.a, system.b)));
			double[][] g = new double[systems.size()][];
			for (int p = 0; p < futures.size(); p++) {
				double[] x = futures.get(p).get();
				if (x == null || x.length < N_VALUES)
					throw new IllegalStateException("Least-squares solver returned " + (x == null ? "null" : x.length + " values") + " for plane " + p);
				g[p] = x;
			}
			return g;
		} catch (InterruptedException e) {
			logger.warn("Interrupted while solving response curves");
			Thread.currentThread().interrupt();
			return null;
		} catch (ExecutionException e) {
			Throwable cause = e.getCause();
			if (cause instanceof RuntimeException)
				throw (RuntimeException)cause;
			if (cause instanceof Error)
				throw (Error)cause;
			throw new IllegalStateException("Least-squares solve failed", cause);
		} finally {
			pool.shutdownNow();
		}
	}
	
	/**
	 * Fuse the exposures into a normalized 8-bit image, using the recovered response curves.
	 */
	static PixelImage fuse(List<PixelImage> images, double[][] g, double[] logExposureTimes) {
		int width = images.get(0).getWidth();
		int height = images.get(0).getHeight();
		int nImages = images.size();
		int fallbackIndex = nImages / 2;
		
		double[][] radiance = new double[N_PLANES][width * height];
		double min = Double.POSITIVE_INFINITY;
		double max = Double.NEGATIVE_INFINITY;
		for (int p = 0; p < N_PLANES; p++) {
			double[] gp = g[p];
			double[] rp = radiance[p];
			for (int y = 0; y < height; y++) {
				for (int x = 0; x < width; x++) {
					long weightSum = 0;
					double sum = 0;
					for (int j = 0; j < nImages; j++) {
						int z = images.get(j).getPlane(p).getValue(x, y);
						int w = weight(z);
						weightSum += w;
						sum += w * (gp[z] - logExposureTimes[j]);
					}
					double value;
					if (weightSum > 0)
						value = sum / weightSum;
					else {
						int z = images.get(fallbackIndex).getPlane(p).getValue(x, y);
						value = gp[z] - logExposureTimes[fallbackIndex];
					}
					rp[y * width + x] = value;
					if (value < min)
						min = value;
					if (value > max)
						max = value;
				}
			}
		}
		
		var result = PixelImage.createEmpty(width, height, N_PLANES);
		double range = max - min;
		if (!(range > 0))
			logger.warn("Radiance map is constant ({}), output will be black", min);
		for (int p = 0; p < N_PLANES; p++) {
			var plane = result.getPlane(p);
			double[] rp = radiance[p];
			for (int y = 0; y < height; y++) {
				for (int x = 0; x < width; x++) {
					double normalized = range > 0 ? (rp[y * width + x] - min) / range : 0;
					plane.setValue(x, y, ColorTools.roundTo8Bit(normalized * 255.0));
				}
			}
		}
		return result;
	}

}
