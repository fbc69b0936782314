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

package pixl.lib.awt.common;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.ComponentSampleModel;
import java.awt.image.DataBuffer;
import java.awt.image.DataBufferByte;
import java.awt.image.IndexColorModel;
import java.awt.image.WritableRaster;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import pixl.lib.common.ColorTools;
import pixl.lib.images.ImagePlane;
import pixl.lib.images.PixelImage;

/**
 * Static methods for converting between {@link PixelImage}s and Java AWT {@link BufferedImage}s.
 */
public final class BufferedImageTools {
	
	// Suppress default constructor for non-instantiability
	private BufferedImageTools() {
		throw new AssertionError();
	}
	
	/**
	 * Convert a BufferedImage to a PixelImage.
	 * <p>
	 * Indexed images with up to 8 bits become a single plane with a palette; single-band images become a 
	 * single plane; other images become 3 planes (RGB), or 4 planes (RGB and alpha) if there is an alpha channel.
	 * 
	 * @param img
	 * @return
	 */
	public static PixelImage toPixelImage(BufferedImage img) {
		Objects.requireNonNull(img, "BufferedImage must not be null");
		int w = img.getWidth();
		int h = img.getHeight();
		var cm = img.getColorModel();
		
		if (cm instanceof IndexColorModel && cm.getPixelSize() <= 8) {
			var icm = (IndexColorModel)cm;
			int[] palette = new int[icm.getMapSize()];
			icm.getRGBs(palette);
			var plane = readBand(img.getRaster(), 0);
			return new PixelImage(List.of(plane), palette, null);
		}
		if (img.getRaster().getNumBands() == 1 && cm.getNumComponents() == 1) {
			var plane = new ImagePlane(w, h);
			var raster = img.getRaster();
			int shift = Math.max(0, cm.getComponentSize(0) - 8);
			for (int y = 0; y < h; y++) {
				for (int x = 0; x < w; x++)
					plane.setValue(x, y, raster.getSample(x, y, 0) >> shift);
			}
			return new PixelImage(List.of(plane));
		}
		
		var interleaved = readInterleavedBytes(img);
		if (interleaved != null)
			return new PixelImage(interleaved);
		
		boolean alpha = cm.hasAlpha();
		List<ImagePlane> planes = new ArrayList<>();
		int n = alpha ? 4 : 3;
		for (int i = 0; i < n; i++)
			planes.add(new ImagePlane(w, h));
		for (int y = 0; y < h; y++) {
			for (int x = 0; x < w; x++) {
				int argb = img.getRGB(x, y);
				planes.get(0).setValue(x, y, ColorTools.red(argb));
				planes.get(1).setValue(x, y, ColorTools.green(argb));
				planes.get(2).setValue(x, y, ColorTools.blue(argb));
				if (alpha)
					planes.get(3).setValue(x, y, argb >>> 24);
			}
		}
		return new PixelImage(planes);
	}
	
	/**
	 * Read the planes of a 3-byte BGR or 4-byte ABGR image directly from its data buffer.
	 * @return RGB(A) planes, or null if the image does not use a plain interleaved byte layout
	 */
	private static List<ImagePlane> readInterleavedBytes(BufferedImage img) {
		int type = img.getType();
		if (type != BufferedImage.TYPE_3BYTE_BGR && type != BufferedImage.TYPE_4BYTE_ABGR)
			return null;
		var raster = img.getRaster();
		if (raster.getParent() != null || !(raster.getSampleModel() instanceof ComponentSampleModel) || !(raster.getDataBuffer() instanceof DataBufferByte))
			return null;
		var sm = (ComponentSampleModel)raster.getSampleModel();
		var buffer = (DataBufferByte)raster.getDataBuffer();
		int w = img.getWidth();
		int step = sm.getPixelStride();
		if (sm.getScanlineStride() != w * step || buffer.getNumBanks() != 1)
			return null;
		byte[] data = buffer.getData();
		int[] offsets = sm.getBandOffsets();
		// Raster bands are ordered R, G, B (and A)
		List<ImagePlane> planes = new ArrayList<>();
		for (int b = 0; b < sm.getNumBands(); b++)
			planes.add(ImagePlane.createFromInterleaved(w, img.getHeight(), data, buffer.getOffset() + offsets[b], step));
		return planes;
	}
	
	private static ImagePlane readBand(WritableRaster raster, int band) {
		var plane = new ImagePlane(raster.getWidth(), raster.getHeight());
		for (int y = 0; y < raster.getHeight(); y++) {
			for (int x = 0; x < raster.getWidth(); x++)
				plane.setValue(x, y, raster.getSample(x, y, band));
		}
		return plane;
	}
	
	/**
	 * Convert a PixelImage to a BufferedImage.
	 * <p>
	 * Single-plane images become indexed (if they have a palette) or 8-bit grayscale. 
	 * Images with 2 planes are written as grayscale using plane 0.
	 * Images with 3 planes become RGB, and images with 4 or more planes become ARGB using plane 3 as alpha.
	 * 
	 * @param image
	 * @return
	 */
	public static BufferedImage toBufferedImage(PixelImage image) {
		Objects.requireNonNull(image, "Image must not be null");
		int w = image.getWidth();
		int h = image.getHeight();
		int n = image.nPlanes();
		
		if (n < 3) {
			int[] palette = n == 1 ? image.getPalette() : null;
			BufferedImage img;
			if (palette != null && palette.length > 0 && palette.length <= 256) {
				var icm = new IndexColorModel(8, palette.length, palette, 0, true, -1, DataBuffer.TYPE_BYTE);
				img = new BufferedImage(w, h, BufferedImage.TYPE_BYTE_INDEXED, icm);
			} else
				img = new BufferedImage(w, h, BufferedImage.TYPE_BYTE_GRAY);
			var raster = img.getRaster();
			var plane = image.getPlane(0);
			for (int y = 0; y < h; y++) {
				for (int x = 0; x < w; x++)
					raster.setSample(x, y, 0, plane.getValue(x, y));
			}
			return img;
		}
		
		boolean alpha = n >= 4;
		var img = new BufferedImage(w, h, alpha ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB);
		for (int y = 0; y < h; y++) {
			for (int x = 0; x < w; x++) {
				int rgb = image.getRGB(x, y);
				if (alpha)
					rgb = (rgb & 0x00ffffff) | (image.getPlane(3).getValue(x, y) << 24);
				img.setRGB(x, y, rgb);
			}
		}
		return img;
	}
	
	/**
	 * Create an opaque RGB copy of an image, e.g. for formats that do not support alpha or palettes.
	 * @param img
	 * @return
	 */
	public static BufferedImage ensureOpaqueRGB(BufferedImage img) {
		if (img.getType() == BufferedImage.TYPE_INT_RGB || img.getType() == BufferedImage.TYPE_BYTE_GRAY)
			return img;
		var imgRGB = new BufferedImage(img.getWidth(), img.getHeight(), BufferedImage.TYPE_INT_RGB);
		Graphics2D g2d = imgRGB.createGraphics();
		try {
			g2d.drawImage(img, 0, 0, null);
		} finally {
			g2d.dispose();
		}
		return imgRGB;
	}

}
