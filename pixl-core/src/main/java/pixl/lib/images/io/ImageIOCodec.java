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

package pixl.lib.images.io;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

import javax.imageio.ImageIO;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import pixl.lib.awt.common.BufferedImageTools;
import pixl.lib.common.GeneralTools;
import pixl.lib.images.ImageCodec;
import pixl.lib.images.PixelImage;

/**
 * {@link ImageCodec} using Java's ImageIO.
 * <p>
 * The output format is chosen from the file extension, defaulting to PNG. 
 * Formats without alpha or palette support (JPEG, BMP) are written as opaque RGB or grayscale.
 * Embedded metadata such as exposure times is not read.
 */
public class ImageIOCodec implements ImageCodec {
	
	private static final Logger logger = LoggerFactory.getLogger(ImageIOCodec.class);
	
	private static final List<String> EXTENSIONS = List.of("png", "jpg", "jpeg", "bmp", "gif");
	
	@Override
	public String getName() {
		return "ImageIO";
	}

	@Override
	public Collection<String> getExtensions() {
		return EXTENSIONS;
	}

	@Override
	public PixelImage read(Path path) throws IOException {
		Objects.requireNonNull(path, "Path must not be null");
		if (!Files.isRegularFile(path))
			throw new IOException("No image file found at " + path);
		BufferedImage img = ImageIO.read(path.toFile());
		if (img == null)
			throw new IOException("Unable to decode " + path + " with ImageIO");
		var image = BufferedImageTools.toPixelImage(img);
		logger.debug("Read {} from {}", image, path);
		return image;
	}

	@Override
	public void write(PixelImage image, Path path) throws IOException {
		Objects.requireNonNull(image, "Image must not be null");
		Objects.requireNonNull(path, "Path must not be null");
		String ext = GeneralTools.getExtension(path.getFileName().toString())
				.filter(EXTENSIONS::contains)
				.orElse(null);
		if (ext == null) {
			logger.warn("Unrecognized extension for {}, will write PNG", path);
			ext = "png";
		}
		var img = BufferedImageTools.toBufferedImage(image);
		if (ext.equals("jpg") || ext.equals("jpeg") || ext.equals("bmp"))
			img = BufferedImageTools.ensureOpaqueRGB(img);
		if (!ImageIO.write(img, ext, path.toFile()))
			throw new IOException("Unable to write using ImageIO with extension " + ext);
		logger.debug("Wrote {} to {}", image, path);
	}

}
