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

package pixl.lib.images;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;

/**
 * Interface for reading and writing {@link PixelImage}s.
 * <p>
 * Implementations must preserve the number of planes, and the palette of single-plane images, 
 * wherever the file format permits it.
 */
public interface ImageCodec {
	
	/**
	 * Get the name of the codec.
	 * @return
	 */
	public String getName();
	
	/**
	 * Get the lower-case file extensions supported for writing, without the leading dot.
	 * The preferred extension is returned first.
	 * @return
	 */
	public Collection<String> getExtensions();

	/**
	 * Read an image from a file.
	 * @param path
	 * @return
	 * @throws IOException if the file cannot be read or decoded
	 */
	public PixelImage read(Path path) throws IOException;
	
	/**
	 * Write an image to a file. The format is determined from the file extension.
	 * @param image
	 * @param path
	 * @throws IOException if the image cannot be encoded or written
	 */
	public void write(PixelImage image, Path path) throws IOException;

}
