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

package pixl.lib.plugins;

/**
 * Receives progress updates from a long-running algorithm.
 */
@FunctionalInterface
public interface ProgressListener {
	
	/**
	 * Listener that ignores all updates.
	 */
	public static final ProgressListener NONE = progress -> {};
	
	/**
	 * Called with the fraction of work completed, between 0 and 1.
	 * @param progress
	 */
	public void updateProgress(double progress);

}
