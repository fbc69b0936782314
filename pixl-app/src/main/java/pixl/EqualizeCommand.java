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

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import pixl.lib.algorithms.contrast.HistogramEqualization;
import pixl.lib.plugins.CancellationContext;
import pixl.lib.plugins.parameters.ParameterList;

@Command(name = "equalize", description = "Apply global histogram equalization to an image.")
class EqualizeCommand extends AbstractPixlCommand {
	
	@Parameters(index = "0", paramLabel = "input", description = "Input image.")
	private Path input;
	
	@Parameters(index = "1", paramLabel = "output", description = "Output image (format from the extension, default PNG).")
	private Path output;
	
	@Option(names = {"--clip"}, paramLabel = "limit", description = "Clip limit; values <= 0 disable clipping.")
	private Double clipLimit;

	@Override
	ParameterList createParameterList() {
		return HistogramEqualization.getDefaultParameterList();
	}

	@Override
	Map<String, Object> getParameterOverrides() {
		return overrides(HistogramEqualization.KEY_CLIP_LIMIT, clipLimit);
	}

	@Override
	boolean process(ParameterList params, CancellationContext cancellation) throws IOException {
		var image = getCodec().read(input);
		if (!HistogramEqualization.equalizeHistogram(image, params, cancellation))
			return false;
		getCodec().write(image, output);
		return true;
	}

}
