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

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestCancellationContext {
	
	@Test
	public void test_cancel() {
		var context = new CancellationContext();
		assertFalse(context.isCancelled());
		context.cancel();
		assertTrue(context.isCancelled());
		context.cancel();
		assertTrue(context.isCancelled());
	}
	
	@Test
	public void test_none() {
		var none = CancellationContext.none();
		assertSame(none, CancellationContext.none());
		assertFalse(none.isCancelled());
		assertThrows(UnsupportedOperationException.class, () -> none.cancel());
		assertFalse(none.isCancelled());
	}
	
	@Test
	public void test_deadline() {
		var expired = CancellationContext.withDeadline(Duration.ZERO);
		assertTrue(expired.isCancelled());
		
		var distant = CancellationContext.withDeadline(Duration.ofDays(365));
		assertFalse(distant.isCancelled());
		distant.cancel();
		assertTrue(distant.isCancelled());
		
		var shortDeadline = CancellationContext.withDeadline(Duration.ofMillis(20));
		assertTimeoutPreemptively(Duration.ofSeconds(10), () -> {
			while (!shortDeadline.isCancelled())
				Thread.sleep(5);
		});
	}

}
