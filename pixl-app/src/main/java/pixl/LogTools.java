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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;

/**
 * Control the logback root log level from the launcher.
 */
class LogTools {
	
	private static final Logger logger = LoggerFactory.getLogger(LogTools.class);
	
	/**
	 * Available log levels.
	 */
	enum LogLevel {
		/**
		 * Trace logging (an awful lot of messages)
		 */
		TRACE,
		/**
		 * Debug logging (a lot of messages)
		 */
		DEBUG,
		/**
		 * Default log level
		 */
		INFO,
		/**
		 * Warnings only
		 */
		WARN,
		/**
		 * Errors only
		 */
		ERROR,
		/**
		 * All messages
		 */
		ALL,
		/**
		 * No messages
		 */
		OFF
	}
	
	static void setRootLogLevel(LogLevel logLevel) {
		var root = getRootLogger();
		if (root == null) {
			logger.warn("Cannot set log level to {}: logback is not the active logging backend", logLevel);
			return;
		}
		root.setLevel(Level.toLevel(logLevel.name(), Level.INFO));
	}
	
	static LogLevel getRootLogLevel() {
		var root = getRootLogger();
		if (root == null || root.getLevel() == null)
			return null;
		return LogLevel.valueOf(root.getLevel().toString());
	}
	
	private static ch.qos.logback.classic.Logger getRootLogger() {
		if (LoggerFactory.getILoggerFactory() instanceof LoggerContext)
			return ((LoggerContext)LoggerFactory.getILoggerFactory()).getLogger(Logger.ROOT_LOGGER_NAME);
		return null;
	}

}
