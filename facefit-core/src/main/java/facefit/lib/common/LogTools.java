/*-
 * #%L
 * This file is part of FaceFit.
 * %%
 * Copyright (C) 2024 FaceFit developers
 * %%
 * FaceFit is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * FaceFit is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with FaceFit.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package facefit.lib.common;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.event.Level;
import org.slf4j.helpers.MessageFormatter;

/**
 * Helper class for logging.
 */
public class LogTools {
	
	private static Map<String, Map<Level, Set<String>>> alreadyLogged = new ConcurrentHashMap<>();

	/**
	 * Log a message once at the specified level.
	 * <p>
	 * Messages are formatted with the usual slf4j {@code {}} placeholders before comparison, 
	 * so the same template with different arguments counts as a different message.
	 * 
	 * @param logger
	 * @param level
	 * @param message
	 * @param arguments optional arguments to substitute into the message
	 * @return true if the message was logged, false if it had been logged before
	 */
	public static boolean logOnce(Logger logger, Level level, String message, Object... arguments) {
		String formatted = arguments.length == 0 ? message : MessageFormatter.basicArrayFormat(message, arguments);
		var map = alreadyLogged.computeIfAbsent(logger.getName(), l -> new ConcurrentHashMap<>());
		var set = map.computeIfAbsent(level, l -> ConcurrentHashMap.newKeySet());
		if (set.add(formatted)) {
			logger.atLevel(level).log(formatted);
			return true;
		}
		return false;
	}

	/**
	 * Log a message once at the INFO level.
	 * 
	 * @param logger
	 * @param message
	 * @return true if the message was logged, false otherwise
	 * @see #logOnce(Logger, Level, String, Object...)
	 */
	public static boolean logOnce(Logger logger, String message) {
		return logOnce(logger, Level.INFO, message);
	}

	/**
	 * Log a message once at the WARN level.
	 * <p>
	 * This is used when a computation falls back to a slower path, so that 
	 * repeated calls (e.g. once per image row) do not flood the log.
	 * 
	 * @param logger
	 * @param message
	 * @param arguments
	 * @return true if the message was logged, false otherwise
	 */
	public static boolean warnOnce(Logger logger, String message, Object... arguments) {
		return logOnce(logger, Level.WARN, message, arguments);
	}
	
	/**
	 * Forget all messages that have been logged, so that they may be logged again.
	 */
	public static void resetLoggedMessages() {
		alreadyLogged.clear();
	}

}
