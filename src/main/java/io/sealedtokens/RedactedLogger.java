/*
 * Copyright 2022 Neil Madden.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 *
 */

package io.sealedtokens;

import java.security.Key;
import java.util.Arrays;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A thin facade over an slf4j {@link Logger} that redacts arguments which may hold secrets (byte arrays, char
 * arrays and {@link Key} objects) before they are handed to the logging backend. Only the levels used by this
 * library are exposed.
 */
final class RedactedLogger {
    static final String REDACTED = "<redacted>";

    private final Logger realLogger;

    private RedactedLogger(Logger realLogger) {
        this.realLogger = Objects.requireNonNull(realLogger);
    }

    static RedactedLogger getLogger(Class<?> forClass) {
        return new RedactedLogger(LoggerFactory.getLogger(forClass));
    }

    void trace(String format, Object... args) {
        if (realLogger.isTraceEnabled()) {
            realLogger.trace(format, redactAll(args));
        }
    }

    void debug(String format, Object... args) {
        if (realLogger.isDebugEnabled()) {
            realLogger.debug(format, redactAll(args));
        }
    }

    void info(String format, Object... args) {
        if (realLogger.isInfoEnabled()) {
            realLogger.info(format, redactAll(args));
        }
    }

    static Object redact(Object arg) {
        if (arg instanceof byte[]) {
            return maskForLog(((byte[]) arg).length);
        } else if (arg instanceof char[]) {
            return maskForLog(((char[]) arg).length);
        } else if (arg instanceof DestroyableSecretKey) {
            return maskForLog(((DestroyableSecretKey) arg).size());
        } else if (arg instanceof Key) {
            return REDACTED;
        } else {
            return arg;
        }
    }

    private static Object[] redactAll(Object[] args) {
        return Arrays.stream(args).map(RedactedLogger::redact).toArray();
    }

    private static String maskForLog(int length) {
        return REDACTED + "(" + length + ")";
    }
}
