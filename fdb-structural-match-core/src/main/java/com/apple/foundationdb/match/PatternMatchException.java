/*
 * PatternMatchException.java
 *
 * This source file is part of the FoundationDB open source project
 *
 * Copyright 2015-2026 Apple Inc. and the FoundationDB project authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.apple.foundationdb.match;

import com.apple.foundationdb.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class of the errors raised by the structural matcher. Besides its message, an exception carries key/value
 * log info (see {@link com.apple.foundationdb.match.logging.LogMessageKeys}) so that it can be logged in a
 * searchable form.
 *
 * <p>
 * A pattern that simply does not match its subject is not an error and never results in one of these.
 * </p>
 */
@SuppressWarnings("serial")
@API(API.Status.UNSTABLE)
public class PatternMatchException extends RuntimeException {
    @Nullable
    private Map<String, Object> logInfo;

    /**
     * Create an exception with a message and alternating log info keys and values.
     * @param msg error message
     * @param keyValues alternating keys and values
     * @throws IllegalArgumentException if {@code keyValues} has an odd number of elements
     */
    public PatternMatchException(@Nonnull String msg, @Nullable Object... keyValues) {
        super(msg);
        if (keyValues != null) {
            addLogInfo(keyValues);
        }
    }

    public PatternMatchException(@Nonnull String msg, @Nullable Throwable cause) {
        super(msg, cause);
    }

    @Nonnull
    public Map<String, Object> getLogInfo() {
        if (logInfo == null) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(logInfo);
    }

    @Nonnull
    public PatternMatchException addLogInfo(@Nonnull String description, @Nullable Object object) {
        if (logInfo == null) {
            logInfo = new LinkedHashMap<>();
        }
        logInfo.put(description, object);
        return this;
    }

    /**
     * Add log info given as a flat array where even elements are keys and odd elements are their values.
     * @param keyValue alternating keys and values
     * @return this exception
     * @throws IllegalArgumentException if {@code keyValue} has an odd number of elements
     */
    @Nonnull
    public PatternMatchException addLogInfo(@Nonnull Object... keyValue) {
        if (keyValue.length % 2 != 0) {
            throw new IllegalArgumentException("Unbalanced key/value logging info");
        }
        for (int i = 0; i < keyValue.length; i += 2) {
            addLogInfo(String.valueOf(keyValue[i]), keyValue[i + 1]);
        }
        return this;
    }

    /**
     * Flatten the log info into alternating keys and values, the format accepted by
     * {@link #addLogInfo(Object...)} and {@link com.apple.foundationdb.match.logging.KeyValueLogMessage#build}.
     * @return the log info as a flat array
     */
    @Nonnull
    public Object[] exportLogInfo() {
        final Map<String, Object> info = getLogInfo();
        final Object[] exported = new Object[2 * info.size()];
        int i = 0;
        for (Map.Entry<String, Object> entry : info.entrySet()) {
            exported[i++] = entry.getKey();
            exported[i++] = entry.getValue();
        }
        return exported;
    }
}
