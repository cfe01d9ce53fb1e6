/*
 * LogMessageKeys.java
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

package com.apple.foundationdb.match.logging;

import com.apple.foundationdb.annotation.API;

import javax.annotation.Nonnull;
import java.util.Locale;

/**
 * Keys used in {@link KeyValueLogMessage}s and in the log info of
 * {@link com.apple.foundationdb.match.PatternMatchException}s. All keys of the library live here so that collisions
 * are easy to spot.
 */
@API(API.Status.UNSTABLE)
public enum LogMessageKeys {
    // matcher
    ARITY,
    MATCHED,
    BINDING_COUNT("bindings"),
    PATTERN_KIND,
    SUBJECT_TYPE,
    // variables
    VARIABLE_ID("var_id"),
    OCCURRENCES,
    // unordered matching
    PATTERN_SIZE,
    SUBJECT_SIZE,
    MAX_SEARCH_STEPS,
    ;

    @Nonnull
    private final String logKey;

    LogMessageKeys() {
        this.logKey = name().toLowerCase(Locale.ROOT);
    }

    LogMessageKeys(@Nonnull String key) {
        this.logKey = key;
    }

    @Override
    public String toString() {
        return logKey;
    }
}
