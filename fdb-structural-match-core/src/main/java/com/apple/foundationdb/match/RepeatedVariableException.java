/*
 * RepeatedVariableException.java
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
import com.apple.foundationdb.match.logging.LogMessageKeys;

import javax.annotation.Nonnull;

/**
 * Thrown when the same {@link Variable} instance occurs more than once in a pattern. This is a usage error on the
 * pattern itself and is raised before the pattern is compared to any subject.
 */
@SuppressWarnings("serial")
@API(API.Status.EXPERIMENTAL)
public class RepeatedVariableException extends PatternMatchException {
    @Nonnull
    private final transient Variable variable;

    public RepeatedVariableException(@Nonnull Variable variable, int occurrences) {
        super("variable used more than once in pattern",
                LogMessageKeys.VARIABLE_ID, variable.getId(),
                LogMessageKeys.OCCURRENCES, occurrences);
        this.variable = variable;
    }

    /**
     * The variable that was used more than once.
     * @return the repeated variable
     */
    @Nonnull
    public Variable getVariable() {
        return variable;
    }
}
