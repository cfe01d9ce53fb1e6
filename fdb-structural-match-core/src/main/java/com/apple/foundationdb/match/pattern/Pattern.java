/*
 * Pattern.java
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

package com.apple.foundationdb.match.pattern;

import com.apple.foundationdb.annotation.API;

import javax.annotation.Nonnull;

/**
 * A node of a pattern tree. A pattern describes constraints on the shape and content of a subject; matching a
 * pattern against a subject either fails or succeeds with a binding for every
 * {@link com.apple.foundationdb.match.Variable} the pattern mentions.
 *
 * <p>
 * The set of pattern variants is closed and enumerated by {@link Kind}. Patterns are usually built with
 * {@link Patterns}.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public interface Pattern {

    /**
     * The variants of patterns. The constants are declared in the order in which the matcher tests for them.
     */
    enum Kind {
        /** An unordered set of element patterns, see {@link SetPattern}. */
        SET,
        /** An unordered collection of key/value pattern pairs, see {@link MapPattern}. */
        MAPPING,
        /** An ordered sequence of a given {@link SequenceFamily}, see {@link SequencePattern}. */
        SEQUENCE,
        /** An instance-of check, see {@link TypePattern}. */
        TYPE,
        /** A capture site, see {@link com.apple.foundationdb.match.Variable}. */
        VARIABLE,
        /** Matches everything, see {@link WildcardPattern}. */
        WILDCARD,
        /** Equality with a value, see {@link LiteralPattern}. */
        LITERAL
    }

    @Nonnull
    Kind getKind();

    /**
     * The immediate sub-patterns of this pattern, in a stable order.
     * @return the children of this pattern
     */
    @Nonnull
    Iterable<? extends Pattern> getChildren();
}
