/*
 * package-info.java
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

/**
 * A structural pattern matcher for plain Java values.
 *
 * <p>
 * A pattern is a tree of literals, types, wildcards, capture {@link com.apple.foundationdb.match.Variable}s and
 * ordered, set and map containers (see {@link com.apple.foundationdb.match.pattern}). A
 * {@link com.apple.foundationdb.match.Matcher} decides whether a subject has the shape and content the pattern
 * describes and, if so, binds each variable to the part of the subject it captured.
 * </p>
 *
 * <p>
 * Set and map patterns are matched without regard to order: each pattern element must be assigned a distinct
 * subject element that it matches. This is solved by a backtracking search that tries the most constrained pattern
 * elements first (see {@link com.apple.foundationdb.match.combinatorics.InjectiveAssignment}).
 * </p>
 *
 * <p>
 * Misuse of a pattern, such as using one variable twice, raises a
 * {@link com.apple.foundationdb.match.PatternMatchException}. A subject that does not fit the pattern is never an
 * error, just a failed match.
 * </p>
 */
package com.apple.foundationdb.match;
