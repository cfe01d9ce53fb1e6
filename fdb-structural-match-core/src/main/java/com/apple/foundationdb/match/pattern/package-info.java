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
 * The pattern language of the structural matcher.
 *
 * <p>
 * A {@link com.apple.foundationdb.match.pattern.Pattern} is a tree. Its leaves are literals, type checks and the
 * wildcard; its inner nodes are {@link com.apple.foundationdb.match.Variable}s (capture sites with an optional
 * sub-pattern) and the three container patterns:
 * </p>
 * <ul>
 *     <li>{@link com.apple.foundationdb.match.pattern.SequencePattern}, ordered, tagged with a
 *     {@link com.apple.foundationdb.match.pattern.SequenceFamily}</li>
 *     <li>{@link com.apple.foundationdb.match.pattern.SetPattern}, unordered elements</li>
 *     <li>{@link com.apple.foundationdb.match.pattern.MapPattern}, unordered key/value pairs</li>
 * </ul>
 */
package com.apple.foundationdb.match.pattern;
