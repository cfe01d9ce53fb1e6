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
 * The matching algorithm: the {@link com.apple.foundationdb.match.matching.StructuralMatcher} dispatcher, the
 * ordered and unordered container matchers, the check for repeated variables, and
 * {@link com.apple.foundationdb.match.matching.Bindings}, the result of a successful match.
 *
 * <p>
 * Everything here is {@link com.apple.foundationdb.annotation.API.Status#INTERNAL INTERNAL}. Clients match through
 * {@link com.apple.foundationdb.match.Matcher}.
 * </p>
 */
package com.apple.foundationdb.match.matching;
