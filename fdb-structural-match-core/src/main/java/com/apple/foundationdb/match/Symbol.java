/*
 * Symbol.java
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

import java.util.Locale;

/**
 * Distinguished markers used by the matcher.
 */
@API(API.Status.EXPERIMENTAL)
public enum Symbol {
    /**
     * The wildcard. When used as (or converted to) a pattern it matches any subject and binds nothing.
     */
    ANY,
    /**
     * The value of a {@link Variable} that is not bound to anything.
     */
    UNMATCHED;

    @Override
    public String toString() {
        return "<" + name().toLowerCase(Locale.ROOT) + ">";
    }
}
