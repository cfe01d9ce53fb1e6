/*
 * WildcardPattern.java
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
import com.apple.foundationdb.match.Symbol;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;

/**
 * The pattern that matches any subject without binding anything. There is exactly one instance; it is what
 * {@link Symbol#ANY} converts to.
 */
@API(API.Status.EXPERIMENTAL)
public final class WildcardPattern implements Pattern {
    private static final WildcardPattern INSTANCE = new WildcardPattern();

    private WildcardPattern() {
    }

    @Nonnull
    public static WildcardPattern instance() {
        return INSTANCE;
    }

    @Nonnull
    @Override
    public Kind getKind() {
        return Kind.WILDCARD;
    }

    @Nonnull
    @Override
    public Iterable<? extends Pattern> getChildren() {
        return ImmutableList.of();
    }

    @Override
    public String toString() {
        return Symbol.ANY.toString();
    }
}
