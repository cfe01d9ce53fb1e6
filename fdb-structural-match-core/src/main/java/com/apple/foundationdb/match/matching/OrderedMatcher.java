/*
 * OrderedMatcher.java
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

package com.apple.foundationdb.match.matching;

import com.apple.foundationdb.annotation.API;
import com.apple.foundationdb.match.pattern.Pattern;
import com.google.common.base.Preconditions;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Optional;
import java.util.function.BiFunction;

/**
 * Matches a list of patterns against a list of subjects of the same length, position by position.
 */
@API(API.Status.INTERNAL)
public final class OrderedMatcher {
    private OrderedMatcher() {
        // prevent instantiation
    }

    /**
     * Match element-wise. The first element that does not match ends the attempt.
     * @param patterns the element patterns
     * @param subjects the subject elements
     * @param elementMatcher matches a single element
     * @return the bindings of all elements combined, or empty if some element does not match
     */
    @Nonnull
    public static Optional<Bindings> match(@Nonnull List<? extends Pattern> patterns,
                                           @Nonnull List<?> subjects,
                                           @Nonnull BiFunction<? super Pattern, Object, Optional<Bindings>> elementMatcher) {
        Preconditions.checkArgument(patterns.size() == subjects.size(), "patterns and subjects differ in length");
        final Bindings.Builder bindings = Bindings.newBuilder();
        for (int i = 0; i < patterns.size(); i++) {
            final Optional<Bindings> elementBindings = elementMatcher.apply(patterns.get(i), subjects.get(i));
            if (elementBindings.isEmpty()) {
                return Optional.empty();
            }
            bindings.addAll(elementBindings.get());
        }
        return Optional.of(bindings.build());
    }
}
