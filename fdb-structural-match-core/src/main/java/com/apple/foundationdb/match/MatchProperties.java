/*
 * MatchProperties.java
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
import com.google.common.base.Preconditions;

import javax.annotation.Nonnull;

/**
 * Tuning knobs for a {@link Matcher}. None of them changes whether a pattern matches a subject, as long as no
 * search limit is hit.
 */
@API(API.Status.EXPERIMENTAL)
public class MatchProperties {
    /**
     * A constant representing that the assignment search may take as many steps as it needs.
     */
    public static final int UNLIMITED_ASSIGNMENT_STEPS = 0;

    /**
     * Properties with the most-constrained-first ordering turned on and no search limit.
     */
    public static final MatchProperties DEFAULT = newBuilder().build();

    private final boolean constrainedFirstOrdering;
    private final int maxAssignmentSteps;

    private MatchProperties(@Nonnull Builder builder) {
        this.constrainedFirstOrdering = builder.constrainedFirstOrdering;
        this.maxAssignmentSteps = builder.maxAssignmentSteps;
    }

    /**
     * Whether the unordered matcher tries the pattern elements with the fewest compatible subject elements first.
     * Turning this off searches the pattern elements in declaration order.
     * @return {@code true} if the most-constrained-first ordering is used
     */
    public boolean shouldUseConstrainedFirstOrdering() {
        return constrainedFirstOrdering;
    }

    /**
     * The maximum number of steps a single assignment search may take before it is abandoned with an
     * {@link AssignmentSearchLimitException}.
     * @return the step limit or {@link #UNLIMITED_ASSIGNMENT_STEPS}
     */
    public int getMaxAssignmentSteps() {
        return maxAssignmentSteps;
    }

    public boolean isAssignmentSearchLimited() {
        return maxAssignmentSteps != UNLIMITED_ASSIGNMENT_STEPS;
    }

    @Nonnull
    public Builder toBuilder() {
        return new Builder(this);
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "MatchProperties{constrainedFirstOrdering=" + constrainedFirstOrdering
               + ", maxAssignmentSteps=" + maxAssignmentSteps + "}";
    }

    /**
     * A builder for {@link MatchProperties}.
     */
    public static class Builder {
        private boolean constrainedFirstOrdering = true;
        private int maxAssignmentSteps = UNLIMITED_ASSIGNMENT_STEPS;

        private Builder() {
        }

        private Builder(@Nonnull MatchProperties properties) {
            this.constrainedFirstOrdering = properties.constrainedFirstOrdering;
            this.maxAssignmentSteps = properties.maxAssignmentSteps;
        }

        @Nonnull
        public Builder setConstrainedFirstOrdering(boolean constrainedFirstOrdering) {
            this.constrainedFirstOrdering = constrainedFirstOrdering;
            return this;
        }

        @Nonnull
        public Builder setMaxAssignmentSteps(int maxAssignmentSteps) {
            Preconditions.checkArgument(maxAssignmentSteps >= 0, "step limit must not be negative");
            this.maxAssignmentSteps = maxAssignmentSteps;
            return this;
        }

        @Nonnull
        public MatchProperties build() {
            return new MatchProperties(this);
        }
    }
}
