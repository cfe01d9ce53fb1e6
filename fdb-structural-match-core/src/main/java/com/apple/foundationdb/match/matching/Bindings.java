/*
 * Bindings.java
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
import com.apple.foundationdb.match.Variable;
import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiConsumer;

/**
 * The values captured by the variables of a pattern during one match attempt. Bindings are keyed by
 * {@link Variable#getId()} and are immutable; combining two bindings produces a new one.
 *
 * <p>
 * Since a variable occurs at most once in a pattern, two bindings that are combined never bind the same variable.
 * </p>
 */
@API(API.Status.INTERNAL)
public final class Bindings {
    private static final Bindings EMPTY = new Bindings(Collections.emptyMap());

    // values may be null, so each entry holds its variable and value together
    @Nonnull
    private final Map<Long, Binding> bindingMap;

    private Bindings(@Nonnull Map<Long, Binding> bindingMap) {
        this.bindingMap = bindingMap;
    }

    @Nonnull
    public static Bindings empty() {
        return EMPTY;
    }

    @Nonnull
    public static Bindings of(@Nonnull Variable variable, @Nullable Object value) {
        return new Bindings(Collections.singletonMap(variable.getId(), new Binding(variable, value)));
    }

    @Nonnull
    public static Bindings mergeAll(@Nonnull Collection<Bindings> bindingsCollection) {
        final Builder builder = newBuilder();
        bindingsCollection.forEach(builder::addAll);
        return builder.build();
    }

    @Nonnull
    public Bindings merge(@Nonnull Bindings other) {
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        return newBuilder().addAll(this).addAll(other).build();
    }

    public boolean isEmpty() {
        return bindingMap.isEmpty();
    }

    public int size() {
        return bindingMap.size();
    }

    public boolean containsVariable(@Nonnull Variable variable) {
        return bindingMap.containsKey(variable.getId());
    }

    /**
     * Get the binding of a variable.
     * @param variable the variable
     * @return the binding, whose value may be {@code null}, or empty if the variable is not bound here
     */
    @Nonnull
    public Optional<Binding> getBinding(@Nonnull Variable variable) {
        return Optional.ofNullable(bindingMap.get(variable.getId()));
    }

    @Nonnull
    public Collection<Variable> getVariables() {
        return bindingMap.values().stream().map(Binding::getVariable).collect(ImmutableList.toImmutableList());
    }

    public void forEach(@Nonnull BiConsumer<? super Variable, Object> consumer) {
        for (Binding binding : bindingMap.values()) {
            consumer.accept(binding.getVariable(), binding.getValue());
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return bindingMap.equals(((Bindings)o).bindingMap);
    }

    @Override
    public int hashCode() {
        return bindingMap.hashCode();
    }

    @Override
    public String toString() {
        return bindingMap.values().toString();
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder();
    }

    /**
     * A single variable and the value bound to it.
     */
    public static final class Binding {
        @Nonnull
        private final Variable variable;
        @Nullable
        private final Object value;

        private Binding(@Nonnull Variable variable, @Nullable Object value) {
            this.variable = variable;
            this.value = value;
        }

        @Nonnull
        public Variable getVariable() {
            return variable;
        }

        @Nullable
        public Object getValue() {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            final Binding binding = (Binding)o;
            return variable.getId() == binding.variable.getId() && Objects.equals(value, binding.value);
        }

        @Override
        public int hashCode() {
            return 31 * Long.hashCode(variable.getId()) + Objects.hashCode(value);
        }

        @Override
        public String toString() {
            return variable + "=" + value;
        }
    }

    /**
     * Accumulates bindings in insertion order.
     */
    public static final class Builder {
        @Nonnull
        private final Map<Long, Binding> bindingMap = new LinkedHashMap<>();

        private Builder() {
        }

        @Nonnull
        public Builder add(@Nonnull Variable variable, @Nullable Object value) {
            final Binding previous = bindingMap.put(variable.getId(), new Binding(variable, value));
            Verify.verify(previous == null, "variable %s bound twice", variable);
            return this;
        }

        @Nonnull
        public Builder addAll(@Nonnull Bindings bindings) {
            bindings.forEach(this::add);
            return this;
        }

        @Nonnull
        public Bindings build() {
            if (bindingMap.isEmpty()) {
                return EMPTY;
            }
            return new Bindings(Collections.unmodifiableMap(new LinkedHashMap<>(bindingMap)));
        }
    }
}
