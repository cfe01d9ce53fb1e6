/*
 * MapPattern.java
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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * A pattern over the entries of a {@link Map} subject. Each entry of the pattern is a pair of a key pattern and a
 * value pattern, and the pattern matches if every pattern entry can be assigned to its own, distinct subject entry
 * whose key matches the key pattern and whose value matches the value pattern.
 *
 * <p>
 * Pattern entries are not looked up by key: a key pattern is matched structurally like any other pattern, so a
 * {@link com.apple.foundationdb.match.Variable} in key position can bind to any key whose value also matches.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public class MapPattern implements Pattern {
    @Nonnull
    private final Map<Pattern, Pattern> entries;

    public MapPattern(@Nonnull Map<? extends Pattern, ? extends Pattern> entries) {
        this.entries = ImmutableMap.copyOf(entries);
    }

    @Nonnull
    public List<Map.Entry<Pattern, Pattern>> getEntryList() {
        return ImmutableList.copyOf(entries.entrySet());
    }

    public int size() {
        return entries.size();
    }

    @Nonnull
    @Override
    public Kind getKind() {
        return Kind.MAPPING;
    }

    /**
     * The key and value patterns of all entries, each key followed by its value.
     * @return keys and values, interleaved
     */
    @Nonnull
    @Override
    public Iterable<? extends Pattern> getChildren() {
        final ImmutableList.Builder<Pattern> children = ImmutableList.builderWithExpectedSize(2 * entries.size());
        entries.forEach((key, value) -> children.add(key).add(value));
        return children.build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return entries.equals(((MapPattern)o).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return entries.entrySet().stream()
                .map(entry -> entry.getKey() + ": " + entry.getValue())
                .collect(Collectors.joining(", ", "{", "}"));
    }
}
