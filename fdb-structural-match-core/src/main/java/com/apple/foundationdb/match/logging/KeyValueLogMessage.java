/*
 * KeyValueLogMessage.java
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

package com.apple.foundationdb.match.logging;

import com.apple.foundationdb.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Map;
import java.util.TreeMap;

/**
 * A log message made of a static title followed by {@code key="value"} pairs, sorted by key. Keeping the title
 * static makes it possible to search logs for every occurrence of an event and then pull the details out of the
 * pairs.
 */
@API(API.Status.UNSTABLE)
public class KeyValueLogMessage {
    @Nonnull
    private final String staticMessage;
    @Nonnull
    private final Map<String, String> keyValueMap;

    private KeyValueLogMessage(@Nonnull String staticMessage) {
        this.staticMessage = staticMessage;
        this.keyValueMap = new TreeMap<>();
    }

    /**
     * Format a message right away.
     * @param staticMessage the title of the message
     * @param keysAndValues alternating keys and values
     * @return the formatted message
     * @throws IllegalArgumentException if there is an odd number of {@code keysAndValues}
     */
    @Nonnull
    public static String of(@Nonnull String staticMessage, @Nullable Object... keysAndValues) {
        return build(staticMessage, keysAndValues).toString();
    }

    @Nonnull
    public static KeyValueLogMessage build(@Nonnull String staticMessage, @Nullable Object... keysAndValues) {
        final KeyValueLogMessage message = new KeyValueLogMessage(staticMessage);
        if (keysAndValues != null) {
            if (keysAndValues.length % 2 != 0) {
                throw new IllegalArgumentException("keys and values don't match");
            }
            for (int i = 0; i < keysAndValues.length; i += 2) {
                message.addKeyAndValue(keysAndValues[i], keysAndValues[i + 1]);
            }
        }
        return message;
    }

    @Nonnull
    public KeyValueLogMessage addKeyAndValue(@Nullable Object key, @Nullable Object value) {
        if (key == null) {
            throw new IllegalArgumentException("null key passed to KeyValueLogMessage");
        }
        keyValueMap.put(key.toString().replace("=", ""), String.valueOf(value).replace("\"", "'"));
        return this;
    }

    @Nonnull
    public KeyValueLogMessage addKeysAndValues(@Nonnull Map<?, ?> map) {
        map.forEach(this::addKeyAndValue);
        return this;
    }

    @Nonnull
    public String getStaticMessage() {
        return staticMessage;
    }

    @Nonnull
    public String getMessageWithKeys() {
        final StringBuilder sb = new StringBuilder(staticMessage.length() + keyValueMap.size() * 24);
        sb.append(staticMessage);
        for (Map.Entry<String, String> entry : keyValueMap.entrySet()) {
            sb.append(' ').append(entry.getKey()).append("=\"").append(entry.getValue()).append('"');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return getMessageWithKeys();
    }
}
