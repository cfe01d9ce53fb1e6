/*
 * API.java
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

package com.apple.foundationdb.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks how stable a public type, method or field of the structural matching library is.
 *
 * <p>
 * Members of an annotated type inherit the status of the type unless they carry their own annotation. A status may be
 * promoted to a more stable one at any time, but it is never demoted within a minor release.
 * </p>
 */
@Target({ElementType.TYPE, ElementType.METHOD, ElementType.CONSTRUCTOR, ElementType.FIELD})
@Retention(RetentionPolicy.CLASS)
@Documented
public @interface API {
    /**
     * The stability of the annotated element.
     * @return the stability status
     */
    Status value();

    /**
     * Stability levels, ordered from least to most stable.
     */
    enum Status {
        /**
         * Public only so that other packages of the library can reach it. Not for use by clients; may change without
         * notice.
         */
        INTERNAL,

        /**
         * Slated for removal. Stays until the next minor release at the earliest.
         */
        DEPRECATED,

        /**
         * Still being shaped. Clients may use it but should expect changes in any release.
         */
        EXPERIMENTAL,

        /**
         * May change with the next minor release, but not before.
         */
        UNSTABLE,

        /**
         * Kept backwards-compatible until the next major release.
         */
        MAINTAINED,
    }
}
