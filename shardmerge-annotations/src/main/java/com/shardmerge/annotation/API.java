/*
 * API.java
 *
 * This source file is part of the Shard Merge open source project
 *
 * Copyright 2024 the Shard Merge project authors
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

package com.shardmerge.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks how stable a public type, constructor, field or method is for code outside this project.
 *
 * <p>
 * A member without its own annotation inherits the status of the enclosing type. A status may move towards
 * {@link Status#STABLE} at any time, but it only moves back towards {@link Status#INTERNAL} in a major release.
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
     * Stability levels, from least to most stable.
     */
    enum Status {
        /**
         * Public only so that other packages of the pipeline can reach it. May change in any release.
         */
        INTERNAL,

        /**
         * Scheduled for removal. Callers should migrate away before the next minor release.
         */
        DEPRECATED,

        /**
         * A new feature whose shape is still being worked out. May change in any release.
         */
        EXPERIMENTAL,

        /**
         * Used by callers, but may still change in a minor release.
         */
        UNSTABLE,

        /**
         * Only changes in a major release.
         */
        STABLE,

        /**
         * Like {@link #STABLE}, with the additional promise that bug fixes are back-ported.
         */
        MAINTAINED,
    }
}
