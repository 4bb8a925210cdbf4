/*
 * PipelinePropertyKey.java
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

package com.shardmerge.query.properties;

import com.google.common.base.MoreObjects;
import com.shardmerge.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * A typed key for a pipeline property. Keys are compared by name.
 * @param <T> the type of the property value
 */
@API(API.Status.UNSTABLE)
public final class PipelinePropertyKey<T> {
    @Nonnull
    private final String name;
    @Nonnull
    private final Class<T> type;
    @Nullable
    private final T defaultValue;

    public PipelinePropertyKey(@Nonnull String name, @Nonnull Class<T> type, @Nullable T defaultValue) {
        this.name = name;
        this.type = type;
        this.defaultValue = defaultValue;
    }

    @Nonnull
    public static PipelinePropertyKey<Boolean> booleanPropertyKey(@Nonnull String name, boolean defaultValue) {
        return new PipelinePropertyKey<>(name, Boolean.class, defaultValue);
    }

    @Nonnull
    public static PipelinePropertyKey<Integer> integerPropertyKey(@Nonnull String name, int defaultValue) {
        return new PipelinePropertyKey<>(name, Integer.class, defaultValue);
    }

    @Nonnull
    public String getName() {
        return name;
    }

    @Nonnull
    public Class<T> getType() {
        return type;
    }

    @Nullable
    public T getDefaultValue() {
        return defaultValue;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return name.equals(((PipelinePropertyKey<?>)o).name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("name", name)
                .add("type", type.getSimpleName())
                .add("default", defaultValue)
                .toString();
    }
}
