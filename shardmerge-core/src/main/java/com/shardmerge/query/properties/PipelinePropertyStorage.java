/*
 * PipelinePropertyStorage.java
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

import com.google.common.collect.ImmutableMap;
import com.shardmerge.annotation.API;
import com.shardmerge.query.QueryCoreArgumentException;
import com.shardmerge.query.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.HashMap;
import java.util.Map;

/**
 * An immutable set of pipeline property values. Properties that were not set read as the default of their key.
 */
@API(API.Status.UNSTABLE)
public final class PipelinePropertyStorage {
    @Nonnull
    private static final PipelinePropertyStorage EMPTY = new PipelinePropertyStorage(ImmutableMap.of());

    @Nonnull
    private final ImmutableMap<PipelinePropertyKey<?>, Object> propertyMap;

    private PipelinePropertyStorage(@Nonnull ImmutableMap<PipelinePropertyKey<?>, Object> propertyMap) {
        this.propertyMap = propertyMap;
    }

    @Nonnull
    public static PipelinePropertyStorage getEmptyInstance() {
        return EMPTY;
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder();
    }

    @Nonnull
    public Map<PipelinePropertyKey<?>, Object> getPropertyMap() {
        return propertyMap;
    }

    /**
     * Get the value of a property.
     * @param propertyKey the key of the property
     * @param <T> the type of the property value
     * @return the value set for the property, or the key's default if none was set
     */
    @Nullable
    public <T> T getPropertyValue(@Nonnull PipelinePropertyKey<T> propertyKey) {
        final Object value = propertyMap.get(propertyKey);
        if (value == null) {
            return propertyKey.getDefaultValue();
        }
        return propertyKey.getType().cast(value);
    }

    @Nonnull
    public Builder toBuilder() {
        return new Builder(propertyMap);
    }

    @Override
    public String toString() {
        return propertyMap.toString();
    }

    /**
     * Builder for {@link PipelinePropertyStorage}.
     */
    public static class Builder {
        @Nonnull
        private final Map<PipelinePropertyKey<?>, Object> propertyMap;

        private Builder() {
            this.propertyMap = new HashMap<>();
        }

        private Builder(@Nonnull Map<PipelinePropertyKey<?>, Object> properties) {
            this.propertyMap = new HashMap<>(properties);
        }

        /**
         * Set a property value.
         * @param propertyKey the key of the property
         * @param value the value to set
         * @param <T> the type of the property value
         * @return this builder
         * @throws QueryCoreArgumentException if the property was already set in this builder
         */
        @Nonnull
        public <T> Builder addProp(@Nonnull PipelinePropertyKey<T> propertyKey, @Nonnull T value) {
            if (propertyMap.containsKey(propertyKey)) {
                throw new QueryCoreArgumentException("duplicate pipeline property",
                        LogMessageKeys.PROPERTY, propertyKey.getName());
            }
            propertyMap.put(propertyKey, value);
            return this;
        }

        @Nonnull
        public <T> Builder removePropertyValue(@Nonnull PipelinePropertyKey<T> propertyKey) {
            propertyMap.remove(propertyKey);
            return this;
        }

        @Nonnull
        public PipelinePropertyStorage build() {
            if (propertyMap.isEmpty()) {
                return EMPTY;
            }
            return new PipelinePropertyStorage(ImmutableMap.copyOf(propertyMap));
        }
    }
}
