/*
 * MaybeUndefined.java
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

package com.shardmerge.query.aggregate;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.shardmerge.annotation.API;
import com.shardmerge.query.Undefined;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;
import java.util.function.BiFunction;

/**
 * Either a defined value or {@link Undefined}.
 *
 * <p>
 * Undefined is sticky: {@link #combine} with an undefined operand on either side is undefined, so once a running
 * aggregate becomes undefined no later input can make it defined again.
 * </p>
 *
 * @param <T> the type of the defined value
 */
@API(API.Status.UNSTABLE)
public final class MaybeUndefined<T> {
    private static final MaybeUndefined<?> UNDEFINED = new MaybeUndefined<>(null);

    @Nullable
    private final T value;

    private MaybeUndefined(@Nullable T value) {
        this.value = value;
    }

    @Nonnull
    public static <T> MaybeUndefined<T> defined(@Nonnull T value) {
        return new MaybeUndefined<>(Preconditions.checkNotNull(value));
    }

    @Nonnull
    @SuppressWarnings("unchecked")
    public static <T> MaybeUndefined<T> undefined() {
        return (MaybeUndefined<T>)UNDEFINED;
    }

    public boolean isDefined() {
        return value != null;
    }

    /**
     * Get the defined value.
     * @return the value
     * @throws IllegalStateException if this is undefined
     */
    @Nonnull
    public T get() {
        Preconditions.checkState(value != null, "value is undefined");
        return value;
    }

    /**
     * Get the defined value, or {@link Undefined#INSTANCE}.
     * @return the value as seen by callers of an aggregate
     */
    @Nonnull
    public Object toResult() {
        return value == null ? Undefined.INSTANCE : value;
    }

    @Nonnull
    public <U, R> MaybeUndefined<R> combine(@Nonnull MaybeUndefined<U> other,
                                            @Nonnull BiFunction<? super T, ? super U, ? extends R> function) {
        if (value == null || other.value == null) {
            return undefined();
        }
        return defined(function.apply(value, other.value));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Objects.equals(value, ((MaybeUndefined<?>)o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public String toString() {
        if (value == null) {
            return Undefined.INSTANCE.toString();
        }
        return MoreObjects.toStringHelper(this).addValue(value).toString();
    }
}
