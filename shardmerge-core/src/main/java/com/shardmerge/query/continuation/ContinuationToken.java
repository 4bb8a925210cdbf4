/*
 * ContinuationToken.java
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

package com.shardmerge.query.continuation;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.MessageOrBuilder;
import com.google.protobuf.util.JsonFormat;
import com.shardmerge.annotation.API;
import com.shardmerge.query.BadRequestException;
import com.shardmerge.query.QueryInvariantException;
import com.shardmerge.query.logging.KeyValueLogMessage;
import com.shardmerge.query.logging.LogMessageKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * The state of an offset or limit component between two pages: how many items are still to be skipped or returned,
 * and the continuation of the component's source.
 *
 * <p>
 * Tokens travel to clients as JSON, for example {@code {"offset":3,"sourceToken":"..."}}. Unknown fields are ignored
 * when reading. A token whose count is missing, negative or larger than the count of the query it is replayed
 * against is rejected with a {@link BadRequestException}.
 * </p>
 */
@API(API.Status.UNSTABLE)
public final class ContinuationToken {
    @Nonnull
    private static final Logger LOGGER = LoggerFactory.getLogger(ContinuationToken.class);

    @Nonnull
    private static final JsonFormat.Printer PRINTER = JsonFormat.printer().omittingInsignificantWhitespace();
    @Nonnull
    private static final JsonFormat.Parser PARSER = JsonFormat.parser().ignoringUnknownFields();

    @Nonnull
    private final TokenKind kind;
    private final int remaining;
    @Nullable
    private final String sourceToken;

    public ContinuationToken(@Nonnull TokenKind kind, int remaining, @Nullable String sourceToken) {
        Preconditions.checkArgument(remaining >= 0, "remaining count must not be negative");
        this.kind = kind;
        this.remaining = remaining;
        this.sourceToken = sourceToken;
    }

    @Nonnull
    public TokenKind getKind() {
        return kind;
    }

    /**
     * Get the number of items still to be skipped (for {@link TokenKind#OFFSET}) or returned.
     * @return the remaining count
     */
    public int getRemaining() {
        return remaining;
    }

    @Nullable
    public String getSourceToken() {
        return sourceToken;
    }

    /**
     * Parse a token and check it against the count of the current query.
     *
     * @param kind the kind of token expected
     * @param json the token as received from the client
     * @param queryCount the offset or limit count of the current query
     * @return the parsed token
     * @throws BadRequestException if the token is malformed or its count exceeds {@code queryCount}
     */
    @Nonnull
    public static ContinuationToken parse(@Nonnull TokenKind kind, @Nonnull String json, int queryCount) {
        final ContinuationToken token = parse(kind, json);
        if (token.getRemaining() > queryCount) {
            if (LOGGER.isWarnEnabled()) {
                LOGGER.warn(KeyValueLogMessage.of("continuation token count exceeds query count",
                        LogMessageKeys.TOKEN_KIND, kind,
                        LogMessageKeys.TOKEN_COUNT, token.getRemaining(),
                        LogMessageKeys.REQUESTED_COUNT, queryCount));
            }
            throw new BadRequestException(kind.getCountField() + " count in continuation token: " + token.getRemaining()
                                          + " can not be greater than the " + kind.getCountField()
                                          + " count in the query: " + queryCount + ".",
                    LogMessageKeys.TOKEN_KIND, kind,
                    LogMessageKeys.TOKEN_COUNT, token.getRemaining(),
                    LogMessageKeys.REQUESTED_COUNT, queryCount);
        }
        return token;
    }

    /**
     * Parse a token without checking its count against a query.
     *
     * @param kind the kind of token expected
     * @param json the token as received from the client
     * @return the parsed token
     * @throws BadRequestException if the token is not a JSON object or its count is missing or negative
     */
    @Nonnull
    public static ContinuationToken parse(@Nonnull TokenKind kind, @Nonnull String json) {
        if (Strings.isNullOrEmpty(json.trim())) {
            throw malformed(kind, json, null);
        }
        final String object = toJsonObject(kind, json);
        try {
            switch (kind) {
                case OFFSET:
                    final ContinuationTokenProto.OffsetContinuation.Builder offset =
                            ContinuationTokenProto.OffsetContinuation.newBuilder();
                    PARSER.merge(object, offset);
                    return fromFields(kind, json, offset.hasOffset(), offset.getOffset(),
                            offset.hasSourceToken() ? offset.getSourceToken() : null);
                case LIMIT:
                    final ContinuationTokenProto.LimitContinuation.Builder limit =
                            ContinuationTokenProto.LimitContinuation.newBuilder();
                    PARSER.merge(object, limit);
                    return fromFields(kind, json, limit.hasLimit(), limit.getLimit(),
                            limit.hasSourceToken() ? limit.getSourceToken() : null);
                case TOP:
                    final ContinuationTokenProto.TopContinuation.Builder top =
                            ContinuationTokenProto.TopContinuation.newBuilder();
                    PARSER.merge(object, top);
                    return fromFields(kind, json, top.hasTop(), top.getTop(),
                            top.hasSourceToken() ? top.getSourceToken() : null);
                default:
                    throw unknownKind(kind);
            }
        } catch (InvalidProtocolBufferException ex) {
            throw malformed(kind, json, ex);
        }
    }

    // JsonFormat stops reading after the first value, so trailing text has to be rejected here.
    @Nonnull
    private static String toJsonObject(@Nonnull TokenKind kind, @Nonnull String json) {
        final JsonElement element;
        try {
            element = JsonParser.parseString(json);
        } catch (JsonParseException ex) {
            throw malformed(kind, json, ex);
        }
        if (!element.isJsonObject()) {
            throw malformed(kind, json, null);
        }
        return element.toString();
    }

    @Nonnull
    private static ContinuationToken fromFields(@Nonnull TokenKind kind, @Nonnull String json, boolean hasCount,
                                                int count, @Nullable String sourceToken) {
        if (!hasCount || count < 0) {
            throw malformed(kind, json, null);
        }
        return new ContinuationToken(kind, count, sourceToken);
    }

    /**
     * Serialize this token to the JSON form handed to clients.
     * @return the JSON text of this token
     */
    @Nonnull
    public String toJson() {
        final MessageOrBuilder message;
        switch (kind) {
            case OFFSET:
                final ContinuationTokenProto.OffsetContinuation.Builder offset =
                        ContinuationTokenProto.OffsetContinuation.newBuilder().setOffset(remaining);
                if (sourceToken != null) {
                    offset.setSourceToken(sourceToken);
                }
                message = offset;
                break;
            case LIMIT:
                final ContinuationTokenProto.LimitContinuation.Builder limit =
                        ContinuationTokenProto.LimitContinuation.newBuilder().setLimit(remaining);
                if (sourceToken != null) {
                    limit.setSourceToken(sourceToken);
                }
                message = limit;
                break;
            case TOP:
                final ContinuationTokenProto.TopContinuation.Builder top =
                        ContinuationTokenProto.TopContinuation.newBuilder().setTop(remaining);
                if (sourceToken != null) {
                    top.setSourceToken(sourceToken);
                }
                message = top;
                break;
            default:
                throw unknownKind(kind);
        }
        try {
            return PRINTER.print(message);
        } catch (InvalidProtocolBufferException ex) {
            final QueryInvariantException err = new QueryInvariantException("unable to serialize continuation token",
                    LogMessageKeys.TOKEN_KIND, kind);
            err.initCause(ex);
            throw err;
        }
    }

    @Nonnull
    private static BadRequestException malformed(@Nonnull TokenKind kind, @Nonnull String json,
                                                 @Nullable Exception cause) {
        if (LOGGER.isWarnEnabled()) {
            LOGGER.warn(KeyValueLogMessage.of("malformed continuation token",
                    LogMessageKeys.TOKEN_KIND, kind,
                    LogMessageKeys.CONTINUATION, json));
        }
        final String message = "Invalid " + kind.getCountField() + " continuation token: " + json;
        final BadRequestException ex = cause == null
                                       ? new BadRequestException(message)
                                       : new BadRequestException(message, cause);
        ex.addLogInfo(LogMessageKeys.TOKEN_KIND.toString(), kind);
        ex.addLogInfo(LogMessageKeys.CONTINUATION.toString(), json);
        return ex;
    }

    @Nonnull
    private static QueryInvariantException unknownKind(@Nonnull TokenKind kind) {
        return new QueryInvariantException("unknown continuation token kind", LogMessageKeys.TOKEN_KIND, kind);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ContinuationToken that = (ContinuationToken)o;
        return remaining == that.remaining && kind == that.kind && Objects.equals(sourceToken, that.sourceToken);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, remaining, sourceToken);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("kind", kind)
                .add("remaining", remaining)
                .add("sourceToken", sourceToken)
                .toString();
    }
}
