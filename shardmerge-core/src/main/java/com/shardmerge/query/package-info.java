/*
 * package-info.java
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

/**
 * Cross-partition query execution. Results of a query that runs on many partitions are merged here into one result
 * stream that looks as if the query had run on a single partition.
 *
 * <p>
 * The pipeline is a stack of {@link com.shardmerge.query.QueryExecutionComponent}s, each wrapping the one below it.
 * Pages flow up as {@link com.shardmerge.query.ResultBatch}es; failures are {@link com.shardmerge.query.QueryCoreException}s.
 * </p>
 */
package com.shardmerge.query;
