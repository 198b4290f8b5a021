package me.golemcore.costmodel.domain.exception;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

/**
 * Base failure of a single metrics query.
 *
 * <p>
 * Carries the logical name of the query that failed (for example
 * {@code totalCPU}) so that callers of a query batch can decide per query
 * whether the failure is fatal. The name is {@code null} for queries executed
 * outside a batch.
 */
public class QueryException extends RuntimeException {

    private final String queryName;

    public QueryException(String message) {
        this(null, message, null);
    }

    public QueryException(String message, Throwable cause) {
        this(null, message, cause);
    }

    public QueryException(String queryName, String message, Throwable cause) {
        super(message, cause);
        this.queryName = queryName;
    }

    public String getQueryName() {
        return queryName;
    }
}
