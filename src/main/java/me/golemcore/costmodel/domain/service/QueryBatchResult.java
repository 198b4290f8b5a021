package me.golemcore.costmodel.domain.service;

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

import me.golemcore.costmodel.domain.exception.QueryException;
import me.golemcore.costmodel.domain.model.QueryResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a query batch: one result list per query, in submission order,
 * and the errors the batch collected. A failed query has an empty result list.
 */
public class QueryBatchResult {

    private final Map<String, List<QueryResult>> results;
    private final ErrorCollector errors;

    QueryBatchResult(Map<String, List<QueryResult>> results, ErrorCollector errors) {
        this.results = new LinkedHashMap<>(results);
        this.errors = errors;
    }

    /**
     * Results of the named query, empty when it failed or matched nothing.
     *
     * @throws IllegalArgumentException
     *             if no query of that name was part of the batch
     */
    public List<QueryResult> get(String name) {
        List<QueryResult> result = results.get(name);
        if (result == null) {
            throw new IllegalArgumentException("No query named '" + name + "' in batch");
        }
        return result;
    }

    public ErrorCollector getErrors() {
        return errors;
    }

    /**
     * Promotes the errors of the given queries to a single fatal exception.
     *
     * @throws QueryException
     *             if any of the named queries failed
     */
    public void requireSuccess(String... names) {
        StringBuilder message = new StringBuilder();
        QueryException first = null;
        for (String name : names) {
            for (QueryException error : errors.errorsFor(name)) {
                if (first == null) {
                    first = error;
                } else {
                    message.append("; ");
                }
                message.append(error.getMessage());
            }
        }
        if (first != null) {
            throw new QueryException(first.getQueryName(), message.toString(), first);
        }
    }
}
