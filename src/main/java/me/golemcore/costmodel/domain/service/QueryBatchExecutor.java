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
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs a fixed batch of independent queries in parallel and returns every
 * result set, even when some of the queries fail.
 *
 * <p>
 * Execution model:
 * <ul>
 * <li>Each query runs as its own task on the shared query executor</li>
 * <li>A failing task reports into the batch's {@link ErrorCollector} and
 * delivers an empty result; it never cancels its siblings</li>
 * <li>Every task completes its delivery future before counting down the
 * barrier, so once the barrier releases all results are available</li>
 * <li>Results are drained in submission order</li>
 * </ul>
 *
 * <p>
 * There is no cancellation and no timeout of its own: a batch lasts as long as
 * its slowest query, bounded by the HTTP client's timeouts.
 *
 * @see QueryBatchResult
 */
@Service
@Slf4j
public class QueryBatchExecutor {

    private final QueryExecutor queryExecutor;
    private final Executor executor;

    public QueryBatchExecutor(QueryExecutor queryExecutor,
            @Qualifier("prometheusQueryExecutor") Executor executor) {
        this.queryExecutor = queryExecutor;
        this.executor = executor;
    }

    /**
     * Run all requests and wait for every one of them.
     *
     * @param requests
     *            queries with unique names
     * @return per-query results plus the collected errors
     * @throws IllegalArgumentException
     *             if two requests share a name
     * @throws QueryException
     *             if the calling thread is interrupted while waiting
     */
    public QueryBatchResult run(List<QueryRequest> requests) {
        Set<String> names = new HashSet<>();
        for (QueryRequest request : requests) {
            if (!names.add(request.name())) {
                throw new IllegalArgumentException("Duplicate query name in batch: " + request.name());
            }
        }

        ErrorCollector errors = new ErrorCollector();
        CountDownLatch barrier = new CountDownLatch(requests.size());
        List<CompletableFuture<List<QueryResult>>> deliveries = new ArrayList<>(requests.size());

        log.debug("[QueryBatch] Submitting {} queries", requests.size());
        for (QueryRequest request : requests) {
            CompletableFuture<List<QueryResult>> delivery = new CompletableFuture<>();
            deliveries.add(delivery);
            try {
                executor.execute(() -> runQuery(request, delivery, errors, barrier));
            } catch (RejectedExecutionException e) {
                errors.report(new QueryException(request.name(),
                        "query " + request.name() + " was not scheduled: " + e.getMessage(), e));
                delivery.complete(List.of());
                barrier.countDown();
            }
        }

        try {
            barrier.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueryException("Interrupted while waiting for query batch", e);
        }

        Map<String, List<QueryResult>> results = new LinkedHashMap<>();
        for (int i = 0; i < requests.size(); i++) {
            results.put(requests.get(i).name(), deliveries.get(i).join());
        }

        if (!errors.isEmpty()) {
            log.debug("[QueryBatch] {} of {} queries failed", errors.getErrors().size(), requests.size());
        }
        return new QueryBatchResult(results, errors);
    }

    private void runQuery(QueryRequest request, CompletableFuture<List<QueryResult>> delivery,
            ErrorCollector errors, CountDownLatch barrier) {
        List<QueryResult> results = List.of();
        try {
            log.debug("[QueryBatch] {}: {}", request.name(), request.query());
            results = request.isRange()
                    ? queryExecutor.executeRange(request.query(), request.start(), request.end(), request.step())
                    : queryExecutor.execute(request.query());
        } catch (RuntimeException e) { // NOSONAR - every failure must be collected, not thrown
            log.warn("[QueryBatch] Query {} failed: {}", request.name(), e.getMessage());
            errors.report(new QueryException(request.name(),
                    "query " + request.name() + " failed: " + e.getMessage(), e));
        } finally {
            delivery.complete(results);
            barrier.countDown();
        }
    }
}
