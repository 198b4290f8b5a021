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
import me.golemcore.costmodel.port.outbound.MetricsTransportPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Executes a single fully formed query against the metrics backend and parses
 * the answer.
 *
 * <p>
 * No retries happen here. A query that matches nothing yields an empty list.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QueryExecutor {

    private final MetricsTransportPort transport;
    private final QueryResultParser parser;

    /**
     * @throws QueryException
     *             on transport or parse failure
     */
    public List<QueryResult> execute(String query) {
        log.trace("[Query] instant: {}", query);
        String raw = transport.query(query);
        return parser.parse(raw);
    }

    /**
     * @throws QueryException
     *             on transport or parse failure
     */
    public List<QueryResult> executeRange(String query, Instant start, Instant end, Duration step) {
        log.trace("[Query] range {}..{} step {}: {}", start, end, step, query);
        String raw = transport.queryRange(query, start, end, step);
        return parser.parse(raw);
    }
}
