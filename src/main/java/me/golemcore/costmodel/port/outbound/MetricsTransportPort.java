package me.golemcore.costmodel.port.outbound;

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

import java.time.Duration;
import java.time.Instant;

/**
 * Port for the raw HTTP exchange with a Prometheus-compatible metrics backend.
 * Implementations return the response body unparsed and own connection
 * handling, timeouts and connection-level retries.
 */
public interface MetricsTransportPort {

    /**
     * Run an instant query.
     *
     * @param query
     *            fully formed PromQL expression
     * @return raw JSON response body
     * @throws me.golemcore.costmodel.domain.exception.QueryTransportException
     *             if the backend is unreachable or rejects the query
     */
    String query(String query);

    /**
     * Run a range query evaluated every {@code step} between {@code start} and
     * {@code end}.
     *
     * @return raw JSON response body
     * @throws me.golemcore.costmodel.domain.exception.QueryTransportException
     *             if the backend is unreachable or rejects the query
     */
    String queryRange(String query, Instant start, Instant end, Duration step);
}
