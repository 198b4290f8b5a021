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

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * One query of a batch: a logical name, the PromQL text and, for range
 * queries, the evaluation range.
 */
public record QueryRequest(String name, String query, Instant start, Instant end, Duration step) {

    public QueryRequest {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(query, "query");
    }

    public static QueryRequest instant(String name, String query) {
        return new QueryRequest(name, query, null, null, null);
    }

    public static QueryRequest range(String name, String query, Instant start, Instant end, Duration step) {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        Objects.requireNonNull(step, "step");
        return new QueryRequest(name, query, start, end, step);
    }

    public boolean isRange() {
        return step != null;
    }
}
