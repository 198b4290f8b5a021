package me.golemcore.costmodel.domain.model;

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

import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A single labeled time series returned by a metrics query.
 *
 * <p>
 * Instant queries produce one value per series; range queries produce the full
 * time-ascending sequence. A series with no values is valid and means "no
 * data" for that label set.
 *
 * @since 1.0
 */
@Value
public class QueryResult {

    public static final String CLUSTER_ID_LABEL = "cluster_id";

    Map<String, String> labels;
    List<QueryValue> values;

    public QueryResult(Map<String, String> labels, List<QueryValue> values) {
        this.labels = labels != null ? Map.copyOf(labels) : Map.of();
        this.values = values != null ? List.copyOf(values) : List.of();
    }

    /**
     * Returns the label value, or empty when the label is missing or blank.
     */
    public Optional<String> label(String name) {
        String value = labels.get(name);
        if (value == null || value.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(value);
    }

    /**
     * Resolves the cluster this series belongs to, falling back to the given
     * default when the series carries no {@code cluster_id} label.
     */
    public String clusterIdOr(String defaultClusterId) {
        return label(CLUSTER_ID_LABEL).orElse(defaultClusterId);
    }

    public Optional<QueryValue> firstValue() {
        return values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }
}
