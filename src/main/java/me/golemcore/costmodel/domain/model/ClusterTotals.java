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

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Monthly-rate cost totals as time-stamped points, per resource.
 *
 * <p>
 * Point-in-time totals carry one point per series; totals over time carry the
 * full range-query sequence. A category with no data is an empty list.
 *
 * @since 1.0
 */
@Value
@Builder(toBuilder = true)
public class ClusterTotals {

    @Builder.Default
    List<CostPoint> totalCost = List.of();
    @Builder.Default
    List<CostPoint> cpuCost = List.of();
    @Builder.Default
    List<CostPoint> memCost = List.of();
    @Builder.Default
    List<CostPoint> storageCost = List.of();

    public static ClusterTotals empty() {
        return ClusterTotals.builder().build();
    }

    /**
     * A cost value observed at a Unix timestamp in seconds.
     */
    public record CostPoint(double timestamp, double value) {

        public static CostPoint of(QueryValue value) {
            return new CostPoint(value.timestamp(), value.value());
        }
    }
}
