package me.golemcore.costmodel.adapter.inbound.web.dto;

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

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.costmodel.domain.model.ClusterTotals;
import me.golemcore.costmodel.domain.model.ClusterTotals.CostPoint;

import java.util.List;
import java.util.Locale;

/**
 * Cost totals as {@code [timestamp, value]} string pairs, both formatted with
 * six decimals.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TotalsResponse {

    @JsonProperty("totalcost")
    private List<List<String>> totalCost;

    @JsonProperty("cpucost")
    private List<List<String>> cpuCost;

    @JsonProperty("memcost")
    private List<List<String>> memCost;

    @JsonProperty("storageCost")
    private List<List<String>> storageCost;

    public static TotalsResponse from(ClusterTotals totals) {
        return TotalsResponse.builder()
                .totalCost(pairs(totals.getTotalCost()))
                .cpuCost(pairs(totals.getCpuCost()))
                .memCost(pairs(totals.getMemCost()))
                .storageCost(pairs(totals.getStorageCost()))
                .build();
    }

    private static List<List<String>> pairs(List<CostPoint> points) {
        return points.stream()
                .map(p -> List.of(format(p.timestamp()), format(p.value())))
                .toList();
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%f", value);
    }
}
