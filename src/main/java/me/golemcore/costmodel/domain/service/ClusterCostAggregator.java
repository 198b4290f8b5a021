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

import me.golemcore.costmodel.domain.model.ClusterCosts;
import me.golemcore.costmodel.domain.model.ClusterCostsBreakdown;
import me.golemcore.costmodel.domain.model.CostCategory;
import me.golemcore.costmodel.domain.model.Discounts;
import me.golemcore.costmodel.domain.model.QueryResult;
import me.golemcore.costmodel.domain.model.QueryValue;
import me.golemcore.costmodel.domain.model.TimeWindow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Folds the results of the cumulative cost query batch into per-cluster
 * {@link ClusterCosts}.
 *
 * <p>
 * Steps:
 * <ol>
 * <li>Effective data volume: the data-count query's leading value (observed
 * one-minute samples), else the window length in minutes</li>
 * <li>Accumulation: each CPU, GPU, RAM and storage series adds its leading
 * value, discounted per {@link CostCategory}, to its cluster</li>
 * <li>Breakdowns: CPU mode fractions by {@code mode} label; RAM system
 * fraction</li>
 * <li>Materialization: one {@link ClusterCosts} per cluster with monthly
 * rates over the data hours</li>
 * </ol>
 *
 * <p>
 * Series without a {@code cluster_id} label belong to the default cluster.
 * Several series of one cluster and category are summed. This class holds no
 * state; the same inputs always give the same output.
 */
@Component
@Slf4j
public class ClusterCostAggregator {

    private static final double MINUTES_PER_HOUR = 60.0;
    private static final String MODE_LABEL = "mode";

    private static final List<CostCategory> ACCUMULATION_ORDER = List.of(
            CostCategory.GPU, CostCategory.CPU, CostCategory.RAM, CostCategory.STORAGE);

    /**
     * @param batch
     *            results of {@link ClusterCostQueries#cumulativeCostQueries}
     * @param window
     *            resolved window the queries covered
     * @param discounts
     *            discount fractions to apply
     * @param defaultClusterId
     *            cluster for series without a {@code cluster_id} label
     * @return costs keyed by cluster id
     * @throws me.golemcore.costmodel.domain.exception.InvalidRangeException
     *             if no positive data duration can be resolved
     */
    public Map<String, ClusterCosts> aggregate(QueryBatchResult batch, TimeWindow window, Discounts discounts,
            String defaultClusterId) {
        double dataMinutes = resolveDataMinutes(batch.get(ClusterCostQueries.DATA_COUNT), window);

        Map<String, Map<CostCategory, Double>> costData = new LinkedHashMap<>();
        for (CostCategory category : ACCUMULATION_ORDER) {
            accumulate(costData, batch.get(queryNameOf(category)), category, discounts, defaultClusterId);
        }

        Map<String, ClusterCostsBreakdown> cpuBreakdowns = cpuBreakdowns(
                batch.get(ClusterCostQueries.CPU_MODE_PCT), defaultClusterId);
        // RAM "other" is queried but not merged: no agreed formula yet
        Map<String, ClusterCostsBreakdown> ramBreakdowns = ramBreakdowns(
                batch.get(ClusterCostQueries.RAM_SYSTEM_PCT), defaultClusterId);

        double dataHours = dataMinutes / MINUTES_PER_HOUR;
        Map<String, ClusterCosts> costsByCluster = new LinkedHashMap<>();
        for (Map.Entry<String, Map<CostCategory, Double>> entry : costData.entrySet()) {
            String clusterId = entry.getKey();
            Map<CostCategory, Double> costs = entry.getValue();

            ClusterCosts clusterCosts = ClusterCosts.fromCumulative(
                    costs.getOrDefault(CostCategory.CPU, 0.0),
                    costs.getOrDefault(CostCategory.GPU, 0.0),
                    costs.getOrDefault(CostCategory.RAM, 0.0),
                    costs.getOrDefault(CostCategory.STORAGE, 0.0),
                    window, dataHours);

            ClusterCostsBreakdown cpuBreakdown = cpuBreakdowns.get(clusterId);
            ClusterCostsBreakdown ramBreakdown = ramBreakdowns.get(clusterId);
            if (cpuBreakdown != null || ramBreakdown != null) {
                clusterCosts = clusterCosts.toBuilder()
                        .cpuBreakdown(cpuBreakdown)
                        .ramBreakdown(ramBreakdown)
                        .build();
            }

            log.debug("[ClusterCosts] {}: total={} monthly={}", clusterId,
                    clusterCosts.getTotalCumulative(), clusterCosts.getTotalMonthly());
            costsByCluster.put(clusterId, clusterCosts);
        }
        return costsByCluster;
    }

    double resolveDataMinutes(List<QueryResult> dataCount, TimeWindow window) {
        Optional<QueryValue> first = dataCount.isEmpty() ? Optional.empty() : dataCount.get(0).firstValue();
        if (first.isPresent()) {
            return first.get().value();
        }
        log.info("[ClusterCosts] Data count returned no results, using window of {} minutes", window.minutes());
        return window.minutes();
    }

    private void accumulate(Map<String, Map<CostCategory, Double>> costData, List<QueryResult> results,
            CostCategory category, Discounts discounts, String defaultClusterId) {
        double factor = category.discountFactor(discounts);
        for (QueryResult result : results) {
            String clusterId = result.clusterIdOr(defaultClusterId);
            Map<CostCategory, Double> clusterData = costData.computeIfAbsent(clusterId,
                    id -> new EnumMap<>(CostCategory.class));
            result.firstValue().ifPresent(value -> clusterData.merge(category, value.value() * factor, Double::sum));
        }
    }

    private Map<String, ClusterCostsBreakdown> cpuBreakdowns(List<QueryResult> results, String defaultClusterId) {
        Map<String, ClusterCostsBreakdown> breakdowns = new LinkedHashMap<>();
        for (QueryResult result : results) {
            Optional<QueryValue> value = result.firstValue();
            if (value.isEmpty()) {
                continue;
            }
            Optional<String> mode = result.label(MODE_LABEL);
            if (mode.isEmpty()) {
                log.debug("[ClusterCosts] CPU mode series without mode label counted as other");
            }
            double fraction = value.get().value();
            breakdowns.compute(result.clusterIdOr(defaultClusterId), (id, current) -> orEmpty(current)
                    .plusMode(mode.orElse(null), fraction));
        }
        return breakdowns;
    }

    private Map<String, ClusterCostsBreakdown> ramBreakdowns(List<QueryResult> results, String defaultClusterId) {
        Map<String, ClusterCostsBreakdown> breakdowns = new LinkedHashMap<>();
        for (QueryResult result : results) {
            result.firstValue().ifPresent(value -> breakdowns.compute(result.clusterIdOr(defaultClusterId),
                    (id, current) -> orEmpty(current).plusSystem(value.value())));
        }
        return breakdowns;
    }

    private static ClusterCostsBreakdown orEmpty(ClusterCostsBreakdown breakdown) {
        return breakdown != null ? breakdown : ClusterCostsBreakdown.empty();
    }

    private static String queryNameOf(CostCategory category) {
        return switch (category) {
        case CPU -> ClusterCostQueries.TOTAL_CPU;
        case GPU -> ClusterCostQueries.TOTAL_GPU;
        case RAM -> ClusterCostQueries.TOTAL_RAM;
        case STORAGE -> ClusterCostQueries.TOTAL_STORAGE;
        };
    }
}
