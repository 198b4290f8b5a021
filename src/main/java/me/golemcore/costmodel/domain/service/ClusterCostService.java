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

import me.golemcore.costmodel.domain.exception.InsufficientDataException;
import me.golemcore.costmodel.domain.exception.InvalidRangeException;
import me.golemcore.costmodel.domain.exception.QueryException;
import me.golemcore.costmodel.domain.model.ClusterCosts;
import me.golemcore.costmodel.domain.model.ClusterTotals;
import me.golemcore.costmodel.domain.model.ClusterTotals.CostPoint;
import me.golemcore.costmodel.domain.model.Discounts;
import me.golemcore.costmodel.domain.model.QueryResult;
import me.golemcore.costmodel.domain.model.TimeWindow;
import me.golemcore.costmodel.infrastructure.config.CostModelProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;

/**
 * Entry points for cluster cost questions.
 *
 * <p>
 * Each call validates its time inputs before any query is sent, runs its
 * queries as one concurrent batch, then decides which query failures are
 * fatal:
 * <ul>
 * <li>{@link #computeClusterCosts} - CPU, RAM and storage failures are fatal;
 * GPU, data count and usage percentage failures are logged and treated as no
 * data</li>
 * <li>totals entry points - every query is required</li>
 * </ul>
 *
 * @since 1.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ClusterCostService {

    static final String NOT_ENOUGH_DATA = "Not enough data available in the selected time range";

    private final QueryBatchExecutor batchExecutor;
    private final ClusterCostQueries queries;
    private final ClusterCostAggregator aggregator;
    private final DiscountResolver discountResolver;
    private final TimeRangeParser timeRangeParser;
    private final CostModelProperties properties;

    /**
     * Cumulative and monthly-rate costs of every cluster over a window.
     *
     * @param window
     *            window length, e.g. {@code 24h}
     * @param offset
     *            shift of the window end into the past; blank means none
     * @return costs keyed by cluster id
     * @throws InvalidRangeException
     *             if the window or offset is invalid
     * @throws QueryException
     *             if the CPU, RAM or storage query failed
     */
    public Map<String, ClusterCosts> computeClusterCosts(String window, String offset) {
        TimeWindow timeWindow = timeRangeParser.resolveWindow(window, offset);

        QueryBatchResult batch = batchExecutor.run(queries.cumulativeCostQueries(window, offset));
        logNonFatal(batch, ClusterCostQueries.TOTAL_GPU, ClusterCostQueries.DATA_COUNT,
                ClusterCostQueries.CPU_MODE_PCT, ClusterCostQueries.RAM_SYSTEM_PCT, ClusterCostQueries.RAM_OTHER_PCT);
        try {
            batch.requireSuccess(ClusterCostQueries.TOTAL_CPU, ClusterCostQueries.TOTAL_RAM,
                    ClusterCostQueries.TOTAL_STORAGE);
        } catch (QueryException e) {
            log.warn("[ClusterCosts] Failed to compute costs on {} ({}): {}", window, offset, e.getMessage());
            throw e;
        }

        Discounts discounts = discountResolver.resolve();
        String defaultClusterId = properties.getCluster().getDefaultId();
        return aggregator.aggregate(batch, timeWindow, discounts, defaultClusterId);
    }

    /**
     * Monthly-rate CPU, RAM and storage costs of every cluster, averaged over a
     * window. Each category holds one point per series of that cluster.
     */
    public Map<String, ClusterTotals> clusterTotalsForAllClusters(String window, String offset) {
        timeRangeParser.resolveWindow(window, offset);

        QueryBatchResult batch = batchExecutor.run(List.of(
                QueryRequest.instant(ClusterCostQueries.CLUSTER_CORES, queries.clusterCores(window, offset)),
                QueryRequest.instant(ClusterCostQueries.CLUSTER_RAM, queries.clusterRam(window, offset)),
                QueryRequest.instant(ClusterCostQueries.CLUSTER_STORAGE, queries.clusterStorage(window, offset))));
        batch.requireSuccess(ClusterCostQueries.CLUSTER_CORES, ClusterCostQueries.CLUSTER_RAM,
                ClusterCostQueries.CLUSTER_STORAGE);

        String defaultClusterId = properties.getCluster().getDefaultId();
        Map<String, ClusterTotals> totalsByCluster = new LinkedHashMap<>();
        mergeTotals(totalsByCluster, totalsByCluster(batch.get(ClusterCostQueries.CLUSTER_CORES), defaultClusterId),
                (totals, points) -> totals.toBuilder().cpuCost(points).build());
        mergeTotals(totalsByCluster, totalsByCluster(batch.get(ClusterCostQueries.CLUSTER_RAM), defaultClusterId),
                (totals, points) -> totals.toBuilder().memCost(points).build());
        mergeTotals(totalsByCluster, totalsByCluster(batch.get(ClusterCostQueries.CLUSTER_STORAGE), defaultClusterId),
                (totals, points) -> totals.toBuilder().storageCost(points).build());
        return totalsByCluster;
    }

    /**
     * Monthly-rate totals of the default cluster averaged over a window,
     * including the overall total.
     */
    public ClusterTotals averageClusterTotals(String window, String offset) {
        timeRangeParser.resolveWindow(window, offset);

        QueryBatchResult batch = batchExecutor.run(List.of(
                QueryRequest.instant(ClusterCostQueries.CLUSTER_CORES, queries.clusterCores(window, offset)),
                QueryRequest.instant(ClusterCostQueries.CLUSTER_RAM, queries.clusterRam(window, offset)),
                QueryRequest.instant(ClusterCostQueries.CLUSTER_STORAGE, queries.clusterStorage(window, offset)),
                QueryRequest.instant(ClusterCostQueries.CLUSTER_TOTAL, queries.clusterTotal(window, offset))));
        batch.requireSuccess(ClusterCostQueries.CLUSTER_CORES, ClusterCostQueries.CLUSTER_RAM,
                ClusterCostQueries.CLUSTER_STORAGE, ClusterCostQueries.CLUSTER_TOTAL);

        String defaultClusterId = properties.getCluster().getDefaultId();
        return ClusterTotals.builder()
                .totalCost(pointsFor(batch.get(ClusterCostQueries.CLUSTER_TOTAL), defaultClusterId))
                .cpuCost(pointsFor(batch.get(ClusterCostQueries.CLUSTER_CORES), defaultClusterId))
                .memCost(pointsFor(batch.get(ClusterCostQueries.CLUSTER_RAM), defaultClusterId))
                .storageCost(pointsFor(batch.get(ClusterCostQueries.CLUSTER_STORAGE), defaultClusterId))
                .build();
    }

    /**
     * Monthly-rate totals as time series between {@code start} and {@code end},
     * one point per {@code window}.
     *
     * @param start
     *            ISO-8601 instant
     * @param end
     *            ISO-8601 instant, after {@code start}
     * @param window
     *            averaging window, also used as the range step
     * @throws InvalidRangeException
     *             if the range or window is invalid
     * @throws InsufficientDataException
     *             if any query returned no series
     */
    public ClusterTotals clusterCostsOverTime(String start, String end, String window, String offset) {
        Instant startTime = timeRangeParser.parseTimestamp(start);
        Instant endTime = timeRangeParser.parseTimestamp(end);
        Duration step = timeRangeParser.parseDuration(window);
        timeRangeParser.parseOffset(offset);
        if (step.isZero()) {
            throw new InvalidRangeException("illegal step: window '" + window + "' has zero length");
        }
        if (!endTime.isAfter(startTime)) {
            throw new InvalidRangeException("illegal time range: end " + end + " is not after start " + start);
        }

        QueryBatchResult batch = batchExecutor.run(List.of(
                QueryRequest.range(ClusterCostQueries.CLUSTER_CORES, queries.clusterCores(window, offset),
                        startTime, endTime, step),
                QueryRequest.range(ClusterCostQueries.CLUSTER_RAM, queries.clusterRam(window, offset),
                        startTime, endTime, step),
                QueryRequest.range(ClusterCostQueries.CLUSTER_STORAGE, queries.clusterStorage(window, offset),
                        startTime, endTime, step),
                QueryRequest.range(ClusterCostQueries.CLUSTER_TOTAL, queries.clusterTotal(window, offset),
                        startTime, endTime, step)));
        batch.requireSuccess(ClusterCostQueries.CLUSTER_CORES, ClusterCostQueries.CLUSTER_RAM,
                ClusterCostQueries.CLUSTER_STORAGE, ClusterCostQueries.CLUSTER_TOTAL);

        return ClusterTotals.builder()
                .totalCost(seriesPoints(batch.get(ClusterCostQueries.CLUSTER_TOTAL)))
                .cpuCost(seriesPoints(batch.get(ClusterCostQueries.CLUSTER_CORES)))
                .memCost(seriesPoints(batch.get(ClusterCostQueries.CLUSTER_RAM)))
                .storageCost(seriesPoints(batch.get(ClusterCostQueries.CLUSTER_STORAGE)))
                .build();
    }

    private void logNonFatal(QueryBatchResult batch, String... names) {
        for (String name : names) {
            for (QueryException error : batch.getErrors().errorsFor(name)) {
                log.warn("[ClusterCosts] Ignoring failed {} query: {}", name, error.getMessage());
            }
        }
    }

    /**
     * Leading value of every series, grouped by cluster. Series without values
     * are skipped.
     */
    private Map<String, List<CostPoint>> totalsByCluster(List<QueryResult> results, String defaultClusterId) {
        Map<String, List<CostPoint>> points = new LinkedHashMap<>();
        for (QueryResult result : results) {
            if (result.firstValue().isEmpty()) {
                log.warn("[ClusterCosts] Metric values did not contain any valid data");
                continue;
            }
            points.computeIfAbsent(result.clusterIdOr(defaultClusterId), id -> new ArrayList<>())
                    .add(CostPoint.of(result.firstValue().get()));
        }
        return points;
    }

    private List<CostPoint> pointsFor(List<QueryResult> results, String clusterId) {
        return List.copyOf(totalsByCluster(results, clusterId).getOrDefault(clusterId, List.of()));
    }

    /**
     * Every value of the first series.
     *
     * @throws InsufficientDataException
     *             if there is no series
     */
    private List<CostPoint> seriesPoints(List<QueryResult> results) {
        if (results.isEmpty()) {
            throw new InsufficientDataException(NOT_ENOUGH_DATA);
        }
        return results.get(0).getValues().stream()
                .map(CostPoint::of)
                .toList();
    }

    private void mergeTotals(Map<String, ClusterTotals> target, Map<String, List<CostPoint>> points,
            BiFunction<ClusterTotals, List<CostPoint>, ClusterTotals> setter) {
        for (Map.Entry<String, List<CostPoint>> entry : points.entrySet()) {
            ClusterTotals current = target.getOrDefault(entry.getKey(), ClusterTotals.empty());
            target.put(entry.getKey(), setter.apply(current, List.copyOf(entry.getValue())));
        }
    }
}
