package me.golemcore.costmodel.adapter.inbound.web.controller;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.costmodel.adapter.inbound.web.dto.TotalsResponse;
import me.golemcore.costmodel.domain.model.ClusterCosts;
import me.golemcore.costmodel.domain.model.ClusterTotals;
import me.golemcore.costmodel.domain.service.ClusterCostService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Cluster cost endpoints.
 *
 * <p>
 * Computations block on a query batch, so they run on the bounded elastic
 * scheduler rather than the event loop.
 */
@RestController
@RequestMapping("/api/cluster-costs")
@RequiredArgsConstructor
public class ClusterCostController {

    private final ClusterCostService clusterCostService;

    @GetMapping
    public Mono<ResponseEntity<Map<String, ClusterCosts>>> getClusterCosts(
            @RequestParam(defaultValue = "24h") String window,
            @RequestParam(defaultValue = "") String offset) {
        return Mono.fromCallable(() -> ResponseEntity.ok(clusterCostService.computeClusterCosts(window, offset)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/totals")
    public Mono<ResponseEntity<Map<String, TotalsResponse>>> getTotals(
            @RequestParam(defaultValue = "24h") String window,
            @RequestParam(defaultValue = "") String offset) {
        return Mono.fromCallable(() -> {
            Map<String, ClusterTotals> totals = clusterCostService.clusterTotalsForAllClusters(window, offset);
            Map<String, TotalsResponse> body = new LinkedHashMap<>();
            totals.forEach((clusterId, clusterTotals) -> body.put(clusterId, TotalsResponse.from(clusterTotals)));
            return ResponseEntity.ok(body);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/average")
    public Mono<ResponseEntity<TotalsResponse>> getAverageTotals(
            @RequestParam(defaultValue = "24h") String window,
            @RequestParam(defaultValue = "") String offset) {
        return Mono.fromCallable(() -> ResponseEntity.ok(
                TotalsResponse.from(clusterCostService.averageClusterTotals(window, offset))))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/over-time")
    public Mono<ResponseEntity<TotalsResponse>> getCostsOverTime(
            @RequestParam String start,
            @RequestParam String end,
            @RequestParam(defaultValue = "1d") String window,
            @RequestParam(defaultValue = "") String offset) {
        return Mono.fromCallable(() -> ResponseEntity.ok(
                TotalsResponse.from(clusterCostService.clusterCostsOverTime(start, end, window, offset))))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
