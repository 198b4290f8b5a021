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
import me.golemcore.costmodel.domain.exception.InvalidRangeException;

import java.time.Instant;

/**
 * Cumulative and monthly-rate costs of one cluster over a window, broken down
 * by CPU, GPU, RAM and storage.
 *
 * <p>
 * Monthly figures normalize the cumulative cost to a {@value #HOURS_PER_MONTH}
 * hour month: {@code monthly = cumulative / dataHours * 730}. Totals are the
 * sums of the four resource figures.
 *
 * @since 1.0
 */
@Value
@Builder(toBuilder = true)
public class ClusterCosts {

    public static final double HOURS_PER_MONTH = 730.0;

    Instant start;
    Instant end;

    double cpuCumulative;
    double cpuMonthly;
    ClusterCostsBreakdown cpuBreakdown;

    double gpuCumulative;
    double gpuMonthly;

    double ramCumulative;
    double ramMonthly;
    ClusterCostsBreakdown ramBreakdown;

    double storageCumulative;
    double storageMonthly;
    // Never populated yet; kept so consumers see the same shape for every resource
    ClusterCostsBreakdown storageBreakdown;

    double totalCumulative;
    double totalMonthly;

    /**
     * Builds costs from cumulative figures and computes the monthly rates.
     *
     * @param dataHours
     *            hours of observed data backing the cumulative figures
     * @throws InvalidRangeException
     *             if {@code dataHours} is zero, negative or NaN
     */
    public static ClusterCosts fromCumulative(double cpu, double gpu, double ram, double storage,
            TimeWindow window, double dataHours) {
        if (!(dataHours > 0)) {
            throw new InvalidRangeException(String.format("illegal time range: %s to %s has %s hours of data",
                    window.start(), window.end(), dataHours));
        }
        double hours = dataHours;

        double cpuMonthly = cpu / hours * HOURS_PER_MONTH;
        double gpuMonthly = gpu / hours * HOURS_PER_MONTH;
        double ramMonthly = ram / hours * HOURS_PER_MONTH;
        double storageMonthly = storage / hours * HOURS_PER_MONTH;

        return ClusterCosts.builder()
                .start(window.start())
                .end(window.end())
                .cpuCumulative(cpu)
                .gpuCumulative(gpu)
                .ramCumulative(ram)
                .storageCumulative(storage)
                .totalCumulative(cpu + gpu + ram + storage)
                .cpuMonthly(cpuMonthly)
                .gpuMonthly(gpuMonthly)
                .ramMonthly(ramMonthly)
                .storageMonthly(storageMonthly)
                .totalMonthly(cpuMonthly + gpuMonthly + ramMonthly + storageMonthly)
                .build();
    }
}
