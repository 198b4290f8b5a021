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

import me.golemcore.costmodel.port.outbound.CloudProviderPort;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * PromQL for the cluster cost computations.
 *
 * <p>
 * Cumulative queries sample each metric once a minute over the window
 * ({@code [window:1m]}) and divide hourly prices by 60, so their values are
 * costs accrued over the observed minutes. Average queries multiply hourly
 * prices by 730 and yield monthly rates.
 */
@Component
@RequiredArgsConstructor
public class ClusterCostQueries {

    public static final String DATA_COUNT = "dataCount";
    public static final String TOTAL_GPU = "totalGPU";
    public static final String TOTAL_CPU = "totalCPU";
    public static final String TOTAL_RAM = "totalRAM";
    public static final String TOTAL_STORAGE = "totalStorage";
    public static final String CPU_MODE_PCT = "cpuModePct";
    public static final String RAM_SYSTEM_PCT = "ramSystemPct";
    public static final String RAM_OTHER_PCT = "ramOtherPct";

    public static final String CLUSTER_CORES = "clusterCores";
    public static final String CLUSTER_RAM = "clusterRAM";
    public static final String CLUSTER_STORAGE = "clusterStorage";
    public static final String CLUSTER_TOTAL = "clusterTotal";

    private static final String FMT_DATA_COUNT = "max(sum(count_over_time(kube_node_status_capacity_cpu_cores[%s:1m]%s)) by (node, cluster_id))";

    private static final String FMT_TOTAL_GPU = """
            sum(
            	sum_over_time(node_gpu_hourly_cost[%s:1m]%s) / 60
            ) by (cluster_id)""";

    private static final String FMT_TOTAL_CPU = """
            sum(
            	sum(sum_over_time(kube_node_status_capacity_cpu_cores[%s:1m]%s)) by (node, cluster_id) *
            	avg(avg_over_time(node_cpu_hourly_cost[%s:1m]%s)) by (node, cluster_id) / 60
            ) by (cluster_id)""";

    private static final String FMT_TOTAL_RAM = """
            sum(
            	sum(sum_over_time(kube_node_status_capacity_memory_bytes[%s:1m]%s) / 1024 / 1024 / 1024) by (node, cluster_id) *
            	avg(avg_over_time(node_ram_hourly_cost[%s:1m]%s)) by (node, cluster_id) / 60
            ) by (cluster_id)""";

    private static final String FMT_TOTAL_STORAGE = """
            sum(
            	sum(sum_over_time(kube_persistentvolume_capacity_bytes[%s:1m]%s)) by (persistentvolume, cluster_id) / 1024 / 1024 / 1024 *
            	avg(avg_over_time(pv_hourly_cost[%s:1m]%s)) by (persistentvolume, cluster_id) / 60
            ) by (cluster_id) %s""";

    // TODO: group the three percentage queries by cluster_id once node exporters carry the label
    private static final String FMT_CPU_MODE_PCT = "sum(rate(node_cpu_seconds_total[%s])) by (mode) / scalar(sum(rate(node_cpu_seconds_total[%s])))";

    private static final String FMT_RAM_SYSTEM_PCT = """
            sum(avg_over_time(container_memory_usage_bytes{container_name!="",namespace="kube-system"}[%s]))
            / sum(avg(kube_node_status_capacity_memory_bytes) by (node))""";

    private static final String FMT_RAM_OTHER_PCT = """
            avg_over_time(kubecost_cluster_memory_working_set_bytes[%s])
            / sum(kube_node_status_capacity_memory_bytes)""";

    private static final String FMT_CLUSTER_CORES = """
            sum(
            	avg(avg_over_time(kube_node_status_capacity_cpu_cores[%s] %s)) by (node, cluster_id) * avg(avg_over_time(node_cpu_hourly_cost[%s] %s)) by (node, cluster_id) * 730 +
            	avg(avg_over_time(node_gpu_hourly_cost[%s] %s)) by (node, cluster_id) * 730
            ) by (cluster_id)""";

    private static final String FMT_CLUSTER_RAM = """
            sum(
            	avg(avg_over_time(kube_node_status_capacity_memory_bytes[%s] %s)) by (node, cluster_id) / 1024 / 1024 / 1024 * avg(avg_over_time(node_ram_hourly_cost[%s] %s)) by (node, cluster_id) * 730
            ) by (cluster_id)""";

    private static final String FMT_CLUSTER_STORAGE = """
            sum(
            	avg(avg_over_time(pv_hourly_cost[%s] %s)) by (persistentvolume, cluster_id) * 730
            	* avg(avg_over_time(kube_persistentvolume_capacity_bytes[%s] %s)) by (persistentvolume, cluster_id) / 1024 / 1024 / 1024
            ) by (cluster_id) %s""";

    private static final String FMT_CLUSTER_TOTAL = """
            sum(avg(node_total_hourly_cost) by (node, cluster_id)) * 730 +
            sum(
            	avg(avg_over_time(pv_hourly_cost[1h])) by (persistentvolume, cluster_id) * 730
            	* avg(avg_over_time(kube_persistentvolume_capacity_bytes[1h])) by (persistentvolume, cluster_id) / 1024 / 1024 / 1024
            ) by (cluster_id) %s""";

    private final CloudProviderPort cloudProvider;

    /**
     * The eight queries behind the cumulative cluster cost computation, in
     * submission order.
     */
    public List<QueryRequest> cumulativeCostQueries(String window, String offset) {
        String fmtOffset = formatOffset(offset);
        String localStorage = localStorageTerm(window, offset, false);

        return List.of(
                QueryRequest.instant(DATA_COUNT, String.format(FMT_DATA_COUNT, window, fmtOffset)),
                QueryRequest.instant(TOTAL_GPU, String.format(FMT_TOTAL_GPU, window, fmtOffset)),
                QueryRequest.instant(TOTAL_CPU, String.format(FMT_TOTAL_CPU, window, fmtOffset, window, fmtOffset)),
                QueryRequest.instant(TOTAL_RAM, String.format(FMT_TOTAL_RAM, window, fmtOffset, window, fmtOffset)),
                QueryRequest.instant(TOTAL_STORAGE,
                        String.format(FMT_TOTAL_STORAGE, window, fmtOffset, window, fmtOffset, localStorage)),
                QueryRequest.instant(CPU_MODE_PCT, String.format(FMT_CPU_MODE_PCT, window, window)),
                QueryRequest.instant(RAM_SYSTEM_PCT, String.format(FMT_RAM_SYSTEM_PCT, window)),
                QueryRequest.instant(RAM_OTHER_PCT, String.format(FMT_RAM_OTHER_PCT, window)));
    }

    public String clusterCores(String window, String offset) {
        String fmtOffset = formatOffset(offset);
        return String.format(FMT_CLUSTER_CORES, window, fmtOffset, window, fmtOffset, window, fmtOffset);
    }

    public String clusterRam(String window, String offset) {
        String fmtOffset = formatOffset(offset);
        return String.format(FMT_CLUSTER_RAM, window, fmtOffset, window, fmtOffset);
    }

    public String clusterStorage(String window, String offset) {
        String fmtOffset = formatOffset(offset);
        return String.format(FMT_CLUSTER_STORAGE, window, fmtOffset, window, fmtOffset,
                localStorageTerm(window, offset, true));
    }

    public String clusterTotal(String window, String offset) {
        return String.format(FMT_CLUSTER_TOTAL, localStorageTerm(window, offset, true));
    }

    /**
     * Turns {@code 3h} into {@code offset 3h}; blank stays blank.
     */
    static String formatOffset(String offset) {
        if (offset == null || offset.isBlank()) {
            return "";
        }
        String trimmed = offset.trim();
        return trimmed.startsWith("offset ") ? trimmed : "offset " + trimmed;
    }

    private String localStorageTerm(String window, String offset, boolean rate) {
        String query = cloudProvider.getLocalStorageQuery(window, offset, rate);
        if (query == null || query.isBlank()) {
            return "";
        }
        return "+ " + query;
    }
}
