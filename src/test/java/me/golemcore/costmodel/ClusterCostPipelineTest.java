package me.golemcore.costmodel;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.costmodel.adapter.outbound.prometheus.PrometheusHttpAdapter;
import me.golemcore.costmodel.adapter.outbound.provider.ConfiguredCloudProviderAdapter;
import me.golemcore.costmodel.domain.exception.QueryException;
import me.golemcore.costmodel.domain.model.ClusterCosts;
import me.golemcore.costmodel.domain.model.ClusterCostsBreakdown;
import me.golemcore.costmodel.domain.service.ClusterCostAggregator;
import me.golemcore.costmodel.domain.service.ClusterCostQueries;
import me.golemcore.costmodel.domain.service.ClusterCostService;
import me.golemcore.costmodel.domain.service.DiscountResolver;
import me.golemcore.costmodel.domain.service.QueryBatchExecutor;
import me.golemcore.costmodel.domain.service.QueryExecutor;
import me.golemcore.costmodel.domain.service.QueryResultParser;
import me.golemcore.costmodel.domain.service.TimeRangeParser;
import me.golemcore.costmodel.infrastructure.config.AutoConfiguration;
import me.golemcore.costmodel.infrastructure.config.CostModelProperties;
import me.golemcore.costmodel.testsupport.http.OkHttpMockEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.ExecutorService;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the cumulative cost computation through the real HTTP adapter, parser,
 * concurrent batch executor and aggregator against canned Prometheus replies.
 */
class ClusterCostPipelineTest {

    private static final Instant NOW = Instant.parse("2024-06-15T12:00:00Z");

    private OkHttpMockEngine engine;
    private ExecutorService queryPool;
    private ClusterCostService service;

    @BeforeEach
    void setUp() {
        CostModelProperties properties = new CostModelProperties();
        properties.getPrometheus().setUrl("http://prometheus.test:9090");
        properties.getCluster().setDefaultId("cluster-a");
        properties.getPricing().setDiscount("10%");
        properties.getPricing().setNegotiatedDiscount("0%");
        properties.getQuery().setMaxConcurrency(4);

        ObjectMapper objectMapper = AutoConfiguration.objectMapper();
        engine = new OkHttpMockEngine();
        queryPool = new AutoConfiguration(properties).prometheusQueryExecutor();

        PrometheusHttpAdapter transport = new PrometheusHttpAdapter(properties,
                OkHttpMockEngine.clientWith(engine), objectMapper);
        ConfiguredCloudProviderAdapter provider = new ConfiguredCloudProviderAdapter(properties);
        QueryExecutor queryExecutor = new QueryExecutor(transport, new QueryResultParser(objectMapper));

        service = new ClusterCostService(
                new QueryBatchExecutor(queryExecutor, queryPool),
                new ClusterCostQueries(provider),
                new ClusterCostAggregator(),
                new DiscountResolver(provider),
                new TimeRangeParser(Clock.fixed(NOW, ZoneOffset.UTC)),
                properties);

        engine.routeJson("count_over_time", 200, vector("{}", "60"));
        engine.routeJson("node_gpu_hourly_cost", 200, emptyVector());
        engine.routeJson("node_cpu_hourly_cost", 200, vector("{}", "10"));
        engine.routeJson("node_ram_hourly_cost", 200, vector("{}", "20"));
        engine.routeJson("pv_hourly_cost", 200, vector("{}", "5"));
        engine.routeJson("node_cpu_seconds_total", 200, """
                {"status":"success","data":{"resultType":"vector","result":[
                  {"metric":{"mode":"idle"},"value":[1718452800,"0.6"]},
                  {"metric":{"mode":"system"},"value":[1718452800,"0.1"]},
                  {"metric":{"mode":"user"},"value":[1718452800,"0.25"]},
                  {"metric":{"mode":"steal"},"value":[1718452800,"0.05"]}
                ]}}
                """);
        engine.routeJson("kube-system", 200, vector("{}", "0.2"));
        engine.routeJson("kubecost_cluster_memory_working_set_bytes", 200, vector("{}", "0.5"));
    }

    @AfterEach
    void tearDown() {
        queryPool.shutdownNow();
    }

    private static String vector(String metric, String value) {
        return "{\"status\":\"success\",\"data\":{\"resultType\":\"vector\",\"result\":["
                + "{\"metric\":" + metric + ",\"value\":[1718452800,\"" + value + "\"]}]}}";
    }

    private static String emptyVector() {
        return "{\"status\":\"success\",\"data\":{\"resultType\":\"vector\",\"result\":[]}}";
    }

    @Test
    void computesDiscountedMonthlyCostsForDefaultCluster() {
        Map<String, ClusterCosts> costs = service.computeClusterCosts("1h", "");

        assertEquals(8, engine.getRequestCount());
        ClusterCosts cluster = costs.get("cluster-a");
        assertNotNull(cluster);
        assertEquals(9.0, cluster.getCpuCumulative(), 1e-9);
        assertEquals(0.0, cluster.getGpuCumulative());
        assertEquals(18.0, cluster.getRamCumulative(), 1e-9);
        assertEquals(5.0, cluster.getStorageCumulative(), 1e-9);
        assertEquals(32.0, cluster.getTotalCumulative(), 1e-9);
        assertEquals(9.0 * 730, cluster.getCpuMonthly(), 1e-6);
        assertEquals(0.0, cluster.getGpuMonthly());
        assertEquals(18.0 * 730, cluster.getRamMonthly(), 1e-6);
        assertEquals(5.0 * 730, cluster.getStorageMonthly(), 1e-6);
        assertEquals(32.0 * 730, cluster.getTotalMonthly(), 1e-6);

        assertEquals(new ClusterCostsBreakdown(0.6, 0.05, 0.1, 0.25), cluster.getCpuBreakdown());
        assertEquals(0.2, cluster.getRamBreakdown().getSystem(), 1e-12);
        assertEquals(0.0, cluster.getRamBreakdown().getOther());
    }

    @Test
    void survivesUnreachableGpuMetrics() {
        engine.routeFailure("node_gpu_hourly_cost", new IOException("Connection reset"));

        ClusterCosts cluster = service.computeClusterCosts("1h", "").get("cluster-a");

        assertEquals(32.0, cluster.getTotalCumulative(), 1e-9);
    }

    @Test
    void failsWhenPrometheusRejectsCpuQuery() {
        engine.routeJson("node_cpu_hourly_cost", 422,
                "{\"status\":\"error\",\"errorType\":\"execution\",\"error\":\"many-to-many matching not allowed\"}");

        QueryException ex = assertThrows(QueryException.class, () -> service.computeClusterCosts("1h", ""));

        assertEquals(ClusterCostQueries.TOTAL_CPU, ex.getQueryName());
        assertTrue(ex.getMessage().contains("many-to-many matching not allowed"));
        assertEquals(8, engine.getRequestCount());
    }

    @Test
    void attributesLabeledSeriesToTheirClusters() {
        engine.routeJson("node_cpu_hourly_cost", 200, """
                {"status":"success","data":{"resultType":"vector","result":[
                  {"metric":{"cluster_id":"east"},"value":[1718452800,"4"]},
                  {"metric":{"cluster_id":"west"},"value":[1718452800,"6"]}
                ]}}
                """);

        Map<String, ClusterCosts> costs = service.computeClusterCosts("1h", "");

        assertEquals(3.6, costs.get("east").getCpuCumulative(), 1e-9);
        assertEquals(5.4, costs.get("west").getCpuCumulative(), 1e-9);
        assertEquals(0.0, costs.get("cluster-a").getCpuCumulative());
        assertEquals(18.0, costs.get("cluster-a").getRamCumulative(), 1e-9);
    }
}
