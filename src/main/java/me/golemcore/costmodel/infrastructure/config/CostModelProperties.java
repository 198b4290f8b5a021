package me.golemcore.costmodel.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Centralized configuration properties for the cost model, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code costmodel.*} prefix:
 * <ul>
 * <li>{@link PrometheusProperties} - metrics backend location and
 * credentials</li>
 * <li>{@link HttpProperties} - OkHttp timeouts and connection pool</li>
 * <li>{@link ClusterProperties} - cluster attribution defaults</li>
 * <li>{@link PricingProperties} - discounts and provider storage pricing</li>
 * <li>{@link QueryProperties} - concurrent query batch sizing</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "costmodel")
@Data
public class CostModelProperties {

    private PrometheusProperties prometheus = new PrometheusProperties();
    private HttpProperties http = new HttpProperties();
    private ClusterProperties cluster = new ClusterProperties();
    private PricingProperties pricing = new PricingProperties();
    private QueryProperties query = new QueryProperties();

    @Data
    public static class PrometheusProperties {
        private String url = "http://localhost:9090";
        private String bearerToken;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 120000;
        private long writeTimeout = 60000;
        private long keepAliveDuration = 300000;
    }

    @Data
    public static class ClusterProperties {
        /** Cluster id for series without a cluster_id label. */
        private String defaultId = "cluster-one";
    }

    @Data
    public static class PricingProperties {
        private String discount = "0%";
        private String negotiatedDiscount = "0%";
        private String localStorageQuery = "";
    }

    @Data
    public static class QueryProperties {
        private int maxConcurrency = 8;
    }
}
