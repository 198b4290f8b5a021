package me.golemcore.costmodel.infrastructure.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class CostModelPropertiesTest {

    @Test
    void shouldProvideDefaults() {
        CostModelProperties properties = new CostModelProperties();

        assertEquals("http://localhost:9090", properties.getPrometheus().getUrl());
        assertNull(properties.getPrometheus().getBearerToken());
        assertEquals("cluster-one", properties.getCluster().getDefaultId());
        assertEquals("0%", properties.getPricing().getDiscount());
        assertEquals("0%", properties.getPricing().getNegotiatedDiscount());
        assertEquals("", properties.getPricing().getLocalStorageQuery());
        assertEquals(8, properties.getQuery().getMaxConcurrency());
        assertEquals(120000, properties.getHttp().getReadTimeout());
    }
}
