package me.golemcore.costmodel.domain.model;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class QueryResultTest {

    @Test
    void missingOrBlankClusterIdFallsBackToDefault() {
        assertEquals("default", new QueryResult(Map.of(), List.of()).clusterIdOr("default"));
        assertEquals("default", new QueryResult(Map.of("cluster_id", ""), List.of()).clusterIdOr("default"));
        assertEquals("prod", new QueryResult(Map.of("cluster_id", "prod"), List.of()).clusterIdOr("default"));
    }

    @Test
    void seriesWithoutValuesHasNoFirstValue() {
        assertEquals(Optional.empty(), new QueryResult(null, null).firstValue());
        assertTrue(new QueryResult(null, null).getLabels().isEmpty());
    }

    @Test
    void copiesInputCollections() {
        Map<String, String> labels = new HashMap<>(Map.of("mode", "idle"));
        QueryResult result = new QueryResult(labels, List.of(new QueryValue(1, 2)));

        labels.put("mode", "user");

        assertEquals(Optional.of("idle"), result.label("mode"));
        assertEquals(new QueryValue(1, 2), result.firstValue().orElseThrow());
    }
}
