package com.statgrid.service.core.statistic;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.statgrid.service.core.support.Sha256;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Collapses a fact row's resolved identity into a fixed-width key.
 *
 * <p>The canonical form is the compact JSON array {@code [matrixId, territoryId, timePeriodId,
 * unitId, [classificationValueIds...]]} with absent ids as JSON null and classification ids sorted
 * ascending, hashed with SHA-256.
 */
@Component
public class NaturalKeyHasher {

    private static final ObjectMapper CANONICAL_JSON = new ObjectMapper();

    public String hash(StatisticRow row) {
        return hash(
                row.matrixId(), row.territoryId(), row.timePeriodId(), row.unitId(), row.classificationValueIds());
    }

    public String hash(
            long matrixId, Long territoryId, Long timePeriodId, Long unitId, List<Long> classificationValueIds) {
        return Sha256.hex(canonical(matrixId, territoryId, timePeriodId, unitId, classificationValueIds));
    }

    String canonical(
            long matrixId, Long territoryId, Long timePeriodId, Long unitId, List<Long> classificationValueIds) {
        ArrayNode node = JsonNodeFactory.instance.arrayNode();
        node.add(matrixId);
        node.add(territoryId);
        node.add(timePeriodId);
        node.add(unitId);
        ArrayNode classes = node.addArray();
        classificationValueIds.stream().sorted().forEach(classes::add);
        try {
            return CANONICAL_JSON.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to canonically encode natural key", e);
        }
    }
}
