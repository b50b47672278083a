package org.akkordio.fingering.heuristic;

import lombok.experimental.UtilityClass;
import org.akkordio.fingering.cost.HandCostModel;

import java.util.Objects;

/**
 * Creates heuristic providers for one cost model.
 */
@UtilityClass
public final class HeuristicFactory {

    /**
     * Creates a provider of the requested type.
     *
     * @param type requested heuristic type.
     * @param costModel cost model whose weights the bound must respect.
     * @return initialized heuristic provider.
     */
    public static HeuristicProvider create(HeuristicType type, HandCostModel costModel) {
        if (type == null) {
            throw new IllegalArgumentException("heuristic type must be explicitly specified (NONE, BOUNDING_BOX)");
        }
        Objects.requireNonNull(costModel, "costModel");
        return switch (type) {
            case NONE -> new NullHeuristicProvider();
            case BOUNDING_BOX -> new BoundingBoxHeuristicProvider(costModel);
        };
    }
}
