package com.portfolioengine.sizing;

import com.portfolioengine.domain.enums.PositionSizingType;
import com.portfolioengine.exception.EngineConfigurationException;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Resolves a {@link PositionSizer} by {@link PositionSizingType}.
 *
 * <p>Spring discovers every PositionSizer bean and this factory indexes them by type at
 * construction time.
 */
@Component
public class PositionSizerFactory {

    private final Map<PositionSizingType, PositionSizer> sizersByType;

    public PositionSizerFactory(List<PositionSizer> positionSizers) {
        this.sizersByType =
                positionSizers.stream().collect(Collectors.toMap(PositionSizer::getType, Function.identity()));
    }

    /**
     * @throws EngineConfigurationException if no sizer is registered for the type
     */
    public PositionSizer getSizer(PositionSizingType positionSizingType) {
        PositionSizer positionSizer = sizersByType.get(positionSizingType);
        if (positionSizer == null) {
            throw new EngineConfigurationException("No position sizer found for type: " + positionSizingType);
        }
        return positionSizer;
    }
}
