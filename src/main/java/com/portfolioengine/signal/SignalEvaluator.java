package com.portfolioengine.signal;

import com.portfolioengine.domain.enums.PositionSide;
import com.portfolioengine.domain.enums.Regime;
import com.portfolioengine.domain.model.InstrumentSnapshot;
import com.portfolioengine.domain.model.SignalResult;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Runs the signal table against a snapshot.
 *
 * <p>Entry is the OR of all enabled families (the first satisfied family in table order
 * supplies the tag); exit is evaluated independently for the side of the open position. When
 * flat, exit is evaluated for the candidate entry side (LONG when there is none), so a long
 * exit never suppresses a short entry. Families are ordered by {@link SignalFamilyType} so
 * evaluation does not depend on bean registration order.
 */
@Component
public class SignalEvaluator {

    private final List<SignalFamily> families;
    private final SignalConfig signalConfig;

    public SignalEvaluator(List<SignalFamily> families, SignalConfig signalConfig) {
        this.families = families.stream()
                .sorted(Comparator.comparing(SignalFamily::getType))
                .toList();
        this.signalConfig = signalConfig;
    }

    /**
     * @param positionSide side of the open position, or null when the instrument is flat
     */
    public SignalResult evaluate(Regime regime, InstrumentSnapshot snapshot, PositionSide positionSide) {
        if (snapshot == null) {
            return SignalResult.none();
        }

        PositionSide entrySide = null;
        String entryTag = null;
        Optional<String> longEntry = firstEntry(regime, snapshot, PositionSide.LONG);
        if (longEntry.isPresent()) {
            entrySide = PositionSide.LONG;
            entryTag = longEntry.get();
        } else if (signalConfig.isShortingEnabled()) {
            Optional<String> shortEntry = firstEntry(regime, snapshot, PositionSide.SHORT);
            if (shortEntry.isPresent()) {
                entrySide = PositionSide.SHORT;
                entryTag = shortEntry.get();
            }
        }

        PositionSide exitSide = positionSide != null
                ? positionSide
                : entrySide != null ? entrySide : PositionSide.LONG;
        Optional<String> exitTag = enabled().stream()
                .map(family -> family.exit(regime, snapshot, exitSide))
                .flatMap(Optional::stream)
                .findFirst();

        return new SignalResult(entrySide != null, entrySide, entryTag, exitTag.isPresent(), exitTag.orElse(null));
    }

    private Optional<String> firstEntry(Regime regime, InstrumentSnapshot snapshot, PositionSide side) {
        return enabled().stream()
                .map(family -> family.entry(regime, snapshot, side))
                .flatMap(Optional::stream)
                .findFirst();
    }

    private List<SignalFamily> enabled() {
        return families.stream()
                .filter(family -> signalConfig.getEnabledFamilies().contains(family.getType()))
                .toList();
    }
}
