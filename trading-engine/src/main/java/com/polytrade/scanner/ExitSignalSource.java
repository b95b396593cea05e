package com.polytrade.scanner;

import com.polytrade.ledger.Position;

import java.util.List;

/**
 * Source of position exits (market resolutions, take-profit rules, manual closes).
 */
@FunctionalInterface
public interface ExitSignalSource {

    ExitSignalSource NONE = openPositions -> List.of();

    List<ExitSignal> pendingExits(List<Position> openPositions);
}
