package com.campaignkeeper.memory;

import com.campaignkeeper.model.Turn;
import com.campaignkeeper.model.TurnRole;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Detects natural breaks in a history buffer.
 *
 * <p>A break is an explicit encounter-end marker in the latest exchange, or an idle stretch: the last
 * {@code idleTurnThreshold} uncompressed turns contain no NPC turn and mention no proper name
 * that was not already known from earlier turns or the seeded world state.</p>
 */
public class BreakDetector {

    private final int idleTurnThreshold;
    private final List<String> markers;

    public BreakDetector(int idleTurnThreshold, List<String> markers) {
        this.idleTurnThreshold = idleTurnThreshold;
        this.markers = markers.stream().map(m -> m.toLowerCase(Locale.ROOT)).toList();
    }

    public Optional<BreakReason> detect(HistoryBuffer buffer, Set<String> knownNames) {
        Optional<Turn> last = buffer.lastTurn();
        if (last.isEmpty()) {
            return Optional.empty();
        }
        if (latestExchange(buffer).stream().anyMatch(this::hasEncounterEndMarker)) {
            return Optional.of(BreakReason.ENCOUNTER_END);
        }
        if (buffer.turnCount() - buffer.compactedCount() < idleTurnThreshold) {
            return Optional.empty();
        }
        List<Turn> all = buffer.snapshot();
        int windowStart = all.size() - idleTurnThreshold;
        List<Turn> window = all.subList(windowStart, all.size());
        if (window.stream().anyMatch(turn -> turn.role() == TurnRole.NPC)) {
            return Optional.empty();
        }
        Set<String> seen = new HashSet<>();
        knownNames.forEach(name -> seen.add(name.toLowerCase(Locale.ROOT)));
        for (Turn turn : all.subList(0, windowStart)) {
            seen.addAll(ProperNames.extract(turn.content()));
        }
        for (Turn turn : window) {
            if (!seen.containsAll(ProperNames.extract(turn.content()))) {
                return Optional.empty();
            }
        }
        return Optional.of(BreakReason.IDLE);
    }

    // the latest turn, plus the player prompt it answers
    private static List<Turn> latestExchange(HistoryBuffer buffer) {
        List<Turn> active = buffer.activeTurns();
        int size = active.size();
        if (size >= 2 && active.get(size - 1).role() != TurnRole.PLAYER
            && active.get(size - 2).role() == TurnRole.PLAYER) {
            return active.subList(size - 2, size);
        }
        return size == 0 ? List.of() : active.subList(size - 1, size);
    }

    public boolean hasEncounterEndMarker(Turn turn) {
        String content = turn.content().toLowerCase(Locale.ROOT);
        return markers.stream().anyMatch(content::contains);
    }
}
