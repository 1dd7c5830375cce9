package com.dripline.backend.services.webhook;

import com.dripline.backend.enums.Channel;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public record ReconcileReport(Channel channel, List<ReconcileOutcome> outcomes) {

    public ReconcileReport {
        outcomes = List.copyOf(outcomes);
    }

    public long count(ReconcileOutcome outcome) {
        return outcomes.stream().filter(o -> o == outcome).count();
    }

    public Map<ReconcileOutcome, Long> counts() {
        Map<ReconcileOutcome, Long> counts = new EnumMap<>(ReconcileOutcome.class);
        for (ReconcileOutcome outcome : ReconcileOutcome.values()) {
            counts.put(outcome, count(outcome));
        }
        return counts;
    }

    /**
     * True when the payload had events and every one named a message we do not know (yet).
     */
    public boolean allUnknown() {
        return !outcomes.isEmpty() && count(ReconcileOutcome.UNKNOWN_MESSAGE) == outcomes.size();
    }
}
