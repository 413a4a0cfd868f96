package com.arrowlog.columnar.join;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

public record JoinStats(int rowsScanned, int attributesIndexed, Map<DropReason, Integer> dropped) {

    public JoinStats {
        EnumMap<DropReason, Integer> copy = new EnumMap<>(DropReason.class);
        if (dropped != null) copy.putAll(dropped);
        dropped = Collections.unmodifiableMap(copy);
    }

    public int dropped(DropReason reason) {
        return dropped.getOrDefault(reason, 0);
    }

    public int totalDropped() {
        return dropped.values().stream().mapToInt(Integer::intValue).sum();
    }
}
