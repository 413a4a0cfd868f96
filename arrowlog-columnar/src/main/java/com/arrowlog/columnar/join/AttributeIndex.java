package com.arrowlog.columnar.join;

import com.arrowlog.logs.model.LogAttribute;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Attributes grouped by parent id, each list in attribute-table scan order. */
public final class AttributeIndex {

    private final Map<Long, List<LogAttribute>> byParent;
    private final JoinStats stats;

    AttributeIndex(Map<Long, List<LogAttribute>> byParent, JoinStats stats) {
        Map<Long, List<LogAttribute>> copy = new LinkedHashMap<>();
        byParent.forEach((parent, attrs) -> copy.put(parent, List.copyOf(attrs)));
        this.byParent = Collections.unmodifiableMap(copy);
        this.stats = stats;
    }

    public List<LogAttribute> attributesOf(long parentId) {
        return byParent.getOrDefault(parentId, List.of());
    }

    public Map<Long, List<LogAttribute>> byParent() {
        return byParent;
    }

    public JoinStats stats() {
        return stats;
    }
}
