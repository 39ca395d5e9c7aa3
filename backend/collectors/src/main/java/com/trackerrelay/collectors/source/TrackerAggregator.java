package com.trackerrelay.collectors.source;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

public final class TrackerAggregator {
    private TrackerAggregator() {
    }

    public static Set<String> extract(String body) {
        if (body == null || body.isEmpty()) {
            return Set.of();
        }
        return body.lines()
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public static List<String> aggregate(Collection<String> bodies) {
        TreeSet<String> union = new TreeSet<>();
        for (String body : bodies) {
            union.addAll(extract(body));
        }
        return List.copyOf(union);
    }
}
