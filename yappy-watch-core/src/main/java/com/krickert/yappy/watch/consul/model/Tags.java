package com.krickert.yappy.watch.consul.model;

import java.util.List;

final class Tags {

    private Tags() {
    }

    static List<String> sortedCopy(List<String> tags) {
        if (tags == null || tags.isEmpty()) {
            return List.of();
        }
        return tags.stream().sorted().toList();
    }
}
