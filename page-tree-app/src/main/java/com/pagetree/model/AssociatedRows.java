package com.pagetree.model;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Extra column values captured per page id by an ad-hoc query, kept for the
 * rest of the run so they can be carried into CSV output.
 * A later query returning the same id replaces the earlier values.
 */
public class AssociatedRows {

    private final Map<Integer, List<String>> valuesById = new HashMap<>();

    public void put(int id, List<String> values) {
        valuesById.put(id, List.copyOf(values));
    }

    public List<String> get(int id) {
        return valuesById.getOrDefault(id, List.of());
    }
}
