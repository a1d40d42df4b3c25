package com.duckide.practice.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One result row. Values are positional; the column names travel along for display.
 */
public record Row(List<String> columns, List<Value> values) {
    public Row {
        if (columns.size() != values.size()) {
            throw new IllegalArgumentException("Row has " + values.size() + " values for " + columns.size() + " columns");
        }
        columns = List.copyOf(columns);
        values = List.copyOf(values);
    }

    public int arity() {
        return values.size();
    }

    public Value valueAt(int position) {
        return values.get(position);
    }

    public Map<String, Value> asMap() {
        Map<String, Value> map = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            map.putIfAbsent(columns.get(i), values.get(i));
        }
        return Collections.unmodifiableMap(map);
    }
}
