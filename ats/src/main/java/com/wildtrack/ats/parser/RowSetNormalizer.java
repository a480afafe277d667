package com.wildtrack.ats.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Turns the {@code NewDataSet} content of a vendor response into an ordered list of rows.
 *
 * <p>The XML tree exposes repeated {@code Table} elements as an array, which is the only
 * shape read as rows.  Anything else (no rows, a lone {@code Table} that the tree shows as a
 * plain object, a text node where rows should be, or an entry that is not a container)
 * normalizes to an empty list instead of an error.</p>
 */
@Slf4j
final class RowSetNormalizer {

    static final String ROW_ELEMENT = "Table";

    private RowSetNormalizer() {
        // utility class
    }

    static List<ObjectNode> normalize(JsonNode newDataSet) {
        if (newDataSet == null || !newDataSet.isObject()) {
            return Collections.emptyList();
        }

        JsonNode table = newDataSet.get(ROW_ELEMENT);
        if (table == null || table.isNull()) {
            return Collections.emptyList();
        }
        if (table.isObject()) {
            log.warn("Row-set holds a single '{}' object instead of a list, treating it as empty", ROW_ELEMENT);
            return Collections.emptyList();
        }
        if (!table.isArray()) {
            log.warn("Row-set holds a non-container '{}' entry, treating it as empty", ROW_ELEMENT);
            return Collections.emptyList();
        }

        List<ObjectNode> rows = new ArrayList<>(table.size());
        for (JsonNode row : table) {
            if (!row.isObject()) {
                log.warn("Row-set holds a non-container '{}' entry, treating it as empty", ROW_ELEMENT);
                return Collections.emptyList();
            }
            rows.add((ObjectNode) row);
        }
        return rows;
    }
}
