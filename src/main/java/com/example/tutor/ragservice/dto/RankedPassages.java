package com.example.tutor.ragservice.dto;

import java.util.List;

/**
 * Passages for one question. {@code degraded} is set when part of the store could not
 * be searched, so an empty list can be told apart from "nothing matched".
 */
public record RankedPassages(String question, List<String> queries, List<Passage> passages,
                             boolean degraded, String note) {
}
