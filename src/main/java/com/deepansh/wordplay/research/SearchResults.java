package com.deepansh.wordplay.research;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Outcome of a web search. {@code error} is set when the live provider failed and the
 * results are the simulated fallback.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SearchResults(List<SearchResult> results, String summary, String error) {

    public SearchResults {
        results = results != null ? List.copyOf(results) : List.of();
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }

    public SearchResults withError(String message) {
        return new SearchResults(results, summary, message);
    }
}
