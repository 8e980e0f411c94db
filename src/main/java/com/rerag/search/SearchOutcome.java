package com.rerag.search;

import java.util.List;

import com.rerag.store.Candidate;
import com.rerag.store.Document;

public record SearchOutcome(
        List<Candidate> candidates,
        int requested,
        int indexQueries,
        int candidatesExamined,
        SearchTermination termination) {

    public SearchOutcome {
        candidates = List.copyOf(candidates);
    }

    static SearchOutcome empty(int requested) {
        return new SearchOutcome(List.of(), requested, 0, 0, SearchTermination.EMPTY_REQUEST);
    }

    public List<Document> documents() {
        return candidates.stream()
                .map(Candidate::document)
                .toList();
    }

    public int size() {
        return candidates.size();
    }

    public boolean isPartial() {
        return requested > 0 && candidates.size() < requested;
    }
}
