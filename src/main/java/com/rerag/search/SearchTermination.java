package com.rerag.search;

public enum SearchTermination {
    SATISFIED,
    EXHAUSTED,
    ATTEMPT_LIMIT,
    EMPTY_REQUEST
}
