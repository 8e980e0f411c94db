package com.rerag.store;

public record Candidate(Document document, double distance) {
}
