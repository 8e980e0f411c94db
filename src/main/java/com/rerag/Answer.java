package com.rerag;

import java.util.List;

import com.rerag.store.Document;

public record Answer(String text, List<Document> sources, boolean partial) {
}
