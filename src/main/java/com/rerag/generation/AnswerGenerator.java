package com.rerag.generation;

import java.util.List;

import com.rerag.store.Document;

public interface AnswerGenerator {

    String generate(String question, List<Document> documents);
}
