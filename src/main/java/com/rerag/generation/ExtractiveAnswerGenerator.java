package com.rerag.generation;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import com.rerag.store.Document;

public class ExtractiveAnswerGenerator implements AnswerGenerator {
    static final String NO_SOURCES = "No authorized documents matched the question.";

    @Override
    public String generate(String question, List<Document> documents) {
        if (documents.isEmpty()) {
            return NO_SOURCES;
        }
        Set<String> keywords = keywords(question);
        return documents.stream()
                .map(document -> "[" + document.title() + "] " + firstMatchingSentence(document.content(), keywords))
                .collect(Collectors.joining("\n"));
    }

    private static Set<String> keywords(String input) {
        if (input == null) {
            return Set.of();
        }
        return Arrays.stream(input.toLowerCase(Locale.ROOT).split("[^a-z0-9]+"))
                .filter(token -> token.length() > 2)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static String firstMatchingSentence(String text, Set<String> keywords) {
        if (text == null || text.isBlank()) {
            return "(empty document)";
        }
        String[] sentences = text.split("(?<=[.!?])\\s+");
        for (String sentence : sentences) {
            String lower = sentence.toLowerCase(Locale.ROOT);
            if (keywords.stream().anyMatch(lower::contains)) {
                return sentence.trim();
            }
        }
        return sentences[0].trim();
    }
}
