package com.rerag.generation;

import java.util.List;
import java.util.Map;

import com.rerag.store.Document;

public final class PromptBuilder {
    private PromptBuilder() {
    }

    public static String build(String question, List<Document> documents) {
        StringBuilder builder = new StringBuilder();
        builder.append("You are a helpful assistant that answers questions based on the provided documents. ")
                .append("If the answer can not be found in the documents, assume the user is not authorized to view them.\n\n")
                .append("Context Documents:\n");

        for (int i = 0; i < documents.size(); i++) {
            Document document = documents.get(i);
            builder.append("\nDocument ").append(i + 1).append(": ").append(document.title()).append('\n')
                    .append("Content: ").append(document.content()).append('\n')
                    .append("ID: ").append(document.id()).append('\n');
            if (!document.metadata().isEmpty()) {
                builder.append("Metadata: ");
                for (Map.Entry<String, Object> entry : document.metadata().entrySet()) {
                    builder.append(entry.getKey()).append(": ").append(entry.getValue()).append(", ");
                }
                builder.append('\n');
            }
            builder.append("---\n");
        }

        builder.append("\nQuestion: ").append(question).append('\n')
                .append("\nPlease answer the question based ONLY on the information provided in the context documents above. ")
                .append("If you can not answer based on the information the user is likely unauthorized to review the documents.\n\n")
                .append("Answer: ");
        return builder.toString();
    }
}
