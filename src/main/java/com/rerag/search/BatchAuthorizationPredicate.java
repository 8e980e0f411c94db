package com.rerag.search;

import java.util.ArrayList;
import java.util.List;

import com.rerag.store.Document;

public interface BatchAuthorizationPredicate extends AuthorizationPredicate {

    default List<Boolean> authorizeAll(List<Document> documents) {
        List<Boolean> decisions = new ArrayList<>(documents.size());
        for (Document document : documents) {
            decisions.add(isAuthorized(document));
        }
        return decisions;
    }
}
