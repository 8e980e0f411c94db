package com.rerag.authz;

import java.util.ArrayList;
import java.util.List;

import com.rerag.store.Document;

public interface AuthorizationService {

    boolean isAuthorized(String caller, Document document);

    List<String> permissionsOf(String caller);

    default List<Boolean> authorizeAll(String caller, List<Document> documents) {
        List<Boolean> decisions = new ArrayList<>(documents.size());
        for (Document document : documents) {
            decisions.add(isAuthorized(caller, document));
        }
        return decisions;
    }
}
