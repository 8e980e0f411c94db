package com.rerag.search;

import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

import com.rerag.authz.AuthorizationService;
import com.rerag.store.Document;

@FunctionalInterface
public interface AuthorizationPredicate extends Predicate<Document> {

    boolean isAuthorized(Document document);

    @Override
    default boolean test(Document document) {
        return isAuthorized(document);
    }

    static AuthorizationPredicate allowAll() {
        return document -> true;
    }

    static AuthorizationPredicate denyAll() {
        return document -> false;
    }

    static AuthorizationPredicate forCaller(AuthorizationService service, String caller) {
        Objects.requireNonNull(service, "service");
        if (caller == null || caller.isBlank()) {
            throw new IllegalArgumentException("Caller identity must not be blank");
        }
        return new BatchAuthorizationPredicate() {
            @Override
            public boolean isAuthorized(Document document) {
                return service.isAuthorized(caller, document);
            }

            @Override
            public List<Boolean> authorizeAll(List<Document> documents) {
                return service.authorizeAll(caller, documents);
            }
        };
    }
}
