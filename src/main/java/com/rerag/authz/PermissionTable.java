package com.rerag.authz;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import com.rerag.store.Document;

public class PermissionTable implements AuthorizationService {
    public static final String WILDCARD = "*";
    public static final String TAXPAYER_KEY = "taxpayer";

    private final Map<String, CopyOnWriteArrayList<String>> grants = new ConcurrentHashMap<>();

    public PermissionTable() {
    }

    public PermissionTable(Map<String, List<String>> initialGrants) {
        if (initialGrants != null) {
            initialGrants.forEach((caller, callerGrants) -> {
                if (callerGrants != null) {
                    callerGrants.forEach(grant -> grant(caller, grant));
                }
            });
        }
    }

    public void grant(String caller, String grant) {
        if (caller == null || caller.isBlank() || grant == null || grant.isBlank()) {
            throw new IllegalArgumentException("Caller and grant must not be blank");
        }
        grants.computeIfAbsent(normalize(caller), unused -> new CopyOnWriteArrayList<>()).addIfAbsent(grant);
    }

    @Override
    public boolean isAuthorized(String caller, Document document) {
        if (caller == null || document == null) {
            return false;
        }
        List<String> callerGrants = grants.get(normalize(caller));
        if (callerGrants == null) {
            return false;
        }
        String taxpayer = document.metadataString(TAXPAYER_KEY);
        for (String grant : callerGrants) {
            if (WILDCARD.equals(grant)) {
                return true;
            }
            if (grant.equals(document.id())) {
                return true;
            }
            if (taxpayer != null && taxpayer.equalsIgnoreCase(grant)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public List<String> permissionsOf(String caller) {
        if (caller == null) {
            return List.of();
        }
        List<String> callerGrants = grants.get(normalize(caller));
        return callerGrants == null ? List.of() : List.copyOf(callerGrants);
    }

    private static String normalize(String caller) {
        return caller.toLowerCase(Locale.ROOT);
    }
}
