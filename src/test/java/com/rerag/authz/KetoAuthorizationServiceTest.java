package com.rerag.authz;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.rerag.store.Document;

import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Response;
import okhttp3.ResponseBody;

class KetoAuthorizationServiceTest {
    private static final Document ACME_2023 = new Document("doc-1", "Return", "text",
            Map.of("taxpayer", "Acme Corp", "year", 2023), null);
    private static final Document UNTAGGED = new Document("doc-2", "Memo", "text", Map.of(), null);

    private final List<HttpUrl> requests = new ArrayList<>();

    @Test
    void shouldAskKetoForViewerRelationOnMappedObject() {
        KetoAuthorizationService service = service(200, "{\"allowed\":true}");

        assertTrue(service.isAuthorized("bob", ACME_2023));

        HttpUrl url = requests.get(0);
        assertEquals("/relation-tuples/check/openapi", url.encodedPath());
        assertEquals("documents", url.queryParameter("namespace"));
        assertEquals("acme-corp:2023", url.queryParameter("object"));
        assertEquals("viewer", url.queryParameter("relation"));
        assertEquals("bob", url.queryParameter("subject_id"));
    }

    @Test
    void shouldFallBackToDocumentIdWhenNoTaxpayerIsTagged() {
        KetoAuthorizationService service = service(200, "{\"allowed\":false}");

        assertFalse(service.isAuthorized("bob", UNTAGGED));
        assertEquals("doc-2", requests.get(0).queryParameter("object"));
    }

    @Test
    void shouldTreatForbiddenAsDenied() {
        KetoAuthorizationService service = service(403, "{\"allowed\":false}");

        assertFalse(service.isAuthorized("bob", ACME_2023));
    }

    @Test
    void shouldFailRatherThanDenyWhenKetoErrors() {
        KetoAuthorizationService service = service(500, "{\"error\":\"boom\"}");

        assertThrows(AuthorizationException.class, () -> service.isAuthorized("bob", ACME_2023));
    }

    @Test
    void shouldFailWhenResponseHasNoDecision() {
        KetoAuthorizationService service = service(200, "{}");

        assertThrows(AuthorizationException.class, () -> service.isAuthorized("bob", ACME_2023));
    }

    @Test
    void shouldWrapTransportFailures() {
        OkHttpClient client = new OkHttpClient.Builder()
                .addInterceptor(chain -> {
                    throw new IOException("connection refused");
                })
                .build();
        KetoAuthorizationService service = new KetoAuthorizationService(client, "http://keto.test:4466", "documents", "viewer");

        AuthorizationException failure = assertThrows(AuthorizationException.class,
                () -> service.isAuthorized("bob", ACME_2023));
        assertInstanceOf(IOException.class, failure.getCause());
    }

    @Test
    void shouldListObjectsFromRelationTuples() {
        KetoAuthorizationService service = service(200, """
                {"relation_tuples":[
                  {"namespace":"documents","object":"acme-corp:2023","relation":"viewer","subject_id":"bob"},
                  {"namespace":"documents","object":"globex:2022","relation":"viewer","subject_id":"bob"}
                ]}
                """);

        assertEquals(List.of("acme-corp:2023", "globex:2022"), service.permissionsOf("bob"));
        assertEquals("/relation-tuples", requests.get(0).encodedPath());
        assertEquals("bob", requests.get(0).queryParameter("subject_id"));
    }

    @Test
    void shouldMapYearlessTaxpayerToUnknownYear() {
        Document noYear = new Document("doc-3", "Return", "text", Map.of("taxpayer", "Globex Inc"), null);

        assertEquals("globex-inc:unknown", KetoAuthorizationService.objectFor(noYear));
    }

    private KetoAuthorizationService service(int status, String body) {
        OkHttpClient client = new OkHttpClient.Builder()
                .addInterceptor(chain -> {
                    requests.add(chain.request().url());
                    return new Response.Builder()
                            .request(chain.request())
                            .protocol(Protocol.HTTP_1_1)
                            .code(status)
                            .message("status " + status)
                            .body(ResponseBody.create(body, MediaType.get("application/json")))
                            .build();
                })
                .build();
        return new KetoAuthorizationService(client, "http://keto.test:4466", "documents", "viewer");
    }
}
