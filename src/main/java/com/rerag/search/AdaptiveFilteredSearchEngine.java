package com.rerag.search;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rerag.store.Candidate;
import com.rerag.store.Document;
import com.rerag.store.DocumentStore;

/**
 * Nearest-neighbour search that only returns documents passing an authorization predicate.
 *
 * <p>A plain top-{@code k} query under-fills when authorized documents are a minority of the
 * closest candidates, so the candidate pool is widened geometrically until {@code k} authorized
 * documents are found, the corpus is exhausted, or {@link SearchPolicy#maxAttempts()} index
 * queries have been issued. The engine holds no mutable state and is safe to share.</p>
 */
public class AdaptiveFilteredSearchEngine {
    private static final Logger log = LoggerFactory.getLogger(AdaptiveFilteredSearchEngine.class);

    private final DocumentStore store;
    private final SearchPolicy policy;

    public AdaptiveFilteredSearchEngine(DocumentStore store) {
        this(store, SearchPolicy.defaults());
    }

    public AdaptiveFilteredSearchEngine(DocumentStore store, SearchPolicy policy) {
        this.store = Objects.requireNonNull(store, "store");
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public SearchPolicy policy() {
        return policy;
    }

    public SearchOutcome search(float[] query, int k, AuthorizationPredicate predicate) {
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(predicate, "predicate");
        if (k <= 0) {
            return SearchOutcome.empty(k);
        }

        int multiplier = policy.initialMultiplier();
        int attempt = 0;
        int indexQueries = 0;
        int examined = 0;
        while (true) {
            int corpusSize = store.size();
            if (corpusSize == 0) {
                return new SearchOutcome(List.of(), k, indexQueries, examined, indexQueries == 0
                        ? SearchTermination.EMPTY_REQUEST
                        : SearchTermination.EXHAUSTED);
            }
            int requested = (int) Math.min((long) k * multiplier, corpusSize);
            List<Candidate> pool = store.nearest(query, requested);
            indexQueries++;
            log.debug("Search attempt {}/{} requested={} returned={}", attempt + 1, policy.maxAttempts(), requested, pool.size());

            FilterPass pass = authorize(pool, k, predicate);
            examined += pass.examined();
            List<Candidate> authorized = pass.authorized();

            if (authorized.size() >= k) {
                return new SearchOutcome(authorized, k, indexQueries, examined, SearchTermination.SATISFIED);
            }
            if (pool.size() < requested || pool.size() >= corpusSize) {
                return new SearchOutcome(authorized, k, indexQueries, examined, SearchTermination.EXHAUSTED);
            }
            if (attempt + 1 >= policy.maxAttempts()) {
                log.warn("Reached max attempts ({}) in filtered search, returning {}/{} documents",
                        policy.maxAttempts(), authorized.size(), k);
                return new SearchOutcome(authorized, k, indexQueries, examined, SearchTermination.ATTEMPT_LIMIT);
            }

            int nextMultiplier = policy.nextMultiplier(multiplier);
            log.info("Only found {}/{} matching documents, increasing search from {} to {} candidates (attempt {}/{})",
                    authorized.size(),
                    k,
                    requested,
                    (long) k * nextMultiplier,
                    attempt + 1,
                    policy.maxAttempts());
            multiplier = nextMultiplier;
            attempt++;
        }
    }

    private FilterPass authorize(List<Candidate> pool, int k, AuthorizationPredicate predicate) {
        List<Candidate> authorized = new ArrayList<>(Math.min(k, pool.size()));
        int examined = 0;
        if (predicate instanceof BatchAuthorizationPredicate batch) {
            while (authorized.size() < k && examined < pool.size()) {
                int end = Math.min(pool.size(), examined + (k - authorized.size()));
                List<Candidate> slice = pool.subList(examined, end);
                List<Boolean> decisions = batch.authorizeAll(slice.stream().map(Candidate::document).toList());
                if (decisions.size() != slice.size()) {
                    throw new IllegalStateException("Batch predicate returned " + decisions.size()
                            + " decisions for " + slice.size() + " documents");
                }
                for (int i = 0; i < slice.size(); i++) {
                    if (Boolean.TRUE.equals(decisions.get(i))) {
                        authorized.add(slice.get(i));
                    }
                }
                examined = end;
            }
            return new FilterPass(authorized, examined);
        }
        for (Candidate candidate : pool) {
            examined++;
            Document document = candidate.document();
            if (predicate.isAuthorized(document)) {
                authorized.add(candidate);
                if (authorized.size() >= k) {
                    break;
                }
            }
        }
        return new FilterPass(authorized, examined);
    }

    private record FilterPass(List<Candidate> authorized, int examined) {
    }
}
