package com.jreinhal.veritas.rag.retrieval;

import com.jreinhal.veritas.model.QueryPlan;
import com.jreinhal.veritas.model.RetrievedItem;
import com.jreinhal.veritas.util.ContentKeys;
import com.jreinhal.veritas.util.LogSanitizer;
import com.jreinhal.veritas.workspace.TenantClientPool;
import com.jreinhal.veritas.workspace.TenantClients;
import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Runs vector and graph retrieval for a plan.
 *
 * <p>Both sides are submitted to the retrieval pool at once and joined against a shared deadline,
 * so the stage takes as long as the slower side. A side that fails or misses the deadline yields an
 * empty list and is named in {@link RetrievalResult#failures()}; it never fails the other side.
 * Unfinished tasks are cancelled before returning.</p>
 */
@Service
public class RetrievalCoordinator {
    private static final Logger log = LoggerFactory.getLogger(RetrievalCoordinator.class);
    static final String VECTOR_SIDE = "vector";
    static final String GRAPH_SIDE = "graph";

    private final TenantClientPool tenantClientPool;
    private final VectorRetriever vectorRetriever;
    private final GraphRetriever graphRetriever;
    private final QueryExpander queryExpander;
    private final ExecutorService retrievalExecutor;
    private final ExecutorService expansionExecutor;

    @Value("${veritas.retrieval.timeout-ms:8000}")
    private long timeoutMs;
    @Value("${veritas.retrieval.expansion-variants:4}")
    private int expansionVariants;
    @Value("${veritas.retrieval.expansion-concurrency:5}")
    private int expansionConcurrency;
    @Value("${veritas.retrieval.expansion-budget-ms:3000}")
    private long expansionBudgetMs;
    @Value("${veritas.retrieval.vector-max-items:30}")
    private int vectorMaxItems;

    public RetrievalCoordinator(TenantClientPool tenantClientPool, VectorRetriever vectorRetriever, GraphRetriever graphRetriever,
                                QueryExpander queryExpander,
                                @Qualifier("retrievalExecutor") ExecutorService retrievalExecutor,
                                @Qualifier("expansionExecutor") ExecutorService expansionExecutor) {
        this.tenantClientPool = tenantClientPool;
        this.vectorRetriever = vectorRetriever;
        this.graphRetriever = graphRetriever;
        this.queryExpander = queryExpander;
        this.retrievalExecutor = retrievalExecutor;
        this.expansionExecutor = expansionExecutor;
    }

    @PostConstruct
    public void init() {
        log.info("Retrieval coordinator initialized (timeout={}ms, variants={}, expansionConcurrency={}, expansionBudget={}ms)",
                this.timeoutMs, this.expansionVariants, this.expansionConcurrency, this.expansionBudgetMs);
    }

    public RetrievalResult retrieve(QueryPlan plan, String workspaceId) {
        if (plan.intent().skipsRetrieval() || !plan.retrievalStrategy().retrievesAnything()) {
            return RetrievalResult.EMPTY;
        }
        long startTime = System.currentTimeMillis();
        long deadlineMs = startTime + this.timeoutMs;
        TenantClients clients;
        try {
            clients = this.tenantClientPool.acquire(workspaceId);
        }
        catch (RuntimeException e) {
            log.warn("Store clients unavailable for workspace {}: {}", workspaceId, LogSanitizer.sanitize(e.getMessage()));
            return new RetrievalResult(List.of(), List.of(), List.of(VECTOR_SIDE, GRAPH_SIDE));
        }

        Map<String, CompletableFuture<List<RetrievedItem>>> futures = new LinkedHashMap<>();
        if (plan.retrievalStrategy().useVector()) {
            futures.put(VECTOR_SIDE, this.submit(VECTOR_SIDE, () -> this.retrieveVector(plan, clients, deadlineMs)));
        }
        if (plan.retrievalStrategy().useGraph()) {
            futures.put(GRAPH_SIDE, this.submit(GRAPH_SIDE, () -> this.graphRetriever.retrieve(plan, clients.graphStore())));
        }

        Map<String, List<RetrievedItem>> results = new LinkedHashMap<>();
        List<String> failures = new ArrayList<>();
        try {
            for (Map.Entry<String, CompletableFuture<List<RetrievedItem>>> entry : futures.entrySet()) {
                List<RetrievedItem> items = this.await(entry.getKey(), entry.getValue(), deadlineMs);
                if (items == null) {
                    failures.add(entry.getKey());
                    items = List.of();
                }
                results.put(entry.getKey(), items);
            }
        }
        finally {
            futures.values().forEach(future -> {
                if (!future.isDone()) {
                    future.cancel(true);
                }
            });
        }

        RetrievalResult result = new RetrievalResult(results.getOrDefault(VECTOR_SIDE, List.of()),
                results.getOrDefault(GRAPH_SIDE, List.of()), failures);
        log.info("Retrieval for query {} finished in {}ms: vector={}, graph={}, failures={}",
                LogSanitizer.querySummary(plan.rawQuery()), System.currentTimeMillis() - startTime,
                result.vectorItems().size(), result.graphItems().size(), failures);
        return result;
    }

    List<RetrievedItem> retrieveVector(QueryPlan plan, TenantClients clients, long deadlineMs) {
        Set<String> queries = new LinkedHashSet<>(plan.retrievalQueries());
        if (plan.retrievalStrategy().expandQuery()) {
            long budgetDeadlineMs = Math.min(deadlineMs, System.currentTimeMillis() + this.expansionBudgetMs);
            queries.addAll(this.expandAll(plan.retrievalQueries(), budgetDeadlineMs));
        }
        List<String> ordered = new ArrayList<>(queries);
        List<List<RetrievedItem>> perQuery = new ArrayList<>();
        RuntimeException lastFailure = null;
        int failed = 0;
        int batchSize = Math.max(1, this.expansionConcurrency);
        for (int offset = 0; offset < ordered.size(); offset += batchSize) {
            List<CompletableFuture<List<RetrievedItem>>> batch = new ArrayList<>();
            for (String query : ordered.subList(offset, Math.min(ordered.size(), offset + batchSize))) {
                try {
                    batch.add(CompletableFuture.supplyAsync(() -> this.vectorRetriever.search(clients, query), this.expansionExecutor));
                }
                catch (RejectedExecutionException e) {
                    batch.add(CompletableFuture.failedFuture(e));
                }
            }
            try {
                for (CompletableFuture<List<RetrievedItem>> future : batch) {
                    long remainingMs = deadlineMs - System.currentTimeMillis();
                    try {
                        if (remainingMs <= 0L) {
                            throw new TimeoutException("retrieval deadline passed");
                        }
                        perQuery.add(future.get(remainingMs, TimeUnit.MILLISECONDS));
                    }
                    catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new IllegalStateException("Vector retrieval interrupted", e);
                    }
                    catch (TimeoutException | ExecutionException e) {
                        failed++;
                        Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
                        lastFailure = new IllegalStateException(cause.getMessage(), cause);
                        log.debug("Vector search variant failed: {}", LogSanitizer.sanitize(cause.getMessage()));
                    }
                }
            }
            finally {
                batch.forEach(future -> future.cancel(true));
            }
        }
        if (failed == ordered.size() && lastFailure != null) {
            throw lastFailure;
        }
        return mergeVariants(perQuery, this.vectorMaxItems);
    }

    /**
     * Expands all queries at once on the expansion pool. A query whose expansion is still running at
     * the budget deadline is searched unexpanded.
     */
    private List<String> expandAll(List<String> baseQueries, long budgetDeadlineMs) {
        List<CompletableFuture<List<String>>> expansions = new ArrayList<>();
        for (String query : baseQueries) {
            try {
                expansions.add(CompletableFuture.supplyAsync(() -> this.queryExpander.expand(query, this.expansionVariants),
                        this.expansionExecutor));
            }
            catch (RejectedExecutionException e) {
                expansions.add(CompletableFuture.failedFuture(e));
            }
        }
        List<String> variants = new ArrayList<>();
        int skipped = 0;
        try {
            for (CompletableFuture<List<String>> future : expansions) {
                long remainingMs = budgetDeadlineMs - System.currentTimeMillis();
                try {
                    if (remainingMs <= 0L && !future.isDone()) {
                        throw new TimeoutException("expansion budget spent");
                    }
                    variants.addAll(future.get(Math.max(0L, remainingMs), TimeUnit.MILLISECONDS));
                }
                catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Query expansion interrupted", e);
                }
                catch (TimeoutException | ExecutionException e) {
                    skipped++;
                }
            }
        }
        finally {
            expansions.forEach(future -> future.cancel(true));
        }
        if (skipped > 0) {
            log.warn("Query expansion incomplete for {} of {} queries, searching them unexpanded", skipped, expansions.size());
        }
        return variants;
    }

    /**
     * Merge per-variant results, collapsing items with the same content prefix to the best-scoring
     * one, highest score first. Equal scores keep first-seen order.
     */
    static List<RetrievedItem> mergeVariants(List<List<RetrievedItem>> perQuery, int maxItems) {
        Map<String, RetrievedItem> byKey = new LinkedHashMap<>();
        for (List<RetrievedItem> items : perQuery) {
            for (RetrievedItem item : items) {
                byKey.merge(ContentKeys.prefixKey(item.content()), item,
                        (existing, candidate) -> candidate.relevanceScore() > existing.relevanceScore() ? candidate : existing);
            }
        }
        List<RetrievedItem> merged = new ArrayList<>(byKey.values());
        merged.sort(Comparator.comparingDouble(RetrievedItem::relevanceScore).reversed());
        return merged.size() > maxItems ? List.copyOf(merged.subList(0, maxItems)) : List.copyOf(merged);
    }

    private CompletableFuture<List<RetrievedItem>> submit(String side, Supplier<List<RetrievedItem>> task) {
        try {
            return CompletableFuture.supplyAsync(task, this.retrievalExecutor);
        }
        catch (RejectedExecutionException e) {
            log.warn("Retrieval pool overloaded, skipping {} retrieval", side);
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * @return the side's items, or null when it failed or missed the deadline
     */
    private List<RetrievedItem> await(String side, CompletableFuture<List<RetrievedItem>> future, long deadlineMs) {
        long remainingMs = deadlineMs - System.currentTimeMillis();
        if (remainingMs <= 0L && !future.isDone()) {
            log.warn("{} retrieval exceeded the {}ms deadline", side, this.timeoutMs);
            future.cancel(true);
            return null;
        }
        try {
            return future.get(Math.max(0L, remainingMs), TimeUnit.MILLISECONDS);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("{} retrieval interrupted", side);
            return null;
        }
        catch (TimeoutException e) {
            log.warn("{} retrieval timed out after {}ms", side, this.timeoutMs);
            future.cancel(true);
            return null;
        }
        catch (Exception e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("{} retrieval failed: {}", side, LogSanitizer.sanitize(cause.getMessage()));
            return null;
        }
    }
}
