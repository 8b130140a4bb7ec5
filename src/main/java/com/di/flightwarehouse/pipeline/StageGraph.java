package com.di.flightwarehouse.pipeline;

import com.di.flightwarehouse.exception.ErrorCategory;
import com.di.flightwarehouse.util.MdcPropagation;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * A directed acyclic graph of named stages.
 * <p>
 * A stage starts once every upstream stage has succeeded, so independent stages (fan-out) run
 * concurrently on the supplied executor and a stage with several upstreams waits for all of them
 * (fan-in barrier). A stage whose upstream failed or was skipped is itself skipped.
 */
@Slf4j
public final class StageGraph {

    private record Node(String name, Callable<?> task, List<String> upstream) {
    }

    private final Map<String, Node> nodes;
    private final List<String> order;

    private StageGraph(Map<String, Node> nodes, List<String> order) {
        this.nodes = nodes;
        this.order = order;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Stage names in a valid execution order. */
    public List<String> topologicalOrder() {
        return order;
    }

    /**
     * Runs the graph to completion and returns one execution per stage, in topological order.
     * Stage failures are reported in the result, never thrown.
     */
    public List<StageExecution> execute(RetryPolicy retryPolicy, Executor executor) {
        Map<String, CompletableFuture<StageExecution>> futures = new LinkedHashMap<>();
        for (String name : order) {
            Node node = nodes.get(name);
            List<CompletableFuture<StageExecution>> upstream = node.upstream().stream().map(futures::get).toList();
            CompletableFuture<StageExecution> future = CompletableFuture
                    .allOf(upstream.toArray(new CompletableFuture<?>[0]))
                    .thenApplyAsync(MdcPropagation.<Void, StageExecution>wrapFunction(ignored -> {
                        for (CompletableFuture<StageExecution> dep : upstream) {
                            StageExecution done = dep.join();
                            if (!done.isSucceeded()) {
                                log.warn("[DAG] {} skipped: upstream {} {}", name, done.getStage(), done.getStatus());
                                return StageExecution.skipped(name, "upstream " + done.getStage() + " " + done.getStatus());
                            }
                        }
                        return runStage(node, retryPolicy);
                    }), executor);
            futures.put(name, future);
        }
        CompletableFuture.allOf(futures.values().toArray(new CompletableFuture<?>[0])).join();
        return futures.values().stream().map(CompletableFuture::join).toList();
    }

    private static StageExecution runStage(Node node, RetryPolicy retryPolicy) {
        long start = System.currentTimeMillis();
        log.info("[DAG] {} started", node.name());
        Callable<?> task = node.task();
        RetryPolicy.Outcome<Object> outcome = retryPolicy.execute(node.name(),
                () -> MdcPropagation.callWithMdcValue(MdcPropagation.STAGE, node.name(), task));
        long durationMs = System.currentTimeMillis() - start;
        if (outcome.succeeded()) {
            log.info("[DAG] {} succeeded in {} ms ({} attempt(s))", node.name(), durationMs, outcome.attempts());
            return StageExecution.builder()
                    .stage(node.name())
                    .status(StageStatus.SUCCEEDED)
                    .attempts(outcome.attempts())
                    .durationMs(durationMs)
                    .result(outcome.value())
                    .build();
        }
        Throwable failure = outcome.failure();
        log.error("[DAG] {} failed after {} attempt(s) in {} ms: {}", node.name(), outcome.attempts(), durationMs, failure.getMessage());
        return StageExecution.builder()
                .stage(node.name())
                .status(StageStatus.FAILED)
                .attempts(outcome.attempts())
                .durationMs(durationMs)
                .errorCategory(ErrorCategory.categorize(failure).name())
                .errorMessage(failure.getMessage())
                .failure(failure)
                .build();
    }

    public static final class Builder {
        private final Map<String, Node> nodes = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder stage(String name, Callable<?> task, String... upstream) {
            if (nodes.containsKey(name)) {
                throw new IllegalArgumentException("Duplicate stage '" + name + "'");
            }
            nodes.put(name, new Node(name, task, List.of(upstream)));
            return this;
        }

        /**
         * @throws IllegalArgumentException on an unknown upstream or a cycle
         */
        public StageGraph build() {
            Map<String, Integer> inDegree = new HashMap<>();
            Map<String, List<String>> downstream = new HashMap<>();
            for (Node node : nodes.values()) {
                inDegree.putIfAbsent(node.name(), 0);
                for (String up : node.upstream()) {
                    if (!nodes.containsKey(up)) {
                        throw new IllegalArgumentException("Stage '" + node.name() + "' depends on unknown stage '" + up + "'");
                    }
                    inDegree.merge(node.name(), 1, Integer::sum);
                    downstream.computeIfAbsent(up, k -> new ArrayList<>()).add(node.name());
                }
            }

            // Kahn's algorithm; declaration order breaks ties so the order is stable.
            Deque<String> ready = new ArrayDeque<>();
            nodes.keySet().stream().filter(n -> inDegree.get(n) == 0).forEach(ready::add);
            List<String> order = new ArrayList<>(nodes.size());
            while (!ready.isEmpty()) {
                String next = ready.poll();
                order.add(next);
                for (String down : downstream.getOrDefault(next, List.of())) {
                    if (inDegree.merge(down, -1, Integer::sum) == 0) {
                        ready.add(down);
                    }
                }
            }
            if (order.size() != nodes.size()) {
                List<String> cyclic = new ArrayList<>(nodes.keySet());
                cyclic.removeAll(order);
                throw new IllegalArgumentException("Stage graph has a cycle through " + Arrays.toString(cyclic.toArray()));
            }
            return new StageGraph(Map.copyOf(nodes), List.copyOf(order));
        }
    }
}
