package com.deepansh.research.core.graph;

import com.deepansh.research.core.state.StateUpdate;
import com.deepansh.research.core.state.WorkflowState;
import com.deepansh.research.exception.WorkflowExecutionException;
import com.deepansh.research.exception.WorkflowTimeoutException;
import com.deepansh.research.resilience.ErrorClassifier;
import com.deepansh.research.resilience.RetryExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class GraphSchedulerTest {

    private static final Set<NodeId> BRANCHES =
            EnumSet.of(NodeId.MARKET_DATA, NodeId.SENTIMENT, NodeId.RAG_RETRIEVAL);

    private ThreadPoolTaskExecutor executor;
    private GraphScheduler scheduler;
    private WorkflowState initial;

    @BeforeEach
    void setUp() {
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(8);
        executor.setThreadNamePrefix("test-node-");
        executor.initialize();

        ErrorClassifier classifier = new ErrorClassifier();
        ExecutionEnvelope envelope = new ExecutionEnvelope(new RetryExecutor(classifier, 3, Duration.ofMillis(5)), classifier);
        scheduler = new GraphScheduler(envelope, executor);
        initial = WorkflowState.initial("run-1", "session-1", "Analyze AAPL", Instant.now());
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    private WorkflowGraph graph(DispatchRouter router, StubNode market, StubNode sentiment,
                                StubNode retrieval, StubNode aggregator, StubNode report) {
        return WorkflowGraph.builder()
                .node(StubNode.passThrough(NodeId.VALIDATION))
                .node(StubNode.passThrough(NodeId.INTENT_CLASSIFICATION))
                .node(market)
                .node(sentiment)
                .node(retrieval)
                .node(aggregator)
                .node(report)
                .entry(NodeId.VALIDATION)
                .edge(NodeId.VALIDATION, NodeId.INTENT_CLASSIFICATION)
                .conditionalEdges(NodeId.INTENT_CLASSIFICATION, router, BRANCHES, NodeId.AGGREGATOR)
                .edge(NodeId.MARKET_DATA, NodeId.AGGREGATOR)
                .edge(NodeId.SENTIMENT, NodeId.AGGREGATOR)
                .edge(NodeId.RAG_RETRIEVAL, NodeId.AGGREGATOR)
                .edge(NodeId.AGGREGATOR, NodeId.REPORT)
                .exit(NodeId.REPORT)
                .critical(NodeId.VALIDATION, NodeId.INTENT_CLASSIFICATION, NodeId.REPORT)
                .build();
    }

    private static StubNode reportNode() {
        return new StubNode(NodeId.REPORT, (state, trace) -> StateUpdate.builder().report("done").build());
    }

    @Test
    void run_fanOut_branchesRunConcurrentlyAndMergeBeforeJoin() {
        CountDownLatch bothStarted = new CountDownLatch(2);
        StubNode market = new StubNode(NodeId.MARKET_DATA, (state, trace) -> {
            bothStarted.countDown();
            if (!bothStarted.await(5, TimeUnit.SECONDS)) throw new IllegalStateException("branches not concurrent");
            Thread.sleep(50);
            return StateUpdate.builder().error("from market").build();
        });
        StubNode sentiment = new StubNode(NodeId.SENTIMENT, (state, trace) -> {
            bothStarted.countDown();
            if (!bothStarted.await(5, TimeUnit.SECONDS)) throw new IllegalStateException("branches not concurrent");
            return StateUpdate.builder().error("from sentiment").build();
        });
        StubNode retrieval = StubNode.passThrough(NodeId.RAG_RETRIEVAL);
        AtomicReference<WorkflowState> seenByAggregator = new AtomicReference<>();
        StubNode aggregator = new StubNode(NodeId.AGGREGATOR, (state, trace) -> {
            seenByAggregator.set(state);
            return StateUpdate.empty();
        });

        WorkflowState result = scheduler.run(
                graph(state -> Set.of(NodeId.SENTIMENT, NodeId.MARKET_DATA), market, sentiment, retrieval, aggregator, reportNode()),
                initial, RunDeadline.after(Duration.ofSeconds(10)));

        assertThat(retrieval.calls).hasValue(0);
        assertThat(seenByAggregator.get().executedNodes()).contains("market_data", "sentiment");
        // merged in declaration order, not completion order
        assertThat(result.errors()).containsExactly("from market", "from sentiment");
        assertThat(result.executedNodes()).containsExactly(
                "validation", "intent_classification", "market_data", "sentiment", "aggregator", "report");
        assertThat(result.report()).isEqualTo("done");
    }

    @Test
    void run_emptyDispatch_continuesAtJoin() {
        StubNode market = StubNode.passThrough(NodeId.MARKET_DATA);
        StubNode aggregator = StubNode.passThrough(NodeId.AGGREGATOR);

        WorkflowState result = scheduler.run(
                graph(state -> Set.of(), market, StubNode.passThrough(NodeId.SENTIMENT),
                        StubNode.passThrough(NodeId.RAG_RETRIEVAL), aggregator, reportNode()),
                initial, RunDeadline.after(Duration.ofSeconds(5)));

        assertThat(market.calls).hasValue(0);
        assertThat(aggregator.calls).hasValue(1);
        assertThat(result.executedNodes()).containsExactly(
                "validation", "intent_classification", "aggregator", "report");
    }

    @Test
    void run_nonCriticalBranchFails_runContinues() {
        StubNode market = new StubNode(NodeId.MARKET_DATA, (state, trace) -> {
            throw new IllegalStateException("provider broke");
        });

        WorkflowState result = scheduler.run(
                graph(state -> Set.of(NodeId.MARKET_DATA), market, StubNode.passThrough(NodeId.SENTIMENT),
                        StubNode.passThrough(NodeId.RAG_RETRIEVAL), StubNode.passThrough(NodeId.AGGREGATOR), reportNode()),
                initial, RunDeadline.after(Duration.ofSeconds(5)));

        assertThat(result.nodeErrors()).containsEntry("market_data", "provider broke");
        assertThat(result.report()).isEqualTo("done");
    }

    @Test
    void run_criticalNodeFails_throwsWithNodeName() {
        StubNode report = new StubNode(NodeId.REPORT, (state, trace) -> {
            throw new IllegalArgumentException("template missing");
        });

        assertThatThrownBy(() -> scheduler.run(
                graph(state -> Set.of(), StubNode.passThrough(NodeId.MARKET_DATA), StubNode.passThrough(NodeId.SENTIMENT),
                        StubNode.passThrough(NodeId.RAG_RETRIEVAL), StubNode.passThrough(NodeId.AGGREGATOR), report),
                initial, RunDeadline.after(Duration.ofSeconds(5))))
                .isInstanceOf(WorkflowExecutionException.class)
                .hasMessageContaining("template missing")
                .extracting(e -> ((WorkflowExecutionException) e).getNodeName())
                .isEqualTo("report");
    }

    @Test
    void run_criticalNodeFails_exceptionCarriesMergedState() {
        StubNode report = new StubNode(NodeId.REPORT, (state, trace) -> {
            throw new IllegalArgumentException("template missing");
        });

        WorkflowExecutionException failure = catchThrowableOfType(() -> scheduler.run(
                graph(state -> Set.of(NodeId.MARKET_DATA), StubNode.passThrough(NodeId.MARKET_DATA),
                        StubNode.passThrough(NodeId.SENTIMENT), StubNode.passThrough(NodeId.RAG_RETRIEVAL),
                        StubNode.passThrough(NodeId.AGGREGATOR), report),
                initial, RunDeadline.after(Duration.ofSeconds(5))), WorkflowExecutionException.class);

        WorkflowState last = failure.getLastState().orElseThrow();
        assertThat(last.executedNodes()).containsExactly(
                "validation", "intent_classification", "market_data", "aggregator", "report");
        assertThat(last.nodeErrors()).containsEntry("report", "template missing");
        assertThat(last.nodeMetrics()).containsKeys("validation", "market_data", "report");
    }

    @Test
    void run_branchThrowsError_failureNamesNode() {
        StubNode market = new StubNode(NodeId.MARKET_DATA, (state, trace) -> {
            throw new AssertionError("invariant broken");
        });

        WorkflowExecutionException failure = catchThrowableOfType(() -> scheduler.run(
                graph(state -> Set.of(NodeId.MARKET_DATA, NodeId.SENTIMENT), market,
                        StubNode.passThrough(NodeId.SENTIMENT), StubNode.passThrough(NodeId.RAG_RETRIEVAL),
                        StubNode.passThrough(NodeId.AGGREGATOR), reportNode()),
                initial, RunDeadline.after(Duration.ofSeconds(5))), WorkflowExecutionException.class);

        assertThat(failure.getNodeName()).isEqualTo("market_data");
        assertThat(failure).hasMessageContaining("market_data").hasMessageContaining("invariant broken");
        assertThat(failure.getCause()).isInstanceOf(AssertionError.class);
        assertThat(failure.getLastState().orElseThrow().executedNodes())
                .containsExactly("validation", "intent_classification");
    }

    @Test
    void run_deadlineExpires_timeoutCarriesStateBeforeFanOut() {
        StubNode slowMarket = new StubNode(NodeId.MARKET_DATA, (state, trace) -> {
            Thread.sleep(10_000);
            return StateUpdate.empty();
        });

        WorkflowExecutionException failure = catchThrowableOfType(() -> scheduler.run(
                graph(state -> Set.of(NodeId.MARKET_DATA), slowMarket, StubNode.passThrough(NodeId.SENTIMENT),
                        StubNode.passThrough(NodeId.RAG_RETRIEVAL), StubNode.passThrough(NodeId.AGGREGATOR), reportNode()),
                initial, RunDeadline.after(Duration.ofMillis(300))), WorkflowExecutionException.class);

        assertThat(failure).isInstanceOf(WorkflowTimeoutException.class);
        assertThat(failure.getLastState().orElseThrow().executedNodes())
                .containsExactly("validation", "intent_classification");
    }

    @Test
    void run_routerSelectsUndeclaredBranch_throws() {
        DispatchRouter rogue = state -> Set.of(NodeId.VISUALIZATION);

        assertThatThrownBy(() -> scheduler.run(
                graph(rogue, StubNode.passThrough(NodeId.MARKET_DATA), StubNode.passThrough(NodeId.SENTIMENT),
                        StubNode.passThrough(NodeId.RAG_RETRIEVAL), StubNode.passThrough(NodeId.AGGREGATOR), reportNode()),
                initial, RunDeadline.after(Duration.ofSeconds(5))))
                .isInstanceOf(WorkflowExecutionException.class)
                .hasMessageContaining("undeclared");
    }

    @Test
    void run_deadlineExpires_cancelsBranchesAndThrowsTimeout() throws Exception {
        AtomicBoolean interrupted = new AtomicBoolean();
        CountDownLatch cancelled = new CountDownLatch(1);
        StubNode slowMarket = new StubNode(NodeId.MARKET_DATA, (state, trace) -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.set(true);
                cancelled.countDown();
                throw e;
            }
            return StateUpdate.empty();
        });
        StubNode aggregator = StubNode.passThrough(NodeId.AGGREGATOR);

        assertThatThrownBy(() -> scheduler.run(
                graph(state -> Set.of(NodeId.MARKET_DATA), slowMarket, StubNode.passThrough(NodeId.SENTIMENT),
                        StubNode.passThrough(NodeId.RAG_RETRIEVAL), aggregator, reportNode()),
                initial, RunDeadline.after(Duration.ofMillis(300))))
                .isInstanceOf(WorkflowTimeoutException.class);

        assertThat(cancelled.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(interrupted).isTrue();
        assertThat(aggregator.calls).hasValue(0);
    }

    @Test
    void run_schedulerIsReusableAcrossRuns() {
        WorkflowGraph graph = graph(state -> Set.of(NodeId.RAG_RETRIEVAL), StubNode.passThrough(NodeId.MARKET_DATA),
                StubNode.passThrough(NodeId.SENTIMENT), StubNode.passThrough(NodeId.RAG_RETRIEVAL),
                StubNode.passThrough(NodeId.AGGREGATOR), reportNode());

        WorkflowState first = scheduler.run(graph, initial, RunDeadline.after(Duration.ofSeconds(5)));
        WorkflowState second = scheduler.run(graph,
                WorkflowState.initial("run-2", "session-1", "again", Instant.now()),
                RunDeadline.after(Duration.ofSeconds(5)));

        assertThat(first.executedNodes()).isEqualTo(second.executedNodes());
        assertThat(List.of(first.runId(), second.runId())).containsExactly("run-1", "run-2");
    }
}
