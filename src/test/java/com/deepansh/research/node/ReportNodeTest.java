package com.deepansh.research.node;

import com.deepansh.research.analysis.ReportDraft;
import com.deepansh.research.analysis.ReportInputs;
import com.deepansh.research.analysis.ReportSynthesizer;
import com.deepansh.research.core.graph.ExecutionTrace;
import com.deepansh.research.core.state.StateMerger;
import com.deepansh.research.core.state.StateUpdate;
import com.deepansh.research.core.state.WorkflowState;
import com.deepansh.research.model.MarketSnapshot;
import com.deepansh.research.model.QueryIntent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReportNodeTest {

    @Mock ReportSynthesizer reportSynthesizer;

    @InjectMocks
    ReportNode node;

    private WorkflowState state(StateUpdate update) {
        return StateMerger.merge(
                WorkflowState.initial("run-1", "session-1", "What is the AAPL price?", Instant.now()), update);
    }

    @Test
    void execute_invalidQuery_explainsWithoutCallingLlm() {
        WorkflowState invalid = state(StateUpdate.builder()
                .queryValid(false)
                .validationReason("Greeting")
                .executedNode("validation")
                .build());

        WorkflowState result = StateMerger.merge(invalid, node.execute(invalid, new ExecutionTrace("report")));

        verifyNoInteractions(reportSynthesizer);
        assertThat(result.report()).contains("Greeting").contains("No data sources were used");
        assertThat(result.reportMetadata().dataSources()).doesNotContainValue(true);
        assertThat(result.reportMetadata().executedNodes()).containsExactly("validation", "report");
        assertThat(result.snapshot()).isNull();
    }

    @Test
    void execute_snapshotFails_reportStillProduced() {
        WorkflowState withData = state(StateUpdate.builder()
                .intent(QueryIntent.PRICE_QUERY)
                .tickers(List.of("AAPL"))
                .marketData(List.of(MarketSnapshot.builder().ticker("AAPL").currentPrice(190.0).build()))
                .build());
        when(reportSynthesizer.generate(any(ReportInputs.class)))
                .thenReturn(new ReportDraft("AAPL trades at $190.", "brief_market", 1, 0.9));
        when(reportSynthesizer.snapshot(any(ReportInputs.class))).thenThrow(new IllegalStateException("LLM down"));

        WorkflowState result = StateMerger.merge(withData, node.execute(withData, new ExecutionTrace("report")));

        assertThat(result.report()).isEqualTo("AAPL trades at $190.");
        assertThat(result.snapshot()).isNull();
        assertThat(result.reportMetadata().reportTemplate()).isEqualTo("brief_market");
        assertThat(result.reportMetadata().reflectionIterations()).isEqualTo(1);
        assertThat(result.reportMetadata().dataSources())
                .containsEntry("market_data", true)
                .containsEntry("sentiment", false);
    }
}
