package com.deepansh.research.node;

import com.deepansh.research.analysis.ReportDraft;
import com.deepansh.research.analysis.ReportInputs;
import com.deepansh.research.analysis.ReportSynthesizer;
import com.deepansh.research.core.graph.ExecutionTrace;
import com.deepansh.research.core.graph.NodeId;
import com.deepansh.research.core.graph.WorkflowNode;
import com.deepansh.research.core.state.StateUpdate;
import com.deepansh.research.core.state.WorkflowState;
import com.deepansh.research.model.InvestorSnapshot;
import com.deepansh.research.model.ReportMetadata;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Synthesizes the final report with its metadata and, when the primary
 * ticker has market data, an investor snapshot.
 *
 * An invalid query gets a short explanation instead of a report; no LLM
 * call is made for it.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ReportNode implements WorkflowNode {

    private final ReportSynthesizer reportSynthesizer;

    @Override
    public NodeId id() {
        return NodeId.REPORT;
    }

    @Override
    public StateUpdate execute(WorkflowState state, ExecutionTrace trace) {
        ReportInputs inputs = ReportInputs.from(state);

        if (!state.queryValid()) {
            trace.step("Query invalid, explaining instead of reporting");
            String reason = state.validationReason() != null ? state.validationReason() : "not an investment question";
            return StateUpdate.builder()
                    .report("I can only help with investment research questions (" + reason + "). "
                            + "No data sources were used. Try asking about a company, a stock or a market sector.")
                    .reportMetadata(metadata(state, inputs, "none", 0, 0.0))
                    .build();
        }

        ReportDraft draft = reportSynthesizer.generate(inputs);
        trace.step("Template " + draft.template() + ", " + draft.iterations()
                + " synthesis pass(es), final score " + draft.finalScore());

        StateUpdate.Builder update = StateUpdate.builder()
                .report(draft.text())
                .reportMetadata(metadata(state, inputs, draft.template(), draft.iterations(), draft.finalScore()));

        InvestorSnapshot snapshot = snapshot(inputs, state, trace);
        if (snapshot != null) {
            update.snapshot(snapshot);
        }
        return update.build();
    }

    private InvestorSnapshot snapshot(ReportInputs inputs, WorkflowState state, ExecutionTrace trace) {
        try {
            InvestorSnapshot snapshot = reportSynthesizer.snapshot(inputs).orElse(null);
            trace.step(snapshot != null ? "Snapshot generated for " + snapshot.ticker() : "Not enough data for a snapshot");
            return snapshot;
        } catch (RuntimeException e) {
            log.warn("Snapshot generation failed [runId={}]: {}", state.runId(), e.getMessage());
            trace.step("Snapshot unavailable: " + e.getMessage());
            return null;
        }
    }

    private ReportMetadata metadata(WorkflowState state, ReportInputs inputs, String template,
                                    int iterations, double score) {
        List<String> executed = new ArrayList<>(state.executedNodes());
        executed.add(name());
        return ReportMetadata.builder()
                .executedNodes(List.copyOf(executed))
                .dataSources(inputs.dataSources())
                .intent(state.intent())
                .tickers(state.tickers())
                .reportTemplate(template)
                .reflectionIterations(iterations)
                .finalScore(score)
                .build();
    }
}
