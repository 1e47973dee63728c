package com.deepansh.research.core.graph;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static com.deepansh.research.core.graph.NodeId.AGGREGATOR;
import static com.deepansh.research.core.graph.NodeId.INTENT_CLASSIFICATION;
import static com.deepansh.research.core.graph.NodeId.MEMORY_LOADER;
import static com.deepansh.research.core.graph.NodeId.MEMORY_SAVER;
import static com.deepansh.research.core.graph.NodeId.QUALITY_CHECK;
import static com.deepansh.research.core.graph.NodeId.QUERY_OPTIMIZATION;
import static com.deepansh.research.core.graph.NodeId.REPORT;
import static com.deepansh.research.core.graph.NodeId.VALIDATION;
import static com.deepansh.research.core.graph.NodeId.VISUALIZATION;

/**
 * Wires the research pipeline:
 *
 * validation → query_optimization → memory_loader → intent_classification
 *   ⇉ {market_data, sentiment, forward_looking, rag_retrieval}
 *   → aggregator → visualization → report → quality_check → memory_saver
 */
@Configuration
public class ResearchGraphConfig {

    @Bean
    public WorkflowGraph researchGraph(NodeRegistry registry, SpecialistRouter router) {
        WorkflowGraph.Builder builder = WorkflowGraph.builder();
        for (NodeId id : NodeId.values()) {
            builder.node(registry.get(id));
        }

        builder.entry(VALIDATION)
                .edge(VALIDATION, QUERY_OPTIMIZATION)
                .edge(QUERY_OPTIMIZATION, MEMORY_LOADER)
                .edge(MEMORY_LOADER, INTENT_CLASSIFICATION)
                .conditionalEdges(INTENT_CLASSIFICATION, router, SpecialistRouter.SPECIALISTS, AGGREGATOR);

        SpecialistRouter.SPECIALISTS.forEach(branch -> builder.edge(branch, AGGREGATOR));

        return builder
                .edge(AGGREGATOR, VISUALIZATION)
                .edge(VISUALIZATION, REPORT)
                .edge(REPORT, QUALITY_CHECK)
                .edge(QUALITY_CHECK, MEMORY_SAVER)
                .exit(MEMORY_SAVER)
                .critical(VALIDATION, INTENT_CLASSIFICATION, REPORT)
                .build();
    }
}
