package com.causal.graph.service.pipeline;

import com.causal.graph.service.config.MetricsConfig;
import com.causal.graph.service.engine.CycleEnumerator;
import com.causal.graph.service.engine.CycleReport;
import com.causal.graph.service.engine.SccDecomposer;
import com.causal.graph.service.engine.SccPartition;
import com.causal.graph.service.store.AnalysisStage;
import com.causal.graph.service.store.ArtifactStore;
import com.causal.graph.service.store.ArtifactTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Decomposes the pruned graph into SCCs and counts every simple cycle inside them.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CyclesStageHandler implements StageHandler {

    public static final String SCC_SUMMARY = "scc_summary";
    public static final String PARTICIPATION = "node_cycle_participation";
    public static final String LENGTH_DISTRIBUTION = "cycle_length_distribution";
    public static final String SAMPLES = "cycle_samples";

    private final ArtifactStore artifactStore;
    private final SccDecomposer sccDecomposer;
    private final CycleEnumerator cycleEnumerator;
    private final MetricsConfig metricsConfig;

    @Override
    public Map<String, Object> run(String analysisId) {
        var graph = artifactStore.getGraph(analysisId, AnalysisStage.PRUNING);
        var partition = sccDecomposer.decompose(graph);
        var report = cycleEnumerator.enumerate(graph, partition);
        metricsConfig.getCyclesEnumerated().increment(report.totalCycles());

        artifactStore.putTable(analysisId, getStage(), SCC_SUMMARY, sccTable(partition, report));
        artifactStore.putTable(analysisId, getStage(), PARTICIPATION, participationTable(report));
        artifactStore.putTable(analysisId, getStage(), LENGTH_DISTRIBUTION, lengthTable(report));
        artifactStore.putTable(analysisId, getStage(), SAMPLES, samplesTable(report));

        var summary = new LinkedHashMap<String, Object>();
        summary.put("largeSccs", partition.largeComponents().size());
        summary.put("nodesInLargeSccs", partition.nodesInLargeComponents());
        summary.put("totalCycles", report.totalCycles());
        summary.put("cyclesSampled", report.samples().size());
        return summary;
    }

    @Override
    public AnalysisStage getStage() {
        return AnalysisStage.CYCLES;
    }

    // ==================== Tables ====================

    private ArtifactTable sccTable(SccPartition partition, CycleReport report) {
        var totals = report.totalsByComponent();
        var builder = ArtifactTable.builder("scc_id", "size", "cycle_count", "members");
        for (var component : partition.largeComponents()) {
            builder.row(component.id(), component.size(),
                    totals.getOrDefault(component.id(), 0L), component.members());
        }
        return builder.build();
    }

    private ArtifactTable participationTable(CycleReport report) {
        var builder = ArtifactTable.builder("node", "cycle_count", "scc_ids");
        report.participation().forEach(p -> builder.row(p.node(), p.cycleCount(), p.sccIds()));
        return builder.build();
    }

    private ArtifactTable lengthTable(CycleReport report) {
        var builder = ArtifactTable.builder("length", "count");
        report.lengthHistogram().forEach(builder::row);
        return builder.build();
    }

    private ArtifactTable samplesTable(CycleReport report) {
        var builder = ArtifactTable.builder("scc_id", "sequence", "length", "path");
        report.samples().forEach(c -> builder.row(c.sccId(), c.sequence(), c.length(), c.asPath()));
        return builder.build();
    }
}
