package com.causal.graph.service.batch;

import com.causal.graph.service.config.AnalysisConfig;
import com.causal.graph.service.error.MissingPrerequisiteException;
import com.causal.graph.service.store.AnalysisStage;
import com.causal.graph.service.store.ArtifactStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Batch mode picks up the generated graph file at startup and runs every stage.
 */
@SpringBootTest(properties = {
        "causal.features.batch-enabled=true",
        "causal.analysis.input-dir=src/test/resources/fixtures/input"
})
@ActiveProfiles("test")
class BatchAnalysisRunnerTest {

    @Autowired
    private ArtifactStore artifactStore;

    @Autowired
    private AnalysisConfig analysisConfig;

    @Test
    @DisplayName("Startup run stores artifacts for every stage under the configured id")
    void startupRun() {
        var analysisId = analysisConfig.analysisId();

        assertThat(analysisId).isEqualTo("Hypertension_Alzheimers_degree2");
        assertThat(artifactStore.exists(analysisId)).isTrue();
        assertThat(artifactStore.listArtifacts(analysisId))
                .extracting(ArtifactStore.ArtifactMetadata::stage)
                .contains(AnalysisStage.values());
        assertThat(artifactStore.getTable(analysisId, AnalysisStage.INGEST, "metadata").column("source"))
                .containsExactly("Hypertension_Alzheimers_degree_2.R");
    }

    @Test
    @DisplayName("A missing input file names the generation step that produces it")
    void missingInput(@TempDir Path emptyDir) {
        var config = new AnalysisConfig();
        config.setInputDir(emptyDir.toString());
        var runner = new BatchAnalysisRunner(config, null, null, null);

        assertThatThrownBy(runner::resolveInput)
                .isInstanceOf(MissingPrerequisiteException.class)
                .hasMessageContaining("Hypertension_Alzheimers_degree_2.R")
                .hasMessageContaining("graph generation");
    }
}
