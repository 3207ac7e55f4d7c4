package io.github.jakubt4.pmfusion;

import io.github.jakubt4.pmfusion.config.AlignmentProperties;
import io.github.jakubt4.pmfusion.config.CatalogProperties;
import io.github.jakubt4.pmfusion.model.AveragingMode;
import io.github.jakubt4.pmfusion.service.ConvergenceController;
import io.github.jakubt4.pmfusion.service.ConvergencePolicy;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.concurrent.ExecutorService;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class PmFusionApplicationTest {

    @Autowired
    private ConvergenceController convergenceController;

    @Autowired
    private AlignmentProperties alignmentProperties;

    @Autowired
    private CatalogProperties catalogProperties;

    @Autowired
    @Qualifier("frameWorkerPool")
    private ExecutorService frameWorkerPool;

    @Test
    void wiresTheRefinementEngine() {
        assertThat(convergenceController).isNotNull();
        assertThat(frameWorkerPool.isShutdown()).isFalse();
    }

    @Test
    void bindsEngineSettingsFromApplicationYaml() {
        assertThat(alignmentProperties.getPolicy()).isEqualTo(ConvergencePolicy.DRIFT);
        assertThat(alignmentProperties.getAveraging()).isEqualTo(AveragingMode.WEIGHTED);
        assertThat(alignmentProperties.getReferenceEpoch()).isEqualTo("J2016.0");
        assertThat(alignmentProperties.getAlpha()).isEqualTo(1e-6);
        assertThat(catalogProperties.getInflation6p()).isEqualTo(1.22);
        assertThat(catalogProperties.isOnly5p()).isFalse();
    }
}
