package com.humanizer.infrastructure.rewrite.pipeline;

import com.humanizer.domain.rewrite.exception.InvalidConfigurationException;
import com.humanizer.domain.rewrite.model.HumanizeResult;
import com.humanizer.domain.rewrite.model.RewriteConfiguration;
import com.humanizer.domain.rewrite.model.RewriteOverrides;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Random;

import static com.humanizer.infrastructure.rewrite.RewriteComponents.REGISTRY;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RewriteEngineTest {

    @Mock
    private RewritePipeline pipeline;

    private final Random random = new Random(1);

    private RewriteEngine engine;

    @BeforeEach
    void setUp() {
        engine = new RewriteEngine(REGISTRY, pipeline, random);
    }

    @Test
    @DisplayName("resolved configuration and the shared random source reach the pipeline")
    void delegates() {
        HumanizeResult expected = new HumanizeResult("Hi.", "Hi.", 1, 1, 1, 1, "casual");
        when(pipeline.execute(eq("Hi."), any(RewriteConfiguration.class), eq(random))).thenReturn(expected);

        HumanizeResult result = engine.humanize("Hi.", "Casual", RewriteOverrides.ofProbabilities(0.5, null, null, null));

        assertThat(result).isSameAs(expected);
        ArgumentCaptor<RewriteConfiguration> captor = ArgumentCaptor.forClass(RewriteConfiguration.class);
        verify(pipeline).execute(eq("Hi."), captor.capture(), eq(random));
        assertThat(captor.getValue().styleName()).isEqualTo("casual");
        assertThat(captor.getValue().profile().synonymProbability()).isEqualTo(0.5);
    }

    @Test
    @DisplayName("invalid configuration is rejected before any pass runs")
    void rejectsBeforeRunning() {
        assertThatThrownBy(() -> engine.humanize("Hi.", "pirate", null))
                .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> engine.humanize("Hi.", "balanced", RewriteOverrides.ofProbabilities(2.0, null, null, null)))
                .isInstanceOf(InvalidConfigurationException.class);

        verifyNoInteractions(pipeline);
    }
}
