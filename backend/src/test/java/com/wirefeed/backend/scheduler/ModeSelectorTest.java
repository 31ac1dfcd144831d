package com.wirefeed.backend.scheduler;

import static com.wirefeed.backend.testing.SiteFixtures.CLOCK;
import static com.wirefeed.backend.testing.SiteFixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.wirefeed.backend.config.ScrapingConfig;
import com.wirefeed.backend.ingest.IngestStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class ModeSelectorTest {

    @Mock
    private IngestStore ingestStore;

    private ModeSelector modeSelector;

    @BeforeEach
    void setUp() {
        modeSelector = new ModeSelector(ingestStore, new ScrapingConfig(), CLOCK);
    }

    @Test
    @DisplayName("should pick bulk mode for an empty store on the first run")
    void shouldPickBulkForEmptyStore() {
        when(ingestStore.isEmpty()).thenReturn(true);

        ScrapePlan plan = modeSelector.select();

        assertThat(plan.getMode()).isEqualTo(RunMode.BULK);
        assertThat(plan.getMaxPages()).isEqualTo(50);
        assertThat(plan.getWindow().getCutoff()).isEqualTo(NOW.minusDays(30));
        assertThat(plan.getMode().getRunType()).isEqualTo("initial");
    }

    @Test
    @DisplayName("should pick incremental mode when the store has articles")
    void shouldPickIncrementalForPopulatedStore() {
        when(ingestStore.isEmpty()).thenReturn(false);

        ScrapePlan plan = modeSelector.select();

        assertThat(plan.getMode()).isEqualTo(RunMode.INCREMENTAL);
        assertThat(plan.getMaxPages()).isEqualTo(5);
        assertThat(plan.getWindow().getCutoff()).isEqualTo(NOW.minusHours(1));
    }

    @Test
    @DisplayName("should stay incremental after the first run without checking the store again")
    void shouldStayIncrementalAfterFirstRun() {
        when(ingestStore.isEmpty()).thenReturn(true);
        assertThat(modeSelector.select().getMode()).isEqualTo(RunMode.BULK);

        modeSelector.markCompleted();

        assertThat(modeSelector.select().getMode()).isEqualTo(RunMode.INCREMENTAL);
        assertThat(modeSelector.isFirstRun()).isFalse();
        verify(ingestStore, times(1)).isEmpty();
    }

    @Test
    @DisplayName("should fall back to incremental when the emptiness check fails")
    void shouldFallBackWhenCheckFails() {
        when(ingestStore.isEmpty()).thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThat(modeSelector.select().getMode()).isEqualTo(RunMode.INCREMENTAL);
    }

    @Test
    @DisplayName("should build a manual plan with the bulk page bound")
    void shouldBuildManualPlan() {
        ScrapePlan plan = modeSelector.manual(7);

        assertThat(plan.getMode()).isEqualTo(RunMode.MANUAL);
        assertThat(plan.getMaxPages()).isEqualTo(50);
        assertThat(plan.getWindow().getCutoff()).isEqualTo(NOW.minusDays(7));
    }
}
