package com.mlbbai.hero_analysis_engine.scheduler;

import com.mlbbai.hero_analysis_engine.config.HeroEngineProperties;
import com.mlbbai.hero_analysis_engine.model.SnapshotStatus;
import com.mlbbai.hero_analysis_engine.service.HeroSnapshotStore;
import com.mlbbai.hero_analysis_engine.service.event.HeroSnapshotRefreshedEvent;
import com.mlbbai.hero_analysis_engine.service.provider.HeroDataException;
import com.mlbbai.hero_analysis_engine.service.provider.HeroStatsNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static com.mlbbai.hero_analysis_engine.testutil.HeroFixtures.hero;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class HeroStatsRefreshSchedulerTest {

    private static final Instant NOW = Instant.parse("2026-10-19T10:00:00Z");

    @Mock
    private HeroStatsNormalizer normalizer;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private HeroSnapshotStore store;
    private HeroEngineProperties properties;
    private List<Runnable> submitted;
    private HeroStatsRefreshScheduler scheduler;

    @BeforeEach
    void setUp() {
        store = new HeroSnapshotStore();
        properties = new HeroEngineProperties();
        submitted = new ArrayList<>();
        scheduler = newScheduler(submitted::add);
    }

    private HeroStatsRefreshScheduler newScheduler(Executor executor) {
        return new HeroStatsRefreshScheduler(normalizer, store, eventPublisher, executor,
            Clock.fixed(NOW, ZoneOffset.UTC), properties);
    }

    @Test
    void successfulRefreshCommitsAndPublishesEvent() {
        given(normalizer.fetchAll()).willReturn(Mono.just(List.of(hero("1", "Ling", "Assassin", 0.56, 0.3, 0.2))));

        assertThat(scheduler.runGuarded("scheduled")).isTrue();

        assertThat(store.current().status()).isEqualTo(SnapshotStatus.READY);
        assertThat(store.current().lastUpdated()).isEqualTo(NOW);
        ArgumentCaptor<Object> event = ArgumentCaptor.forClass(Object.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertThat(event.getValue()).isInstanceOf(HeroSnapshotRefreshedEvent.class);
        HeroSnapshotRefreshedEvent refreshed = (HeroSnapshotRefreshedEvent) event.getValue();
        assertThat(refreshed.getHeroCount()).isEqualTo(1);
        assertThat(refreshed.getTrigger()).isEqualTo("scheduled");
        assertThat(scheduler.isRunning()).isFalse();
    }

    @Test
    void fetchErrorIsRecordedAsFailedRefresh() {
        given(normalizer.fetchAll()).willReturn(Mono.error(
            new HeroDataException(HeroDataException.Reason.FETCH_TIMEOUT, "Timed out")));

        scheduler.runGuarded("scheduled");

        assertThat(store.current().status()).isEqualTo(SnapshotStatus.ERROR);
        assertThat(store.current().consecutiveFailures()).isEqualTo(1);
        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }

    @Test
    void emptyResultKeepsPriorHeroesAsStale() {
        store.commitSuccess(List.of(hero("1", "Ling", "Assassin", 0.56, 0.3, 0.2)), NOW.minusSeconds(3600));
        given(normalizer.fetchAll()).willReturn(Mono.just(List.of()));

        scheduler.runGuarded("scheduled");

        assertThat(store.current().status()).isEqualTo(SnapshotStatus.STALE);
        assertThat(store.current().heroCount()).isEqualTo(1);
        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }

    @Test
    void completedWithoutValueIsRecordedAsFailedRefresh() {
        given(normalizer.fetchAll()).willReturn(Mono.empty());

        assertThat(scheduler.runGuarded("manual")).isTrue();

        assertThat(store.current().status()).isEqualTo(SnapshotStatus.ERROR);
        assertThat(store.current().consecutiveFailures()).isEqualTo(1);
        assertThat(scheduler.isRunning()).isFalse();
        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }

    @Test
    void manualTriggerWhileRunningIsRejected() {
        assertThat(scheduler.triggerManualRefresh()).isEqualTo(HeroStatsRefreshScheduler.TriggerResult.STARTED);
        assertThat(scheduler.isRunning()).isTrue();

        assertThat(scheduler.triggerManualRefresh()).isEqualTo(HeroStatsRefreshScheduler.TriggerResult.ALREADY_RUNNING);
        assertThat(submitted).hasSize(1);
    }

    @Test
    void scheduledTickIsSkippedWhileManualRefreshIsPending() {
        scheduler.triggerManualRefresh();

        scheduler.scheduledRefresh();

        verifyNoInteractions(normalizer);
    }

    @Test
    void guardIsReleasedAfterManualRefreshCompletes() {
        given(normalizer.fetchAll()).willReturn(Mono.just(List.of(hero("1", "Ling", "Assassin", 0.56, 0.3, 0.2))));
        scheduler.triggerManualRefresh();

        submitted.get(0).run();

        assertThat(scheduler.isRunning()).isFalse();
        assertThat(store.current().status()).isEqualTo(SnapshotStatus.READY);
        assertThat(scheduler.triggerManualRefresh()).isEqualTo(HeroStatsRefreshScheduler.TriggerResult.STARTED);
    }

    @Test
    void rejectedSubmissionReleasesGuard() {
        HeroStatsRefreshScheduler rejecting = newScheduler(task -> {
            throw new RejectedExecutionException("queue full");
        });

        assertThatThrownBy(rejecting::triggerManualRefresh).isInstanceOf(IllegalStateException.class);
        assertThat(rejecting.isRunning()).isFalse();
    }

    @Test
    void startupRefreshHonoursSwitch() {
        properties.getRefresh().setRunOnStartup(false);
        HeroStatsRefreshScheduler disabled = newScheduler(submitted::add);

        disabled.refreshOnStartup();

        verifyNoInteractions(normalizer);
        assertThat(store.current().status()).isEqualTo(SnapshotStatus.INITIALIZING);
    }
}
