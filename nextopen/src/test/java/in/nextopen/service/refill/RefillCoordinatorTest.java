package in.nextopen.service.refill;

import in.nextopen.config.NextOpenConfig.RefillConfig;
import in.nextopen.domain.data.Instrument;
import in.nextopen.domain.job.JobStatus;
import in.nextopen.domain.job.StepResult;
import in.nextopen.domain.refill.RefillProgress;
import in.nextopen.domain.refill.RefillStatus;
import in.nextopen.infrastructure.broker.BrokerAuthenticationException;
import in.nextopen.infrastructure.broker.BrokerGateway;
import in.nextopen.infrastructure.lease.ExclusiveLease;
import in.nextopen.infrastructure.lease.FileExclusiveLease;
import in.nextopen.infrastructure.persistence.PostgresDailyBarRepository;
import in.nextopen.infrastructure.persistence.PostgresInstrumentRepository;
import in.nextopen.infrastructure.persistence.PostgresRefillProgressRepository;
import in.nextopen.testsupport.FakeBrokerGateway;
import in.nextopen.testsupport.FakeBrokerGateway.HistoryCall;
import in.nextopen.testsupport.RecordingSleeper;
import in.nextopen.testsupport.TestConfigs;
import in.nextopen.testsupport.TestDatabase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for RefillCoordinator against an H2 store and a scripted broker.
 *
 * Tests:
 * - Chunk boundaries over the horizon
 * - Resume from the last stored chunk after a failure
 * - Covered-through date never moves backwards
 * - Lease exclusivity
 * - Failure isolation across instruments
 * - Enrichment failures and listing dates
 */
class RefillCoordinatorTest {

    private static final LocalDate RUN_DATE = LocalDate.of(2026, 3, 5);

    @TempDir
    Path tempDir;

    private PostgresInstrumentRepository instruments;
    private PostgresRefillProgressRepository progress;
    private PostgresDailyBarRepository dailyBars;
    private FakeBrokerGateway broker;
    private RecordingSleeper sleeper;

    @BeforeEach
    void setUp() {
        DataSource dataSource = TestDatabase.create();
        instruments = new PostgresInstrumentRepository(dataSource);
        progress = new PostgresRefillProgressRepository(dataSource);
        dailyBars = new PostgresDailyBarRepository(dataSource);
        broker = new FakeBrokerGateway();
        sleeper = new RecordingSleeper();
    }

    private void listed(String code, LocalDate listedDate) {
        instruments.save(new Instrument(code, code + " Co", "KOSPI", listedDate, true));
    }

    private RefillConfig config(int maxCodes) {
        return TestConfigs.refill(10, 50, maxCodes, tempDir.resolve("refill.lock"));
    }

    private RefillCoordinator coordinator(RefillConfig config, List<EnrichmentTask> tasks) {
        return new RefillCoordinator(config, new FileExclusiveLease(config.lockPath()), instruments, progress,
            dailyBars, broker, new RefillAudit(instruments, progress), tasks, sleeper);
    }

    private RefillCoordinator coordinator() {
        return coordinator(config(0), List.of());
    }

    private static HistoryCall call(String code, int fromDaysBack, int toDaysBack) {
        return new HistoryCall(code, RUN_DATE.minusDays(fromDaysBack), RUN_DATE.minusDays(toDaysBack));
    }

    @Test
    void refillsHorizonInChunks() {
        listed("AAA", null);

        StepResult result = coordinator().run(RUN_DATE);

        assertEquals(JobStatus.SUCCESS, result.status());
        assertEquals(List.of(
            call("AAA", 50, 41),
            call("AAA", 40, 31),
            call("AAA", 30, 21),
            call("AAA", 20, 11),
            call("AAA", 10, 1)
        ), broker.historyLog());

        RefillProgress row = progress.findByCode("AAA").orElseThrow();
        assertEquals(RefillStatus.DONE, row.status());
        assertEquals(RUN_DATE.minusDays(1), row.coveredThroughDate());
        assertNull(row.lastError());
        assertEquals(Optional.of(RUN_DATE.minusDays(1)), dailyBars.latestTradeDate());
    }

    @Test
    void pausesBetweenFetchesButNotBeforeTheFirst() {
        listed("AAA", null);

        coordinator().run(RUN_DATE);

        assertEquals(4, sleeper.sleeps().size());
        assertEquals(Duration.ofMillis(400), sleeper.total());
    }

    @Test
    void resumesFromLastStoredChunkAfterFailure() {
        listed("AAA", null);
        broker.failHistoryCall(3);

        StepResult first = coordinator().run(RUN_DATE);

        assertEquals(JobStatus.SUCCESS, first.status(), "Stored chunks count as progress");
        RefillProgress failed = progress.findByCode("AAA").orElseThrow();
        assertNotEquals(RefillStatus.DONE, failed.status());
        assertEquals(RUN_DATE.minusDays(31), failed.coveredThroughDate());
        assertNotNull(failed.lastError());

        coordinator().run(RUN_DATE);

        List<HistoryCall> resumed = broker.historyLog().subList(3, broker.historyLog().size());
        assertEquals(List.of(
            call("AAA", 30, 21),
            call("AAA", 20, 11),
            call("AAA", 10, 1)
        ), resumed);
        RefillProgress done = progress.findByCode("AAA").orElseThrow();
        assertEquals(RefillStatus.DONE, done.status());
        assertEquals(RUN_DATE.minusDays(1), done.coveredThroughDate());
    }

    @Test
    void coveredThroughDateOnlyMovesForward() {
        listed("AAA", null);
        coordinator().run(RUN_DATE);

        assertFalse(progress.advance("AAA", RUN_DATE.minusDays(20)));
        assertEquals(RUN_DATE.minusDays(1), progress.findByCode("AAA").orElseThrow().coveredThroughDate());
    }

    @Test
    void completedInstrumentsAreNotFetchedAgain() {
        listed("AAA", null);
        coordinator().run(RUN_DATE);
        int calls = broker.historyLog().size();

        StepResult again = coordinator().run(RUN_DATE);

        assertEquals(JobStatus.SUCCESS, again.status());
        assertEquals("no incomplete instruments", again.message());
        assertEquals(calls, broker.historyLog().size());
    }

    @Test
    void heldLeaseSkipsTheRun() {
        listed("AAA", null);
        RefillConfig config = config(0);
        FileExclusiveLease other = new FileExclusiveLease(config.lockPath());

        try (ExclusiveLease.Lease ignored = other.tryAcquire().orElseThrow()) {
            StepResult result = coordinator(config, List.of()).run(RUN_DATE);

            assertEquals(JobStatus.SKIPPED, result.status());
        }
        assertTrue(broker.historyLog().isEmpty());
        assertTrue(progress.findByCode("AAA").isEmpty(), "Skipped run writes no progress");
    }

    @Test
    void failingInstrumentDoesNotStopOthers() {
        listed("AAA", null);
        listed("BBB", null);
        broker.failHistoryCall(1);

        StepResult result = coordinator().run(RUN_DATE);

        assertTrue(result.message().contains("done=1 failed=1"), result.message());
        RefillProgress aaa = progress.findByCode("AAA").orElseThrow();
        assertNull(aaa.coveredThroughDate());
        assertEquals(1, aaa.attempts());
        assertEquals(RefillStatus.DONE, progress.findByCode("BBB").orElseThrow().status());
    }

    @Test
    void everyFetchFailingFailsTheStep() {
        listed("AAA", null);
        broker.failHistoryCall(1);

        assertEquals(JobStatus.FAILED, coordinator().run(RUN_DATE).status());
    }

    @Test
    void authenticationFailureAbortsTheRun() {
        listed("AAA", null);
        RefillConfig config = config(0);
        BrokerGateway refusing = mock(BrokerGateway.class);
        when(refusing.getHistory(any(), any(), any()))
            .thenThrow(new BrokerAuthenticationException("FAKE", "getHistory", "token refused"));
        RefillCoordinator coordinator = new RefillCoordinator(config, new FileExclusiveLease(config.lockPath()),
            instruments, progress, dailyBars, refusing, new RefillAudit(instruments, progress), List.of(), sleeper);

        assertThrows(BrokerAuthenticationException.class, () -> coordinator.run(RUN_DATE));
        Optional<ExclusiveLease.Lease> again = new FileExclusiveLease(config.lockPath()).tryAcquire();
        assertTrue(again.isPresent(), "Lease released");
        again.get().close();
    }

    @Test
    void maxCodesLimitsOneRun() {
        listed("AAA", null);
        listed("BBB", null);
        listed("CCC", null);

        StepResult result = coordinator(config(2), List.of()).run(RUN_DATE);

        assertTrue(result.message().startsWith("targets=2"), result.message());
        assertNotEquals(RefillStatus.DONE, progress.findByCode("CCC").orElseThrow().status());
    }

    @Test
    void horizonStartsAtListingDate() {
        listed("AAA", RUN_DATE.minusDays(15));

        coordinator().run(RUN_DATE);

        assertEquals(List.of(
            call("AAA", 15, 6),
            call("AAA", 5, 1)
        ), broker.historyLog());
    }

    @Test
    void instrumentListedOnRunDateStaysOpenUntilItHasHistory() {
        listed("AAA", RUN_DATE);

        StepResult first = coordinator().run(RUN_DATE);

        assertTrue(first.message().contains("waiting=1"), first.message());
        assertTrue(broker.historyLog().isEmpty());
        RefillProgress open = progress.findByCode("AAA").orElseThrow();
        assertNotEquals(RefillStatus.DONE, open.status());
        assertNull(open.coveredThroughDate());

        LocalDate nextWeek = RUN_DATE.plusDays(7);
        coordinator().run(nextWeek);

        assertEquals(List.of(new HistoryCall("AAA", RUN_DATE, nextWeek.minusDays(1))), broker.historyLog());
        RefillProgress done = progress.findByCode("AAA").orElseThrow();
        assertEquals(RefillStatus.DONE, done.status());
        assertEquals(nextWeek.minusDays(1), done.coveredThroughDate());
    }

    @Test
    void enrichmentFailureIsTolerated() {
        listed("AAA", null);
        EnrichmentTask broken = mock(EnrichmentTask.class);
        when(broken.name()).thenReturn("broken");
        doThrow(new IllegalStateException("boom")).when(broken).run(RUN_DATE);
        List<EnrichmentTask> tasks = new ArrayList<>();
        tasks.add(broken);

        StepResult result = coordinator(config(0), tasks).run(RUN_DATE);

        assertEquals(JobStatus.SUCCESS, result.status());
        verify(broken).run(RUN_DATE);
        assertEquals(RefillStatus.DONE, progress.findByCode("AAA").orElseThrow().status());
    }

    @Test
    void listingDateEnrichmentShortensHorizonInSameRun() {
        listed("AAA", null);
        broker.listingDate("AAA", RUN_DATE.minusDays(8));

        coordinator(config(0), List.of(new ListingDateEnrichment(instruments, broker, 50))).run(RUN_DATE);

        assertEquals(List.of(call("AAA", 8, 1)), broker.historyLog());
    }

    @Test
    void rejectsNonPositiveChunk() {
        RefillConfig config = TestConfigs.refill(0, 50, 0, tempDir.resolve("refill.lock"));

        assertThrows(IllegalArgumentException.class, () -> coordinator(config, List.of()));
    }
}
