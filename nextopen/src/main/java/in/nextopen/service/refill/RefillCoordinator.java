package in.nextopen.service.refill;

import in.nextopen.config.NextOpenConfig.RefillConfig;
import in.nextopen.domain.data.DailyBar;
import in.nextopen.domain.data.Instrument;
import in.nextopen.domain.job.StepResult;
import in.nextopen.domain.refill.RefillProgress;
import in.nextopen.domain.repository.DailyBarRepository;
import in.nextopen.domain.repository.InstrumentRepository;
import in.nextopen.domain.repository.RefillProgressRepository;
import in.nextopen.infrastructure.broker.BrokerAuthenticationException;
import in.nextopen.infrastructure.broker.BrokerException;
import in.nextopen.infrastructure.broker.BrokerGateway;
import in.nextopen.infrastructure.broker.common.Sleeper;
import in.nextopen.infrastructure.lease.ExclusiveLease;
import in.nextopen.infrastructure.lease.ExclusiveLease.Lease;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Resumable historical backfill.
 *
 * Under an exclusive lease: run enrichment tasks, run the audit, then fetch every incomplete
 * instrument forward in chunks from its covered-through date up to the day before the run date.
 * Bars are stored before the cursor moves, so a crash repeats at most one chunk and never
 * leaves a gap. A failing instrument keeps the progress of its completed chunks and the run
 * moves on to the next one.
 */
public final class RefillCoordinator {
    private static final Logger log = LoggerFactory.getLogger(RefillCoordinator.class);

    private final RefillConfig config;
    private final ExclusiveLease lease;
    private final InstrumentRepository instrumentRepository;
    private final RefillProgressRepository progressRepository;
    private final DailyBarRepository dailyBarRepository;
    private final BrokerGateway gateway;
    private final RefillAudit audit;
    private final List<EnrichmentTask> enrichmentTasks;
    private final Sleeper sleeper;

    private boolean firstCall;

    public RefillCoordinator(RefillConfig config, ExclusiveLease lease, InstrumentRepository instrumentRepository,
                             RefillProgressRepository progressRepository, DailyBarRepository dailyBarRepository,
                             BrokerGateway gateway, RefillAudit audit, List<EnrichmentTask> enrichmentTasks,
                             Sleeper sleeper) {
        if (config.chunkDays() <= 0) {
            throw new IllegalArgumentException("Chunk days must be positive");
        }
        this.config = config;
        this.lease = lease;
        this.instrumentRepository = instrumentRepository;
        this.progressRepository = progressRepository;
        this.dailyBarRepository = dailyBarRepository;
        this.gateway = gateway;
        this.audit = audit;
        this.enrichmentTasks = List.copyOf(enrichmentTasks);
        this.sleeper = sleeper;
    }

    public StepResult run(LocalDate runDate) {
        Optional<Lease> held = lease.tryAcquire();
        if (held.isEmpty()) {
            log.info("[REFILL] Another refill run is active, exiting");
            return StepResult.skipped("refill lease held by another run");
        }
        try (Lease ignored = held.get()) {
            return refill(runDate);
        }
    }

    private StepResult refill(LocalDate runDate) {
        for (EnrichmentTask task : enrichmentTasks) {
            try {
                task.run(runDate);
            } catch (RuntimeException e) {
                log.warn("[REFILL] Enrichment {} failed, continuing: {}", task.name(), e.getMessage());
            }
        }

        audit.run();

        Map<String, Instrument> universe = instrumentRepository.findActive().stream()
            .collect(Collectors.toMap(Instrument::code, Function.identity()));
        List<RefillProgress> targets = progressRepository.findIncomplete().stream()
            .filter(progress -> universe.containsKey(progress.code()))
            .toList();
        if (config.maxCodes() > 0 && targets.size() > config.maxCodes()) {
            targets = targets.subList(0, config.maxCodes());
        }
        if (targets.isEmpty()) {
            log.info("[REFILL] No incomplete instruments");
            return StepResult.success("no incomplete instruments");
        }

        LocalDate horizonEnd = runDate.minusDays(1);
        int completed = 0;
        int failed = 0;
        int waiting = 0;
        int chunks = 0;
        firstCall = true;
        log.info("[REFILL] {} instruments to refill through {}", targets.size(), horizonEnd);

        for (RefillProgress progress : targets) {
            String code = progress.code();
            progressRepository.markInProgress(code);
            ChunkOutcome outcome = refillInstrument(universe.get(code), progress, runDate, horizonEnd);
            chunks += outcome.chunks();
            if (outcome.error() != null) {
                failed++;
                progressRepository.recordError(code, outcome.error().getMessage());
                log.warn("[REFILL] {} failed after {} chunks: {}", code, outcome.chunks(), outcome.error().getMessage());
            } else if (outcome.covered() != null && !outcome.covered().isBefore(horizonEnd)) {
                progressRepository.markDone(code);
                completed++;
                log.info("[REFILL] {} DONE ({} chunks)", code, outcome.chunks());
            } else {
                waiting++;
                log.info("[REFILL] {} has no trading days before {} yet, left open", code, runDate);
            }
        }

        String summary = String.format("targets=%d done=%d failed=%d waiting=%d chunks=%d",
            targets.size(), completed, failed, waiting, chunks);
        log.info("[REFILL] {}", summary);
        return failed > 0 && completed == 0 && chunks == 0 ? StepResult.failed(summary) : StepResult.success(summary);
    }

    private ChunkOutcome refillInstrument(Instrument instrument, RefillProgress progress,
                                          LocalDate runDate, LocalDate horizonEnd) {
        LocalDate horizonStart = runDate.minusDays(config.horizonDays());
        if (instrument.listedDate() != null && instrument.listedDate().isAfter(horizonStart)) {
            horizonStart = instrument.listedDate();
        }
        LocalDate covered = progress.coveredThroughDate();
        int chunks = 0;

        while (covered == null || covered.isBefore(horizonEnd)) {
            LocalDate from = covered == null || covered.isBefore(horizonStart) ? horizonStart : covered.plusDays(1);
            if (from.isAfter(horizonEnd)) {
                break;
            }
            LocalDate to = from.plusDays(config.chunkDays() - 1L);
            if (to.isAfter(horizonEnd)) {
                to = horizonEnd;
            }

            try {
                if (!firstCall) {
                    sleeper.sleep(config.cooldown());
                }
                firstCall = false;
                List<DailyBar> bars = gateway.getHistory(instrument.code(), from, to);
                dailyBarRepository.upsertAll(bars);
                log.debug("[REFILL] {} {}..{}: {} bars", instrument.code(), from, to, bars.size());
            } catch (BrokerAuthenticationException e) {
                throw e;
            } catch (BrokerException e) {
                return new ChunkOutcome(chunks, covered, e);
            }

            progressRepository.advance(instrument.code(), to);
            covered = to;
            chunks++;
        }
        return new ChunkOutcome(chunks, covered, null);
    }

    private record ChunkOutcome(int chunks, LocalDate covered, RuntimeException error) {}
}
