package in.nextopen.service.refill;

import in.nextopen.config.NextOpenConfig.RefillConfig;
import in.nextopen.domain.data.DailyBar;
import in.nextopen.domain.data.Instrument;
import in.nextopen.domain.job.StepResult;
import in.nextopen.domain.repository.DailyBarRepository;
import in.nextopen.domain.repository.InstrumentRepository;
import in.nextopen.domain.repository.RefillProgressRepository;
import in.nextopen.infrastructure.broker.BrokerAuthenticationException;
import in.nextopen.infrastructure.broker.BrokerException;
import in.nextopen.infrastructure.broker.BrokerGateway;
import in.nextopen.infrastructure.broker.common.Sleeper;
import in.nextopen.infrastructure.lease.ExclusiveLease;
import in.nextopen.infrastructure.lease.ExclusiveLease.Lease;
import in.nextopen.service.calendar.SessionCalendar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Daily top-up of stored bars.
 *
 * For every active instrument that already has bars, fetches from the session after its last
 * stored trade date through the day before the run date. Instruments without any bars belong
 * to the refill. Shares the refill lease, so the two never call the brokerage at the same time.
 */
public final class IncrementalBarLoader {
    private static final Logger log = LoggerFactory.getLogger(IncrementalBarLoader.class);

    private final RefillConfig config;
    private final ExclusiveLease lease;
    private final InstrumentRepository instrumentRepository;
    private final RefillProgressRepository progressRepository;
    private final DailyBarRepository dailyBarRepository;
    private final BrokerGateway gateway;
    private final Sleeper sleeper;

    public IncrementalBarLoader(RefillConfig config, ExclusiveLease lease, InstrumentRepository instrumentRepository,
                                RefillProgressRepository progressRepository, DailyBarRepository dailyBarRepository,
                                BrokerGateway gateway, Sleeper sleeper) {
        if (config.chunkDays() <= 0) {
            throw new IllegalArgumentException("Chunk days must be positive");
        }
        this.config = config;
        this.lease = lease;
        this.instrumentRepository = instrumentRepository;
        this.progressRepository = progressRepository;
        this.dailyBarRepository = dailyBarRepository;
        this.gateway = gateway;
        this.sleeper = sleeper;
    }

    public StepResult run(LocalDate runDate) {
        Optional<Lease> held = lease.tryAcquire();
        if (held.isEmpty()) {
            log.info("[DAILY] Refill lease is held, exiting");
            return StepResult.skipped("refill lease held by another run");
        }
        try (Lease ignored = held.get()) {
            return load(runDate);
        }
    }

    private StepResult load(LocalDate runDate) {
        LocalDate through = runDate.minusDays(1);
        List<Instrument> instruments = instrumentRepository.findActive();
        int updated = 0;
        int current = 0;
        int unseeded = 0;
        int failed = 0;
        int chunks = 0;
        boolean firstCall = true;

        for (Instrument instrument : instruments) {
            String code = instrument.code();
            Optional<LocalDate> last = dailyBarRepository.latestTradeDate(code);
            if (last.isEmpty()) {
                unseeded++;
                continue;
            }
            LocalDate from = last.get().plusDays(1);
            while (!SessionCalendar.isBusinessDay(from)) {
                from = from.plusDays(1);
            }
            if (from.isAfter(through)) {
                current++;
                continue;
            }

            try {
                while (!from.isAfter(through)) {
                    LocalDate to = from.plusDays(config.chunkDays() - 1L);
                    if (to.isAfter(through)) {
                        to = through;
                    }
                    if (!firstCall) {
                        sleeper.sleep(config.cooldown());
                    }
                    firstCall = false;
                    List<DailyBar> bars = gateway.getHistory(code, from, to);
                    dailyBarRepository.upsertAll(bars);
                    progressRepository.advance(code, to);
                    chunks++;
                    log.debug("[DAILY] {} {}..{}: {} bars", code, from, to, bars.size());
                    from = to.plusDays(1);
                }
                updated++;
            } catch (BrokerAuthenticationException e) {
                throw e;
            } catch (BrokerException e) {
                failed++;
                log.warn("[DAILY] {} failed from {}: {}", code, from, e.getMessage());
            }
        }

        String summary = String.format("codes=%d updated=%d current=%d unseeded=%d failed=%d chunks=%d",
            instruments.size(), updated, current, unseeded, failed, chunks);
        log.info("[DAILY] {}", summary);
        return failed > 0 && updated == 0 && chunks == 0 ? StepResult.failed(summary) : StepResult.success(summary);
    }
}
