package in.nextopen.service.refill;

import in.nextopen.domain.data.Instrument;
import in.nextopen.domain.repository.InstrumentRepository;
import in.nextopen.infrastructure.broker.BrokerException;
import in.nextopen.infrastructure.broker.ListingDateSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Fills in missing listing dates so backfill horizons start at the listing instead of the
 * configured horizon. Looks up at most {@code maxLookups} instruments per run.
 */
public final class ListingDateEnrichment implements EnrichmentTask {
    private static final Logger log = LoggerFactory.getLogger(ListingDateEnrichment.class);

    private final InstrumentRepository instrumentRepository;
    private final ListingDateSource source;
    private final int maxLookups;

    public ListingDateEnrichment(InstrumentRepository instrumentRepository, ListingDateSource source, int maxLookups) {
        this.instrumentRepository = instrumentRepository;
        this.source = source;
        this.maxLookups = maxLookups;
    }

    @Override
    public String name() {
        return "listing-date";
    }

    @Override
    public void run(LocalDate runDate) {
        List<Instrument> missing = instrumentRepository.findActive().stream()
            .filter(instrument -> instrument.listedDate() == null)
            .limit(maxLookups)
            .toList();
        int updated = 0;
        for (Instrument instrument : missing) {
            try {
                Optional<LocalDate> listed = source.getListingDate(instrument.code());
                if (listed.isPresent() && !listed.get().isAfter(runDate)) {
                    instrumentRepository.updateListedDate(instrument.code(), listed.get());
                    updated++;
                }
            } catch (BrokerException e) {
                log.warn("[REFILL] Listing date lookup failed for {}: {}", instrument.code(), e.getMessage());
            }
        }
        log.info("[REFILL] Listing dates filled for {}/{} instruments", updated, missing.size());
    }
}
