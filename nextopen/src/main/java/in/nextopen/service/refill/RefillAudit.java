package in.nextopen.service.refill;

import in.nextopen.domain.data.Instrument;
import in.nextopen.domain.refill.RefillProgress;
import in.nextopen.domain.repository.InstrumentRepository;
import in.nextopen.domain.repository.RefillProgressRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Makes sure every active universe member has a refill_progress row before the refill loop.
 */
public final class RefillAudit {
    private static final Logger log = LoggerFactory.getLogger(RefillAudit.class);

    private final InstrumentRepository instrumentRepository;
    private final RefillProgressRepository progressRepository;

    public RefillAudit(InstrumentRepository instrumentRepository, RefillProgressRepository progressRepository) {
        this.instrumentRepository = instrumentRepository;
        this.progressRepository = progressRepository;
    }

    /**
     * @return number of progress rows created
     */
    public int run() {
        List<String> codes = instrumentRepository.findActive().stream().map(Instrument::code).toList();
        int inserted = progressRepository.insertMissing(codes);

        List<RefillProgress> incomplete = progressRepository.findIncomplete();
        long withErrors = incomplete.stream().filter(p -> p.lastError() != null).count();
        log.info("[REFILL] Audit: universe={} new_rows={} incomplete={} with_errors={}",
            codes.size(), inserted, incomplete.size(), withErrors);
        return inserted;
    }
}
