package in.nextopen.domain.repository;

import in.nextopen.domain.refill.RefillProgress;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for per-instrument backfill progress.
 */
public interface RefillProgressRepository {

    Optional<RefillProgress> findByCode(String code);

    /**
     * Rows whose status is not DONE, ordered by code.
     */
    List<RefillProgress> findIncomplete();

    /**
     * Insert an unset row for every code without one. Returns the number inserted.
     */
    int insertMissing(Collection<String> codes);

    void markInProgress(String code);

    /**
     * Move the covered-through date forward. Never moves it backwards; returns false
     * when the stored date is already at or past {@code coveredThrough}.
     */
    boolean advance(String code, LocalDate coveredThrough);

    void markDone(String code);

    void recordError(String code, String error);
}
