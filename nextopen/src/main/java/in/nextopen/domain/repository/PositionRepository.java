package in.nextopen.domain.repository;

import in.nextopen.domain.position.Position;

import java.util.List;

public interface PositionRepository {

    List<Position> findAll();

    /**
     * Overwrite the table with {@code positions}. Codes that are not listed are deleted;
     * codes that were already held keep their stored entry date.
     */
    void replaceAll(List<Position> positions);
}
