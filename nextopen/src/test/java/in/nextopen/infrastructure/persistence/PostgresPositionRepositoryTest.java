package in.nextopen.infrastructure.persistence;

import in.nextopen.domain.position.Position;
import in.nextopen.testsupport.TestDatabase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PostgresPositionRepositoryTest {

    private PostgresPositionRepository repository;

    @BeforeEach
    void setUp() {
        repository = new PostgresPositionRepository(TestDatabase.create());
    }

    @Test
    void replaceAllOverwritesAndKeepsEntryDates() {
        LocalDate first = LocalDate.of(2026, 3, 2);
        LocalDate second = LocalDate.of(2026, 3, 5);
        repository.replaceAll(List.of(
            new Position("AAA", "A Co", 10, new BigDecimal("101"), first, null),
            new Position("BBB", "B Co", 5, new BigDecimal("50"), first, null)));

        repository.replaceAll(List.of(
            new Position("AAA", "A Co", 15, new BigDecimal("102"), second, null),
            new Position("CCC", "C Co", 1, new BigDecimal("7"), second, null)));

        List<Position> positions = repository.findAll();
        assertEquals(List.of("AAA", "CCC"), positions.stream().map(Position::code).toList());
        assertEquals(15, positions.get(0).qty());
        assertEquals(first, positions.get(0).entryDate(), "Held code keeps its entry date");
        assertEquals(second, positions.get(1).entryDate());
        assertNotNull(positions.get(0).updatedAt());
    }

    @Test
    void emptyBalancesClearPositions() {
        repository.replaceAll(List.of(new Position("AAA", "A Co", 10, BigDecimal.TEN, LocalDate.of(2026, 3, 2), null)));

        repository.replaceAll(List.of());

        assertTrue(repository.findAll().isEmpty());
    }
}
