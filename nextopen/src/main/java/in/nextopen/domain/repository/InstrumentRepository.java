package in.nextopen.domain.repository;

import in.nextopen.domain.data.Instrument;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface InstrumentRepository {

    List<Instrument> findActive();

    Optional<Instrument> findByCode(String code);

    void save(Instrument instrument);

    void updateListedDate(String code, LocalDate listedDate);
}
