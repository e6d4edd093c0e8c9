package in.nextopen.infrastructure.broker;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Looks up the exchange listing date of an instrument.
 */
@FunctionalInterface
public interface ListingDateSource {

    Optional<LocalDate> getListingDate(String code);
}
