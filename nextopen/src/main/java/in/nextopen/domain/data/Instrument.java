package in.nextopen.domain.data;

import java.time.LocalDate;

/**
 * Universe member.
 */
public record Instrument(
    String code,
    String name,
    String market,
    LocalDate listedDate,
    boolean active
) {

    public boolean isKospi() {
        return market != null && market.toUpperCase().contains("KOSPI");
    }
}
