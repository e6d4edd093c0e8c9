package in.nextopen.domain.position;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Locally tracked holding, overwritten from broker balances on every sync.
 */
public record Position(
    String code,
    String name,
    int qty,
    BigDecimal avgPrice,
    LocalDate entryDate,
    Instant updatedAt
) {}
