package in.nextopen.domain.order;

import java.util.EnumSet;
import java.util.Set;

/**
 * Order lifecycle status.
 *
 * <pre>
 * PENDING -> SENT -> {DONE, PARTIAL, NOT_FOUND}
 * PARTIAL -> {PARTIAL, DONE}
 * NOT_FOUND -> {NOT_FOUND, PARTIAL, DONE}
 * SENT | PARTIAL | NOT_FOUND -> CANCELLED
 * any non-terminal -> ERROR
 * </pre>
 *
 * PENDING rows are never transitioned backwards; a close re-run replaces them wholesale.
 */
public enum OrderStatus {
    PENDING,    // Materialized by close, not yet sent
    SENT,       // Accepted by broker
    PARTIAL,    // Partially filled
    NOT_FOUND,  // Broker has no record (rejected, expired or not yet visible)
    DONE,       // Fully filled
    CANCELLED,  // Remainder cancelled
    ERROR;      // Needs manual intervention

    /** Statuses the sync and cancel steps act on. */
    public static final Set<OrderStatus> AWAITING_FILL = EnumSet.of(SENT, PARTIAL, NOT_FOUND);

    public boolean isTerminal() {
        return this == DONE || this == CANCELLED || this == ERROR;
    }

    public boolean canTransitionTo(OrderStatus next) {
        if (next == ERROR) {
            return !isTerminal();
        }
        return switch (this) {
            case PENDING -> next == SENT;
            case SENT -> next == DONE || next == PARTIAL || next == NOT_FOUND || next == CANCELLED;
            case PARTIAL -> next == PARTIAL || next == DONE || next == CANCELLED;
            case NOT_FOUND -> next == NOT_FOUND || next == PARTIAL || next == DONE || next == CANCELLED;
            case DONE, CANCELLED, ERROR -> false;
        };
    }
}
