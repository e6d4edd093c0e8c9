package in.nextopen.service.signal;

public enum ExitReason {
    STOP_LOSS,
    TAKE_PROFIT,
    HOLDING_PERIOD
}
