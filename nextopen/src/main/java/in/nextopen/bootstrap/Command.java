package in.nextopen.bootstrap;

import java.util.Locale;

/**
 * CLI commands. Each trading command is one step of the daily loop.
 */
public enum Command {
    CLOSE("close", false),
    OPEN("open", true),
    SYNC("sync", true),
    CANCEL("cancel", true),
    REFILL("refill", true),
    DAILY("daily", true),
    STATUS("status", false);

    private final String jobName;
    private final boolean requiresBroker;

    Command(String jobName, boolean requiresBroker) {
        this.jobName = jobName;
        this.requiresBroker = requiresBroker;
    }

    public String jobName() {
        return jobName;
    }

    public boolean requiresBroker() {
        return requiresBroker;
    }

    public static Command parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown command: " + value);
        }
    }
}
