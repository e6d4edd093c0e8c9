package in.nextopen.bootstrap;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Parsed command line: {@code <command> [--date=YYYY-MM-DD]}.
 */
public record Invocation(Command command, Optional<LocalDate> date) {

    static final String USAGE = "usage: nextopen <close|open|sync|cancel|refill|daily|status> [--date=YYYY-MM-DD]";

    /**
     * @throws IllegalArgumentException on any usage error
     */
    public static Invocation parse(String[] args) {
        if (args == null || args.length == 0) {
            throw new IllegalArgumentException("Missing command");
        }
        Command command = Command.parse(args[0]);
        LocalDate date = null;
        for (int i = 1; i < args.length; i++) {
            String arg = args[i];
            if (!arg.startsWith("--date=")) {
                throw new IllegalArgumentException("Unknown argument: " + arg);
            }
            if (date != null) {
                throw new IllegalArgumentException("--date given more than once");
            }
            try {
                date = LocalDate.parse(arg.substring("--date=".length()));
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Invalid --date: " + arg.substring("--date=".length()));
            }
        }
        return new Invocation(command, Optional.ofNullable(date));
    }
}
