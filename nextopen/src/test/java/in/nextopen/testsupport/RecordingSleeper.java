package in.nextopen.testsupport;

import in.nextopen.infrastructure.broker.common.Sleeper;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Sleeper that records requested pauses instead of sleeping.
 */
public final class RecordingSleeper implements Sleeper {

    private final List<Duration> sleeps = new ArrayList<>();

    @Override
    public void sleep(Duration duration) {
        sleeps.add(duration);
    }

    public List<Duration> sleeps() {
        return sleeps;
    }

    public Duration total() {
        return sleeps.stream().reduce(Duration.ZERO, Duration::plus);
    }
}
