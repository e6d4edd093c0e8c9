package in.nextopen.infrastructure.broker.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes a registry in Prometheus text format for the node-exporter textfile collector.
 *
 * The file is written to a temporary sibling and moved into place so the collector never
 * reads a partial file. Example output:
 * <pre>
 * # HELP broker_calls_total Total number of brokerage HTTP exchanges
 * # TYPE broker_calls_total counter
 * broker_calls_total{broker="KIS",operation="createOrder",outcome="OK",} 3.0
 * </pre>
 */
public class MetricsTextfileWriter {
    private static final Logger log = LoggerFactory.getLogger(MetricsTextfileWriter.class);

    private final CollectorRegistry registry;

    public MetricsTextfileWriter(CollectorRegistry registry) {
        this.registry = registry;
    }

    /**
     * Write {@code <dir>/<name>.prom}. Failures are logged, never thrown.
     */
    public boolean write(Path dir, String name) {
        Path target = dir.resolve(name + ".prom");
        Path temp = dir.resolve(name + ".prom.tmp");
        try {
            Files.createDirectories(dir);
            try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                TextFormat.write004(writer, registry.metricFamilySamples());
            }
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("[METRICS] Wrote {}", target);
            return true;
        } catch (IOException e) {
            log.warn("[METRICS] Failed to write {}: {}", target, e.getMessage());
            return false;
        }
    }
}
