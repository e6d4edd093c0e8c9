package in.nextopen.infrastructure.lease;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Optional;

/**
 * ExclusiveLease backed by an OS file lock.
 *
 * The lock dies with the process, so a crashed holder never blocks the next run. The lock
 * file itself is left in place; only the lock on it matters.
 */
public final class FileExclusiveLease implements ExclusiveLease {
    private static final Logger log = LoggerFactory.getLogger(FileExclusiveLease.class);

    private final Path lockPath;

    public FileExclusiveLease(Path lockPath) {
        this.lockPath = lockPath;
    }

    @Override
    public Optional<Lease> tryAcquire() {
        FileChannel channel = null;
        try {
            Path parent = lockPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            channel = FileChannel.open(lockPath, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            FileLock lock;
            try {
                lock = channel.tryLock();
            } catch (OverlappingFileLockException e) {
                lock = null;
            }
            if (lock == null) {
                channel.close();
                log.info("[LEASE] {} is held by another run", lockPath);
                return Optional.empty();
            }

            channel.truncate(0);
            channel.write(ByteBuffer.wrap(
                (ProcessHandle.current().pid() + "\n").getBytes(StandardCharsets.UTF_8)));
            log.debug("[LEASE] Acquired {}", lockPath);
            return Optional.of(new FileLease(channel, lock));

        } catch (IOException e) {
            if (channel != null) {
                try {
                    channel.close();
                } catch (IOException closeError) {
                    e.addSuppressed(closeError);
                }
            }
            throw new UncheckedIOException("Cannot open lock file " + lockPath, e);
        }
    }

    private final class FileLease implements Lease {
        private final FileChannel channel;
        private final FileLock lock;

        private FileLease(FileChannel channel, FileLock lock) {
            this.channel = channel;
            this.lock = lock;
        }

        @Override
        public void close() {
            try {
                if (lock.isValid()) {
                    lock.release();
                }
                channel.close();
                log.debug("[LEASE] Released {}", lockPath);
            } catch (IOException e) {
                log.warn("[LEASE] Failed to release {}: {}", lockPath, e.getMessage());
            }
        }
    }
}
