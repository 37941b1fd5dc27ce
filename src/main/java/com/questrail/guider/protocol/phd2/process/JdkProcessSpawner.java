package com.questrail.guider.protocol.phd2.process;

import com.questrail.guider.api.ProcessStartFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.concurrent.TimeUnit;

/**
 * {@link ProcessSpawner} backed by {@link ProcessBuilder}.
 */
public final class JdkProcessSpawner implements ProcessSpawner
{
    private static final Logger log = LoggerFactory.getLogger(JdkProcessSpawner.class);

    @Override
    public ManagedProcess spawn(Path executable, Map<String, String> environment)
    {
        Objects.requireNonNull(executable, "executable");
        Objects.requireNonNull(environment, "environment");

        ProcessBuilder builder = new ProcessBuilder(executable.toString())
                .redirectInput(ProcessBuilder.Redirect.PIPE)
                .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                .redirectError(ProcessBuilder.Redirect.DISCARD);
        builder.environment().putAll(environment);

        final Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new ProcessStartFailedException("Failed to start " + executable + ": " + e.getMessage(), e);
        }
        log.info("Started guider controller {} (pid {})", executable, process.pid());
        return new JdkManagedProcess(process);
    }

    private static final class JdkManagedProcess implements ManagedProcess
    {
        private final Process process;

        JdkManagedProcess(Process process)
        {
            this.process = process;
        }

        @Override
        public long pid()
        {
            return process.pid();
        }

        @Override
        public boolean isAlive()
        {
            return process.isAlive();
        }

        @Override
        public OptionalInt exitCode()
        {
            return process.isAlive() ? OptionalInt.empty() : OptionalInt.of(process.exitValue());
        }

        @Override
        public void destroyForcibly()
        {
            process.destroyForcibly();
        }

        @Override
        public boolean waitFor(Duration timeout) throws InterruptedException
        {
            return process.waitFor(timeout.toNanos(), TimeUnit.NANOSECONDS);
        }
    }
}
