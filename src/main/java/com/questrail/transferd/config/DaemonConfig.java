package com.questrail.transferd.config;

import java.net.InetSocketAddress;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Aggregated configuration for the transfer daemon.
 *
 * <p>Absent TLS key material means a self-signed certificate is generated at
 * startup. An absent handler timeout means handlers may run indefinitely. An
 * absent plugin directory means no plugin catalog.</p>
 */
public record DaemonConfig(
    InetSocketAddress bindAddress,
    Path certificateChain,
    Path privateKey,
    int maxFrameLength,
    boolean compressionAllowed,
    Duration idleTimeout,
    Duration handlerTimeout,
    Duration sessionIdReuseGrace,
    int eventQueueCapacity,
    int workerThreads,
    int maxLoginAttempts,
    Path pluginDirectory
) {
    public static final int DEFAULT_PORT = 58846;

    public DaemonConfig {
        Objects.requireNonNull(bindAddress, "bindAddress");
        Objects.requireNonNull(sessionIdReuseGrace, "sessionIdReuseGrace");
        if ((certificateChain == null) != (privateKey == null)) {
            throw new IllegalArgumentException("certificateChain and privateKey must be given together");
        }
        if (maxFrameLength <= 0) {
            throw new IllegalArgumentException("maxFrameLength must be positive");
        }
        if (eventQueueCapacity <= 0) {
            throw new IllegalArgumentException("eventQueueCapacity must be positive");
        }
        if (workerThreads <= 0) {
            throw new IllegalArgumentException("workerThreads must be positive");
        }
        if (maxLoginAttempts <= 0) {
            throw new IllegalArgumentException("maxLoginAttempts must be positive");
        }
        if (handlerTimeout != null && (handlerTimeout.isZero() || handlerTimeout.isNegative())) {
            throw new IllegalArgumentException("handlerTimeout must be positive when set");
        }
    }

    public static DaemonConfig defaults() {
        return builder().build();
    }

    public Optional<Duration> handlerTimeoutIfAny() {
        return Optional.ofNullable(handlerTimeout);
    }

    public Optional<Path> pluginDirectoryIfAny() {
        return Optional.ofNullable(pluginDirectory);
    }

    public boolean usesSelfSignedCertificate() {
        return certificateChain == null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private InetSocketAddress bindAddress = new InetSocketAddress("0.0.0.0", DEFAULT_PORT);
        private Path certificateChain;
        private Path privateKey;
        private int maxFrameLength = 16 * 1024 * 1024;
        private boolean compressionAllowed = true;
        private Duration idleTimeout = Duration.ofMinutes(10);
        private Duration handlerTimeout;
        private Duration sessionIdReuseGrace = Duration.ofSeconds(30);
        private int eventQueueCapacity = 1024;
        private int workerThreads = 8;
        private int maxLoginAttempts = 3;
        private Path pluginDirectory;

        public Builder withBindAddress(InetSocketAddress bindAddress) {
            this.bindAddress = bindAddress;
            return this;
        }

        public Builder withPort(int port) {
            this.bindAddress = new InetSocketAddress(bindAddress.getHostString(), port);
            return this;
        }

        public Builder withKeyMaterial(Path certificateChain, Path privateKey) {
            this.certificateChain = certificateChain;
            this.privateKey = privateKey;
            return this;
        }

        public Builder withMaxFrameLength(int maxFrameLength) {
            this.maxFrameLength = maxFrameLength;
            return this;
        }

        public Builder withCompressionAllowed(boolean compressionAllowed) {
            this.compressionAllowed = compressionAllowed;
            return this;
        }

        public Builder withIdleTimeout(Duration idleTimeout) {
            this.idleTimeout = idleTimeout;
            return this;
        }

        public Builder withHandlerTimeout(Duration handlerTimeout) {
            this.handlerTimeout = handlerTimeout;
            return this;
        }

        public Builder withSessionIdReuseGrace(Duration grace) {
            this.sessionIdReuseGrace = grace;
            return this;
        }

        public Builder withEventQueueCapacity(int capacity) {
            this.eventQueueCapacity = capacity;
            return this;
        }

        public Builder withWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
            return this;
        }

        public Builder withMaxLoginAttempts(int maxLoginAttempts) {
            this.maxLoginAttempts = maxLoginAttempts;
            return this;
        }

        public Builder withPluginDirectory(Path pluginDirectory) {
            this.pluginDirectory = pluginDirectory;
            return this;
        }

        public DaemonConfig build() {
            return new DaemonConfig(bindAddress, certificateChain, privateKey, maxFrameLength,
                    compressionAllowed, idleTimeout, handlerTimeout, sessionIdReuseGrace,
                    eventQueueCapacity, workerThreads, maxLoginAttempts, pluginDirectory);
        }
    }
}
