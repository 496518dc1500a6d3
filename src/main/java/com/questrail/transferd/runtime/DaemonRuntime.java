package com.questrail.transferd.runtime;

import com.questrail.transferd.auth.Authenticator;
import com.questrail.transferd.auth.CredentialStore;
import com.questrail.transferd.component.ComponentRegistry;
import com.questrail.transferd.config.DaemonConfig;
import com.questrail.transferd.daemon.DaemonOperations;
import com.questrail.transferd.daemon.JobOperations;
import com.questrail.transferd.daemon.JobStatusPublisher;
import com.questrail.transferd.daemon.PluginOperations;
import com.questrail.transferd.engine.JobEngine;
import com.questrail.transferd.engine.sim.SimulatedJobEngine;
import com.questrail.transferd.event.EventManager;
import com.questrail.transferd.internal.time.MonotonicClock;
import com.questrail.transferd.internal.time.MonotonicScheduler;
import com.questrail.transferd.internal.time.ScheduledExecutorScheduler;
import com.questrail.transferd.internal.time.SystemMonotonicClock;
import com.questrail.transferd.observability.DaemonObservabilitySink;
import com.questrail.transferd.observability.NullObservabilitySink;
import com.questrail.transferd.plugin.DirectoryPluginCatalog;
import com.questrail.transferd.plugin.PluginCatalog;
import com.questrail.transferd.plugin.PluginManager;
import com.questrail.transferd.protocol.codec.EnvelopeDecoder;
import com.questrail.transferd.protocol.codec.EnvelopeEncoder;
import com.questrail.transferd.protocol.codec.PayloadCodec;
import com.questrail.transferd.protocol.codec.impl.DefaultEnvelopeDecoder;
import com.questrail.transferd.protocol.codec.impl.DefaultEnvelopeEncoder;
import com.questrail.transferd.protocol.codec.impl.JacksonPayloadCodec;
import com.questrail.transferd.rpc.OperationRegistry;
import com.questrail.transferd.rpc.RpcDispatcher;
import com.questrail.transferd.session.SessionManager;
import com.questrail.transferd.transport.ConnectionEndpoint;
import com.questrail.transferd.transport.netty.NettyTlsServerEndpoint;
import com.questrail.transferd.transport.netty.TlsContextFactory;

import io.netty.handler.ssl.SslContext;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.SocketAddress;
import java.security.GeneralSecurityException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * DaemonRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the transfer daemon.
 *
 * <p>Wires codec, sessions, dispatcher, events, plugins and the transport,
 * registers the built-in operations and drives every part through a
 * {@link ComponentRegistry}. {@link #start()} and {@link #stop()} are
 * idempotent.</p>
 */
public final class DaemonRuntime
{
    private static final Logger log = LoggerFactory.getLogger(DaemonRuntime.class);

    public static final String VERSION = "0.1.0";

    private final DaemonConfig config;
    private final ComponentRegistry components;
    private final SessionManager sessionManager;
    private final EventManager eventManager;
    private final PluginManager pluginManager;
    private final OperationRegistry operations;
    private final ConnectionEndpoint endpoint;
    private final ScheduledExecutorService timerExecutor;
    private final ExecutorService workerExecutor;
    private final ExecutorService handlerExecutor;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final CountDownLatch terminated = new CountDownLatch(1);

    private DaemonRuntime(Builder b) {
        this.config = b.config;

        MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        this.timerExecutor = Executors.newSingleThreadScheduledExecutor(namedThreads("transferd-timer"));
        this.workerExecutor = Executors.newFixedThreadPool(config.workerThreads(), namedThreads("transferd-worker"));
        this.handlerExecutor = config.handlerTimeout() == null
                ? null
                : Executors.newCachedThreadPool(namedThreads("transferd-handler"));
        MonotonicScheduler scheduler = new ScheduledExecutorScheduler(timerExecutor, clock);

        // 1. Codec
        PayloadCodec payloadCodec = new JacksonPayloadCodec(JacksonPayloadCodec.defaultMapper());
        EnvelopeDecoder envelopeDecoder = new DefaultEnvelopeDecoder(config.maxFrameLength());
        EnvelopeEncoder envelopeEncoder = new DefaultEnvelopeEncoder();

        // 2. Core
        this.operations = new OperationRegistry();
        RpcDispatcher dispatcher = new RpcDispatcher(operations, payloadCodec, b.observability,
                config.handlerTimeout(), handlerExecutor);
        this.sessionManager = new SessionManager(
                new Authenticator(b.credentials),
                payloadCodec,
                envelopeEncoder,
                scheduler,
                clock,
                workerExecutor,
                b.observability,
                new SessionManager.Settings(config.idleTimeout(), config.sessionIdReuseGrace(),
                        config.eventQueueCapacity(), config.maxLoginAttempts()));
        this.eventManager = new EventManager(workerExecutor, b.observability);
        sessionManager.addListener(eventManager);

        PluginCatalog catalog = b.pluginCatalog != null
                ? b.pluginCatalog
                : config.pluginDirectoryIfAny()
                        .<PluginCatalog>map(dir -> new DirectoryPluginCatalog(dir, DaemonRuntime.class.getClassLoader()))
                        .orElse(PluginCatalog.empty());
        this.pluginManager = new PluginManager(operations, eventManager, catalog, b.observability);

        // 3. Built-in operations
        operations.registerAll(new DaemonOperations(VERSION, sessionManager, eventManager, operations,
                this::stopAsync).operations());
        operations.registerAll(new JobOperations(b.jobEngine).operations());
        operations.registerAll(new PluginOperations(pluginManager).operations());

        // 4. Transport
        this.endpoint = b.endpoint != null ? b.endpoint : createTlsEndpoint(config);
        RpcServerAdapter server = new RpcServerAdapter(endpoint, sessionManager, dispatcher, envelopeDecoder,
                payloadCodec, workerExecutor, config.compressionAllowed(), b.observability);

        // 5. Components
        this.components = new ComponentRegistry();
        components.register(eventManager);
        components.register(sessionManager);
        components.register(pluginManager);
        components.register(new JobStatusPublisher(b.jobEngine, eventManager));
        components.register(server);
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        components.start();
        log.info("transferd {} started; listening on {}", VERSION, localAddress().orElse(null));
    }

    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        log.info("transferd stopping");
        components.shutdown();
        shutdownExecutor(timerExecutor);
        shutdownExecutor(workerExecutor);
        if (handlerExecutor != null) {
            shutdownExecutor(handlerExecutor);
        }
        running.set(false);
        terminated.countDown();
        log.info("transferd stopped");
    }

    /**
     * Stop on a separate thread; used by {@code daemon.shutdown} so the
     * calling request can still be answered.
     */
    public void stopAsync() {
        Thread t = new Thread(this::stop, "transferd-shutdown");
        t.setDaemon(false);
        t.start();
    }

    public void awaitTermination() throws InterruptedException {
        terminated.await();
    }

    public boolean isRunning() {
        return running.get();
    }

    public Optional<SocketAddress> localAddress() {
        return endpoint.localAddress();
    }

    public DaemonConfig config() {
        return config;
    }

    public SessionManager sessions() {
        return sessionManager;
    }

    public EventManager events() {
        return eventManager;
    }

    public PluginManager plugins() {
        return pluginManager;
    }

    public OperationRegistry operations() {
        return operations;
    }

    public ComponentRegistry components() {
        return components;
    }

    private static ConnectionEndpoint createTlsEndpoint(DaemonConfig config) {
        SslContext sslContext;
        try {
            sslContext = config.usesSelfSignedCertificate()
                    ? TlsContextFactory.selfSigned()
                    : TlsContextFactory.fromPem(config.certificateChain(), config.privateKey());
        } catch (GeneralSecurityException | IOException e) {
            throw new IllegalStateException("Could not set up TLS", e);
        }
        return new NettyTlsServerEndpoint(config.bindAddress(), sslContext, config.maxFrameLength());
    }

    private static void shutdownExecutor(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private DaemonConfig config = DaemonConfig.defaults();
        private CredentialStore credentials;
        private JobEngine jobEngine;
        private DaemonObservabilitySink observability = NullObservabilitySink.INSTANCE;
        private ConnectionEndpoint endpoint;
        private PluginCatalog pluginCatalog;

        public Builder withConfig(DaemonConfig config) {
            this.config = config;
            return this;
        }

        public Builder withCredentialStore(CredentialStore credentials) {
            this.credentials = credentials;
            return this;
        }

        public Builder withJobEngine(JobEngine jobEngine) {
            this.jobEngine = jobEngine;
            return this;
        }

        public Builder withObservabilitySink(DaemonObservabilitySink sink) {
            this.observability = sink;
            return this;
        }

        /**
         * Replace the TLS server endpoint, e.g. with an in-memory endpoint in tests.
         */
        public Builder withEndpoint(ConnectionEndpoint endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        /**
         * Replace the catalog derived from the configured plugin directory.
         */
        public Builder withPluginCatalog(PluginCatalog catalog) {
            this.pluginCatalog = catalog;
            return this;
        }

        public DaemonRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(credentials, "credentials");
            Objects.requireNonNull(observability, "observability");
            if (jobEngine == null) {
                jobEngine = new SimulatedJobEngine();
            }
            return new DaemonRuntime(this);
        }
    }
}
