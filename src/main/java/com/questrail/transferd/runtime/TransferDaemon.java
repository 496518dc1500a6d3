package com.questrail.transferd.runtime;

import com.questrail.transferd.api.AuthLevel;
import com.questrail.transferd.auth.InMemoryCredentialStore;
import com.questrail.transferd.config.DaemonConfig;
import com.questrail.transferd.observability.Slf4jDaemonObservabilitySink;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Process entry point: runs the daemon with default configuration until it is
 * shut down remotely or the JVM exits.
 *
 * <p>The only account is {@code localclient} at administrative level, with a
 * password generated per run and written to the log.</p>
 */
public final class TransferDaemon
{
    private static final Logger log = LoggerFactory.getLogger(TransferDaemon.class);

    private TransferDaemon() {}

    public static void main(String[] args) throws InterruptedException
    {
        byte[] secret = new byte[20];
        new SecureRandom().nextBytes(secret);
        String password = HexFormat.of().formatHex(secret);

        DaemonRuntime runtime = DaemonRuntime.builder()
                .withConfig(DaemonConfig.defaults())
                .withCredentialStore(InMemoryCredentialStore.builder()
                        .addAccount("localclient", password, AuthLevel.ADMIN)
                        .build())
                .withObservabilitySink(new Slf4jDaemonObservabilitySink())
                .build();

        Runtime.getRuntime().addShutdownHook(new Thread(runtime::stop, "transferd-shutdown-hook"));
        runtime.start();
        log.warn("Account 'localclient' password for this run: {}", password);

        runtime.awaitTermination();
    }
}
