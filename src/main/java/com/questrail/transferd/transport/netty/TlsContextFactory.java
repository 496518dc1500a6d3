package com.questrail.transferd.transport.netty;

import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.SelfSignedCertificate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.nio.file.Path;
import java.security.cert.CertificateException;

/**
 * Builds the server-side TLS context, either from PEM key material on disk or
 * from a certificate generated at startup.
 */
public final class TlsContextFactory
{
    private static final Logger log = LoggerFactory.getLogger(TlsContextFactory.class);

    private TlsContextFactory() {}

    /**
     * @param certificateChain PEM certificate chain
     * @param privateKey       PEM PKCS#8 private key
     */
    public static SslContext fromPem(Path certificateChain, Path privateKey) throws SSLException
    {
        log.info("Using TLS key material from {}", certificateChain);
        return SslContextBuilder.forServer(certificateChain.toFile(), privateKey.toFile()).build();
    }

    public static SslContext selfSigned() throws CertificateException, SSLException
    {
        SelfSignedCertificate certificate = new SelfSignedCertificate("localhost");
        log.warn("No TLS key material configured; using a self-signed certificate for {}", "localhost");
        try {
            return SslContextBuilder.forServer(certificate.certificate(), certificate.privateKey()).build();
        } finally {
            certificate.delete();
        }
    }
}
