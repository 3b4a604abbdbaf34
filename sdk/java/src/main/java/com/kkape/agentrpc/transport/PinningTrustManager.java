package com.kkape.agentrpc.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLEngine;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509ExtendedTrustManager;
import javax.net.ssl.X509TrustManager;
import java.net.Socket;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.MessageDigest;
import java.security.cert.CertPathBuilder;
import java.security.cert.CertPathBuilderException;
import java.security.cert.CertStore;
import java.security.cert.Certificate;
import java.security.cert.CertificateException;
import java.security.cert.CollectionCertStoreParameters;
import java.security.cert.PKIXBuilderParameters;
import java.security.cert.PKIXCertPathBuilderResult;
import java.security.cert.TrustAnchor;
import java.security.cert.X509CertSelector;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Server certificate verification for agent connections.
 *
 * <p>Unless verification is disabled, the presented chain must build to one of the trust
 * anchors and the leaf must cover the configured server name. When pins are configured, at
 * least one certificate of the verified chain (trust anchor included) must have a
 * SubjectPublicKeyInfo whose SHA-256 equals a pin. Pins only ever narrow CA trust: with
 * verification disabled there is no verified chain and every pinned handshake fails.</p>
 */
public class PinningTrustManager extends X509ExtendedTrustManager {
    private static final Logger log = LoggerFactory.getLogger(PinningTrustManager.class);

    private final TlsConfig config;
    private final Set<TrustAnchor> trustAnchors;
    private final X509Certificate[] acceptedIssuers;

    public PinningTrustManager(TlsConfig config) throws GeneralSecurityException {
        this.config = config;
        List<X509Certificate> roots = config.getRootCertificates() != null
                ? config.getRootCertificates()
                : systemRoots();
        Set<TrustAnchor> anchors = new HashSet<>();
        for (X509Certificate root : roots) {
            anchors.add(new TrustAnchor(root, null));
        }
        this.trustAnchors = Collections.unmodifiableSet(anchors);
        this.acceptedIssuers = roots.toArray(new X509Certificate[0]);
    }

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType) throws CertificateException {
        verify(chain);
    }

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType, Socket socket)
            throws CertificateException {
        verify(chain);
    }

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType, SSLEngine engine)
            throws CertificateException {
        verify(chain);
    }

    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType) throws CertificateException {
        throw new CertificateException("client certificates are not verified by this trust manager");
    }

    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType, Socket socket)
            throws CertificateException {
        checkClientTrusted(chain, authType);
    }

    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType, SSLEngine engine)
            throws CertificateException {
        checkClientTrusted(chain, authType);
    }

    @Override
    public X509Certificate[] getAcceptedIssuers() {
        return acceptedIssuers.clone();
    }

    void verify(X509Certificate[] chain) throws CertificateException {
        if (chain == null || chain.length == 0) {
            throw new CertificateException("x509: no certificates presented by server");
        }

        List<X509Certificate> verifiedChain = Collections.emptyList();
        if (!config.isInsecureSkipVerify()) {
            verifiedChain = buildVerifiedChain(chain);
            CertificateHostnames.verify(chain[0], config.getServerName());
        }

        if (!config.getCertPins().isEmpty()) {
            checkPins(verifiedChain);
        }
    }

    private List<X509Certificate> buildVerifiedChain(X509Certificate[] chain) throws CertificateException {
        if (trustAnchors.isEmpty()) {
            throw new CertificateException("x509: certificate signed by unknown authority");
        }
        try {
            X509CertSelector target = new X509CertSelector();
            target.setCertificate(chain[0]);

            PKIXBuilderParameters params = new PKIXBuilderParameters(trustAnchors, target);
            params.setRevocationEnabled(false);
            params.addCertStore(CertStore.getInstance("Collection",
                    new CollectionCertStoreParameters(Arrays.asList(chain))));

            PKIXCertPathBuilderResult result =
                    (PKIXCertPathBuilderResult) CertPathBuilder.getInstance("PKIX").build(params);

            List<X509Certificate> verified = new ArrayList<>();
            for (Certificate certificate : result.getCertPath().getCertificates()) {
                verified.add((X509Certificate) certificate);
            }
            X509Certificate anchor = result.getTrustAnchor().getTrustedCert();
            if (anchor != null) {
                verified.add(anchor);
            }
            return verified;
        } catch (CertPathBuilderException e) {
            throw new CertificateException("x509: certificate signed by unknown authority", e);
        } catch (GeneralSecurityException e) {
            throw new CertificateException("x509: verifying certificate chain: " + e.getMessage(), e);
        }
    }

    private void checkPins(List<X509Certificate> verifiedChain) throws CertificateException {
        for (X509Certificate certificate : verifiedChain) {
            byte[] digest = CertPins.spkiSha256(certificate);
            for (byte[] pin : config.getCertPins()) {
                if (MessageDigest.isEqual(pin, digest)) {
                    return;
                }
            }
        }

        // The handshake error loses this detail on its way out of the TLS stack.
        log.info("No match found with pinned certificates for {}: certificate pin validation failed",
                config.getServerName());
        throw new CertificateException("no match found with pinned cert");
    }

    private static List<X509Certificate> systemRoots() throws GeneralSecurityException {
        TrustManagerFactory factory = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
        factory.init((KeyStore) null);
        for (TrustManager trustManager : factory.getTrustManagers()) {
            if (trustManager instanceof X509TrustManager) {
                return Arrays.asList(((X509TrustManager) trustManager).getAcceptedIssuers());
            }
        }
        throw new GeneralSecurityException("no X509TrustManager in default trust store");
    }
}
