package com.kkape.agentrpc.transport;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.security.cert.CertificateException;
import java.security.cert.CertificateParsingException;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Hostname verification against a leaf certificate's subjectAltName entries.
 *
 * <p>The subject common name is never consulted. Error messages keep the
 * {@code x509: certificate is valid for ...} wording that callers match on.</p>
 */
public final class CertificateHostnames {
    private static final int SAN_DNS = 2;
    private static final int SAN_IP = 7;
    private static final Pattern IPV4 = Pattern.compile("^\\d{1,3}(\\.\\d{1,3}){3}$");

    private CertificateHostnames() {
    }

    /**
     * @throws CertificateException if the certificate does not cover the host
     */
    public static void verify(X509Certificate leaf, String host) throws CertificateException {
        String candidate = stripBrackets(host);
        List<String> dnsNames = new ArrayList<>();
        List<String> ipAddresses = new ArrayList<>();
        collectNames(leaf, dnsNames, ipAddresses);

        if (isIpLiteral(candidate)) {
            if (ipAddresses.isEmpty()) {
                throw new CertificateException("x509: cannot validate certificate for " + candidate
                        + " because it doesn't contain any IP SANs");
            }
            InetAddress wanted = parseLiteral(candidate);
            for (String ip : ipAddresses) {
                if (wanted != null && wanted.equals(parseLiteral(ip))) {
                    return;
                }
            }
            throw mismatch(ipAddresses, candidate);
        }

        String wanted = normalize(candidate);
        for (String name : dnsNames) {
            if (matches(normalize(name), wanted)) {
                return;
            }
        }
        throw mismatch(dnsNames, candidate);
    }

    static boolean matches(String pattern, String host) {
        if (pattern.isEmpty() || host.isEmpty()) {
            return false;
        }
        if (!pattern.startsWith("*.")) {
            return pattern.equals(host);
        }
        // A wildcard covers exactly one leftmost label.
        int dot = host.indexOf('.');
        if (dot <= 0) {
            return false;
        }
        return pattern.substring(1).equals(host.substring(dot));
    }

    private static CertificateException mismatch(List<String> names, String host) {
        if (names.isEmpty()) {
            return new CertificateException(
                    "x509: certificate is not valid for any names, but wanted to match " + host);
        }
        return new CertificateException(
                "x509: certificate is valid for " + String.join(", ", names) + ", not " + host);
    }

    private static void collectNames(X509Certificate leaf, List<String> dnsNames, List<String> ipAddresses)
            throws CertificateParsingException {
        Collection<List<?>> altNames = leaf.getSubjectAlternativeNames();
        if (altNames == null) {
            return;
        }
        for (List<?> entry : altNames) {
            if (entry.size() < 2 || !(entry.get(0) instanceof Integer) || !(entry.get(1) instanceof String)) {
                continue;
            }
            int type = (Integer) entry.get(0);
            if (type == SAN_DNS) {
                dnsNames.add((String) entry.get(1));
            } else if (type == SAN_IP) {
                ipAddresses.add((String) entry.get(1));
            }
        }
    }

    private static String normalize(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return lower.endsWith(".") ? lower.substring(0, lower.length() - 1) : lower;
    }

    private static String stripBrackets(String host) {
        if (host.startsWith("[") && host.endsWith("]")) {
            return host.substring(1, host.length() - 1);
        }
        return host;
    }

    private static boolean isIpLiteral(String host) {
        return IPV4.matcher(host).matches() || host.indexOf(':') >= 0;
    }

    private static InetAddress parseLiteral(String literal) {
        if (!isIpLiteral(literal)) {
            return null;
        }
        try {
            // literal addresses never hit the resolver
            return InetAddress.getByName(literal);
        } catch (UnknownHostException e) {
            return null;
        }
    }
}
