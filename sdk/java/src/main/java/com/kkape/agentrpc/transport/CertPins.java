package com.kkape.agentrpc.transport;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/**
 * Helpers for SHA-256 SubjectPublicKeyInfo pins.
 */
public final class CertPins {

    private CertPins() {
    }

    /**
     * Parse hex encoded pins, as given on the command line.
     *
     * @throws IllegalArgumentException if a pin is not valid hex
     */
    public static List<byte[]> parse(List<String> hexPins) {
        List<byte[]> pins = new ArrayList<>(hexPins.size());
        for (String hex : hexPins) {
            try {
                pins.add(HexFormat.of().parseHex(hex.trim()));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("decoding cert pin " + hex + ": " + e.getMessage(), e);
            }
        }
        return pins;
    }

    /**
     * SHA-256 over the DER encoded SubjectPublicKeyInfo of a certificate.
     */
    public static byte[] spkiSha256(X509Certificate certificate) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(certificate.getPublicKey().getEncoded());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static String toHex(byte[] pin) {
        return HexFormat.of().formatHex(pin);
    }
}
