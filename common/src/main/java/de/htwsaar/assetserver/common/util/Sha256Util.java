package de.htwsaar.assetserver.common.util;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Hilfsfunktionen rund um SHA-256.
 *
 * <p>Der Digest selbst ist für den Asset-Server ein opaker, kollisionsresistenter Hash;
 * hier wird nur zentral festgelegt, welcher Algorithmus verwendet wird.</p>
 */
public final class Sha256Util {

    private Sha256Util() {}

    /**
     * Erzeugt einen frischen SHA-256-Digest für inkrementelles Hashen (Streaming).
     *
     * @return neue {@link MessageDigest}-Instanz, nicht thread-sicher
     */
    public static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Unable to compute SHA-256", e);
        }
    }

    public static byte[] sha256(byte[] data) {
        return newDigest().digest(data);
    }
}
