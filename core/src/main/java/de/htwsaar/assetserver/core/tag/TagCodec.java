package de.htwsaar.assetserver.core.tag;

import java.util.Objects;

/**
 * Reine Funktionen rund um Tags in Dateinamen.
 *
 * <p>Ein Tag ist eine Base62-Kodierung (Alphabet {@code 0-9a-zA-Z}) der ersten 8 Bytes des
 * Inhalts-Digests mit fester Breite von {@value #TAG_LENGTH} Zeichen. Getaggte Dateinamen haben
 * die Form {@code name.TAG} bzw. {@code name.TAG.ext[.ext...]}: der Tag steht immer direkt hinter
 * dem ersten Punkt des Basisnamens, damit zusammengesetzte Endungen ({@code x.tar.gz},
 * {@code lib.min.js}) hinter dem Tag vollständig erhalten bleiben.</p>
 *
 * <p>Die Erkennung ist eine Heuristik: jede 10 Zeichen lange Folge aus dem Alphabet an der
 * richtigen Position gilt als Tag, auch zufällige Treffer. Ein Tag an späterer Position
 * ({@code a.b.TAG} oder {@code a.b.TAG.js}) wird nicht erkannt; solche Namen bleiben ungetaggt.</p>
 */
public final class TagCodec {

    /** Feste Länge eines Tags. */
    public static final int TAG_LENGTH = 10;

    private static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ";

    private static final int BASE = ALPHABET.length();

    private TagCodec() {}

    /**
     * Kodiert die ersten 8 Bytes eines Digests (unsigned, big-endian) als Tag.
     * Die niederwertigste Stelle wird zuerst ausgegeben; führende Null-Stellen bleiben erhalten.
     *
     * @param digest Digest mit mindestens 8 Bytes
     * @return Tag mit genau {@value #TAG_LENGTH} Zeichen
     */
    public static String encode(byte[] digest) {
        Objects.requireNonNull(digest, "digest must not be null");
        if (digest.length < Long.BYTES) {
            throw new IllegalArgumentException("digest must have at least 8 bytes, got " + digest.length);
        }
        long n = 0;
        for (int i = 0; i < Long.BYTES; i++) {
            n = (n << 8) | (digest[i] & 0xFF);
        }
        char[] out = new char[TAG_LENGTH];
        for (int i = 0; i < TAG_LENGTH; i++) {
            out[i] = ALPHABET.charAt((int) Long.remainderUnsigned(n, BASE));
            n = Long.divideUnsigned(n, BASE);
        }
        return new String(out);
    }

    /**
     * Prüft, ob {@code s} syntaktisch ein Tag ist.
     *
     * @param s zu prüfende Zeichenkette (darf {@code null} sein)
     * @return {@code true} bei genau {@value #TAG_LENGTH} Zeichen aus dem Alphabet
     */
    public static boolean isTag(String s) {
        if (s == null || s.length() != TAG_LENGTH) return false;
        for (int i = 0; i < s.length(); i++) {
            if (!inAlphabet(s.charAt(i))) return false;
        }
        return true;
    }

    /**
     * Sucht einen Tag im Basisnamen (letzte Pfadkomponente) und entfernt ihn.
     *
     * <p>Geprüft wird das Segment direkt hinter dem ersten Punkt: bei {@code name.TAG} ist das
     * das letzte Segment, bei {@code name.TAG.ext} das vorletzte, bei {@code name.TAG.min.js}
     * entsprechend weiter vorne.</p>
     *
     * @param path Pfad, optional mit Verzeichnisanteil und führendem Slash
     * @return Tag und Pfad ohne Tag; ohne Treffer {@code ("", path)}
     */
    public static TaggedName extractTag(String path) {
        Objects.requireNonNull(path, "path must not be null");
        int slash = path.lastIndexOf('/');
        String dir = path.substring(0, slash + 1);
        String base = path.substring(slash + 1);

        int firstDot = base.indexOf('.');
        if (firstDot < 0) return TaggedName.untagged(path);

        int nextDot = base.indexOf('.', firstDot + 1);
        String candidate = nextDot < 0 ? base.substring(firstDot + 1) : base.substring(firstDot + 1, nextDot);
        if (!isTag(candidate)) return TaggedName.untagged(path);

        String stripped = nextDot < 0 ? base.substring(0, firstDot) : base.substring(0, firstDot) + base.substring(nextDot);
        return new TaggedName(candidate, dir + stripped);
    }

    /**
     * Fügt den Tag direkt hinter dem ersten Punkt des Basisnamens ein;
     * ohne Punkt wird er als neues letztes Segment angehängt.
     *
     * @param path Pfad, optional mit Verzeichnisanteil und führendem Slash
     * @param tag  einzufügender Tag
     * @return getaggter Pfad
     */
    public static String insertTag(String path, String tag) {
        Objects.requireNonNull(path, "path must not be null");
        if (!isTag(tag)) {
            throw new IllegalArgumentException("not a tag: " + tag);
        }
        int slash = path.lastIndexOf('/');
        String dir = path.substring(0, slash + 1);
        String base = path.substring(slash + 1);

        int dot = base.indexOf('.');
        if (dot < 0) {
            // name.TAG
            return dir + base + "." + tag;
        }
        // name.TAG.ext
        return dir + base.substring(0, dot + 1) + tag + base.substring(dot);
    }

    private static boolean inAlphabet(char c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
