package de.htwsaar.assetserver.core.domain;

/**
 * Ob die Metadaten eines Requests aus dem Cache stammen oder neu berechnet wurden.
 */
public enum CacheDecision {
    HIT,
    MISS,
    /**
     * Neu berechnet, aber die Datei hat sich dabei geändert; nicht veröffentlicht.
     * Tag und Größe passen zu den Bytes des Handles, die Änderungszeit ist nicht belastbar.
     */
    UNSTABLE
}
