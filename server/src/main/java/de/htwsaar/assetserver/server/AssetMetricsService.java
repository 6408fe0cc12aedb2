package de.htwsaar.assetserver.server;

import de.htwsaar.assetserver.core.domain.CacheDecision;
import java.time.Clock;
import java.util.Deque;
import java.util.Iterator;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Erfasst Laufzeitmetriken des Asset-Servers.
 *
 * <p>Die Werte liegen nur im Speicher der laufenden Instanz. "Hit" heißt: die gecachten
 * Metadaten waren gültig und die Datei musste nicht neu gehasht werden.</p>
 */
@Service
public class AssetMetricsService {

    /** Größtes auswertbares Zeitfenster; ältere Zeitstempel werden schon beim Erfassen verworfen. */
    public static final int MAX_WINDOW_SECONDS = 3600;

    private final AtomicLong totalRequests = new AtomicLong(0);
    private final AtomicLong cacheHits = new AtomicLong(0);
    private final AtomicLong cacheMisses = new AtomicLong(0);
    private final AtomicLong notFound = new AtomicLong(0);
    private final AtomicLong methodNotAllowed = new AtomicLong(0);
    private final AtomicLong internalErrors = new AtomicLong(0);
    private final Deque<Long> requestTimestampsMs = new ConcurrentLinkedDeque<>();
    private final Clock clock;

    /** Erstellt den Service mit der System-Uhr. */
    public AssetMetricsService() {
        this(Clock.systemUTC());
    }

    /**
     * Erstellt den Service mit einer expliziten Uhr (nützlich für Tests).
     *
     * @param clock Zeitquelle
     */
    @Autowired
    public AssetMetricsService(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Erfasst einen erfolgreich aufgelösten Request.
     *
     * @param decision ob die gecachten Metadaten gültig waren
     */
    public void recordResolved(CacheDecision decision) {
        countRequest();
        if (decision == CacheDecision.HIT) cacheHits.incrementAndGet();
        else cacheMisses.incrementAndGet();
    }

    /** Fehlende Datei, Verzeichnis, Wurzel oder veralteter Tag. */
    public void recordNotFound() {
        countRequest();
        notFound.incrementAndGet();
    }

    public void recordMethodNotAllowed() {
        countRequest();
        methodNotAllowed.incrementAndGet();
    }

    public void recordInternalError() {
        countRequest();
        internalErrors.incrementAndGet();
    }

    /**
     * Liefert eine Momentaufnahme inklusive exakter Request-Zahl im Zeitfenster.
     *
     * @param windowSeconds Zeitfenster in Sekunden, begrenzt auf 1 bis {@value #MAX_WINDOW_SECONDS}
     * @param cacheEntries aktuelle Anzahl Cache-Einträge
     * @return Snapshot
     */
    public AssetStatsSnapshot snapshot(int windowSeconds, long cacheEntries) {
        int safeWindow = Math.min(MAX_WINDOW_SECONDS, Math.max(1, windowSeconds));
        long nowMs = clock.millis();
        purgeOlderThan(nowMs - MAX_WINDOW_SECONDS * 1000L);
        long inWindow = countSince(nowMs - safeWindow * 1000L);

        long hits = cacheHits.get();
        long misses = cacheMisses.get();
        long totalCacheDecisions = hits + misses;
        double hitRatio = totalCacheDecisions == 0 ? 0.0 : (double) hits / totalCacheDecisions;

        return new AssetStatsSnapshot(
                totalRequests.get(),
                inWindow,
                hits,
                misses,
                hitRatio,
                notFound.get(),
                methodNotAllowed.get(),
                internalErrors.get(),
                Math.max(0, cacheEntries));
    }

    private void countRequest() {
        totalRequests.incrementAndGet();
        long nowMs = clock.millis();
        requestTimestampsMs.addLast(nowMs);
        purgeOlderThan(nowMs - MAX_WINDOW_SECONDS * 1000L);
    }

    /** Anzahl Zeitstempel ab {@code thresholdMs}; die Deque ist aufsteigend sortiert. */
    private long countSince(long thresholdMs) {
        long count = 0;
        Iterator<Long> newestFirst = requestTimestampsMs.descendingIterator();
        while (newestFirst.hasNext() && newestFirst.next() >= thresholdMs) {
            count++;
        }
        return count;
    }

    int retainedTimestamps() {
        return requestTimestampsMs.size();
    }

    private void purgeOlderThan(long threshold) {
        while (true) {
            Long first = requestTimestampsMs.peekFirst();
            if (first == null || first >= threshold) {
                break;
            }
            requestTimestampsMs.pollFirst();
        }
    }

    /**
     * Unveränderlicher Snapshot der Server-Metriken.
     *
     * @param totalRequests Gesamtanzahl Requests seit Start
     * @param requestsPerWindow exakte Anzahl Requests im Zeitfenster
     * @param cacheHits Requests mit gültigen gecachten Metadaten
     * @param cacheMisses Requests mit Neuberechnung
     * @param cacheHitRatio Trefferquote zwischen 0 und 1
     * @param notFound 404-Antworten
     * @param methodNotAllowed 405-Antworten
     * @param internalErrors 500-Antworten
     * @param cacheEntries Anzahl Cache-Einträge (wächst nur)
     */
    public record AssetStatsSnapshot(
            long totalRequests,
            long requestsPerWindow,
            long cacheHits,
            long cacheMisses,
            double cacheHitRatio,
            long notFound,
            long methodNotAllowed,
            long internalErrors,
            long cacheEntries) {}
}
