package de.htwsaar.assetserver.core.cache;

import de.htwsaar.assetserver.core.domain.FileInfo;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Zuordnung logischer Pfad → unabhängig austauschbare {@link FileInfo}-Zelle.
 *
 * <p>Thread-Safety: Die Map synchronisiert nur das Anlegen neuer Zellen; Lesen und Ersetzen
 * eines Wertes läuft lock-frei über die jeweilige {@link AtomicReference}. Zellen werden nie
 * entfernt, der Cache wächst mit der Zahl jemals angefragter Pfade (keine Eviction).</p>
 */
public final class FileInfoCache {

    private final Map<String, AtomicReference<FileInfo>> holders = new ConcurrentHashMap<>();

    /**
     * Gibt den aktuell veröffentlichten Eintrag zurück, ohne eine Zelle anzulegen.
     *
     * @param path logischer Pfad
     * @return Eintrag oder {@code null}, wenn noch nie etwas veröffentlicht wurde
     */
    public FileInfo get(String path) {
        AtomicReference<FileInfo> holder = holders.get(path);
        return holder != null ? holder.get() : null;
    }

    /**
     * Veröffentlicht einen neu berechneten Eintrag. Ersetzt den alten Wert vollständig,
     * bei Rennen gewinnt der letzte Schreiber.
     *
     * @param path logischer Pfad
     * @param info neuer Eintrag
     */
    public void publish(String path, FileInfo info) {
        holder(path).set(info);
    }

    /**
     * Liefert die Zelle eines Pfads und legt sie bei Bedarf an. Einmal angelegt, ist sie permanent.
     *
     * @param path logischer Pfad
     * @return Zelle
     */
    AtomicReference<FileInfo> holder(String path) {
        return holders.computeIfAbsent(path, ignored -> new AtomicReference<>());
    }

    /**
     * Anzahl angelegter Zellen.
     *
     * @return Eintragsanzahl
     */
    public int size() {
        return holders.size();
    }
}
