package de.htwsaar.assetserver.core.domain;

import java.io.Closeable;
import java.io.IOException;
import java.nio.channels.SeekableByteChannel;

/**
 * Offenes Handle auf eine Datei im Asset-Baum.
 */
public interface AssetFile extends Closeable {

    /**
     * Liefert die Metadaten der geöffneten Datei. Die Größe stammt aus dem offenen Handle, die
     * Änderungszeit kann vom Pfad stammen und nach einem Ersetzen der Datei schon zur neuen
     * Version gehören. Belastbar ist sie nur, wenn sie mit einem Stat vor dem Öffnen übereinstimmt.
     *
     * @return aktuelle Momentaufnahme
     * @throws IOException bei Lesefehlern
     */
    AssetStat stat() throws IOException;

    /**
     * Lese-Kanal des Handles. Schließen des Kanals schließt das Handle.
     *
     * @return positionierbarer Kanal
     */
    SeekableByteChannel channel();
}
