package de.htwsaar.assetserver.core.tag;

import java.util.Objects;

/**
 * Ergebnis von {@link TagCodec#extractTag(String)}.
 *
 * @param tag  gefundener Tag oder {@code ""}
 * @param name Pfad ohne Tag (unverändert, wenn kein Tag gefunden wurde)
 */
public record TaggedName(String tag, String name) {

    public TaggedName {
        Objects.requireNonNull(tag, "tag must not be null");
        Objects.requireNonNull(name, "name must not be null");
    }

    static TaggedName untagged(String name) {
        return new TaggedName("", name);
    }

    public boolean tagged() {
        return !tag.isEmpty();
    }
}
