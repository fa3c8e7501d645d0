package com.deckinverter.model;

import lombok.Value;

/**
 * One named input buffer, either a deck or an archive of decks.
 * The bytes are copied in and out, so callers cannot change a queued input.
 */
@Value
public class DocumentSource {

    String name;

    byte[] data;

    private DocumentSource(String name, byte[] data) {
        this.name = name;
        this.data = data == null ? null : data.clone();
    }

    public static DocumentSource of(String name, byte[] data) {
        return new DocumentSource(name, data);
    }

    /** A copy of the input bytes. */
    public byte[] getData() {
        return data == null ? null : data.clone();
    }

    public DocumentSource withName(String newName) {
        return new DocumentSource(newName, data);
    }
}
