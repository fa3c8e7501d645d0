package com.deckinverter.model;

import lombok.EqualsAndHashCode;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Flat, versioned encoding of an {@link InversionConfig} that can be handed
 * to a worker in another JVM as a single command-line argument.
 * <p>
 * Layout (version 1), fields separated by {@code ;}:
 * <pre>v1;background;foreground;invertImages;imageQuality;recolorBackground;suffix;folder</pre>
 * Colors are {@code RRGGBB}; free-text fields are Base64url encoded so they
 * may contain any character.
 */
@EqualsAndHashCode
public final class SerializedConfig {

    static final String VERSION = "v1";
    private static final String SEPARATOR = ";";
    private static final int FIELD_COUNT = 8;

    private final String encoded;

    private SerializedConfig(String encoded) {
        this.encoded = encoded;
    }

    public static SerializedConfig encode(InversionConfig config) {
        String value = String.join(SEPARATOR,
                VERSION,
                config.getBackgroundColor().toHex().substring(1),
                config.getForegroundColor().toHex().substring(1),
                Boolean.toString(config.isInvertImages()),
                Integer.toString(config.getImageQuality()),
                Boolean.toString(config.isRecolorBackground()),
                text(config.getFileSuffix()),
                text(config.getArchiveFolder()));
        return new SerializedConfig(value);
    }

    /** Wrap a string previously obtained from {@link #asString()}. */
    public static SerializedConfig of(String encoded) {
        if (encoded == null || encoded.isBlank()) {
            throw new InvalidConfigException("Serialized config is empty");
        }
        return new SerializedConfig(encoded);
    }

    /**
     * @throws InvalidConfigException on an unknown version or malformed field
     */
    public InversionConfig decode() {
        String[] fields = encoded.split(SEPARATOR, -1);
        if (!VERSION.equals(fields[0])) {
            throw new InvalidConfigException("Unsupported serialized config version: " + fields[0]);
        }
        if (fields.length != FIELD_COUNT) {
            throw new InvalidConfigException(
                    "Serialized config must have " + FIELD_COUNT + " fields (got " + fields.length + ")");
        }
        try {
            return InversionConfig.builder()
                    .backgroundColor(RgbColor.fromHex(fields[1]))
                    .foregroundColor(RgbColor.fromHex(fields[2]))
                    .invertImages(bool(fields[3]))
                    .imageQuality(Integer.parseInt(fields[4]))
                    .recolorBackground(bool(fields[5]))
                    .fileSuffix(untext(fields[6]))
                    .archiveFolder(untext(fields[7]))
                    .build();
        } catch (IllegalArgumentException e) {
            if (e instanceof InvalidConfigException ice) {
                throw ice;
            }
            throw new InvalidConfigException("Malformed serialized config: " + e.getMessage(), e);
        }
    }

    public String asString() {
        return encoded;
    }

    @Override
    public String toString() {
        return encoded;
    }

    private static boolean bool(String value) {
        if ("true".equals(value)) return true;
        if ("false".equals(value)) return false;
        throw new InvalidConfigException("Expected true/false but got '" + value + "'");
    }

    private static String text(String value) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(value.getBytes(StandardCharsets.UTF_8));
    }

    private static String untext(String value) {
        return new String(Base64.getUrlDecoder().decode(value), StandardCharsets.UTF_8);
    }
}
