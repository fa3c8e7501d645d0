package com.deckinverter.util;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Outcome of transforming one embedded image: unchanged, replaced by new
 * bytes in a given format, or failed with a warning.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ImageTransformResult {

    public enum Status { UNCHANGED, TRANSFORMED, FAILED }

    private static final ImageTransformResult UNCHANGED = new ImageTransformResult(Status.UNCHANGED, null, null, null);

    private final Status status;
    private final byte[] data;
    private final ImageFormat format;
    private final String warning;

    public static ImageTransformResult unchanged() {
        return UNCHANGED;
    }

    public static ImageTransformResult transformed(byte[] data, ImageFormat format) {
        return new ImageTransformResult(Status.TRANSFORMED, data, format, null);
    }

    public static ImageTransformResult failed(String warning) {
        return new ImageTransformResult(Status.FAILED, null, null, warning);
    }

    public boolean isTransformed() {
        return status == Status.TRANSFORMED;
    }
}
