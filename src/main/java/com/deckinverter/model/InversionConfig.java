package com.deckinverter.model;

import lombok.Builder;
import lombok.Value;

/**
 * Inversion settings shared by every document of a batch.
 * <p>
 * Instances are immutable and validated on construction; a low contrast
 * between the two colors is not an error here, it is reported separately
 * by {@link com.deckinverter.util.ContrastValidator}.
 */
@Value
public class InversionConfig {

    public static final int DEFAULT_IMAGE_QUALITY = 85;
    public static final String DEFAULT_FILE_SUFFIX = "(inverted)";
    public static final String DEFAULT_ARCHIVE_FOLDER = "Inverted Presentations";

    /** Slide background color of the inverted scheme. */
    RgbColor backgroundColor;

    /** Text color of the inverted scheme. */
    RgbColor foregroundColor;

    boolean invertImages;

    /** JPEG quality for opaque images, 1-100. */
    int imageQuality;

    /** Paint every slide background with {@link #backgroundColor}. */
    boolean recolorBackground;

    String fileSuffix;

    String archiveFolder;

    @Builder(toBuilder = true)
    private InversionConfig(RgbColor backgroundColor,
                            RgbColor foregroundColor,
                            Boolean invertImages,
                            Integer imageQuality,
                            Boolean recolorBackground,
                            String fileSuffix,
                            String archiveFolder) {
        this.backgroundColor = backgroundColor != null ? backgroundColor : RgbColor.BLACK;
        this.foregroundColor = foregroundColor != null ? foregroundColor : RgbColor.WHITE;
        this.invertImages = invertImages == null || invertImages;
        this.imageQuality = imageQuality != null ? imageQuality : DEFAULT_IMAGE_QUALITY;
        this.recolorBackground = recolorBackground == null || recolorBackground;
        this.fileSuffix = fileSuffix != null ? fileSuffix : DEFAULT_FILE_SUFFIX;
        this.archiveFolder = archiveFolder != null ? archiveFolder : DEFAULT_ARCHIVE_FOLDER;

        if (this.imageQuality < 1 || this.imageQuality > 100) {
            throw new InvalidConfigException("Image quality must be between 1 and 100 (got " + this.imageQuality + ")");
        }
        if (this.fileSuffix.contains("/") || this.fileSuffix.contains("\\")) {
            throw new InvalidConfigException("File suffix must not contain path separators: " + this.fileSuffix);
        }
    }

    /**
     * Build a config from hex color strings as entered by a user.
     *
     * @throws InvalidConfigException if either color is malformed
     */
    public static InversionConfig fromHex(String foregroundHex, String backgroundHex) {
        return builder()
                .foregroundColor(RgbColor.fromHex(foregroundHex))
                .backgroundColor(RgbColor.fromHex(backgroundHex))
                .build();
    }

    public static InversionConfig defaults() {
        return builder().build();
    }
}
