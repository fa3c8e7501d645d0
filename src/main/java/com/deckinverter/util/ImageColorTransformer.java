package com.deckinverter.util;

import lombok.extern.slf4j.Slf4j;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;

/**
 * Recolors embedded raster images onto the two-color scheme.
 * <p>
 * Each pixel is placed between the dark and light targets according to its
 * relative luminance, so light regions stay light and dark regions stay dark
 * while shading and anti-aliasing survive as intermediate tones. Part of the
 * pixel's own hue deviation is kept on top. Alpha is copied unchanged.
 * <p>
 * Output encoding: PNG when any pixel is not fully opaque, otherwise JPEG at
 * the configured quality.
 */
@Slf4j
public final class ImageColorTransformer {

    /** Share of a pixel's deviation from its gray level that survives the remap. */
    static final double CHROMA_RETENTION = 0.25;

    private ImageColorTransformer() { /* utility class */ }

    /**
     * Transform one encoded image.
     *
     * @param imageData    encoded image bytes, e.g. a PNG or JPEG picture part
     * @param polarity     the light and dark targets
     * @param imageQuality JPEG quality 1-100 for opaque output
     * @param invertImages {@code false} short-circuits to {@link ImageTransformResult#unchanged()}
     * @return never {@code null}; decoding problems are reported as {@link ImageTransformResult.Status#FAILED}
     */
    public static ImageTransformResult transform(byte[] imageData, ColorPolarity polarity,
                                                 int imageQuality, boolean invertImages) {
        if (!invertImages || imageData == null || imageData.length == 0) {
            return ImageTransformResult.unchanged();
        }

        BufferedImage source;
        try {
            source = ImageIO.read(new ByteArrayInputStream(imageData));
        } catch (IOException | RuntimeException e) {
            log.debug("Image decoding failed: {}", e.getMessage());
            return ImageTransformResult.failed("Image could not be decoded: " + describe(e));
        }
        if (source == null) {
            return ImageTransformResult.failed("Image could not be decoded: unrecognized image format");
        }

        try {
            BufferedImage remapped = remap(source, polarity);
            ImageFormat format = hasTransparency(remapped) ? ImageFormat.LOSSLESS_PNG : ImageFormat.LOSSY_JPEG;
            byte[] encoded = encode(remapped, format, imageQuality);
            log.debug("Recolored {}x{} image as {} ({} -> {} bytes)",
                    remapped.getWidth(), remapped.getHeight(), format, imageData.length, encoded.length);
            return ImageTransformResult.transformed(encoded, format);
        } catch (IOException | RuntimeException e) {
            log.debug("Image re-encoding failed: {}", e.getMessage());
            return ImageTransformResult.failed("Image could not be re-encoded: " + describe(e));
        }
    }

    /**
     * Remap every pixel of {@code image}. The result is {@code TYPE_INT_ARGB}
     * when the source has an alpha channel, {@code TYPE_INT_RGB} otherwise.
     */
    public static BufferedImage remap(BufferedImage image, ColorPolarity polarity) {
        int width = image.getWidth();
        int height = image.getHeight();

        boolean hasAlpha = image.getColorModel().hasAlpha();
        int imgType = hasAlpha ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;

        // Normalise to a standard type so that getRGB() works consistently
        // across all colour models (CMYK, Indexed, Gray, custom, etc.)
        BufferedImage source;
        if (image.getType() != imgType) {
            source = new BufferedImage(width, height, imgType);
            Graphics2D g2d = source.createGraphics();
            g2d.drawImage(image, 0, 0, null);
            g2d.dispose();
        } else {
            source = image;
        }

        int lightR = polarity.getLightTarget().getRed();
        int lightG = polarity.getLightTarget().getGreen();
        int lightB = polarity.getLightTarget().getBlue();
        int darkR = polarity.getDarkTarget().getRed();
        int darkG = polarity.getDarkTarget().getGreen();
        int darkB = polarity.getDarkTarget().getBlue();

        BufferedImage result = new BufferedImage(width, height, imgType);
        int[] row = new int[width];

        for (int y = 0; y < height; y++) {
            source.getRGB(0, y, width, 1, row, 0, width);
            for (int x = 0; x < width; x++) {
                int argb = row[x];
                int a = (argb >>> 24) & 0xFF;
                int r = (argb >> 16) & 0xFF;
                int g = (argb >> 8) & 0xFF;
                int b = argb & 0xFF;

                double luminance = ContrastValidator.relativeLuminance(r, g, b);
                double gray = 0.2126 * r + 0.7152 * g + 0.0722 * b;

                int nr = blend(darkR, lightR, luminance, r - gray);
                int ng = blend(darkG, lightG, luminance, g - gray);
                int nb = blend(darkB, lightB, luminance, b - gray);

                row[x] = (hasAlpha ? a << 24 : 0xFF000000) | (nr << 16) | (ng << 8) | nb;
            }
            result.setRGB(0, y, width, 1, row, 0, width);
        }
        return result;
    }

    /** {@code true} when the image has an alpha channel with at least one non-opaque pixel. */
    public static boolean hasTransparency(BufferedImage image) {
        if (!image.getColorModel().hasAlpha()) {
            return false;
        }
        int width = image.getWidth();
        int[] row = new int[width];
        for (int y = 0; y < image.getHeight(); y++) {
            image.getRGB(0, y, width, 1, row, 0, width);
            for (int argb : row) {
                if ((argb >>> 24) != 0xFF) {
                    return true;
                }
            }
        }
        return false;
    }

    static byte[] encode(BufferedImage image, ImageFormat format, int imageQuality) throws IOException {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        if (format == ImageFormat.LOSSLESS_PNG) {
            if (!ImageIO.write(image, format.getImageIoName(), baos)) {
                throw new IOException("No PNG writer available");
            }
            return baos.toByteArray();
        }

        BufferedImage opaque = image;
        if (image.getType() != BufferedImage.TYPE_INT_RGB) {
            opaque = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
            Graphics2D g = opaque.createGraphics();
            g.drawImage(image, 0, 0, null);
            g.dispose();
        }

        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(format.getImageIoName());
        if (!writers.hasNext()) {
            throw new IOException("No JPEG writer available");
        }
        ImageWriter writer = writers.next();
        ImageWriteParam jpegParams = writer.getDefaultWriteParam();
        jpegParams.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
        jpegParams.setCompressionQuality(imageQuality / 100f);

        try (ImageOutputStream ios = ImageIO.createImageOutputStream(baos)) {
            writer.setOutput(ios);
            writer.write(null, new IIOImage(opaque, null, null), jpegParams);
        } finally {
            writer.dispose();
        }
        return baos.toByteArray();
    }

    private static int blend(int dark, int light, double weight, double deviation) {
        double value = dark + weight * (light - dark) + CHROMA_RETENTION * deviation;
        return (int) Math.max(0, Math.min(255, Math.round(value)));
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
