package com.deckinverter.util;

import com.deckinverter.DeckFixtures;
import com.deckinverter.model.RgbColor;
import org.junit.jupiter.api.Test;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class ImageColorTransformerTest {

    private static final RgbColor CREAM = new RgbColor(0xF5, 0xEE, 0xDC);
    private static final RgbColor NAVY = new RgbColor(0x10, 0x18, 0x40);
    private final ColorPolarity polarity = ColorPolarity.byLuminance(CREAM, NAVY);

    @Test
    void disabledImagesAreUnchanged() {
        byte[] png = DeckFixtures.png(DeckFixtures.solidImage(4, 4, Color.WHITE, false));

        ImageTransformResult result = ImageColorTransformer.transform(png, polarity, 85, false);

        assertThat(result.getStatus()).isEqualTo(ImageTransformResult.Status.UNCHANGED);
        assertThat(result.getData()).isNull();
    }

    @Test
    void emptyBytesAreUnchanged() {
        assertThat(ImageColorTransformer.transform(new byte[0], polarity, 85, true).getStatus())
                .isEqualTo(ImageTransformResult.Status.UNCHANGED);
    }

    @Test
    void garbageBytesFailWithAWarning() {
        ImageTransformResult result = ImageColorTransformer.transform(
                "not an image".getBytes(), polarity, 85, true);

        assertThat(result.getStatus()).isEqualTo(ImageTransformResult.Status.FAILED);
        assertThat(result.getWarning()).startsWith("Image could not be decoded");
    }

    @Test
    void opaqueImagesBecomeJpeg() throws IOException {
        byte[] png = DeckFixtures.png(DeckFixtures.solidImage(8, 8, Color.WHITE, false));

        ImageTransformResult result = ImageColorTransformer.transform(png, polarity, 90, true);

        assertThat(result.isTransformed()).isTrue();
        assertThat(result.getFormat()).isEqualTo(ImageFormat.LOSSY_JPEG);
        // JPEG SOI marker
        assertThat(result.getData()[0]).isEqualTo((byte) 0xFF);
        assertThat(result.getData()[1]).isEqualTo((byte) 0xD8);
        assertThat(ImageIO.read(new ByteArrayInputStream(result.getData()))).isNotNull();
    }

    @Test
    void fullyOpaqueArgbStillBecomesJpeg() {
        byte[] png = DeckFixtures.png(DeckFixtures.solidImage(8, 8, Color.BLACK, true));

        ImageTransformResult result = ImageColorTransformer.transform(png, polarity, 90, true);

        assertThat(result.getFormat()).isEqualTo(ImageFormat.LOSSY_JPEG);
    }

    @Test
    void partialTransparencyBecomesPngAndKeepsAlpha() throws IOException {
        BufferedImage image = DeckFixtures.solidImage(8, 8, Color.WHITE, true);
        image.setRGB(3, 3, new Color(0, 0, 0, 100).getRGB());
        byte[] png = DeckFixtures.png(image);

        ImageTransformResult result = ImageColorTransformer.transform(png, polarity, 90, true);

        assertThat(result.getFormat()).isEqualTo(ImageFormat.LOSSLESS_PNG);
        BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(result.getData()));
        assertThat(decoded.getRGB(3, 3) >>> 24).isEqualTo(100);
        assertThat(decoded.getRGB(0, 0) >>> 24).isEqualTo(255);
    }

    @Test
    void whiteAndBlackLandExactlyOnTheTargets() {
        BufferedImage image = new BufferedImage(2, 1, BufferedImage.TYPE_INT_RGB);
        image.setRGB(0, 0, Color.WHITE.getRGB());
        image.setRGB(1, 0, Color.BLACK.getRGB());

        BufferedImage remapped = ImageColorTransformer.remap(image, polarity);

        assertThat(RgbColor.of(new Color(remapped.getRGB(0, 0)))).isEqualTo(CREAM);
        assertThat(RgbColor.of(new Color(remapped.getRGB(1, 0)))).isEqualTo(NAVY);
    }

    @Test
    void shadingSurvivesAsIntermediateTones() {
        BufferedImage image = new BufferedImage(3, 1, BufferedImage.TYPE_INT_RGB);
        image.setRGB(0, 0, new Color(60, 60, 60).getRGB());
        image.setRGB(1, 0, new Color(128, 128, 128).getRGB());
        image.setRGB(2, 0, new Color(200, 200, 200).getRGB());

        BufferedImage remapped = ImageColorTransformer.remap(image, polarity);

        int dark = new Color(remapped.getRGB(0, 0)).getRed();
        int mid = new Color(remapped.getRGB(1, 0)).getRed();
        int light = new Color(remapped.getRGB(2, 0)).getRed();
        assertThat(dark).isLessThan(mid);
        assertThat(mid).isLessThan(light);
        assertThat(dark).isGreaterThanOrEqualTo(NAVY.getRed());
        assertThat(light).isLessThanOrEqualTo(CREAM.getRed());
    }

    @Test
    void indexedImagesAreNormalised() {
        BufferedImage indexed = new BufferedImage(4, 4, BufferedImage.TYPE_BYTE_INDEXED);
        indexed.setRGB(0, 0, Color.WHITE.getRGB());

        BufferedImage remapped = ImageColorTransformer.remap(indexed, polarity);

        assertThat(remapped.getWidth()).isEqualTo(4);
        assertThat(RgbColor.of(new Color(remapped.getRGB(0, 0)))).isEqualTo(CREAM);
    }
}
