package com.deckinverter.util;

import com.deckinverter.model.InversionConfig;
import com.deckinverter.model.RgbColor;
import lombok.Getter;

import java.awt.Color;

/**
 * Maps any color onto the configured two-color scheme while keeping its
 * polarity: light colors go to the light target, dark colors to the dark one.
 * <p>
 * Shape colors take their targets from the configured roles, so light fills
 * and text become the foreground color. Image pixels take them by luminance,
 * so light regions always land on the lighter configured color.
 */
@Getter
public final class ColorPolarity {

    private final RgbColor lightTarget;
    private final RgbColor darkTarget;

    private ColorPolarity(RgbColor lightTarget, RgbColor darkTarget) {
        this.lightTarget = lightTarget;
        this.darkTarget = darkTarget;
    }

    /** Light colors become the foreground, dark colors the background. */
    public static ColorPolarity byRole(RgbColor foreground, RgbColor background) {
        return new ColorPolarity(foreground, background);
    }

    /** Light colors become whichever configured color is lighter; on a tie the foreground. */
    public static ColorPolarity byLuminance(RgbColor foreground, RgbColor background) {
        if (ContrastValidator.relativeLuminance(background) > ContrastValidator.relativeLuminance(foreground)) {
            return new ColorPolarity(background, foreground);
        }
        return new ColorPolarity(foreground, background);
    }

    public static ColorPolarity forShapes(InversionConfig config) {
        return byRole(config.getForegroundColor(), config.getBackgroundColor());
    }

    public static ColorPolarity forImages(InversionConfig config) {
        return byLuminance(config.getForegroundColor(), config.getBackgroundColor());
    }

    public RgbColor map(RgbColor color) {
        return ContrastValidator.isLight(color) ? lightTarget : darkTarget;
    }

    /** Like {@link #map(RgbColor)}, keeping the source alpha. */
    public Color map(Color color) {
        RgbColor target = map(RgbColor.of(color));
        return target.toAwtColor(color.getAlpha());
    }
}
