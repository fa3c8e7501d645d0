package com.deckinverter.util;

import com.deckinverter.model.RgbColor;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * WCAG 2.x luminance and contrast checks for the configured color pair.
 * <p>
 * Purely advisory: nothing here throws for a poor pair, callers decide
 * whether to go ahead.
 *
 * @see <a href="https://www.w3.org/TR/WCAG21/#dfn-relative-luminance">relative luminance</a>
 * @see <a href="https://www.w3.org/TR/WCAG21/#dfn-contrast-ratio">contrast ratio</a>
 */
public final class ContrastValidator {

    /** WCAG AA minimum for body text. */
    public static final double MIN_CONTRAST_RATIO = 4.5;

    /** Below this the two colors are practically the same. */
    static final double INDISTINGUISHABLE_RATIO = 1.5;

    /** Luminance midpoint separating light from dark colors. */
    public static final double POLARITY_MIDPOINT = 0.5;

    private ContrastValidator() { /* utility class */ }

    public static double relativeLuminance(RgbColor color) {
        return relativeLuminance(color.getRed(), color.getGreen(), color.getBlue());
    }

    public static double relativeLuminance(int red, int green, int blue) {
        return 0.2126 * LINEAR[red] + 0.7152 * LINEAR[green] + 0.0722 * LINEAR[blue];
    }

    /** Symmetric; 1.0 for identical colors, 21.0 for black against white. */
    public static double contrastRatio(RgbColor a, RgbColor b) {
        double la = relativeLuminance(a);
        double lb = relativeLuminance(b);
        double lighter = Math.max(la, lb);
        double darker = Math.min(la, lb);
        return (lighter + 0.05) / (darker + 0.05);
    }

    public static boolean isLight(RgbColor color) {
        return relativeLuminance(color) >= POLARITY_MIDPOINT;
    }

    /**
     * @return a single warning when the pair falls below {@link #MIN_CONTRAST_RATIO}, otherwise empty
     */
    public static List<String> validate(RgbColor foreground, RgbColor background) {
        List<String> warnings = new ArrayList<>();
        double ratio = contrastRatio(foreground, background);

        if (ratio < INDISTINGUISHABLE_RATIO) {
            warnings.add(String.format(Locale.ROOT,
                    "Colors are very similar (contrast ratio: %.2f:1). Text may be difficult to read; "
                            + "consider using more contrasting colors.", ratio));
        } else if (ratio < MIN_CONTRAST_RATIO) {
            warnings.add(String.format(Locale.ROOT,
                    "Contrast ratio is %.2f:1. WCAG AA recommends at least 4.5:1 for normal text.", ratio));
        }
        return warnings;
    }

    // sRGB channel (0-255) -> linear light
    private static final double[] LINEAR = new double[256];

    static {
        for (int i = 0; i < LINEAR.length; i++) {
            double c = i / 255.0;
            LINEAR[i] = c <= 0.04045 ? c / 12.92 : Math.pow((c + 0.055) / 1.055, 2.4);
        }
    }
}
