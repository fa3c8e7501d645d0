package com.deckinverter.model;

import lombok.Value;

import java.awt.Color;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Opaque sRGB color, one byte per channel.
 */
@Value
public class RgbColor {

    public static final RgbColor BLACK = new RgbColor(0, 0, 0);
    public static final RgbColor WHITE = new RgbColor(255, 255, 255);

    private static final Pattern HEX_DIGITS = Pattern.compile("[0-9A-Fa-f]{6}");

    int red;
    int green;
    int blue;

    public RgbColor(int red, int green, int blue) {
        this.red = checkChannel("red", red);
        this.green = checkChannel("green", green);
        this.blue = checkChannel("blue", blue);
    }

    /**
     * Parse a hex color such as {@code #1A1A1A} or {@code F0F0F0}.
     *
     * @throws InvalidConfigException if the value is empty, not 6 digits long or not hex
     */
    public static RgbColor fromHex(String hex) {
        if (hex == null || hex.isBlank()) {
            throw new InvalidConfigException("Hex color cannot be empty");
        }
        String digits = hex.trim();
        if (digits.startsWith("#")) {
            digits = digits.substring(1);
        }
        if (digits.length() != 6) {
            throw new InvalidConfigException(String.format(Locale.ROOT,
                    "Hex color must be exactly 6 characters (got %d). Example: #FF0000 or FF0000",
                    digits.length()));
        }
        if (!HEX_DIGITS.matcher(digits).matches()) {
            throw new InvalidConfigException(
                    "Invalid hex color '" + hex + "'. Must contain only hex digits (0-9, A-F). Example: #FF0000");
        }
        int rgb = Integer.parseInt(digits, 16);
        return new RgbColor((rgb >> 16) & 0xFF, (rgb >> 8) & 0xFF, rgb & 0xFF);
    }

    public static RgbColor of(Color color) {
        return new RgbColor(color.getRed(), color.getGreen(), color.getBlue());
    }

    public String toHex() {
        return String.format(Locale.ROOT, "#%02X%02X%02X", red, green, blue);
    }

    public Color toAwtColor() {
        return new Color(red, green, blue);
    }

    /** Same hue as this color with the given alpha (0-255). */
    public Color toAwtColor(int alpha) {
        return new Color(red, green, blue, alpha);
    }

    @Override
    public String toString() {
        return toHex();
    }

    private static int checkChannel(String name, int value) {
        if (value < 0 || value > 255) {
            throw new InvalidConfigException("Color channel " + name + " out of range 0-255: " + value);
        }
        return value;
    }
}
