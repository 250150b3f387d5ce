package org.scopeclient.preferences;

import javafx.scene.paint.Color;

/**
 * Raw color payload: three 16-bit channels.
 */
public record ColorValue(int red, int green, int blue) {
    public static final int MAX_CHANNEL = 0xFFFF;

    public ColorValue {
        checkChannel("red", red);
        checkChannel("green", green);
        checkChannel("blue", blue);
    }

    public static ColorValue fromColor(Color color) {
        return new ColorValue(toChannel(color.getRed()), toChannel(color.getGreen()), toChannel(color.getBlue()));
    }

    public Color toColor() {
        return Color.color((double) red / MAX_CHANNEL, (double) green / MAX_CHANNEL, (double) blue / MAX_CHANNEL);
    }

    public String toHex() {
        return String.format("#%04x%04x%04x", red, green, blue);
    }

    private static int toChannel(double component) {
        return (int) Math.round(component * MAX_CHANNEL);
    }

    private static void checkChannel(String name, int value) {
        if (value < 0 || value > MAX_CHANNEL) {
            throw new IllegalArgumentException("Channel " + name + " out of range: " + value);
        }
    }
}
