/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.core;

/**
 * Imaging channel identifier, the wavelength band in Ångström.
 */
public record Channel(int wavelength) implements Comparable<Channel> {

    public static Channel of(int wavelength) {
        return new Channel(wavelength);
    }

    public static Channel parse(String text) {
        try {
            return new Channel(Integer.parseInt(text.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a channel id: '" + text + "'", e);
        }
    }

    @Override
    public int compareTo(Channel other) {
        return Integer.compare(wavelength, other.wavelength);
    }

    @Override
    public String toString() {
        return Integer.toString(wavelength);
    }
}
