/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.core.config;

import java.util.Locale;

public enum OutputFormat {
    /** Pixel map only. */
    RAW,
    /** Pixel map plus a JSON provenance sidecar. */
    ANNOTATED;

    public static OutputFormat parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown output format '" + value + "', expected raw or annotated", e);
        }
    }
}
