/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.core.math;

import java.util.Locale;

public enum BasisNormalization {
    /** divide each profile by its peak value */
    MAX,
    /** divide each profile by its integral against the bin measure */
    AREA,
    NONE;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static BasisNormalization parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown basis normalization '" + value
                    + "', expected one of max, area, none", e);
        }
    }
}
