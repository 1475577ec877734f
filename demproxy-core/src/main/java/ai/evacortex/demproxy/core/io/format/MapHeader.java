/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.core.io.format;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Fixed-size header that follows the magic number of a pixel-map file.
 *
 * @param exposureSeconds exposure time of the frame, {@code NaN} when unknown
 */
public record MapHeader(int version, int rows, int cols, double exposureSeconds) {
    public static final int SIZE = 4 + 4 + 4 + 8; // version + rows + cols + exposure

    public void writeTo(ByteBuffer buf) {
        buf.order(ByteOrder.LITTLE_ENDIAN);
        buf.putInt(version);
        buf.putInt(rows);
        buf.putInt(cols);
        buf.putDouble(exposureSeconds);
    }

    /**
     * Deserializes header from buffer in little-endian format.
     */
    public static MapHeader from(ByteBuffer buf) {
        buf.order(ByteOrder.LITTLE_ENDIAN);
        int version = buf.getInt();
        int rows = buf.getInt();
        int cols = buf.getInt();
        double exposure = buf.getDouble();
        return new MapHeader(version, rows, cols, exposure);
    }

    public boolean hasExposure() {
        return !Double.isNaN(exposureSeconds);
    }
}
