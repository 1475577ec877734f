/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.core.combine;

import ai.evacortex.demproxy.core.Channel;
import ai.evacortex.demproxy.core.PixelMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Logs the exposure used for every channel at info level and each combined frame at debug level.
 */
public class LoggingFrameTracer implements FrameTracer {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingFrameTracer.class);

    @Override
    public void exposure(String event, Channel channel, Instant referenceTime, double seconds) {
        LOG.info("{} {} EXPTIME={} ({})", event, channel, seconds, referenceTime);
    }

    @Override
    public void combined(String event, Instant referenceTime, PixelMap map) {
        if (LOG.isDebugEnabled()) {
            LOG.debug("{} {} combined {}x{} map", event, referenceTime, map.rows(), map.cols());
        }
    }
}
