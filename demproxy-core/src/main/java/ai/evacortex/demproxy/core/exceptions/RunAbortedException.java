/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.core.exceptions;

import ai.evacortex.demproxy.core.combine.FrameError;

/**
 * Raised by the orchestrator when a frame reports a fatal condition. The whole run stops.
 */
public class RunAbortedException extends RuntimeException {
    private final FrameError error;

    public RunAbortedException(FrameError error) {
        super("Run aborted: " + error.describe());
        this.error = error;
    }

    public RunAbortedException(String message, Throwable cause) {
        super("Run aborted: " + message, cause);
        this.error = null;
    }

    /**
     * @return the frame error that caused the abort, or {@code null} when a worker failed unexpectedly
     */
    public FrameError error() {
        return error;
    }
}
