/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.core.engine;

/**
 * Weights for one target temperature with the bin conversion factor they were normalized against.
 */
public record LinearSolution(double logT, double[] weights, double scale) {
}
