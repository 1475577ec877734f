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
import ai.evacortex.demproxy.core.ChannelFrame;
import ai.evacortex.demproxy.core.PixelMap;
import ai.evacortex.demproxy.core.ResponseTable;
import ai.evacortex.demproxy.core.WeightSet;
import ai.evacortex.demproxy.core.exceptions.ChannelConfigurationException;

import java.time.Instant;
import java.util.*;

/**
 * Combines the channel frames of one matched reference time into a single map.
 *
 * <p>Per channel the frame is optionally divided by its exposure time, then by the channel
 * response at {@link CombineOptions#responseLogT()} (only where that response is positive), then
 * clipped, and finally weighted and summed. The sum is multiplied by the output scale.</p>
 *
 * <p>A missing or non-positive exposure while exposure normalization is on does not throw: it is
 * reported as {@link FrameResult.Failed} and the caller decides to stop the run. Channel and weight
 * mismatches are rejected when the combiner is built. Instances are immutable and shared by
 * all workers.</p>
 */
public final class FrameCombiner {

    private final List<Channel> channels;
    private final double[] weights;
    private final double[] responseDivisors;    // 0 where no division applies
    private final CombineOptions options;
    private final FrameTracer tracer;

    public FrameCombiner(List<Channel> channels, double[] weights, ResponseTable responses,
                         CombineOptions options, FrameTracer tracer) {
        Objects.requireNonNull(channels, "channels must not be null");
        Objects.requireNonNull(weights, "weights must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        if (channels.isEmpty()) {
            throw new ChannelConfigurationException("no channels to combine");
        }
        if (channels.size() != weights.length) {
            throw new ChannelConfigurationException(channels.size() + " channels but "
                    + weights.length + " weights");
        }
        if (new HashSet<>(channels).size() != channels.size()) {
            throw new ChannelConfigurationException("duplicate channel in " + channels);
        }
        this.channels = List.copyOf(channels);
        this.weights = weights.clone();
        this.responseDivisors = new double[channels.size()];
        if (options.divideByResponse()) {
            if (responses == null) {
                throw new ChannelConfigurationException("response division requested without a response table");
            }
            for (int j = 0; j < channels.size(); j++) {
                responseDivisors[j] = responses.responseAt(channels.get(j), options.responseLogT());
            }
        }
        this.tracer = tracer != null ? tracer : new NoOpFrameTracer();
    }

    /**
     * Combiner for one bin of a weight set.
     */
    public static FrameCombiner forWeights(WeightSet weights, int bin, ResponseTable responses,
                                           CombineOptions options, FrameTracer tracer) {
        return new FrameCombiner(weights.channels(), weights.row(bin), responses, options, tracer);
    }

    public List<Channel> channels() {
        return channels;
    }

    public double[] weights() {
        return weights.clone();
    }

    public CombineOptions options() {
        return options;
    }

    /**
     * @param event         event name, for error reporting
     * @param referenceTime reference timestamp of the match set
     * @param frames        one decoded frame per channel of this combiner
     */
    public FrameResult combine(String event, Instant referenceTime, Map<Channel, ChannelFrame> frames) {
        PixelMap shape = null;
        double[] acc = null;

        for (int j = 0; j < channels.size(); j++) {
            Channel ch = channels.get(j);
            ChannelFrame frame = frames.get(ch);
            if (frame == null) {
                throw new IllegalArgumentException("No frame for channel " + ch + " at " + referenceTime);
            }
            PixelMap map = frame.map();
            if (shape == null) {
                shape = map;
                acc = new double[map.size()];
            } else if (!shape.sameShape(map)) {
                return new FrameResult.Failed(new FrameError(event, ch, referenceTime,
                        "frame shape " + map.rows() + "x" + map.cols() + " differs from "
                                + shape.rows() + "x" + shape.cols()));
            }

            double divisor = 1.0;
            if (options.normalizeExposure()) {
                OptionalDouble exposure = frame.exposureSeconds();
                if (exposure.isEmpty()) {
                    return new FrameResult.Failed(new FrameError(event, ch, referenceTime,
                            "exposure time not found"));
                }
                double seconds = exposure.getAsDouble();
                if (!(seconds > 0)) {
                    return new FrameResult.Failed(new FrameError(event, ch, referenceTime,
                            "invalid exposure time " + seconds));
                }
                tracer.exposure(event, ch, referenceTime, seconds);
                divisor = seconds;
            }
            if (responseDivisors[j] > 0) {
                divisor *= responseDivisors[j];
            }

            double w = weights[j];
            double[] v = map.values();
            for (int i = 0; i < v.length; i++) {
                double x = v[i] / divisor;
                if (options.clipInput() && !(Double.isFinite(x) && x > 0)) {
                    x = 0.0;
                }
                acc[i] += w * x;
            }
        }

        if (options.outputScale() != 1.0) {
            for (int i = 0; i < acc.length; i++) acc[i] *= options.outputScale();
        }
        PixelMap out = new PixelMap(shape.rows(), shape.cols(), acc);
        tracer.combined(event, referenceTime, out);
        return new FrameResult.Combined(referenceTime, out);
    }
}
