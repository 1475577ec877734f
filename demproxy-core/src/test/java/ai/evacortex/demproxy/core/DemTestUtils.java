/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.core;

import ai.evacortex.demproxy.core.align.FrameTimestamps;
import ai.evacortex.demproxy.core.io.codec.PixelMapCodec;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Builders for synthetic response tables and frame trees.
 */
public class DemTestUtils {

    public static final Instant T0 = Instant.parse("2024-05-01T12:00:00Z");

    public static List<Channel> channels(int... ids) {
        List<Channel> out = new ArrayList<>();
        for (int id : ids) out.add(Channel.of(id));
        return out;
    }

    /**
     * Table whose channel {@code j} has the constant response {@code values[j]} at every temperature.
     */
    public static ResponseTable constantTable(double[] logT, List<Channel> channels, double... values) {
        double[][] r = new double[logT.length][channels.size()];
        for (int i = 0; i < logT.length; i++) {
            for (int j = 0; j < channels.size(); j++) r[i][j] = values[j];
        }
        return new ResponseTable(logT, channels, r);
    }

    /**
     * Table with Gaussian-shaped responses peaking at {@code peaks[j]} (width 0.2 dex, height 1e-24).
     */
    public static ResponseTable peakedTable(List<Channel> channels, double... peaks) {
        int n = 41;
        double[] logT = new double[n];
        double[][] r = new double[n][channels.size()];
        for (int i = 0; i < n; i++) {
            logT[i] = 5.5 + 0.05 * i;
            for (int j = 0; j < channels.size(); j++) {
                double z = (logT[i] - peaks[j]) / 0.2;
                r[i][j] = 1e-24 * Math.exp(-0.5 * z * z);
            }
        }
        return new ResponseTable(logT, channels, r);
    }

    public static Instant at(long secondsFromT0) {
        return T0.plusSeconds(secondsFromT0);
    }

    /**
     * Writes {@code <eventDir>/<channel>/aia_<channel>.<stamp>Z.dmap} filled with {@code value}.
     */
    public static Path writeFrame(Path eventDir, Channel channel, Instant time, int rows, int cols,
                                  double value, Double exposure) throws IOException {
        PixelMap map = PixelMap.filled(rows, cols, value);
        ChannelFrame frame = exposure == null ? ChannelFrame.withoutExposure(map) : ChannelFrame.withExposure(map, exposure);
        Path path = eventDir.resolve(channel.toString())
                .resolve(FrameTimestamps.frameName("aia_" + channel, time, "dmap"));
        PixelMapCodec.write(path, frame);
        return path;
    }
}
