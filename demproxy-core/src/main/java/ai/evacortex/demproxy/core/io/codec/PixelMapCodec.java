/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.core.io.codec;

import ai.evacortex.demproxy.core.ChannelFrame;
import ai.evacortex.demproxy.core.PixelMap;
import ai.evacortex.demproxy.core.io.format.MapHeader;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.OptionalDouble;

public class PixelMapCodec {

    public static final String EXTENSION = ".dmap";

    private static final int MAGIC = 0x444D4150; // 'DMAP'
    private static final int VERSION = 1;
    private static final ByteOrder ORDER = ByteOrder.LITTLE_ENDIAN;
    private static final int MAX_SIDE = 16384; // sanity limit per dimension
    // whole file must fit one byte array
    private static final long MAX_PAYLOAD = Integer.MAX_VALUE - 8 - (4 + MapHeader.SIZE);

    /**
     * Serializes a frame into the given ByteBuffer.
     *
     * Format:
     *   [MAGIC:int][VERSION:int][ROWS:int][COLS:int][EXPOSURE:double, NaN if absent][V₀:double]...[Vₙ]
     */
    public static void writeTo(ByteBuffer buf, ChannelFrame frame) {
        PixelMap map = frame.map();
        checkShape(map.rows(), map.cols());

        buf.order(ORDER);
        buf.putInt(MAGIC);
        new MapHeader(VERSION, map.rows(), map.cols(), frame.exposureSeconds().orElse(Double.NaN)).writeTo(buf);
        for (double v : map.values()) buf.putDouble(v);
    }

    /**
     * Reads a frame from a ByteBuffer positioned at the magic number.
     */
    public static ChannelFrame readFrom(ByteBuffer buf) {
        buf.order(ORDER);
        if (buf.remaining() < 4 + MapHeader.SIZE) throw new IllegalArgumentException("No space for header");
        int magic = buf.getInt();
        if (magic != MAGIC) throw new IllegalArgumentException("Invalid MAGIC header");

        MapHeader header = MapHeader.from(buf);
        if (header.version() != VERSION) {
            throw new IllegalArgumentException("Unsupported map version: " + header.version());
        }
        checkShape(header.rows(), header.cols());

        int count = header.rows() * header.cols();
        long required = 8L * count;
        if (buf.remaining() < required) {
            throw new IllegalArgumentException("Buffer underflow: need " + required + " bytes, found " + buf.remaining());
        }
        double[] values = new double[count];
        for (int i = 0; i < count; i++) values[i] = buf.getDouble();

        PixelMap map = new PixelMap(header.rows(), header.cols(), values);
        return new ChannelFrame(map, header.hasExposure()
                ? OptionalDouble.of(header.exposureSeconds())
                : OptionalDouble.empty());
    }

    public static byte[] serialize(ChannelFrame frame) {
        ByteBuffer buf = ByteBuffer.allocate(estimateSize(frame.map().rows(), frame.map().cols())).order(ORDER);
        writeTo(buf, frame);
        return buf.array();
    }

    public static ChannelFrame deserialize(byte[] data) {
        return readFrom(ByteBuffer.wrap(data).order(ORDER));
    }

    public static ChannelFrame read(Path path) throws IOException {
        return deserialize(Files.readAllBytes(path));
    }

    public static void write(Path path, ChannelFrame frame) throws IOException {
        Path parent = path.getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.write(path, serialize(frame), StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE);
    }

    /**
     * Bytes needed for a map of the given shape, magic number included.
     */
    public static int estimateSize(int rows, int cols) {
        checkShape(rows, cols);
        return 4 + MapHeader.SIZE + Math.multiplyExact(8, Math.multiplyExact(rows, cols));
    }

    private static void checkShape(int rows, int cols) {
        if (rows <= 0 || cols <= 0 || rows > MAX_SIDE || cols > MAX_SIDE) {
            throw new IllegalArgumentException("Unsupported map shape: " + rows + "x" + cols);
        }
        if (8L * rows * cols > MAX_PAYLOAD) {
            throw new IllegalArgumentException("Map too large: " + rows + "x" + cols);
        }
    }
}
