/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.core.io;

import ai.evacortex.demproxy.core.Channel;
import ai.evacortex.demproxy.core.ResponseTable;
import ai.evacortex.demproxy.core.exceptions.InvalidResponseTableException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON persisted form of a {@link ResponseTable}:
 * <pre>{"logt": [...], "channels": [94, ...], "response": [[...], ...]}</pre>
 * where {@code response} has one row per logT sample and one column per channel.
 */
public final class ResponseTableStore {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public record ResponseTableDocument(double[] logt, int[] channels, double[][] response) {}

    private ResponseTableStore() {}

    /**
     * @throws InvalidResponseTableException if the document is malformed or fails table validation
     */
    public static ResponseTable load(Path path) {
        if (!Files.exists(path)) {
            throw new InvalidResponseTableException("response table not found: " + path);
        }
        ResponseTableDocument doc;
        try (InputStream in = Files.newInputStream(path)) {
            doc = MAPPER.readValue(in, ResponseTableDocument.class);
        } catch (IOException e) {
            throw new InvalidResponseTableException("cannot read " + path, e);
        }
        if (doc.logt() == null || doc.channels() == null || doc.response() == null) {
            throw new InvalidResponseTableException(path + " must define logt, channels and response");
        }
        List<Channel> channels = new ArrayList<>(doc.channels().length);
        for (int c : doc.channels()) channels.add(Channel.of(c));
        return new ResponseTable(doc.logt(), channels, doc.response());
    }

    public static void save(Path path, ResponseTable table) {
        int[] channels = table.channels().stream().mapToInt(Channel::wavelength).toArray();
        ResponseTableDocument doc = new ResponseTableDocument(table.logT(), channels, table.toMatrix());
        try {
            Path parent = path.getParent();
            if (parent != null) Files.createDirectories(parent);
            try (OutputStream out = Files.newOutputStream(path, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING)) {
                MAPPER.writerWithDefaultPrettyPrinter().writeValue(out, doc);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write response table " + path, e);
        }
    }
}
