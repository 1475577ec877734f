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
import ai.evacortex.demproxy.core.WeightSet;
import ai.evacortex.demproxy.core.exceptions.WeightFileFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.regex.Pattern;

/**
 * Text form of a {@link WeightSet}.
 *
 * <p>Single bin:</p>
 * <pre>
 * logt=6.6
 * delta_logt=auto
 * ...
 * scale=1.51982575e+06
 * channels,weights
 * 94,1.23456789e-03
 * </pre>
 * <p>Multiple bins or Gaussian basis:</p>
 * <pre>
 * logt_list=6.4,6.6
 * ...
 * channels=94,131
 * logt,channel,weight
 * 6.4,94,1.23456789e-03
 * </pre>
 * <p>Lines starting with {@code #} are comments. When {@code channels=} or {@code logt_list=} is
 * missing the sets are taken from the data rows; cells missing from a multi-bin table are 0. Rows
 * outside the declared sets, and files mixing both row shapes, are rejected.</p>
 */
public final class WeightFileCodec {

    private static final Logger LOG = LoggerFactory.getLogger(WeightFileCodec.class);

    private static final Pattern METADATA = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*=.*");
    private static final String SINGLE_HEADER = "channels,weights";
    private static final String MULTI_HEADER = "logt,channel,weight";

    private WeightFileCodec() {}

    public static WeightTable read(Path path) {
        try {
            return parse(Files.readAllLines(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read weight file " + path, e);
        }
    }

    public static WeightTable parse(List<String> lines) {
        Map<String, String> metadata = new LinkedHashMap<>();
        List<Channel> singleChannels = new ArrayList<>();
        List<Double> singleWeights = new ArrayList<>();
        List<double[]> multiRows = new ArrayList<>();   // {logT, channel, weight}

        int lineNo = 0;
        for (String raw : lines) {
            lineNo++;
            String line = raw.strip();
            if (line.isEmpty() || line.startsWith("#")) continue;
            if (line.startsWith(SINGLE_HEADER) || line.startsWith(MULTI_HEADER)) continue;
            if (METADATA.matcher(line).matches()) {
                int eq = line.indexOf('=');
                metadata.put(line.substring(0, eq), line.substring(eq + 1).strip());
                continue;
            }

            String[] parts = line.split(",");
            try {
                if (parts.length == 2) {
                    singleChannels.add(Channel.parse(parts[0]));
                    singleWeights.add(Double.parseDouble(parts[1].strip()));
                } else if (parts.length == 3) {
                    multiRows.add(new double[]{
                            Double.parseDouble(parts[0].strip()),
                            Channel.parse(parts[1]).wavelength(),
                            Double.parseDouble(parts[2].strip())});
                } else {
                    LOG.debug("Ignoring weight file line {}: {}", lineNo, line);
                }
            } catch (IllegalArgumentException e) {
                throw new WeightFileFormatException("line " + lineNo + ": '" + line + "'", e);
            }
        }

        if (!multiRows.isEmpty() && !singleWeights.isEmpty()) {
            throw new WeightFileFormatException("mixes " + singleWeights.size() + " single-bin rows with "
                    + multiRows.size() + " multi-bin rows");
        }
        if (!multiRows.isEmpty()) {
            return multiBin(metadata, multiRows);
        }
        if (!singleWeights.isEmpty()) {
            if (new HashSet<>(singleChannels).size() != singleChannels.size()) {
                throw new WeightFileFormatException("duplicate channel in " + singleChannels);
            }
            double[] w = singleWeights.stream().mapToDouble(Double::doubleValue).toArray();
            return new WeightTable.SingleBin(List.copyOf(singleChannels), w,
                    number(metadata, "logt"), number(metadata, "scale"), Collections.unmodifiableMap(metadata));
        }
        throw new WeightFileFormatException("no weights found");
    }

    private static WeightTable.MultiBin multiBin(Map<String, String> metadata, List<double[]> rows) {
        List<Channel> channels;
        String declared = metadata.get("channels");
        if (declared != null && !declared.isBlank()) {
            channels = new ArrayList<>();
            try {
                for (String c : declared.split(",")) {
                    if (!c.isBlank()) channels.add(Channel.parse(c));
                }
            } catch (IllegalArgumentException e) {
                throw new WeightFileFormatException("channels=" + declared, e);
            }
        } else {
            SortedSet<Channel> seen = new TreeSet<>();
            for (double[] r : rows) seen.add(Channel.of((int) r[1]));
            channels = new ArrayList<>(seen);
        }

        double[] bins;
        String logtList = metadata.get("logt_list");
        if (logtList != null && !logtList.isBlank()) {
            try {
                bins = Arrays.stream(logtList.split(",")).filter(s -> !s.isBlank())
                        .mapToDouble(s -> Double.parseDouble(s.strip())).toArray();
            } catch (NumberFormatException e) {
                throw new WeightFileFormatException("logt_list=" + logtList, e);
            }
        } else {
            bins = rows.stream().mapToDouble(r -> r[0]).distinct().sorted().toArray();
        }

        double[][] table = new double[bins.length][channels.size()];
        for (double[] r : rows) {
            int b = indexOf(bins, r[0]);
            int j = channels.indexOf(Channel.of((int) r[1]));
            if (b < 0) {
                throw new WeightFileFormatException("row logT " + r[0] + " not in logt_list=" + logtList);
            }
            if (j < 0) {
                throw new WeightFileFormatException("row channel " + (int) r[1] + " not in channels=" + declared);
            }
            table[b][j] = r[2];
        }
        return new WeightTable.MultiBin(bins, List.copyOf(channels), table, Collections.unmodifiableMap(metadata));
    }

    public static void write(Path path, WeightSet weights) {
        try {
            Path parent = path.getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.writeString(path, format(weights), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write weight file " + path, e);
        }
    }

    public static String format(WeightSet weights) {
        List<String> lines = new ArrayList<>();
        weights.metadata().forEach((k, v) -> lines.add(k + "=" + v));
        if (weights.ratioCorrected()) {
            lines.add("ratio_mode=per-channel");
            StringJoiner joined = new StringJoiner(",", "ratios=", "");
            weights.ratios().forEach((ch, r) -> joined.add(ch + ":" + sci(r)));
            lines.add(joined.toString());
        }

        List<Channel> channels = weights.channels();
        if (weights.layout() == WeightSet.Layout.SINGLE_BIN) {
            lines.add(SINGLE_HEADER);
            double[] w = weights.single();
            for (int j = 0; j < channels.size(); j++) {
                lines.add(channels.get(j) + "," + sci(w[j]));
            }
        } else {
            lines.add(MULTI_HEADER);
            for (int b = 0; b < weights.binCount(); b++) {
                double[] w = weights.row(b);
                for (int j = 0; j < channels.size(); j++) {
                    lines.add(weights.bin(b) + "," + channels.get(j) + "," + sci(w[j]));
                }
            }
        }
        return String.join("\n", lines);
    }

    static String sci(double v) {
        return String.format(Locale.ROOT, "%.8e", v);
    }

    private static int indexOf(double[] bins, double logT) {
        for (int b = 0; b < bins.length; b++) {
            if (Math.abs(bins[b] - logT) <= 1e-9) return b;
        }
        return -1;
    }

    private static double number(Map<String, String> metadata, String key) {
        String v = metadata.get(key);
        if (v == null || v.isBlank()) return Double.NaN;
        try {
            return Double.parseDouble(v);
        } catch (NumberFormatException e) {
            throw new WeightFileFormatException(key + "=" + v + " is not a number", e);
        }
    }
}
