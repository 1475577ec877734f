/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.cli;

import java.util.*;

/**
 * {@code --name value} options and {@code --flag} switches of one subcommand.
 */
public final class CliArgs {

    private final Map<String, String> values;
    private final Set<String> flags;

    private CliArgs(Map<String, String> values, Set<String> flags) {
        this.values = values;
        this.flags = flags;
    }

    /**
     * @param args     arguments after the subcommand name
     * @param switches option names that take no value
     * @throws UsageException on a stray argument or an option without its value
     */
    public static CliArgs parse(String[] args, Set<String> switches) {
        Map<String, String> values = new LinkedHashMap<>();
        Set<String> flags = new LinkedHashSet<>();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (!a.startsWith("--")) {
                throw new UsageException("Unexpected argument '" + a + "'");
            }
            String name = a.substring(2);
            int eq = name.indexOf('=');
            if (eq >= 0) {
                values.put(name.substring(0, eq), name.substring(eq + 1));
            } else if (switches.contains(name)) {
                flags.add(name);
            } else if (i + 1 < args.length) {
                values.put(name, args[++i]);
            } else {
                throw new UsageException("Option --" + name + " needs a value");
            }
        }
        return new CliArgs(values, flags);
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    public boolean flag(String name) {
        return flags.contains(name);
    }

    public String get(String name, String def) {
        return values.getOrDefault(name, def);
    }

    public String require(String name) {
        String v = values.get(name);
        if (v == null || v.isBlank()) {
            throw new UsageException("Missing required option --" + name);
        }
        return v;
    }

    public double getDouble(String name, double def) {
        String v = values.get(name);
        return v == null ? def : parseDouble(name, v);
    }

    public Double getDoubleOrNull(String name) {
        String v = values.get(name);
        return v == null || v.isBlank() ? null : parseDouble(name, v);
    }

    public List<Double> getDoubles(String name) {
        String v = values.get(name);
        if (v == null) return null;
        List<Double> out = new ArrayList<>();
        for (String part : v.split(",")) {
            if (!part.isBlank()) out.add(parseDouble(name, part.trim()));
        }
        return out;
    }

    private static double parseDouble(String name, String v) {
        try {
            return Double.parseDouble(v);
        } catch (NumberFormatException e) {
            throw new UsageException("--" + name + " expects a number, got '" + v + "'", e);
        }
    }
}
