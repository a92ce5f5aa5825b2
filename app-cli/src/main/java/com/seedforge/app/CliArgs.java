package com.seedforge.app;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * "&lt;command&gt; --flag value --switch" 형태의 단순 파서.
 * 값 없는 스위치는 SWITCHES에 등록된 것만 허용.
 */
final class CliArgs {
    static final Set<String> SWITCHES = Set.of("precheck-connections", "dry-run");

    private final String command;
    private final Map<String, String> values;

    private CliArgs(String command, Map<String, String> values) {
        this.command = command;
        this.values = values;
    }

    static CliArgs parse(String[] args) {
        if (args == null || args.length == 0) {
            throw new IllegalArgumentException("Missing command (seeds | multi-seeds | import-precheck)");
        }
        String command = args[0].trim().toLowerCase(Locale.ROOT);
        Map<String, String> values = new HashMap<>();
        for (int i = 1; i < args.length; i++) {
            String a = args[i];
            if (!a.startsWith("--") || a.length() == 2) {
                throw new IllegalArgumentException("Unexpected argument: " + a);
            }
            String name = a.substring(2);
            String inline = null;
            int eq = name.indexOf('=');
            if (eq > 0) {
                inline = name.substring(eq + 1);
                name = name.substring(0, eq);
            }
            if (SWITCHES.contains(name)) {
                values.put(name, inline == null ? "true" : inline);
                continue;
            }
            if (inline != null) {
                values.put(name, inline);
            } else if (i + 1 < args.length) {
                values.put(name, args[++i]);
            } else {
                throw new IllegalArgumentException("Missing value for --" + name);
            }
        }
        return new CliArgs(command, values);
    }

    String command() { return command; }

    boolean has(String name) { return values.containsKey(name); }

    String get(String name) { return values.get(name); }

    String get(String name, String def) { return values.getOrDefault(name, def); }

    boolean flag(String name) {
        String v = values.get(name);
        return v != null && !"false".equalsIgnoreCase(v);
    }

    int getInt(String name, int def) {
        String v = values.get(name);
        if (v == null) return def;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " must be an integer: \"" + v + "\"", e);
        }
    }
}
