package com.aurelius.cli;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Raw argument parsing for the command line.
 *
 * Accepts "--name value", "--name=value" and bare boolean flags
 * ("--strict", "--no-strict"). The first non-option argument is the command.
 * Spring's ApplicationArguments only understands the "=" form, which is why
 * this works on the source args.
 */
public final class CommandLineOptions {

    private final String command;
    private final Map<String, String> values;
    private final Set<String> flags;
    private final List<String> positional;

    private CommandLineOptions(String command, Map<String, String> values, Set<String> flags, List<String> positional) {
        this.command = command;
        this.values = Collections.unmodifiableMap(values);
        this.flags = Collections.unmodifiableSet(flags);
        this.positional = Collections.unmodifiableList(positional);
    }

    /**
     * @param booleanFlags option names that never take a value
     * @throws IllegalArgumentException when a boolean flag is given as "--name=value"
     */
    public static CommandLineOptions parse(String[] args, Set<String> booleanFlags) {
        String command = null;
        Map<String, String> values = new HashMap<>();
        Set<String> flags = new HashSet<>();
        List<String> positional = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];

            if (!arg.startsWith("--")) {
                if (command == null) {
                    command = arg;
                } else {
                    positional.add(arg);
                }
                continue;
            }

            String body = arg.substring(2);
            int eq = body.indexOf('=');
            if (eq >= 0) {
                String name = body.substring(0, eq);
                if (booleanFlags.contains(name)) {
                    throw new IllegalArgumentException("--" + name + " is a flag and takes no value");
                }
                values.put(name, body.substring(eq + 1));
            } else if (booleanFlags.contains(body)) {
                flags.add(body);
            } else if (i + 1 < args.length && !args[i + 1].startsWith("--")) {
                values.put(body, args[++i]);
            } else {
                flags.add(body);
            }
        }

        return new CommandLineOptions(command, values, flags, positional);
    }

    public String getCommand() {
        return command;
    }

    public String get(String name) {
        return values.get(name);
    }

    public boolean has(String name) {
        return values.containsKey(name) || flags.contains(name);
    }

    public boolean hasFlag(String name) {
        return flags.contains(name);
    }

    public List<String> getPositional() {
        return positional;
    }

    /**
     * @throws IllegalArgumentException when the value is not a number
     */
    public Double getDouble(String name) {
        String raw = values.get(name);
        if (raw == null) {
            return null;
        }
        try {
            return Double.valueOf(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " expects a number, got '" + raw + "'");
        }
    }
}
