package com.aurelius.cli;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CommandLineOptionsTest {

    private static final Set<String> FLAGS = Set.of("strict", "no-strict");

    @Test
    void testSpaceAndEqualsForms() {
        CommandLineOptions options = CommandLineOptions.parse(
                new String[] { "run", "--goal", "trend under DD<10%", "--data=prices.parquet" }, FLAGS);

        assertEquals("run", options.getCommand());
        assertEquals("trend under DD<10%", options.get("goal"));
        assertEquals("prices.parquet", options.get("data"));
    }

    @Test
    void testBooleanFlagsNeverConsumeValues() {
        CommandLineOptions options = CommandLineOptions.parse(
                new String[] { "run", "--no-strict", "extra", "--verbose" }, FLAGS);

        assertTrue(options.hasFlag("no-strict"));
        assertTrue(options.hasFlag("verbose"));
        assertEquals(List.of("extra"), options.getPositional());
        assertTrue(options.has("no-strict"));
        assertFalse(options.has("goal"));
    }

    @Test
    void testNumericOption() {
        CommandLineOptions options = CommandLineOptions.parse(
                new String[] { "run", "--max-drawdown", "0.15", "--bad", "abc" }, FLAGS);

        assertEquals(0.15, options.getDouble("max-drawdown"));
        assertNull(options.getDouble("missing"));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> options.getDouble("bad"));
        assertTrue(e.getMessage().contains("--bad"));
    }

    @Test
    void testBooleanFlagRejectsAssignedValue() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> CommandLineOptions.parse(new String[] { "run", "--no-strict=true" }, FLAGS));

        assertTrue(e.getMessage().contains("--no-strict"));
    }

    @Test
    void testNoArguments() {
        CommandLineOptions options = CommandLineOptions.parse(new String[0], FLAGS);

        assertNull(options.getCommand());
        assertTrue(options.getPositional().isEmpty());
    }
}
