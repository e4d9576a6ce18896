package com.aurelius.config;

import com.aurelius.core.tool.ToolType;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ToolBinaryLocatorTest {

    @TempDir
    Path tempDir;

    @Test
    @EnabledOnOs({ OS.LINUX, OS.MAC })
    void testFindsBinaryInSearchDir() throws Exception {
        Path release = Files.createDirectories(tempDir.resolve("target/release"));
        Path engine = Files.writeString(release.resolve("quant_engine"), "#!/bin/sh\n");
        assertTrue(engine.toFile().setExecutable(true));

        ToolBinaryLocator locator = new ToolBinaryLocator(
                "", "quant_engine", "", "hipcortex", release.toString());

        assertEquals(engine.toAbsolutePath(), locator.locate(ToolType.Backend.ENGINE));
    }

    @Test
    @EnabledOnOs({ OS.LINUX, OS.MAC })
    void testOverrideWinsOverConfiguredPath() throws Exception {
        Path override = Files.writeString(tempDir.resolve("my_engine"), "#!/bin/sh\n");
        assertTrue(override.toFile().setExecutable(true));

        ToolBinaryLocator locator = new ToolBinaryLocator(
                tempDir.resolve("configured_engine").toString(), "quant_engine", "", "hipcortex", "");

        assertEquals(override.toAbsolutePath(),
                locator.locate(ToolType.Backend.ENGINE, override.toString()));
    }

    @Test
    void testMissingConfiguredPathFails() {
        ToolBinaryLocator locator = new ToolBinaryLocator(
                "", "quant_engine", tempDir.resolve("nope").toString(), "hipcortex", "");

        ToolBinaryLocator.BinaryNotFoundException e = assertThrows(
                ToolBinaryLocator.BinaryNotFoundException.class,
                () -> locator.locate(ToolType.Backend.MEMORY));
        assertTrue(e.getMessage().contains("MEMORY"));
    }

    @Test
    void testUnknownBinaryNameFails() {
        ToolBinaryLocator locator = new ToolBinaryLocator(
                "", "aurelius-no-such-binary-xyz", "", "hipcortex", tempDir.toString());

        assertThrows(ToolBinaryLocator.BinaryNotFoundException.class,
                () -> locator.locate(ToolType.Backend.ENGINE));
    }
}
