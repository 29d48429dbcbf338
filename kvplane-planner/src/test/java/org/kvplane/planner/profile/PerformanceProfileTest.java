package org.kvplane.planner.profile;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.kvplane.exception.ConfigException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PerformanceProfileTest {

    private static PerformanceProfile profile;

    @BeforeAll
    static void load() {
        profile = PerformanceProfile.load("classpath:performance-profile.json");
    }

    @Test
    void should_interpolate_prefill_between_points() {
        assertEquals(9000, profile.prefillThroughputPerGpu(320), 1e-9);
        assertEquals(12000, profile.prefillThroughputPerGpu(512), 1e-9);
    }

    @Test
    void should_clamp_prefill_outside_table() {
        assertEquals(6000, profile.prefillThroughputPerGpu(1), 1e-9);
        assertEquals(8500, profile.prefillThroughputPerGpu(100_000), 1e-9);
    }

    @Test
    void should_interpolate_decode_within_row() {
        assertEquals(2400, profile.decodeThroughputPerGpu(30, 512), 1e-9);
    }

    @Test
    void should_interpolate_decode_across_rows() {
        // halfway between the 512 row (2400) and the 2048 row (1450)
        assertEquals(1925, profile.decodeThroughputPerGpu(30, 1280), 1e-9);
    }

    @Test
    void should_clamp_decode_outside_table() {
        assertEquals(80, profile.decodeThroughputPerGpu(1, 50_000), 1e-9);
        assertEquals(4800, profile.decodeThroughputPerGpu(500, 16), 1e-9);
    }

    @Test
    void should_sort_unordered_file(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("profile.json");
        Files.write(file, ("{\"prefill\":[{\"inputLen\":200,\"throughputPerGpu\":20},{\"inputLen\":100,\"throughputPerGpu\":10}],"
                + "\"decode\":[{\"contextLen\":10,\"points\":[{\"itlMs\":20,\"throughputPerGpu\":2},"
                + "{\"itlMs\":10,\"throughputPerGpu\":1}]}]}").getBytes(StandardCharsets.UTF_8));

        PerformanceProfile loaded = PerformanceProfile.load(file.toString());

        assertEquals(15, loaded.prefillThroughputPerGpu(150), 1e-9);
        assertEquals(1.5, loaded.decodeThroughputPerGpu(15, 10), 1e-9);
    }

    @Test
    void should_reject_missing_tables(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("empty.json");
        Files.write(file, "{\"prefill\":[]}".getBytes(StandardCharsets.UTF_8));

        assertThrows(ConfigException.class, () -> PerformanceProfile.load(file.toString()));
        assertThrows(ConfigException.class, () -> PerformanceProfile.load(dir.resolve("absent.json").toString()));
    }
}
