package com.cscript.compiler.build.profile;

import com.cscript.compiler.model.ProfileSample;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ProfileSampleReader.
 */
class ProfileSampleReaderTest {

    @TempDir
    Path tempDir;

    private final ProfileSampleReader reader = new ProfileSampleReader();

    @Test
    void testParsesAndSumsCounts() {
        ProfileSample sample = reader.parse("""
                main 1
                step 400
                step 100

                garbage
                bad count
                """);

        assertThat(sample.getHitCounts()).containsOnlyKeys("main", "step");
        assertThat(sample.countOf("step")).isEqualTo(500L);
        assertThat(sample.countOf("missing")).isZero();
    }

    @Test
    void testReadsFile() throws IOException {
        Path file = tempDir.resolve("profile.txt");
        Files.writeString(file, "main 1\r\nloop 7\r\n");

        ProfileSample sample = reader.read(file);

        assertThat(sample.countOf("loop")).isEqualTo(7L);
        assertThat(sample.countOf("main")).isEqualTo(1L);
    }

    @Test
    void testMissingFileIsEmpty() throws IOException {
        assertThat(reader.read(tempDir.resolve("absent.txt")).isEmpty()).isTrue();
    }
}
