package com.cscript.compiler.build.profile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cscript.compiler.model.ProfileSample;

/**
 * Reads the {@code name count} lines written by the instrumented program.
 * Counts for a name appearing on several lines are summed; lines that do not
 * parse are skipped.
 */
public class ProfileSampleReader {
    private static final Logger log = LoggerFactory.getLogger(ProfileSampleReader.class);

    /**
     * A missing file yields an empty sample; the program may have exited
     * without reaching any instrumented function.
     */
    public ProfileSample read(Path file) throws IOException {
        if (!Files.exists(file)) {
            log.debug("No profile written at {}", file);
            return ProfileSample.empty();
        }
        return parse(Files.readString(file, StandardCharsets.UTF_8));
    }

    public ProfileSample parse(String content) {
        Map<String, Long> counts = new HashMap<>();
        int lineNumber = 0;
        for (String line : content.split("\\R")) {
            lineNumber++;
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }

            String[] parts = trimmed.split("\\s+");
            if (parts.length != 2) {
                log.debug("Skipping profile line {}: '{}'", lineNumber, trimmed);
                continue;
            }
            try {
                long count = Long.parseLong(parts[1]);
                counts.merge(parts[0], count, Long::sum);
            } catch (NumberFormatException e) {
                log.debug("Skipping profile line {} with bad count '{}'", lineNumber, parts[1]);
            }
        }
        return ProfileSample.of(counts);
    }
}
