package com.pathwise.planlibrary.load;

import com.pathwise.planlibrary.PlanLibraryConfig;
import com.pathwise.planlibrary.config.PlanLibrary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Loads the plan library in order: external {@link PlanLibrarySource} → {@code <configDir>/<fileName>}
 * → bundled classpath resource {@value #BUNDLED_RESOURCE}. A document that fails to parse or validate
 * is skipped with a warning and the next source is tried. When nothing loads, the library is empty
 * and no plan is ever selected.
 */
public final class PlanLibraryLoader {

    private static final Logger log = LoggerFactory.getLogger(PlanLibraryLoader.class);

    public static final String BUNDLED_RESOURCE = "plan_library.json";

    private final PlanLibrarySource source;
    private final Path configDir;
    private final String fileName;

    /**
     * @param source    external source (may be null; treated as {@link PlanLibrarySource#NONE})
     * @param configDir directory holding the library file (may be null to skip the file step)
     * @param fileName  library file name inside {@code configDir}; null = {@value #BUNDLED_RESOURCE}
     */
    public PlanLibraryLoader(PlanLibrarySource source, Path configDir, String fileName) {
        this.source = source != null ? source : PlanLibrarySource.NONE;
        this.configDir = configDir;
        this.fileName = fileName != null && !fileName.isBlank() ? fileName : BUNDLED_RESOURCE;
    }

    /**
     * Loads the first valid library from the configured sources.
     *
     * @return the library (never null; empty when no source has a valid document)
     */
    public PlanLibrary loadLibrary() {
        Optional<PlanLibrary> library = tryLoadFromSource()
                .or(this::tryLoadFromFile)
                .or(this::tryLoadFromClasspath);
        if (library.isEmpty()) {
            log.warn("No plan library found (source={}, dir={}, file={}, classpath={}); graph workflows disabled",
                    source.describe(), configDir, fileName, BUNDLED_RESOURCE);
            return PlanLibrary.empty();
        }
        return library.get();
    }

    Optional<PlanLibrary> tryLoadFromSource() {
        Optional<String> json;
        try {
            json = source.fetch();
        } catch (RuntimeException e) {
            log.warn("Plan library source {} failed: {}", source.describe(), e.getMessage());
            return Optional.empty();
        }
        return json.flatMap(j -> parseAndValidate(j, "source:" + source.describe()));
    }

    Optional<PlanLibrary> tryLoadFromFile() {
        if (configDir == null) return Optional.empty();
        Path file = configDir.resolve(fileName);
        if (!Files.isRegularFile(file)) return Optional.empty();
        try {
            return parseAndValidate(Files.readString(file), "file:" + file);
        } catch (IOException e) {
            log.warn("Failed to read plan library file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    Optional<PlanLibrary> tryLoadFromClasspath() {
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) cl = PlanLibraryLoader.class.getClassLoader();
        try (InputStream in = cl.getResourceAsStream(BUNDLED_RESOURCE)) {
            if (in == null) return Optional.empty();
            return parseAndValidate(new String(in.readAllBytes(), StandardCharsets.UTF_8), "classpath:" + BUNDLED_RESOURCE);
        } catch (IOException e) {
            log.warn("Failed to read bundled plan library {}: {}", BUNDLED_RESOURCE, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<PlanLibrary> parseAndValidate(String json, String origin) {
        try {
            PlanLibrary library = PlanLibraryValidator.validate(PlanLibraryConfig.fromJson(json));
            log.info("Plan library loaded | origin={} | version={} | plans={}",
                    origin, library.getVersion(), library.getPlans().size());
            return Optional.of(library);
        } catch (PlanLibraryValidationException e) {
            log.warn("Plan library from {} rejected: {}", origin, e.getProblems());
            return Optional.empty();
        } catch (RuntimeException e) {
            log.warn("Failed to parse plan library from {}: {}", origin, e.getMessage());
            return Optional.empty();
        }
    }
}
