package com.csvgroupdiff;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import lombok.extern.java.Log;

/**
 * Loads {@link DiffProfile}s from YAML. The bundled {@code /diff-profiles.yaml}
 * is used when no file is given.
 */
@Log
public class DiffProfileLoader {
    public static final String BUNDLED_PROFILES = "/diff-profiles.yaml";
    public static final String DEFAULT_PROFILE = "default";

    public static DiffProfilesFile load(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new FileNotFoundException("Profile file not found: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            return parse(in, path.toString());
        }
    }

    public static DiffProfilesFile loadBundled() throws IOException {
        try (InputStream in = DiffProfileLoader.class.getResourceAsStream(BUNDLED_PROFILES)) {
            if (in == null) {
                log.warning("Bundled " + BUNDLED_PROFILES + " not found, using built-in defaults");
                return new DiffProfilesFile();
            }
            return parse(in, BUNDLED_PROFILES);
        }
    }

    /**
     * Picks {@code name} out of the given file, or the bundled profiles when {@code path} is null.
     * The name {@code default} always resolves, falling back to built-in settings.
     */
    public static DiffProfile resolve(Path path, String name) throws IOException {
        DiffProfilesFile file = path != null ? load(path) : loadBundled();
        String profileName = name != null ? name : DEFAULT_PROFILE;
        if (file.find(profileName).isEmpty()) {
            if (DEFAULT_PROFILE.equals(profileName)) {
                log.info("No '" + DEFAULT_PROFILE + "' profile found, using built-in defaults");
                return DiffProfile.defaults();
            }
            throw new IOException("Unknown profile '" + profileName + "'; available: "
                    + String.join(", ", file.names()));
        }
        log.info("Using profile '" + profileName + "'" + (path != null ? " from " + path : ""));
        return file.find(profileName).get();
    }

    private static DiffProfilesFile parse(InputStream in, String source) throws IOException {
        try {
            Yaml yaml = new Yaml(new Constructor(DiffProfilesFile.class, new LoaderOptions()));
            DiffProfilesFile file = yaml.load(in);
            return file != null ? file : new DiffProfilesFile();
        } catch (YAMLException e) {
            throw new IOException("Invalid profile file " + source + ": " + e.getMessage(), e);
        }
    }
}
