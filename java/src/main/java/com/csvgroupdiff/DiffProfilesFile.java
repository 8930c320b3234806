package com.csvgroupdiff;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Root of a profile YAML file: named {@link DiffProfile}s under {@code profiles}.
 */
public class DiffProfilesFile {
    private Map<String, DiffProfile> profiles = new LinkedHashMap<>();

    public DiffProfilesFile() {
    }

    public Map<String, DiffProfile> getProfiles() {
        return profiles;
    }

    public void setProfiles(Map<String, DiffProfile> profiles) {
        this.profiles = profiles != null ? new LinkedHashMap<>(profiles) : new LinkedHashMap<>();
    }

    public Optional<DiffProfile> find(String name) {
        return Optional.ofNullable(profiles.get(name));
    }

    /** Profile names in file order. */
    public Set<String> names() {
        return profiles.keySet();
    }
}
