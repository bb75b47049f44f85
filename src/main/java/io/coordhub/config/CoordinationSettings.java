package io.coordhub.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.coordhub.model.TaskKind;
import io.coordhub.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Tunables read from {@code coordhub-settings.json}. Every field is optional; out-of-range values are raised to
 * their floor instead of being rejected.
 */
public record CoordinationSettings(
        long claimTtlMs,
        long sweepIntervalMs,
        boolean sweepEnabled,
        long instanceTimeoutMs,
        int searchLimitDefault,
        Map<String, String> capabilityByTaskKind
) {
    public CoordinationSettings {
        capabilityByTaskKind = capabilityByTaskKind == null
                ? defaultCapabilities()
                : Collections.unmodifiableMap(new LinkedHashMap<>(capabilityByTaskKind));
    }

    public static CoordinationSettings defaults() {
        return new CoordinationSettings(
                CoordHubConfig.DEFAULT_CLAIM_TTL_MS,
                CoordHubConfig.DEFAULT_SWEEP_INTERVAL_MS,
                true,
                CoordHubConfig.DEFAULT_INSTANCE_TIMEOUT_MS,
                CoordHubConfig.DEFAULT_SEARCH_LIMIT,
                defaultCapabilities()
        );
    }

    public static CoordinationSettings load(Path file) {
        CoordinationSettings defaults = defaults();
        if (file == null || !Files.exists(file)) {
            return defaults;
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load coordination settings: " + file, e);
        }
    }

    public static CoordinationSettings fromFile(SettingsFile file, CoordinationSettings defaults) {
        if (file == null) {
            return defaults;
        }
        long claimTtl = sanitizeLong(file.claimTtlMs(), defaults.claimTtlMs(), 1_000L);
        long sweepInterval = sanitizeLong(file.sweepIntervalMs(), defaults.sweepIntervalMs(), 1_000L);
        boolean sweepEnabled = file.sweepEnabled() == null ? defaults.sweepEnabled() : file.sweepEnabled();
        long instanceTimeout = sanitizeLong(file.instanceTimeoutMs(), defaults.instanceTimeoutMs(), 0L);
        int searchLimit = sanitizeInt(file.searchLimitDefault(), defaults.searchLimitDefault(), 1);
        Map<String, String> capabilities = new LinkedHashMap<>(defaults.capabilityByTaskKind());
        if (file.capabilityByTaskKind() != null) {
            file.capabilityByTaskKind().forEach((kind, capability) -> {
                if (TaskKind.find(kind).isEmpty() || capability == null || capability.isBlank()) {
                    return;
                }
                capabilities.put(TaskKind.fromString(kind).wireName(), capability.trim());
            });
        }
        return new CoordinationSettings(claimTtl, sweepInterval, sweepEnabled, instanceTimeout, searchLimit, capabilities);
    }

    public String requiredCapability(TaskKind kind) {
        return capabilityByTaskKind.getOrDefault(kind.wireName(), kind.defaultCapability());
    }

    public List<String> diff(CoordinationSettings other) {
        List<String> out = new ArrayList<>();
        if (other == null) {
            return out;
        }
        if (claimTtlMs != other.claimTtlMs) out.add("claimTtlMs");
        if (sweepIntervalMs != other.sweepIntervalMs) out.add("sweepIntervalMs");
        if (sweepEnabled != other.sweepEnabled) out.add("sweepEnabled");
        if (instanceTimeoutMs != other.instanceTimeoutMs) out.add("instanceTimeoutMs");
        if (searchLimitDefault != other.searchLimitDefault) out.add("searchLimitDefault");
        if (!Objects.equals(capabilityByTaskKind, other.capabilityByTaskKind)) out.add("capabilityByTaskKind");
        return out;
    }

    private static Map<String, String> defaultCapabilities() {
        Map<String, String> out = new LinkedHashMap<>();
        for (TaskKind kind : TaskKind.values()) {
            out.put(kind.wireName(), kind.defaultCapability());
        }
        return Collections.unmodifiableMap(out);
    }

    private static long sanitizeLong(Long raw, long fallback, long floor) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(floor, raw);
    }

    private static int sanitizeInt(Integer raw, int fallback, int floor) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(floor, raw);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SettingsFile(
            Long claimTtlMs,
            Long sweepIntervalMs,
            Boolean sweepEnabled,
            Long instanceTimeoutMs,
            Integer searchLimitDefault,
            Map<String, String> capabilityByTaskKind
    ) {
    }
}
