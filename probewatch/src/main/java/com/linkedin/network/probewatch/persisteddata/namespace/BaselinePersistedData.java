/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.network.probewatch.persisteddata.namespace;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import com.linkedin.network.probewatch.persisteddata.ValueMappedMap;
import com.linkedin.network.probewatch.persisteddata.file.FilePersistedMapException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The last observed latency and the last observed traceroute path of every (probe, target) pair.
 * Each accessor returns the previously stored value and overwrites it with the current one, so a
 * baseline is always the most recent observation rather than an average.
 * <p>
 * Failures to read or write the backing store are logged and reported as "no baseline" or
 * "write skipped". They never propagate to the caller.
 */
public class BaselinePersistedData {

    private static final Logger LOG = LoggerFactory.getLogger(BaselinePersistedData.class);
    private static final Gson GSON = new Gson();
    static final String KEY_SEPARATOR = "_";

    // Latency baselines in milliseconds.
    private final Map<String, Double> _latencyBaselines;

    // Traceroute hop IP baselines.
    private final Map<String, List<String>> _hopBaselines;

    /**
     * @param persistedMap The map to store baselines in. It is assumed to be persisted
     * independently.
     */
    public BaselinePersistedData(Map<String, String> persistedMap) {
        this._latencyBaselines = Namespace.PING.embed(
                new ValueMappedMap<>(
                        persistedMap,
                        BaselinePersistedData::serializeLatency,
                        BaselinePersistedData::deserializeLatency));
        this._hopBaselines = Namespace.TRACEROUTE.embed(
                new ValueMappedMap<>(
                        persistedMap,
                        BaselinePersistedData::serializeHops,
                        BaselinePersistedData::deserializeHops));
    }

    /**
     * Get the latency baseline of the given probe and target and replace it with the current
     * latency. A {@code null} current latency leaves the stored baseline untouched.
     *
     * @param probeId Probe id.
     * @param target Target address.
     * @param currentRttMs The current average round trip time, may be {@code null}.
     * @return The previous latency baseline, or {@code null} if there is none or it is unreadable.
     */
    @Nullable
    public Double getAndUpdateLatency(@Nonnull String probeId, String target, @Nullable Double currentRttMs) {
        String key = baselineKey(probeId, target);
        Double previous = read(this._latencyBaselines, key);
        if (currentRttMs != null) {
            write(this._latencyBaselines, key, currentRttMs);
        }
        LOG.debug("Latency baseline of {}: previous={}, current={}", key, previous, currentRttMs);
        return previous;
    }

    /**
     * Get the hop baseline of the given probe and target and replace it with the current hops.
     * The current hops are always stored, an empty path included.
     *
     * @param probeId Probe id.
     * @param target Target address.
     * @param currentHops The hop IPs of the current traceroute.
     * @return The previous hop baseline, or {@code null} if there is none or it is unreadable.
     */
    @Nullable
    public List<String> getAndUpdateHops(@Nonnull String probeId, String target, @Nonnull List<String> currentHops) {
        String key = baselineKey(probeId, target);
        List<String> previous = read(this._hopBaselines, key);
        write(this._hopBaselines, key, new ArrayList<>(currentHops));
        LOG.debug("Hop baseline of {}: previous={}, current={}", key, previous, currentHops);
        return previous;
    }

    /**
     * @param probeId Probe id.
     * @param target Target address.
     * @return The key of the baselines of the given probe and target, without the namespace.
     */
    static String baselineKey(String probeId, String target) {
        return probeId + KEY_SEPARATOR + target;
    }

    private static <V> V read(Map<String, V> baselines, String key) {
        try {
            return baselines.get(key);
        } catch (FilePersistedMapException e) {
            LOG.warn("Failed to read baseline {}, treating it as absent.", key, e);
            return null;
        }
    }

    private static <V> void write(Map<String, V> baselines, String key, V value) {
        try {
            baselines.put(key, value);
        } catch (FilePersistedMapException e) {
            LOG.warn("Failed to write baseline {}, keeping the stored one.", key, e);
        }
    }

    /**
     * Package private for testing.
     *
     * @param latency Latency in milliseconds.
     * @return The JSON representation of the latency baseline, or {@code null} for a non-number.
     */
    static String serializeLatency(Object latency) {
        if (!(latency instanceof Number)) {
            return null;
        }
        return GSON.toJson(new LatencyBaseline(((Number) latency).doubleValue()));
    }

    /**
     * Package private for testing.
     *
     * @param json The stored latency baseline.
     * @return The latency in milliseconds, or {@code null} if it could not be parsed.
     */
    static Double deserializeLatency(String json) {
        try {
            LatencyBaseline baseline = GSON.fromJson(json, LatencyBaseline.class);
            return baseline == null ? null : baseline._avgRtt;
        } catch (JsonParseException | IllegalStateException e) {
            LOG.warn("Ignoring unparseable latency baseline {}.", json, e);
            return null;
        }
    }

    /**
     * Package private for testing.
     *
     * @param hops A list of hop IPs.
     * @return The JSON representation of the hop baseline, or {@code null} for a non-list.
     */
    static String serializeHops(Object hops) {
        if (!(hops instanceof List)) {
            return null;
        }
        List<String> hopIps = ((List<?>) hops).stream().map(String::valueOf).collect(Collectors.toList());
        return GSON.toJson(new HopBaseline(hopIps));
    }

    /**
     * Package private for testing.
     *
     * @param json The stored hop baseline.
     * @return The hop IPs, or {@code null} if they could not be parsed.
     */
    static List<String> deserializeHops(String json) {
        try {
            HopBaseline baseline = GSON.fromJson(json, HopBaseline.class);
            if (baseline == null || baseline._hopIps == null) {
                return null;
            }
            return baseline._hopIps.stream().filter(Objects::nonNull).collect(Collectors.toList());
        } catch (JsonParseException | IllegalStateException e) {
            LOG.warn("Ignoring unparseable hop baseline {}.", json, e);
            return null;
        }
    }

    private static final class LatencyBaseline {
        @SerializedName("avg_rtt")
        private Double _avgRtt;

        private LatencyBaseline() {
        }

        LatencyBaseline(Double avgRtt) {
            this._avgRtt = avgRtt;
        }
    }

    private static final class HopBaseline {
        @SerializedName("hop_ips")
        private List<String> _hopIps;

        private HopBaseline() {
        }

        HopBaseline(List<String> hopIps) {
            this._hopIps = hopIps;
        }
    }
}
