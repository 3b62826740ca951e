package com.biomech.cfpg.io;

import com.biomech.cfpg.engine.PreCfpg;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.Data;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Settings shared by the queries of one {@code PathFinder}.
 *
 * JSON form, every key optional:
 * <pre>
 * {"signed": true, "targetPolarity": 1, "maxDepth": 6, "numSamples": 1000,
 *  "maxRounds": 50, "cycleFree": true, "seed": 42}
 * </pre>
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class PathQueryOptions {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Track edge signs and require {@link #targetPolarity} at the target. */
    private boolean signed;
    private int targetPolarity;
    /** Depth of the cached reach sets and the bound of the *UpTo queries. */
    private int maxDepth = 6;
    private int numSamples = 1000;
    private int maxRounds = PreCfpg.DEFAULT_MAX_ROUNDS;
    /** False answers with walks from the paths graph, which may repeat names. */
    private boolean cycleFree = true;
    /** Seed for the facade's random source; null draws a fresh one. */
    private Long seed;

    public static PathQueryOptions defaults() {
        return new PathQueryOptions();
    }

    public static PathQueryOptions load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return MAPPER.readValue(in, PathQueryOptions.class).validate();
        }
    }

    public static PathQueryOptions parse(String json) throws IOException {
        return MAPPER.readValue(json, PathQueryOptions.class).validate();
    }

    /**
     * Checks ranges.
     *
     * @return this
     * @throws IllegalArgumentException on the first invalid setting
     */
    public PathQueryOptions validate() {
        if (targetPolarity != 0 && targetPolarity != 1)
            throw new IllegalArgumentException("targetPolarity must be 0 or 1: " + targetPolarity);
        if (maxDepth < 0)
            throw new IllegalArgumentException("maxDepth must not be negative: " + maxDepth);
        if (numSamples < 0)
            throw new IllegalArgumentException("numSamples must not be negative: " + numSamples);
        if (maxRounds < 1)
            throw new IllegalArgumentException("maxRounds must be at least 1: " + maxRounds);
        return this;
    }
}
