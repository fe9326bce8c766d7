package com.gnovoa.tennis.fixtures;

import com.gnovoa.tennis.model.League;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Deterministic match numbering.
 *
 * <p>Each league gets a stable base id in {@code [100000, 999999]} derived from its identity, so
 * regenerating fixtures for the same league yields the same ids.
 */
public final class MatchIds {

    private MatchIds() {}

    public static long baseId(League league) {
        String key = league.id() + "-" + league.year() + "-" + league.name() + "-" + league.section() + "-" + league.division();
        try {
            byte[] digest = MessageDigest.getInstance("MD5").digest(key.getBytes(StandardCharsets.UTF_8));
            long hash = Long.parseLong(HexFormat.of().formatHex(digest, 0, 4), 16);
            return 100_000L + (hash % 900_000L);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
