// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.fedsim;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.random.RandomGenerator;
import java.util.random.RandomGeneratorFactory;

/// Derives random generator seeds that are identical in every process and every run. The seed is the first eight
/// bytes, big-endian, of `SHA-256("<key>_<scenarioSeed>")` in UTF-8. `String.hashCode()` and identity hashes must never
/// be used for this.
public final class DeterministicSeed {

  /// The generator algorithm is fixed so that a JDK default change cannot alter a run.
  public static final String ALGORITHM = "L64X128MixRandom";

  private DeterministicSeed() {
  }

  public static long derive(String key, long scenarioSeed) {
    final MessageDigest sha256;
    try {
      sha256 = MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException e) {
      // every JDK is required to ship SHA-256
      throw new IllegalStateException(e);
    }
    final byte[] digest = sha256.digest((key + "_" + scenarioSeed).getBytes(StandardCharsets.UTF_8));
    return ByteBuffer.wrap(digest, 0, Long.BYTES).getLong();
  }

  public static RandomGenerator random(String key, long scenarioSeed) {
    return RandomGeneratorFactory.of(ALGORITHM).create(derive(key, scenarioSeed));
  }
}
