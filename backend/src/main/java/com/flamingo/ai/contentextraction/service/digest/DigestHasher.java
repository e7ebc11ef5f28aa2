package com.flamingo.ai.contentextraction.service.digest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.flamingo.ai.contentextraction.config.ExtractionConfig;
import com.flamingo.ai.contentextraction.service.model.SectionDigest;
import java.nio.charset.StandardCharsets;
import java.util.HexFormat;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.crypto.digests.Blake2bDigest;
import org.springframework.stereotype.Component;

/**
 * Content-addresses a {@link SectionDigest}: compact JSON in fixed property order, hashed with
 * BLAKE2b to 16 bytes and rendered as 32 lowercase hex characters.
 *
 * <p>A dedicated mapper is used so that application-wide Jackson customizations cannot change
 * the canonical form.
 */
@Component
@Slf4j
public class DigestHasher {

  static final int DIGEST_LENGTH_BYTES = 16;
  private static final int MAX_KEY_LENGTH_BYTES = 64;

  private final ObjectMapper canonicalMapper = JsonMapper.builder().build();
  private final byte[] key;

  public DigestHasher(ExtractionConfig extractionConfig) {
    String configuredKey = extractionConfig.getDigest().getHashKey();
    if (configuredKey == null || configuredKey.isEmpty()) {
      this.key = null;
    } else {
      byte[] bytes = configuredKey.getBytes(StandardCharsets.UTF_8);
      if (bytes.length > MAX_KEY_LENGTH_BYTES) {
        throw new IllegalStateException(
            "extraction.digest.hash-key must be at most "
                + MAX_KEY_LENGTH_BYTES
                + " bytes, got "
                + bytes.length);
      }
      this.key = bytes;
      log.info("Digest hashing is keyed");
    }
  }

  /**
   * Hashes the canonical form of {@code digest}.
   *
   * @param digest digest to hash
   * @return 32 lowercase hex characters
   */
  public String hash(SectionDigest digest) {
    byte[] input = canonicalForm(digest).getBytes(StandardCharsets.UTF_8);
    // Blake2bDigest is stateful and not thread-safe.
    Blake2bDigest blake2b = new Blake2bDigest(key, DIGEST_LENGTH_BYTES, null, null);
    blake2b.update(input, 0, input.length);
    byte[] out = new byte[DIGEST_LENGTH_BYTES];
    blake2b.doFinal(out, 0);
    return HexFormat.of().formatHex(out);
  }

  /** Returns the exact string that {@link #hash} feeds to the digest. */
  public String canonicalForm(SectionDigest digest) {
    try {
      return canonicalMapper.writeValueAsString(digest);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize section digest", e);
    }
  }
}
