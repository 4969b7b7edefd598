package org.neuralchilli.cellflow.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CacheKeyTest {

    @Test
    void shouldNormalizeToLowercase() {
        CacheKey key = new CacheKey("AB".repeat(32));

        assertThat(key.hex()).isEqualTo("ab".repeat(32));
        assertThat(key.shortForm()).isEqualTo("abababababab");
    }

    @Test
    void shouldBuildFromDigest() {
        byte[] digest = new byte[32];
        digest[0] = (byte) 0xff;

        CacheKey key = CacheKey.fromDigest(digest);

        assertThat(key.hex()).startsWith("ff00").hasSize(64);
        assertThat(key.isEmpty()).isFalse();
    }

    @Test
    void shouldRejectWrongLength() {
        assertThatThrownBy(() -> new CacheKey("abc"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("64 hex characters");
    }

    @Test
    void shouldRejectNonHex() {
        assertThatThrownBy(() -> new CacheKey("z".repeat(64)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid cache key");
    }
}
