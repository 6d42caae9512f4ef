package uk.gegc.covenhub.features.asset.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class ContentHashingTest {

    private static final String ABC_SHA256 = "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad";

    @Test
    @DisplayName("sha256Hex produces lowercase hex")
    void sha256Hex() {
        assertThat(ContentHashing.sha256Hex("abc".getBytes(StandardCharsets.UTF_8))).isEqualTo(ABC_SHA256);
        assertThat(ContentHashing.sha256Hex("abc")).isEqualTo(ABC_SHA256);
    }

    @Test
    @DisplayName("matches ignores case and surrounding whitespace but not content")
    void matches() {
        byte[] abc = "abc".getBytes(StandardCharsets.UTF_8);

        assertThat(ContentHashing.matches(abc, ABC_SHA256)).isTrue();
        assertThat(ContentHashing.matches(abc, " " + ABC_SHA256.toUpperCase() + " ")).isTrue();
        assertThat(ContentHashing.matches(abc, ABC_SHA256.replace('a', 'b'))).isFalse();
        assertThat(ContentHashing.matches(abc, "abc")).isFalse();
    }
}
