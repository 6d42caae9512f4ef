package uk.gegc.covenhub.features.asset.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.covenhub.features.asset.config.AssetStorageProperties;
import uk.gegc.covenhub.features.asset.domain.model.AssetType;

import static org.assertj.core.api.Assertions.assertThat;

class StorageKeyFactoryTest {

    @Test
    @DisplayName("hashedFileName keeps the lower-cased extension and never repeats")
    void hashedFileName() {
        StorageKeyFactory factory = new StorageKeyFactory(new AssetStorageProperties());

        String first = factory.hashedFileName("Blood Moon.JPEG", "user-1");
        String second = factory.hashedFileName("Blood Moon.JPEG", "user-1");

        assertThat(first).matches("^[0-9a-f]{64}\\.jpeg$");
        assertThat(first).isNotEqualTo(second);
        assertThat(factory.hashedFileName("README", "user-1")).matches("^[0-9a-f]{64}$");
    }

    @Test
    @DisplayName("storageKey nests under the trimmed directory prefix and the type folder")
    void storageKey() {
        AssetStorageProperties properties = new AssetStorageProperties();
        StorageKeyFactory factory = new StorageKeyFactory(properties);

        assertThat(factory.storageKey(AssetType.VIDEO, "abc.mp4")).isEqualTo("assets/videos/abc.mp4");

        properties.setDirectoryPrefix("/prod/");
        assertThat(factory.storageKey(AssetType.IMAGE, "abc.png")).isEqualTo("prod/assets/images/abc.png");
    }

    @Test
    @DisplayName("storageUrl prefers the reported location, else joins the public base URL")
    void storageUrl() {
        AssetStorageProperties properties = new AssetStorageProperties();
        properties.setPublicBaseUrl("https://cdn.covenhub.app/");
        StorageKeyFactory factory = new StorageKeyFactory(properties);

        assertThat(factory.storageUrl("assets/images/abc.png", "https://bucket/abc.png")).isEqualTo("https://bucket/abc.png");
        assertThat(factory.storageUrl("assets/images/abc.png", null)).isEqualTo("https://cdn.covenhub.app/assets/images/abc.png");
    }
}
