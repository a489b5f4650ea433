package com.paxkun.magpie.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class StorageConfigTest {

    @Test
    void uploadDirFallsBackToDataRoot() {
        assertThat(StorageConfig.resolveUploadDir("/srv/images", Path.of("/data"))).isEqualTo(Path.of("/srv/images"));
        assertThat(StorageConfig.resolveUploadDir("", Path.of("/data"))).isEqualTo(Path.of("/data", "images"));
        assertThat(StorageConfig.resolveUploadDir(" ", null)).isEqualTo(Path.of("uploads"));
    }

    @Test
    void publicBaseUrlPrefersExplicitValue() {
        MagpieProperties.S3 s3 = new MagpieProperties.S3();
        s3.setBucket("magpie");
        s3.setRegion("eu-west-1");

        assertThat(StorageConfig.publicBaseUrl(s3)).isEqualTo("https://magpie.s3.eu-west-1.amazonaws.com");

        s3.setEndpoint("http://minio:9000");
        assertThat(StorageConfig.publicBaseUrl(s3)).isEqualTo("http://minio:9000/magpie");

        s3.setPublicBaseUrl("https://cdn.example.com");
        assertThat(StorageConfig.publicBaseUrl(s3)).isEqualTo("https://cdn.example.com");
    }
}
