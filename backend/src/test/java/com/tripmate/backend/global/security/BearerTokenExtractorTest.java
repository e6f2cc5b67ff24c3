package com.tripmate.backend.global.security;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class BearerTokenExtractorTest {

    @Test
    void extractsTokenIgnoringSchemeCase() {
        assertThat(BearerTokenExtractor.extract("Bearer abc.def.ghi")).contains("abc.def.ghi");
        assertThat(BearerTokenExtractor.extract("bearer abc.def.ghi")).contains("abc.def.ghi");
        assertThat(BearerTokenExtractor.extract("  BEARER   abc.def.ghi  ")).contains("abc.def.ghi");
    }

    @Test
    void rejectsMissingOrGarbledHeaders() {
        assertThat(BearerTokenExtractor.extract(null)).isEmpty();
        assertThat(BearerTokenExtractor.extract("")).isEmpty();
        assertThat(BearerTokenExtractor.extract("Bearer")).isEmpty();
        assertThat(BearerTokenExtractor.extract("Bearer ")).isEmpty();
        assertThat(BearerTokenExtractor.extract("Basic dXNlcjpwYXNz")).isEmpty();
        assertThat(BearerTokenExtractor.extract("Bearer two tokens")).isEmpty();
    }
}
