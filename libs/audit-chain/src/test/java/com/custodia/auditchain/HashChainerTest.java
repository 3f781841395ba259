package com.custodia.auditchain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("HashChainer")
class HashChainerTest {

    @Test
    @DisplayName("hash is lowercase hex SHA-256")
    void knownVector() {
        assertThat(HashChainer.hash("abc".getBytes(StandardCharsets.US_ASCII)))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    @DisplayName("genesis sentinel can never be a digest")
    void genesisIsNotHex() {
        assertThat(HashChainer.genesisHash()).isEqualTo("GENESIS");
        assertThat(HashChainer.genesisHash()).doesNotMatch("[0-9a-f]{64}");
    }

    @Test
    @DisplayName("chain() hashes the canonical encoding")
    void chainHashesEncoding() {
        var fields = new ChainedFields("company-1", AuditEventType.CUSTODY_TRANSFER, "clerk-1",
                Instant.parse("2026-01-05T10:15:30Z"), SubjectRef.of("container", "C-9"),
                "Handed to courier", Metadata.empty(), HashChainer.GENESIS);

        String hash = HashChainer.chain(fields);

        assertThat(hash).matches("[0-9a-f]{64}");
        assertThat(hash).isEqualTo(HashChainer.hash(CanonicalEncoder.encode(fields)));
        assertThat(HashChainer.chain(fields)).isEqualTo(hash);
    }
}
