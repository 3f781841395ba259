package com.custodia.auditchain;

/**
 * An integrity break found by {@link ChainVerifier}. Reported to operators, never corrected.
 */
public sealed interface ChainViolation {

    long entryId();

    /** Stable snake_case name, used as metric tag and in API responses. */
    String kind();

    String message();

    /**
     * The first entry of a chain does not link to the genesis sentinel.
     */
    record InvalidGenesis(long entryId, String actualPreviousHash) implements ChainViolation {

        @Override
        public String kind() {
            return "invalid_genesis";
        }

        @Override
        public String message() {
            return "Entry %d opens the chain but links to %s instead of %s"
                    .formatted(entryId, actualPreviousHash, HashChainer.GENESIS);
        }
    }

    /**
     * The entry's previous hash is not the content hash of the entry before it, which means an
     * entry was removed, reordered or rewritten with a new hash.
     */
    record BrokenLink(long entryId, String expectedPreviousHash, String actualPreviousHash)
            implements ChainViolation {

        @Override
        public String kind() {
            return "broken_link";
        }

        @Override
        public String message() {
            return "Entry %d links to %s but its predecessor's hash is %s"
                    .formatted(entryId, actualPreviousHash, expectedPreviousHash);
        }
    }

    /**
     * Recomputing the hash from the stored fields does not reproduce the stored hash.
     */
    record TamperedEntry(long entryId, String storedHash, String recomputedHash) implements ChainViolation {

        @Override
        public String kind() {
            return "tampered_entry";
        }

        @Override
        public String message() {
            return "Entry %d stores hash %s but its fields hash to %s"
                    .formatted(entryId, storedHash, recomputedHash);
        }
    }
}
