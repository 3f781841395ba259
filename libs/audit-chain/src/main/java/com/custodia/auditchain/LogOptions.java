package com.custodia.auditchain;

import java.time.Instant;

/**
 * Optional inputs of {@link AuditRecorder#log}. Every field may be null; the recorder fills in
 * defaults (current actor or "system", now, {@link Severity#INFO}, empty metadata).
 */
public record LogOptions(
        String actorId,
        Instant timestamp,
        Severity severity,
        SubjectRef subjectRef,
        String beforeState,
        String afterState,
        Metadata metadata) {

    private static final LogOptions DEFAULTS = new LogOptions(null, null, null, null, null, null, null);

    public static LogOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private String actorId;
        private Instant timestamp;
        private Severity severity;
        private SubjectRef subjectRef;
        private String beforeState;
        private String afterState;
        private Metadata metadata;

        private Builder() {
        }

        public Builder actorId(String actorId) {
            this.actorId = actorId;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder subject(String type, String id) {
            this.subjectRef = new SubjectRef(type, id);
            return this;
        }

        public Builder subjectRef(SubjectRef subjectRef) {
            this.subjectRef = subjectRef;
            return this;
        }

        public Builder beforeState(String beforeState) {
            this.beforeState = beforeState;
            return this;
        }

        public Builder afterState(String afterState) {
            this.afterState = afterState;
            return this;
        }

        public Builder metadata(Metadata metadata) {
            this.metadata = metadata;
            return this;
        }

        public LogOptions build() {
            return new LogOptions(actorId, timestamp, severity, subjectRef, beforeState, afterState, metadata);
        }
    }
}
