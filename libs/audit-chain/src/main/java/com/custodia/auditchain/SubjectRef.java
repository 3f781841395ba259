package com.custodia.auditchain;

/**
 * Opaque reference to the business entity an event concerns (document, container, custody
 * record, compliance record). Never dereferenced by the audit chain.
 *
 * @param type kind of entity, e.g. "document" or "container"
 * @param id   identifier of the entity instance
 */
public record SubjectRef(String type, String id) {

    public static SubjectRef of(String type, String id) {
        return new SubjectRef(type, id);
    }
}
