package com.flamingo.ai.clouddocs.domain.model;

/**
 * A documented cloud service from the catalog. Keyed by {@code code}.
 *
 * @param code short service code used in documentation URLs, e.g. {@code ecs}
 * @param title display title
 * @param category code of the category the service is listed under
 * @param description one-line description, may be empty
 * @param uri documentation landing page
 */
public record CloudService(
    String code, String title, String category, String description, String uri) {}
