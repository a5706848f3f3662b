package com.railexchange.core.domain;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Kind of account participating in the marketplace.
 *
 * Sellers, contractors and companies are business entities that can buy visibility.
 * Buyers never promote inventory or services and are never exposed in discovery surfaces.
 */
public enum EntityType {

    SELLER("seller", "sellers", "Seller", "Sellers"),
    CONTRACTOR("contractor", "contractors", "Contractor", "Contractors"),
    COMPANY("company", "companies", "Company", "Companies"),
    BUYER("buyer", "buyers", "Buyer", "Buyers");

    private static final Map<String, EntityType> ALIASES = Map.ofEntries(
            Map.entry("seller", SELLER),
            Map.entry("sellers", SELLER),
            Map.entry("vendor", SELLER),
            Map.entry("contractor", CONTRACTOR),
            Map.entry("contractors", CONTRACTOR),
            Map.entry("service-provider", CONTRACTOR),
            Map.entry("company", COMPANY),
            Map.entry("companies", COMPANY),
            Map.entry("business", COMPANY),
            Map.entry("organization", COMPANY),
            Map.entry("buyer", BUYER),
            Map.entry("buyers", BUYER)
    );

    private final String value;
    private final String urlPrefix;
    private final String label;
    private final String pluralLabel;

    EntityType(String value, String urlPrefix, String label, String pluralLabel) {
        this.value = value;
        this.urlPrefix = urlPrefix;
        this.label = label;
        this.pluralLabel = pluralLabel;
    }

    public String value() { return value; }
    public String urlPrefix() { return urlPrefix; }
    public String label() { return label; }
    public String pluralLabel() { return pluralLabel; }

    /**
     * True for the entity types that can pay for visibility.
     */
    public boolean isPromotable() {
        return this != BUYER;
    }

    /**
     * Parses a stored or user-supplied type, accepting common aliases.
     * Unrecognised values yield empty rather than a guessed type.
     */
    public static Optional<EntityType> fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(ALIASES.get(raw.trim().toLowerCase(Locale.ROOT)));
    }

    /**
     * Resolves the type of a public profile from its URL path, e.g. {@code /contractors/abc}.
     * Buyer profiles are not resolvable from discovery paths.
     */
    public static Optional<EntityType> fromPath(String path) {
        if (path == null) {
            return Optional.empty();
        }
        String normalized = path.toLowerCase(Locale.ROOT);
        for (EntityType type : new EntityType[] {SELLER, CONTRACTOR, COMPANY}) {
            String segment = type.urlPrefix + "/";
            if (normalized.contains("/" + segment) || normalized.startsWith(segment)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    public String profileUrl(String id) {
        return "/" + urlPrefix + "/" + id;
    }
}
