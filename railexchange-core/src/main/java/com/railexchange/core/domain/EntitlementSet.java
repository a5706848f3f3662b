package com.railexchange.core.domain;

/**
 * Capabilities derived from verification, visibility tier and expiry.
 *
 * Always derived fresh for the request at hand. Never persisted and never cached,
 * otherwise an expired badge or lapsed tier would keep granting access.
 */
public record EntitlementSet(
        boolean canListItems,
        boolean canReceiveInquiries,
        boolean canDisplayContact,
        boolean canDisplayServices,
        boolean canDisplayListings,
        boolean canDisplayCompanyInfo,
        boolean hasVerifiedBadge,
        boolean hasVisibilityBoost,
        boolean canAccessSellerFeatures,
        boolean canAccessContractorFeatures,
        boolean isSearchEligible
) {

    private static final EntitlementSet NONE = new EntitlementSet(
            false, false, false, false, false, false, false, false, false, false, false);

    /**
     * The all-false set returned for unknown or unresolvable input.
     */
    public static EntitlementSet none() {
        return NONE;
    }

    public boolean grantsAnything() {
        return !equals(NONE);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean canListItems;
        private boolean canReceiveInquiries;
        private boolean canDisplayContact;
        private boolean canDisplayServices;
        private boolean canDisplayListings;
        private boolean canDisplayCompanyInfo;
        private boolean hasVerifiedBadge;
        private boolean hasVisibilityBoost;
        private boolean canAccessSellerFeatures;
        private boolean canAccessContractorFeatures;
        private boolean isSearchEligible;

        private Builder() {}

        public Builder canListItems(boolean value) { this.canListItems = value; return this; }
        public Builder canReceiveInquiries(boolean value) { this.canReceiveInquiries = value; return this; }
        public Builder canDisplayContact(boolean value) { this.canDisplayContact = value; return this; }
        public Builder canDisplayServices(boolean value) { this.canDisplayServices = value; return this; }
        public Builder canDisplayListings(boolean value) { this.canDisplayListings = value; return this; }
        public Builder canDisplayCompanyInfo(boolean value) { this.canDisplayCompanyInfo = value; return this; }
        public Builder hasVerifiedBadge(boolean value) { this.hasVerifiedBadge = value; return this; }
        public Builder hasVisibilityBoost(boolean value) { this.hasVisibilityBoost = value; return this; }
        public Builder canAccessSellerFeatures(boolean value) { this.canAccessSellerFeatures = value; return this; }
        public Builder canAccessContractorFeatures(boolean value) { this.canAccessContractorFeatures = value; return this; }
        public Builder isSearchEligible(boolean value) { this.isSearchEligible = value; return this; }

        public EntitlementSet build() {
            return new EntitlementSet(
                    canListItems,
                    canReceiveInquiries,
                    canDisplayContact,
                    canDisplayServices,
                    canDisplayListings,
                    canDisplayCompanyInfo,
                    hasVerifiedBadge,
                    hasVisibilityBoost,
                    canAccessSellerFeatures,
                    canAccessContractorFeatures,
                    isSearchEligible
            );
        }
    }
}
