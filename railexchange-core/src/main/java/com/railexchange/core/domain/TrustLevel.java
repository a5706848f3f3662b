package com.railexchange.core.domain;

/**
 * Verification trust hierarchy: NONE &lt; SELLER &lt; CONTRACTOR.
 *
 * A higher level includes every level-additive capability of the lower ones.
 * The unlock is one-way: contractor verification grants seller access,
 * seller verification never grants contractor access.
 */
public enum TrustLevel {

    NONE(0, "Not Verified"),
    SELLER(1, "Seller Verified"),
    CONTRACTOR(2, "Contractor Verified");

    private final int rank;
    private final String displayName;

    TrustLevel(int rank, String displayName) {
        this.rank = rank;
        this.displayName = displayName;
    }

    public int rank() { return rank; }
    public String displayName() { return displayName; }

    /**
     * @return true if this level meets or exceeds {@code required}
     */
    public boolean includes(TrustLevel required) {
        return rank >= required.rank;
    }

    public boolean isUpgradeFrom(TrustLevel current) {
        return rank > current.rank;
    }

    /**
     * Trust level granted by an entity's effective verification.
     * Only verified sellers and contractors enter the hierarchy.
     */
    public static TrustLevel of(EntityType type, VerificationStatus effectiveStatus) {
        if (type == null || effectiveStatus != VerificationStatus.VERIFIED) {
            return NONE;
        }
        return switch (type) {
            case SELLER -> SELLER;
            case CONTRACTOR -> CONTRACTOR;
            case COMPANY, BUYER -> NONE;
        };
    }

    /**
     * Maps the older per-role verification fields onto a single level.
     * Contractor verification takes precedence because it is the higher level.
     */
    public static TrustLevel fromLegacy(boolean verifiedSeller, String sellerStatus, String contractorStatus) {
        if ("active".equals(contractorStatus)) {
            return CONTRACTOR;
        }
        if (verifiedSeller && "active".equals(sellerStatus)) {
            return SELLER;
        }
        return NONE;
    }
}
