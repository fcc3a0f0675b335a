package com.eainde.compliance.remediation;

import java.util.List;

/**
 * Ordering class of a fix in the remediation priority order. Declaration order is rank.
 */
public enum FixCategory {

    /** Encryption, consent and data-protection fixes. */
    TRANSPORT_AND_CONSENT(List.of("no_encryption", "cookie_banner", "privacy_policy", "contact_info", "external_scripts")),
    /** Document structure and assistive-technology labelling. */
    STRUCTURE_AND_LABELING(List.of("missing_alt", "unlabeled_inputs", "keyboard_access", "missing_h1", "multiple_h1",
            "missing_landmarks")),
    /** Link wording, metadata and anything unrecognised. */
    PRESENTATION(List.of());

    private final List<String> markers;

    FixCategory(List<String> markers) {
        this.markers = markers;
    }

    public static FixCategory of(String kind) {
        if (kind != null) {
            for (FixCategory category : values()) {
                for (String marker : category.markers) {
                    if (kind.contains(marker)) return category;
                }
            }
        }
        return PRESENTATION;
    }
}
