package com.eainde.compliance.scanner;

/**
 * The fixed rule battery. Declaration order is evaluation order, and therefore the order
 * violations are reported in.
 */
public enum RuleId {
    CONSENT_MECHANISM,
    PRIVACY_POLICY,
    CONTACT_INFORMATION,
    IMAGE_ALT_TEXT,
    HEADING_STRUCTURE,
    FORM_LABELS,
    LINK_PURPOSE,
    KEYBOARD_OPERABILITY,
    LANDMARK_REGIONS,
    TRANSPORT_ENCRYPTION,
    EXTERNAL_SCRIPTS,
    METADATA
}
