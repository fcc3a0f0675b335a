package com.eainde.compliance.scanner;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Ordered set of rules keyed by {@link RuleId}. Iteration follows enum declaration order
 * regardless of registration order.
 *
 * <pre>
 * RuleRegistry registry = RuleRegistry.standard();
 * RuleRegistry custom = RuleRegistry.builder()
 *         .from(RuleRegistry.standard())
 *         .rule(RuleId.METADATA, in -> List.of())
 *         .build();
 * </pre>
 */
public final class RuleRegistry {

    private final Map<RuleId, ComplianceRule> rules;

    private RuleRegistry(Map<RuleId, ComplianceRule> rules) {
        this.rules = Collections.unmodifiableMap(new EnumMap<>(rules));
    }

    public static RuleRegistry standard() {
        return builder()
                .rule(RuleId.CONSENT_MECHANISM, ComplianceRules::consentMechanism)
                .rule(RuleId.PRIVACY_POLICY, ComplianceRules::privacyPolicy)
                .rule(RuleId.CONTACT_INFORMATION, ComplianceRules::contactInformation)
                .rule(RuleId.IMAGE_ALT_TEXT, ComplianceRules::imageAltText)
                .rule(RuleId.HEADING_STRUCTURE, ComplianceRules::headingStructure)
                .rule(RuleId.FORM_LABELS, ComplianceRules::formLabels)
                .rule(RuleId.LINK_PURPOSE, ComplianceRules::linkPurpose)
                .rule(RuleId.KEYBOARD_OPERABILITY, ComplianceRules::keyboardOperability)
                .rule(RuleId.LANDMARK_REGIONS, ComplianceRules::landmarkRegions)
                .rule(RuleId.TRANSPORT_ENCRYPTION, ComplianceRules::transportEncryption)
                .rule(RuleId.EXTERNAL_SCRIPTS, ComplianceRules::externalScripts)
                .rule(RuleId.METADATA, ComplianceRules::metadata)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Rules in evaluation order. */
    public Map<RuleId, ComplianceRule> rules() {
        return rules;
    }

    public int size() {
        return rules.size();
    }

    // =========================================================================
    //  Builder
    // =========================================================================

    public static class Builder {
        private final Map<RuleId, ComplianceRule> rules = new EnumMap<>(RuleId.class);

        public Builder from(RuleRegistry registry) {
            rules.putAll(registry.rules);
            return this;
        }

        /** Registers or replaces the rule for {@code id}. */
        public Builder rule(RuleId id, ComplianceRule rule) {
            if (id == null || rule == null) {
                throw new IllegalArgumentException("rule id and rule must not be null");
            }
            rules.put(id, rule);
            return this;
        }

        public Builder without(RuleId id) {
            rules.remove(id);
            return this;
        }

        public RuleRegistry build() {
            return new RuleRegistry(rules);
        }
    }
}
