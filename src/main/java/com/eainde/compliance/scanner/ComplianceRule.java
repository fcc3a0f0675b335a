package com.eainde.compliance.scanner;

import com.eainde.compliance.model.Violation;

import java.util.List;

/**
 * A pure check over a parsed document. Returns zero or more violations; never mutates its input.
 */
@FunctionalInterface
public interface ComplianceRule {

    List<Violation> evaluate(RuleInput input);
}
