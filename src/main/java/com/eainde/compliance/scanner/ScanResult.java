package com.eainde.compliance.scanner;

import com.eainde.compliance.model.Violation;

import java.util.List;

/**
 * Violations in rule order, plus one warning per rule that threw.
 */
public record ScanResult(List<Violation> violations, List<String> warnings) {

    public ScanResult {
        violations = List.copyOf(violations);
        warnings = List.copyOf(warnings);
    }
}
