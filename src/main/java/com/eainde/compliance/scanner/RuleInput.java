package com.eainde.compliance.scanner;

import com.eainde.compliance.citation.RegulationCitationTable;
import com.eainde.compliance.document.DocumentTree;
import com.eainde.compliance.document.RequestContext;
import com.eainde.compliance.model.Severity;
import com.eainde.compliance.model.Violation;

/**
 * Everything a rule may look at.
 */
public record RuleInput(DocumentTree tree, RequestContext context, RegulationCitationTable citations) {

    /** Builds a violation whose regulation is the primary citation for {@code kind}. */
    public Violation violation(String kind, Severity severity, String subject, String description, String suggestion) {
        return new Violation(kind, severity, subject, description, citations.primaryCitation(kind), suggestion);
    }
}
