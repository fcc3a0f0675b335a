package com.eainde.compliance.pipeline;

import com.eainde.compliance.model.NarrativeRecord;
import com.eainde.compliance.model.NarratorRole;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Immutable accumulator threaded through the role loop: the technical summary followed by
 * one section per role that has succeeded so far, in role order.
 */
public final class AuditContext {

    private final String technicalSummary;
    private final List<Section> sections;

    private AuditContext(String technicalSummary, List<Section> sections) {
        this.technicalSummary = technicalSummary;
        this.sections = List.copyOf(sections);
    }

    public static AuditContext initial(String technicalSummary) {
        return new AuditContext(technicalSummary, List.of());
    }

    public AuditContext with(NarrativeRecord record) {
        List<Section> next = new ArrayList<>(sections);
        next.add(new Section(record.role(), record.digest()));
        return new AuditContext(technicalSummary, next);
    }

    public List<NarratorRole> roles() {
        return sections.stream().map(Section::role).toList();
    }

    public String render() {
        StringBuilder sb = new StringBuilder(technicalSummary);
        for (Section section : sections) {
            sb.append("\n\n").append(section.role().wireName().toUpperCase(Locale.ROOT)).append(" FINDINGS:\n")
                    .append(section.digest());
        }
        return sb.toString();
    }

    record Section(NarratorRole role, String digest) {}
}
