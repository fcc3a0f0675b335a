package com.eainde.compliance.model;

/**
 * Structured output of one narrative role. Every implementation is total: fields the
 * collaborator did not supply are filled from heuristics or defaults.
 */
public interface NarrativeRecord {

    NarratorRole role();

    RecordSource source();

    /** One-paragraph summary of the record. */
    String summary();

    /** Compact multi-line rendering fed to the next role as context. */
    String digest();
}
