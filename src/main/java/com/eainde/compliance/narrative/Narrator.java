package com.eainde.compliance.narrative;

import com.eainde.compliance.model.NarratorRole;

/**
 * External text-generating collaborator. Output is untrusted free text that may or may not
 * contain a JSON object; any runtime exception counts as a failed role.
 */
@FunctionalInterface
public interface Narrator {

    String ask(NarratorRole role, String context);
}
