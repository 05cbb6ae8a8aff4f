package my.companyprofile.app.llm;

import my.companyprofile.app.model.NarrativeProfile;

/**
 * Generative collaborator that writes narrative fields when documents do not supply them.
 * Its output is opaque to this core and is always cited as generated.
 */
public interface NarrativeGenerator {
	NarrativeProfile generateNarrative(NarrativeRequest request);
}
