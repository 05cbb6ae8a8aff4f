package my.companyprofile.app.llm;

import my.companyprofile.app.model.NarrativeProfile;

public class NoopNarrativeGenerator implements NarrativeGenerator {
	@Override
	public NarrativeProfile generateNarrative(NarrativeRequest request) {
		throw new NarrativeGenerationException("LLM disabled", false, null);
	}
}
