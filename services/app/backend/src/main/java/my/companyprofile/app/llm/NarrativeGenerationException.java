package my.companyprofile.app.llm;

public class NarrativeGenerationException extends RuntimeException {
	private final boolean retryable;

	public NarrativeGenerationException(String message, boolean retryable, Throwable cause) {
		super(message, cause);
		this.retryable = retryable;
	}

	public boolean isRetryable() {
		return retryable;
	}
}
