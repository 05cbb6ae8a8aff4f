package my.companyprofile.app.model;

public enum DocumentOrigin {
	PRIVATE_FILE(SourceType.PRIVATE_FILE),
	PUBLIC_URL(SourceType.PUBLIC_URL);

	private final SourceType sourceType;

	DocumentOrigin(SourceType sourceType) {
		this.sourceType = sourceType;
	}

	public SourceType sourceType() {
		return sourceType;
	}
}
