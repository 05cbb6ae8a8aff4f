package my.companyprofile.app.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SourceType {
	PRIVATE_FILE("private_file"),
	PUBLIC_URL("public_url"),
	GENERATED("generated");

	private final String code;

	SourceType(String code) {
		this.code = code;
	}

	@JsonValue
	public String code() {
		return code;
	}
}
