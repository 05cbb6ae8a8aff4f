package my.companyprofile.app.util;

import java.util.regex.Pattern;

/**
 * Masks contact details before text leaves the process.
 */
public final class TextAnonymizer {
	private static final Pattern EMAIL = Pattern.compile("[\\w.-]+@[\\w-]+(?:\\.[\\w-]+)+");
	private static final Pattern PHONE = Pattern.compile("\\+?\\d[\\d -]{8,12}\\d");

	private TextAnonymizer() {
	}

	public static String anonymize(String text) {
		if (text == null || text.isEmpty()) {
			return "";
		}
		String masked = EMAIL.matcher(text).replaceAll("[EMAIL_REDACTED]");
		return PHONE.matcher(masked).replaceAll("[PHONE_REDACTED]");
	}
}
