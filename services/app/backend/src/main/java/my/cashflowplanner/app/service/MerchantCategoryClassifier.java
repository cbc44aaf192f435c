package my.cashflowplanner.app.service;

import java.util.List;
import java.util.Locale;

/**
 * Keyword heuristic over normalised merchant names.
 */
public final class MerchantCategoryClassifier {
	public static final String ENTERTAINMENT = "Entertainment";
	public static final String HEALTH = "Health";
	public static final String SUBSCRIPTIONS = "Subscriptions";
	public static final String OTHER = "Other";

	private static final List<String> ENTERTAINMENT_KEYWORDS = List.of("netflix", "spotify", "disney", "stan", "youtube");
	private static final List<String> HEALTH_KEYWORDS = List.of("gym", "fitness", "anytime");
	private static final List<String> SUBSCRIPTION_KEYWORDS = List.of("subscription", "membership", "patreon", "audible",
			"icloud", "dropbox", "adobe", "microsoft 365", "google one");
	private static final List<String> STREAMING_KEYWORDS = List.of("netflix", "disney", "stan", "binge", "paramount",
			"prime video");

	private MerchantCategoryClassifier() {
	}

	public static String classify(String merchant) {
		String lowered = normalise(merchant);
		if (containsAny(lowered, ENTERTAINMENT_KEYWORDS)) {
			return ENTERTAINMENT;
		}
		if (containsAny(lowered, HEALTH_KEYWORDS)) {
			return HEALTH;
		}
		if (containsAny(lowered, SUBSCRIPTION_KEYWORDS)) {
			return SUBSCRIPTIONS;
		}
		return OTHER;
	}

	public static boolean isStreamingService(String merchant) {
		return containsAny(normalise(merchant), STREAMING_KEYWORDS);
	}

	private static String normalise(String merchant) {
		return merchant == null ? "" : merchant.toLowerCase(Locale.ROOT);
	}

	private static boolean containsAny(String value, List<String> keywords) {
		for (String keyword : keywords) {
			if (value.contains(keyword)) {
				return true;
			}
		}
		return false;
	}
}
