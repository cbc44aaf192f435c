package my.cashflowplanner.app.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MerchantCategoryClassifierTest {
	@Test
	void classifiesByKeyword() {
		assertThat(MerchantCategoryClassifier.classify("NETFLIX.COM")).isEqualTo("Entertainment");
		assertThat(MerchantCategoryClassifier.classify("Anytime Fitness Sydney")).isEqualTo("Health");
		assertThat(MerchantCategoryClassifier.classify("Adobe Creative Cloud")).isEqualTo("Subscriptions");
		assertThat(MerchantCategoryClassifier.classify("Microsoft 365 Family")).isEqualTo("Subscriptions");
	}

	@Test
	void entertainmentWinsOverSubscriptionKeywords() {
		assertThat(MerchantCategoryClassifier.classify("Spotify Premium Subscription")).isEqualTo("Entertainment");
	}

	@Test
	void unknownOrMissingMerchantsFallBackToOther() {
		assertThat(MerchantCategoryClassifier.classify("AGL Energy")).isEqualTo("Other");
		assertThat(MerchantCategoryClassifier.classify(null)).isEqualTo("Other");
	}

	@Test
	void detectsStreamingServices() {
		assertThat(MerchantCategoryClassifier.isStreamingService("Disney Plus")).isTrue();
		assertThat(MerchantCategoryClassifier.isStreamingService("Amazon Prime Video")).isTrue();
		assertThat(MerchantCategoryClassifier.isStreamingService("Binge")).isTrue();
		assertThat(MerchantCategoryClassifier.isStreamingService("Spotify")).isFalse();
		assertThat(MerchantCategoryClassifier.isStreamingService(null)).isFalse();
	}
}
