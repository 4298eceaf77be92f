package com.bundleradar.ingestion.adapter.moralis;

import com.bundleradar.domain.Transaction;
import com.bundleradar.ingestion.adapter.FakeProviderHttpClient;
import com.bundleradar.ingestion.adapter.ProviderException;
import com.bundleradar.ingestion.config.ProviderProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MoralisTransactionFeedTest {

    private static final String TOKEN = "MintAddr111";

    private ProviderProperties properties;

    @BeforeEach
    void setUp() {
        properties = new ProviderProperties();
        properties.getMoralis().setApiKey("moralis-key");
        properties.getMoralis().setBaseUrl("https://moralis.test");
        properties.getMoralis().setPageSize(2);
    }

    private static String swap(String hash, String wallet, String isoTime) {
        return """
                {"transactionHash":"%s","walletAddress":"%s","blockTimestamp":"%s","transactionType":"buy",
                 "bought":{"amount":"10"},"totalValueUsd":1.5}
                """.formatted(hash, wallet, isoTime);
    }

    @Test
    @DisplayName("follows the cursor until the limit is reached")
    void followsCursor() {
        FakeProviderHttpClient fake = new FakeProviderHttpClient(url -> {
            if (!url.contains("cursor=")) {
                return "{\"cursor\":\"c1\",\"result\":[" + swap("h1", "w1", "2024-03-01T12:00:01Z") + ","
                        + swap("h2", "w2", "2024-03-01T12:00:00Z") + "]}";
            }
            return "{\"cursor\":\"c2\",\"result\":[" + swap("h3", "w3", "2024-03-01T12:00:02Z") + "]}";
        });
        MoralisTransactionFeed feed = new MoralisTransactionFeed(fake.limited("moralis"), properties);

        List<Transaction> txs = feed.fetch(TOKEN, 1_709_294_399L, 3);

        assertThat(txs).extracting(Transaction::txHash).containsExactly("h2", "h1", "h3");
        assertThat(fake.urls()).hasSize(2);
        assertThat(fake.urls().get(0))
                .startsWith("https://moralis.test/token/mainnet/MintAddr111/swaps")
                .contains("order=ASC", "transactionTypes=buy", "fromDate=1709294399", "limit=2");
        assertThat(fake.urls().get(1)).contains("cursor=c1", "limit=1");
        assertThat(fake.headers().get(0)).containsEntry("X-API-Key", "moralis-key");
    }

    @Test
    @DisplayName("stops on a missing cursor and skips malformed swaps")
    void stopsWithoutCursor() {
        FakeProviderHttpClient fake = new FakeProviderHttpClient(url ->
                "{\"result\":[" + swap("h1", "w1", "2024-03-01T12:00:00Z") + ",{\"walletAddress\":\"w2\"}]}");
        MoralisTransactionFeed feed = new MoralisTransactionFeed(fake.limited("moralis"), properties);

        List<Transaction> txs = feed.fetch(TOKEN, 0L, 300);

        assertThat(txs).extracting(Transaction::txHash).containsExactly("h1");
        assertThat(fake.urls()).hasSize(1);
    }

    @Test
    @DisplayName("first-page failure propagates")
    void firstPageFailure() {
        FakeProviderHttpClient fake = new FakeProviderHttpClient(url -> {
            throw new ProviderException("500 from moralis");
        });
        MoralisTransactionFeed feed = new MoralisTransactionFeed(fake.limited("moralis"), properties);

        assertThatThrownBy(() -> feed.fetch(TOKEN, 0L, 10)).isInstanceOf(ProviderException.class);
    }

    @Test
    @DisplayName("later-page failure keeps what was collected")
    void laterPageFailure() {
        FakeProviderHttpClient fake = new FakeProviderHttpClient(url -> {
            if (url.contains("cursor=")) {
                throw new ProviderException("500 from moralis");
            }
            return "{\"cursor\":\"c1\",\"result\":[" + swap("h1", "w1", "2024-03-01T12:00:00Z") + ","
                    + swap("h2", "w2", "2024-03-01T12:00:01Z") + "]}";
        });
        MoralisTransactionFeed feed = new MoralisTransactionFeed(fake.limited("moralis"), properties);

        assertThat(feed.fetch(TOKEN, 0L, 10)).hasSize(2);
    }

    @Test
    @DisplayName("missing API key returns nothing without calling upstream")
    void missingApiKey() {
        properties.getMoralis().setApiKey("");
        FakeProviderHttpClient fake = new FakeProviderHttpClient(url -> "{}");

        assertThat(new MoralisTransactionFeed(fake.limited("moralis"), properties).fetch(TOKEN, 0L, 10)).isEmpty();
        assertThat(fake.urls()).isEmpty();
    }

    @Test
    void parseSwapPageHandlesMissingResult() throws Exception {
        MoralisTransactionFeed.SwapPage page = MoralisTransactionFeed.parseSwapPage(new ObjectMapper().readTree("{}"));

        assertThat(page.records()).isZero();
        assertThat(page.cursor()).isNull();
    }
}
