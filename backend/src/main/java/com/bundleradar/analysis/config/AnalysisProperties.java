package com.bundleradar.analysis.config;

import com.bundleradar.domain.Chain;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Orchestration settings under bundleradar.analysis.
 */
@ConfigurationProperties(prefix = "bundleradar.analysis")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class AnalysisProperties {

    /** Length of the post-launch price window inspected for sell-offs. */
    @Min(1)
    private int ohlcvWindowDays = 3;

    @NotBlank
    private String ohlcvGranularity = "1D";

    /** Upper bound for each post-detection task (present impact, price action). */
    @Min(1)
    private int taskTimeoutSeconds = 30;

    /** Lookback and candle size for the recent market health check. */
    @Min(1)
    private int marketHealthWindowHours = 24;

    @NotBlank
    private String marketHealthGranularity = "15m";

    /** Chain used for holder statistics. */
    @NotNull
    private Chain chain = Chain.SOLANA;

    /** Which provider supplies the early buys. */
    @NotNull
    private Feed feed = Feed.MORALIS;

    public enum Feed {
        MORALIS("Moralis API for transactions, BirdEye for creation info and OHLCV"),
        BIRDEYE("BirdEye API for transactions, creation info and OHLCV");

        private final String sourceDescription;

        Feed(String sourceDescription) {
            this.sourceDescription = sourceDescription;
        }

        public String getSourceDescription() {
            return sourceDescription;
        }
    }
}
