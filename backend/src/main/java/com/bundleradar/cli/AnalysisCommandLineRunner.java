package com.bundleradar.cli;

import com.bundleradar.analysis.BundlerAnalysisService;
import com.bundleradar.analysis.MarketHealthService;
import com.bundleradar.domain.BundlerAnalysisReport;
import com.bundleradar.domain.MarketHealthResult;
import com.bundleradar.domain.TokenAssessment;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.PrintStream;

/**
 * Analyzes {@code bundleradar.cli.token} on startup and prints the bundle report, plus the 24h market health
 * unless {@code bundleradar.cli.market-health=false}, as pretty JSON to stdout.
 *
 * Run with:  mvn -pl backend spring-boot:run -Dspring-boot.run.arguments=--bundleradar.cli.token=&lt;mint&gt;
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "bundleradar.cli.token")
@RequiredArgsConstructor
public class AnalysisCommandLineRunner implements CommandLineRunner {

    private final BundlerAnalysisService analysisService;
    private final MarketHealthService marketHealthService;
    private final ObjectMapper objectMapper;

    @Value("${bundleradar.cli.token}")
    private String token;

    @Value("${bundleradar.cli.market-health:true}")
    private boolean marketHealth;

    private PrintStream out = System.out;

    @Override
    public void run(String... args) throws JsonProcessingException {
        String target = token.strip();
        BundlerAnalysisReport report = analysisService.analyze(target);
        MarketHealthResult health = marketHealth ? marketHealthService.assess(target) : null;
        out.println(objectMapper.writerWithDefaultPrettyPrinter()
                .writeValueAsString(new TokenAssessment(report, health)));
        if (report.getMeta() != null && report.getMeta().getError() != null) {
            log.warn("Analysis of {} degraded: {}", target, report.getMeta().getError());
        }
    }

    void setOut(PrintStream out) {
        this.out = out;
    }

    void setToken(String token) {
        this.token = token;
    }

    void setMarketHealth(boolean marketHealth) {
        this.marketHealth = marketHealth;
    }
}
