package com.portfolioscanner.scanner.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.portfolioscanner.common.extraction.SymbolExtractor;
import com.portfolioscanner.common.insight.InsightEngine;
import com.portfolioscanner.common.scan.PortfolioScanner;
import com.portfolioscanner.common.sentiment.SentimentAggregator;
import com.portfolioscanner.common.sentiment.SentimentScorer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

@Configuration
public class ScannerConfig {

    @Value("${services.news.base-url}")
    private String newsServiceUrl;

    @Bean
    public WebClient newsServiceClient(WebClient.Builder builder) {
        return builder.baseUrl(newsServiceUrl).build();
    }

    // Lexicon-backed pipeline pieces load their resources once, here.

    @Bean
    public SymbolExtractor symbolExtractor() {
        return SymbolExtractor.withDefaults();
    }

    @Bean
    public SentimentScorer sentimentScorer() {
        return SentimentScorer.withDefaults();
    }

    @Bean
    public SentimentAggregator sentimentAggregator(SentimentScorer sentimentScorer) {
        return new SentimentAggregator(sentimentScorer);
    }

    @Bean
    public InsightEngine insightEngine() {
        return InsightEngine.withDefaults();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PortfolioScanner portfolioScanner(SymbolExtractor symbolExtractor,
                                             SentimentAggregator sentimentAggregator,
                                             InsightEngine insightEngine,
                                             Clock clock) {
        return new PortfolioScanner(symbolExtractor, sentimentAggregator, insightEngine, clock);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
