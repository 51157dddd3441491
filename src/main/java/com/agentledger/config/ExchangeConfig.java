package com.agentledger.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * HTTP client for the exchange info API, configured from {@code agentledger.exchange.*}.
 */
@Configuration
public class ExchangeConfig {

    private static final Logger log = LoggerFactory.getLogger(ExchangeConfig.class);

    @Bean
    public RestClient exchangeRestClient(AgentLedgerProperties properties) {
        AgentLedgerProperties.Exchange exchange = properties.getExchange();
        log.info("Creating exchange RestClient for {} (enabled={})", exchange.getBaseUrl(), exchange.isEnabled());
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(exchange.getConnectTimeout());
        requestFactory.setReadTimeout(exchange.getReadTimeout());
        return RestClient.builder()
                .baseUrl(exchange.getBaseUrl())
                .requestFactory(requestFactory)
                .build();
    }
}
