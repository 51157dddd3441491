package com.agentledger.integration;

import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.agentledger.api.controller.AccountLedgerController;
import com.agentledger.config.AgentLedgerProperties;
import com.agentledger.config.ApiResponseAdvice;
import com.agentledger.config.ExchangeConfig;
import com.agentledger.diary.DiaryReader;
import com.agentledger.event.ReconciliationEvent;
import com.agentledger.exception.GlobalExceptionHandler;
import com.agentledger.exchange.HttpExchangeSnapshotSource;
import com.agentledger.exchange.mapper.ExchangeSnapshotMapper;
import com.agentledger.feed.FeedComposer;
import com.agentledger.io.ArtifactLineReader;
import com.agentledger.io.ArtifactLocator;
import com.agentledger.matching.TradeMatcher;
import com.agentledger.observability.ReconciliationMetrics;
import com.agentledger.processlog.ProcessLogExtractor;
import com.agentledger.processlog.PromptLogReader;
import com.agentledger.reconciliation.AgentReconciliationService;
import com.agentledger.stats.StatsAggregator;
import com.agentledger.stats.StatsPublisher;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.result.MockMvcResultMatchers;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.client.RestClient;

/**
 * End-to-end reconciliation flow: agent artifacts on disk, the exchange info API
 * mocked at the HTTP level, and every component in between real. Requests go
 * through the controller with the production advices.
 */
class ReconciliationFlowIntegrationTest {

    private static final String BASE_URL = "http://exchange.test";
    private static final String ACCOUNT = "0xabc";
    private static final String FILLED = "{'status': 'ok', 'statuses': [{'filled': {'totalSz': '2'}}]}";

    private static final String STATE_JSON = """
            {"marginSummary": {"accountValue": "1250.75", "totalNtlPos": "0.0", "totalRawUsd": "1250.75",
                               "totalMarginUsed": "0.0"},
             "assetPositions": [], "withdrawable": "1250.75"}
            """;

    // ETH opened at 3000 and closed at 3100 ninety minutes later
    private static final String FILLS_JSON = """
            [{"coin": "ETH", "px": "3000", "sz": "2", "side": "B", "time": 1704103200000, "dir": "Open Long",
              "closedPnl": "0.0", "hash": "0xopen", "oid": 1, "fee": "1.2", "tid": 11},
             {"coin": "ETH", "px": "3100", "sz": "2", "side": "A", "time": 1704108600000, "dir": "Close Long",
              "closedPnl": "200.0", "hash": "0xclose", "oid": 2, "fee": "1.24", "tid": 12}]
            """;

    private static final String LEDGER_JSON = """
            [{"time": 1704000000000, "hash": "0xdep", "delta": {"type": "deposit", "usdc": "1000.0"}}]
            """;

    @TempDir
    Path tempDir;

    private MockRestServiceServer server;
    private MeterRegistry meterRegistry;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() throws Exception {
        AgentLedgerProperties properties = new AgentLedgerProperties();
        properties.setDiaryDir(tempDir.toString());
        properties.setLogDir(tempDir.toString());
        properties.getExchange().setBaseUrl(BASE_URL);

        RestClient.Builder clientBuilder = new ExchangeConfig().exchangeRestClient(properties).mutate();
        server = MockRestServiceServer.bindTo(clientBuilder).build();

        meterRegistry = new SimpleMeterRegistry();
        ReconciliationMetrics reconciliationMetrics = new ReconciliationMetrics(meterRegistry);
        ApplicationEventPublisher eventPublisher =
                event -> reconciliationMetrics.onReconciliation((ReconciliationEvent) event);

        ArtifactLocator locator = new ArtifactLocator(properties);
        ArtifactLineReader lineReader = new ArtifactLineReader(properties);
        AgentReconciliationService service = new AgentReconciliationService(
                new DiaryReader(locator, lineReader, properties, meterRegistry),
                new ProcessLogExtractor(locator, lineReader, properties),
                new PromptLogReader(locator, lineReader, properties),
                new HttpExchangeSnapshotSource(clientBuilder.build()),
                new ExchangeSnapshotMapper(),
                new TradeMatcher(),
                new StatsAggregator(),
                new StatsPublisher(properties),
                new FeedComposer(),
                properties,
                eventPublisher);

        mockMvc = MockMvcBuilders.standaloneSetup(new AccountLedgerController(service))
                .setControllerAdvice(new ApiResponseAdvice(), new GlobalExceptionHandler())
                .build();

        Files.writeString(
                tempDir.resolve(ACCOUNT + ".jsonl"),
                "{\"timestamp\": \"2024-01-01T10:00:00\", \"asset\": \"ETH\", \"action\": \"buy\", \"amount\": 2,"
                        + " \"entry_price\": 3000, \"rationale\": \"Trend continuation\", \"order_result\": \""
                        + FILLED + "\"}\n"
                        + "not json\n"
                        + "{\"timestamp\": \"2024-01-01T11:00:00\", \"asset\": \"BTC\", \"action\": \"hold\"}\n",
                StandardCharsets.UTF_8);
        Files.writeString(
                tempDir.resolve(ACCOUNT + ".log"),
                "2024-01-01 11:00:00,001 - INFO - LLM reasoning summary: ETH momentum intact.\n"
                        + "Holding BTC flat.\n"
                        + "2024-01-01 11:00:00,002 - INFO - Decision rationale for BTC: No edge\n",
                StandardCharsets.UTF_8);
    }

    private void expectQuery(String type, String responseJson) {
        server.expect(requestTo(BASE_URL + "/info"))
                .andExpect(jsonPath("$.type").value(type))
                .andRespond(withSuccess(responseJson, MediaType.APPLICATION_JSON));
    }

    @Test
    @DisplayName("Exchange fills drive trades and stats; feed comes from the process log")
    void liveFlow() throws Exception {
        expectQuery("clearinghouseState", STATE_JSON);
        expectQuery("userFills", FILLS_JSON);
        expectQuery("frontendOpenOrders", "[]");
        expectQuery("userNonFundingLedgerUpdates", LEDGER_JSON);

        mockMvc.perform(get("/api/accounts/" + ACCOUNT + "/reconciliation"))
                .andExpect(status().isOk())
                .andExpect(MockMvcResultMatchers.jsonPath("$.success").value(true))
                .andExpect(MockMvcResultMatchers.jsonPath("$.data.exchangeAvailable").value(true))
                .andExpect(MockMvcResultMatchers.jsonPath("$.data.tradeSource").value("EXCHANGE_FILL"))
                .andExpect(MockMvcResultMatchers.jsonPath("$.data.completedTrades.length()").value(1))
                .andExpect(MockMvcResultMatchers.jsonPath("$.data.completedTrades[0].entryPrice").value(3000))
                .andExpect(MockMvcResultMatchers.jsonPath("$.data.completedTrades[0].exitPrice").value(3100))
                .andExpect(MockMvcResultMatchers.jsonPath("$.data.completedTrades[0].realizedPnl").value(200.0))
                .andExpect(MockMvcResultMatchers.jsonPath("$.data.completedTrades[0].holdingDuration").value("1h 30m"))
                .andExpect(MockMvcResultMatchers.jsonPath("$.data.stats.totalPnl").value(250.75))
                .andExpect(MockMvcResultMatchers.jsonPath("$.data.stats.winRate").value(100.0))
                .andExpect(MockMvcResultMatchers.jsonPath("$.data.stats.holdDecisions").value(1))
                .andExpect(MockMvcResultMatchers.jsonPath("$.data.positions.length()").value(0))
                .andExpect(MockMvcResultMatchers.jsonPath("$.data.skippedDiaryLines").value(1))
                .andExpect(MockMvcResultMatchers.jsonPath("$.data.feed[0].kind").value("REASONING"))
                .andExpect(MockMvcResultMatchers.jsonPath("$.data.feed[0].text")
                        .value("ETH momentum intact.\nHolding BTC flat."))
                .andExpect(MockMvcResultMatchers.jsonPath("$.data.feed[1].text").value("No edge"));

        server.verify();
        Assertions.assertThat(meterRegistry.get("agentledger.reconciliation").timer().count())
                .isEqualTo(1);
        Assertions.assertThat(meterRegistry.get("agentledger.diary.malformed.lines").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Exchange outage still answers, with diary positions and no stats")
    void exchangeOutage() throws Exception {
        server.expect(requestTo(BASE_URL + "/info")).andRespond(withServerError());

        mockMvc.perform(get("/api/accounts/" + ACCOUNT + "/reconciliation"))
                .andExpect(status().isOk())
                .andExpect(MockMvcResultMatchers.jsonPath("$.data.exchangeAvailable").value(false))
                .andExpect(MockMvcResultMatchers.jsonPath("$.data.positions[0].id").value("diary-0"))
                .andExpect(MockMvcResultMatchers.jsonPath("$.data.positions[0].source").value("DIARY"))
                .andExpect(MockMvcResultMatchers.jsonPath("$.data.stats").doesNotExist())
                .andExpect(MockMvcResultMatchers.jsonPath("$.data.openOrders.length()").value(0));

        Assertions.assertThat(meterRegistry.get("agentledger.exchange.unavailable").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Diary endpoint returns only valid records, oldest first")
    void diaryEndpoint() throws Exception {
        mockMvc.perform(get("/api/accounts/" + ACCOUNT + "/diary").param("limit", "10"))
                .andExpect(status().isOk())
                .andExpect(MockMvcResultMatchers.jsonPath("$.data.length()").value(2))
                .andExpect(MockMvcResultMatchers.jsonPath("$.data[0].asset").value("ETH"))
                .andExpect(MockMvcResultMatchers.jsonPath("$.data[1].action").value("HOLD"));
    }
}
