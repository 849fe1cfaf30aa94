package com.hagglehub.gateway;

import com.hagglehub.dispatch.Dispatcher;
import com.hagglehub.dispatch.DownstreamSink;
import com.hagglehub.dispatch.EntityCreateSink;
import com.hagglehub.dispatch.FunctionInvokeSink;
import com.hagglehub.dispatch.LogSink;
import com.hagglehub.ingest.IdentityExtractor;
import com.hagglehub.ingest.PayloadNormalizer;
import com.hagglehub.ingest.SignalExtractor;
import com.hagglehub.matching.DealMatcher;
import com.hagglehub.observability.MetricsConfig;
import com.hagglehub.pipeline.InboundPipeline;
import com.hagglehub.resolution.ResolutionPolicy;
import com.hagglehub.shared.config.ConfigLoader;
import com.hagglehub.shared.config.HaggleHubConfig;
import com.hagglehub.store.EntityStore;
import com.hagglehub.store.HttpEntityStore;
import com.hagglehub.store.InMemoryEntityStore;
import com.hagglehub.store.StoreHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class GatewayBeans {

    private static final Logger log = LoggerFactory.getLogger(GatewayBeans.class);

    @Bean
    public HaggleHubConfig haggleHubConfig() {
        return ConfigLoader.load();
    }

    @Bean
    public MetricsConfig metricsConfig() {
        return new MetricsConfig();
    }

    @Bean
    public StoreHttpClient storeHttpClient(HaggleHubConfig config) {
        if (config.store().apiKey().isBlank()) {
            log.warn("Store API key not configured. Set store.api-key in ~/.hagglehub/config.yaml or BASE44_API_KEY");
        }
        return new StoreHttpClient(config.store());
    }

    @Bean
    public EntityStore entityStore(HaggleHubConfig config, StoreHttpClient http) {
        if ("memory".equalsIgnoreCase(config.store().mode())) {
            log.warn("Using in-memory entity store; nothing survives a restart");
            return new InMemoryEntityStore();
        }
        return new HttpEntityStore(http);
    }

    @Bean
    public DownstreamSink downstreamSink(HaggleHubConfig config, StoreHttpClient http) {
        var mode = config.dispatch().mode().toLowerCase();
        switch (mode) {
            case "function":
                return new FunctionInvokeSink(http, config.dispatch().functionName());
            case "log":
                return new LogSink();
            case "entity":
                return new EntityCreateSink(http);
            default:
                throw new IllegalArgumentException("Unknown dispatch mode: " + mode);
        }
    }

    @Bean
    public PayloadNormalizer payloadNormalizer(HaggleHubConfig config) {
        return new PayloadNormalizer(config.routing().maxBodyLength());
    }

    @Bean(destroyMethod = "close")
    public InboundPipeline inboundPipeline(HaggleHubConfig config, EntityStore store,
                                           DownstreamSink sink, MetricsConfig metrics) {
        var routing = config.routing();
        var matcher = DealMatcher.fromNames(store, routing.strategies());
        var dispatcher = new Dispatcher(sink, config.dispatch().retries(), config.dispatch().retryDelayMs());

        var threadIds = new AtomicInteger();
        var executor = Executors.newFixedThreadPool(config.pipelineWorkers(), r -> {
            var t = new Thread(r, "inbound-worker-" + threadIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        log.info("Inbound pipeline: strategies={} sink={} workers={}",
                matcher.strategyNames(), dispatcher.sinkId(), config.pipelineWorkers());
        return new InboundPipeline(
                new IdentityExtractor(routing.aliasPrefix()),
                new SignalExtractor(),
                matcher,
                new ResolutionPolicy(store, routing),
                dispatcher,
                metrics,
                executor);
    }
}
