package com.hagglehub.shared.config;

public record HaggleHubConfig(
    RoutingConfig routing,
    DispatchConfig dispatch,
    StoreConfig store,
    int pipelineWorkers
) {
    public static HaggleHubConfig defaults() {
        return new HaggleHubConfig(
            RoutingConfig.defaults(),
            DispatchConfig.defaults(),
            StoreConfig.defaults(),
            4
        );
    }
}
