package com.finsight.data;

import com.finsight.config.Config;
import com.finsight.config.PipelineConfigurationException;
import com.finsight.data.http.HttpClientEx;

import java.util.Locale;

public final class MarketDataGateways {
    private MarketDataGateways() {
    }

    public static MarketDataGateway create(Config config) {
        return create(config, new HttpClientEx(Math.max(1, config.getInt("market.timeout_sec"))));
    }

    public static MarketDataGateway create(Config config, HttpClientEx http) {
        String provider = config.getString("market.provider").toLowerCase(Locale.ROOT);
        switch (provider) {
            case YahooChartGateway.PROVIDER:
                return new YahooChartGateway(config, http);
            case StooqGateway.PROVIDER:
                return new StooqGateway(config, http);
            default:
                throw new PipelineConfigurationException("unknown market.provider: " + provider);
        }
    }
}
