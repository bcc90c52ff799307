package com.finsight.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {
    private List<String> symbols = new ArrayList<>(List.of("AAPL", "MSFT", "TSLA", "GOOGL", "AMZN"));
    private int intervalHours = 6;
    private int concurrency = 3;
    private int symbolTimeoutSec = 300;
    private int historyDays = 1825;
    private Insight insight = new Insight();

    @Getter
    @Setter
    public static class Insight {
        private boolean awaitForecast = true;
    }
}
