package com.finsight.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "store")
public class StoreProperties {
    private String type = "file";
    private String dir = "outputs/artifacts";
}
