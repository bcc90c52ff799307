package com.finsight.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "db")
public class DbProperties {
    private String url = "jdbc:postgresql://localhost:5432/finsight";
    private String user = "finsight";
    private String pass = "finsight";
    private String schema = "finsight";
    private int connectTimeoutSec = 5;
}
