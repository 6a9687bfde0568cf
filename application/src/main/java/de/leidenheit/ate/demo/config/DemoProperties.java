package de.leidenheit.ate.demo.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "ate.demo")
public class DemoProperties {

    /**
     * Appended to the device data before hashing when a client signs a token request.
     */
    private String secretKey = "DebugTalk";
    private int tokenLength = 16;
}
