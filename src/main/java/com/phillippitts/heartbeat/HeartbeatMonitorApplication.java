package com.phillippitts.heartbeat;

import com.phillippitts.heartbeat.config.notifier.WebhookNotifierProperties;
import com.phillippitts.heartbeat.config.properties.HeartbeatProperties;
import com.phillippitts.heartbeat.config.storage.FileStorageProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        HeartbeatProperties.class,
        WebhookNotifierProperties.class,
        FileStorageProperties.class
})
public class HeartbeatMonitorApplication {

    public static void main(String[] args) {
        SpringApplication.run(HeartbeatMonitorApplication.class, args);
    }

}
