package com.phillippitts.kioskwatch;

import com.phillippitts.kioskwatch.config.properties.DeviceProperties;
import com.phillippitts.kioskwatch.config.properties.MonitorProperties;
import com.phillippitts.kioskwatch.config.properties.RemediationProperties;
import com.phillippitts.kioskwatch.config.properties.UiMonitoringProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        MonitorProperties.class,
        DeviceProperties.class,
        UiMonitoringProperties.class,
        RemediationProperties.class
})
@EnableScheduling
public class KioskWatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(KioskWatchApplication.class, args);
    }

}
