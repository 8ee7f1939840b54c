package com.mike.reportpopulator;

import com.mike.reportpopulator.config.ImapProperties;
import com.mike.reportpopulator.config.InboxMonitorProperties;
import com.mike.reportpopulator.config.ReportPopulatorProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
@EnableConfigurationProperties({ReportPopulatorProperties.class, ImapProperties.class, InboxMonitorProperties.class})
public class ReportPopulatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReportPopulatorApplication.class, args);
    }

}
