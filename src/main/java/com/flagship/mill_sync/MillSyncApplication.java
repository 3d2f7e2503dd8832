package com.flagship.mill_sync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Device-side ledger and sync engine for the rice mill.
 *
 * Domain operations write to the embedded ledger and append mutation records
 * in one local transaction. The sync orchestrator drains those records to the
 * remote system of record whenever the device is online.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class MillSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(MillSyncApplication.class, args);
    }
}
