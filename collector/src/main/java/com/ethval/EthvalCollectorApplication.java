package com.ethval;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Batch entry point: runs one collection (or the gas price backfill) and exits with the run's exit code.
 */
@SpringBootApplication
public class EthvalCollectorApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(EthvalCollectorApplication.class, args)));
    }
}
