package com.spreadsheet.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SpreadsheetEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(SpreadsheetEngineApplication.class, args);
    }
}
