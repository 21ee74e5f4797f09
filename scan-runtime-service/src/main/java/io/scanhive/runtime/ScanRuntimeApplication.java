package io.scanhive.runtime;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ScanRuntimeApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScanRuntimeApplication.class, args);
    }
}
