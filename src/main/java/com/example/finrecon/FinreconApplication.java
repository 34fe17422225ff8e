package com.example.finrecon;

import com.example.finrecon.config.IngestProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(IngestProperties.class)
public class FinreconApplication {

    public static void main(String[] args) {
        SpringApplication.run(FinreconApplication.class, args);
    }

}
