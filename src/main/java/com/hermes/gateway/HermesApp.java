package com.hermes.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

// the DataSource is built by HermesWiring only when the postgres store is selected
@SpringBootApplication(scanBasePackages = "com.hermes", exclude = DataSourceAutoConfiguration.class)
public class HermesApp {

    public static void main(String[] args) {
        SpringApplication.run(HermesApp.class, args);
    }
}
