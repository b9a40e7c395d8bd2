package com.vedant.dataquery;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
public class DataQueryApplication {

    public static void main(String[] args) {
        SpringApplication.run(DataQueryApplication.class, args);
    }
}
