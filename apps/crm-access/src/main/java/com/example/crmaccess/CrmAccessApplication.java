package com.example.crmaccess;

import com.example.crmaccess.config.AccessProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(AccessProperties.class)
public class CrmAccessApplication {

    public static void main(String[] args) {
        SpringApplication.run(CrmAccessApplication.class, args);
    }

}
