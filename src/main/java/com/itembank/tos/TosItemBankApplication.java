package com.itembank.tos;

import com.itembank.tos.config.ItemBankProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ItemBankProperties.class)
public class TosItemBankApplication {

    public static void main(String[] args) {
        SpringApplication.run(TosItemBankApplication.class, args);
    }
}
