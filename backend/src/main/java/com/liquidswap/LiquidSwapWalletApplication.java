package com.liquidswap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LiquidSwapWalletApplication {

    public static void main(String[] args) {
        SpringApplication.run(LiquidSwapWalletApplication.class, args);
    }
}
