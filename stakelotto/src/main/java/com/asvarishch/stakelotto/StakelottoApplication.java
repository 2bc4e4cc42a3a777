package com.asvarishch.stakelotto;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StakelottoApplication {

    public static void main(String[] args) {
        SpringApplication.run(StakelottoApplication.class, args);
    }
}
