package com.vendorcatalog;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VendorCatalogApplication {

    public static void main(String[] args) {
        SpringApplication.run(VendorCatalogApplication.class, args);
    }
}
