package com.catalogcache;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CatalogCacheApplication {

    public static void main(String[] args) {
        SpringApplication.run(CatalogCacheApplication.class, args);
    }
}
