package com.chambua.inventory;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChambuaInventoryApplication {
    public static void main(String[] args) {
        SpringApplication.run(ChambuaInventoryApplication.class, args);
    }
}
