package com.tabledesigner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TableDesignerApplication {

    public static void main(String[] args) {
        SpringApplication.run(TableDesignerApplication.class, args);
    }
}
