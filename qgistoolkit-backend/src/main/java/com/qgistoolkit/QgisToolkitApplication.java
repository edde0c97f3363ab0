package com.qgistoolkit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class QgisToolkitApplication {

    public static void main(String[] args) {
        SpringApplication.run(QgisToolkitApplication.class, args);
    }
}
