package com.library.borrowing;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class LibraryBorrowingApplication {

    public static void main(String[] args) {
        SpringApplication.run(LibraryBorrowingApplication.class, args);
    }
}
