package org.cloudfiles.storage;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CloudFilesApplication {

    public static void main(String[] args) {
        SpringApplication.run(CloudFilesApplication.class, args);
    }
}
