package com.github.stormino.medialib;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.retry.annotation.EnableRetry;

@EnableRetry
@SpringBootApplication
public class MediaLibraryApplication {

    public static void main(String[] args) {
        SpringApplication.run(MediaLibraryApplication.class, args);
    }
}
