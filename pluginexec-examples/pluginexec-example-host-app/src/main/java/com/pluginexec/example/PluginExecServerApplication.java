package com.pluginexec.example;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PluginExecServerApplication {
    public static void main(String[] args) {
        SpringApplication.run(PluginExecServerApplication.class, args);
    }
}
