package com.example.mcpinvoke;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class McpInvokeApplication {

    public static void main(String[] args) {
        SpringApplication.run(McpInvokeApplication.class, args);
    }
}
