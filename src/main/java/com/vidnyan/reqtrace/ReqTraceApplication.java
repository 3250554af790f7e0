package com.vidnyan.reqtrace;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * ReqTrace - requirements coverage index.
 *
 * Maps spec rules to annotated source code and back, and serves the result
 * over HTTP and as a CLI report.
 */
@SpringBootApplication
public class ReqTraceApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReqTraceApplication.class, args);
    }
}
