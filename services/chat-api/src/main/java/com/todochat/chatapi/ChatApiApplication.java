package com.todochat.chatapi;

import com.todochat.chatapi.config.DirectoryProperties;
import com.todochat.chatapi.config.PipelineProperties;
import com.todochat.chatapi.config.SecurityProperties;
import com.todochat.chatapi.config.ServiceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Todo Chat API service.
 *
 * <p>Every HTTP request passes through the shared request pipeline (correlation logging, security
 * headers, metrics, error translation, rate limiting) before it reaches Spring MVC. Protected
 * endpoints authenticate with a bearer token and only serve resources owned by the caller.
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties({
        ServiceProperties.class,
        PipelineProperties.class,
        SecurityProperties.class,
        DirectoryProperties.class
})
public class ChatApiApplication {

    private static final Logger log = LoggerFactory.getLogger(ChatApiApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(ChatApiApplication.class, args);
        log.info("Todo Chat API started successfully");
    }
}
