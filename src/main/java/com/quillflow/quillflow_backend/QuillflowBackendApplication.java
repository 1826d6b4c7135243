package com.quillflow.quillflow_backend;

import com.quillflow.quillflow_backend.config.PipelineProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(PipelineProperties.class)
public class QuillflowBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(QuillflowBackendApplication.class, args);
    }
}
