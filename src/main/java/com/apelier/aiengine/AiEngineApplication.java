package com.apelier.aiengine;

import com.apelier.aiengine.common.config.AnalysisProperties;
import com.apelier.aiengine.common.config.GpuProperties;
import com.apelier.aiengine.common.config.PipelineProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({PipelineProperties.class, AnalysisProperties.class, GpuProperties.class})
public class AiEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(AiEngineApplication.class, args);
    }
}
