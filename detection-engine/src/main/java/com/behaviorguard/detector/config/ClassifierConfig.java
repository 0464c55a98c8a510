package com.behaviorguard.detector.config;

import com.behaviorguard.detector.classifier.ModelLoadException;
import com.behaviorguard.detector.classifier.OnnxModelPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;

/**
 * Loads the trained ONNX model once at startup.
 *
 * <p>
 * A missing or malformed model fails context startup. The session is released
 * when the context closes.
 * </p>
 */
@Configuration
public class ClassifierConfig {

    private static final Logger log = LoggerFactory.getLogger(ClassifierConfig.class);

    @Bean(destroyMethod = "close")
    public OnnxModelPipeline modelPipeline(
            @Value("${behaviorguard.classifier.model-path:classpath:models/behavior-model.onnx}") String modelPath,
            ResourceLoader resourceLoader) {
        Resource resource = resourceLoader.getResource(modelPath);
        if (!resource.exists()) {
            throw new ModelLoadException("Model artifact not found: " + modelPath);
        }
        byte[] model;
        try (InputStream in = resource.getInputStream()) {
            model = in.readAllBytes();
        } catch (IOException e) {
            throw new ModelLoadException("Failed to read model artifact " + modelPath, e);
        }
        OnnxModelPipeline pipeline = OnnxModelPipeline.load(model);
        log.info("Loaded model artifact {} ({} bytes, classes {})", modelPath, model.length, pipeline.classes());
        return pipeline;
    }
}
