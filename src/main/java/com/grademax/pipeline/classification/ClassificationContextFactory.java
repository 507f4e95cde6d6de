package com.grademax.pipeline.classification;

import com.grademax.pipeline.config.PipelineProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Component
public class ClassificationContextFactory {
    private static final Logger log = LoggerFactory.getLogger(ClassificationContextFactory.class);

    private final ClassificationThrottle throttle;

    public ClassificationContextFactory(ObjectProvider<ClassificationClient> client, PipelineProperties properties) {
        ClassificationClient available = client.getIfAvailable();
        this.throttle = new ClassificationThrottle(available, properties.classification().rateLimitDelay(), Clock.systemUTC(),
                d -> Thread.sleep(d.toMillis()));
        log.info("External classification {}", available == null ? "disabled" : "enabled");
    }

    public ClassificationContext create() {
        return new ClassificationContext(throttle);
    }
}
