package com.grademax.pipeline.classification;

import com.grademax.pipeline.classification.ClassificationModels.ClassificationItem;
import com.grademax.pipeline.classification.ClassificationModels.ExternalClassification;
import com.grademax.pipeline.config.SubjectProfile;
import com.grademax.pipeline.exception.ClassificationServiceError;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

public class ClassificationContext {
    private final ClassificationThrottle throttle;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public ClassificationContext(ClassificationThrottle throttle) {
        this.throttle = throttle;
    }

    public ClassificationContext(ClassificationClient client, Duration minDelay, Clock clock, ClassificationThrottle.Sleeper sleeper) {
        this(new ClassificationThrottle(client, minDelay, clock, sleeper));
    }

    public static ClassificationContext offline() {
        return new ClassificationContext(null, Duration.ZERO, Clock.systemUTC(), d -> {});
    }

    public boolean externalAvailable() {
        return throttle.hasClient() && !cancelled.get();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public List<ExternalClassification> call(SubjectProfile subject, List<ClassificationItem> items) {
        if (cancelled.get()) throw new ClassificationServiceError("Classification cancelled");
        try {
            return throttle.call(subject, items);
        } catch (ClassificationThrottle.Interrupted e) {
            cancel();
            throw e;
        }
    }
}
