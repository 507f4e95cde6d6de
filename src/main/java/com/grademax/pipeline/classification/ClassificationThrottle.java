package com.grademax.pipeline.classification;

import com.grademax.pipeline.classification.ClassificationModels.ClassificationItem;
import com.grademax.pipeline.classification.ClassificationModels.ExternalClassification;
import com.grademax.pipeline.config.SubjectProfile;
import com.grademax.pipeline.exception.ClassificationServiceError;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

public class ClassificationThrottle {
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final ClassificationClient client;
    private final Duration minDelay;
    private final Clock clock;
    private final Sleeper sleeper;
    private Instant lastCallAt;

    public ClassificationThrottle(ClassificationClient client, Duration minDelay, Clock clock, Sleeper sleeper) {
        this.client = client;
        this.minDelay = minDelay == null ? Duration.ZERO : minDelay;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public boolean hasClient() {
        return client != null;
    }

    public synchronized List<ExternalClassification> call(SubjectProfile subject, List<ClassificationItem> items) {
        if (client == null) throw new ClassificationServiceError("No external classification client configured");
        awaitSlot();
        try {
            List<ExternalClassification> result = client.classifyBatch(subject, items);
            return result == null ? List.of() : result;
        } finally {
            lastCallAt = clock.instant();
        }
    }

    private void awaitSlot() {
        if (lastCallAt == null) return;
        Duration remaining = minDelay.minus(Duration.between(lastCallAt, clock.instant()));
        if (remaining.isNegative() || remaining.isZero()) return;
        try {
            sleeper.sleep(remaining);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new Interrupted(e);
        }
    }

    static final class Interrupted extends ClassificationServiceError {
        Interrupted(InterruptedException cause) {
            super("Interrupted while waiting for the rate limit", cause);
        }
    }
}
