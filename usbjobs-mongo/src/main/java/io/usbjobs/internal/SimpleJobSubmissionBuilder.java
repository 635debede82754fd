package io.usbjobs.internal;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.usbjobs.JobSubmissionBuilder;
import io.usbjobs.core.JobSubmission;

import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.ToLongFunction;

/**
 * Default {@link JobSubmissionBuilder} implementation used by the Mongo-backed pipeline.
 */
public class SimpleJobSubmissionBuilder implements JobSubmissionBuilder {

    private final String orderRef;
    private final ObjectMapper objectMapper;
    private final ToLongFunction<JobSubmission> persister;

    private String capacity;
    private Map<String, Object> preferences;
    private String contentPlanId;
    private String volumeLabel;
    private String assignedDeviceId;
    private String jobToken;

    public SimpleJobSubmissionBuilder(String orderRef, ObjectMapper objectMapper,
                                      ToLongFunction<JobSubmission> persister) {
        Objects.requireNonNull(orderRef, "orderRef must not be null");
        if (orderRef.isBlank()) throw new IllegalArgumentException("orderRef must not be blank");

        this.orderRef = orderRef;
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.persister = Objects.requireNonNull(persister, "persister must not be null");
    }

    @Override
    public JobSubmissionBuilder capacity(String capacity) {
        Objects.requireNonNull(capacity, "capacity must not be null");
        if (capacity.isBlank()) throw new IllegalArgumentException("capacity must not be blank");

        this.capacity = capacity;
        return this;
    }

    @Override
    public JobSubmissionBuilder preferences(Object preferences) {
        if (preferences == null) {
            this.preferences = null;
            return this;
        }
        this.preferences = objectMapper.convertValue(preferences, new TypeReference<>() {
        });
        return this;
    }

    @Override
    public JobSubmissionBuilder contentPlan(String contentPlanId) {
        this.contentPlanId = contentPlanId;
        return this;
    }

    @Override
    public JobSubmissionBuilder volumeLabel(String volumeLabel) {
        this.volumeLabel = volumeLabel;
        return this;
    }

    @Override
    public JobSubmissionBuilder assignedDevice(String deviceId) {
        this.assignedDeviceId = deviceId;
        return this;
    }

    @Override
    public JobSubmissionBuilder jobToken(String jobToken) {
        Objects.requireNonNull(jobToken, "jobToken must not be null");
        if (jobToken.isBlank()) throw new IllegalArgumentException("jobToken must not be blank");

        this.jobToken = jobToken;
        return this;
    }

    @Override
    public JobSubmission build() {
        if (capacity == null) {
            throw new IllegalStateException("capacity is required");
        }
        String token = jobToken != null ? jobToken : newJobToken();
        return new JobSubmission(token, orderRef, capacity, preferences, contentPlanId, volumeLabel, assignedDeviceId);
    }

    @Override
    public long save() {
        return persister.applyAsLong(build());
    }

    static String newJobToken() {
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 9);
        return "job-" + System.currentTimeMillis() + "-" + suffix;
    }
}
