package com.umitunal.leaseq.job;

import com.umitunal.leaseq.core.JobException;
import com.umitunal.leaseq.core.LeasedJob;
import com.umitunal.leaseq.core.QueueException;
import com.umitunal.leaseq.serialization.CodecRegistry;
import com.umitunal.leaseq.serialization.PayloadCodec;

import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Jobs by type. Built once at startup; two jobs with the same type are rejected.
 */
public class JobRegistry {

    private final Map<String, Job<?, ?>> jobsByType;

    public JobRegistry(List<Job<?, ?>> jobs) {
        this.jobsByType = jobs.stream()
                .collect(Collectors.toUnmodifiableMap(
                        Job::jobType,
                        Function.identity(),
                        (a, b) -> {
                            throw new IllegalStateException("Duplicate job type: " + a.jobType());
                        }
                ));
    }

    public static JobRegistry of(Job<?, ?>... jobs) {
        return new JobRegistry(Arrays.asList(jobs));
    }

    public Optional<Job<?, ?>> find(String jobType) {
        return Optional.ofNullable(jobsByType.get(jobType));
    }

    /**
     * @throws QueueException JOB_TYPE_NOT_REGISTERED for an unknown type
     */
    public Job<?, ?> getRequired(String jobType) throws QueueException {
        Job<?, ?> job = jobsByType.get(jobType);
        if (job == null) {
            throw QueueException.jobTypeNotRegistered(jobType);
        }
        return job;
    }

    public Set<String> jobTypes() {
        return jobsByType.keySet();
    }

    /**
     * Decode the payload with the codec named in the message, run the job and encode its result
     * with the same codec.
     *
     * @return Base64 of the encoded result, or null when the job returned nothing
     */
    public String dispatch(LeasedJob leased, CodecRegistry codecs, JobContext context)
            throws QueueException, JobException {
        Job<?, ?> job = getRequired(leased.getJobType());
        PayloadCodec codec = codecs.get(leased.getMessage().getCodec());
        return invoke(job, codec, leased, context);
    }

    private static <P, R> String invoke(Job<P, R> job, PayloadCodec codec, LeasedJob leased, JobContext context)
            throws QueueException, JobException {
        P payload = codec.decode(leased.getMessage().getPayload(), job.payloadType());
        R result = job.execute(payload, context);
        if (result == null) {
            return null;
        }
        return Base64.getEncoder().encodeToString(codec.encode(result));
    }

    /**
     * Decode a result reference produced by {@link #dispatch}.
     */
    public static <R> R decodeResult(String resultRef, PayloadCodec codec, Class<R> type) throws QueueException {
        if (resultRef == null) {
            return null;
        }
        return codec.decode(Base64.getDecoder().decode(resultRef), type);
    }
}
