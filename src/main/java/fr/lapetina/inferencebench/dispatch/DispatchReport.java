package fr.lapetina.inferencebench.dispatch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Results of a dispatch run, accumulated per job identity in first-seen order.
 */
public final class DispatchReport {

    private final Map<String, JobSummary> summaries;
    private final List<JobResult> results;

    private DispatchReport(Map<String, JobSummary> summaries, List<JobResult> results) {
        this.summaries = Collections.unmodifiableMap(summaries);
        this.results = List.copyOf(results);
    }

    public Map<String, JobSummary> getSummaries() {
        return summaries;
    }

    public Optional<JobSummary> summary(String jobId) {
        return Optional.ofNullable(summaries.get(jobId));
    }

    /**
     * Every result, in the order the dispatcher collected them.
     */
    public List<JobResult> getResults() {
        return results;
    }

    public int totalAttempts() {
        return results.size();
    }

    public long totalSuccesses() {
        return results.stream().filter(JobResult::success).count();
    }

    /**
     * Outcome of one job identity across all batches and iterations.
     *
     * @param payloads raw payloads in collection order
     */
    public record JobSummary(String jobId, int successCount, int attempts, List<String> payloads) {

        public JobSummary {
            payloads = List.copyOf(payloads);
        }

        public double percentSuccess() {
            return attempts > 0 ? successCount * 100.0 / attempts : 0;
        }
    }

    static Accumulator accumulator() {
        return new Accumulator();
    }

    /**
     * Mutable builder used by the dispatcher thread only.
     */
    static final class Accumulator {
        private final Map<String, int[]> counts = new LinkedHashMap<>();
        private final Map<String, List<String>> payloads = new LinkedHashMap<>();
        private final List<JobResult> results = new ArrayList<>();

        void register(Job job) {
            counts.computeIfAbsent(job.id(), k -> new int[2]);
            payloads.computeIfAbsent(job.id(), k -> new ArrayList<>());
        }

        void add(JobResult result) {
            register(result.job());
            int[] count = counts.get(result.job().id());
            count[1]++;
            if (result.success()) {
                count[0]++;
            }
            payloads.get(result.job().id()).add(result.payload());
            results.add(result);
        }

        DispatchReport build() {
            Map<String, JobSummary> summaries = new LinkedHashMap<>();
            counts.forEach((id, count) ->
                    summaries.put(id, new JobSummary(id, count[0], count[1], payloads.get(id))));
            return new DispatchReport(summaries, results);
        }
    }
}
