package fr.lapetina.inferencebench.dispatch;

/**
 * Decides whether a raw response document counts as a success.
 */
@FunctionalInterface
public interface SuccessClassifier {

    /** Accepts every payload. */
    SuccessClassifier ALWAYS = (job, payload) -> true;

    boolean isSuccess(Job job, String payload);
}
