package fr.lapetina.inferencebench.dispatch;

import java.util.Objects;

/**
 * One unit of dispatch work: exercise a model.
 *
 * @param id    identity under which results accumulate across batches and iterations
 * @param model model the job runs against
 */
public record Job(String id, String model) {

    public Job {
        Objects.requireNonNull(model, "Model is required");
        if (id == null || id.isBlank()) {
            id = model;
        }
    }

    public static Job forModel(String model) {
        return new Job(model, model);
    }
}
