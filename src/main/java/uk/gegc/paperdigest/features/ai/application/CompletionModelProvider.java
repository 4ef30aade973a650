package uk.gegc.paperdigest.features.ai.application;

import uk.gegc.paperdigest.features.ai.domain.model.TaskType;

@FunctionalInterface
public interface CompletionModelProvider {

    CompletionModel forTask(TaskType taskType);
}
