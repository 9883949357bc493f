package dk.cloudcreate.essentials.micro.kernel;

import java.util.*;

/**
 * The steps a command passes through when dispatched by the {@link CommandDispatcher}, in order.<br>
 * The {@link #stepName()} is the name reported by {@link dk.cloudcreate.essentials.micro.kernel.pipeline.Result#failedStep()}
 * when a dispatch fails
 */
public enum DispatchStage {
    RESOLVE_DEFINITION("resolve-definition"),
    LOAD_STATE("load-state"),
    RECONSTITUTE_STATE("reconstitute-state"),
    HANDLE_COMMAND("handle-command"),
    PERSIST_EVENTS("persist-events");

    private final String stepName;

    DispatchStage(String stepName) {
        this.stepName = stepName;
    }

    public String stepName() {
        return stepName;
    }

    public static Optional<DispatchStage> fromStepName(String stepName) {
        return Arrays.stream(values())
                     .filter(stage -> stage.stepName.equals(stepName))
                     .findFirst();
    }
}
