package dk.cloudcreate.essentials.micro.kernel.pipeline;

import org.slf4j.*;

import java.util.*;
import java.util.function.Function;

import static dk.cloudcreate.essentials.shared.FailFast.*;

/**
 * Composes a fixed sequence of named steps, where the output of one step is the input of the next.<br>
 * The value flowing between the steps is threaded as a {@link Result}: the first step that fails
 * (either by throwing an {@link Exception} or a non fatal {@link Error}, or by returning a {@link Result.Failure}) stops the pipeline
 * and the remaining steps are never called. {@link #apply(Object)} only rethrows a {@link VirtualMachineError} - any other failure is returned
 * as a {@link Result.Failure} carrying the error and the name of the failed step.
 * <pre>{@code
 * var pipeline = Pipeline.<String, Integer>startWith("parse", Integer::parseInt)
 *                        .then("double", number -> number * 2);
 * Result<Integer> result = pipeline.apply("21"); // Success{42}
 * }</pre>
 *
 * @param <IN>  the type of the pipeline input
 * @param <OUT> the type of the pipeline output
 */
public final class Pipeline<IN, OUT> implements Function<IN, Result<OUT>> {
    private static final Logger log = LoggerFactory.getLogger(Pipeline.class);

    private final List<Step> steps;

    private Pipeline(List<Step> steps) {
        this.steps = steps;
    }

    /**
     * Start a pipeline with a step that returns a plain value
     *
     * @param stepName the name of the step
     * @param function the step function
     */
    public static <IN, OUT> Pipeline<IN, OUT> startWith(String stepName, Function<? super IN, ? extends OUT> function) {
        return new Pipeline<IN, IN>(List.of()).then(stepName, function);
    }

    /**
     * Start a pipeline with a step that returns a {@link Result}
     *
     * @param stepName the name of the step
     * @param function the step function
     */
    public static <IN, OUT> Pipeline<IN, OUT> startWithResult(String stepName, Function<? super IN, Result<OUT>> function) {
        return new Pipeline<IN, IN>(List.of()).thenResult(stepName, function);
    }

    /**
     * Compose untyped functions into a pipeline. The steps are named <code>step-1</code>, <code>step-2</code>, ...
     *
     * @param functions the functions, in the order they're applied
     */
    public static Pipeline<Object, Object> compose(List<? extends Function<Object, Object>> functions) {
        requireNonNull(functions, "No functions provided");
        requireTrue(!functions.isEmpty(), "A pipeline requires at least one function");
        Pipeline<Object, Object> pipeline = new Pipeline<>(List.of());
        for (var index = 0; index < functions.size(); index++) {
            pipeline = pipeline.then("step-" + (index + 1), functions.get(index));
        }
        return pipeline;
    }

    /**
     * Add a step that returns a plain value
     *
     * @param stepName the name of the step
     * @param function the step function
     * @param <NEXT>   the output type of the new step
     * @return a new pipeline - this pipeline is left untouched
     */
    public <NEXT> Pipeline<IN, NEXT> then(String stepName, Function<? super OUT, ? extends NEXT> function) {
        requireNonNull(function, "No function provided");
        return thenResult(stepName, value -> Result.success(function.apply(value)));
    }

    /**
     * Add a step that returns a {@link Result}
     *
     * @param stepName the name of the step
     * @param function the step function
     * @param <NEXT>   the output type of the new step
     * @return a new pipeline - this pipeline is left untouched
     */
    @SuppressWarnings("unchecked")
    public <NEXT> Pipeline<IN, NEXT> thenResult(String stepName, Function<? super OUT, Result<NEXT>> function) {
        requireNonNull(stepName, "No stepName provided");
        requireTrue(!stepName.isBlank(), "stepName must not be blank");
        requireNonNull(function, "No function provided");
        var newSteps = new ArrayList<>(steps);
        newSteps.add(new Step(stepName, value -> (Result<Object>) (Result<?>) function.apply((OUT) value)));
        return new Pipeline<>(List.copyOf(newSteps));
    }

    /**
     * @return the step names in the order they're applied
     */
    public List<String> stepNames() {
        var stepNames = new ArrayList<String>(steps.size());
        steps.forEach(step -> stepNames.add(step.name));
        return stepNames;
    }

    @SuppressWarnings("unchecked")
    @Override
    public Result<OUT> apply(IN input) {
        Object value = input;
        for (var index = 0; index < steps.size(); index++) {
            var step = steps.get(index);
            Result<Object> result;
            try {
                result = step.function.apply(value);
                if (result == null) {
                    result = Result.failure(new IllegalStateException("Step returned a null Result"));
                }
            } catch (Throwable e) {
                result = Result.capture(e);
            }
            if (result.isFailure()) {
                if (log.isDebugEnabled()) {
                    log.debug("Step '{}' failed with {}. Skipping {} remaining step(s)",
                              step.name,
                              result.error().getClass().getSimpleName(),
                              steps.size() - index - 1);
                }
                return Result.failure(result.error(), step.name);
            }
            value = result.get();
        }
        return Result.success((OUT) value);
    }

    private static final class Step {
        private final String                           name;
        private final Function<Object, Result<Object>> function;

        private Step(String name, Function<Object, Result<Object>> function) {
            this.name = name;
            this.function = function;
        }
    }
}
