package com.phillippitts.commandrouter.service.workflow;

import com.phillippitts.commandrouter.domain.Classification;
import com.phillippitts.commandrouter.domain.ExecutionResult;
import com.phillippitts.commandrouter.domain.IntentCategory;
import com.phillippitts.commandrouter.domain.ParsedCommand;
import com.phillippitts.commandrouter.domain.WorkflowRequest;
import com.phillippitts.commandrouter.exception.EntityNotFoundException;
import com.phillippitts.commandrouter.exception.WorkflowAbortException;
import com.phillippitts.commandrouter.service.classifier.IntentClassifier;
import com.phillippitts.commandrouter.service.executor.ActionExecutor;
import com.phillippitts.commandrouter.service.executor.ExecutorRegistry;
import com.phillippitts.commandrouter.service.resolver.DirectoryRegistry;
import com.phillippitts.commandrouter.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Default {@link WorkflowCoordinator}.
 *
 * <p>Flow per request:
 * <ol>
 *   <li>pre-parsed steps are used as given; otherwise the utterance is checked for a pipeline
 *       and, failing that, classified as a single command</li>
 *   <li>entity slots of a step are resolved just before it runs, so a pipeline whose producer
 *       fails never touches the consumer's names</li>
 *   <li>a failed producer, or one that published no output, aborts the pipeline and its
 *       failure becomes the whole result; the consumer executor is not called</li>
 * </ol>
 */
@Service
public class DefaultWorkflowCoordinator implements WorkflowCoordinator {

    private static final Logger LOG = LogManager.getLogger(DefaultWorkflowCoordinator.class);

    static final String NO_EXECUTOR_MESSAGE = "I can't do that yet.";
    static final String UNEXPECTED_MESSAGE = "Sorry, something went wrong while processing your command.";

    private final IntentClassifier classifier;
    private final PipelineDetector pipelineDetector;
    private final SlotResolver slotResolver;
    private final ExecutorRegistry executors;
    private final ExecutorInvoker invoker;

    public DefaultWorkflowCoordinator(IntentClassifier classifier,
                                      PipelineDetector pipelineDetector,
                                      SlotResolver slotResolver,
                                      ExecutorRegistry executors,
                                      ExecutorInvoker invoker) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.pipelineDetector = Objects.requireNonNull(pipelineDetector, "pipelineDetector");
        this.slotResolver = Objects.requireNonNull(slotResolver, "slotResolver");
        this.executors = Objects.requireNonNull(executors, "executors");
        this.invoker = Objects.requireNonNull(invoker, "invoker");
    }

    @Override
    public List<ExecutionResult> run(WorkflowRequest request) {
        WorkflowTrace trace = new WorkflowTrace(request.correlationId());
        try {
            List<ExecutionResult> results = execute(request, trace);
            LOG.debug("Workflow finished: state={}, path={}", trace.state(), trace.history());
            return results;
        } catch (WorkflowAbortException e) {
            trace.failIfActive();
            LOG.info("Pipeline aborted: {}", e.getMessage());
            return List.of(e.getFailure());
        } catch (RuntimeException e) {
            trace.failIfActive();
            LOG.error("Workflow failed unexpectedly: text='{}'",
                    LogSanitizer.preview(request.utterance().text()), e);
            return List.of(ExecutionResult.failure(UNEXPECTED_MESSAGE, Map.of("error", "internal"),
                    "coordinator", IntentCategory.CONVERSATION));
        }
    }

    private List<ExecutionResult> execute(WorkflowRequest request, WorkflowTrace trace) {
        trace.transition(WorkflowState.CLASSIFYING);

        if (request.isPreParsed()) {
            List<ParsedCommand> steps = request.steps();
            if (steps.size() == 1) {
                return List.of(runSingle(steps.get(0), trace));
            }
            Optional<PipelineRule> rule = steps.size() == 2
                    ? PipelineRule.find(pipelineDetector.rules(), steps.get(0).intent(), steps.get(1).intent())
                    : Optional.empty();
            if (rule.isEmpty()) {
                trace.transition(WorkflowState.FAILED);
                return List.of(ExecutionResult.failure("I can't chain those steps together.",
                        Map.of("error", "unsupported_pipeline"), "coordinator", steps.get(0).intent()));
            }
            return runPipeline(new PipelinePlan(steps.get(0), steps.get(1), rule.get()), trace);
        }

        String text = request.utterance().text();
        Optional<PipelinePlan> plan = pipelineDetector.detect(text);
        if (plan.isPresent()) {
            return runPipeline(plan.get(), trace);
        }
        Classification classification = classifier.classify(request.utterance());
        LOG.info("Classified: intent={}, confidence={}, source={}",
                classification.intent().wireName(), classification.confidence(), classification.source());
        return List.of(runSingle(classification.toCommand(text), trace));
    }

    private ExecutionResult runSingle(ParsedCommand step, WorkflowTrace trace) {
        trace.transition(WorkflowState.SINGLE_DISPATCH);
        ExecutionResult result = dispatch(step);
        trace.transition(result.success() ? WorkflowState.COMPLETED : WorkflowState.FAILED);
        return result;
    }

    private List<ExecutionResult> runPipeline(PipelinePlan plan, WorkflowTrace trace) {
        PipelineRule rule = plan.rule();
        trace.transition(WorkflowState.PRODUCING_STEP);
        ExecutionResult produced = dispatch(plan.producer());
        if (!produced.success()) {
            throw new WorkflowAbortException("Producer " + rule.producer().wireName() + " failed", 0, produced);
        }
        Object output = produced.payload().get(rule.outputKey());
        if (output == null) {
            ExecutionResult missing = ExecutionResult.failure(
                    "I couldn't get anything to pass on. " + rule.producer().failureHint(),
                    Map.of("error", "missing_output", "expected", rule.outputKey()),
                    produced.executorName(), rule.producer());
            throw new WorkflowAbortException("Producer published no '" + rule.outputKey() + "'", 0, missing);
        }

        trace.transition(WorkflowState.CONSUMING_STEP);
        ParsedCommand consumer = plan.consumer().withSlot(rule.inputSlot(), String.valueOf(output));
        ExecutionResult consumed = dispatch(consumer);
        trace.transition(consumed.success() ? WorkflowState.COMPLETED : WorkflowState.FAILED);
        return List.of(produced, consumed);
    }

    private ExecutionResult dispatch(ParsedCommand step) {
        IntentCategory intent = step.intent();
        Optional<ActionExecutor> executor = executors.find(intent);
        if (executor.isEmpty()) {
            LOG.warn("No executor registered for intent {}", intent);
            return ExecutionResult.failure(NO_EXECUTOR_MESSAGE, Map.of("error", "no_executor"), "none", intent);
        }
        ParsedCommand resolved;
        try {
            resolved = slotResolver.resolve(step);
        } catch (EntityNotFoundException e) {
            LOG.info("Entity not found: directory={}, query='{}'", e.getDirectory(), LogSanitizer.preview(e.getQuery()));
            return ExecutionResult.failure(notFoundMessage(e) + " " + intent.failureHint(),
                    Map.of("error", "entity_not_found", "query", e.getQuery(), "directory", e.getDirectory()),
                    "resolver", intent);
        }
        return invoker.invoke(executor.get(), resolved);
    }

    private static String notFoundMessage(EntityNotFoundException e) {
        String where = switch (e.getDirectory()) {
            case DirectoryRegistry.CONTACTS -> "your contacts";
            case DirectoryRegistry.EMAILS -> "your email contacts";
            case DirectoryRegistry.APPLICATIONS -> "your apps";
            default -> e.getDirectory();
        };
        return "I couldn't find '" + e.getQuery() + "' in " + where + ".";
    }
}
