package ai.eigloo.workgraph.engine.pour;

import ai.eigloo.workgraph.graph.exception.GraphValidationException;
import ai.eigloo.workgraph.graph.model.Dependency;
import ai.eigloo.workgraph.graph.model.DependencyType;
import ai.eigloo.workgraph.graph.model.ElementIds;
import ai.eigloo.workgraph.graph.model.ElementType;
import ai.eigloo.workgraph.graph.model.Task;
import ai.eigloo.workgraph.graph.model.TaskStatus;
import ai.eigloo.workgraph.graph.model.Workflow;
import ai.eigloo.workgraph.graph.model.WorkflowStatus;
import ai.eigloo.workgraph.graph.playbook.Playbook;
import ai.eigloo.workgraph.graph.playbook.PlaybookStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * Expands a playbook and variable bindings into a workflow, its tasks and their edges.
 *
 * <p>Stateless apart from the id source. Nothing is stored; the returned fragment goes
 * through the dependency graph store's normal checks when it is persisted.</p>
 */
public class PourEngine {

    private static final Logger logger = LoggerFactory.getLogger(PourEngine.class);

    private final Clock clock;
    private final Random random;

    public PourEngine(Clock clock) {
        this(clock, new SecureRandom());
    }

    public PourEngine(Clock clock, Random random) {
        this.clock = clock;
        this.random = random;
    }

    /**
     * Pours {@code playbook} with {@code variables}.
     *
     * @throws GraphValidationException when the playbook has no steps, variables do not
     *         validate, a condition or template is malformed, or every step is filtered out
     */
    public PourResult pour(Playbook playbook, Map<String, Object> variables, String createdBy, PourOptions options) {
        if (playbook == null) {
            throw new GraphValidationException("Playbook is required for pouring");
        }
        if (createdBy == null || createdBy.trim().isEmpty()) {
            throw new GraphValidationException("createdBy is required for pouring");
        }
        PourOptions pourOptions = options != null ? options : PourOptions.defaults();
        if (playbook.steps().isEmpty()) {
            throw new GraphValidationException("Playbook " + playbook.name() + " has no steps defined",
                    Map.of("playbook", playbook.name()));
        }

        Map<String, Object> resolved = VariableResolver.resolve(playbook.variables(), variables);

        List<PlaybookStep> included = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        for (PlaybookStep step : playbook.steps()) {
            if (ConditionEvaluator.evaluate(step.condition(), resolved)) {
                included.add(step);
            } else {
                logger.debug("Skipping step {} of {}: condition '{}' is false", step.id(), playbook.name(),
                        step.condition());
                skipped.add(step.id());
            }
        }
        if (included.isEmpty()) {
            throw new GraphValidationException("All steps of playbook " + playbook.name()
                    + " were filtered by conditions", Map.of("playbook", playbook.name(), "skippedSteps", skipped));
        }

        Instant now = Instant.now(clock);
        String workflowId = ElementIds.generate(ElementType.WORKFLOW, random);
        String title = pourOptions.title() != null
                ? pourOptions.title()
                : TemplateEvaluator.render(playbook.title(), resolved);
        if (title == null || title.trim().isEmpty()) {
            logger.debug("Workflow title for {} rendered empty, using playbook name", playbook.name());
            title = playbook.name();
        }
        Workflow workflow = new Workflow(workflowId, title, WorkflowStatus.PENDING, pourOptions.ephemeral(),
                playbook.id(), resolved, pourOptions.tags(), createdBy, now, now, null);

        List<CreatedTask> tasks = new ArrayList<>();
        Map<String, String> taskIdByStep = new LinkedHashMap<>();
        for (int i = 0; i < included.size(); i++) {
            PlaybookStep step = included.get(i);
            Task task = taskFromStep(step, resolved, ElementIds.childId(workflowId, i + 1), createdBy, now);
            tasks.add(new CreatedTask(task, step.id()));
            taskIdByStep.put(step.id(), task.id());
        }

        List<Dependency> blocks = new ArrayList<>();
        for (PlaybookStep step : included) {
            String dependentId = taskIdByStep.get(step.id());
            for (String blockerStep : step.dependsOn()) {
                String blockerId = taskIdByStep.get(blockerStep);
                if (blockerId == null) {
                    logger.debug("Dropping ordering {} -> {}: blocker step was skipped", blockerStep, step.id());
                    continue;
                }
                blocks.add(new Dependency(blockerId, dependentId, DependencyType.BLOCKS, Map.of(), createdBy, now));
            }
        }

        List<Dependency> parentChild = new ArrayList<>();
        for (CreatedTask created : tasks) {
            parentChild.add(new Dependency(created.task().id(), workflowId, DependencyType.PARENT_CHILD, Map.of(),
                    createdBy, now));
        }

        logger.info("Poured playbook {} into workflow {} ({} tasks, {} skipped)", playbook.name(), workflowId,
                tasks.size(), skipped.size());
        return new PourResult(workflow, tasks, blocks, parentChild, skipped, resolved);
    }

    /**
     * Runs every check {@link #pour} would, collecting problems instead of throwing.
     */
    public PourValidation validatePour(Playbook playbook, Map<String, Object> variables) {
        List<String> issues = new ArrayList<>();
        if (playbook == null) {
            return new PourValidation(false, List.of(), List.of(), Map.of(), List.of("Playbook is required"));
        }
        if (playbook.steps().isEmpty()) {
            issues.add("Playbook " + playbook.name() + " has no steps defined");
        }
        Map<String, Object> resolved = VariableResolver.resolve(playbook.variables(), variables, issues);

        List<String> included = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        for (PlaybookStep step : playbook.steps()) {
            try {
                if (ConditionEvaluator.evaluate(step.condition(), resolved)) {
                    included.add(step.id());
                    checkTemplates(step, issues);
                } else {
                    skipped.add(step.id());
                }
            } catch (GraphValidationException e) {
                issues.add("Step " + step.id() + ": " + e.getMessage());
            }
        }
        try {
            TemplateEvaluator.referencedVariables(playbook.title());
        } catch (GraphValidationException e) {
            issues.add("Playbook title: " + e.getMessage());
        }
        if (!playbook.steps().isEmpty() && included.isEmpty() && skipped.size() == playbook.steps().size()) {
            issues.add("All steps of playbook " + playbook.name() + " were filtered by conditions");
        }
        return new PourValidation(issues.isEmpty(), included, skipped, resolved, issues);
    }

    private static void checkTemplates(PlaybookStep step, List<String> issues) {
        Set<String> reported = new HashSet<>();
        for (String template : new String[] {step.title(), step.description(), step.assignee()}) {
            try {
                TemplateEvaluator.referencedVariables(template);
            } catch (GraphValidationException e) {
                if (reported.add(e.getMessage())) {
                    issues.add("Step " + step.id() + ": " + e.getMessage());
                }
            }
        }
    }

    private static Task taskFromStep(PlaybookStep step, Map<String, Object> resolved, String taskId,
                                     String createdBy, Instant now) {
        String assignee = TemplateEvaluator.render(step.assignee(), resolved);
        if (assignee != null && assignee.trim().isEmpty()) {
            assignee = null;
        }
        int priority = step.priority() != null ? step.priority() : Task.DEFAULT_PRIORITY;
        try {
            return new Task(taskId,
                    TemplateEvaluator.render(step.title(), resolved),
                    TemplateEvaluator.render(step.description(), resolved),
                    TaskStatus.OPEN,
                    priority,
                    assignee,
                    null,
                    step.tags(),
                    createdBy,
                    now,
                    now,
                    null);
        } catch (IllegalArgumentException e) {
            throw new GraphValidationException("Step " + step.id() + ": " + e.getMessage(),
                    Map.of("stepId", step.id()));
        }
    }
}
