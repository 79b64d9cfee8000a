package ai.eigloo.workgraph.service.config;

import ai.eigloo.workgraph.engine.containment.ContainmentService;
import ai.eigloo.workgraph.engine.hierarchy.HierarchyService;
import ai.eigloo.workgraph.engine.pour.PourEngine;
import ai.eigloo.workgraph.engine.spi.DependencyPersistence;
import ai.eigloo.workgraph.engine.spi.ElementStore;
import ai.eigloo.workgraph.engine.spi.GraphEventPublisher;
import ai.eigloo.workgraph.engine.state.DerivedStateCalculator;
import ai.eigloo.workgraph.engine.store.DependencyGraphStore;
import ai.eigloo.workgraph.engine.store.IndexedDependencyGraphStore;
import ai.eigloo.workgraph.engine.workflow.WorkflowLifecycleService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the framework-free engine classes as Spring beans.
 */
@Configuration
public class EngineConfig {

    private static final Logger logger = LoggerFactory.getLogger(EngineConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public IndexedDependencyGraphStore dependencyGraphStore(ElementStore elementStore,
                                                            DependencyPersistence dependencyPersistence,
                                                            GraphEventPublisher graphEventPublisher,
                                                            Clock clock) {
        return new IndexedDependencyGraphStore(elementStore, dependencyPersistence, graphEventPublisher, clock);
    }

    @Bean
    public DerivedStateCalculator derivedStateCalculator(ElementStore elementStore,
                                                         DependencyGraphStore dependencyGraphStore,
                                                         GraphEventPublisher graphEventPublisher,
                                                         Clock clock,
                                                         WorkGraphProperties properties) {
        return new DerivedStateCalculator(elementStore, dependencyGraphStore, graphEventPublisher, clock,
                properties.getHierarchy().getMaxChainDepth());
    }

    @Bean
    public HierarchyService hierarchyService(ElementStore elementStore,
                                             DerivedStateCalculator derivedStateCalculator,
                                             GraphEventPublisher graphEventPublisher,
                                             Clock clock) {
        return new HierarchyService(elementStore, derivedStateCalculator, graphEventPublisher, clock);
    }

    @Bean
    public ContainmentService containmentService(ElementStore elementStore,
                                                 DependencyGraphStore dependencyGraphStore,
                                                 DerivedStateCalculator derivedStateCalculator,
                                                 GraphEventPublisher graphEventPublisher,
                                                 Clock clock) {
        return new ContainmentService(elementStore, dependencyGraphStore, derivedStateCalculator,
                graphEventPublisher, clock);
    }

    @Bean
    public PourEngine pourEngine(Clock clock) {
        return new PourEngine(clock);
    }

    @Bean
    public WorkflowLifecycleService workflowLifecycleService(ElementStore elementStore,
                                                             DependencyGraphStore dependencyGraphStore,
                                                             DerivedStateCalculator derivedStateCalculator,
                                                             GraphEventPublisher graphEventPublisher,
                                                             Clock clock) {
        return new WorkflowLifecycleService(elementStore, dependencyGraphStore, derivedStateCalculator,
                graphEventPublisher, clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "workgraph.index", name = "load-on-startup", havingValue = "true",
            matchIfMissing = true)
    public ApplicationRunner dependencyIndexLoader(DependencyGraphStore dependencyGraphStore) {
        return args -> {
            logger.info("Loading dependency index from storage");
            dependencyGraphStore.reload();
        };
    }
}
