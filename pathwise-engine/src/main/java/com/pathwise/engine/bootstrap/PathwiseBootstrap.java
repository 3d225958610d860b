package com.pathwise.engine.bootstrap;

import com.pathwise.collaborator.DomainClassifier;
import com.pathwise.collaborator.EscalationSink;
import com.pathwise.collaborator.PlanAccessPolicy;
import com.pathwise.config.PathwiseConfig;
import com.pathwise.engine.EngineLimits;
import com.pathwise.engine.GraphTraversalEngine;
import com.pathwise.engine.WorkflowTurnDriver;
import com.pathwise.planlibrary.config.PlanLibrary;
import com.pathwise.planlibrary.load.PlanLibraryContext;
import com.pathwise.planlibrary.load.PlanLibraryLoader;
import com.pathwise.planlibrary.load.PlanLibrarySource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Wires the workflow engine: loads the plan library once into {@link PlanLibraryContext}
 * (source → {@code <dir>/<file>} → bundled resource) and returns a ready {@link WorkflowTurnDriver}.
 */
public final class PathwiseBootstrap {

    private static final Logger log = LoggerFactory.getLogger(PathwiseBootstrap.class);

    private PathwiseBootstrap() {
    }

    /** Initializes from environment configuration with no external library source. */
    public static WorkflowTurnDriver initialize() {
        return initialize(PathwiseConfig.fromEnvironment());
    }

    public static WorkflowTurnDriver initialize(PathwiseConfig config) {
        return initialize(config, PlanLibrarySource.NONE);
    }

    public static WorkflowTurnDriver initialize(PathwiseConfig config, PlanLibrarySource source) {
        return initialize(config, source, DomainClassifier.UNKNOWN, PlanAccessPolicy.UNRESTRICTED,
                EscalationSink.DISCARD);
    }

    /**
     * Loads the plan library (cached for the process lifetime) and builds the driver.
     *
     * @param config           engine and library settings
     * @param source           external library source tried before the file system
     * @param domainClassifier supplies the conversation domain
     * @param accessPolicy     optional plan allow-list
     * @param escalationSink   receives escalation signals
     */
    public static WorkflowTurnDriver initialize(PathwiseConfig config, PlanLibrarySource source,
                                                DomainClassifier domainClassifier,
                                                PlanAccessPolicy accessPolicy,
                                                EscalationSink escalationSink) {
        Path configDir = Path.of(config.getPlanLibraryDir());
        log.info("Bootstrap: loading plan library | source={} | configDir={} | file={}",
                source.describe(), configDir.toAbsolutePath(), config.getPlanLibraryFile());
        PlanLibrary library = PlanLibraryContext.getOrLoad(
                new PlanLibraryLoader(source, configDir, config.getPlanLibraryFile()));
        EngineLimits limits = new EngineLimits(config.getMaxRouteDepth(), config.getEventLogCapacity());
        GraphTraversalEngine engine = new GraphTraversalEngine(limits, config.getDefaultPaceLevel());
        log.info("Bootstrap: workflow engine ready | plans={} | maxRouteDepth={} | eventLogCapacity={}",
                library.getPlans().size(), limits.getMaxRouteDepth(), limits.getEventLogCapacity());
        return new WorkflowTurnDriver(PlanLibraryContext::get, domainClassifier, accessPolicy,
                escalationSink, engine);
    }
}
