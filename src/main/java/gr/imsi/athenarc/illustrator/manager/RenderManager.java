package gr.imsi.athenarc.illustrator.manager;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;

import gr.imsi.athenarc.illustrator.config.LayoutConfig;
import gr.imsi.athenarc.illustrator.config.Stylesheet;
import gr.imsi.athenarc.illustrator.constraint.ConstraintApplicator;
import gr.imsi.athenarc.illustrator.layout.GeometryTreeBuilder;
import gr.imsi.athenarc.illustrator.layout.LayoutEngine;
import gr.imsi.athenarc.illustrator.layout.LayoutNode;
import gr.imsi.athenarc.illustrator.layout.NodeIndex;
import gr.imsi.athenarc.illustrator.lint.Diagnostic;
import gr.imsi.athenarc.illustrator.lint.Validator;
import gr.imsi.athenarc.illustrator.model.ContainsSpec;
import gr.imsi.athenarc.illustrator.model.Diagram;
import gr.imsi.athenarc.illustrator.routing.ConnectionRouter;
import gr.imsi.athenarc.illustrator.routing.Route;
import gr.imsi.athenarc.illustrator.scene.Scene;
import gr.imsi.athenarc.illustrator.scene.SceneAssembler;

/**
 * Entry point of the engine. Runs build, layout, constrain, route, assemble and, on
 * request, validate, each phase to completion before the next. Holds no state between
 * calls, so one manager can serve concurrent renders.
 */
public class RenderManager {
    private static final Logger LOG = LoggerFactory.getLogger(RenderManager.class);

    private final LayoutConfig config;
    private final ConstraintApplicator constraintApplicator;
    private final ConnectionRouter router;
    private final SceneAssembler assembler;
    private final Validator validator;

    // Private constructor used by builder
    private RenderManager(LayoutConfig config, ConnectionRouter router) {
        this.config = config;
        this.constraintApplicator = new ConstraintApplicator();
        this.router = router;
        this.assembler = new SceneAssembler(config);
        this.validator = new Validator(config);
    }

    /**
     * Render a diagram.
     *
     * @param diagram the diagram to render
     * @param stylesheet lookup for symbolic colors
     * @return the finished scene
     * @throws gr.imsi.athenarc.illustrator.error.DiagramException if any phase fails; no scene is produced
     */
    public Scene render(Diagram diagram, Stylesheet stylesheet) {
        LOG.info("Rendering {}", diagram);
        return run(diagram, stylesheet).scene;
    }

    /**
     * Render a diagram and check the result for geometric defects.
     *
     * @param diagram the diagram to render
     * @param stylesheet lookup for symbolic colors
     * @return the scene with its diagnostics
     * @throws gr.imsi.athenarc.illustrator.error.DiagramException if any phase fails
     */
    public RenderResult validate(Diagram diagram, Stylesheet stylesheet) {
        LOG.info("Validating {}", diagram);
        Rendering rendering = run(diagram, stylesheet);
        ImmutableList<Diagnostic> diagnostics = validator.validate(
                rendering.index, diagram.getContainments(), rendering.routes, rendering.scene);
        LOG.info("Validation reported {} diagnostics", diagnostics.size());
        return new RenderResult(rendering.scene, diagnostics);
    }

    private Rendering run(Diagram diagram, Stylesheet stylesheet) {
        Stopwatch stopwatch = Stopwatch.createStarted();

        LayoutNode root = new GeometryTreeBuilder(config).build(diagram.getRoot());
        NodeIndex index = NodeIndex.of(root);
        checkContainments(index, diagram.getContainments());

        new LayoutEngine(config).arrange(root);
        constraintApplicator.apply(index, diagram.getConstraints());
        List<Route> routes = router.route(index, diagram.getConnections());
        Scene scene = assembler.assemble(index, routes, stylesheet);

        LOG.info("Rendered {} nodes, {} connections, {} constraints in {}",
                index.size(), routes.size(), diagram.getConstraints().size(), stopwatch.stop());
        return new Rendering(index, routes, scene);
    }

    private static void checkContainments(NodeIndex index, List<ContainsSpec> containments) {
        for (ContainsSpec contains : containments) {
            index.resolve(contains.getContainerId(), "contains declaration");
            for (String member : contains.getMemberIds()) {
                index.resolve(member, "contains declaration");
            }
        }
    }

    public LayoutConfig getConfig() {
        return config;
    }

    /**
     * Creates a new builder for RenderManager
     * @return A new builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a new RenderManager with default settings
     * @return A new RenderManager instance
     */
    public static RenderManager createDefault() {
        return builder().build();
    }

    /**
     * Builder class for RenderManager that allows configuring specific components
     */
    public static class Builder {
        private LayoutConfig config;
        private ConnectionRouter router;

        private Builder() {
        }

        public Builder withLayoutConfig(LayoutConfig config) {
            this.config = config;
            return this;
        }

        public Builder withRouter(ConnectionRouter router) {
            this.router = router;
            return this;
        }

        public RenderManager build() {
            if (config == null) {
                config = LayoutConfig.defaults();
            }
            if (router == null) {
                router = new ConnectionRouter(config);
            }
            return new RenderManager(config, router);
        }
    }

    private static final class Rendering {
        private final NodeIndex index;
        private final List<Route> routes;
        private final Scene scene;

        Rendering(NodeIndex index, List<Route> routes, Scene scene) {
            this.index = index;
            this.routes = routes;
            this.scene = scene;
        }
    }
}
